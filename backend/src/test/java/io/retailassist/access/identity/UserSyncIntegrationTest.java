package io.retailassist.access.identity;

import static io.retailassist.access.testutil.AccessTestSupport.API_KEY;
import static io.retailassist.access.testutil.AccessTestSupport.jwtFor;
import static io.retailassist.access.testutil.AccessTestSupport.provisionWorkspace;
import static io.retailassist.access.testutil.AccessTestSupport.syncUser;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.retailassist.access.TestcontainersConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class UserSyncIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void firstSyncCreates_secondSyncLinks() throws Exception {
    sync("user_sync_new", "sync-new@example.com", API_KEY)
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.externalAuthId").value("user_sync_new"))
        .andExpect(jsonPath("$.action").value("created"));

    sync("user_sync_new", "sync-new@example.com", API_KEY)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.action").value("linked"));
  }

  @Test
  void emailMatch_isNormalizedBeforeLookup() throws Exception {
    sync("user_sync_case", "sync-case@example.com", API_KEY).andExpect(status().isCreated());

    sync("user_sync_case", "Sync-Case@Example.COM", API_KEY)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.action").value("linked"));
  }

  @Test
  void emailLinkedToOtherSubject_isIdentityConflict() throws Exception {
    sync("user_sync_first", "sync-shared@example.com", API_KEY).andExpect(status().isCreated());

    sync("user_sync_second", "sync-shared@example.com", API_KEY)
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("IDENTITY_CONFLICT"));
  }

  @Test
  void wrongApiKey_isUnauthorized() throws Exception {
    sync("user_sync_bad_key", "sync-bad-key@example.com", "not-the-key")
        .andExpect(status().isUnauthorized());
  }

  @Test
  void deactivatedUser_losesRole() throws Exception {
    UUID userId = syncUser(mockMvc, "user_sync_leaver", "sync-leaver@example.com");
    provisionWorkspace(mockMvc, userId, "Leaver Store");
    mockMvc
        .perform(get("/api/access/me").with(jwtFor("user_sync_leaver")))
        .andExpect(jsonPath("$.role").value("admin"));

    mockMvc
        .perform(post("/internal/users/" + userId + "/deactivate").header("X-API-KEY", API_KEY))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/access/me").with(jwtFor("user_sync_leaver")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.role").doesNotExist());
  }

  @Test
  void promotedUser_resolvesAsSuperAdminWithoutWorkspace() throws Exception {
    UUID userId = syncUser(mockMvc, "user_sync_root", "sync-root@example.com");

    mockMvc
        .perform(post("/internal/users/" + userId + "/super-admin").header("X-API-KEY", API_KEY))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/access/me").with(jwtFor("user_sync_root")))
        .andExpect(jsonPath("$.role").value("super_admin"))
        .andExpect(jsonPath("$.workspaceId").doesNotExist());
  }

  private ResultActions sync(String subject, String email, String apiKey) throws Exception {
    return mockMvc.perform(
        post("/internal/users/sync")
            .header("X-API-KEY", apiKey)
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"externalAuthId": "%s", "email": "%s", "fullName": "Sync User"}
                """
                    .formatted(subject, email)));
  }
}
