package io.retailassist.access.role;

import static io.retailassist.access.testutil.AccessTestSupport.jwtFor;
import static io.retailassist.access.testutil.AccessTestSupport.syncUser;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
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
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AccessControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void withoutToken_isUnauthorized() throws Exception {
    mockMvc.perform(get("/api/access/me")).andExpect(status().isUnauthorized());
  }

  @Test
  void userWithoutGrants_hasNoRole() throws Exception {
    UUID userId = syncUser(mockMvc, "user_me_plain", "me-plain@example.com");

    mockMvc
        .perform(get("/api/access/me").with(jwtFor("user_me_plain")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.userId").value(userId.toString()))
        .andExpect(jsonPath("$.role").doesNotExist());
  }

  @Test
  void firstRequestWithEmailClaim_createsUser() throws Exception {
    mockMvc
        .perform(
            get("/api/access/me")
                .with(
                    jwtFor("user_me_fresh")
                        .jwt(j -> j.subject("user_me_fresh").claim("email", "me-fresh@example.com"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.userId").exists());
  }

  @Test
  void unknownSubjectWithoutEmail_isUnauthorized() throws Exception {
    mockMvc
        .perform(get("/api/access/me").with(jwtFor("user_me_stranger")))
        .andExpect(status().isUnauthorized());
  }
}
