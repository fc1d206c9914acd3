package io.retailassist.access.grant;

import static io.retailassist.access.testutil.AccessTestSupport.jwtFor;
import static io.retailassist.access.testutil.AccessTestSupport.onboardEmployee;
import static io.retailassist.access.testutil.AccessTestSupport.promoteToSuperAdmin;
import static io.retailassist.access.testutil.AccessTestSupport.provisionWorkspace;
import static io.retailassist.access.testutil.AccessTestSupport.syncUser;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.retailassist.access.TestcontainersConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class EmployeeControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private EmployeeAssignmentRepository employeeRepository;

  private final JwtRequestPostProcessor adminA = jwtFor("user_emp_admin_a");
  private final JwtRequestPostProcessor adminB = jwtFor("user_emp_admin_b");
  private final JwtRequestPostProcessor superAdmin = jwtFor("user_emp_super");
  private final JwtRequestPostProcessor cashier = jwtFor("user_emp_cashier");

  private UUID workspaceA;
  private UUID workspaceB;
  private UUID cashierAssignmentId;

  @BeforeAll
  void setUp() throws Exception {
    workspaceA =
        provisionWorkspace(
            mockMvc, syncUser(mockMvc, "user_emp_admin_a", "emp-admin-a@example.com"), "Store A");
    workspaceB =
        provisionWorkspace(
            mockMvc, syncUser(mockMvc, "user_emp_admin_b", "emp-admin-b@example.com"), "Store B");
    promoteToSuperAdmin(mockMvc, syncUser(mockMvc, "user_emp_super", "emp-super@example.com"));

    UUID cashierId =
        onboardEmployee(
            mockMvc, adminA, workspaceA, "user_emp_cashier", "emp-cashier@example.com");
    cashierAssignmentId = employeeRepository.findByUserId(cashierId).orElseThrow().getId();
  }

  @Test
  void admin_listsOwnWorkspaceEmployees() throws Exception {
    mockMvc
        .perform(get("/api/workspaces/" + workspaceA + "/employees").with(adminA))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.id == '%s')]".formatted(cashierAssignmentId)).exists());
  }

  @Test
  void admin_cannotListAnotherWorkspace() throws Exception {
    mockMvc
        .perform(get("/api/workspaces/" + workspaceA + "/employees").with(adminB))
        .andExpect(status().isForbidden());
  }

  @Test
  void admin_seesAnotherWorkspacesEmployeeAsNotFound() throws Exception {
    mockMvc
        .perform(
            get("/api/workspaces/" + workspaceA + "/employees/" + cashierAssignmentId)
                .with(adminB))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(
            get("/api/workspaces/" + workspaceB + "/employees/" + cashierAssignmentId)
                .with(adminB))
        .andExpect(status().isNotFound());
  }

  @Test
  void employee_cannotListEmployees() throws Exception {
    mockMvc
        .perform(get("/api/workspaces/" + workspaceA + "/employees").with(cashier))
        .andExpect(status().isForbidden());
  }

  @Test
  void superAdmin_readsAcrossWorkspaces() throws Exception {
    mockMvc
        .perform(
            get("/api/workspaces/" + workspaceA + "/employees/" + cashierAssignmentId)
                .with(superAdmin))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.workspaceId").value(workspaceA.toString()));
  }

  @Test
  void admin_updatesOwnEmployee() throws Exception {
    mockMvc
        .perform(
            put("/api/workspaces/" + workspaceA + "/employees/" + cashierAssignmentId)
                .with(adminA)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"phone": "+15550199"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.phone").value("+15550199"))
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void deactivatedEmployee_resolvesToNoRole() throws Exception {
    UUID stockerId =
        onboardEmployee(mockMvc, adminA, workspaceA, "user_emp_stocker", "emp-stocker@example.com");
    UUID assignmentId = employeeRepository.findByUserId(stockerId).orElseThrow().getId();

    mockMvc
        .perform(
            post("/api/workspaces/" + workspaceA + "/employees/" + assignmentId + "/deactivate")
                .with(adminA))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(false));

    mockMvc
        .perform(get("/api/access/me").with(jwtFor("user_emp_stocker")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.role").doesNotExist());
  }
}
