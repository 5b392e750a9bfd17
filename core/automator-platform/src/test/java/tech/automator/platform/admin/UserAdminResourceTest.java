package tech.automator.platform.admin;

import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.authentication.AuthenticationGuard;
import tech.automator.platform.authorization.AccessDeniedException;
import tech.automator.platform.principal.User;
import tech.automator.platform.principal.UserService;
import tech.automator.platform.principal.UserView;
import tech.automator.platform.shared.ErrorCode;
import tech.automator.platform.shared.ServiceResult;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the admin gate on UserAdminResource.
 */
@ExtendWith(MockitoExtension.class)
class UserAdminResourceTest {

    private static final String HEADER = "Bearer token";

    @Mock
    private AuthenticationGuard authenticationGuard;

    @Mock
    private UserService userService;

    @InjectMocks
    private UserAdminResource resource;

    @Test
    @DisplayName("getUser should deny a caller without the admin role before touching the service")
    void getUser_shouldDeny_whenCallerNotAdmin() {
        when(authenticationGuard.authenticate(HEADER)).thenReturn(principal(List.of("user")));

        assertThatThrownBy(() -> resource.getUser(HEADER, "u-1"))
            .isInstanceOf(AccessDeniedException.class);
        verifyNoInteractions(userService);
    }

    @Test
    @DisplayName("getUser should return 200 for a caller holding admin among other roles")
    void getUser_shouldSucceed_whenCallerIsAdmin() {
        User user = new User();
        user.id = "u-1";
        user.email = "jane@example.com";
        when(authenticationGuard.authenticate(HEADER)).thenReturn(principal(List.of("admin", "user")));
        when(userService.getUser("u-1")).thenReturn(ServiceResult.success(UserView.from(user)));

        Response response = resource.getUser(HEADER, "u-1");

        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("createUser should create with privileged fields enabled for an admin")
    void createUser_shouldPassPrivilegedFlag() {
        when(authenticationGuard.authenticate(HEADER)).thenReturn(principal(List.of("admin")));
        when(userService.createUser(null, true, "admin"))
            .thenReturn(ServiceResult.failure(ErrorCode.MISSING_REQUIRED_FIELDS));

        Response response = resource.createUser(HEADER, null);

        assertThat(response.getStatus()).isEqualTo(ErrorCode.MISSING_REQUIRED_FIELDS.status().getStatusCode());
        verify(userService).createUser(null, true, "admin");
    }

    @Test
    @DisplayName("Unit management should be open to admins and org admins of the same organization only")
    void manageUnits_shouldRequireAdminOrOrgAdminOfOrganization() {
        assertThat(OrganizationAdminResource.manageUnits("org-1").permits(principal(List.of("admin")))).isTrue();
        assertThat(OrganizationAdminResource.manageUnits("org-1").permits(principal(List.of("org_admin")))).isTrue();
        assertThat(OrganizationAdminResource.manageUnits("org-2").permits(principal(List.of("org_admin")))).isFalse();
        assertThat(OrganizationAdminResource.manageUnits("org-1").permits(principal(List.of("user")))).isFalse();
    }

    private static AuthenticatedPrincipal principal(List<String> roles) {
        return new AuthenticatedPrincipal("caller", roles, "org-1", List.of(), Map.of());
    }
}
