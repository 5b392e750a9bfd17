package tech.automator.platform.organization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.shared.ErrorCode;
import tech.automator.platform.shared.ErrorDetail;
import tech.automator.platform.shared.Page;
import tech.automator.platform.shared.PageRequest;
import tech.automator.platform.shared.ServiceResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrganizationService.
 * Uses mocked repositories and caller organization validation.
 */
@ExtendWith(MockitoExtension.class)
class OrganizationServiceTest {

    @Mock
    private OrganizationRepository organizationRepository;

    @Mock
    private BusinessUnitRepository businessUnitRepository;

    @Mock
    private CallerOrganizationValidator callerOrganizationValidator;

    @InjectMocks
    private OrganizationService service;

    private final AuthenticatedPrincipal admin =
        new AuthenticatedPrincipal("admin-1", List.of("admin", "user"), "home-org", List.of(), Map.of());

    // ========================================
    // createOrganization TESTS
    // ========================================

    @Test
    @DisplayName("createOrganization should persist a new active organization")
    void createOrganization_shouldPersist_whenNameUnique() {
        // Arrange
        when(organizationRepository.findByName("Acme")).thenReturn(Optional.empty());

        // Act
        ServiceResult<OrganizationView> result = service.createOrganization(admin, request(null, " Acme "));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        OrganizationView view = result.value();
        assertThat(view.orgId()).isNotBlank();
        assertThat(view.name()).isEqualTo("Acme");
        assertThat(view.status()).isEqualTo("active");
        assertThat(view.isActive()).isTrue();

        ArgumentCaptor<Organization> saved = ArgumentCaptor.forClass(Organization.class);
        verify(organizationRepository).persist(saved.capture());
        assertThat(saved.getValue().id).isEqualTo(view.orgId());
        verifyNoInteractions(callerOrganizationValidator);
    }

    @Test
    @DisplayName("createOrganization should keep a client-supplied id")
    void createOrganization_shouldUseSuppliedId() {
        when(organizationRepository.findByIdOptional("org-42")).thenReturn(Optional.empty());
        when(organizationRepository.findByName("Acme")).thenReturn(Optional.empty());

        ServiceResult<OrganizationView> result = service.createOrganization(admin, request("org-42", "Acme"));

        assertThat(result.value().orgId()).isEqualTo("org-42");
    }

    @Test
    @DisplayName("createOrganization should require a name")
    void createOrganization_shouldFail_whenNameMissing() {
        ServiceResult<OrganizationView> result = service.createOrganization(admin, request(null, "  "));

        assertFailure(result, ErrorCode.MISSING_ORGANIZATION_NAME);
        verify(organizationRepository, never()).persist(any());
    }

    @Test
    @DisplayName("createOrganization should refuse a duplicate id or name")
    void createOrganization_shouldFail_whenIdOrNameTaken() {
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Other")));
        when(organizationRepository.findByName("Acme")).thenReturn(Optional.of(organization("org-2", "Acme")));

        assertFailure(service.createOrganization(admin, request("org-1", "New")), ErrorCode.ORG_ID_ALREADY_EXISTS);
        assertFailure(service.createOrganization(admin, request(null, "Acme")), ErrorCode.ORG_NAME_ALREADY_EXISTS);
    }

    // ========================================
    // getOrganization TESTS
    // ========================================

    @Test
    @DisplayName("getOrganization should stop at an invalid caller organization")
    void getOrganization_shouldFail_whenCallerOrganizationInvalid() {
        when(callerOrganizationValidator.validate(admin)).thenReturn(ServiceResult.failure(ErrorCode.INVALID_ORGANIZATION));

        assertFailure(service.getOrganization(admin, "org-1"), ErrorCode.INVALID_ORGANIZATION);
        verifyNoInteractions(organizationRepository);
    }

    @Test
    @DisplayName("getOrganization should report ORGANIZATION_NOT_FOUND for an unknown id")
    void getOrganization_shouldFail_whenNotFound() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("missing")).thenReturn(Optional.empty());

        assertFailure(service.getOrganization(admin, "missing"), ErrorCode.ORGANIZATION_NOT_FOUND);
    }

    // ========================================
    // updateOrganization TESTS
    // ========================================

    @Test
    @DisplayName("updateOrganization should apply changed fields and save")
    void updateOrganization_shouldSave_whenFieldsChange() {
        // Arrange
        callerIsValid();
        Organization org = organization("org-1", "Acme");
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(org));
        when(organizationRepository.findByName("Acme Corp")).thenReturn(Optional.empty());

        // Act
        ServiceResult<OrganizationView> result = service.updateOrganization(admin, "org-1", request(null, "Acme Corp"));

        // Assert
        assertThat(result.value().name()).isEqualTo("Acme Corp");
        verify(organizationRepository).update(org);
    }

    @Test
    @DisplayName("updateOrganization should refuse to change the organization id")
    void updateOrganization_shouldFail_whenIdChanges() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));

        ServiceResult<OrganizationView> result = service.updateOrganization(admin, "org-1", request("org-2", null));

        assertFailure(result, ErrorCode.INVALID_FIELD);
        assertThat(((ServiceResult.Failure<?>) result).errors()).extracting(ErrorDetail::field).containsExactly("org_id");
        verify(organizationRepository, never()).update(any());
    }

    @Test
    @DisplayName("updateOrganization should report NO_CHANGES_MADE when nothing differs")
    void updateOrganization_shouldFail_whenNothingChanges() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));

        assertFailure(service.updateOrganization(admin, "org-1", request("org-1", "Acme")), ErrorCode.NO_CHANGES_MADE);
    }

    @Test
    @DisplayName("updateOrganization should refuse a name held by another organization")
    void updateOrganization_shouldFail_whenNameTaken() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));
        when(organizationRepository.findByName("Globex")).thenReturn(Optional.of(organization("org-2", "Globex")));

        assertFailure(service.updateOrganization(admin, "org-1", request(null, "Globex")),
            ErrorCode.ORG_NAME_ALREADY_EXISTS);
    }

    @Test
    @DisplayName("updateOrganization should trim the new name before checking and storing it")
    void updateOrganization_shouldTrimName() {
        callerIsValid();
        Organization existing = organization("org-1", "Acme");
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(existing));
        when(organizationRepository.findByName("Globex")).thenReturn(Optional.empty());

        ServiceResult<OrganizationView> result = service.updateOrganization(admin, "org-1", request(null, "  Globex "));

        assertThat(result.isSuccess()).isTrue();
        assertThat(existing.name).isEqualTo("Globex");
        verify(organizationRepository).update(existing);
    }

    @Test
    @DisplayName("updateOrganization should refuse a blank name")
    void updateOrganization_shouldFail_whenNameBlank() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));

        assertFailure(service.updateOrganization(admin, "org-1", request(null, "   ")), ErrorCode.MISSING_ORGANIZATION_NAME);
        verify(organizationRepository, never()).update(any());
    }

    // ========================================
    // deleteOrganization TESTS
    // ========================================

    @Test
    @DisplayName("deleteOrganization should refuse while business units remain")
    void deleteOrganization_shouldFail_whenBusinessUnitsExist() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));
        when(businessUnitRepository.countByOrganization("org-1")).thenReturn(2L);

        assertFailure(service.deleteOrganization(admin, "org-1"), ErrorCode.ORGANIZATION_HAS_DEPENDENCIES);
        verify(organizationRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("deleteOrganization should delete an organization without business units")
    void deleteOrganization_shouldDelete_whenNoDependencies() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));
        when(businessUnitRepository.countByOrganization("org-1")).thenReturn(0L);

        assertThat(service.deleteOrganization(admin, "org-1").isSuccess()).isTrue();
        verify(organizationRepository).deleteById("org-1");
    }

    @Test
    @DisplayName("deleteOrganization should check dependencies against the stored id when the path id is padded")
    void deleteOrganization_shouldFail_whenPaddedIdHasBusinessUnits() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));
        when(businessUnitRepository.countByOrganization("org-1")).thenReturn(3L);

        assertFailure(service.deleteOrganization(admin, " org-1 "), ErrorCode.ORGANIZATION_HAS_DEPENDENCIES);
        verify(organizationRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("deleteOrganization should delete by the stored id when the path id is padded")
    void deleteOrganization_shouldDeleteStoredId_whenPathIdPadded() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));
        when(businessUnitRepository.countByOrganization("org-1")).thenReturn(0L);

        assertThat(service.deleteOrganization(admin, " org-1 ").isSuccess()).isTrue();
        verify(organizationRepository).deleteById("org-1");
    }

    // ========================================
    // list / units TESTS
    // ========================================

    @Test
    @DisplayName("listOrganizations should page without caller organization validation")
    void listOrganizations_shouldReturnPage() {
        when(organizationRepository.findPage(0, 2)).thenReturn(List.of(organization("a", "A"), organization("b", "B")));
        when(organizationRepository.count()).thenReturn(3L);

        ServiceResult<Page<OrganizationView>> result = service.listOrganizations(new PageRequest(2, 0));

        assertThat(result.value().items()).extracting(OrganizationView::orgId).containsExactly("a", "b");
        assertThat(result.value().pagination().hasMore()).isTrue();
        verifyNoInteractions(callerOrganizationValidator);
    }

    @Test
    @DisplayName("getOrganizationUnits should return the organization with its listed business units")
    void getOrganizationUnits_shouldResolveUnits() {
        // Arrange
        callerIsValid();
        Organization org = organization("org-1", "Acme");
        org.businessUnits = List.of("bu-1");
        BusinessUnit unit = new BusinessUnit();
        unit.id = "bu-1";
        unit.name = "Sales";
        unit.parentOrg = "org-1";
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(org));
        when(businessUnitRepository.findByIds(List.of("bu-1"))).thenReturn(List.of(unit));

        // Act
        ServiceResult<OrganizationUnitsView> result = service.getOrganizationUnits(admin, "org-1");

        // Assert
        assertThat(result.value().organization().orgId()).isEqualTo("org-1");
        assertThat(result.value().businessUnits()).extracting(BusinessUnitView::buId).containsExactly("bu-1");
        assertThat(result.value().totalBusinessUnits()).isEqualTo(1);
    }

    // ========================================
    // HELPERS
    // ========================================

    private void callerIsValid() {
        when(callerOrganizationValidator.validate(admin)).thenReturn(ServiceResult.success(organization("home-org", "Home")));
    }

    static Organization organization(String id, String name) {
        Organization org = new Organization();
        org.id = id;
        org.name = name;
        return org;
    }

    private static OrganizationRequest request(String orgId, String name) {
        return new OrganizationRequest(orgId, name, null, null, null, null, null, null, null, null, null, null,
            null, null);
    }

    static void assertFailure(ServiceResult<?> result, ErrorCode expected) {
        assertThat(result).isInstanceOf(ServiceResult.Failure.class);
        assertThat(((ServiceResult.Failure<?>) result).code()).isEqualTo(expected);
    }
}
