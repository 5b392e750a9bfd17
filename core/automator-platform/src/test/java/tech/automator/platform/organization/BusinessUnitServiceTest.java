package tech.automator.platform.organization;

import com.mongodb.MongoException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.shared.ErrorCode;
import tech.automator.platform.shared.ErrorDetail;
import tech.automator.platform.shared.ServiceResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;
import static tech.automator.platform.organization.OrganizationServiceTest.assertFailure;
import static tech.automator.platform.organization.OrganizationServiceTest.organization;

/**
 * Unit tests for BusinessUnitService.
 */
@ExtendWith(MockitoExtension.class)
class BusinessUnitServiceTest {

    @Mock
    private BusinessUnitRepository businessUnitRepository;

    @Mock
    private OrganizationRepository organizationRepository;

    @Mock
    private CallerOrganizationValidator callerOrganizationValidator;

    @InjectMocks
    private BusinessUnitService service;

    private final AuthenticatedPrincipal orgAdmin =
        new AuthenticatedPrincipal("u1", List.of("org_admin"), "org-1", List.of(), Map.of());

    // ========================================
    // createBusinessUnit TESTS
    // ========================================

    @Test
    @DisplayName("createBusinessUnit should persist the unit under the path organization and link it")
    void createBusinessUnit_shouldPersistAndLink() {
        // Arrange
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));
        when(businessUnitRepository.findByNameInOrganization("org-1", "Sales")).thenReturn(Optional.empty());
        when(organizationRepository.addBusinessUnit(eq("org-1"), anyString())).thenReturn(1L);

        // Act
        ServiceResult<BusinessUnitView> result = service.createBusinessUnit(orgAdmin, "org-1", request(null, "Sales", null));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().parentOrg()).isEqualTo("org-1");
        assertThat(result.value().status()).isEqualTo("active");
        verify(businessUnitRepository).persist(any(BusinessUnit.class));
        verify(organizationRepository).addBusinessUnit("org-1", result.value().buId());
    }

    @Test
    @DisplayName("createBusinessUnit should succeed even when linking to the organization fails")
    void createBusinessUnit_shouldSucceed_whenLinkFails() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));
        when(businessUnitRepository.findByNameInOrganization("org-1", "Sales")).thenReturn(Optional.empty());
        when(organizationRepository.addBusinessUnit(eq("org-1"), anyString())).thenThrow(new MongoException("timeout"));

        assertThat(service.createBusinessUnit(orgAdmin, "org-1", request(null, "Sales", null)).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("createBusinessUnit should report PARENT_ORGANIZATION_NOT_FOUND for an unknown organization")
    void createBusinessUnit_shouldFail_whenOrganizationMissing() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("ghost")).thenReturn(Optional.empty());

        assertFailure(service.createBusinessUnit(orgAdmin, "ghost", request(null, "Sales", null)),
            ErrorCode.PARENT_ORGANIZATION_NOT_FOUND);
    }

    @Test
    @DisplayName("createBusinessUnit should refuse a name already used in the organization")
    void createBusinessUnit_shouldFail_whenNameTaken() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));
        when(businessUnitRepository.findByNameInOrganization("org-1", "Sales")).thenReturn(Optional.of(unit("bu-1")));

        assertFailure(service.createBusinessUnit(orgAdmin, "org-1", request(null, "Sales", null)),
            ErrorCode.BU_NAME_ALREADY_EXISTS);
        verify(businessUnitRepository, never()).persist(any());
    }

    @Test
    @DisplayName("createBusinessUnit should refuse a parent unit from outside the organization")
    void createBusinessUnit_shouldFail_whenParentUnitUnknown() {
        callerIsValid();
        when(organizationRepository.findByIdOptional("org-1")).thenReturn(Optional.of(organization("org-1", "Acme")));
        when(businessUnitRepository.findByNameInOrganization("org-1", "Sales")).thenReturn(Optional.empty());
        when(businessUnitRepository.findInOrganization("org-1", "bu-x")).thenReturn(Optional.empty());

        assertFailure(service.createBusinessUnit(orgAdmin, "org-1", request(null, "Sales", "bu-x")),
            ErrorCode.BUSINESS_UNIT_NOT_FOUND);
    }

    // ========================================
    // update / delete TESTS
    // ========================================

    @Test
    @DisplayName("updateBusinessUnit should refuse to make a unit its own parent")
    void updateBusinessUnit_shouldFail_whenSelfParent() {
        callerIsValid();
        when(businessUnitRepository.findInOrganization("org-1", "bu-1")).thenReturn(Optional.of(unit("bu-1")));

        assertFailure(service.updateBusinessUnit(orgAdmin, "org-1", "bu-1", request(null, null, "bu-1")),
            ErrorCode.INVALID_FIELD);
        verify(businessUnitRepository, never()).update(any());
    }

    @Test
    @DisplayName("updateBusinessUnit should refuse a parent unit that is not in the organization")
    void updateBusinessUnit_shouldFail_whenParentUnitUnknown() {
        callerIsValid();
        when(businessUnitRepository.findInOrganization("org-1", "bu-1")).thenReturn(Optional.of(unit("bu-1")));
        when(businessUnitRepository.findInOrganization("org-1", "ghost")).thenReturn(Optional.empty());

        ServiceResult<BusinessUnitView> result =
            service.updateBusinessUnit(orgAdmin, "org-1", "bu-1", request(null, null, "ghost"));

        assertFailure(result, ErrorCode.BUSINESS_UNIT_NOT_FOUND);
        assertThat(((ServiceResult.Failure<BusinessUnitView>) result).errors())
            .extracting(ErrorDetail::field)
            .containsExactly("parent_bu_id");
        verify(businessUnitRepository, never()).update(any());
    }

    @Test
    @DisplayName("updateBusinessUnit should refuse a parent that would close a cycle")
    void updateBusinessUnit_shouldFail_whenParentIsDescendant() {
        // Arrange: bu-2 already sits under bu-1
        callerIsValid();
        BusinessUnit child = unit("bu-2");
        child.parentBuId = "bu-1";
        when(businessUnitRepository.findInOrganization("org-1", "bu-1")).thenReturn(Optional.of(unit("bu-1")));
        when(businessUnitRepository.findInOrganization("org-1", "bu-2")).thenReturn(Optional.of(child));

        // Act
        ServiceResult<BusinessUnitView> result =
            service.updateBusinessUnit(orgAdmin, "org-1", "bu-1", request(null, null, "bu-2"));

        // Assert
        assertFailure(result, ErrorCode.INVALID_FIELD);
        verify(businessUnitRepository, never()).update(any());
    }

    @Test
    @DisplayName("updateBusinessUnit should move a unit under another unit of the organization")
    void updateBusinessUnit_shouldChangeParent_whenParentValid() {
        callerIsValid();
        BusinessUnit existing = unit("bu-1");
        when(businessUnitRepository.findInOrganization("org-1", "bu-1")).thenReturn(Optional.of(existing));
        when(businessUnitRepository.findInOrganization("org-1", "bu-2")).thenReturn(Optional.of(unit("bu-2")));

        ServiceResult<BusinessUnitView> result =
            service.updateBusinessUnit(orgAdmin, "org-1", "bu-1", request(null, null, "bu-2"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(existing.parentBuId).isEqualTo("bu-2");
        verify(businessUnitRepository).update(existing);
    }

    @Test
    @DisplayName("updateBusinessUnit should trim the new name before checking and storing it")
    void updateBusinessUnit_shouldTrimName() {
        callerIsValid();
        BusinessUnit existing = unit("bu-1");
        when(businessUnitRepository.findInOrganization("org-1", "bu-1")).thenReturn(Optional.of(existing));
        when(businessUnitRepository.findByNameInOrganization("org-1", "Marketing")).thenReturn(Optional.empty());

        ServiceResult<BusinessUnitView> result =
            service.updateBusinessUnit(orgAdmin, "org-1", "bu-1", request(null, " Marketing ", null));

        assertThat(result.isSuccess()).isTrue();
        assertThat(existing.name).isEqualTo("Marketing");
    }

    @Test
    @DisplayName("deleteBusinessUnit should refuse while child units exist")
    void deleteBusinessUnit_shouldFail_whenChildrenExist() {
        callerIsValid();
        when(businessUnitRepository.findInOrganization("org-1", "bu-1")).thenReturn(Optional.of(unit("bu-1")));
        when(businessUnitRepository.countChildren("bu-1")).thenReturn(1L);

        assertFailure(service.deleteBusinessUnit(orgAdmin, "org-1", "bu-1"), ErrorCode.BUSINESS_UNIT_HAS_DEPENDENCIES);
        verify(businessUnitRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("deleteBusinessUnit should delete and unlink a leaf unit")
    void deleteBusinessUnit_shouldDeleteAndUnlink() {
        callerIsValid();
        when(businessUnitRepository.findInOrganization("org-1", "bu-1")).thenReturn(Optional.of(unit("bu-1")));
        when(businessUnitRepository.countChildren("bu-1")).thenReturn(0L);
        when(organizationRepository.removeBusinessUnit("org-1", "bu-1")).thenReturn(1L);

        assertThat(service.deleteBusinessUnit(orgAdmin, "org-1", "bu-1").isSuccess()).isTrue();
        verify(businessUnitRepository).deleteById("bu-1");
        verify(organizationRepository).removeBusinessUnit("org-1", "bu-1");
    }

    @Test
    @DisplayName("getBusinessUnit should report BUSINESS_UNIT_NOT_FOUND for a unit of another organization")
    void getBusinessUnit_shouldFail_whenUnitNotInOrganization() {
        callerIsValid();
        when(businessUnitRepository.findInOrganization("org-1", "bu-9")).thenReturn(Optional.empty());

        assertFailure(service.getBusinessUnit(orgAdmin, "org-1", "bu-9"), ErrorCode.BUSINESS_UNIT_NOT_FOUND);
    }

    // ========================================
    // HELPERS
    // ========================================

    private void callerIsValid() {
        when(callerOrganizationValidator.validate(orgAdmin)).thenReturn(ServiceResult.success(organization("org-1", "Acme")));
    }

    private static BusinessUnit unit(String id) {
        BusinessUnit unit = new BusinessUnit();
        unit.id = id;
        unit.name = "Sales";
        unit.parentOrg = "org-1";
        return unit;
    }

    private static BusinessUnitRequest request(String buId, String name, String parentBuId) {
        return new BusinessUnitRequest(buId, name, null, parentBuId, null, null, null, null, null);
    }
}
