package tech.automator.platform.organization;

import com.mongodb.MongoException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.shared.ErrorCode;
import tech.automator.platform.shared.Page;
import tech.automator.platform.shared.PageRequest;
import tech.automator.platform.shared.PartialUpdate;
import tech.automator.platform.shared.ServiceResult;
import tech.automator.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static tech.automator.platform.shared.Strings.trimToNull;

/**
 * Service for business units nested under an organization.
 *
 * The owning organization's {@code businessUnits} list is updated after each create
 * and delete. That write is best-effort: a failure is logged and the primary
 * operation still succeeds.
 */
@ApplicationScoped
public class BusinessUnitService {

    private static final Logger LOG = Logger.getLogger(BusinessUnitService.class);

    @Inject
    BusinessUnitRepository businessUnitRepository;

    @Inject
    OrganizationRepository organizationRepository;

    @Inject
    CallerOrganizationValidator callerOrganizationValidator;

    public ServiceResult<BusinessUnitView> createBusinessUnit(AuthenticatedPrincipal caller, String orgId,
                                                              BusinessUnitRequest request) {
        ServiceResult<Organization> parent = callerOrganizationValidator.validate(caller)
            .flatMap(ignored -> findParentOrganization(orgId));
        if (!parent.isSuccess()) {
            return parent.map(org -> null);
        }
        String parentOrgId = parent.value().id;

        String name = trimToNull(request.name());
        if (name == null) {
            return ServiceResult.failure(ErrorCode.MISSING_BUSINESS_UNIT_NAME);
        }

        String buId = trimToNull(request.buId());
        if (buId != null && businessUnitRepository.findByIdOptional(buId).isPresent()) {
            return ServiceResult.failure(ErrorCode.BU_ID_ALREADY_EXISTS);
        }
        if (businessUnitRepository.findByNameInOrganization(parentOrgId, name).isPresent()) {
            return ServiceResult.failure(ErrorCode.BU_NAME_ALREADY_EXISTS);
        }
        if (request.parentBuId() != null
            && businessUnitRepository.findInOrganization(parentOrgId, request.parentBuId()).isEmpty()) {
            return ServiceResult.failure(ErrorCode.BUSINESS_UNIT_NOT_FOUND, "parent_bu_id");
        }

        BusinessUnit unit = new BusinessUnit();
        unit.id = buId != null ? buId : TsidGenerator.generate();
        unit.name = name;
        unit.description = request.description();
        unit.parentOrg = parentOrgId;
        unit.parentBuId = request.parentBuId();
        unit.head = request.head();
        if (request.members() != null) {
            unit.members = new ArrayList<>(request.members());
        }
        if (request.projects() != null) {
            unit.projects = new ArrayList<>(request.projects());
        }
        if (request.status() != null) {
            unit.status = request.status();
        }
        if (request.metadata() != null) {
            unit.metadata = new HashMap<>(request.metadata());
        }

        businessUnitRepository.persist(unit);
        LOG.infof("Business unit %s created in organization %s by user %s", unit.id, parentOrgId, caller.userId());

        linkToOrganization(parentOrgId, unit.id);
        return ServiceResult.success(BusinessUnitView.from(unit));
    }

    public ServiceResult<BusinessUnitView> getBusinessUnit(AuthenticatedPrincipal caller, String orgId, String buId) {
        return callerOrganizationValidator.validate(caller)
            .flatMap(ignored -> findUnit(orgId, buId))
            .map(BusinessUnitView::from);
    }

    public ServiceResult<BusinessUnitView> updateBusinessUnit(AuthenticatedPrincipal caller, String orgId, String buId,
                                                              BusinessUnitRequest request) {
        ServiceResult<BusinessUnit> loaded = callerOrganizationValidator.validate(caller)
            .flatMap(ignored -> findUnit(orgId, buId));
        if (!loaded.isSuccess()) {
            return loaded.map(BusinessUnitView::from);
        }
        BusinessUnit unit = loaded.value();

        String name = trimToNull(request.name());
        if (request.name() != null && name == null) {
            return ServiceResult.failure(ErrorCode.MISSING_BUSINESS_UNIT_NAME);
        }
        if (name != null && !name.equals(unit.name)) {
            Optional<BusinessUnit> sameName = businessUnitRepository.findByNameInOrganization(unit.parentOrg, name);
            if (sameName.isPresent() && !sameName.get().id.equals(unit.id)) {
                return ServiceResult.failure(ErrorCode.BU_NAME_ALREADY_EXISTS);
            }
        }

        PartialUpdate update = PartialUpdate.builder();
        if (request.buId() != null && !request.buId().equals(unit.id)) {
            update.reject("bu_id", "Business unit id cannot be changed");
        }
        String parentBuId = request.parentBuId();
        if (parentBuId != null && parentBuId.equals(unit.id)) {
            update.reject("parent_bu_id", "Business unit cannot be its own parent");
        } else if (parentBuId != null && !parentBuId.equals(unit.parentBuId)) {
            Optional<BusinessUnit> parent = businessUnitRepository.findInOrganization(unit.parentOrg, parentBuId);
            if (parent.isEmpty()) {
                return ServiceResult.failure(ErrorCode.BUSINESS_UNIT_NOT_FOUND, "parent_bu_id");
            }
            if (isDescendant(parent.get(), unit)) {
                update.reject("parent_bu_id", "Business unit cannot be placed under one of its descendants");
            }
        }
        update
            .field("name", name, unit.name, v -> unit.name = v)
            .field("description", request.description(), unit.description, v -> unit.description = v)
            .field("parent_bu_id", request.parentBuId(), unit.parentBuId, v -> unit.parentBuId = v)
            .field("head", request.head(), unit.head, v -> unit.head = v)
            .field("members", request.members(), unit.members, v -> unit.members = new ArrayList<>(v))
            .field("projects", request.projects(), unit.projects, v -> unit.projects = new ArrayList<>(v))
            .field("status", request.status(), unit.status, v -> unit.status = v)
            .field("metadata", unit.metadata != null, request.metadata(), unit.metadata,
                v -> unit.metadata = new HashMap<>(v));

        ServiceResult<List<String>> changed = update.apply();
        if (!changed.isSuccess()) {
            return changed.map(fields -> BusinessUnitView.from(unit));
        }

        unit.updatedAt = Instant.now();
        businessUnitRepository.update(unit);
        LOG.infof("Business unit %s updated by user %s: %s", unit.id, caller.userId(), changed.value());
        return ServiceResult.success(BusinessUnitView.from(unit));
    }

    /**
     * Delete a business unit. Refused while child units reference it as their parent.
     */
    public ServiceResult<Void> deleteBusinessUnit(AuthenticatedPrincipal caller, String orgId, String buId) {
        ServiceResult<BusinessUnit> loaded = callerOrganizationValidator.validate(caller)
            .flatMap(ignored -> findUnit(orgId, buId));
        if (!loaded.isSuccess()) {
            return loaded.map(unit -> null);
        }
        BusinessUnit unit = loaded.value();

        long children = businessUnitRepository.countChildren(unit.id);
        if (children > 0) {
            LOG.warnf("Business unit %s not deleted: %d child units remain", unit.id, children);
            return ServiceResult.failure(ErrorCode.BUSINESS_UNIT_HAS_DEPENDENCIES);
        }

        businessUnitRepository.deleteById(unit.id);
        LOG.infof("Business unit %s deleted by user %s", unit.id, caller.userId());

        unlinkFromOrganization(unit.parentOrg, unit.id);
        return ServiceResult.success(null);
    }

    public ServiceResult<Page<BusinessUnitView>> listBusinessUnits(AuthenticatedPrincipal caller, String orgId,
                                                                   PageRequest page) {
        ServiceResult<Organization> parent = callerOrganizationValidator.validate(caller)
            .flatMap(ignored -> findParentOrganization(orgId));
        if (!parent.isSuccess()) {
            return parent.map(org -> null);
        }
        String parentOrgId = parent.value().id;

        List<BusinessUnitView> items = businessUnitRepository
            .findPageByOrganization(parentOrgId, page.skip(), page.limit()).stream()
            .map(BusinessUnitView::from)
            .toList();
        long total = businessUnitRepository.countByOrganization(parentOrgId);
        return ServiceResult.success(Page.of(items, total, page));
    }

    // ==================== Reverse references ====================

    private void linkToOrganization(String orgId, String buId) {
        try {
            if (organizationRepository.addBusinessUnit(orgId, buId) == 0) {
                LOG.warnf("Organization %s not updated with business unit %s", orgId, buId);
            }
        } catch (MongoException e) {
            LOG.warnf(e, "Failed to add business unit %s to organization %s", buId, orgId);
        }
    }

    private void unlinkFromOrganization(String orgId, String buId) {
        try {
            if (organizationRepository.removeBusinessUnit(orgId, buId) == 0) {
                LOG.warnf("Organization %s did not reference business unit %s", orgId, buId);
            }
        } catch (MongoException e) {
            LOG.warnf(e, "Failed to remove business unit %s from organization %s", buId, orgId);
        }
    }

    // ==================== Helpers ====================

    /**
     * Whether {@code candidate} sits below {@code unit} in the parent chain.
     */
    private boolean isDescendant(BusinessUnit candidate, BusinessUnit unit) {
        Set<String> visited = new HashSet<>();
        String ancestorId = candidate.parentBuId;
        while (ancestorId != null && visited.add(ancestorId)) {
            if (ancestorId.equals(unit.id)) {
                return true;
            }
            ancestorId = businessUnitRepository.findInOrganization(unit.parentOrg, ancestorId)
                .map(ancestor -> ancestor.parentBuId)
                .orElse(null);
        }
        return false;
    }

    private ServiceResult<Organization> findParentOrganization(String orgId) {
        String id = trimToNull(orgId);
        Optional<Organization> org = id == null ? Optional.empty() : organizationRepository.findByIdOptional(id);
        return org.map(ServiceResult::success)
            .orElseGet(() -> ServiceResult.failure(ErrorCode.PARENT_ORGANIZATION_NOT_FOUND));
    }

    private ServiceResult<BusinessUnit> findUnit(String orgId, String buId) {
        String parentOrgId = trimToNull(orgId);
        String id = trimToNull(buId);
        if (parentOrgId == null || id == null) {
            return ServiceResult.failure(ErrorCode.BUSINESS_UNIT_NOT_FOUND);
        }
        return businessUnitRepository.findInOrganization(parentOrgId, id)
            .map(ServiceResult::success)
            .orElseGet(() -> ServiceResult.failure(ErrorCode.BUSINESS_UNIT_NOT_FOUND));
    }
}
