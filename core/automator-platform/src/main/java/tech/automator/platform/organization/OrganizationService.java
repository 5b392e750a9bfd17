package tech.automator.platform.organization;

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
import java.util.List;
import java.util.Optional;

import static tech.automator.platform.shared.Strings.trimToNull;

/**
 * Service for organization CRUD operations.
 */
@ApplicationScoped
public class OrganizationService {

    private static final Logger LOG = Logger.getLogger(OrganizationService.class);

    @Inject
    OrganizationRepository organizationRepository;

    @Inject
    BusinessUnitRepository businessUnitRepository;

    @Inject
    CallerOrganizationValidator callerOrganizationValidator;

    // ==================== CRUD Operations ====================

    /**
     * Create an organization. The id is taken from the request when supplied, generated otherwise.
     */
    public ServiceResult<OrganizationView> createOrganization(AuthenticatedPrincipal caller, OrganizationRequest request) {
        String name = trimToNull(request.name());
        if (name == null) {
            return ServiceResult.failure(ErrorCode.MISSING_ORGANIZATION_NAME);
        }

        String orgId = trimToNull(request.orgId());
        if (orgId != null && organizationRepository.findByIdOptional(orgId).isPresent()) {
            LOG.warnf("Organization creation refused: id %s already exists", orgId);
            return ServiceResult.failure(ErrorCode.ORG_ID_ALREADY_EXISTS);
        }
        if (organizationRepository.findByName(name).isPresent()) {
            LOG.warnf("Organization creation refused: name '%s' already exists", name);
            return ServiceResult.failure(ErrorCode.ORG_NAME_ALREADY_EXISTS);
        }

        Organization org = new Organization();
        org.id = orgId != null ? orgId : TsidGenerator.generate();
        org.name = name;
        org.shortName = request.shortName();
        org.description = request.description();
        org.primaryContact = request.primaryContact();
        org.email = request.email();
        org.website = request.website();
        org.address = request.address();
        org.parentOrgId = request.parentOrgId();
        if (request.status() != null) {
            org.status = request.status();
        }
        if (request.isActive() != null) {
            org.active = request.isActive();
        }
        if (request.members() != null) {
            org.members = new ArrayList<>(request.members());
        }
        org.establishedDate = request.establishedDate();
        if (request.metadata() != null) {
            org.metadata = new HashMap<>(request.metadata());
        }

        organizationRepository.persist(org);
        LOG.infof("Organization %s created by user %s", org.id, caller.userId());
        return ServiceResult.success(OrganizationView.from(org));
    }

    public ServiceResult<OrganizationView> getOrganization(AuthenticatedPrincipal caller, String orgId) {
        return callerOrganizationValidator.validate(caller)
            .flatMap(ignored -> findOrganization(orgId))
            .map(OrganizationView::from);
    }

    /**
     * Apply the supplied fields to an existing organization.
     * The organization id cannot be changed and the name must stay globally unique.
     */
    public ServiceResult<OrganizationView> updateOrganization(AuthenticatedPrincipal caller, String orgId,
                                                              OrganizationRequest request) {
        ServiceResult<Organization> loaded = callerOrganizationValidator.validate(caller)
            .flatMap(ignored -> findOrganization(orgId));
        if (!loaded.isSuccess()) {
            return loaded.map(OrganizationView::from);
        }
        Organization org = loaded.value();

        String name = trimToNull(request.name());
        if (request.name() != null && name == null) {
            return ServiceResult.failure(ErrorCode.MISSING_ORGANIZATION_NAME);
        }
        if (name != null && !name.equals(org.name)) {
            Optional<Organization> sameName = organizationRepository.findByName(name);
            if (sameName.isPresent() && !sameName.get().id.equals(org.id)) {
                return ServiceResult.failure(ErrorCode.ORG_NAME_ALREADY_EXISTS);
            }
        }

        PartialUpdate update = PartialUpdate.builder();
        if (request.orgId() != null && !request.orgId().equals(org.id)) {
            update.reject("org_id", "Organization id cannot be changed");
        }
        update
            .field("name", name, org.name, v -> org.name = v)
            .field("short_name", request.shortName(), org.shortName, v -> org.shortName = v)
            .field("description", request.description(), org.description, v -> org.description = v)
            .field("primary_contact", request.primaryContact(), org.primaryContact, v -> org.primaryContact = v)
            .field("email", request.email(), org.email, v -> org.email = v)
            .field("website", request.website(), org.website, v -> org.website = v)
            .field("address", request.address(), org.address, v -> org.address = v)
            .field("parent_org_id", request.parentOrgId(), org.parentOrgId, v -> org.parentOrgId = v)
            .field("status", request.status(), org.status, v -> org.status = v)
            .field("is_active", request.isActive(), org.active, v -> org.active = v)
            .field("members", request.members(), org.members, v -> org.members = new ArrayList<>(v))
            .field("established_date", request.establishedDate(), org.establishedDate, v -> org.establishedDate = v)
            .field("metadata", org.metadata != null, request.metadata(), org.metadata,
                v -> org.metadata = new HashMap<>(v));

        ServiceResult<List<String>> changed = update.apply();
        if (!changed.isSuccess()) {
            return changed.map(fields -> OrganizationView.from(org));
        }

        org.updatedAt = Instant.now();
        organizationRepository.update(org);
        LOG.infof("Organization %s updated by user %s: %s", org.id, caller.userId(), changed.value());
        return ServiceResult.success(OrganizationView.from(org));
    }

    /**
     * Delete an organization. Refused while any business unit still belongs to it.
     */
    public ServiceResult<Void> deleteOrganization(AuthenticatedPrincipal caller, String orgId) {
        ServiceResult<Organization> loaded = callerOrganizationValidator.validate(caller)
            .flatMap(ignored -> findOrganization(orgId));
        if (!loaded.isSuccess()) {
            return loaded.map(org -> null);
        }
        String id = loaded.value().id;

        long units = businessUnitRepository.countByOrganization(id);
        if (units > 0) {
            LOG.warnf("Organization %s not deleted: %d business units remain", id, units);
            return ServiceResult.failure(ErrorCode.ORGANIZATION_HAS_DEPENDENCIES);
        }

        organizationRepository.deleteById(id);
        LOG.infof("Organization %s deleted by user %s", id, caller.userId());
        return ServiceResult.success(null);
    }

    /**
     * List organizations, newest first.
     */
    public ServiceResult<Page<OrganizationView>> listOrganizations(PageRequest page) {
        List<OrganizationView> items = organizationRepository.findPage(page.skip(), page.limit()).stream()
            .map(OrganizationView::from)
            .toList();
        long total = organizationRepository.count();
        return ServiceResult.success(Page.of(items, total, page));
    }

    /**
     * The organization plus the full records of the business units it lists.
     */
    public ServiceResult<OrganizationUnitsView> getOrganizationUnits(AuthenticatedPrincipal caller, String orgId) {
        ServiceResult<Organization> loaded = callerOrganizationValidator.validate(caller)
            .flatMap(ignored -> findOrganization(orgId));
        if (!loaded.isSuccess()) {
            return loaded.map(org -> null);
        }
        Organization org = loaded.value();

        List<BusinessUnitView> units = org.businessUnits == null || org.businessUnits.isEmpty()
            ? List.of()
            : businessUnitRepository.findByIds(org.businessUnits).stream()
                .map(BusinessUnitView::from)
                .toList();

        return ServiceResult.success(new OrganizationUnitsView(OrganizationView.from(org), units, units.size()));
    }

    // ==================== Helpers ====================

    private ServiceResult<Organization> findOrganization(String orgId) {
        String id = trimToNull(orgId);
        if (id == null) {
            return ServiceResult.failure(ErrorCode.ORGANIZATION_NOT_FOUND);
        }
        return organizationRepository.findByIdOptional(id)
            .map(ServiceResult::success)
            .orElseGet(() -> ServiceResult.failure(ErrorCode.ORGANIZATION_NOT_FOUND));
    }
}
