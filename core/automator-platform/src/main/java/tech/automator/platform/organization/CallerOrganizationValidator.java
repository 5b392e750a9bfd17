package tech.automator.platform.organization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.shared.ErrorCode;
import tech.automator.platform.shared.ServiceResult;

import java.util.Optional;

/**
 * Confirms that the caller's own organization exists and is active before
 * organization-scoped operations run.
 */
@ApplicationScoped
public class CallerOrganizationValidator {

    private static final Logger LOG = Logger.getLogger(CallerOrganizationValidator.class);

    @Inject
    OrganizationRepository organizationRepository;

    public ServiceResult<Organization> validate(AuthenticatedPrincipal caller) {
        String orgId = caller.orgId();
        if (orgId == null || orgId.isBlank()) {
            LOG.warnf("Caller %s has no organization", caller.userId());
            return ServiceResult.failure(ErrorCode.INVALID_ORGANIZATION);
        }

        Optional<Organization> organization = organizationRepository.findByIdOptional(orgId);
        if (organization.isEmpty() || !Organization.STATUS_ACTIVE.equals(organization.get().status)) {
            LOG.warnf("Operation refused: invalid or inactive organization %s", orgId);
            return ServiceResult.failure(ErrorCode.INVALID_ORGANIZATION);
        }
        return ServiceResult.success(organization.get());
    }
}
