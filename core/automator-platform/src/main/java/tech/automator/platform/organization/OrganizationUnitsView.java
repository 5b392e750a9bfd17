package tech.automator.platform.organization;

import java.util.List;

/**
 * An organization together with the full records of its business units.
 */
public record OrganizationUnitsView(
    OrganizationView organization,
    List<BusinessUnitView> businessUnits,
    int totalBusinessUnits
) {
}
