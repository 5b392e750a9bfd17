package tech.automator.platform.organization;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.automator.platform.shared.Address;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record OrganizationView(
    String orgId,
    String name,
    String shortName,
    String description,
    String primaryContact,
    String email,
    String website,
    Address address,
    String parentOrgId,
    String status,
    @JsonProperty("is_active") boolean isActive,
    List<String> businessUnits,
    List<String> members,
    List<String> projects,
    Instant establishedDate,
    Instant createdAt,
    Instant updatedAt,
    Map<String, String> metadata
) {

    public static OrganizationView from(Organization org) {
        return new OrganizationView(
            org.id,
            org.name,
            org.shortName,
            org.description,
            org.primaryContact,
            org.email,
            org.website,
            org.address,
            org.parentOrgId,
            org.status,
            org.active,
            org.businessUnits,
            org.members,
            org.projects,
            org.establishedDate,
            org.createdAt,
            org.updatedAt,
            org.metadata
        );
    }
}
