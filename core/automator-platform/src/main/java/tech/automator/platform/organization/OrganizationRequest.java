package tech.automator.platform.organization;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.automator.platform.shared.Address;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Organization payload for create and update. Business unit and project lists are
 * maintained by the server and cannot be supplied.
 */
public record OrganizationRequest(
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
    @JsonProperty("is_active") Boolean isActive,
    List<String> members,
    Instant establishedDate,
    Map<String, String> metadata
) {
}
