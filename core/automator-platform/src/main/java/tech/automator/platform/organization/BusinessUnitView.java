package tech.automator.platform.organization;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record BusinessUnitView(
    String buId,
    String name,
    String description,
    String parentOrg,
    String parentBuId,
    String head,
    List<String> members,
    List<String> projects,
    String status,
    Instant createdAt,
    Instant updatedAt,
    Map<String, String> metadata
) {

    public static BusinessUnitView from(BusinessUnit unit) {
        return new BusinessUnitView(
            unit.id,
            unit.name,
            unit.description,
            unit.parentOrg,
            unit.parentBuId,
            unit.head,
            unit.members,
            unit.projects,
            unit.status,
            unit.createdAt,
            unit.updatedAt,
            unit.metadata
        );
    }
}
