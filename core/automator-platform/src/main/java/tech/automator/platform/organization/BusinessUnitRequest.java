package tech.automator.platform.organization;

import java.util.List;
import java.util.Map;

/**
 * Business unit payload for create and update. The owning organization comes from the path.
 */
public record BusinessUnitRequest(
    String buId,
    String name,
    String description,
    String parentBuId,
    String head,
    List<String> members,
    List<String> projects,
    String status,
    Map<String, String> metadata
) {
}
