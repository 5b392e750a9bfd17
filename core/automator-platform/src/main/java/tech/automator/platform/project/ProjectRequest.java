package tech.automator.platform.project;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Project payload for create and update. The module list is maintained by the server.
 */
public record ProjectRequest(
    String projectId,
    String name,
    String description,
    String status,
    String owner,
    String parentProjectId,
    String orgId,
    LocalDate startDate,
    LocalDate dueDate,
    Instant completedAt,
    List<String> members,
    List<String> tags,
    Double budget,
    String priority,
    Map<String, String> metadata
) {
}
