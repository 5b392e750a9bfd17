package tech.automator.platform.project;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record ModuleRequest(
    String moduleId,
    String name,
    String description,
    String status,
    String projectId,
    String owner,
    LocalDate startDate,
    LocalDate dueDate,
    Instant completedAt,
    List<String> members,
    List<String> tags,
    String priority,
    Map<String, String> metadata
) {
}
