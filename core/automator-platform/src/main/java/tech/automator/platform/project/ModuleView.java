package tech.automator.platform.project;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record ModuleView(
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
    Instant createdAt,
    Instant updatedAt,
    Map<String, String> metadata
) {

    public static ModuleView from(Module module) {
        return new ModuleView(
            module.id,
            module.name,
            module.description,
            module.status,
            module.projectId,
            module.owner,
            module.startDate,
            module.dueDate,
            module.completedAt,
            module.members,
            module.tags,
            module.priority,
            module.createdAt,
            module.updatedAt,
            module.metadata
        );
    }
}
