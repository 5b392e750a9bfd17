package tech.automator.platform.project;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record ProjectView(
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
    List<String> modules,
    List<String> members,
    List<String> tags,
    Double budget,
    String priority,
    Instant createdAt,
    Instant updatedAt,
    Map<String, String> metadata
) {

    public static ProjectView from(Project project) {
        return new ProjectView(
            project.id,
            project.name,
            project.description,
            project.status,
            project.owner,
            project.parentProjectId,
            project.orgId,
            project.startDate,
            project.dueDate,
            project.completedAt,
            project.modules,
            project.members,
            project.tags,
            project.budget,
            project.priority,
            project.createdAt,
            project.updatedAt,
            project.metadata
        );
    }
}
