package tech.automator.platform.project;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A project owned by one organization. Visible only to callers of that organization.
 */
@MongoEntity(collection = "projects")
public class Project extends PanacheMongoEntityBase {

    public static final String DEFAULT_STATUS = "planning";

    @BsonId
    public String id;

    /**
     * Unique within the owning organization.
     */
    public String name;

    public String description;

    public String status = DEFAULT_STATUS;

    public String owner;

    public String parentProjectId;

    public String orgId;

    public LocalDate startDate;

    public LocalDate dueDate;

    public Instant completedAt;

    /**
     * Module ids, maintained alongside module create and delete.
     */
    public List<String> modules = new ArrayList<>();

    public List<String> members = new ArrayList<>();

    public List<String> tags = new ArrayList<>();

    public Double budget;

    public String priority;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public Map<String, String> metadata = new HashMap<>();

    public Project() {
    }
}
