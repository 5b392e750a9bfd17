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
 * A unit of work inside a project.
 */
@MongoEntity(collection = "modules")
public class Module extends PanacheMongoEntityBase {

    public static final String DEFAULT_STATUS = "not_started";

    @BsonId
    public String id;

    public String name;

    public String description;

    public String status = DEFAULT_STATUS;

    public String projectId;

    public String owner;

    public LocalDate startDate;

    public LocalDate dueDate;

    public Instant completedAt;

    public List<String> members = new ArrayList<>();

    public List<String> tags = new ArrayList<>();

    public String priority;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public Map<String, String> metadata = new HashMap<>();

    public Module() {
    }
}
