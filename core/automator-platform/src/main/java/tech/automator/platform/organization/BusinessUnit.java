package tech.automator.platform.organization;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A sub-division of an organization. Units may nest through {@link #parentBuId}.
 */
@MongoEntity(collection = "business_units")
public class BusinessUnit extends PanacheMongoEntityBase {

    @BsonId
    public String id;

    /**
     * Unique within the owning organization.
     */
    public String name;

    public String description;

    /**
     * Owning organization id.
     */
    public String parentOrg;

    public String parentBuId;

    public String head;

    public List<String> members = new ArrayList<>();

    public List<String> projects = new ArrayList<>();

    public String status = "active";

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public Map<String, String> metadata = new HashMap<>();

    public BusinessUnit() {
    }
}
