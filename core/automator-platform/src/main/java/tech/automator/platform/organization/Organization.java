package tech.automator.platform.organization;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;
import tech.automator.platform.shared.Address;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A tenant. Business units and projects belong to exactly one organization.
 */
@MongoEntity(collection = "organizations")
public class Organization extends PanacheMongoEntityBase {

    public static final String STATUS_ACTIVE = "active";

    @BsonId
    public String id;

    /**
     * Globally unique.
     */
    public String name;

    public String shortName;

    public String description;

    public String primaryContact;

    public String email;

    public String website;

    public Address address;

    public String parentOrgId;

    /**
     * active, inactive or dissolved. Only "active" organizations may act as a caller's tenant.
     */
    public String status = STATUS_ACTIVE;

    public boolean active = true;

    /**
     * Denormalized business unit ids, kept in step on a best-effort basis.
     */
    public List<String> businessUnits = new ArrayList<>();

    public List<String> members = new ArrayList<>();

    /**
     * Denormalized project ids, kept in step on a best-effort basis.
     */
    public List<String> projects = new ArrayList<>();

    public Instant establishedDate;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public Map<String, String> metadata = new HashMap<>();

    public Organization() {
    }
}
