package tech.automator.platform.principal;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;
import tech.automator.platform.shared.Address;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A user account: credentials, status flags and tenant affiliation.
 *
 * The five status flags are independent. Login checks active, banned and suspended
 * separately and in that order.
 */
@MongoEntity(collection = "users")
public class User extends PanacheMongoEntityBase {

    @BsonId
    public String id;

    /**
     * Always stored lowercased.
     */
    public String email;

    public String username;

    public UserProfile profile = new UserProfile();

    public Address address = new Address();

    public UserPreferences preferences = UserPreferences.defaults();

    public UserSecurity security = new UserSecurity();

    public String orgId;

    public List<String> businessUnitIds = new ArrayList<>();

    public Membership membership = Membership.free(Instant.now());

    public List<String> roles = new ArrayList<>(List.of("user"));

    public List<String> groups = new ArrayList<>();

    public List<String> tags = new ArrayList<>(List.of("new_user"));

    public boolean active = true;

    public boolean banned;

    public boolean suspended;

    public boolean loggedIn;

    public boolean deleted;

    public UserMetadata metadata = new UserMetadata();

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public User() {
    }

    public boolean hasOrganization() {
        return orgId != null && !orgId.isBlank();
    }

    public boolean emailVerified() {
        return security != null && security.emailVerified;
    }

    public String passwordHash() {
        return security != null ? security.passwordHash : null;
    }
}
