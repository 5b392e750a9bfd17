package tech.automator.platform.principal;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.shared.Address;
import tech.automator.platform.shared.EmailAddresses;
import tech.automator.platform.shared.ErrorCode;
import tech.automator.platform.shared.ErrorDetail;
import tech.automator.platform.shared.Page;
import tech.automator.platform.shared.PageRequest;
import tech.automator.platform.shared.PartialUpdate;
import tech.automator.platform.shared.ServiceResult;
import tech.automator.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service for user account CRUD operations.
 * Used by self-registration and by the admin user endpoints.
 */
@ApplicationScoped
public class UserService {

    private static final Logger LOG = Logger.getLogger(UserService.class);

    @Inject
    UserRepository userRepository;

    @Inject
    PasswordService passwordService;

    // ==================== Create ====================

    /**
     * Create a user account.
     *
     * @param request            the user payload; email, username and password are required
     * @param privileged         whether the caller may set roles, status flags and verification state;
     *                           when false those fall back to the defaults for a new account
     * @param registrationSource recorded in the user's metadata
     */
    public ServiceResult<UserView> createUser(UserRequest request, boolean privileged, String registrationSource) {
        List<ErrorDetail> missing = new ArrayList<>();
        if (isBlank(request.email())) {
            missing.add(ErrorDetail.of(ErrorCode.MISSING_REQUIRED_FIELDS, "Email is required", "email"));
        }
        if (isBlank(request.username())) {
            missing.add(ErrorDetail.of(ErrorCode.MISSING_REQUIRED_FIELDS, "Username is required", "username"));
        }
        if (isBlank(request.password())) {
            missing.add(ErrorDetail.of(ErrorCode.MISSING_REQUIRED_FIELDS, "Password is required", "password"));
        }
        if (!missing.isEmpty()) {
            return ServiceResult.failure(ErrorCode.MISSING_REQUIRED_FIELDS, missing);
        }

        String email = EmailAddresses.normalize(request.email());
        if (!EmailAddresses.isValid(email)) {
            return ServiceResult.failure(ErrorCode.INVALID_EMAIL_FORMAT);
        }
        if (!passwordService.meetsPolicy(request.password())) {
            return ServiceResult.failure(ErrorCode.INVALID_PASSWORD);
        }
        String username = request.username().trim();

        if (userRepository.findByEmail(email).isPresent()) {
            LOG.warnf("User creation refused: email %s already registered", email);
            return ServiceResult.failure(ErrorCode.EMAIL_ALREADY_EXISTS);
        }
        if (userRepository.findByUsername(username).isPresent()) {
            LOG.warnf("User creation refused: username %s already taken", username);
            return ServiceResult.failure(ErrorCode.USERNAME_ALREADY_EXISTS);
        }

        String passwordHash;
        try {
            passwordHash = passwordService.hash(request.password());
        } catch (PasswordHashingException e) {
            LOG.errorf(e, "Password hashing failed for new user %s", email);
            return ServiceResult.failure(ErrorCode.PASSWORD_ENCRYPTION_ERROR);
        }

        Instant now = Instant.now();
        User user = new User();
        user.id = TsidGenerator.generate();
        user.email = email;
        user.username = username;
        if (request.profile() != null) {
            user.profile = request.profile();
        }
        if (request.address() != null) {
            user.address = request.address();
        }
        if (request.preferences() != null) {
            user.preferences = withDefaults(request.preferences());
        }
        user.security.passwordHash = passwordHash;
        user.orgId = request.orgId();
        if (request.businessUnitIds() != null) {
            user.businessUnitIds = new ArrayList<>(request.businessUnitIds());
        }
        if (request.membership() != null) {
            user.membership = request.membership();
        }
        if (request.groups() != null) {
            user.groups = new ArrayList<>(request.groups());
        }
        if (request.tags() != null && !request.tags().isEmpty()) {
            user.tags = new ArrayList<>(request.tags());
        }

        if (privileged) {
            if (request.roles() != null && !request.roles().isEmpty()) {
                user.roles = new ArrayList<>(request.roles());
            }
            if (request.isActive() != null) {
                user.active = request.isActive();
            }
            if (request.isBanned() != null) {
                user.banned = request.isBanned();
            }
            if (request.isSuspended() != null) {
                user.suspended = request.isSuspended();
            }
            UserRequest.SecurityInput security = request.security();
            if (security != null) {
                user.security.emailVerified = Boolean.TRUE.equals(security.isEmailVerified());
                user.security.phoneVerified = Boolean.TRUE.equals(security.isPhoneVerified());
                user.security.mfaEnabled = Boolean.TRUE.equals(security.mfaEnabled());
            }
        }

        user.metadata.registrationSource = registrationSource;
        user.metadata.lastActivity = now;
        user.createdAt = now;
        user.updatedAt = now;

        try {
            userRepository.persist(user);
        } catch (MongoWriteException e) {
            if (isDuplicateKey(e)) {
                LOG.warnf("User creation lost a race on unique email/username for %s", email);
                return ServiceResult.failure(ErrorCode.USER_ALREADY_EXISTS);
            }
            throw e;
        }

        LOG.infof("User %s created [source=%s]", user.id, registrationSource);
        return ServiceResult.success(UserView.from(user));
    }

    // ==================== Read ====================

    public ServiceResult<UserView> getUser(String userId) {
        return findUser(userId).map(UserView::from);
    }

    /**
     * List users, newest first.
     */
    public ServiceResult<Page<UserView>> listUsers(PageRequest page) {
        List<UserView> items = userRepository.findPage(page.skip(), page.limit()).stream()
            .map(UserView::from)
            .toList();
        return ServiceResult.success(Page.of(items, userRepository.count(), page));
    }

    // ==================== Update ====================

    /**
     * Apply the supplied fields to an existing user.
     * Embedded fields can only be patched when the record already carries the enclosing structure.
     * A new password replaces the stored hash wholesale.
     */
    public ServiceResult<UserView> updateUser(AuthenticatedPrincipal caller, String userId, UserRequest request) {
        ServiceResult<User> loaded = findUser(userId);
        if (!loaded.isSuccess()) {
            return loaded.map(UserView::from);
        }
        User user = loaded.value();

        String email = null;
        if (request.email() != null) {
            email = EmailAddresses.normalize(request.email());
            if (!EmailAddresses.isValid(email)) {
                return ServiceResult.failure(ErrorCode.INVALID_EMAIL_FORMAT);
            }
            Optional<User> sameEmail = userRepository.findByEmail(email);
            if (sameEmail.isPresent() && !sameEmail.get().id.equals(user.id)) {
                return ServiceResult.failure(ErrorCode.EMAIL_ALREADY_EXISTS);
            }
        }
        String username = null;
        if (request.username() != null) {
            username = request.username().trim();
            if (username.isEmpty()) {
                return ServiceResult.failure(ErrorCode.MISSING_REQUIRED_FIELDS, "username");
            }
            Optional<User> sameUsername = userRepository.findByUsername(username);
            if (sameUsername.isPresent() && !sameUsername.get().id.equals(user.id)) {
                return ServiceResult.failure(ErrorCode.USERNAME_ALREADY_EXISTS);
            }
        }

        String passwordHash = null;
        if (request.password() != null) {
            if (!passwordService.meetsPolicy(request.password())) {
                return ServiceResult.failure(ErrorCode.INVALID_PASSWORD);
            }
            try {
                passwordHash = passwordService.hash(request.password());
            } catch (PasswordHashingException e) {
                LOG.errorf(e, "Password hashing failed while updating user %s", user.id);
                return ServiceResult.failure(ErrorCode.PASSWORD_ENCRYPTION_ERROR);
            }
        }

        PartialUpdate update = PartialUpdate.builder()
            .field("email", email, user.email, v -> user.email = v)
            .field("username", username, user.username, v -> user.username = v)
            .field("org_id", request.orgId(), user.orgId, v -> user.orgId = v)
            .field("business_unit_ids", request.businessUnitIds(), user.businessUnitIds,
                v -> user.businessUnitIds = new ArrayList<>(v))
            .field("roles", request.roles(), user.roles, v -> user.roles = new ArrayList<>(v))
            .field("groups", request.groups(), user.groups, v -> user.groups = new ArrayList<>(v))
            .field("tags", request.tags(), user.tags, v -> user.tags = new ArrayList<>(v))
            .field("is_active", request.isActive(), user.active, v -> user.active = v)
            .field("is_banned", request.isBanned(), user.banned, v -> user.banned = v)
            .field("is_suspended", request.isSuspended(), user.suspended, v -> user.suspended = v);

        patchProfile(update, user, request.profile());
        patchAddress(update, user, request.address());
        patchPreferences(update, user, request.preferences());
        patchSecurity(update, user, request.security(), passwordHash);
        patchMembership(update, user, request.membership());

        ServiceResult<List<String>> changed = update.apply();
        if (!changed.isSuccess()) {
            return changed.map(fields -> UserView.from(user));
        }

        user.updatedAt = Instant.now();
        try {
            userRepository.update(user);
        } catch (MongoWriteException e) {
            if (isDuplicateKey(e)) {
                LOG.warnf("Update of user %s lost a race on unique email/username", user.id);
                return ServiceResult.failure(ErrorCode.USER_ALREADY_EXISTS);
            }
            throw e;
        }
        LOG.infof("User %s updated by %s: %s", user.id, caller.userId(), changed.value());
        return ServiceResult.success(UserView.from(user));
    }

    // ==================== Delete ====================

    public ServiceResult<Void> deleteUser(AuthenticatedPrincipal caller, String userId) {
        ServiceResult<User> loaded = findUser(userId);
        if (!loaded.isSuccess()) {
            return loaded.map(user -> null);
        }
        userRepository.deleteById(loaded.value().id);
        LOG.infof("User %s deleted by %s", userId, caller.userId());
        return ServiceResult.success(null);
    }

    // ==================== Embedded patches ====================

    private static void patchProfile(PartialUpdate update, User user, UserProfile patch) {
        if (patch == null) {
            return;
        }
        boolean present = user.profile != null;
        UserProfile current = present ? user.profile : new UserProfile();
        update
            .field("profile.first_name", present, patch.firstName, current.firstName, v -> user.profile.firstName = v)
            .field("profile.last_name", present, patch.lastName, current.lastName, v -> user.profile.lastName = v)
            .field("profile.display_name", present, patch.displayName, current.displayName,
                v -> user.profile.displayName = v)
            .field("profile.avatar_url", present, patch.avatarUrl, current.avatarUrl, v -> user.profile.avatarUrl = v)
            .field("profile.phone", present, patch.phone, current.phone, v -> user.profile.phone = v)
            .field("profile.date_of_birth", present, patch.dateOfBirth, current.dateOfBirth,
                v -> user.profile.dateOfBirth = v)
            .field("profile.gender", present, patch.gender, current.gender, v -> user.profile.gender = v)
            .field("profile.bio", present, patch.bio, current.bio, v -> user.profile.bio = v);
    }

    private static void patchAddress(PartialUpdate update, User user, Address patch) {
        if (patch == null) {
            return;
        }
        boolean present = user.address != null;
        Address current = present ? user.address : new Address();
        update
            .field("address.street", present, patch.street, current.street, v -> user.address.street = v)
            .field("address.city", present, patch.city, current.city, v -> user.address.city = v)
            .field("address.state", present, patch.state, current.state, v -> user.address.state = v)
            .field("address.postal_code", present, patch.postalCode, current.postalCode,
                v -> user.address.postalCode = v)
            .field("address.country", present, patch.country, current.country, v -> user.address.country = v);
    }

    private static void patchPreferences(PartialUpdate update, User user, UserPreferences patch) {
        if (patch == null) {
            return;
        }
        boolean present = user.preferences != null;
        UserPreferences current = present ? user.preferences : new UserPreferences();
        update
            .field("preferences.language", present, patch.language, current.language,
                v -> user.preferences.language = v)
            .field("preferences.timezone", present, patch.timezone, current.timezone,
                v -> user.preferences.timezone = v)
            .field("preferences.theme", present, patch.theme, current.theme, v -> user.preferences.theme = v)
            .field("preferences.notifications_enabled", present, patch.notificationsEnabled,
                current.notificationsEnabled, v -> user.preferences.notificationsEnabled = v);
    }

    private static void patchSecurity(PartialUpdate update, User user, UserRequest.SecurityInput patch,
                                      String passwordHash) {
        boolean present = user.security != null;
        UserSecurity current = present ? user.security : new UserSecurity();
        update.field("password", present, passwordHash, current.passwordHash, v -> user.security.passwordHash = v);
        if (patch == null) {
            return;
        }
        update
            .field("security.is_email_verified", present, patch.isEmailVerified(), current.emailVerified,
                v -> user.security.emailVerified = v)
            .field("security.is_phone_verified", present, patch.isPhoneVerified(), current.phoneVerified,
                v -> user.security.phoneVerified = v)
            .field("security.mfa_enabled", present, patch.mfaEnabled(), current.mfaEnabled,
                v -> user.security.mfaEnabled = v);
    }

    private static void patchMembership(PartialUpdate update, User user, Membership patch) {
        if (patch == null) {
            return;
        }
        boolean present = user.membership != null;
        Membership current = present ? user.membership : new Membership();
        update
            .field("membership.plan", present, patch.plan, current.plan, v -> user.membership.plan = v)
            .field("membership.status", present, patch.status, current.status, v -> user.membership.status = v)
            .field("membership.started_at", present, patch.startedAt, current.startedAt,
                v -> user.membership.startedAt = v)
            .field("membership.expires_at", present, patch.expiresAt, current.expiresAt,
                v -> user.membership.expiresAt = v);
    }

    // ==================== Helpers ====================

    private ServiceResult<User> findUser(String userId) {
        if (isBlank(userId)) {
            return ServiceResult.failure(ErrorCode.USER_NOT_FOUND);
        }
        return userRepository.findByIdOptional(userId.trim())
            .map(ServiceResult::success)
            .orElseGet(() -> ServiceResult.failure(ErrorCode.USER_NOT_FOUND));
    }

    private static UserPreferences withDefaults(UserPreferences supplied) {
        UserPreferences preferences = UserPreferences.defaults();
        if (supplied.language != null) {
            preferences.language = supplied.language;
        }
        if (supplied.timezone != null) {
            preferences.timezone = supplied.timezone;
        }
        if (supplied.theme != null) {
            preferences.theme = supplied.theme;
        }
        if (supplied.notificationsEnabled != null) {
            preferences.notificationsEnabled = supplied.notificationsEnabled;
        }
        return preferences;
    }

    private static boolean isDuplicateKey(MongoWriteException e) {
        return e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
