package tech.automator.platform.principal;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for User entities.
 * Exposes only approved data access methods - Panache internals are hidden.
 */
public interface UserRepository {

    // Read operations
    Optional<User> findByIdOptional(String id);
    Optional<User> findByEmail(String email);
    Optional<User> findByUsername(String username);
    List<User> findPage(int skip, int limit);
    long count();

    // Write operations
    void persist(User user);
    void update(User user);
    boolean deleteById(String id);

    // Session bookkeeping, targeted so concurrent profile edits are not overwritten
    long markLoggedIn(String id, Instant at);
    long markLoggedOut(String id, Instant at);
}
