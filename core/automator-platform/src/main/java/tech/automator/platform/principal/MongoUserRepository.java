package tech.automator.platform.principal;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of UserRepository.
 * Package-private to prevent direct injection - use UserRepository interface.
 */
@ApplicationScoped
@Typed(UserRepository.class)
class MongoUserRepository implements PanacheMongoRepositoryBase<User, String>, UserRepository {

    @Override
    public Optional<User> findByEmail(String email) {
        return find("email", email).firstResultOptional();
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return find("username", username).firstResultOptional();
    }

    @Override
    public List<User> findPage(int skip, int limit) {
        return findAll(Sort.descending("createdAt")).range(skip, skip + limit - 1).list();
    }

    @Override
    public long markLoggedIn(String id, Instant at) {
        return update("{'$set': {'loggedIn': true, 'security.lastLogin': ?1, "
                + "'metadata.lastActivity': ?1, 'updatedAt': ?1}}", at)
            .where("_id", id);
    }

    @Override
    public long markLoggedOut(String id, Instant at) {
        return update("{'$set': {'loggedIn': false, 'metadata.lastActivity': ?1, 'updatedAt': ?1}}", at)
            .where("_id", id);
    }

    // Delegate to Panache methods via interface
    @Override
    public Optional<User> findByIdOptional(String id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public long count() {
        return PanacheMongoRepositoryBase.super.count();
    }

    @Override
    public void persist(User user) {
        PanacheMongoRepositoryBase.super.persist(user);
    }

    @Override
    public void update(User user) {
        PanacheMongoRepositoryBase.super.update(user);
    }

    @Override
    public boolean deleteById(String id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
