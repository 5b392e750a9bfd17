package tech.automator.platform.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.bson.Document;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Creates the MongoDB indexes backing uniqueness rules and lookups on startup.
 * {@code createIndex} is a no-op for indexes that already exist.
 */
@ApplicationScoped
public class MongoIndexInitializer {

    private static final Logger LOG = Logger.getLogger(MongoIndexInitializer.class);

    @Inject
    MongoClient mongoClient;

    @ConfigProperty(name = "quarkus.mongodb.database")
    String databaseName;

    void onStart(@Observes StartupEvent ev) {
        LOG.info("Initializing MongoDB indexes...");
        MongoDatabase db = mongoClient.getDatabase(databaseName);

        createUserIndexes(db);
        createOrganizationIndexes(db);
        createBusinessUnitIndexes(db);
        createProjectIndexes(db);
        createModuleIndexes(db);

        LOG.info("MongoDB indexes initialized successfully");
    }

    private void createUserIndexes(MongoDatabase db) {
        MongoCollection<Document> users = db.getCollection("users");
        users.createIndex(Indexes.ascending("email"), opt().unique(true));
        users.createIndex(Indexes.ascending("username"), opt().unique(true));
        users.createIndex(Indexes.ascending("orgId"), opt());
    }

    private void createOrganizationIndexes(MongoDatabase db) {
        MongoCollection<Document> organizations = db.getCollection("organizations");
        organizations.createIndex(Indexes.ascending("name"), opt().unique(true));
        organizations.createIndex(Indexes.descending("createdAt"), opt());
    }

    private void createBusinessUnitIndexes(MongoDatabase db) {
        MongoCollection<Document> units = db.getCollection("business_units");
        units.createIndex(
            Indexes.compoundIndex(Indexes.ascending("parentOrg"), Indexes.ascending("name")),
            opt().unique(true));
        units.createIndex(Indexes.ascending("parentBuId"), opt().sparse(true));
    }

    private void createProjectIndexes(MongoDatabase db) {
        MongoCollection<Document> projects = db.getCollection("projects");
        projects.createIndex(
            Indexes.compoundIndex(Indexes.ascending("orgId"), Indexes.ascending("name")),
            opt().unique(true));
    }

    private void createModuleIndexes(MongoDatabase db) {
        MongoCollection<Document> modules = db.getCollection("modules");
        modules.createIndex(
            Indexes.compoundIndex(Indexes.ascending("projectId"), Indexes.ascending("name")),
            opt().unique(true));
    }

    private static IndexOptions opt() {
        return new IndexOptions().background(true);
    }
}
