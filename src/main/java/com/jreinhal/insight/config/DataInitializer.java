package com.jreinhal.insight.config;

import com.jreinhal.insight.ingest.ImportResult;
import com.jreinhal.insight.ingest.ReviewCsvImporter;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.repository.UserRepository;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * First-run setup: an admin account when the user store is empty, and the review corpus
 * when a CSV path is configured and the review collection is empty.
 */
@Configuration
public class DataInitializer {
    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    @Value("${insight.bootstrap.enabled:false}")
    private boolean bootstrapEnabled;

    @Value("${insight.bootstrap.admin-username:admin}")
    private String adminUsername;

    @Value("${insight.ingest.csv-path:}")
    private String csvPath;

    @Bean
    public CommandLineRunner initDatabase(UserRepository userRepository, ReviewCsvImporter importer, MongoTemplate mongoTemplate) {
        return args -> {
            if (!this.bootstrapEnabled) {
                log.info("Database bootstrap disabled via configuration");
                return;
            }
            if (userRepository.count() == 0L) {
                User admin = User.of(null, this.adminUsername, UserRole.ADMIN, Set.of());
                admin.setDisplayName("Bootstrap Administrator");
                userRepository.save(admin);
                log.warn("Empty user store: created admin account '{}'", this.adminUsername);
            } else {
                log.info("Database already initialized ({} users found)", userRepository.count());
            }
            if (this.csvPath == null || this.csvPath.isBlank()) {
                return;
            }
            if (mongoTemplate.getCollection("reviews").estimatedDocumentCount() > 0L) {
                log.info("Reviews already loaded; skipping CSV import");
                return;
            }
            Path path = Path.of(this.csvPath);
            if (!Files.isReadable(path)) {
                throw new IllegalStateException("Configured review CSV is not readable: " + path);
            }
            try (InputStream input = Files.newInputStream(path)) {
                ImportResult result = importer.importCsv(input);
                log.info("Loaded review corpus from {}: {}", path.getFileName(), result);
            }
            catch (IOException e) {
                throw new IllegalStateException("Review CSV import failed", e);
            }
        };
    }
}
