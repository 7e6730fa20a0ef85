package com.jreinhal.insight.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.jreinhal.insight.access.CategoryCatalog;
import com.jreinhal.insight.model.Category;
import com.jreinhal.insight.model.Review;
import com.jreinhal.insight.util.LogSanitizer;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

/**
 * Loads the product review export (Datafiniti layout: {@code id}, {@code name},
 * {@code categories}, {@code reviews.rating}, {@code reviews.date}, {@code reviews.text},
 * {@code reviews.title}) into one review document per (review, category) and upserts the
 * category catalog.
 */
@Service
public class ReviewCsvImporter {
    private static final Logger log = LoggerFactory.getLogger(ReviewCsvImporter.class);
    private static final int BATCH_SIZE = 1000;

    private final MongoTemplate mongoTemplate;
    private final CategoryCatalog categoryCatalog;
    private final CsvMapper csvMapper = new CsvMapper();

    public ReviewCsvImporter(MongoTemplate mongoTemplate, CategoryCatalog categoryCatalog) {
        this.mongoTemplate = mongoTemplate;
        this.categoryCatalog = categoryCatalog;
    }

    public ImportResult importCsv(InputStream input) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        int rowsRead = 0;
        int rowsSkipped = 0;
        int inserted = 0;
        Set<String> seenCategories = new TreeSet<String>();
        List<Review> batch = new ArrayList<Review>(BATCH_SIZE);
        try (MappingIterator<Map<String, String>> rows = this.csvMapper.readerForMapOf(String.class).with(schema).readValues(input)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                ++rowsRead;
                List<Review> reviews = toReviews(row);
                if (reviews.isEmpty()) {
                    ++rowsSkipped;
                    continue;
                }
                for (Review review : reviews) {
                    seenCategories.add(review.getCategory());
                    batch.add(review);
                }
                if (batch.size() >= BATCH_SIZE) {
                    inserted += this.flush(batch);
                }
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Review CSV could not be read", e);
        }
        inserted += this.flush(batch);
        int created = this.upsertCategories(seenCategories);
        log.info("Review import: {} rows read, {} skipped, {} review rows inserted, {} new categories", rowsRead, rowsSkipped, inserted, created);
        return new ImportResult(rowsRead, rowsSkipped, inserted, created);
    }

    static List<Review> toReviews(Map<String, String> row) {
        Integer rating = parseRating(row.get("reviews.rating"));
        List<String> categories = CategoryNameFilter.extract(row.get("categories"));
        if (rating == null || categories.isEmpty()) {
            return List.of();
        }
        String text = row.get("reviews.text");
        String hash = text == null || text.isBlank() ? null : LogSanitizer.textHash(text);
        Instant date = parseDate(row.get("reviews.date"));
        List<Review> reviews = new ArrayList<Review>(categories.size());
        for (String category : categories) {
            reviews.add(new Review(row.get("id"), row.get("name"), category, rating, date, text, row.get("reviews.title"), hash));
        }
        return reviews;
    }

    static Integer parseRating(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || value < 1.0 || value > 5.0) {
                return null;
            }
            return (int) Math.round(value);
        }
        catch (NumberFormatException e) {
            return null;
        }
    }

    static Instant parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return Instant.parse(value);
        }
        catch (DateTimeParseException e) {
            log.trace("Not an ISO instant: {}", LogSanitizer.sanitize(value));
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        }
        catch (DateTimeParseException e) {
            log.trace("Not an offset date-time: {}", LogSanitizer.sanitize(value));
        }
        try {
            return LocalDate.parse(value.length() >= 10 ? value.substring(0, 10) : value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        catch (DateTimeParseException e) {
            return null;
        }
    }

    private int flush(List<Review> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        int size = batch.size();
        this.mongoTemplate.insert(new ArrayList<Review>(batch), Review.class);
        batch.clear();
        return size;
    }

    private int upsertCategories(Set<String> names) {
        Set<String> existing = new HashSet<String>(this.categoryCatalog.allCategoryNames());
        List<Category> created = new ArrayList<Category>();
        for (String name : names) {
            if (!existing.contains(name)) {
                created.add(new Category(name));
            }
        }
        if (!created.isEmpty()) {
            this.mongoTemplate.insert(created, Category.class);
        }
        return created.size();
    }
}
