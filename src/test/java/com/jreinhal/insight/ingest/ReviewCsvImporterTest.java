package com.jreinhal.insight.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.insight.access.CategoryCatalog;
import com.jreinhal.insight.model.Category;
import com.jreinhal.insight.model.Review;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;

class ReviewCsvImporterTest {

    @Nested
    @DisplayName("Field parsing")
    class FieldParsingTest {
        @Test
        @DisplayName("Ratings are rounded and bounded")
        void ratings() {
            assertThat(ReviewCsvImporter.parseRating("4.6")).isEqualTo(5);
            assertThat(ReviewCsvImporter.parseRating(" 1 ")).isEqualTo(1);
            assertThat(ReviewCsvImporter.parseRating("0")).isNull();
            assertThat(ReviewCsvImporter.parseRating("6")).isNull();
            assertThat(ReviewCsvImporter.parseRating("five")).isNull();
            assertThat(ReviewCsvImporter.parseRating("")).isNull();
        }

        @Test
        @DisplayName("Dates accept instants, offsets and plain dates")
        void dates() {
            assertThat(ReviewCsvImporter.parseDate("2017-01-13T00:00:00.000Z")).isEqualTo(Instant.parse("2017-01-13T00:00:00Z"));
            assertThat(ReviewCsvImporter.parseDate("2017-01-13T02:00:00+02:00")).isEqualTo(Instant.parse("2017-01-13T00:00:00Z"));
            assertThat(ReviewCsvImporter.parseDate("2017-01-13")).isEqualTo(Instant.parse("2017-01-13T00:00:00Z"));
            assertThat(ReviewCsvImporter.parseDate("last week")).isNull();
        }

        @Test
        @DisplayName("One review row per valid category")
        void toReviews() {
            List<Review> reviews = ReviewCsvImporter.toReviews(Map.of("id", "p1", "name", "Echo", "categories", "Electronics,TV,Home Audio",
                    "reviews.rating", "5", "reviews.text", "Great sound", "reviews.title", "Love it"));
            assertThat(reviews).extracting(Review::getCategory).containsExactly("Electronics", "Home Audio");
            assertThat(reviews).allSatisfy(review -> assertThat(review.getTextHash()).isNotNull());
        }

        @Test
        @DisplayName("Rows without a rating or category are skipped")
        void skipped() {
            assertThat(ReviewCsvImporter.toReviews(Map.of("categories", "Electronics", "reviews.rating", ""))).isEmpty();
            assertThat(ReviewCsvImporter.toReviews(Map.of("categories", "TV", "reviews.rating", "4"))).isEmpty();
        }
    }

    @Test
    @DisplayName("Import inserts reviews and only new categories")
    @SuppressWarnings("unchecked")
    void importCsv() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        CategoryCatalog catalog = mock(CategoryCatalog.class);
        when(catalog.allCategoryNames()).thenReturn(Set.of("Electronics"));
        ReviewCsvImporter importer = new ReviewCsvImporter(mongoTemplate, catalog);
        String csv = "id,name,categories,reviews.rating,reviews.date,reviews.text,reviews.title\n"
                + "p1,Echo,\"Electronics,Home Audio\",5,2017-01-13T00:00:00.000Z,Great sound,Love it\n"
                + "p2,Kettle,Kitchen,3,2018-02-01,Fine,Ok\n"
                + "p3,Junk,Amazon.co.uk,4,,Meh,Meh\n";

        ImportResult result = importer.importCsv(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));

        assertThat(result).isEqualTo(new ImportResult(3, 1, 3, 2));
        ArgumentCaptor<Collection> reviews = ArgumentCaptor.forClass(Collection.class);
        verify(mongoTemplate).insert(reviews.capture(), eq(Review.class));
        assertThat(reviews.getValue()).hasSize(3);
        ArgumentCaptor<Collection> categories = ArgumentCaptor.forClass(Collection.class);
        verify(mongoTemplate).insert(categories.capture(), eq(Category.class));
        assertThat((Collection<Category>) categories.getValue()).extracting(Category::getName).containsExactly("Home Audio", "Kitchen");
    }
}
