package com.jreinhal.insight.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One review as seen from one of its categories. A review listed under three
 * categories is stored three times.
 */
@Document(collection = "reviews")
public class Review {

    @Id
    private String id;
    private String productId;
    private String productName;
    @Indexed
    private String category;
    private int rating;
    private Instant reviewDate;
    private String reviewText;
    private String reviewTitle;
    private String textHash;

    public Review() {}

    public Review(String productId, String productName, String category, int rating, Instant reviewDate,
                  String reviewText, String reviewTitle, String textHash) {
        this.productId = productId;
        this.productName = productName;
        this.category = category;
        this.rating = rating;
        this.reviewDate = reviewDate;
        this.reviewText = reviewText;
        this.reviewTitle = reviewTitle;
        this.textHash = textHash;
    }

    public String getId() { return id; }
    public String getProductId() { return productId; }
    public String getProductName() { return productName; }
    public String getCategory() { return category; }
    public int getRating() { return rating; }
    public Instant getReviewDate() { return reviewDate; }
    public String getReviewText() { return reviewText; }
    public String getReviewTitle() { return reviewTitle; }
    public String getTextHash() { return textHash; }
}
