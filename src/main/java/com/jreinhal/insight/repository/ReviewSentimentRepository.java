package com.jreinhal.insight.repository;

import com.jreinhal.insight.model.ReviewSentiment;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface ReviewSentimentRepository extends MongoRepository<ReviewSentiment, String> {

    List<ReviewSentiment> findByTextHashIn(Collection<String> textHashes);
}
