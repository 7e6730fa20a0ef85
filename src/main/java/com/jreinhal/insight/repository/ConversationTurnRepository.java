package com.jreinhal.insight.repository;

import com.jreinhal.insight.model.ConversationTurn;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ConversationTurnRepository extends MongoRepository<ConversationTurn, String> {

    // Replays a conversation in the order it happened.
    List<ConversationTurn> findByConversationIdOrderByTurnIndexAsc(String conversationId);

    long countByConversationId(String conversationId);
}
