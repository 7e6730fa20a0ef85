package com.jreinhal.insight.repository;

import com.jreinhal.insight.model.Conversation;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ConversationRepository extends MongoRepository<Conversation, String> {

    List<Conversation> findByOwnerIdOrderByCreatedAtDesc(String ownerId);
}
