package com.jreinhal.insight.conversation;

import com.jreinhal.insight.exception.ConversationNotFoundException;
import com.jreinhal.insight.model.Conversation;
import com.jreinhal.insight.model.ConversationTurn;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.repository.ConversationRepository;
import com.jreinhal.insight.repository.ConversationTurnRepository;
import com.jreinhal.insight.routing.ConversationContext;
import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.tools.ToolName;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Conversations and their immutable turns. Every method takes the conversation id
 * explicitly; there is no notion of a current conversation.
 */
@Service
public class ConversationService {
    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);
    private static final int MAX_TITLE_CHARS = 120;

    private final ConversationRepository conversationRepository;
    private final ConversationTurnRepository turnRepository;
    private final MongoTemplate mongoTemplate;
    @Value(value="${insight.router.context-messages:6}")
    private int contextMessages = 6;

    public ConversationService(ConversationRepository conversationRepository, ConversationTurnRepository turnRepository,
                               MongoTemplate mongoTemplate) {
        this.conversationRepository = conversationRepository;
        this.turnRepository = turnRepository;
        this.mongoTemplate = mongoTemplate;
    }

    public Conversation open(User owner, String title) {
        String cleanTitle = title == null || title.isBlank() ? "New conversation" : title.trim();
        if (cleanTitle.length() > MAX_TITLE_CHARS) {
            cleanTitle = cleanTitle.substring(0, MAX_TITLE_CHARS);
        }
        Conversation saved = this.conversationRepository.save(new Conversation(owner.getId(), cleanTitle));
        log.info("Conversation {} opened by {}", saved.getId(), owner.getId());
        return saved;
    }

    public List<Conversation> listFor(User owner) {
        return this.conversationRepository.findByOwnerIdOrderByCreatedAtDesc(owner.getId());
    }

    public Conversation requireOwned(String conversationId, User user) {
        if (conversationId == null || conversationId.isBlank() || user == null) {
            throw new ConversationNotFoundException(conversationId);
        }
        Optional<Conversation> found = this.conversationRepository.findById(conversationId);
        if (found.isEmpty() || !user.getId().equals(found.get().getOwnerId())) {
            throw new ConversationNotFoundException(conversationId);
        }
        return found.get();
    }

    public List<ConversationTurn> turns(String conversationId) {
        return this.turnRepository.findByConversationIdOrderByTurnIndexAsc(conversationId);
    }

    public int nextTurnIndex(String conversationId) {
        return (int) this.turnRepository.countByConversationId(conversationId);
    }

    /**
     * The last {@code contextMessages} messages of the conversation, oldest first, each turn
     * contributing the user's utterance and the reply.
     */
    public ConversationContext recentContext(String conversationId, Collection<String> visibleCategories) {
        List<ConversationContext.Message> messages = new ArrayList<ConversationContext.Message>();
        for (ConversationTurn turn : this.turns(conversationId)) {
            messages.add(new ConversationContext.Message("user", turn.getUtterance()));
            if (turn.getReply() != null) {
                messages.add(new ConversationContext.Message("assistant", turn.getReply()));
            }
        }
        int from = Math.max(0, messages.size() - this.contextMessages);
        return new ConversationContext(conversationId, messages.subList(from, messages.size()), visibleCategories == null ? null : new TreeSet<String>(visibleCategories));
    }

    /**
     * Most recent call in the conversation that the interpreter chose itself (not a fallback).
     */
    public Optional<ToolCall> lastGoodToolCall(String conversationId) {
        List<ConversationTurn> turns = this.turns(conversationId);
        for (int i = turns.size() - 1; i >= 0; --i) {
            ConversationTurn turn = turns.get(i);
            if (turn.isFallback() || turn.getToolName() == null) {
                continue;
            }
            Optional<ToolName> tool = ToolName.fromWireName(turn.getToolName());
            if (tool.isPresent()) {
                try {
                    return Optional.of(ToolCall.of(tool.get(), turn.getToolParameters()));
                }
                catch (IllegalArgumentException e) {
                    log.warn("Stored parameters of turn {} in {} are unusable: {}", turn.getTurnIndex(), conversationId, e.getMessage());
                }
            }
        }
        return Optional.empty();
    }

    public ConversationTurn appendTurn(ConversationTurn turn) {
        ConversationTurn saved = this.turnRepository.insert(turn);
        this.mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(turn.getConversationId())),
                new Update().set("updatedAt", Instant.now()), Conversation.class);
        return saved;
    }
}
