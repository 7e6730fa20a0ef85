package com.jreinhal.insight.controller;

import com.jreinhal.insight.conversation.ConversationService;
import com.jreinhal.insight.filter.SecurityContext;
import com.jreinhal.insight.model.Conversation;
import com.jreinhal.insight.model.ConversationTurn;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.pipeline.AnalyticsPipeline;
import com.jreinhal.insight.pipeline.TurnOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/conversations"})
@Tag(name="Conversations")
public class ConversationController {
    private final ConversationService conversationService;
    private final AnalyticsPipeline pipeline;

    public ConversationController(ConversationService conversationService, AnalyticsPipeline pipeline) {
        this.conversationService = conversationService;
        this.pipeline = pipeline;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary="Open a conversation")
    public Conversation open(@RequestBody(required=false) OpenRequest body) {
        User user = requireUser();
        return this.conversationService.open(user, body == null ? null : body.title());
    }

    @GetMapping
    public List<Conversation> list() {
        return this.conversationService.listFor(requireUser());
    }

    @GetMapping(value={"/{id}/turns"})
    public List<ConversationTurn> turns(@PathVariable("id") String id) {
        User user = requireUser();
        this.conversationService.requireOwned(id, user);
        return this.conversationService.turns(id);
    }

    @PostMapping(value={"/{id}/messages"})
    @Operation(summary="Ask an analytics question in a conversation")
    public TurnOutcome message(@PathVariable("id") String id, @RequestBody MessageRequest body) {
        User user = requireUser();
        if (body == null || body.message() == null) {
            throw new IllegalArgumentException("Message is required");
        }
        return this.pipeline.handleMessage(id, user, body.message());
    }

    static User requireUser() {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            throw new SecurityException("No authenticated user");
        }
        return user;
    }

    public record OpenRequest(String title) {
    }

    public record MessageRequest(String message) {
    }
}
