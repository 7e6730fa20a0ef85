package com.jreinhal.insight.pipeline;

import com.jreinhal.insight.access.AccessModel;
import com.jreinhal.insight.conversation.ConversationService;
import com.jreinhal.insight.exception.TurnFailedException;
import com.jreinhal.insight.execution.DataSourceException;
import com.jreinhal.insight.execution.ToolExecutor;
import com.jreinhal.insight.execution.ToolResult;
import com.jreinhal.insight.fallback.FallbackPolicy;
import com.jreinhal.insight.model.ConversationTurn;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.routing.ConversationContext;
import com.jreinhal.insight.routing.IntentRouter;
import com.jreinhal.insight.routing.RouterDecision;
import com.jreinhal.insight.synthesis.ResponseSynthesizer;
import com.jreinhal.insight.synthesis.SynthesisRequest;
import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.trace.TraceRecorder;
import com.jreinhal.insight.trace.TraceWriteException;
import com.jreinhal.insight.trace.TurnIdentity;
import com.jreinhal.insight.util.LogSanitizer;
import com.jreinhal.insight.validation.ToolCallValidator;
import com.jreinhal.insight.validation.ValidationVerdict;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * One user message, start to finish: route, validate, fall back if needed, execute,
 * synthesize, trace, then persist the turn. Stages run strictly in sequence on the
 * calling thread. A turn aborted by the data source still stores a reply-less turn so its
 * index is not reused.
 */
@Service
public class AnalyticsPipeline {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsPipeline.class);

    private final ConversationService conversationService;
    private final AccessModel accessModel;
    private final IntentRouter intentRouter;
    private final ToolCallValidator validator;
    private final FallbackPolicy fallbackPolicy;
    private final ToolExecutor toolExecutor;
    private final ResponseSynthesizer responseSynthesizer;
    private final TraceRecorder traceRecorder;
    @Value(value="${insight.pipeline.max-utterance-chars:2000}")
    private int maxUtteranceChars = 2000;

    public AnalyticsPipeline(ConversationService conversationService, AccessModel accessModel, IntentRouter intentRouter,
                             ToolCallValidator validator, FallbackPolicy fallbackPolicy, ToolExecutor toolExecutor,
                             ResponseSynthesizer responseSynthesizer, TraceRecorder traceRecorder) {
        this.conversationService = conversationService;
        this.accessModel = accessModel;
        this.intentRouter = intentRouter;
        this.validator = validator;
        this.fallbackPolicy = fallbackPolicy;
        this.toolExecutor = toolExecutor;
        this.responseSynthesizer = responseSynthesizer;
        this.traceRecorder = traceRecorder;
    }

    public TurnOutcome handleMessage(String conversationId, User user, String utterance) {
        if (utterance == null || utterance.isBlank()) {
            throw new IllegalArgumentException("Message must not be empty");
        }
        if (utterance.length() > this.maxUtteranceChars) {
            throw new IllegalArgumentException("Message exceeds " + this.maxUtteranceChars + " characters");
        }
        if (user == null || !user.hasPermission(UserRole.Permission.QUERY)) {
            throw new SecurityException("Querying requires QUERY permission");
        }
        this.conversationService.requireOwned(conversationId, user);
        String message = utterance.trim();
        int turnIndex = this.conversationService.nextTurnIndex(conversationId);
        TurnIdentity turn = new TurnIdentity(UUID.randomUUID().toString(), conversationId, turnIndex, user,
                this.accessModel.currentAccessVersion(user), message);
        Map<String, Long> durations = new LinkedHashMap<String, Long>();

        long started = System.nanoTime();
        Set<String> visible = this.accessModel.resolveVisibleCategories(user);
        ConversationContext context = this.conversationService.recentContext(conversationId, visible);
        RouterDecision decision = this.intentRouter.route(message, context);
        started = lap(durations, "route", started);

        ValidationVerdict verdict = this.validator.validate(decision, user);
        started = lap(durations, "validate", started);

        ToolCall finalCall;
        if (verdict instanceof ValidationVerdict.Validated validated) {
            finalCall = validated.call();
        } else {
            ToolCall lastGood = this.conversationService.lastGoodToolCall(conversationId).orElse(null);
            finalCall = this.fallbackPolicy.resolve((ValidationVerdict.Rejected) verdict, user, lastGood);
            started = lap(durations, "fallback", started);
        }

        ToolResult result;
        try {
            result = this.toolExecutor.execute(finalCall, user);
        }
        catch (DataSourceException | DataAccessException e) {
            lap(durations, "execute", started);
            log.error("Turn {} in conversation {} aborted by data source failure: {}", turn.traceId(), conversationId, e.getMessage());
            try {
                this.traceRecorder.recordFailure(turn, decision, verdict, finalCall, e.getMessage(), durations);
            }
            catch (TraceWriteException traceFailure) {
                e.addSuppressed(traceFailure);
            }
            try {
                this.conversationService.appendTurn(ConversationTurn.failed(conversationId, turnIndex, user.getId(), message, turn.traceId()));
            }
            catch (DataAccessException turnFailure) {
                e.addSuppressed(turnFailure);
            }
            throw new TurnFailedException(turn.traceId(), e);
        }
        started = lap(durations, "execute", started);

        String reply = this.responseSynthesizer.synthesize(new SynthesisRequest(message, finalCall, result));
        lap(durations, "synthesize", started);

        try {
            this.traceRecorder.record(turn, decision, verdict, finalCall, result, durations);
        }
        catch (TraceWriteException e) {
            throw new TurnFailedException(turn.traceId(), e);
        }
        String reasonCode = finalCall.rejectionReason() == null ? null : finalCall.rejectionReason().code();
        this.conversationService.appendTurn(new ConversationTurn(conversationId, turnIndex, user.getId(), message,
                finalCall.tool().wireName(), finalCall.parameters(), finalCall.fallback(), reasonCode, reply, turn.traceId()));
        log.info("Turn {} of {} by {}: {} -> {} (fallback={}, verdict={}) {}", turnIndex, conversationId, user.getId(),
                LogSanitizer.querySummary(message), finalCall.tool().wireName(), finalCall.fallback(), verdict.outcome(), durations);
        return new TurnOutcome(turn.traceId(), conversationId, turnIndex, finalCall.tool().wireName(), finalCall.parameters(),
                finalCall.fallback(), reasonCode, verdict.outcome().name(), reply, result.kind(), result);
    }

    private static long lap(Map<String, Long> durations, String stage, long startedNanos) {
        long now = System.nanoTime();
        durations.put(stage, (now - startedNanos) / 1_000_000L);
        return now;
    }
}
