package com.jreinhal.insight.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.insight.tools.ParameterSpec;
import com.jreinhal.insight.tools.ToolRegistry;
import com.jreinhal.insight.tools.ToolSchema;
import com.jreinhal.insight.util.LogSanitizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Asks the interpreter which tool answers an utterance.
 *
 * <p>Attempts run on the {@code interpreterExecutor} pool through {@link RetryPolicy}, which
 * bounds each one with a timeout and the whole call with a deadline. Transient failures are
 * retried with backoff, and the router never throws: exhaustion or a non-transient error
 * yields {@link RouterDecision.Unavailable}.</p>
 */
@Service
public class IntentRouter {
    private static final Logger log = LoggerFactory.getLogger(IntentRouter.class);
    private static final int MAX_PROMPT_CATEGORIES = 200;
    private static final String ROUTER_RULES = "You are a routing function for a product-review analytics service.\n"
            + "Read the user's message and the recent conversation, then choose exactly ONE tool from the catalog.\n"
            + "Reply with JSON only, no markdown:\n"
            + "{\"tool\": \"<tool name>\", \"args\": {...}, \"confidence\": <0..1>, \"ambiguous\": <true|false>, \"rationale\": \"short\"}\n"
            + "Rules:\n"
            + "- \"why\", \"reasons\", \"complaints\", \"main issues\" -> sentiment_summary.\n"
            + "- \"top\", \"best\", \"worst\", \"NPS\", \"highest rated\" -> metrics_top_categories.\n"
            + "- \"distribution\", \"histogram\", \"breakdown of ratings\" -> rating_distribution.\n"
            + "- \"compare\", \"versus\", \"vs\" -> compare_categories.\n"
            + "- Counting or listing categories, or general statistics -> general_query.\n"
            + "- Categories must be copied exactly from allowed_categories.\n"
            + "- If the request is unclear, set \"ambiguous\": true and leave \"tool\" empty.\n";

    private final InterpreterClient interpreterClient;
    private final InterpreterResponseParser responseParser;
    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final ExecutorService interpreterExecutor;
    private final RetryPolicy retryPolicy;
    @Value(value="${insight.router.context-messages:6}")
    private int contextMessages = 6;

    public IntentRouter(InterpreterClient interpreterClient, InterpreterResponseParser responseParser, ToolRegistry toolRegistry,
                        ObjectMapper objectMapper, @Qualifier("interpreterExecutor") ExecutorService interpreterExecutor,
                        RetryPolicy retryPolicy) {
        this.interpreterClient = interpreterClient;
        this.responseParser = responseParser;
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.interpreterExecutor = interpreterExecutor;
        this.retryPolicy = retryPolicy;
    }

    public RouterDecision route(String utterance, ConversationContext context) {
        InterpreterRequest request;
        try {
            request = new InterpreterRequest(this.systemPrompt(), this.userPayload(utterance, context));
        }
        catch (JsonProcessingException e) {
            log.error("Failed to serialize router payload: {}", e.getOriginalMessage());
            return new RouterDecision.Unavailable("router payload could not be serialized", 0);
        }
        InterpreterRequest attemptRequest = request;
        long startNanos = System.nanoTime();
        RetryPolicy.Attempts attempts = new RetryPolicy.Attempts();
        try {
            String raw = this.retryPolicy.execute("interpreter", this.interpreterExecutor,
                    () -> this.interpreterClient.propose(attemptRequest), IntentRouter::isTransient, attempts);
            RouterDecision decision = this.responseParser.parse(raw);
            log.info("Routed {} -> {} (attempt {}, {}ms)", LogSanitizer.querySummary(utterance), decisionLabel(decision), attempts.count(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            return decision;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new RouterDecision.Unavailable("interrupted", attempts.count());
        }
        catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                return new RouterDecision.Unavailable("interrupted", attempts.count());
            }
            if (!(e instanceof RetryPolicy.DeadlineExceededException) && !isTransient(e)) {
                log.warn("Interpreter attempt {} failed permanently: {}", attempts.count(), e.getClass().getSimpleName());
                return new RouterDecision.Unavailable("non-transient interpreter failure: " + describe(e), attempts.count());
            }
            String lastFailure = e instanceof TimeoutException
                    ? "attempt timed out after " + this.retryPolicy.attemptTimeoutMs() + "ms"
                    : describe(e);
            if (attempts.deadlineReached()) {
                lastFailure = lastFailure + "; deadline reached before retry";
            }
            log.warn("Interpreter unavailable after {} attempt(s): {}", attempts.count(), LogSanitizer.sanitize(lastFailure));
            return new RouterDecision.Unavailable(lastFailure, attempts.count());
        }
    }

    String systemPrompt() {
        StringBuilder sb = new StringBuilder(ROUTER_RULES);
        sb.append("Tool catalog:\n");
        for (ToolSchema schema : this.toolRegistry.catalog()) {
            sb.append("- ").append(schema.name()).append(": ").append(schema.description()).append(" args: ");
            List<String> params = new ArrayList<String>();
            for (ParameterSpec spec : schema.parameters()) {
                params.add(describe(spec));
            }
            sb.append(params.isEmpty() ? "none" : String.join("; ", params)).append('\n');
        }
        return sb.toString();
    }

    String userPayload(String utterance, ConversationContext context) throws JsonProcessingException {
        LinkedHashMap<String, Object> payload = new LinkedHashMap<String, Object>();
        List<String> categories = new ArrayList<String>(new TreeSet<String>(context.visibleCategories()));
        payload.put("allowed_categories", categories.size() > MAX_PROMPT_CATEGORIES ? categories.subList(0, MAX_PROMPT_CATEGORIES) : categories);
        List<ConversationContext.Message> recent = context.recentMessages();
        int from = Math.max(0, recent.size() - this.contextMessages);
        List<Map<String, String>> messages = new ArrayList<Map<String, String>>();
        for (ConversationContext.Message message : recent.subList(from, recent.size())) {
            messages.add(Map.of("role", message.role(), "content", message.content() == null ? "" : message.content()));
        }
        payload.put("recent_messages", messages);
        payload.put("user_message", utterance == null ? "" : utterance);
        return this.objectMapper.writeValueAsString(payload);
    }

    private static String describe(ParameterSpec spec) {
        StringBuilder sb = new StringBuilder(spec.name());
        switch (spec.kind()) {
            case INTEGER -> sb.append(" int ").append(spec.min()).append("-").append(spec.max()).append(" default ").append(spec.defaultValue());
            case ENUM -> sb.append(" one of ").append(spec.allowedValues()).append(" default ").append(spec.defaultValue());
            case CATEGORY -> sb.append(" category");
            case CATEGORY_LIST -> sb.append(" list of categories");
        }
        if (spec.required()) {
            sb.append(" (required)");
        }
        return sb.toString();
    }

    private static boolean isTransient(Throwable cause) {
        return cause instanceof InterpreterTransientException || cause instanceof TimeoutException
                || cause instanceof RejectedExecutionException || cause instanceof IOException
                || cause instanceof UncheckedIOException;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown failure";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static String decisionLabel(RouterDecision decision) {
        if (decision instanceof RouterDecision.Proposal proposal) {
            return proposal.tool().wireName();
        }
        if (decision instanceof RouterDecision.Unknown unknown) {
            return "unknown(" + LogSanitizer.sanitize(unknown.rawToolName()) + ")";
        }
        return "unavailable";
    }

}
