package com.jreinhal.insight.sentiment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.insight.routing.RetryPolicy;
import com.jreinhal.insight.routing.SpringAiInterpreterClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Labels review texts with the chat model: one request per batch, a JSON array of
 * {@code {idx, sentiment, reasons}} back. Attempts share the router's timeout, deadline and
 * backoff settings. A batch that cannot be labelled yields an empty list and its reviews stay
 * unlabelled.
 */
@Component
public class ReviewSentimentAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ReviewSentimentAnalyzer.class);
    static final Set<String> SENTIMENTS = Set.of("positive", "negative", "neutral");
    static final int MAX_REASONS = 3;
    private static final int MAX_REVIEW_CHARS = 1200;
    private static final String SYSTEM_PROMPT = "You analyze customer reviews.\n"
            + "Return ONLY valid JSON.\n"
            + "For each review, output an object:\n"
            + "{\"idx\": <int>, \"sentiment\": \"positive|negative|neutral\", \"reasons\": [\"phrase\", ...]}\n"
            + "Rules:\n"
            + "- reasons: up to 3 short noun phrases (2-5 words)\n"
            + "- no full sentences\n"
            + "- no punctuation\n"
            + "- return a JSON array of objects\n";

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final ExecutorService executor;
    @Value(value="${insight.sentiment.max-output-tokens:600}")
    private int maxOutputTokens = 600;
    @Value(value="${insight.sentiment.temperature:0.2}")
    private double temperature = 0.2;

    public ReviewSentimentAnalyzer(ChatClient.Builder chatClientBuilder, ObjectMapper objectMapper, RetryPolicy retryPolicy,
                                   @Qualifier("interpreterExecutor") ExecutorService executor) {
        this.chatClient = chatClientBuilder.build();
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
    }

    public List<SentimentLabel> labelBatch(List<String> texts) {
        String prompt = buildPrompt(texts);
        if (prompt == null) {
            return List.of();
        }
        RetryPolicy.Attempts attempts = new RetryPolicy.Attempts();
        try {
            String raw = this.retryPolicy.execute("sentiment", this.executor, () -> this.callModel(prompt),
                    ReviewSentimentAnalyzer::isRetryable, attempts);
            return this.parseLabels(raw, texts.size());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }
        catch (Exception e) {
            log.warn("Sentiment batch failed after {} attempt(s){}: {}", attempts.count(),
                    attempts.deadlineReached() ? " (deadline reached)" : "", e.getClass().getSimpleName());
            return List.of();
        }
    }

    private static boolean isRetryable(Throwable failure) {
        if (failure instanceof NonTransientAiException) {
            return false;
        }
        return failure instanceof TransientAiException || failure instanceof TimeoutException
                || SpringAiInterpreterClient.isTransientMessage(failure.getMessage());
    }

    String callModel(String prompt) {
        ChatOptions options = ChatOptions.builder().temperature(this.temperature).maxTokens(this.maxOutputTokens).build();
        String content = this.chatClient.prompt().system(SYSTEM_PROMPT).user(prompt).options(options).call().content();
        return content == null ? "" : content;
    }

    static String buildPrompt(List<String> texts) {
        List<String> lines = new ArrayList<String>();
        for (int i = 0; i < texts.size(); ++i) {
            String text = texts.get(i);
            if (text == null || text.isBlank()) {
                continue;
            }
            String trimmed = text.trim();
            if (trimmed.length() > MAX_REVIEW_CHARS) {
                trimmed = trimmed.substring(0, MAX_REVIEW_CHARS);
            }
            lines.add("[" + i + "] " + trimmed);
        }
        if (lines.isEmpty()) {
            return null;
        }
        return "Analyze the following reviews.\nReturn ONLY JSON array. Each element must include idx, sentiment, reasons.\n\n"
                + String.join("\n\n", lines);
    }

    /**
     * Keeps entries whose index falls inside the batch and whose sentiment is one of the
     * three labels. A single object is accepted as a one-element array; the first label for
     * an index wins.
     */
    List<SentimentLabel> parseLabels(String raw, int batchSize) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int lastFence = text.lastIndexOf("```");
            text = firstNewline >= 0 && lastFence > firstNewline ? text.substring(firstNewline + 1, lastFence).trim() : text;
        }
        JsonNode root;
        try {
            root = this.objectMapper.readTree(text);
        }
        catch (JsonProcessingException e) {
            log.warn("Sentiment reply was not JSON: {}", e.getOriginalMessage());
            return List.of();
        }
        List<JsonNode> items = new ArrayList<JsonNode>();
        if (root != null && root.isArray()) {
            root.forEach(items::add);
        } else if (root != null && root.isObject()) {
            items.add(root);
        }
        Map<Integer, SentimentLabel> byIndex = new LinkedHashMap<Integer, SentimentLabel>();
        for (JsonNode item : items) {
            JsonNode idx = item.get("idx");
            JsonNode sentiment = item.get("sentiment");
            if (idx == null || !idx.isInt() || sentiment == null || !sentiment.isTextual()) {
                continue;
            }
            int index = idx.intValue();
            String label = sentiment.textValue().trim().toLowerCase(Locale.ROOT);
            if (index < 0 || index >= batchSize || !SENTIMENTS.contains(label) || byIndex.containsKey(index)) {
                continue;
            }
            List<String> reasons = new ArrayList<String>();
            JsonNode reasonNodes = item.get("reasons");
            if (reasonNodes != null && reasonNodes.isArray()) {
                for (JsonNode reason : reasonNodes) {
                    if (reason.isTextual() && !reason.textValue().isBlank() && reasons.size() < MAX_REASONS) {
                        reasons.add(reason.textValue().trim());
                    }
                }
            }
            byIndex.put(index, new SentimentLabel(index, label, reasons));
        }
        return new ArrayList<SentimentLabel>(byIndex.values());
    }
}
