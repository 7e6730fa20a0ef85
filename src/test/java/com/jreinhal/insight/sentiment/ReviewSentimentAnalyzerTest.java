package com.jreinhal.insight.sentiment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.insight.routing.RetryPolicy;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

class ReviewSentimentAnalyzerTest {

    private ExecutorService executor;
    private List<Long> sleeps;

    @BeforeEach
    void setUp() {
        this.executor = Executors.newCachedThreadPool();
        this.sleeps = new CopyOnWriteArrayList<Long>();
    }

    @AfterEach
    void tearDown() {
        this.executor.shutdownNow();
    }

    private ReviewSentimentAnalyzer analyzer(String... replies) {
        return analyzer(new RetryPolicy(3, 2_000L, 10_000L, attempt -> 100L << (attempt - 1),
                event -> this.sleeps.add(event.getWaitInterval().toMillis())), new AtomicInteger(), replies);
    }

    private ReviewSentimentAnalyzer analyzer(RetryPolicy policy, AtomicInteger calls, String... replies) {
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(mock(ChatClient.class));
        List<String> scripted = Arrays.asList(replies);
        return new ReviewSentimentAnalyzer(builder, new ObjectMapper(), policy, this.executor) {
            @Override
            String callModel(String prompt) {
                String reply = scripted.get(Math.min(calls.getAndIncrement(), scripted.size() - 1));
                if ("TRANSIENT".equals(reply)) {
                    throw new TransientAiException("503 Service Unavailable");
                }
                if ("FATAL".equals(reply)) {
                    throw new NonTransientAiException("401 Unauthorized");
                }
                return reply;
            }
        };
    }

    @Nested
    @DisplayName("Prompt")
    class PromptTest {
        @Test
        @DisplayName("Blank texts are skipped and indices kept")
        void indicesKept() {
            String prompt = ReviewSentimentAnalyzer.buildPrompt(Arrays.asList("Great", " ", null, "Bad"));
            assertThat(prompt).contains("[0] Great").contains("[3] Bad").doesNotContain("[1]").doesNotContain("[2]");
        }

        @Test
        @DisplayName("Long reviews are truncated")
        void truncated() {
            String prompt = ReviewSentimentAnalyzer.buildPrompt(List.of("y".repeat(5000)));
            assertThat(prompt).contains("y".repeat(1200)).doesNotContain("y".repeat(1201));
        }

        @Test
        @DisplayName("Nothing to label gives no prompt")
        void nothingToLabel() {
            assertThat(ReviewSentimentAnalyzer.buildPrompt(List.of(" ", ""))).isNull();
        }
    }

    @Nested
    @DisplayName("Reply parsing")
    class ParsingTest {
        @Test
        @DisplayName("Valid entries are kept, bad ones dropped")
        void filters() {
            String raw = "```json\n["
                    + "{\"idx\":0,\"sentiment\":\"Positive\",\"reasons\":[\"sound\",\" \",\"price\",\"size\",\"color\"]},"
                    + "{\"idx\":0,\"sentiment\":\"negative\",\"reasons\":[]},"
                    + "{\"idx\":1,\"sentiment\":\"angry\"},"
                    + "{\"idx\":7,\"sentiment\":\"neutral\"},"
                    + "{\"idx\":\"2\",\"sentiment\":\"neutral\"},"
                    + "{\"idx\":2,\"sentiment\":\"neutral\"}"
                    + "]\n```";
            List<SentimentLabel> labels = analyzer().parseLabels(raw, 3);
            assertThat(labels).containsExactly(
                    new SentimentLabel(0, "positive", List.of("sound", "price", "size")),
                    new SentimentLabel(2, "neutral", List.of()));
        }

        @Test
        @DisplayName("A single object counts as one entry")
        void singleObject() {
            assertThat(analyzer().parseLabels("{\"idx\":0,\"sentiment\":\"negative\",\"reasons\":[\"broke\"]}", 1))
                    .containsExactly(new SentimentLabel(0, "negative", List.of("broke")));
        }

        @Test
        @DisplayName("Non-JSON replies give no labels")
        void notJson() {
            assertThat(analyzer().parseLabels("I think these are positive", 2)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTest {
        @Test
        @DisplayName("Transient failures are retried with backoff")
        void transientRetried() {
            ReviewSentimentAnalyzer analyzer = analyzer("TRANSIENT", "[{\"idx\":0,\"sentiment\":\"positive\"}]");
            assertThat(analyzer.labelBatch(List.of("Great"))).hasSize(1);
            assertThat(sleeps).containsExactly(100L);
        }

        @Test
        @DisplayName("Non-transient failures stop immediately")
        void fatalStops() {
            ReviewSentimentAnalyzer analyzer = analyzer("FATAL", "[{\"idx\":0,\"sentiment\":\"positive\"}]");
            assertThat(analyzer.labelBatch(List.of("Great"))).isEmpty();
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("Exhausted attempts give no labels")
        void exhausted() {
            assertThat(analyzer("TRANSIENT").labelBatch(List.of("Great"))).isEmpty();
            assertThat(sleeps).containsExactly(100L, 200L);
        }

        @Test
        @DisplayName("A retry that would overrun the deadline is not attempted")
        void deadlineStopsRetry() {
            RetryPolicy policy = new RetryPolicy(3, 100L, 300L, attempt -> 5_000L,
                    event -> sleeps.add(event.getWaitInterval().toMillis()));
            AtomicInteger calls = new AtomicInteger();
            ReviewSentimentAnalyzer analyzer = analyzer(policy, calls, "TRANSIENT", "[{\"idx\":0,\"sentiment\":\"positive\"}]");
            assertThat(analyzer.labelBatch(List.of("Great"))).isEmpty();
            assertThat(calls.get()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }
    }
}
