package com.jreinhal.insight.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.insight.tools.ToolName;
import com.jreinhal.insight.tools.ToolRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class IntentRouterTest {
    private static final String GOOD_REPLY = "{\"tool\": \"rating_distribution\", \"args\": {\"category\": \"Kitchen\"}, \"confidence\": 0.9}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InterpreterClient client;
    private ExecutorService executor;
    private List<Long> sleeps;

    @BeforeEach
    void setUp() {
        this.client = mock(InterpreterClient.class);
        this.executor = Executors.newCachedThreadPool();
        this.sleeps = new CopyOnWriteArrayList<Long>();
    }

    @AfterEach
    void tearDown() {
        this.executor.shutdownNow();
    }

    private IntentRouter router(int maxAttempts, long baseDelayMs, long attemptTimeoutMs, long deadlineMs) {
        RetryPolicy policy = new RetryPolicy(maxAttempts, attemptTimeoutMs, deadlineMs,
                attempt -> baseDelayMs << (attempt - 1), event -> this.sleeps.add(event.getWaitInterval().toMillis()));
        return new IntentRouter(this.client, new InterpreterResponseParser(this.objectMapper), ToolRegistry.withDefaults(),
                this.objectMapper, this.executor, policy);
    }

    private static ConversationContext context() {
        return ConversationContext.empty("c-1", Set.of("Kitchen", "Electronics"));
    }

    @Nested
    @DisplayName("Retry loop")
    class RetryTest {
        @Test
        @DisplayName("First successful reply is parsed into a proposal")
        void firstAttemptSucceeds() {
            when(client.propose(any())).thenReturn(GOOD_REPLY);
            RouterDecision decision = router(3, 0L, 1_000L, 5_000L).route("ratings for kitchen", context());
            assertThat(decision).isInstanceOf(RouterDecision.Proposal.class);
            assertThat(((RouterDecision.Proposal) decision).tool()).isEqualTo(ToolName.RATING_DISTRIBUTION);
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("Transient failures are retried with backoff")
        void transientThenSuccess() {
            when(client.propose(any()))
                    .thenThrow(new InterpreterTransientException("429 rate limit"))
                    .thenThrow(new InterpreterTransientException("503 unavailable"))
                    .thenReturn(GOOD_REPLY);
            RouterDecision decision = router(3, 100L, 1_000L, 60_000L).route("ratings for kitchen", context());
            assertThat(decision).isInstanceOf(RouterDecision.Proposal.class);
            verify(client, times(3)).propose(any());
            assertThat(sleeps).containsExactly(100L, 200L);
        }

        @Test
        @DisplayName("Attempts that always time out are bounded by max attempts")
        void alwaysTimesOut() {
            when(client.propose(any())).thenAnswer(invocation -> {
                Thread.sleep(5_000L);
                return GOOD_REPLY;
            });
            long start = System.nanoTime();
            RouterDecision decision = router(3, 0L, 50L, 10_000L).route("anything", context());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertThat(decision).isInstanceOf(RouterDecision.Unavailable.class);
            assertThat(((RouterDecision.Unavailable) decision).attempts()).isEqualTo(3);
            assertThat(elapsedMs).isLessThan(2_000L);
            verify(client, timeout(2_000L).times(3)).propose(any());
        }

        @Test
        @DisplayName("Slow attempts end at the overall deadline")
        void slowAttemptsStopAtDeadline() {
            when(client.propose(any())).thenAnswer(invocation -> {
                Thread.sleep(5_000L);
                return GOOD_REPLY;
            });
            long start = System.nanoTime();
            RouterDecision decision = router(10, 0L, 150L, 400L).route("anything", context());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertThat(decision).isInstanceOf(RouterDecision.Unavailable.class);
            assertThat(((RouterDecision.Unavailable) decision).attempts()).isBetween(2, 4);
            assertThat(elapsedMs).isLessThan(400L + 350L);
        }

        @Test
        @DisplayName("Non-transient failure stops immediately")
        void nonTransientStops() {
            when(client.propose(any())).thenThrow(new InterpreterException("invalid api key"));
            RouterDecision decision = router(3, 0L, 1_000L, 5_000L).route("anything", context());
            assertThat(decision).isInstanceOf(RouterDecision.Unavailable.class);
            assertThat(((RouterDecision.Unavailable) decision).attempts()).isEqualTo(1);
            verify(client, times(1)).propose(any());
        }

        @Test
        @DisplayName("A retry that would overrun the deadline is not attempted")
        void deadlineStopsRetry() {
            when(client.propose(any())).thenThrow(new InterpreterTransientException("timeout"));
            RouterDecision decision = router(3, 5_000L, 100L, 200L).route("anything", context());
            assertThat(decision).isInstanceOf(RouterDecision.Unavailable.class);
            assertThat(((RouterDecision.Unavailable) decision).attempts()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("Malformed reply is returned as Unknown without retrying")
        void malformedNotRetried() {
            when(client.propose(any())).thenReturn("I think you want ratings");
            RouterDecision decision = router(3, 0L, 1_000L, 5_000L).route("anything", context());
            assertThat(decision).isInstanceOf(RouterDecision.Unknown.class);
            verify(client, times(1)).propose(any());
        }
    }

    @Nested
    @DisplayName("Request payload")
    class PayloadTest {
        @Test
        @DisplayName("Sends at most 200 sorted categories and the last 6 messages")
        void payloadIsBounded() throws Exception {
            when(client.propose(any())).thenReturn(GOOD_REPLY);
            TreeSet<String> categories = new TreeSet<String>();
            for (int i = 0; i < 250; ++i) {
                categories.add(String.format("Category %03d", i));
            }
            List<ConversationContext.Message> messages = new ArrayList<ConversationContext.Message>();
            for (int i = 0; i < 10; ++i) {
                messages.add(new ConversationContext.Message(i % 2 == 0 ? "user" : "assistant", "m" + i));
            }
            router(1, 0L, 1_000L, 5_000L).route("top categories", new ConversationContext("c-1", messages, categories));

            ArgumentCaptor<InterpreterRequest> captor = ArgumentCaptor.forClass(InterpreterRequest.class);
            verify(client).propose(captor.capture());
            JsonNode payload = objectMapper.readTree(captor.getValue().userPayload());
            assertThat(payload.get("allowed_categories")).hasSize(200);
            assertThat(payload.get("allowed_categories").get(0).asText()).isEqualTo("Category 000");
            assertThat(payload.get("recent_messages")).hasSize(6);
            assertThat(payload.get("recent_messages").get(0).get("content").asText()).isEqualTo("m4");
            assertThat(payload.get("user_message").asText()).isEqualTo("top categories");
            assertThat(captor.getValue().systemPrompt()).contains("metrics_top_categories", "general_query");
        }
    }
}
