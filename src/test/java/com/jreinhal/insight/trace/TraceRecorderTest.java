package com.jreinhal.insight.trace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.insight.execution.NoData;
import com.jreinhal.insight.model.TraceRecord;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.routing.RouterDecision;
import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.tools.ToolName;
import com.jreinhal.insight.validation.RejectionReason;
import com.jreinhal.insight.validation.ValidationVerdict;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.util.ReflectionTestUtils;

class TraceRecorderTest {

    private MongoTemplate mongoTemplate;
    private TraceRecorder recorder;
    private TurnIdentity turn;

    @BeforeEach
    void setUp() {
        this.mongoTemplate = mock(MongoTemplate.class);
        this.recorder = new TraceRecorder(this.mongoTemplate);
        User user = User.of("u-1", "ana", UserRole.ANALYST, Set.of("Kitchen"));
        this.turn = new TurnIdentity("trace-1", "conv-1", 2, user, 7L, "how is kitchen doing");
    }

    @Test
    @DisplayName("Records decision, verdict, final call and result summary")
    void recordsTurn() {
        RouterDecision decision = new RouterDecision.Unknown(null, 0.2, true, "vague");
        ValidationVerdict verdict = ValidationVerdict.Rejected.of(RejectionReason.AMBIGUOUS_INTENT, "vague");
        ToolCall call = ToolCall.fallback(ToolName.GENERAL_QUERY, Map.of("query_type", "summary_stats"),
                RejectionReason.AMBIGUOUS_INTENT, "Showing overall stats instead");

        TraceRecord record = recorder.record(turn, decision, verdict, call, new NoData("general_query", "nothing"), Map.of("route", 3L));

        verify(mongoTemplate).insert(record, TraceRecorder.COLLECTION);
        assertThat(record.getId()).isEqualTo("trace-1");
        assertThat(record.getConversationId()).isEqualTo("conv-1");
        assertThat(record.getTurnIndex()).isEqualTo(2);
        assertThat(record.getUserId()).isEqualTo("u-1");
        assertThat(record.getAccessVersion()).isEqualTo(7L);
        assertThat(record.getRouterDecision()).containsEntry("type", "unknown");
        assertThat(record.getVerdict()).containsEntry("reason", "ambiguous_intent");
        assertThat(record.getFinalCall()).containsEntry("tool", "general_query");
        assertThat(record.getFallbackRationale()).isEqualTo("Showing overall stats instead");
        assertThat(record.getResultSummary()).containsEntry("kind", "no_data");
        assertThat(record.getStageDurationsMs()).containsEntry("route", 3L);
    }

    @Test
    @DisplayName("Direct calls carry no fallback rationale")
    void directCall() {
        ToolCall call = ToolCall.of(ToolName.RATING_DISTRIBUTION, Map.of("category", "Kitchen"));
        TraceRecord record = recorder.record(turn, null, new ValidationVerdict.Validated(call, List.of()), call, null, Map.of());
        assertThat(record.getFallbackRationale()).isNull();
        assertThat(record.getResultSummary()).isNull();
    }

    @Test
    @DisplayName("Failures are stored with the failure text")
    void recordsFailure() {
        ToolCall call = ToolCall.of(ToolName.RATING_DISTRIBUTION, Map.of("category", "Kitchen"));
        TraceRecord record = recorder.recordFailure(turn, null, null, call, "store down", Map.of());
        assertThat(record.getFailure()).isEqualTo("store down");
    }

    @Test
    @DisplayName("Write failure is logged and swallowed when fail-open")
    void failOpen() {
        when(mongoTemplate.insert(any(TraceRecord.class), eq(TraceRecorder.COLLECTION)))
                .thenThrow(new DataAccessResourceFailureException("down"));
        ToolCall call = ToolCall.of(ToolName.RATING_DISTRIBUTION, Map.of("category", "Kitchen"));
        assertThat(recorder.record(turn, null, null, call, null, Map.of())).isNotNull();
    }

    @Test
    @DisplayName("Write failure halts the turn when fail-closed")
    void failClosed() {
        ReflectionTestUtils.setField(recorder, "failClosed", true);
        when(mongoTemplate.insert(any(TraceRecord.class), eq(TraceRecorder.COLLECTION)))
                .thenThrow(new DataAccessResourceFailureException("down"));
        ToolCall call = ToolCall.of(ToolName.RATING_DISTRIBUTION, Map.of("category", "Kitchen"));
        assertThatThrownBy(() -> recorder.record(turn, null, null, call, null, Map.of()))
                .isInstanceOf(TraceWriteException.class);
    }
}
