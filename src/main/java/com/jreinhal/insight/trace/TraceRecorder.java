package com.jreinhal.insight.trace;

import com.jreinhal.insight.execution.ToolResult;
import com.jreinhal.insight.model.TraceRecord;
import com.jreinhal.insight.routing.RouterDecision;
import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.validation.ValidationVerdict;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

/**
 * Append-only audit of each turn. One insert per turn; there is no update or delete path.
 */
@Service
public class TraceRecorder {
    private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);
    static final String COLLECTION = "message_traces";

    private final MongoTemplate mongoTemplate;
    @Value(value="${insight.trace.fail-closed:false}")
    private boolean failClosed;

    public TraceRecorder(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public TraceRecord record(TurnIdentity turn, RouterDecision decision, ValidationVerdict verdict, ToolCall finalCall,
                              ToolResult result, Map<String, Long> stageDurations) {
        TraceRecord record = this.base(turn, decision, verdict, finalCall, stageDurations)
                .resultSummary(result == null ? null : result.summary())
                .build();
        this.insert(record);
        return record;
    }

    /**
     * Records a turn that was aborted by the data source. The failure text is stored as given.
     */
    public TraceRecord recordFailure(TurnIdentity turn, RouterDecision decision, ValidationVerdict verdict, ToolCall finalCall,
                                     String failure, Map<String, Long> stageDurations) {
        TraceRecord record = this.base(turn, decision, verdict, finalCall, stageDurations)
                .failure(failure)
                .build();
        this.insert(record);
        return record;
    }

    private TraceRecord.Builder base(TurnIdentity turn, RouterDecision decision, ValidationVerdict verdict, ToolCall finalCall,
                                     Map<String, Long> stageDurations) {
        return TraceRecord.builder(turn.traceId())
                .turn(turn.conversationId(), turn.turnIndex())
                .user(turn.user(), turn.accessVersion())
                .query(turn.utterance())
                .routerDecision(decision == null ? null : decision.toTraceMap())
                .verdict(verdict == null ? null : verdict.toTraceMap())
                .finalCall(finalCall == null ? null : finalCall.toTraceMap())
                .fallbackRationale(finalCall != null && finalCall.fallback() ? finalCall.rationale() : null)
                .stageDurations(stageDurations);
    }

    private void insert(TraceRecord record) {
        try {
            this.mongoTemplate.insert(record, COLLECTION);
            log.debug("Trace {} recorded for conversation {} turn {}", record.getId(), record.getConversationId(), record.getTurnIndex());
        }
        catch (DataAccessException e) {
            log.error("CRITICAL: Failed to persist trace {}: {}", record.getId(), e.getMessage());
            if (this.failClosed) {
                throw new TraceWriteException("Trace write failed - turn halted", e);
            }
        }
    }
}
