package com.jreinhal.insight.trace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.insight.model.TraceRecord;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.service.AuditService;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

class TraceQueryServiceTest {

    private MongoTemplate mongoTemplate;
    private AuditService auditService;
    private TraceQueryService service;

    @BeforeEach
    void setUp() {
        this.mongoTemplate = mock(MongoTemplate.class);
        this.auditService = mock(AuditService.class);
        this.service = new TraceQueryService(this.mongoTemplate, this.auditService);
    }

    @Test
    @DisplayName("Admins query newest first with filters and a capped limit")
    void adminQuery() {
        User admin = User.of("u-admin", "admin", UserRole.ADMIN, Set.of());
        when(mongoTemplate.find(any(Query.class), eq(TraceRecord.class), eq(TraceRecorder.COLLECTION))).thenReturn(List.of());

        service.recent(admin, 10_000, "u-1", "conv-1", null);

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(TraceRecord.class), eq(TraceRecorder.COLLECTION));
        assertThat(query.getValue().getLimit()).isEqualTo(TraceQueryService.MAX_LIMIT);
        assertThat(query.getValue().getQueryObject()).containsEntry("userId", "u-1").containsEntry("conversationId", "conv-1");
        assertThat(query.getValue().getSortObject()).containsEntry("createdAt", -1);
    }

    @Test
    @DisplayName("Analysts are denied and audited")
    void analystDenied() {
        User analyst = User.of("u-1", "ana", UserRole.ANALYST, Set.of());
        assertThatThrownBy(() -> service.recent(analyst, 10, null, null, null)).isInstanceOf(SecurityException.class);
        verify(auditService).logAccessDenied(eq(analyst), eq(TraceQueryService.RESOURCE), anyString(), any());
        verify(mongoTemplate, never()).find(any(Query.class), eq(TraceRecord.class), anyString());
    }
}
