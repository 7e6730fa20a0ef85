package com.jreinhal.insight.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.service.AuditService;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

class CategoryGrantServiceTest {

    private MongoTemplate mongoTemplate;
    private CategoryCatalog catalog;
    private AuditService auditService;
    private CategoryGrantService service;
    private User admin;

    @BeforeEach
    void setUp() {
        this.mongoTemplate = mock(MongoTemplate.class);
        this.catalog = mock(CategoryCatalog.class);
        this.auditService = mock(AuditService.class);
        this.service = new CategoryGrantService(this.mongoTemplate, this.catalog, this.auditService);
        this.admin = User.of("u-admin", "admin", UserRole.ADMIN, Set.of());
        when(this.catalog.exists("Kitchen")).thenReturn(true);
        when(this.catalog.exists("Electronics")).thenReturn(true);
    }

    @Test
    @DisplayName("Grant replacement sets the sorted list and bumps the version in one update")
    void replaceGrant() {
        User updated = User.of("u-1", "ana", UserRole.ANALYST, Set.of("Electronics", "Kitchen"));
        updated.setAccessVersion(4L);
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class), eq(User.class)))
                .thenReturn(updated);
        LinkedHashSet<String> requested = new LinkedHashSet<String>(List.of(" Kitchen ", "Electronics", ""));

        CategoryGrant grant = service.replaceGrant(admin, "u-1", requested);

        assertThat(grant.categories()).containsExactly("Electronics", "Kitchen");
        assertThat(grant.accessVersion()).isEqualTo(4L);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).findAndModify(any(Query.class), update.capture(), any(FindAndModifyOptions.class), eq(User.class));
        assertThat(update.getValue().modifies("allowedCategories")).isTrue();
        assertThat(update.getValue().modifies("accessVersion")).isTrue();
        verify(auditService).logGrantChange(eq(admin), eq("u-1"), any(), eq(4L));
    }

    @Test
    @DisplayName("Unknown categories are rejected before any write")
    void unknownCategory() {
        assertThatThrownBy(() -> service.replaceGrant(admin, "u-1", Set.of("Garden"))).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    @DisplayName("Unknown users are rejected")
    void unknownUser() {
        assertThatThrownBy(() -> service.replaceGrant(admin, "u-404", Set.of("Kitchen"))).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("Only grant managers may change grants")
    void analystRejected() {
        User analyst = User.of("u-2", "bob", UserRole.ANALYST, Set.of());
        assertThatThrownBy(() -> service.replaceGrant(analyst, "u-1", Set.of("Kitchen"))).isInstanceOf(SecurityException.class);
        verifyNoInteractions(mongoTemplate);
    }
}
