package com.jreinhal.insight.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.insight.access.CategoryGrantService;
import com.jreinhal.insight.filter.SecurityContext;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.repository.UserRepository;
import com.jreinhal.insight.sentiment.BackfillResult;
import com.jreinhal.insight.sentiment.SentimentBackfillService;
import com.jreinhal.insight.service.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccessAdminControllerTest {

    private CategoryGrantService grantService;
    private SentimentBackfillService backfillService;
    private UserRepository userRepository;
    private AuditService auditService;
    private AccessAdminController controller;
    private HttpServletRequest request;

    @BeforeEach
    void setUp() {
        this.grantService = mock(CategoryGrantService.class);
        this.backfillService = mock(SentimentBackfillService.class);
        this.userRepository = mock(UserRepository.class);
        this.auditService = mock(AuditService.class);
        this.controller = new AccessAdminController(this.grantService, this.backfillService, this.userRepository, this.auditService);
        this.request = mock(HttpServletRequest.class);
    }

    @AfterEach
    void tearDown() {
        SecurityContext.clear();
    }

    @Test
    void listingUsersRequiresGrantManagerAndIsAudited() {
        User analyst = User.of("u-1", "ana", UserRole.ANALYST, Set.of());
        SecurityContext.setCurrentUser(analyst);

        assertThatThrownBy(() -> controller.users(request)).isInstanceOf(SecurityException.class);
        verify(auditService).logAccessDenied(eq(analyst), eq("/api/admin/users"), anyString(), eq(request));
        verify(userRepository, never()).findByActiveTrue();
    }

    @Test
    void listingUsersShowsGrantsSorted() {
        SecurityContext.setCurrentUser(User.of("u-admin", "admin", UserRole.ADMIN, Set.of()));
        User analyst = User.of("u-1", "ana", UserRole.ANALYST, Set.of("Toys", "Kitchen"));
        User legacy = User.of("u-2", "old", UserRole.ANALYST, Set.of());
        legacy.setAllowedCategories(null);
        when(userRepository.findByActiveTrue()).thenReturn(List.of(analyst, legacy));

        List<Map<String, Object>> users = controller.users(request);

        assertThat(users).hasSize(2);
        assertThat(users.get(0).get("allowedCategories"))
                .asInstanceOf(InstanceOfAssertFactories.iterable(String.class))
                .containsExactly("Kitchen", "Toys");
        assertThat((Set<?>) users.get(1).get("allowedCategories")).isEmpty();
    }

    @Test
    void replaceGrantPassesCurrentAdmin() {
        User admin = User.of("u-admin", "admin", UserRole.ADMIN, Set.of());
        SecurityContext.setCurrentUser(admin);

        controller.replaceGrant("u-1", new AccessAdminController.GrantRequest(Set.of("Kitchen")));

        verify(grantService).replaceGrant(admin, "u-1", new TreeSet<String>(Set.of("Kitchen")));
    }

    @Test
    void replaceGrantWithoutCategoriesIsRejected() {
        assertThatThrownBy(() -> controller.replaceGrant("u-1", new AccessAdminController.GrantRequest(null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void backfillByAnalystIsAuditedBeforeTheServiceRefuses() {
        User analyst = User.of("u-1", "ana", UserRole.ANALYST, Set.of("Kitchen"));
        SecurityContext.setCurrentUser(analyst);
        when(backfillService.backfill(analyst, "Kitchen", 50)).thenThrow(new SecurityException("nope"));

        assertThatThrownBy(() -> controller.backfill("Kitchen", 50, request)).isInstanceOf(SecurityException.class);
        verify(auditService).logAccessDenied(eq(analyst), eq("/api/admin/sentiment/backfill"), anyString(), eq(request));
    }

    @Test
    void backfillByAdminDelegates() {
        User admin = User.of("u-admin", "admin", UserRole.ADMIN, Set.of());
        SecurityContext.setCurrentUser(admin);
        BackfillResult expected = new BackfillResult("Kitchen", 10, 2, 8, 0);
        when(backfillService.backfill(admin, "Kitchen", 10)).thenReturn(expected);

        assertThat(controller.backfill("Kitchen", 10, request)).isEqualTo(expected);
    }
}
