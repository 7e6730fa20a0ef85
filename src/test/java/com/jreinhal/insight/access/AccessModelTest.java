package com.jreinhal.insight.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.insight.model.Category;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.model.UserRole;
import com.jreinhal.insight.repository.CategoryRepository;
import com.jreinhal.insight.repository.UserRepository;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AccessModelTest {

    private UserRepository userRepository;
    private AccessModel accessModel;

    @BeforeEach
    void setUp() {
        this.userRepository = mock(UserRepository.class);
        CategoryRepository categoryRepository = mock(CategoryRepository.class);
        when(categoryRepository.findAll()).thenReturn(List.of(
                new Category("Electronics"), new Category("Home Audio"), new Category("Kitchen")));
        this.accessModel = new AccessModel(this.userRepository, new CategoryCatalog(categoryRepository));
    }

    private User store(User user) {
        when(this.userRepository.findById(user.getId())).thenReturn(Optional.of(user));
        return user;
    }

    @Nested
    @DisplayName("authorize()")
    class AuthorizeTest {
        @Test
        @DisplayName("Admin is allowed every category")
        void adminAllowed() {
            User admin = store(User.of("u-admin", "admin", UserRole.ADMIN, Set.of()));
            assertThat(accessModel.authorize(admin, "Home Audio")).isEqualTo(AccessDecision.ALLOWED);
        }

        @Test
        @DisplayName("Analyst is allowed exactly the granted categories")
        void analystGrantOnly() {
            User analyst = store(User.of("u-1", "ana", UserRole.ANALYST, Set.of("Electronics")));
            assertThat(accessModel.authorize(analyst, "Electronics")).isEqualTo(AccessDecision.ALLOWED);
            assertThat(accessModel.authorize(analyst, "Home Audio")).isEqualTo(AccessDecision.DENIED);
            assertThat(accessModel.authorize(analyst, "electronics")).isEqualTo(AccessDecision.DENIED);
        }

        @Test
        @DisplayName("Blank category is denied")
        void blankDenied() {
            User admin = store(User.of("u-admin", "admin", UserRole.ADMIN, Set.of()));
            assertThat(accessModel.authorize(admin, " ")).isEqualTo(AccessDecision.DENIED);
        }

        @Test
        @DisplayName("Unknown and deactivated users are denied")
        void unresolvedDenied() {
            User ghost = User.of("u-ghost", "ghost", UserRole.ADMIN, Set.of());
            when(userRepository.findById("u-ghost")).thenReturn(Optional.empty());
            assertThat(accessModel.authorize(ghost, "Electronics")).isEqualTo(AccessDecision.DENIED);

            User inactive = User.of("u-2", "gone", UserRole.ADMIN, Set.of());
            inactive.setActive(false);
            store(inactive);
            assertThat(accessModel.authorize(inactive, "Electronics")).isEqualTo(AccessDecision.DENIED);
        }

        @Test
        @DisplayName("Role and grant on the caller object are not trusted")
        void rereadsStoredUser() {
            store(User.of("u-1", "ana", UserRole.ANALYST, Set.of("Kitchen")));
            User forged = User.of("u-1", "ana", UserRole.ADMIN, Set.of("Electronics"));
            assertThat(accessModel.authorize(forged, "Electronics")).isEqualTo(AccessDecision.DENIED);
            assertThat(accessModel.authorize(forged, "Kitchen")).isEqualTo(AccessDecision.ALLOWED);
        }
    }

    @Nested
    @DisplayName("resolveVisibleCategories()")
    class VisibleCategoriesTest {
        @Test
        @DisplayName("Admin sees the whole catalog")
        void adminSeesCatalog() {
            User admin = store(User.of("u-admin", "admin", UserRole.ADMIN, Set.of()));
            assertThat(accessModel.resolveVisibleCategories(admin)).containsExactly("Electronics", "Home Audio", "Kitchen");
        }

        @Test
        @DisplayName("Analyst sees the grant, empty grant sees nothing")
        void analystSeesGrant() {
            User analyst = store(User.of("u-1", "ana", UserRole.ANALYST, Set.of("Kitchen", "Electronics")));
            assertThat(accessModel.resolveVisibleCategories(analyst)).containsExactly("Electronics", "Kitchen");

            User empty = store(User.of("u-3", "none", UserRole.ANALYST, Set.of()));
            assertThat(accessModel.resolveVisibleCategories(empty)).isEmpty();
        }

        @Test
        @DisplayName("Grant change is visible on the next call")
        void grantChangeVisibleImmediately() {
            User before = User.of("u-1", "ana", UserRole.ANALYST, Set.of("Electronics"));
            User after = User.of("u-1", "ana", UserRole.ANALYST, Set.of("Kitchen"));
            after.setAccessVersion(1L);
            when(userRepository.findById("u-1")).thenReturn(Optional.of(before), Optional.of(after));

            assertThat(accessModel.resolveVisibleCategories(before)).containsExactly("Electronics");
            assertThat(accessModel.resolveVisibleCategories(before)).containsExactly("Kitchen");
            verify(userRepository, times(2)).findById("u-1");
        }

        @Test
        @DisplayName("Null user sees nothing")
        void nullUser() {
            assertThat(accessModel.resolveVisibleCategories(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("currentAccessVersion() and grantFor()")
    class VersionTest {
        @Test
        @DisplayName("Returns the stored version")
        void storedVersion() {
            User analyst = User.of("u-1", "ana", UserRole.ANALYST, Set.of("Kitchen"));
            analyst.setAccessVersion(7L);
            store(analyst);
            assertThat(accessModel.currentAccessVersion(analyst)).isEqualTo(7L);
            CategoryGrant grant = accessModel.grantFor(analyst);
            assertThat(grant.universal()).isFalse();
            assertThat(grant.categories()).containsExactly("Kitchen");
            assertThat(grant.accessVersion()).isEqualTo(7L);
        }

        @Test
        @DisplayName("Unresolved user has the sentinel version")
        void unresolvedVersion() {
            User ghost = User.of("u-ghost", "ghost", UserRole.ANALYST, Set.of());
            when(userRepository.findById("u-ghost")).thenReturn(Optional.empty());
            assertThat(accessModel.currentAccessVersion(ghost)).isEqualTo(AccessModel.UNRESOLVED_VERSION);
            assertThat(accessModel.grantFor(ghost).categories()).isEmpty();
        }

        @Test
        @DisplayName("Admin grant is universal")
        void adminUniversal() {
            User admin = store(User.of("u-admin", "admin", UserRole.ADMIN, Set.of()));
            assertThat(accessModel.grantFor(admin).universal()).isTrue();
        }
    }
}
