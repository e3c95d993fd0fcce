package com.example.annotation.authz.engine;

import com.example.annotation.authz.model.Action;
import com.example.annotation.authz.model.PolicyDecision;
import com.example.annotation.authz.model.ResourceAttributes;
import com.example.annotation.authz.model.ResourceAttributes.ResourceType;
import com.example.annotation.authz.model.SubjectAttributes;
import com.example.annotation.authz.policy.Policy;
import com.example.annotation.profile.model.Role;
import com.example.annotation.util.AccessPolicyTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AccessPolicyEngine")
class AccessPolicyEngineTest {

    private static final SubjectAttributes ADMIN = SubjectAttributes.of("admin-1", Role.ADMIN);
    private static final SubjectAttributes NAV_1 = SubjectAttributes.of("nav-1", Role.NAVIGATOR);
    private static final SubjectAttributes NAV_2 = SubjectAttributes.of("nav-2", Role.NAVIGATOR);
    private static final SubjectAttributes NO_PROFILE = SubjectAttributes.withoutProfile("stranger-1");

    private AccessPolicyEngine engine;

    @BeforeEach
    void setUp() {
        engine = AccessPolicyTestSupport.policyEngine();
    }

    @Test
    @DisplayName("should order policies by priority with admin override first")
    void shouldOrderPoliciesByPriority() {
        assertThat(engine.getPolicies())
                .extracting(Policy::getPolicyId)
                .first()
                .isEqualTo("ADMIN_OVERRIDE");
    }

    @Nested
    @DisplayName("admin override")
    class AdminOverride {

        @ParameterizedTest
        @EnumSource(Action.class)
        @DisplayName("should allow every action on every resource type")
        void shouldAllowEverything(Action action) {
            assertThat(engine.isAllowed(ADMIN, ResourceAttributes.profile("nav-1"), action)).isTrue();
            assertThat(engine.isAllowed(ADMIN, ResourceAttributes.profiles(), action)).isTrue();
            assertThat(engine.isAllowed(ADMIN, ResourceAttributes.syntheticCase("case-x"), action)).isTrue();
            assertThat(engine.isAllowed(ADMIN, ResourceAttributes.session("S", "nav-1"), action)).isTrue();
            assertThat(engine.isAllowed(ADMIN, ResourceAttributes.session("missing", null), action)).isTrue();
            assertThat(engine.isAllowed(ADMIN,
                    ResourceAttributes.rating(ResourceType.FORMAT2_RATING, "S:3", "S", "nav-1"), action)).isTrue();
        }

        @Test
        @DisplayName("should record the override policy as the deciding policy")
        void shouldReportOverridePolicy() {
            PolicyDecision decision = engine.evaluate(ADMIN, ResourceAttributes.syntheticCase("case-x"), Action.DELETE);

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.policyId()).isEqualTo("ADMIN_OVERRIDE");
        }
    }

    @Nested
    @DisplayName("profiles")
    class Profiles {

        @Test
        @DisplayName("should allow insert and select of own profile")
        void shouldAllowOwnInsertAndSelect() {
            assertThat(engine.isAllowed(NAV_1, ResourceAttributes.profile("nav-1"), Action.INSERT)).isTrue();
            assertThat(engine.isAllowed(NAV_1, ResourceAttributes.profile("nav-1"), Action.SELECT)).isTrue();
        }

        @Test
        @DisplayName("should allow a caller without a profile to insert their own")
        void shouldAllowFirstProvisioning() {
            assertThat(engine.isAllowed(NO_PROFILE, ResourceAttributes.profile("stranger-1"), Action.INSERT)).isTrue();
        }

        @Test
        @DisplayName("should deny update and delete even of own profile")
        void shouldDenyOwnUpdateAndDelete() {
            PolicyDecision update = engine.evaluate(NAV_1, ResourceAttributes.profile("nav-1"), Action.UPDATE);
            PolicyDecision delete = engine.evaluate(NAV_1, ResourceAttributes.profile("nav-1"), Action.DELETE);

            assertThat(update.isDenied()).isTrue();
            assertThat(update.policyId()).isEqualTo("PROFILE_OWNER");
            assertThat(delete.isDenied()).isTrue();
        }

        @Test
        @DisplayName("should deny access to another caller's profile")
        void shouldDenyForeignProfile() {
            assertThat(engine.isAllowed(NAV_1, ResourceAttributes.profile("nav-2"), Action.SELECT)).isFalse();
            assertThat(engine.isAllowed(NAV_1, ResourceAttributes.profile("nav-2"), Action.INSERT)).isFalse();
        }

        @Test
        @DisplayName("should deny listing profiles to navigators")
        void shouldDenyListing() {
            assertThat(engine.isAllowed(NAV_1, ResourceAttributes.profiles(), Action.SELECT)).isFalse();
        }
    }

    @Nested
    @DisplayName("synthetic cases")
    class Cases {

        @Test
        @DisplayName("should allow navigators to read")
        void shouldAllowNavigatorRead() {
            assertThat(engine.isAllowed(NAV_1, ResourceAttributes.syntheticCase("case-x"), Action.SELECT)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = Action.class, names = {"INSERT", "UPDATE", "DELETE"})
        @DisplayName("should deny navigator writes")
        void shouldDenyNavigatorWrites(Action action) {
            assertThat(engine.isAllowed(NAV_1, ResourceAttributes.syntheticCase("case-x"), action)).isFalse();
        }

        @Test
        @DisplayName("should deny reads by a caller without a navigator profile")
        void shouldDenyWithoutProfile() {
            PolicyDecision decision = engine.evaluate(NO_PROFILE, ResourceAttributes.syntheticCase("*"), Action.SELECT);

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.policyId()).isEqualTo("CASE_NAVIGATOR_READ");
        }
    }

    @Nested
    @DisplayName("sessions and ratings")
    class SessionsAndRatings {

        @ParameterizedTest
        @EnumSource(Action.class)
        @DisplayName("should allow the owning navigator any action on the session")
        void shouldAllowOwner(Action action) {
            assertThat(engine.isAllowed(NAV_1, ResourceAttributes.session("S", "nav-1"), action)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(Action.class)
        @DisplayName("should deny another navigator any action on the session")
        void shouldDenyOtherNavigator(Action action) {
            assertThat(engine.isAllowed(NAV_2, ResourceAttributes.session("S", "nav-1"), action)).isFalse();
        }

        @Test
        @DisplayName("should deny a missing session exactly like a foreign one")
        void shouldDenyMissingSession() {
            PolicyDecision missing = engine.evaluate(NAV_1, ResourceAttributes.session("ghost", null), Action.SELECT);
            PolicyDecision foreign = engine.evaluate(NAV_1, ResourceAttributes.session("S", "nav-2"), Action.SELECT);

            assertThat(missing.isDenied()).isTrue();
            assertThat(foreign.isDenied()).isTrue();
            assertThat(missing.policyId()).isEqualTo(foreign.policyId());
        }

        @ParameterizedTest
        @EnumSource(value = ResourceType.class, names = {"FORMAT1_RATING", "FORMAT2_RATING", "FORMAT3_RATING"})
        @DisplayName("should decide ratings by the owner of the parent session")
        void shouldDecideRatingsBySessionOwner(ResourceType type) {
            ResourceAttributes rating = ResourceAttributes.rating(type, "S:0", "S", "nav-1");

            assertThat(engine.isAllowed(NAV_1, rating, Action.UPDATE)).isTrue();
            assertThat(engine.isAllowed(NAV_2, rating, Action.UPDATE)).isFalse();
            assertThat(engine.isAllowed(NAV_2, rating, Action.SELECT)).isFalse();
        }
    }

    @Test
    @DisplayName("should fall back to default deny when no policy applies")
    void shouldDefaultDeny() {
        AccessPolicyEngine empty = new AccessPolicyEngine(java.util.List.of());

        PolicyDecision decision = empty.evaluate(NAV_1, ResourceAttributes.session("S", "nav-1"), Action.SELECT);

        assertThat(decision.isDenied()).isTrue();
        assertThat(decision.policyId()).isEqualTo(AccessPolicyEngine.DEFAULT_DENY);
    }
}
