package tech.gatehouse.platform.authorization.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.gatehouse.platform.authorization.condition.ConditionEvaluator;
import tech.gatehouse.platform.authorization.condition.ConditionParser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PolicyAggregator.
 */
class PolicyAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private final PolicyAggregator aggregator = new PolicyAggregator(new ConditionEvaluator());

    private static Policy policy(String id, PolicyEffect effect, int priority, String conditions) {
        Policy policy = new Policy();
        policy.id = id;
        policy.name = "policy-" + id;
        policy.resource = "documents";
        policy.action = "edit";
        policy.effect = effect;
        policy.priority = priority;
        policy.conditions = conditions;
        policy.condition = ConditionParser.parse(conditions);
        return policy;
    }

    // ========================================
    // PRIORITY TESTS
    // ========================================

    @Test
    @DisplayName("evaluate should let a higher-priority Allow beat a lower-priority Deny")
    void evaluate_shouldPreferPriorityOverEffect() {
        // Arrange
        Policy deny = policy("pol_a", PolicyEffect.DENY, 50, "{}");
        Policy allow = policy("pol_b", PolicyEffect.ALLOW, 100, "{}");

        // Act
        PolicyOutcome outcome = aggregator.evaluate(List.of(deny, allow), Map.of("x", 1), NOW);

        // Assert
        assertThat(outcome.kind()).isEqualTo(PolicyOutcome.Kind.ALLOWED);
        assertThat(outcome.policy()).isSameAs(allow);
    }

    @Test
    @DisplayName("evaluate should skip a higher-priority policy whose condition does not match")
    void evaluate_shouldFallThrough_whenHigherPolicyDoesNotMatch() {
        // Arrange
        Policy confidential = policy("pol_a", PolicyEffect.DENY, 500, "{\"classification\": \"Confidential\"}");
        Policy engineers = policy("pol_b", PolicyEffect.ALLOW, 10, "{\"department\": \"Engineering\"}");

        // Act
        PolicyOutcome outcome = aggregator.evaluate(
            List.of(confidential, engineers),
            Map.of("classification", "Public", "department", "Engineering"),
            NOW);

        // Assert
        assertThat(outcome.kind()).isEqualTo(PolicyOutcome.Kind.ALLOWED);
        assertThat(outcome.policy()).isSameAs(engineers);
    }

    @Test
    @DisplayName("evaluate should break priority ties by ascending id")
    void evaluate_shouldBreakTiesById() {
        Policy second = policy("pol_b", PolicyEffect.ALLOW, 100, "{}");
        Policy first = policy("pol_a", PolicyEffect.DENY, 100, "{}");

        PolicyOutcome outcome = aggregator.evaluate(List.of(second, first), Map.of("x", 1), NOW);

        assertThat(outcome.kind()).isEqualTo(PolicyOutcome.Kind.DENIED);
        assertThat(outcome.policy()).isSameAs(first);
    }

    // ========================================
    // INDETERMINATE TESTS
    // ========================================

    @Test
    @DisplayName("evaluate should be indeterminate when no policy matches")
    void evaluate_shouldBeIndeterminate_whenNothingMatches() {
        Policy policy = policy("pol_a", PolicyEffect.DENY, 500, "{\"classification\": \"Confidential\"}");

        PolicyOutcome outcome = aggregator.evaluate(List.of(policy), Map.of("classification", "Public"), NOW);

        assertThat(outcome.isDecisive()).isFalse();
        assertThat(outcome.policy()).isNull();
    }

    @Test
    @DisplayName("evaluate should ignore inactive policies")
    void evaluate_shouldIgnoreInactivePolicies() {
        Policy inactive = policy("pol_a", PolicyEffect.DENY, 500, "{}");
        inactive.active = false;

        PolicyOutcome outcome = aggregator.evaluate(List.of(inactive), Map.of("x", 1), NOW);

        assertThat(outcome.kind()).isEqualTo(PolicyOutcome.Kind.INDETERMINATE);
    }

    @Test
    @DisplayName("evaluate should be indeterminate when there are no candidates")
    void evaluate_shouldBeIndeterminate_whenNoCandidates() {
        assertThat(aggregator.evaluate(List.of(), Map.of(), NOW).kind())
            .isEqualTo(PolicyOutcome.Kind.INDETERMINATE);
    }

    // ========================================
    // ORDER INVARIANCE TESTS
    // ========================================

    @Test
    @DisplayName("evaluate should give the same outcome for every input order")
    void evaluate_shouldBeInvariantUnderPermutation() {
        // Arrange
        List<Policy> policies = List.of(
            policy("pol_1", PolicyEffect.DENY, 50, "{}"),
            policy("pol_2", PolicyEffect.ALLOW, 100, "{\"department\": \"Engineering\"}"),
            policy("pol_3", PolicyEffect.DENY, 100, "{\"department\": \"Engineering\"}"),
            policy("pol_4", PolicyEffect.ALLOW, 200, "{\"department\": \"Sales\"}"),
            policy("pol_5", PolicyEffect.DENY, 10, "{}"));
        Map<String, Object> context = Map.of("department", "Engineering");
        PolicyOutcome expected = aggregator.evaluate(policies, context, NOW);
        Random random = new Random(42);

        // Act & Assert
        for (int i = 0; i < 50; i++) {
            List<Policy> shuffled = new ArrayList<>(policies);
            Collections.shuffle(shuffled, random);
            PolicyOutcome outcome = aggregator.evaluate(shuffled, context, NOW);
            assertThat(outcome.kind()).isEqualTo(expected.kind());
            assertThat(outcome.policy()).isSameAs(expected.policy());
        }
        assertThat(expected.policy().id).isEqualTo("pol_2");
    }
}
