package tech.gatehouse.platform.authorization.condition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConditionEvaluator.
 */
class ConditionEvaluatorTest {

    private static final Instant NOON_UTC = Instant.parse("2026-03-02T12:00:00Z");

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private boolean eval(String json, Map<String, Object> context) {
        return evaluator.evaluate(ConditionParser.parse(json), context, NOON_UTC);
    }

    private boolean evalAt(String json, Instant at) {
        return evaluator.evaluate(ConditionParser.parse(json), Map.of(), at);
    }

    // ========================================
    // COMBINATOR TESTS
    // ========================================

    @Test
    @DisplayName("evaluate should return true for empty AND and false for empty OR")
    void evaluate_shouldHandleEmptyCombinators() {
        assertThat(evaluator.evaluate(new ConditionNode.And(List.of()), Map.of(), NOON_UTC)).isTrue();
        assertThat(evaluator.evaluate(new ConditionNode.Or(List.of()), Map.of(), NOON_UTC)).isFalse();
    }

    @Test
    @DisplayName("evaluate should require every AND child and any OR child")
    void evaluate_shouldCombineChildren() {
        Map<String, Object> context = Map.of("role", "editor", "level", 3);

        assertThat(eval("{\"role\": \"editor\", \"level.gt\": 2}", context)).isTrue();
        assertThat(eval("{\"role\": \"editor\", \"level.gt\": 5}", context)).isFalse();
        assertThat(eval("{\"$or\": [{\"role\": \"admin\"}, {\"level.gte\": 3}]}", context)).isTrue();
        assertThat(eval("{\"$or\": [{\"role\": \"admin\"}, {\"level.gte\": 4}]}", context)).isFalse();
    }

    // ========================================
    // LEAF TESTS
    // ========================================

    @Test
    @DisplayName("evaluate should compare equality case-insensitively")
    void evaluate_shouldMatchEquality_whenCaseDiffers() {
        assertThat(eval("{\"department\": \"engineering\"}", Map.of("department", "Engineering"))).isTrue();
        assertThat(eval("{\"department\": \"sales\"}", Map.of("department", "Engineering"))).isFalse();
    }

    @Test
    @DisplayName("evaluate should compare numbers numerically across types")
    void evaluate_shouldCompareNumerically_whenEitherSideNumeric() {
        assertThat(eval("{\"level\": 5}", Map.of("level", "5.0"))).isTrue();
        assertThat(eval("{\"level\": 5}", Map.of("level", 5L))).isTrue();
        assertThat(eval("{\"level.lte\": 5}", Map.of("level", "4"))).isTrue();
        assertThat(eval("{\"level.lt\": 5}", Map.of("level", 5))).isFalse();
    }

    @Test
    @DisplayName("evaluate should return false when context key missing")
    void evaluate_shouldReturnFalse_whenKeyMissing() {
        assertThat(eval("{\"department\": \"Engineering\"}", Map.of())).isFalse();
        assertThat(eval("{\"level.ne\": 5}", Map.of())).isFalse();
        assertThat(eval("{\"tags.contains\": \"x\"}", Map.of())).isFalse();
    }

    @Test
    @DisplayName("evaluate should return false when comparison operand is not numeric")
    void evaluate_shouldReturnFalse_whenOperandNotNumeric() {
        assertThat(eval("{\"level.gt\": 2}", Map.of("level", "high"))).isFalse();
    }

    @Test
    @DisplayName("evaluate should support not-equal")
    void evaluate_shouldSupportNotEqual() {
        assertThat(eval("{\"status.ne\": \"archived\"}", Map.of("status", "draft"))).isTrue();
        assertThat(eval("{\"status.ne\": \"archived\"}", Map.of("status", "ARCHIVED"))).isFalse();
    }

    @Test
    @DisplayName("evaluate should check membership with in")
    void evaluate_shouldCheckIn() {
        assertThat(eval("{\"region.in\": [\"EU\", \"US\"]}", Map.of("region", "eu"))).isTrue();
        assertThat(eval("{\"region.in\": [\"EU\", \"US\"]}", Map.of("region", "APAC"))).isFalse();
        assertThat(eval("{\"level.in\": [1, 2, 3]}", Map.of("level", "2"))).isTrue();
    }

    @Test
    @DisplayName("evaluate should check contains on collections and strings")
    void evaluate_shouldCheckContains() {
        assertThat(eval("{\"tags.contains\": \"urgent\"}", Map.of("tags", List.of("Urgent", "billing")))).isTrue();
        assertThat(eval("{\"tags.contains\": \"legal\"}", Map.of("tags", List.of("urgent")))).isFalse();
        assertThat(eval("{\"title.contains\": \"REPORT\"}", Map.of("title", "Quarterly report"))).isTrue();
        assertThat(eval("{\"title.contains\": \"x\"}", Map.of("title", 42))).isFalse();
    }

    @Test
    @DisplayName("evaluate should match null only against null")
    void evaluate_shouldMatchNull_whenBothNull() {
        Map<String, Object> context = new HashMap<>();
        context.put("manager", null);

        assertThat(eval("{\"manager\": null}", context)).isTrue();
        assertThat(eval("{\"manager\": \"bob\"}", context)).isFalse();
    }

    // ========================================
    // TIME RANGE TESTS
    // ========================================

    @Test
    @DisplayName("evaluate should include start and exclude end of a time range")
    void evaluate_shouldUseHalfOpenRange() {
        String range = "{\"$timeRange\": {\"start\": \"09:00\", \"end\": \"17:00\"}}";

        assertThat(evalAt(range, Instant.parse("2026-03-02T09:00:00Z"))).isTrue();
        assertThat(evalAt(range, Instant.parse("2026-03-02T16:59:59Z"))).isTrue();
        assertThat(evalAt(range, Instant.parse("2026-03-02T17:00:00Z"))).isFalse();
        assertThat(evalAt(range, Instant.parse("2026-03-02T08:59:59Z"))).isFalse();
    }

    @Test
    @DisplayName("evaluate should handle time ranges that wrap past midnight")
    void evaluate_shouldHandleWrapAround() {
        String range = "{\"$timeRange\": {\"start\": \"22:00\", \"end\": \"06:00\"}}";

        assertThat(evalAt(range, Instant.parse("2026-03-02T23:30:00Z"))).isTrue();
        assertThat(evalAt(range, Instant.parse("2026-03-02T05:00:00Z"))).isTrue();
        assertThat(evalAt(range, Instant.parse("2026-03-02T12:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("evaluate should treat equal start and end as empty range")
    void evaluate_shouldReturnFalse_whenStartEqualsEnd() {
        assertThat(evalAt("{\"$timeRange\": {\"start\": \"09:00\", \"end\": \"09:00\"}}",
            Instant.parse("2026-03-02T09:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("evaluate should convert the instant into the range timezone")
    void evaluate_shouldApplyTimezone() {
        // 08:00 UTC is 17:00 in Tokyo
        String tokyo = "{\"$timeRange\": {\"start\": \"09:00\", \"end\": \"17:00\", \"timezone\": \"Asia/Tokyo\"}}";

        assertThat(evalAt(tokyo, Instant.parse("2026-03-02T01:00:00Z"))).isTrue();
        assertThat(evalAt(tokyo, Instant.parse("2026-03-02T08:00:00Z"))).isFalse();
    }

    // ========================================
    // PURITY TESTS
    // ========================================

    @Test
    @DisplayName("evaluate should give the same answer on repeated calls and leave the context untouched")
    void evaluate_shouldBePure() {
        // Arrange
        ConditionNode node = ConditionParser.parse(
            "{\"$or\": [{\"department\": \"Engineering\"}, {\"level.gte\": 3}], \"tags.contains\": \"a\"}");
        Map<String, Object> context = new HashMap<>(Map.of("department", "Sales", "level", 4, "tags", List.of("a")));
        Map<String, Object> snapshot = new HashMap<>(context);

        // Act
        boolean first = evaluator.evaluate(node, context, NOON_UTC);
        boolean second = evaluator.evaluate(node, context, NOON_UTC);
        boolean third = new ConditionEvaluator().evaluate(node, context, NOON_UTC);

        // Assert
        assertThat(first).isTrue();
        assertThat(second).isEqualTo(first);
        assertThat(third).isEqualTo(first);
        assertThat(context).isEqualTo(snapshot);
    }
}
