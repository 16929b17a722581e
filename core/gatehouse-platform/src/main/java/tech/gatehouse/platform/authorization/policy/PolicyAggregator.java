package tech.gatehouse.platform.authorization.policy;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.authorization.condition.ConditionEvaluator;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Resolves candidate policies into a single outcome.
 *
 * <p>Candidates are ordered by priority (highest first), ties broken by
 * ascending id, so the outcome does not depend on the order they were loaded
 * in. The first policy whose condition matches decides; remaining policies are
 * not evaluated. Priority is authoritative over effect: a DENY at priority 50
 * loses to a matching ALLOW at priority 100.
 */
@ApplicationScoped
public class PolicyAggregator {

    private static final Logger LOG = Logger.getLogger(PolicyAggregator.class);

    static final Comparator<Policy> EVALUATION_ORDER = Comparator
        .comparingInt((Policy p) -> p.priority).reversed()
        .thenComparing(p -> p.id);

    @Inject
    ConditionEvaluator evaluator;

    public PolicyAggregator() {
    }

    public PolicyAggregator(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public PolicyOutcome evaluate(Collection<Policy> candidates, Map<String, Object> context, Instant at) {
        List<Policy> ordered = candidates.stream()
            .filter(p -> p.active)
            .sorted(EVALUATION_ORDER)
            .toList();

        for (Policy policy : ordered) {
            if (evaluator.evaluate(policy.condition, context, at)) {
                LOG.debugf("Policy %s (%s, priority %d) matched with effect %s",
                    policy.id, policy.name, policy.priority, policy.effect);
                return PolicyOutcome.matched(policy);
            }
        }

        LOG.debugf("No policy matched among %d candidates", ordered.size());
        return PolicyOutcome.indeterminate();
    }
}
