package tech.gatehouse.platform.authorization.policy.mapper;

import org.jboss.logging.Logger;
import tech.gatehouse.platform.authorization.condition.ConditionNode;
import tech.gatehouse.platform.authorization.condition.ConditionParser;
import tech.gatehouse.platform.authorization.condition.ConditionSyntaxException;
import tech.gatehouse.platform.authorization.policy.Policy;
import tech.gatehouse.platform.authorization.policy.entity.PolicyEntity;

/**
 * Mapper from stored policy rows to Policy domain objects.
 *
 * <p>Conditions are parsed here, once per load. A stored condition that no
 * longer parses yields a policy that never matches.
 */
public final class PolicyMapper {

    private static final Logger LOG = Logger.getLogger(PolicyMapper.class);

    private PolicyMapper() {
    }

    public static Policy toDomain(PolicyEntity entity) {
        if (entity == null) {
            return null;
        }

        Policy policy = new Policy();
        policy.id = entity.id;
        policy.name = entity.name;
        policy.description = entity.description;
        policy.resource = entity.resource;
        policy.action = entity.action;
        policy.effect = entity.effect;
        policy.conditions = entity.conditions;
        policy.condition = parseCondition(entity);
        policy.priority = entity.priority;
        policy.active = entity.active;
        policy.createdAt = entity.createdAt;
        policy.updatedAt = entity.updatedAt;
        return policy;
    }

    private static ConditionNode parseCondition(PolicyEntity entity) {
        try {
            return ConditionParser.parse(entity.conditions);
        } catch (ConditionSyntaxException e) {
            LOG.errorf("Policy %s (%s) has an invalid condition and will never match: %s",
                entity.id, entity.name, e.getMessage());
            return ConditionNode.never();
        }
    }
}
