package tech.gatehouse.platform.authorization.policy;

import tech.gatehouse.platform.authorization.condition.ConditionNode;

import java.time.Instant;

/**
 * An access policy evaluated against request context.
 *
 * <p>A policy targets one resource and either one action or every action
 * ({@link #WILDCARD_ACTION}). When its condition matches, its effect decides
 * the request. Among matching policies the highest priority wins; ties go to
 * the lowest id.
 *
 * <p>{@link #conditions} keeps the stored JSON document, {@link #condition}
 * the tree parsed from it when the policy was loaded. Policies are written by
 * an external management service; this side only reads them.
 */
public class Policy {

    /**
     * Action value that applies a policy to every action on its resource.
     */
    public static final String WILDCARD_ACTION = "*";

    public String id;

    public String name;

    public String description;

    public String resource;

    public String action;

    public PolicyEffect effect;

    /**
     * Condition document as stored (JSON).
     */
    public String conditions;

    /**
     * Parsed form of {@link #conditions}.
     */
    public ConditionNode condition = ConditionNode.always();

    /**
     * Higher values are evaluated first.
     */
    public int priority;

    public boolean active = true;

    public Instant createdAt;

    public Instant updatedAt;

    public Policy() {
    }

    public boolean appliesToAllActions() {
        return WILDCARD_ACTION.equals(action);
    }

    @Override
    public String toString() {
        return "Policy{" + id + ", '" + name + "', " + resource + ":" + action
            + ", " + effect + ", priority=" + priority + "}";
    }
}
