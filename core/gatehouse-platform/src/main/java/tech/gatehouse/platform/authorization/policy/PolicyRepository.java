package tech.gatehouse.platform.authorization.policy;

import java.util.List;

/**
 * Read access to stored policies.
 */
public interface PolicyRepository {

    /**
     * Active policies for {@code (resource, action)} together with the active
     * policies for {@code (resource, "*")}. Order is unspecified.
     */
    List<Policy> findActivePolicies(String resource, String action);
}
