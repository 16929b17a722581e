package tech.gatehouse.platform.authorization;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

/**
 * Configuration for authorization decisions.
 *
 * <pre>
 * gatehouse.authorization.permission-cache-ttl=PT15M
 * gatehouse.authorization.relationship-cache-ttl=PT10M
 * </pre>
 */
@ConfigMapping(prefix = "gatehouse.authorization")
public interface AuthorizationConfig {

    /**
     * How long a principal's resolved permission set stays cached.
     */
    @WithName("permission-cache-ttl")
    @WithDefault("PT15M")
    Duration permissionCacheTtl();

    /**
     * How long a relationship lookup result stays cached.
     */
    @WithName("relationship-cache-ttl")
    @WithDefault("PT10M")
    Duration relationshipCacheTtl();
}
