package tech.gatehouse.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for all entities.
 *
 * TSIDs are time-sortable 64-bit ids rendered as 13 Crockford base32 characters,
 * so rows keep creation order in indexes and ids are safe to pass through JSON.
 */
public class TsidGenerator {

    public static final String SEPARATOR = "_";

    /**
     * Generate a new ID for the given entity type, e.g. "rtk_0HZXEQ5Y8JY5Z".
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        String tsid = TsidCreator.getTsid().toString();
        return type.usePrefix() ? type.prefix() + SEPARATOR + tsid : tsid;
    }

    private TsidGenerator() {
        // Utility class
    }
}
