package tech.gatehouse.platform.shared;

/**
 * Entity types with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix: "{prefix}_{tsid}" (e.g., "prn_0HZXEQ5Y8JY5Z"),
 * 17 characters in total. Login history rows are high-volume and use raw TSIDs.
 */
public enum EntityType {

    PRINCIPAL("prn"),
    ROLE("rol"),
    PERMISSION("prm"),
    POLICY("pol"),
    REFRESH_TOKEN("rtk"),
    LOGIN_HISTORY("lgh", false);

    private final String prefix;
    private final boolean usePrefix;

    EntityType(String prefix) {
        this(prefix, true);
    }

    EntityType(String prefix, boolean usePrefix) {
        this.prefix = prefix;
        this.usePrefix = usePrefix;
    }

    public String prefix() {
        return prefix;
    }

    public boolean usePrefix() {
        return usePrefix;
    }
}
