package tech.gatehouse.platform.authorization.condition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses condition documents into {@link ConditionNode} trees.
 *
 * <p>Document shape:
 * <pre>
 * {
 *   "department": "Engineering",                 // equality
 *   "clearance.gte": 3,                          // comparison
 *   "region.in": ["EU", "US"],                   // membership
 *   "$or": [ { "role": "admin" }, { "owner": true } ],
 *   "$timeRange": { "start": "09:00", "end": "17:00", "timezone": "Europe/Paris" }
 * }
 * </pre>
 *
 * <p>Keys of one object are combined with AND. An operator suffix is taken from
 * the last dot of the key; when the suffix is not a known operator the full key
 * is an equality field, so dotted attribute names keep working.
 */
public final class ConditionParser {

    public static final String AND = "$and";
    public static final String OR = "$or";
    public static final String TIME_RANGE = "$timeRange";

    private static final String EQ_SUFFIX = "eq";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConditionParser() {
    }

    /**
     * Parse a JSON condition document. {@code null}, blank and {@code {}} yield a condition that always holds.
     *
     * @throws ConditionSyntaxException if the document is not valid JSON or has an invalid shape
     */
    public static ConditionNode parse(String json) {
        if (json == null || json.isBlank()) {
            return ConditionNode.always();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConditionSyntaxException("Condition is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    /**
     * Parse an already decoded condition document.
     *
     * @throws ConditionSyntaxException if the document has an invalid shape
     */
    public static ConditionNode parse(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return ConditionNode.always();
        }
        return parseObject(root, "$");
    }

    private static ConditionNode parseObject(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new ConditionSyntaxException("Condition at " + path + " must be an object");
        }
        List<ConditionNode> terms = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            terms.add(parseEntry(field.getKey(), field.getValue(), path));
        }
        return terms.size() == 1 ? terms.get(0) : new ConditionNode.And(terms);
    }

    private static ConditionNode parseEntry(String key, JsonNode value, String path) {
        if (key.isBlank()) {
            throw new ConditionSyntaxException("Blank condition key at " + path);
        }
        if (key.startsWith("$")) {
            String childPath = path + "." + key;
            return switch (key) {
                case AND -> new ConditionNode.And(parseChildren(value, childPath));
                case OR -> new ConditionNode.Or(parseChildren(value, childPath));
                case TIME_RANGE -> parseTimeRange(value, childPath);
                default -> throw new ConditionSyntaxException("Unknown combinator '" + key + "' at " + path);
            };
        }

        int dot = key.lastIndexOf('.');
        if (dot > 0 && dot < key.length() - 1) {
            String field = key.substring(0, dot);
            String suffix = key.substring(dot + 1);

            if (EQ_SUFFIX.equalsIgnoreCase(suffix)) {
                return new ConditionNode.Equals(field, literal(value));
            }

            Optional<ComparisonOperator> comparison = ComparisonOperator.fromSuffix(suffix);
            if (comparison.isPresent()) {
                return new ConditionNode.Compare(field, comparison.get(), literal(value));
            }

            Optional<MembershipOperator> membership = MembershipOperator.fromSuffix(suffix);
            if (membership.isPresent()) {
                if (membership.get() == MembershipOperator.IN && !value.isArray()) {
                    throw new ConditionSyntaxException(
                        "Operator 'in' on '" + field + "' at " + path + " requires an array");
                }
                return new ConditionNode.Membership(field, membership.get(), literal(value));
            }
        }

        return new ConditionNode.Equals(key, literal(value));
    }

    private static List<ConditionNode> parseChildren(JsonNode value, String path) {
        if (value == null || !value.isArray()) {
            throw new ConditionSyntaxException("Combinator at " + path + " requires an array of conditions");
        }
        List<ConditionNode> children = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            children.add(parseObject(value.get(i), path + "[" + i + "]"));
        }
        return children;
    }

    private static ConditionNode parseTimeRange(JsonNode value, String path) {
        if (value == null || !value.isObject()) {
            throw new ConditionSyntaxException("Time range at " + path + " must be an object");
        }
        LocalTime start = parseTime(value.get("start"), "start", path);
        LocalTime end = parseTime(value.get("end"), "end", path);

        ZoneId zone = ZoneOffset.UTC;
        JsonNode timezone = value.get("timezone");
        if (timezone != null && !timezone.isNull()) {
            if (!timezone.isTextual()) {
                throw new ConditionSyntaxException("Time range timezone at " + path + " must be a string");
            }
            try {
                zone = ZoneId.of(timezone.asText());
            } catch (DateTimeException e) {
                throw new ConditionSyntaxException(
                    "Unknown timezone '" + timezone.asText() + "' at " + path, e);
            }
        }
        return new ConditionNode.TimeRange(start, end, zone);
    }

    private static LocalTime parseTime(JsonNode node, String name, String path) {
        if (node == null || !node.isTextual()) {
            throw new ConditionSyntaxException("Time range at " + path + " requires a '" + name + "' time");
        }
        try {
            return LocalTime.parse(node.asText());
        } catch (DateTimeException e) {
            throw new ConditionSyntaxException(
                "Invalid " + name + " time '" + node.asText() + "' at " + path + " (expected HH:mm)", e);
        }
    }

    private static Object literal(JsonNode value) {
        return MAPPER.convertValue(value, Object.class);
    }
}
