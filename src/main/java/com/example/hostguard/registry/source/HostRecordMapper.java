package com.example.hostguard.registry.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Maps loosely structured host objects (JSON, YAML, CSV rows, cloud API
 * payloads) to {@link RawHostRecord}s by recognising common field names
 * case-insensitively. Unrecognised scalar fields become metadata.
 */
@Slf4j
public final class HostRecordMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final List<String> HOSTNAME_FIELDS = List.of("hostname", "host", "name", "server", "fqdn", "node", "machine");
    static final List<String> IP_FIELDS = List.of("ip", "ip_address", "ipaddress", "address", "addr", "ansible_host");
    static final List<String> ENV_FIELDS = List.of("environment", "env", "stage", "tier");
    static final List<String> GROUP_FIELDS = List.of("groups", "group");
    static final List<String> ALIAS_FIELDS = List.of("aliases", "alias");

    private HostRecordMapper() {}

    /**
     * Map a flat row of strings, as read from CSV. List cells may be JSON
     * arrays or pipe/comma separated.
     */
    public static Optional<RawHostRecord> fromRow(Map<String, String> row) {
        Map<String, String> lower = new LinkedHashMap<>();
        row.forEach((k, v) -> {
            if (k != null) lower.put(k.trim().toLowerCase(Locale.ROOT), v == null ? null : v.trim());
        });

        Predicate<String> hasText = v -> v != null && !v.isBlank();
        String hostnameField = firstPresent(lower, HOSTNAME_FIELDS, hasText);
        if (hostnameField == null) {
            return Optional.empty();
        }
        String ipField = firstPresent(lower, IP_FIELDS, hasText);
        String envField = firstPresent(lower, ENV_FIELDS, hasText);
        String groupField = firstPresent(lower, GROUP_FIELDS, hasText);
        String aliasField = firstPresent(lower, ALIAS_FIELDS, hasText);

        RawHostRecord.RawHostRecordBuilder builder = RawHostRecord.builder()
                .name(lower.get(hostnameField))
                .address(blankToNull(ipField == null ? null : lower.get(ipField)))
                .environment(blankToNull(envField == null ? null : lower.get(envField)));
        if (groupField != null) builder.groups(splitList(lower.get(groupField)));
        if (aliasField != null) builder.aliases(splitList(lower.get(aliasField)));

        for (Map.Entry<String, String> e : lower.entrySet()) {
            String key = e.getKey();
            if (key.equals(hostnameField) || key.equals(ipField) || key.equals(envField)
                    || key.equals(groupField) || key.equals(aliasField)) {
                continue;
            }
            if (e.getValue() != null && !e.getValue().isEmpty()) {
                builder.metadataEntry(key, e.getValue());
            }
        }
        return Optional.of(builder.build());
    }

    /**
     * Map a JSON/YAML object node. Returns empty when the node does not look
     * like a host.
     */
    public static Optional<RawHostRecord> fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        Map<String, JsonNode> lower = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            lower.put(field.getKey().toLowerCase(Locale.ROOT), field.getValue());
        }

        // null and blank fields fall through to the next candidate name
        String hostnameField = firstPresent(lower, HOSTNAME_FIELDS, HostRecordMapper::isScalarText);
        if (hostnameField == null) {
            return Optional.empty();
        }
        Predicate<JsonNode> present = n -> n != null && !n.isNull();
        String ipField = firstPresent(lower, IP_FIELDS, HostRecordMapper::isScalarText);
        String envField = firstPresent(lower, ENV_FIELDS, HostRecordMapper::isScalarText);
        String groupField = firstPresent(lower, GROUP_FIELDS, present);
        String aliasField = firstPresent(lower, ALIAS_FIELDS, present);

        RawHostRecord.RawHostRecordBuilder builder = RawHostRecord.builder()
                .name(lower.get(hostnameField).asText().trim())
                .address(scalar(lower, ipField))
                .environment(scalar(lower, envField));
        if (groupField != null) builder.groups(textList(lower.get(groupField)));
        if (aliasField != null) builder.aliases(textList(lower.get(aliasField)));

        for (Map.Entry<String, JsonNode> e : lower.entrySet()) {
            String key = e.getKey();
            if (key.equals(hostnameField) || key.equals(ipField) || key.equals(envField)
                    || key.equals(groupField) || key.equals(aliasField)) {
                continue;
            }
            if (e.getValue().isValueNode() && !e.getValue().isNull()) {
                builder.metadataEntry(key, e.getValue().asText());
            } else if (e.getValue().isObject() && key.equals("tags")) {
                // cloud payloads: flatten tags, and let an env/environment tag classify the host
                Iterator<Map.Entry<String, JsonNode>> tags = e.getValue().fields();
                while (tags.hasNext()) {
                    Map.Entry<String, JsonNode> tag = tags.next();
                    builder.metadataEntry("tag." + tag.getKey(), tag.getValue().asText());
                }
            }
        }
        if (envField == null) {
            builder.environment(tagEnvironment(lower.get("tags")));
        }
        return Optional.of(builder.build());
    }

    private static String tagEnvironment(JsonNode tags) {
        if (tags == null || !tags.isObject()) return null;
        Iterator<Map.Entry<String, JsonNode>> it = tags.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> tag = it.next();
            String key = tag.getKey().toLowerCase(Locale.ROOT);
            if (key.equals("environment") || key.equals("env")) {
                return blankToNull(tag.getValue().asText());
            }
        }
        return null;
    }

    static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null || value.isBlank()) return items;
        String trimmed = value.trim();
        if (trimmed.startsWith("[")) {
            Optional<JsonNode> array = readJsonArray(trimmed);
            if (array.isPresent()) {
                return textList(array.get());
            }
        }
        String delimiter = trimmed.contains("|") ? "\\|" : ",";
        for (String item : trimmed.split(delimiter)) {
            if (!item.trim().isEmpty()) items.add(item.trim());
        }
        return items;
    }

    private static Optional<JsonNode> readJsonArray(String value) {
        try {
            JsonNode node = MAPPER.readTree(value);
            return node.isArray() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("List cell '{}' is not a JSON array, splitting as text: {}", value, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static List<String> textList(JsonNode node) {
        List<String> items = new ArrayList<>();
        if (node == null || node.isNull()) return items;
        if (node.isArray()) {
            node.forEach(item -> {
                if (item.isValueNode() && !item.asText().isBlank()) items.add(item.asText().trim());
            });
            return items;
        }
        return node.isValueNode() ? splitList(node.asText()) : items;
    }

    private static String scalar(Map<String, JsonNode> fields, String key) {
        if (key == null) return null;
        JsonNode node = fields.get(key);
        return node != null && node.isValueNode() && !node.isNull() ? blankToNull(node.asText()) : null;
    }

    private static <V> String firstPresent(Map<String, V> fields, List<String> candidates, Predicate<V> usable) {
        for (String candidate : candidates) {
            if (fields.containsKey(candidate) && usable.test(fields.get(candidate))) return candidate;
        }
        return null;
    }

    private static boolean isScalarText(JsonNode node) {
        return node != null && node.isValueNode() && !node.isNull() && !node.asText().isBlank();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
