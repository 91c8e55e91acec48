package com.example.hostguard.registry.source;

import com.example.hostguard.registry.HostSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ansible inventory in either INI or YAML form.
 *
 * INI: {@code [group]} headers, {@code hostname ansible_host=IP key=value...}
 * lines; {@code :vars} and {@code :children} sections are skipped.
 * YAML: {@code all.hosts} plus nested {@code children.<group>.hosts}.
 * Environment is inferred from group names.
 */
public class AnsibleInventorySource extends AbstractFileInventorySource {

    private static final String UNGROUPED = "ungrouped";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public AnsibleInventorySource(Path path) {
        super(path);
    }

    @Override
    public HostSource type() {
        return HostSource.ANSIBLE;
    }

    @Override
    protected List<RawHostRecord> parseContent(String content) throws IOException {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".yml") || fileName.endsWith(".yaml") || content.stripLeading().startsWith("---")) {
            return parseYaml(content);
        }
        return parseIni(content);
    }

    private List<RawHostRecord> parseIni(String content) {
        List<RawHostRecord> records = new ArrayList<>();
        String currentGroup = UNGROUPED;

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) continue;

            if (line.startsWith("[") && line.endsWith("]")) {
                String group = line.substring(1, line.length() - 1).trim();
                currentGroup = group.contains(":") ? null : group;
                continue;
            }
            if (currentGroup == null) continue;

            String[] parts = line.split("\\s+");
            RawHostRecord.RawHostRecordBuilder builder = RawHostRecord.builder()
                    .name(parts[0])
                    .group(currentGroup)
                    .environment(EnvironmentClassifier.fromGroupName(currentGroup));
            String address = null;
            for (int i = 1; i < parts.length; i++) {
                int eq = parts[i].indexOf('=');
                if (eq <= 0) continue;
                String key = parts[i].substring(0, eq);
                String value = parts[i].substring(eq + 1);
                if (key.equals("ansible_host")) {
                    address = value;
                } else {
                    builder.metadataEntry(key, value);
                }
            }
            records.add(builder.address(address).build());
        }
        return records;
    }

    private List<RawHostRecord> parseYaml(String content) throws IOException {
        JsonNode root = yamlMapper.readTree(content);
        List<RawHostRecord> records = new ArrayList<>();
        if (root == null || !root.isObject()) {
            return records;
        }
        Iterator<Map.Entry<String, JsonNode>> groups = root.fields();
        while (groups.hasNext()) {
            Map.Entry<String, JsonNode> group = groups.next();
            walkGroup(group.getKey(), group.getValue(), new ArrayDeque<>(), records);
        }
        return records;
    }

    private void walkGroup(String group, JsonNode node, Deque<String> parents, List<RawHostRecord> records) {
        if (node == null || !node.isObject()) return;
        parents.push(group);

        JsonNode hosts = node.get("hosts");
        if (hosts != null && hosts.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = hosts.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> host = it.next();
                records.add(yamlHost(host.getKey(), host.getValue(), parents));
            }
        }

        JsonNode children = node.get("children");
        if (children != null && children.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = children.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> child = it.next();
                walkGroup(child.getKey(), child.getValue(), parents, records);
            }
        }
        parents.pop();
    }

    private RawHostRecord yamlHost(String name, JsonNode vars, Deque<String> parents) {
        RawHostRecord.RawHostRecordBuilder builder = RawHostRecord.builder().name(name);
        String environment = null;
        // innermost group first
        for (String group : parents) {
            if (!group.equals("all")) {
                builder.group(group);
            }
            if (environment == null) {
                environment = EnvironmentClassifier.fromGroupName(group);
            }
        }
        if (parents.size() == 1 && parents.peek().equals("all")) {
            builder.group(UNGROUPED);
        }
        builder.environment(environment);

        if (vars != null && vars.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = vars.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> var = it.next();
                if (!var.getValue().isValueNode()) continue;
                if (var.getKey().equals("ansible_host")) {
                    builder.address(var.getValue().asText());
                } else {
                    builder.metadataEntry(var.getKey(), var.getValue().asText());
                }
            }
        }
        return builder.build();
    }
}
