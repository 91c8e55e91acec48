package com.example.hostguard.registry.source;

import com.example.hostguard.registry.HostSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Operator-maintained inventory in JSON, YAML or CSV, picked by file
 * extension. JSON and YAML may be a list of host objects or an object with a
 * {@code hosts} list.
 */
@Slf4j
public class StructuredFileInventorySource extends AbstractFileInventorySource {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public StructuredFileInventorySource(Path path, ObjectMapper jsonMapper) {
        super(path);
        this.jsonMapper = jsonMapper;
    }

    @Override
    public HostSource type() {
        return HostSource.CUSTOM_FILE;
    }

    @Override
    protected List<RawHostRecord> parseContent(String content) throws IOException {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".csv")) {
            return parseCsv(content);
        }
        JsonNode root = fileName.endsWith(".yml") || fileName.endsWith(".yaml")
                ? yamlMapper.readTree(content)
                : jsonMapper.readTree(content);
        return fromTree(root, name());
    }

    static List<RawHostRecord> fromTree(JsonNode root, String sourceName) {
        List<RawHostRecord> records = new ArrayList<>();
        if (root == null) return records;
        JsonNode hosts = root.isObject() && root.has("hosts") ? root.get("hosts") : root;
        if (!hosts.isArray()) {
            log.warn("Inventory {} has no host list", sourceName);
            return records;
        }
        int skipped = 0;
        for (JsonNode node : hosts) {
            var record = HostRecordMapper.fromNode(node);
            if (record.isPresent()) {
                records.add(record.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} entries without a hostname in {}", skipped, sourceName);
        }
        return records;
    }

    private List<RawHostRecord> parseCsv(String content) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        List<RawHostRecord> records = new ArrayList<>();
        try (CSVParser parser = format.parse(new StringReader(content))) {
            for (CSVRecord row : parser) {
                HostRecordMapper.fromRow(row.toMap()).ifPresent(records::add);
            }
        }
        return records;
    }
}
