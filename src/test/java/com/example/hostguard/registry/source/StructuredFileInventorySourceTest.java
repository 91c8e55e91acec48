package com.example.hostguard.registry.source;

import com.example.hostguard.registry.HostSource;
import com.example.hostguard.support.Fixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuredFileInventorySourceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private List<RawHostRecord> parse(Path path) {
        return new StructuredFileInventorySource(path, objectMapper).parse();
    }

    @Test
    void parsesJsonWithFlexibleFieldNames() {
        List<RawHostRecord> records = parse(Fixtures.inventory("inventory.json"));

        assertEquals(2, records.size());

        RawHostRecord api1 = records.get(0);
        assertEquals("api-01", api1.getName());
        assertEquals("10.1.0.1", api1.getAddress());
        assertEquals("production", api1.getEnvironment());
        assertEquals(List.of("api", "public"), api1.getGroups());
        assertEquals("team-api", api1.getMetadata().get("owner"));

        RawHostRecord api2 = records.get(1);
        assertEquals("api-02", api2.getName());
        assertEquals("10.1.0.2", api2.getAddress());
        assertEquals(List.of("api2", "api-backup"), api2.getAliases());
        assertEquals("staging", api2.getEnvironment());
        assertEquals("staging", api2.getMetadata().get("tag.environment"));
        assertEquals("api", api2.getMetadata().get("tag.team"));
    }

    @Test
    void parsesYamlList() {
        List<RawHostRecord> records = parse(Fixtures.inventory("inventory.yaml"));

        assertEquals(2, records.size());
        assertEquals("cache-01", records.get(0).getName());
        assertEquals("10.2.0.1", records.get(0).getAddress());
        assertEquals("development", records.get(0).getEnvironment());
        assertEquals(List.of("cache"), records.get(0).getGroups());
        assertEquals("cache-02", records.get(1).getName());
        assertEquals("10.2.0.2", records.get(1).getAddress());
    }

    @Test
    void parsesCsvRows() {
        List<RawHostRecord> records = parse(Fixtures.inventory("inventory.csv"));

        assertEquals(2, records.size());

        RawHostRecord first = records.get(0);
        assertEquals("worker-01", first.getName());
        assertEquals("10.3.0.1", first.getAddress());
        assertEquals("production", first.getEnvironment());
        assertEquals(List.of("batch", "gpu"), first.getGroups());
        assertEquals(List.of("w1"), first.getAliases());
        assertEquals("r12", first.getMetadata().get("rack"));

        RawHostRecord second = records.get(1);
        assertEquals(List.of("batch", "cpu"), second.getGroups());
        assertTrue(second.getAliases().isEmpty());
        assertEquals("staging", second.getEnvironment());
    }

    @Test
    void nullHostnameFallsThroughToNextNameField(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("nulls.json");
        Files.writeString(file, "[{\"hostname\": null, \"name\": \"web-07\", \"ip\": \"10.0.0.7\"},"
                + "{\"hostname\": \"  \", \"ip\": \"10.0.0.8\"}]");

        List<RawHostRecord> records = parse(file);

        assertEquals(1, records.size());
        assertEquals("web-07", records.get(0).getName());
        assertEquals("10.0.0.7", records.get(0).getAddress());
        assertFalse(records.get(0).getMetadata().containsKey("name"));
        assertFalse(records.get(0).getMetadata().containsKey("hostname"));
    }

    @Test
    void csvListCellKeepsCommasInsideJsonStrings(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("racks.csv");
        Files.writeString(file, "hostname,groups\n"
                + "edge-01,\"[\"\"rack-1,row-2\"\", \"\"edge\"\"]\"\n"
                + "edge-02,\"[not json, edge]\"\n");

        List<RawHostRecord> records = parse(file);

        assertEquals(List.of("rack-1,row-2", "edge"), records.get(0).getGroups());
        assertEquals(List.of("[not json", "edge]"), records.get(1).getGroups());
    }

    @Test
    void splitListHandlesJsonArraysAndDelimiters() {
        assertEquals(List.of("rack-1,row-2", "edge"), HostRecordMapper.splitList("[\"rack-1,row-2\", \"edge\"]"));
        assertEquals(List.of("a", "b"), HostRecordMapper.splitList("a|b"));
        assertEquals(List.of("a", "b"), HostRecordMapper.splitList("a, b"));
        assertTrue(HostRecordMapper.splitList("[]").isEmpty());
    }

    @Test
    void malformedFileYieldsNothing() {
        assertTrue(parse(Fixtures.inventory("malformed.json")).isEmpty());
    }

    @Test
    void missingFileYieldsNothing(@TempDir Path dir) {
        assertTrue(parse(dir.resolve("nope.json")).isEmpty());
    }

    @Test
    void objectWithoutHostListYieldsNothing(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("odd.json");
        Files.writeString(file, "{\"servers\": 3}");

        StructuredFileInventorySource source = new StructuredFileInventorySource(file, objectMapper);

        assertTrue(source.parse().isEmpty());
        assertEquals(HostSource.CUSTOM_FILE, source.type());
    }
}
