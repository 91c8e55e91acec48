package com.example.hostguard.registry.source;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Base for file-backed sources: a missing file is normal and yields nothing,
 * an unreadable or malformed one is logged and yields nothing.
 */
@Slf4j
public abstract class AbstractFileInventorySource implements InventorySource {

    protected final Path path;

    protected AbstractFileInventorySource(Path path) {
        this.path = path;
    }

    @Override
    public String name() {
        return type().getTag() + ":" + path;
    }

    @Override
    public List<RawHostRecord> parse() {
        if (!Files.isRegularFile(path)) {
            log.debug("Inventory file not found: {}", path);
            return List.of();
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            List<RawHostRecord> records = parseContent(content);
            log.debug("Parsed {} hosts from {}", records.size(), name());
            return records;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load inventory {}: {}", name(), e.getMessage());
            return List.of();
        }
    }

    protected abstract List<RawHostRecord> parseContent(String content) throws IOException;
}
