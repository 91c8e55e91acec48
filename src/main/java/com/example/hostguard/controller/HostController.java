package com.example.hostguard.controller;

import com.example.hostguard.registry.Host;
import com.example.hostguard.registry.HostFilter;
import com.example.hostguard.registry.HostRegistry;
import com.example.hostguard.registry.HostSource;
import com.example.hostguard.registry.HostValidationResult;
import com.example.hostguard.registry.RegistryStats;
import com.example.hostguard.service.HostIntelligenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Host inventory REST API: the only way the agent layer learns whether a
 * host is real.
 */
@RestController
@RequestMapping("/api/hosts")
@RequiredArgsConstructor
public class HostController {

    private final HostIntelligenceService intelligenceService;
    private final HostRegistry registry;

    /**
     * List hosts, optionally filtered.
     */
    @GetMapping
    public ResponseEntity<?> listHosts(
            @RequestParam(required = false) String environment,
            @RequestParam(required = false) String group,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String pattern) {

        HostSource hostSource = null;
        if (source != null) {
            Optional<HostSource> parsed = HostSource.fromTag(source);
            if (parsed.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown source: " + source));
            }
            hostSource = parsed.get();
        }
        HostFilter filter = HostFilter.builder()
                .environment(environment)
                .group(group)
                .source(hostSource)
                .pattern(pattern)
                .build();
        try {
            List<Host> hosts = intelligenceService.searchHosts(filter);
            return ResponseEntity.ok(hosts);
        } catch (PatternSyntaxException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid pattern: " + e.getDescription()));
        }
    }

    /**
     * Validate a hostname. Unknown hosts come back as 404 with suggestions.
     */
    @GetMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(@RequestParam String name) {
        HostValidationResult result = intelligenceService.validateTarget(name);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", result.isValid());
        body.put("query", result.getOriginalQuery());
        if (result.isValid()) {
            body.put("host", result.getHost());
            return ResponseEntity.ok(body);
        }
        body.put("error", result.getErrorMessage());
        body.put("suggestions", result.getSuggestions());
        body.put("message", result.getSuggestionText());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    /**
     * Declare a host real by hand.
     */
    @PostMapping("/manual")
    public ResponseEntity<?> registerManual(@RequestBody Map<String, String> body) {
        String hostname = body.get("hostname");
        if (hostname == null || hostname.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "hostname is required"));
        }
        Host host = intelligenceService.registerManualHost(hostname, body.get("ip_address"), body.get("environment"));
        return ResponseEntity.ok(host);
    }

    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload(@RequestParam(defaultValue = "false") boolean force) {
        int count = intelligenceService.reloadInventory(force);
        return ResponseEntity.ok(Map.of("hosts", count, "forced", force));
    }

    @GetMapping("/stats")
    public ResponseEntity<RegistryStats> stats() {
        return ResponseEntity.ok(registry.getStats());
    }
}
