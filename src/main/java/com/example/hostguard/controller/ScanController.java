package com.example.hostguard.controller;

import com.example.hostguard.scan.ScanCategory;
import com.example.hostguard.service.HostIntelligenceService;
import com.example.hostguard.service.TargetScanReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * On-demand scan REST API.
 */
@RestController
@RequestMapping("/api/scans")
@RequiredArgsConstructor
public class ScanController {

    private final HostIntelligenceService intelligenceService;

    /**
     * Scan one host. Unknown hosts are rejected with 404 and never scanned.
     */
    @PostMapping("/{name}")
    public ResponseEntity<?> scan(@PathVariable String name,
                                  @RequestParam(defaultValue = "basic") String category,
                                  @RequestParam(defaultValue = "false") boolean force) {
        Optional<ScanCategory> scanCategory = ScanCategory.fromTag(category);
        if (scanCategory.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown scan category: " + category));
        }
        TargetScanReport report = intelligenceService.scanTarget(name, scanCategory.get(), force);
        if (!report.getValidation().isValid()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(report);
        }
        return ResponseEntity.ok(report);
    }

    /**
     * Scan several hosts. Body: {"hosts": [...], "category": "system", "force": false}
     */
    @PostMapping
    @SuppressWarnings("unchecked")
    public ResponseEntity<?> scanBatch(@RequestBody Map<String, Object> body) {
        Object hosts = body.get("hosts");
        if (!(hosts instanceof List<?> list) || list.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "hosts must be a non-empty list"));
        }
        String category = String.valueOf(body.getOrDefault("category", "basic"));
        Optional<ScanCategory> scanCategory = ScanCategory.fromTag(category);
        if (scanCategory.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown scan category: " + category));
        }
        boolean force = Boolean.parseBoolean(String.valueOf(body.getOrDefault("force", "false")));
        List<String> names = ((List<Object>) list).stream().map(String::valueOf).toList();
        List<TargetScanReport> reports = intelligenceService.scanTargets(names, scanCategory.get(), force, null);
        return ResponseEntity.ok(reports);
    }
}
