package com.example.hostguard.controller;

import com.example.hostguard.cache.CacheCategory;
import com.example.hostguard.cache.CacheManager;
import com.example.hostguard.cache.CacheStatsSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * Cache inspection and invalidation.
 */
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final CacheManager cacheManager;

    @GetMapping("/stats")
    public ResponseEntity<CacheStatsSnapshot> stats() {
        return ResponseEntity.ok(cacheManager.getStats());
    }

    /**
     * Clear everything, or one category when given.
     */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clear(@RequestParam(required = false) String category) {
        if (category == null) {
            cacheManager.clear();
            return ResponseEntity.ok(Map.of("cleared", "all"));
        }
        Optional<CacheCategory> parsed = CacheCategory.fromTag(category);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown cache category: " + category));
        }
        int removed = cacheManager.clear(parsed.get());
        return ResponseEntity.ok(Map.of("cleared", parsed.get().getTag(), "entries", removed));
    }

    @DeleteMapping("/hosts/{hostname}")
    public ResponseEntity<Map<String, Object>> invalidateHost(@PathVariable String hostname) {
        int removed = cacheManager.invalidateHost(hostname);
        return ResponseEntity.ok(Map.of("hostname", hostname, "entries", removed));
    }
}
