package com.example.dbmonitor.controller;

import com.example.dbmonitor.cache.ContextCacheService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final ContextCacheService cacheService;

    @GetMapping("/status")
    public ResponseEntity<ContextCacheService.CacheStatus> status() {
        return ResponseEntity.ok(cacheService.status());
    }

    @DeleteMapping("/{targetId}")
    public ResponseEntity<Map<String, Object>> invalidate(@PathVariable String targetId) {
        boolean invalidated = cacheService.invalidate(targetId);
        return ResponseEntity.ok(Map.of("targetId", targetId, "invalidated", invalidated));
    }
}
