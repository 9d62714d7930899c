package com.vidfeed.controller;

import com.vidfeed.model.ResourceManagerStats;
import com.vidfeed.service.VideoResourceManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Health check endpoint for monitoring
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class HealthController {

    @Autowired
    private VideoResourceManager videoResourceManager;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        ResourceManagerStats stats = videoResourceManager.getStats();

        Map<String, Object> health = new HashMap<>();
        health.put("status", stats.isShutdown() ? "DOWN" : "UP");
        health.put("timestamp", LocalDateTime.now().toString());
        health.put("service", "vidfeed");
        health.put("version", "0.0.1-SNAPSHOT");
        health.put("activeSlots", stats.getActiveSlots());
        health.put("capacity", stats.getCapacity());

        return ResponseEntity.ok(health);
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("pong");
    }
}
