package com.vidfeed.controller;

import com.vidfeed.model.ResourceManagerStats;
import com.vidfeed.model.VideoIdentifier;
import com.vidfeed.model.VideoStatus;
import com.vidfeed.service.VideoResourceManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only diagnostics over the resource manager. Commands stay with the in-process UI.
 */
@RestController
@RequestMapping("/api/videos")
@Slf4j
public class VideoResourceController {

    @Autowired
    private VideoResourceManager videoResourceManager;

    @GetMapping("/{videoId}/status")
    public ResponseEntity<Map<String, Object>> getStatus(@PathVariable String videoId) {
        if (videoId == null || videoId.isEmpty() || !videoId.matches("[a-zA-Z0-9_\\-:.]+")) {
            log.warn("Invalid video id format requested: {}", videoId);
            return ResponseEntity.badRequest().build();
        }

        VideoStatus status = videoResourceManager.getStatus(VideoIdentifier.of(videoId));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("videoId", videoId);
        body.put("state", status.getState());
        body.put("failureKind", status.getFailureKind());
        body.put("failureMessage", status.getFailureMessage());
        body.put("failureCount", status.getFailureCount());
        body.put("nextRetryAt", status.getNextRetryAt() == null ? null : status.getNextRetryAt().toString());
        body.put("updatedAt", status.getUpdatedAt() == null ? null : status.getUpdatedAt().toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<ResourceManagerStats> getStats() {
        return ResponseEntity.ok(videoResourceManager.getStats());
    }

    @GetMapping("/ready")
    public ResponseEntity<List<String>> getReadyVideos() {
        return ResponseEntity.ok(toValues(videoResourceManager.readyVideos()));
    }

    @GetMapping("/window")
    public ResponseEntity<List<String>> getWindow() {
        return ResponseEntity.ok(toValues(videoResourceManager.currentWindow()));
    }

    private List<String> toValues(List<VideoIdentifier> identifiers) {
        return identifiers.stream().map(VideoIdentifier::getValue).collect(Collectors.toList());
    }
}
