package com.flagship.bookstore.projection;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/projections")
@RequiredArgsConstructor
public class ProjectionAdminController {

    private final ProjectionWorker worker;
    private final ProjectionRebuilder rebuilder;

    @PostMapping("/rebuild")
    public ResponseEntity<ProjectionRebuilder.RebuildResult> rebuild() {
        return ResponseEntity.ok(rebuilder.rebuild());
    }

    @PostMapping("/catch-up")
    public ResponseEntity<Map<String, Object>> catchUp() {
        int read = worker.catchUp();
        return ResponseEntity.ok(Map.of("eventsRead", read, "checkpoint", worker.checkpoint()));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("backlog", worker.backlog());
        status.put("deadLettered", worker.deadLetteredCount());
        status.put("checkpoint", worker.checkpoint());
        Instant lastDrainAt = worker.lastDrainAt();
        status.put("lastDrainAt", lastDrainAt != null ? lastDrainAt.toString() : null);
        return ResponseEntity.ok(status);
    }
}
