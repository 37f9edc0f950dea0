package com.studygroups.studygroups_api.controller;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports service status and MongoDB connectivity.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private final MongoTemplate mongoTemplate;

    @Value("${spring.data.mongodb.uri:not-set}")
    private String mongoUri;

    public HealthController(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("service", "studygroups-api");

        Map<String, Object> mongoStatus = new HashMap<>();
        boolean connected;
        try {
            String dbName = mongoTemplate.getDb().getName();
            mongoTemplate.getDb().runCommand(new Document("ping", 1));
            mongoStatus.put("database", dbName);
            connected = true;
        } catch (Exception e) {
            mongoStatus.put("error", e.getMessage());
            logger.error("MongoDB health check failed: {}", e.getMessage(), e);
            connected = false;
        }
        mongoStatus.put("connected", connected);
        mongoStatus.put("uri", mongoUri.replaceAll(":[^:@/]+@", ":****@"));
        health.put("mongodb", mongoStatus);
        health.put("status", connected ? "ok" : "degraded");

        return connected
                ? ResponseEntity.ok(health)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
