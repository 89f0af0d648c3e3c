package com.nevis.pdfscan.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    @Value("${app.version:0.1.0}")
    private String version;

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "version", version);
    }
}
