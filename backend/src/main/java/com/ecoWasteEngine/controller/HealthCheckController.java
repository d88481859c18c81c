package com.ecoWasteEngine.controller;

import com.ecoWasteEngine.classifier.ClassifierAdapter;
import com.ecoWasteEngine.config.WasteEngineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthCheckController {

    private final WasteEngineProperties properties;
    private final ClassifierAdapter classifierAdapter;

    @GetMapping
    public Map<String, Object> checkHealth() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("store", properties.getStore());
        body.put("classifier", classifierAdapter.modelName());
        return body;
    }
}
