package com.ecoWasteEngine.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

/**
 * Base for variants served by an external inference service. The response
 * contract is {@code {"category": ..., "sub_category": ..., "confidence": 0..1}}.
 */
public abstract class AbstractHttpModelClassifier implements WasteClassifier {

    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;
    protected final String endpoint;

    protected AbstractHttpModelClassifier(RestTemplate restTemplate, ObjectMapper objectMapper, String endpoint) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }

    protected abstract String path();

    protected abstract HttpEntity<?> buildRequest(byte[] image, String contentType) throws Exception;

    @Override
    public ClassifierPrediction predict(byte[] image, String contentType) throws Exception {
        ResponseEntity<String> response = restTemplate.postForEntity(
                endpoint + path(), buildRequest(image, contentType), String.class);
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new IllegalStateException(modelName() + " answered " + response.getStatusCode());
        }
        JsonNode body = objectMapper.readTree(response.getBody());
        if (!body.hasNonNull("category") || !body.hasNonNull("confidence")) {
            throw new IllegalStateException(modelName() + " returned an incomplete prediction: " + body);
        }
        return ClassifierPrediction.fromLabels(
                body.get("category").asText(),
                body.hasNonNull("sub_category") ? body.get("sub_category").asText() : null,
                body.get("confidence").asDouble(),
                modelName());
    }
}
