package com.ecoWasteEngine.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ecoWasteEngine.model.enums.WasteSubCategory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Heavier zero-shot vision model. It scores the image against the candidate
 * labels we send, one per sub-category.
 */
public class ClipClassifier extends AbstractHttpModelClassifier {

    private static final List<String> CANDIDATE_LABELS = Arrays.stream(WasteSubCategory.values())
            .map(s -> s.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());

    public ClipClassifier(RestTemplate restTemplate, ObjectMapper objectMapper, String endpoint) {
        super(restTemplate, objectMapper, endpoint);
    }

    @Override
    public String modelName() {
        return "clip-vit-b32-waste";
    }

    @Override
    protected String path() {
        return "/v1/models/clip:predict";
    }

    @Override
    protected HttpEntity<String> buildRequest(byte[] image, String contentType) throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("image_base64", Base64.getEncoder().encodeToString(image));
        payload.put("content_type", contentType);
        payload.put("candidate_labels", CANDIDATE_LABELS);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(objectMapper.writeValueAsString(payload), headers);
    }
}
