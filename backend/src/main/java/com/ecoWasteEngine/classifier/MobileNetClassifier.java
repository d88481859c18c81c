package com.ecoWasteEngine.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

/** Lightweight CNN; the image is posted as the raw request body. */
public class MobileNetClassifier extends AbstractHttpModelClassifier {

    public MobileNetClassifier(RestTemplate restTemplate, ObjectMapper objectMapper, String endpoint) {
        super(restTemplate, objectMapper, endpoint);
    }

    @Override
    public String modelName() {
        return "mobilenet-v3-waste";
    }

    @Override
    protected String path() {
        return "/v1/models/mobilenet:predict";
    }

    @Override
    protected HttpEntity<byte[]> buildRequest(byte[] image, String contentType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(contentType));
        return new HttpEntity<>(image, headers);
    }
}
