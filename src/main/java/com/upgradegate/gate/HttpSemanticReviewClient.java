package com.upgradegate.gate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * POSTs the review request as JSON and reads back
 * {@code {"approve": bool, "reason": str, "confidence": 0..1, "additional_checks": [str]}}.
 * Any deviation from that shape is a review failure.
 */
public class HttpSemanticReviewClient implements SemanticReviewClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String url;

    public HttpSemanticReviewClient(RestTemplate restTemplate, ObjectMapper objectMapper, String url) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.url = url;
    }

    @Override
    public ReviewResponse review(ReviewRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(request, headers), String.class);
        } catch (RestClientException ex) {
            throw new SemanticReviewException("review service call failed: " + ex.getMessage(), ex);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new SemanticReviewException("review service answered " + response.getStatusCode().value());
        }
        if (response.getBody() == null || response.getBody().isBlank()) {
            throw new SemanticReviewException("review service returned an empty body");
        }
        return parse(response.getBody());
    }

    ReviewResponse parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new SemanticReviewException("review response is not valid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new SemanticReviewException("review response must be a JSON object");
        }

        JsonNode approve = root.get("approve");
        if (approve == null || !approve.isBoolean()) {
            throw new SemanticReviewException("review response field 'approve' must be a boolean");
        }
        JsonNode reason = root.get("reason");
        if (reason == null || !reason.isTextual()) {
            throw new SemanticReviewException("review response field 'reason' must be a string");
        }
        JsonNode confidence = root.get("confidence");
        if (confidence == null || !confidence.isNumber()) {
            throw new SemanticReviewException("review response field 'confidence' must be a number");
        }

        List<String> additionalChecks = new ArrayList<>();
        JsonNode checks = root.get("additional_checks");
        if (checks != null && !checks.isNull()) {
            if (!checks.isArray()) {
                throw new SemanticReviewException("review response field 'additional_checks' must be an array");
            }
            for (JsonNode check : checks) {
                if (!check.isTextual()) {
                    throw new SemanticReviewException("additional_checks entries must be strings");
                }
                additionalChecks.add(check.asText());
            }
        }

        return new ReviewResponse(approve.booleanValue(), reason.asText(), confidence.doubleValue(), additionalChecks);
    }
}
