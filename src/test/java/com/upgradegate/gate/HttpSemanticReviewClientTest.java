package com.upgradegate.gate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.upgradegate.health.HealthSnapshot;
import com.upgradegate.inventory.Device;
import com.upgradegate.policy.Policy;
import com.upgradegate.policy.Verdict;
import com.upgradegate.policy.VerdictSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpSemanticReviewClientTest {

    private static final String URL = "http://review.local/v1/review";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Nested
    class Parsing {

        private final HttpSemanticReviewClient client =
            new HttpSemanticReviewClient(new RestTemplate(), objectMapper, URL);

        @Test
        void parsesWellFormedResponse() {
            ReviewResponse response = client.parse("""
                {"approve": true, "reason": "ok to proceed", "confidence": 0.85,
                 "additional_checks": ["verify_ospf", "verify_bgp"]}
                """);

            assertTrue(response.approve());
            assertEquals("ok to proceed", response.reason());
            assertEquals(0.85, response.confidence());
            assertEquals(List.of("verify_ospf", "verify_bgp"), response.additionalChecks());
        }

        @Test
        void additionalChecksAreOptional() {
            ReviewResponse response = client.parse("{\"approve\": false, \"reason\": \"no\", \"confidence\": 1}");
            assertFalse(response.approve());
            assertTrue(response.additionalChecks().isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "not json",
            "[1, 2]",
            "{\"reason\": \"r\", \"confidence\": 0.5}",
            "{\"approve\": \"yes\", \"reason\": \"r\", \"confidence\": 0.5}",
            "{\"approve\": true, \"confidence\": 0.5}",
            "{\"approve\": true, \"reason\": \"\", \"confidence\": 0.5}",
            "{\"approve\": true, \"reason\": \"r\"}",
            "{\"approve\": true, \"reason\": \"r\", \"confidence\": \"high\"}",
            "{\"approve\": true, \"reason\": \"r\", \"confidence\": 1.5}",
            "{\"approve\": true, \"reason\": \"r\", \"confidence\": 0.5, \"additional_checks\": \"x\"}",
            "{\"approve\": true, \"reason\": \"r\", \"confidence\": 0.5, \"additional_checks\": [1]}"
        })
        void rejectsMalformedResponses(String body) {
            assertThrows(SemanticReviewException.class, () -> client.parse(body));
        }
    }

    @Nested
    class Transport {

        private RestTemplate restTemplate;
        private MockRestServiceServer server;
        private HttpSemanticReviewClient client;

        private final ReviewRequest request = new ReviewRequest(
            new Device("R1", "edge-r1", "10.0.0.1", "cisco", "ISR4331", "16.9.4", "17.3.5", null, null),
            new Policy("cisco", "ISR4331", Policy.Origin.DEFAULTS, 70, 30, 0, true, false, null,
                Duration.ofHours(2), List.of()),
            HealthSnapshot.of("R1", Duration.ofHours(2), 45.0, 60.0, 0),
            new Verdict(true, "All conditions met", "17.3.5", 0.8, VerdictSource.RULE, List.of(), List.of()),
            "reviewer-v1");

        @BeforeEach
        void setUp() {
            restTemplate = new RestTemplate();
            server = MockRestServiceServer.bindTo(restTemplate).build();
            client = new HttpSemanticReviewClient(restTemplate, objectMapper, URL);
        }

        @Test
        void postsRequestAndParsesAnswer() {
            server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.device.id").value("R1"))
                .andExpect(jsonPath("$.rule_verdict.approve").value(true))
                .andRespond(withSuccess("{\"approve\": true, \"reason\": \"fine\", \"confidence\": 0.9}",
                    MediaType.APPLICATION_JSON));

            ReviewResponse response = client.review(request);

            assertEquals("fine", response.reason());
            server.verify();
        }

        @Test
        void serverErrorIsReviewFailure() {
            server.expect(requestTo(URL)).andRespond(withServerError());

            assertThrows(SemanticReviewException.class, () -> client.review(request));
        }

        @Test
        void emptyBodyIsReviewFailure() {
            server.expect(requestTo(URL)).andRespond(withSuccess("", MediaType.APPLICATION_JSON));

            assertThrows(SemanticReviewException.class, () -> client.review(request));
        }
    }
}
