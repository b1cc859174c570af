package com.chicu.marketpulse.smoke;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ActuatorHealthSmokeTest {

    @LocalServerPort
    int port;

    private final TestRestTemplate rest = new TestRestTemplate();

    @Test
    @SuppressWarnings("unchecked")
    void actuatorHealthShouldBeUp_withFeedInDemoMode() {
        ResponseEntity<Map> resp = rest.getForEntity("http://localhost:" + port + "/actuator/health", Map.class);
        assertEquals(200, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals("UP", resp.getBody().get("status"));

        Map<String, Object> components = (Map<String, Object>) resp.getBody().get("components");
        Map<String, Object> feed = (Map<String, Object>) components.get("feed");
        assertEquals("UP", feed.get("status"));

        Map<String, Object> details = (Map<String, Object>) feed.get("details");
        assertEquals(Boolean.TRUE, details.get("demo"));
        assertEquals(Boolean.FALSE, details.get("exhausted"));
    }
}
