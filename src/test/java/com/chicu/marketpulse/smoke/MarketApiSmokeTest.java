package com.chicu.marketpulse.smoke;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class MarketApiSmokeTest {

    @LocalServerPort
    int port;

    private final TestRestTemplate rest = new TestRestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    @Test
    void trackedTickers_areSeededOnStartup() {
        ResponseEntity<Map> prices = rest.getForEntity(url("/api/prices"), Map.class);
        ResponseEntity<Map> stats = rest.getForEntity(url("/api/stats"), Map.class);

        assertEquals(200, prices.getStatusCode().value());
        assertTrue(prices.getBody().containsKey("AAPL"));
        assertTrue(prices.getBody().containsKey("TSLA"));
        assertTrue(stats.getBody().containsKey("AAPL"));
    }

    @Test
    void singlePrice_withProvidersDisabled_isMock() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/api/prices/aapl"), Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertEquals("AAPL", resp.getBody().get("symbol"));
        assertEquals("mock", resp.getBody().get("provenance"));
        assertTrue(((Number) resp.getBody().get("price")).doubleValue() > 0);
    }

    @Test
    void history_isSyntheticAndBounded() {
        ResponseEntity<List> resp = rest.getForEntity(url("/api/history/AAPL?period=5y&interval=1m"), List.class);

        assertEquals(200, resp.getStatusCode().value());
        assertFalse(resp.getBody().isEmpty());
        assertTrue(resp.getBody().size() <= 500);
    }

    @Test
    void history_invalidPeriod_is400() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/api/history/AAPL?period=2w&interval=1m"), Map.class);

        assertEquals(400, resp.getStatusCode().value());
        assertEquals(400, resp.getBody().get("code"));
        assertTrue(String.valueOf(resp.getBody().get("message")).contains("period"));
    }

    @Test
    void feedStatus_reportsDemoMode() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/api/feed/status"), Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertEquals(Boolean.TRUE, resp.getBody().get("demoMode"));
        assertEquals(Boolean.FALSE, resp.getBody().get("connected"));
        assertEquals("DISCONNECTED", resp.getBody().get("state"));
    }

    @Test
    void alerts_createListDelete() {
        ResponseEntity<Map> created = rest.postForEntity(url("/api/alerts"),
                Map.of("owner", "smoke", "symbol", "msft", "kind", "price_above", "threshold", 10_000.0),
                Map.class);

        assertEquals(201, created.getStatusCode().value());
        Number id = (Number) created.getBody().get("id");
        assertEquals("MSFT", created.getBody().get("symbol"));
        assertEquals("price_above", created.getBody().get("kind"));
        assertEquals(Boolean.TRUE, created.getBody().get("active"));

        ResponseEntity<List> listed = rest.getForEntity(url("/api/alerts?owner=smoke"), List.class);
        assertEquals(1, listed.getBody().size());

        ResponseEntity<Map> deleted = rest.exchange(url("/api/alerts/" + id), HttpMethod.DELETE, null, Map.class);
        assertEquals(200, deleted.getStatusCode().value());

        ResponseEntity<List> after = rest.getForEntity(url("/api/alerts?owner=smoke"), List.class);
        assertTrue(after.getBody().isEmpty());
    }

    @Test
    void alerts_invalidThreshold_is400_unknownId_is404() {
        ResponseEntity<Map> bad = rest.postForEntity(url("/api/alerts"),
                Map.of("symbol", "AAPL", "kind", "price_below", "threshold", -1),
                Map.class);
        assertEquals(400, bad.getStatusCode().value());

        ResponseEntity<Map> missing = rest.exchange(url("/api/alerts/987654"), HttpMethod.DELETE, null, Map.class);
        assertEquals(404, missing.getStatusCode().value());
    }
}
