package com.chicu.marketpulse.market.provider;

import com.chicu.marketpulse.market.history.HistoryInterval;
import com.chicu.marketpulse.market.history.HistoryPeriod;
import com.chicu.marketpulse.market.model.Candle;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Finnhub REST: /quote (первичный источник цены) и /stock/candle (история).
 */
@Slf4j
@Component
@Order(1)
public class FinnhubMarketDataProvider implements QuoteProvider, CandleProvider {

    private final RestTemplate http;
    private final ProviderProperties.Finnhub props;
    private final Clock clock;

    @Autowired
    public FinnhubMarketDataProvider(@Qualifier("marketRestTemplate") RestTemplate http,
                                     ProviderProperties props) {
        this(http, props, Clock.systemUTC());
    }

    FinnhubMarketDataProvider(RestTemplate http, ProviderProperties props, Clock clock) {
        this.http = http;
        this.props = props.getFinnhub();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "finnhub";
    }

    @Override
    public boolean isEnabled() {
        return props.getApiKey() != null && !props.getApiKey().isBlank();
    }

    @Override
    public Duration getTimeout() {
        return props.getQuoteTimeout();
    }

    @Override
    public Duration getHistoryTimeout() {
        return props.getHistoryTimeout();
    }

    // =====================================================================
    // QUOTE
    // =====================================================================

    @Override
    public double fetchQuote(String symbol) {
        requireEnabled();

        URI uri = UriComponentsBuilder.fromHttpUrl(props.getBaseUrl())
                .path("/quote")
                .queryParam("symbol", symbol)
                .queryParam("token", props.getApiKey())
                .build()
                .toUri();

        JSONObject json = getJson(uri, symbol);

        // c: текущая цена; 0 у Finnhub означает "нет данных по символу"
        double price = json.optDouble("c", Double.NaN);
        if (!Double.isFinite(price) || price <= 0) {
            throw new QuoteProviderException("finnhub: no price for " + symbol);
        }
        log.debug("💵 [FINNHUB] {} = {}", symbol, price);
        return price;
    }

    // =====================================================================
    // CANDLES
    // =====================================================================

    @Override
    public List<Candle> fetchCandles(String symbol, HistoryPeriod period, HistoryInterval interval) {
        requireEnabled();

        long to = clock.instant().getEpochSecond();
        long from = to - period.duration().getSeconds();

        URI uri = UriComponentsBuilder.fromHttpUrl(props.getBaseUrl())
                .path("/stock/candle")
                .queryParam("symbol", symbol)
                .queryParam("resolution", interval.finnhubResolution())
                .queryParam("from", from)
                .queryParam("to", to)
                .queryParam("token", props.getApiKey())
                .build()
                .toUri();

        JSONObject json = getJson(uri, symbol);

        String status = json.optString("s", "");
        if ("no_data".equals(status)) {
            return List.of();
        }
        if (!"ok".equals(status)) {
            throw new QuoteProviderException("finnhub candles: status=" + status + " for " + symbol);
        }

        try {
            JSONArray t = json.getJSONArray("t");
            JSONArray o = json.getJSONArray("o");
            JSONArray h = json.getJSONArray("h");
            JSONArray l = json.getJSONArray("l");
            JSONArray c = json.getJSONArray("c");
            JSONArray v = json.optJSONArray("v");

            List<Candle> out = new ArrayList<>(t.length());
            for (int i = 0; i < t.length(); i++) {
                out.add(new Candle(
                        t.getLong(i) * 1000L,
                        o.getDouble(i),
                        h.getDouble(i),
                        l.getDouble(i),
                        c.getDouble(i),
                        v != null ? v.optDouble(i, 0) : 0
                ));
            }
            return out;
        } catch (JSONException e) {
            throw new QuoteProviderException("finnhub candles: bad body for " + symbol, e);
        }
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private void requireEnabled() {
        if (!isEnabled()) {
            throw new QuoteProviderException("finnhub: api key not configured");
        }
    }

    private JSONObject getJson(URI uri, String symbol) {
        String body;
        try {
            body = http.getForObject(uri, String.class);
        } catch (RestClientException e) {
            throw new QuoteProviderException("finnhub: request failed for " + symbol + ": " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new QuoteProviderException("finnhub: empty body for " + symbol);
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new QuoteProviderException("finnhub: invalid JSON for " + symbol, e);
        }
    }
}
