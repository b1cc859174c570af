package com.chicu.marketpulse.market.provider;

import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Вторичный источник: Yahoo chart API.
 * Берём regularMarketPrice, а если его нет, последний непустой дневной close.
 */
@Slf4j
@Component
@Order(2)
public class YahooChartQuoteProvider implements QuoteProvider {

    private final RestTemplate http;
    private final ProviderProperties.Yahoo props;

    public YahooChartQuoteProvider(@Qualifier("marketRestTemplate") RestTemplate http,
                                   ProviderProperties props) {
        this.http = http;
        this.props = props.getYahoo();
    }

    @Override
    public String getName() {
        return "yahoo";
    }

    @Override
    public boolean isEnabled() {
        return props.isEnabled();
    }

    @Override
    public Duration getTimeout() {
        return props.getTimeout();
    }

    @Override
    public double fetchQuote(String symbol) {
        if (!isEnabled()) {
            throw new QuoteProviderException("yahoo: provider disabled");
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(props.getBaseUrl())
                .path("/v8/finance/chart/{symbol}")
                .queryParam("range", "5d")
                .queryParam("interval", "1d")
                .buildAndExpand(symbol)
                .toUri();

        String body;
        try {
            body = http.getForObject(uri, String.class);
        } catch (RestClientException e) {
            throw new QuoteProviderException("yahoo: request failed for " + symbol + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new QuoteProviderException("yahoo: empty body for " + symbol);
        }

        try {
            JSONObject chart = new JSONObject(body).getJSONObject("chart");
            JSONArray result = chart.optJSONArray("result");
            if (result == null || result.isEmpty()) {
                throw new QuoteProviderException("yahoo: no result for " + symbol);
            }
            JSONObject first = result.getJSONObject(0);

            double price = first.optJSONObject("meta") != null
                    ? first.getJSONObject("meta").optDouble("regularMarketPrice", Double.NaN)
                    : Double.NaN;

            if (!valid(price)) {
                price = lastClose(first);
            }
            if (!valid(price)) {
                throw new QuoteProviderException("yahoo: no usable price for " + symbol);
            }

            log.debug("💵 [YAHOO] {} = {}", symbol, price);
            return price;
        } catch (JSONException e) {
            throw new QuoteProviderException("yahoo: invalid body for " + symbol, e);
        }
    }

    private static double lastClose(JSONObject result) {
        JSONObject indicators = result.optJSONObject("indicators");
        if (indicators == null) return Double.NaN;

        JSONArray quotes = indicators.optJSONArray("quote");
        if (quotes == null || quotes.isEmpty()) return Double.NaN;

        JSONArray closes = quotes.getJSONObject(0).optJSONArray("close");
        if (closes == null) return Double.NaN;

        for (int i = closes.length() - 1; i >= 0; i--) {
            double c = closes.optDouble(i, Double.NaN);
            if (valid(c)) return c;
        }
        return Double.NaN;
    }

    private static boolean valid(double p) {
        return Double.isFinite(p) && p > 0;
    }
}
