package com.chicu.marketpulse.market.feed;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Парсер фреймов стримингового провайдера.
 *
 * {"type":"trade","data":[{"s":"AAPL","p":187.3,"v":100,"t":1700000000000}, ...]}
 * {"type":"ping"}
 */
@Component
public class FeedMessageParser {

    public FeedMessage parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedFeedMessageException("empty frame");
        }

        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            throw new MalformedFeedMessageException("not a JSON object: " + abbreviate(text), e);
        }

        String type = json.optString("type", "");
        switch (type) {
            case "ping":
                return FeedMessage.ping();
            case "trade":
                return FeedMessage.trades(parseTrades(json));
            case "error":
                return FeedMessage.error(json.optString("msg", ""));
            case "":
                throw new MalformedFeedMessageException("frame without type: " + abbreviate(text));
            default:
                return FeedMessage.ignored(type);
        }
    }

    private List<FeedTrade> parseTrades(JSONObject json) {
        JSONArray data = json.optJSONArray("data");
        if (data == null) {
            throw new MalformedFeedMessageException("trade frame without data array");
        }

        List<FeedTrade> out = new ArrayList<>(data.length());
        for (int i = 0; i < data.length(); i++) {
            JSONObject t = data.optJSONObject(i);
            if (t == null) continue;

            String symbol = t.optString("s", "").trim();
            double price = t.optDouble("p", Double.NaN);

            // без символа или цены трейд бесполезен
            if (symbol.isEmpty() || Double.isNaN(price)) continue;

            Long volume = t.has("v") && !t.isNull("v")
                    ? (long) t.optDouble("v", 0)
                    : null;
            long ts = t.optLong("t", System.currentTimeMillis());

            out.add(new FeedTrade(symbol.toUpperCase(Locale.ROOT), price, volume, ts));
        }
        return out;
    }

    private static String abbreviate(String s) {
        return s.length() <= 120 ? s : s.substring(0, 120) + "…";
    }
}
