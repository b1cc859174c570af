package com.chicu.marketpulse.market.history;

import com.chicu.marketpulse.market.MarketProperties;
import com.chicu.marketpulse.market.model.Candle;
import com.chicu.marketpulse.market.model.Quote;
import com.chicu.marketpulse.market.provider.CandleProvider;
import com.chicu.marketpulse.market.provider.ProviderCallExecutor;
import com.chicu.marketpulse.market.state.MarketStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarketHistoryServiceImpl implements MarketHistoryService {

    private final List<CandleProvider> candleProviders;
    private final ProviderCallExecutor calls;
    private final MarketStateService state;
    private final SyntheticHistoryGenerator synthetic;
    private final MarketProperties props;

    @Override
    public List<Candle> getHistory(String rawSymbol, String rawPeriod, String rawInterval) {
        String symbol = rawSymbol == null ? "" : rawSymbol.trim().toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol is required");
        }

        HistoryPeriod period = HistoryPeriod.fromCode(rawPeriod);
        HistoryInterval interval = HistoryInterval.fromCode(rawInterval);

        for (CandleProvider provider : candleProviders) {
            if (!provider.isEnabled()) continue;

            Optional<List<Candle>> candles = calls.call(
                    provider.getName() + ":history:" + symbol,
                    provider.getHistoryTimeout(),
                    () -> provider.fetchCandles(symbol, period, interval)
            );

            if (candles.isPresent() && !candles.get().isEmpty()) {
                log.debug("📈 [HISTORY] {} {}@{} → {} candles via {}",
                        symbol, period.code(), interval.code(), candles.get().size(), provider.getName());
                return candles.get();
            }
        }

        double anchor = state.getQuote(symbol)
                .map(Quote::price)
                .orElseGet(() -> props.getMock().basePriceFor(symbol));

        return synthetic.generate(symbol, anchor, period, interval, Instant.now());
    }
}
