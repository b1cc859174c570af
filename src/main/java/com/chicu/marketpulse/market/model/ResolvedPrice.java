package com.chicu.marketpulse.market.model;

import com.chicu.marketpulse.common.enums.PriceProvenance;

import java.time.Instant;

public record ResolvedPrice(
        String symbol,
        double price,
        PriceProvenance provenance,
        Instant resolvedAt
) {}
