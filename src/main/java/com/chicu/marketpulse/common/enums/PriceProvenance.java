package com.chicu.marketpulse.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Откуда взялась цена.
 *
 * CACHED: свежий кэш резолвера,
 * REAL  : live-фид или REST-провайдер,
 * MOCK  : синтетическое значение.
 */
public enum PriceProvenance {

    CACHED("cached"),
    REAL("real"),
    MOCK("mock");

    private final String code;

    PriceProvenance(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
