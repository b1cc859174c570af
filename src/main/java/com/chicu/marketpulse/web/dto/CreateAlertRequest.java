package com.chicu.marketpulse.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateAlertRequest {
    private String owner;
    private String symbol;
    /** price_above / price_below */
    private String kind;
    private Double threshold;
}
