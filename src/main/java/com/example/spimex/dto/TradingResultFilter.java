package com.example.spimex.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional equality filters shared by the trading result queries.
 * Blank values mean "no filter".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingResultFilter {

    private String oilId;
    private String deliveryTypeId;
    private String deliveryBasisId;

    public static TradingResultFilter of(String oilId, String deliveryTypeId, String deliveryBasisId) {
        return new TradingResultFilter(blankToNull(oilId), blankToNull(deliveryTypeId), blankToNull(deliveryBasisId));
    }

    /**
     * Stable cache key fragment
     */
    public String cacheKey() {
        return nullToDash(oilId) + ":" + nullToDash(deliveryTypeId) + ":" + nullToDash(deliveryBasisId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String nullToDash(String value) {
        return value == null ? "-" : value;
    }
}
