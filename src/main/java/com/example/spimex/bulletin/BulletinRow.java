package com.example.spimex.bulletin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One instrument line of the metric ton section of a bulletin.
 * <p>
 * The exchange product code encodes the other identifiers: the first four characters are
 * the oil product, the next three the delivery basis and the last one the delivery type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulletinRow {

    private String exchangeProductId;
    private String exchangeProductName;
    private String deliveryBasisName;
    private BigDecimal volume;
    private BigDecimal total;
    private int count;

    public String oilId() {
        return exchangeProductId.substring(0, Math.min(4, exchangeProductId.length()));
    }

    public String deliveryBasisId() {
        if (exchangeProductId.length() <= 4) {
            return "";
        }
        return exchangeProductId.substring(4, Math.min(7, exchangeProductId.length()));
    }

    public String deliveryTypeId() {
        return exchangeProductId.substring(exchangeProductId.length() - 1);
    }
}
