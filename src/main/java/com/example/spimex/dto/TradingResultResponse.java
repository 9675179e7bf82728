package com.example.spimex.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Response DTO for one bulletin row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingResultResponse {

    private Long id;
    private String exchangeProductId;
    private String exchangeProductName;
    private String oilId;
    private String deliveryBasisId;
    private String deliveryBasisName;
    private String deliveryTypeId;
    private BigDecimal volume;
    private BigDecimal total;
    private Integer count;
    private LocalDate date;
    private Instant createdOn;
    private Instant updatedOn;
}
