package com.example.spimex.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One row of a SPIMEX oil products bulletin (metric tonne section).
 * <p>
 * The exchange product code encodes the other identifiers:
 * chars 0-3 are the oil id, chars 4-6 the delivery basis, the last char the delivery type.
 */
@Entity
@Table(name = "spimex_trading_results",
        uniqueConstraints = @UniqueConstraint(name = "uq_trading_result_date_product",
                columnNames = {"trade_date", "exchange_product_id"}),
        indexes = {
                @Index(name = "idx_trading_result_date", columnList = "trade_date"),
                @Index(name = "idx_trading_result_oil_date", columnList = "oil_id, trade_date")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradingResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "exchange_product_id", nullable = false, length = 32)
    private String exchangeProductId;

    @Column(name = "exchange_product_name", nullable = false, columnDefinition = "TEXT")
    private String exchangeProductName;

    @Column(name = "oil_id", nullable = false, length = 8)
    private String oilId;

    @Column(name = "delivery_basis_id", nullable = false, length = 8)
    private String deliveryBasisId;

    @Column(name = "delivery_basis_name", nullable = false, columnDefinition = "TEXT")
    private String deliveryBasisName;

    @Column(name = "delivery_type_id", nullable = false, length = 4)
    private String deliveryTypeId;

    /**
     * Traded volume in metric tonnes
     */
    @Column(name = "volume", nullable = false, precision = 20, scale = 3)
    private BigDecimal volume;

    /**
     * Traded value in rubles
     */
    @Column(name = "total", nullable = false, precision = 24, scale = 2)
    private BigDecimal total;

    /**
     * Number of contracts
     */
    @Column(name = "count", nullable = false)
    private Integer count;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "created_on", nullable = false, updatable = false)
    private Instant createdOn;

    @Column(name = "updated_on", nullable = false)
    private Instant updatedOn;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdOn = now;
        this.updatedOn = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedOn = Instant.now();
    }
}
