package com.example.spimex.domain.repository;

import com.example.spimex.domain.entity.TradingResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for TradingResult entity.
 * <p>
 * Blank filters are passed as null and match every row.
 */
@Repository
public interface TradingResultRepository extends JpaRepository<TradingResult, Long> {

    /**
     * Most recent trading date in the store, empty when the store holds no results
     */
    @Query("SELECT MAX(t.tradeDate) FROM TradingResult t")
    Optional<LocalDate> findLatestTradeDate();

    /**
     * Distinct trading dates within a closed range, newest first
     */
    @Query("""
            SELECT DISTINCT t.tradeDate FROM TradingResult t
            WHERE t.tradeDate BETWEEN :from AND :to
            ORDER BY t.tradeDate DESC
            """)
    List<LocalDate> findTradeDatesBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);

    /**
     * Results traded within a closed range matching the optional filters,
     * newest date first, then by product code
     */
    @Query("""
            SELECT t FROM TradingResult t
            WHERE t.tradeDate BETWEEN :from AND :to
              AND (:oilId IS NULL OR t.oilId = :oilId)
              AND (:deliveryTypeId IS NULL OR t.deliveryTypeId = :deliveryTypeId)
              AND (:deliveryBasisId IS NULL OR t.deliveryBasisId = :deliveryBasisId)
            ORDER BY t.tradeDate DESC, t.exchangeProductId ASC
            """)
    List<TradingResult> findMatching(@Param("from") LocalDate from,
                                     @Param("to") LocalDate to,
                                     @Param("oilId") String oilId,
                                     @Param("deliveryTypeId") String deliveryTypeId,
                                     @Param("deliveryBasisId") String deliveryBasisId);

    boolean existsByTradeDate(LocalDate tradeDate);

    /**
     * Remove one trading day before it is re-imported
     */
    @Modifying
    @Query("DELETE FROM TradingResult t WHERE t.tradeDate = :tradeDate")
    int deleteByTradeDate(@Param("tradeDate") LocalDate tradeDate);
}
