package com.example.spimex.service;

import com.example.spimex.bulletin.BulletinRow;
import com.example.spimex.domain.entity.TradingResult;
import com.example.spimex.domain.repository.TradingResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Writes one trading day atomically
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TradingResultWriter {

    private final TradingResultRepository repository;

    /**
     * Replace every stored result of {@code tradeDate} with {@code rows}.
     *
     * @return number of rows written
     */
    @Transactional
    public int replaceDay(LocalDate tradeDate, List<BulletinRow> rows) {
        var deleted = repository.deleteByTradeDate(tradeDate);
        if (deleted > 0) {
            log.info("Replacing {} stored results for {}", deleted, tradeDate);
        }

        var entities = rows.stream()
                .map(row -> toEntity(row, tradeDate))
                .toList();
        repository.saveAll(entities);
        return entities.size();
    }

    private TradingResult toEntity(BulletinRow row, LocalDate tradeDate) {
        return TradingResult.builder()
                .exchangeProductId(row.getExchangeProductId())
                .exchangeProductName(row.getExchangeProductName())
                .oilId(row.oilId())
                .deliveryBasisId(row.deliveryBasisId())
                .deliveryBasisName(row.getDeliveryBasisName())
                .deliveryTypeId(row.deliveryTypeId())
                .volume(row.getVolume())
                .total(row.getTotal())
                .count(row.getCount())
                .tradeDate(tradeDate)
                .build();
    }
}
