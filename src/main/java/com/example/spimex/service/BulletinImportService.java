package com.example.spimex.service;

import com.example.spimex.bulletin.BulletinParser;
import com.example.spimex.bulletin.ImportSummary;
import com.example.spimex.client.SpimexBulletinClient;
import com.example.spimex.config.MetricsConfig;
import com.example.spimex.config.SpimexProperties;
import com.example.spimex.domain.repository.TradingResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Imports SPIMEX bulletins into the store.
 * <p>
 * Dates are processed newest first. Each date is written in its own transaction, so a
 * failure part way through keeps the dates already imported and a rerun skips them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulletinImportService {

    private final SpimexBulletinClient bulletinClient;
    private final BulletinParser bulletinParser;
    private final TradingResultRepository repository;
    private final TradingResultWriter writer;
    private final TradingResultsCache cache;
    private final MetricsConfig metricsConfig;
    private final SpimexProperties properties;
    private final Clock clock;

    /**
     * Import every bulletin from today back to {@code targetDate}, inclusive.
     *
     * @param targetDate Oldest date to import
     * @param force      Re-import dates already in the store
     * @throws IllegalArgumentException if the target date is in the future or too far back
     */
    public ImportSummary importSince(LocalDate targetDate, boolean force) {
        var dates = datesBackTo(targetDate);
        var summary = ImportSummary.builder()
                .targetDate(targetDate)
                .force(force)
                .requested(dates)
                .build();

        log.info("Importing bulletins for {} dates since {} (force: {})", dates.size(), targetDate, force);

        try {
            for (var date : dates) {
                importDate(date, force, summary);
            }
        } finally {
            if (summary.hasWrites()) {
                cache.evictAll();
            }
        }

        log.info("Import since {} finished: {} imported, {} skipped, {} without bulletin, {} rows",
                targetDate, summary.getImported().size(), summary.getSkipped().size(),
                summary.getMissing().size(), summary.getRowsWritten());
        return summary;
    }

    /**
     * Reject a target date the import cannot serve
     *
     * @throws IllegalArgumentException if the date is in the future or too far back
     */
    public void validateTargetDate(LocalDate targetDate) {
        datesBackTo(targetDate);
    }

    List<LocalDate> datesBackTo(LocalDate targetDate) {
        var today = LocalDate.now(clock);
        if (targetDate.isAfter(today)) {
            throw new IllegalArgumentException("target_date " + targetDate + " is in the future");
        }
        var days = ChronoUnit.DAYS.between(targetDate, today) + 1;
        if (days > properties.getMaxImportDays()) {
            throw new IllegalArgumentException(String.format(
                    "target_date %s is %d days back, at most %d are allowed", targetDate, days, properties.getMaxImportDays()));
        }

        var dates = new ArrayList<LocalDate>();
        for (var date = today; !date.isBefore(targetDate); date = date.minusDays(1)) {
            dates.add(date);
        }
        return dates;
    }

    private void importDate(LocalDate date, boolean force, ImportSummary summary) {
        if (!force && repository.existsByTradeDate(date)) {
            log.debug("Results for {} already stored, skipping", date);
            summary.getSkipped().add(date);
            return;
        }

        var bulletin = bulletinClient.download(date);
        if (bulletin.isEmpty()) {
            summary.getMissing().add(date);
            return;
        }

        var rows = bulletinParser.parse(bulletin.get(), date);
        if (rows.isEmpty()) {
            log.info("Bulletin for {} has no instruments with contracts", date);
            summary.getMissing().add(date);
            return;
        }

        var written = writer.replaceDay(date, rows);
        summary.getImported().add(date);
        summary.setRowsWritten(summary.getRowsWritten() + written);
        metricsConfig.recordRowsImported(written);

        log.info("Stored {} results for {}", written, date);
    }
}
