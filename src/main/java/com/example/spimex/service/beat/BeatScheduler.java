package com.example.spimex.service.beat;

import com.example.spimex.broker.TaskDispatcher;
import com.example.spimex.broker.TaskMessage;
import com.example.spimex.config.BeatProperties;
import com.example.spimex.exception.BrokerUnavailableException;
import com.example.spimex.startup.BrokerReadinessGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Periodic dispatch of the daily bulletin import.
 * <p>
 * The beat only enqueues; workers execute. ShedLock holds a row in the store for each
 * tick so that a second beat replica skips the tick instead of enqueueing a duplicate.
 */
@Slf4j
@Service
@Profile("beat")
@RequiredArgsConstructor
public class BeatScheduler {

    static final String ORIGIN = "beat";

    private final TaskDispatcher dispatcher;
    private final BrokerReadinessGate brokerGate;
    private final BeatProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${spimex.beat.import-cron:0 0 19 * * MON-FRI}", zone = "${spimex.beat.zone:Europe/Moscow}")
    @SchedulerLock(name = "spimex_daily_import", lockAtMostFor = "PT30M", lockAtLeastFor = "PT1M")
    public void dispatchDailyImport() {
        var targetDate = LocalDate.now(clock).minusDays(properties.getImportLookbackDays());
        log.info("Dispatching daily bulletin import since {}", targetDate);

        var message = dispatchWhenBrokerAvailable(targetDate);
        log.info("Daily import dispatched as task {}", message.getId());
    }

    private TaskMessage dispatchWhenBrokerAvailable(LocalDate targetDate) {
        while (true) {
            try {
                return dispatcher.dispatchImport(targetDate, false, ORIGIN);
            } catch (BrokerUnavailableException e) {
                log.warn("Broker unavailable for daily import: {}", e.getMessage());
                awaitBroker();
            }
        }
    }

    private void awaitBroker() {
        try {
            brokerGate.awaitAvailable();
        } catch (BrokerUnavailableException e) {
            log.error("{}, waiting again", e.getMessage());
        }
    }
}
