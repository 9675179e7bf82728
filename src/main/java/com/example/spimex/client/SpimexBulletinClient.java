package com.example.spimex.client;

import com.example.spimex.config.SpimexProperties;
import com.example.spimex.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Client for the SPIMEX oil products bulletin archive.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff for 5xx and I/O failures
 * - WebClient with a raised buffer limit for the binary workbooks
 */
@Slf4j
@Component
public class SpimexBulletinClient {

    static final String SERVICE_NAME = "SPIMEX";
    static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final WebClient webClient;
    private final SpimexProperties properties;

    public SpimexBulletinClient(@Qualifier("spimexWebClient") WebClient webClient, SpimexProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Download the bulletin for one trading day.
     *
     * @param date The trading day
     * @return The workbook bytes, or empty when no bulletin exists for that day
     * @throws ExternalServiceException if the archive answers with an error or cannot be reached
     */
    @CircuitBreaker(name = "spimex", fallbackMethod = "downloadFallback")
    @Retry(name = "spimex")
    public Optional<byte[]> download(LocalDate date) {
        var url = bulletinUrl(date);
        log.debug("Downloading bulletin for {} from {}", date, url);

        try {
            var body = webClient.get()
                    .uri(url)
                    .exchangeToMono(response -> {
                        var status = response.statusCode();
                        // Missing bulletins answer 404 or redirect to an error page
                        if (status.value() == HttpStatus.NOT_FOUND.value() || status.is3xxRedirection()) {
                            return response.releaseBody().then(Mono.<byte[]>empty());
                        }
                        if (status.isError()) {
                            return response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(text -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, status.value(), abbreviate(text))));
                        }
                        return response.bodyToMono(byte[].class);
                    })
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .blockOptional();

            if (body.isEmpty()) {
                log.info("No bulletin published for {}", date);
            }
            return body.filter(bytes -> bytes.length > 0);
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to download bulletin for {}: {}", date, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    public String bulletinUrl(LocalDate date) {
        return properties.getBaseUrl() + FILE_DATE.format(date) + properties.getFileSuffix();
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private Optional<byte[]> downloadFallback(LocalDate date, Exception e) {
        if (e instanceof ExternalServiceException external) {
            throw external;
        }
        log.warn("Circuit breaker open for SPIMEX, bulletin {}: {}", date, e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
