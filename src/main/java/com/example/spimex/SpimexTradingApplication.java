package com.example.spimex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Profiles;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SPIMEX Trading Results Service
 * <p>
 * One artifact, four process roles selected by Spring profile:
 * - api: waits for the store, applies migrations, then serves HTTP on port 8000
 * - worker: consumes task messages from the Redis broker and executes them
 * - beat: periodically enqueues the bulletin import (singleton via ShedLock)
 * - topology-check: validates a compose deployment descriptor and exits
 */
@EnableScheduling
@SpringBootApplication
public class SpimexTradingApplication {

    public static final String TOPOLOGY_CHECK_PROFILE = "topology-check";

    public static void main(String[] args) {
        var context = SpringApplication.run(SpimexTradingApplication.class, args);

        if (context.getEnvironment().acceptsProfiles(Profiles.of(TOPOLOGY_CHECK_PROFILE))) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
