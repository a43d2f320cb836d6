package com.phillippitts.autorecovery.config;

import com.phillippitts.autorecovery.service.recovery.BackoffSleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Collaborators of the recovery engine that tests replace.
 */
@Configuration
public class RecoveryConfig {

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.threadSleep();
    }
}
