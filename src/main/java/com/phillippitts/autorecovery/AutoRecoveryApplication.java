package com.phillippitts.autorecovery;

import com.phillippitts.autorecovery.config.properties.RecoveryProperties;
import com.phillippitts.autorecovery.config.properties.StrategyProperties;
import com.phillippitts.autorecovery.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RecoveryProperties.class,
        StrategyProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class AutoRecoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoRecoveryApplication.class, args);
    }

}
