package dao.tron.anchor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Enables @Scheduled methods (BatchingScheduler) and provides the clock every
 * component reads "now" from.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
