package dao.tron.anchor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "anchor")
public class AnchorProperties {

    @Valid
    private FlushConfig flush = new FlushConfig();
    @Valid
    private FsckConfig fsck = new FsckConfig();
    @Valid
    private RetryConfig retry = new RetryConfig();

    /**
     * Serve collection queries (all digests received in a given window).
     * Default: false
     */
    private boolean enableCollections = false;

    @Data
    public static class FlushConfig {
        /**
         * Enable/disable scheduled flushing
         * Default: true
         */
        private boolean enabled = true;

        /**
         * Cron expression driving flush ticks. Must fire once per {@link #period}.
         * Default: on the hour plus ten seconds
         */
        @NotBlank
        private String schedule = "10 0 * * * *";

        /**
         * Length of a collection window. Digests are stamped with their submission
         * time truncated to this period.
         * Default: 1 hour
         */
        @NotNull
        private Duration period = Duration.ofHours(1);
    }

    @Data
    public static class FsckConfig {
        /**
         * A pending digest older than this many flush periods is reported as stuck.
         * Default: 24
         */
        @Min(1)
        private int stuckDigestPeriods = 24;
    }

    @Data
    public static class RetryConfig {
        /**
         * A submitted batch still unconfirmed after this long is marked failed
         * and submitted again on a later tick.
         * Default: 24 hours
         */
        @NotNull
        private Duration resubmitAfter = Duration.ofHours(24);
    }
}
