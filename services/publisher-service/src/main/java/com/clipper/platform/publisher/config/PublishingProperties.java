package com.clipper.platform.publisher.config;

import com.clipper.platform.publisher.polling.PollPolicy;
import com.clipper.platform.publisher.transport.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Polling, chunking and retry tunables of the publish pipeline, one block per platform.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "publishing")
public class PublishingProperties {

    @NotNull
    private Duration callTimeout = Duration.ofSeconds(30);

    // Per chunk PUT, including the body transfer
    @NotNull
    private Duration chunkTimeout = Duration.ofMinutes(5);

    @Valid
    private PlatformSettings instagram = PlatformSettings.of(Duration.ofSeconds(2), 30,
            DataSize.ofMegabytes(10), 3, Duration.ofSeconds(1));

    @Valid
    private PlatformSettings youtube = PlatformSettings.of(Duration.ofSeconds(2), 30,
            DataSize.ofMegabytes(5), 5, Duration.ofSeconds(1));

    @Valid
    private PlatformSettings tiktok = PlatformSettings.of(Duration.ofSeconds(2), 30,
            DataSize.ofMegabytes(10), 3, Duration.ofSeconds(2));

    @Valid
    private PlatformSettings linkedin = PlatformSettings.of(Duration.ofSeconds(2), 90,
            DataSize.ofMegabytes(4), 3, Duration.ofSeconds(1));

    @Data
    public static class PlatformSettings {

        @NotNull
        private Duration pollInterval;

        @Min(1)
        private int pollMaxAttempts;

        @NotNull
        private DataSize chunkSize;

        // Files up to this size go up as one chunk
        @NotNull
        private DataSize singleChunkLimit = DataSize.ofMegabytes(64);

        @Min(0)
        private int chunkRetries;

        @NotNull
        private Duration retryBackoff;

        @NotNull
        private Duration maxRetryBackoff = Duration.ofSeconds(16);

        static PlatformSettings of(Duration pollInterval, int pollMaxAttempts, DataSize chunkSize,
                                   int chunkRetries, Duration retryBackoff) {
            PlatformSettings settings = new PlatformSettings();
            settings.setPollInterval(pollInterval);
            settings.setPollMaxAttempts(pollMaxAttempts);
            settings.setChunkSize(chunkSize);
            settings.setChunkRetries(chunkRetries);
            settings.setRetryBackoff(retryBackoff);
            return settings;
        }

        public PollPolicy pollPolicy() {
            return new PollPolicy(pollInterval, pollMaxAttempts);
        }

        public RetryPolicy retryPolicy() {
            return new RetryPolicy(chunkRetries, retryBackoff, maxRetryBackoff);
        }
    }
}
