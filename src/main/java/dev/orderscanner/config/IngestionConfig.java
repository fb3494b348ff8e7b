package dev.orderscanner.config;

import dev.orderscanner.model.JobCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for ingestion runs.
 * Loaded from application.yml under 'ingestion' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ingestion")
public class IngestionConfig {

    private int maxResults = 50;
    private int fallbackThreshold = 3;
    private int logCapacity = 100;
    private Duration retention = Duration.ofHours(1);
    private Duration cleanupInterval = Duration.ofMinutes(10);
    private int historyRetentionDays = 365;
    private int extractionUnavailableLimit = 3;
    private Duration staggerDelay = Duration.ofSeconds(2);
    private SupersessionScope supersessionScope = SupersessionScope.OWNER;
    private StartRetry startRetry = new StartRetry();

    /**
     * Which running job a newly created job replaces.
     */
    public enum SupersessionScope {
        /** One active job per owner, regardless of category. */
        OWNER,
        /** One active job per owner and category. */
        OWNER_AND_CATEGORY
    }

    @Data
    public static class StartRetry {
        private int maxRetries = 3;
        private Duration defaultBaseDelay = Duration.ofSeconds(3);
        private Map<JobCategory, Duration> baseDelays = new EnumMap<>(Map.of(
                JobCategory.MARKETPLACE, Duration.ofSeconds(3),
                JobCategory.PRIORITY, Duration.ofSeconds(4),
                JobCategory.OTHER, Duration.ofSeconds(5)));

        public Duration baseDelayFor(JobCategory category) {
            return baseDelays.getOrDefault(category, defaultBaseDelay);
        }
    }
}
