package quest.gekko.creators.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Tuning knobs for the analytics engine.
 *
 * @param zone               zone used to read hour-of-day and weekday from a post timestamp
 * @param minPatternPosts    timestamped posts below which a pattern report is flagged low-confidence
 * @param topVideosLimit     default size of the top videos list
 * @param maxTopVideosLimit  upper bound for a caller-supplied top videos limit
 */
@ConfigurationProperties("creators.analytics")
public record AnalyticsProperties(ZoneId zone, Integer minPatternPosts, Integer topVideosLimit, Integer maxTopVideosLimit) {

    public AnalyticsProperties {
        if (zone == null) zone = ZoneId.of("UTC");
        if (minPatternPosts == null) minPatternPosts = 5;
        if (topVideosLimit == null) topVideosLimit = 10;
        if (maxTopVideosLimit == null) maxTopVideosLimit = 50;
    }

    public static AnalyticsProperties defaults() {
        return new AnalyticsProperties(null, null, null, null);
    }
}
