package quest.gekko.creators.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class CacheConfig {
    public static final String STATS = "creatorStats";
    public static final String PATTERNS = "creatorPatterns";
    public static final String TOP_VIDEOS = "creatorTopVideos";

    @Bean
    public Caffeine<Object, Object> caffeine() {
        return Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofMinutes(15));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(STATS, PATTERNS, TOP_VIDEOS);
        cacheManager.setCaffeine(caffeine);
        return cacheManager;
    }
}
