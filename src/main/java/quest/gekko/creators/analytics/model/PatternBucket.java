package quest.gekko.creators.analytics.model;

/**
 * One hour-of-day or weekday slot of a posting pattern.
 */
public record PatternBucket<K>(K key, double avgEngagementRate, int posts) {}
