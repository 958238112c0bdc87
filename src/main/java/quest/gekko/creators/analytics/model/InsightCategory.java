package quest.gekko.creators.analytics.model;

public enum InsightCategory {
    LARGEST_AUDIENCE("👥", "Largest Audience"),
    HIGHEST_ENGAGEMENT("🔥", "Highest Engagement"),
    MOST_VIEWED("👁", "Most Viewed"),
    MOST_ACTIVE("📅", "Most Active");

    private final String icon;
    private final String label;

    InsightCategory(String icon, String label) {
        this.icon = icon;
        this.label = label;
    }

    public String icon() { return icon; }
    public String label() { return label; }
}
