package quest.gekko.creators.analytics.model;

public record Insight(InsightCategory category, String icon, String label, String handle, String detail) {

    public static Insight of(InsightCategory category, String handle, String detail) {
        return new Insight(category, category.icon(), category.label(), handle, detail);
    }
}
