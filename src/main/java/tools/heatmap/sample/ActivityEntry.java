package tools.heatmap.sample;

import java.util.List;

/**
 * 一位成员一周的活动记录。
 */
public class ActivityEntry {
    private String label;
    private List<ActivityDetail> details;

    public ActivityEntry() {
    }

    public ActivityEntry(String label, List<ActivityDetail> details) {
        this.label = label;
        this.details = details;
    }

    public String getLabel() {
        return label;
    }

    public List<ActivityDetail> getDetails() {
        return details == null ? List.of() : details;
    }
}
