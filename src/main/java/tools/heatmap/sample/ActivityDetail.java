package tools.heatmap.sample;

/**
 * 某一天的活动明细：day 为本周第几天（1 = 周一），count 为当天的计数（如步数）。
 */
public class ActivityDetail {
    private int day;
    private int count;

    public ActivityDetail() {
    }

    public ActivityDetail(int day, int count) {
        this.day = day;
        this.count = count;
    }

    public int getDay() {
        return day;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        return "day=" + day + ", count=" + count;
    }
}
