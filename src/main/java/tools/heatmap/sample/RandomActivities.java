package tools.heatmap.sample;

import tools.heatmap.model.RowData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 随机生成打卡数据：每行随机激活 1..maxActive 个列，列号取自 0..maxIndex（含）。
 * maxIndex 可以大于等于列数，超出部分会被保存但不会绘制。
 */
public final class RandomActivities {
    private RandomActivities() {
    }

    public static List<RowData<Boolean>> generate(List<String> labels, int maxActive, int maxIndex, Random random) {
        List<RowData<Boolean>> rows = new ArrayList<>(labels.size());
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i <= maxIndex; i++) {
            candidates.add(i);
        }
        for (String label : labels) {
            int activeCount = 1 + random.nextInt(Math.max(1, maxActive));
            Collections.shuffle(candidates, random);
            Map<Integer, Boolean> cells = new LinkedHashMap<>();
            for (Integer index : candidates.subList(0, Math.min(activeCount, candidates.size()))) {
                cells.put(index, Boolean.TRUE);
            }
            rows.add(new RowData<>(label, cells));
        }
        return rows;
    }
}
