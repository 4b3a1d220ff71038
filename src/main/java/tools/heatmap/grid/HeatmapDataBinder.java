package tools.heatmap.grid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.heatmap.model.RowData;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * 把任意业务对象列表转换为热力图行数据。
 * <ul>
 *     <li>每个业务对象提供一个标签和一组有序的明细，每条明细占一列；</li>
 *     <li>提供 indexOf 时由它决定明细所在列，否则按明细在列表中的位置；</li>
 *     <li>列号小于 0 的明细直接丢弃，同一列出现多次时后者覆盖前者；</li>
 *     <li>超出列数的列号照常保存，只是不会被绘制。</li>
 * </ul>
 * 提取函数抛出的异常原样向上抛出，属于调用方的用法错误。
 */
public final class HeatmapDataBinder {
    private static final Logger log = LoggerFactory.getLogger(HeatmapDataBinder.class);

    private HeatmapDataBinder() {
    }

    public static <T, D> List<RowData<D>> toRows(List<? extends T> items,
                                                 Function<? super T, String> labelOf,
                                                 Function<? super T, ? extends List<? extends D>> detailsOf,
                                                 ToIntFunction<? super D> indexOf) {
        Objects.requireNonNull(labelOf, "labelOf");
        Objects.requireNonNull(detailsOf, "detailsOf");
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<RowData<D>> rows = new ArrayList<>(items.size());
        int dropped = 0;
        for (T item : items) {
            String label = labelOf.apply(item);
            List<? extends D> details = detailsOf.apply(item);
            Map<Integer, D> cells = new LinkedHashMap<>();
            if (details != null) {
                for (int position = 0; position < details.size(); position++) {
                    D detail = details.get(position);
                    int columnIndex = indexOf != null ? indexOf.applyAsInt(detail) : position;
                    if (columnIndex < 0) {
                        dropped++;
                        continue;
                    }
                    cells.put(columnIndex, detail);
                }
            }
            rows.add(new RowData<>(label, cells));
        }
        if (dropped > 0) {
            log.debug("绑定热力图数据时丢弃了 {} 条列号为负的明细", dropped);
        }
        return rows;
    }
}
