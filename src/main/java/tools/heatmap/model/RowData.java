package tools.heatmap.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 热力图中的一行：左侧标签 + 稀疏的列数据。
 * 没有出现在 cells 中的列视为“无数据”（未激活）。
 */
public final class RowData<D> {
    private final String label;
    private final Map<Integer, D> cells;

    public RowData(String label, Map<Integer, ? extends D> cells) {
        this.label = label == null ? "" : label;
        this.cells = cells == null || cells.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public String getLabel() {
        return label;
    }

    public Map<Integer, D> getCells() {
        return cells;
    }

    public boolean hasCell(int columnIndex) {
        return cells.containsKey(columnIndex);
    }

    public D cellAt(int columnIndex) {
        return cells.get(columnIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RowData<?> other)) return false;
        return label.equals(other.label) && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, cells);
    }

    @Override
    public String toString() {
        return "RowData{" + label + ", columns=" + cells.keySet() + "}";
    }
}
