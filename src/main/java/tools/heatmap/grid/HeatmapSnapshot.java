package tools.heatmap.grid;

import tools.heatmap.model.RowData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 组件当前持有的完整数据：行列表 + 表头。每次绑定整体替换，不做原地修改，
 * 因此绘制过程中看到的永远是同一份一致的数据。
 */
public final class HeatmapSnapshot<D> {
    public static final List<String> DEFAULT_HEADERS = List.of(
            "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec");

    private final List<RowData<D>> rows;
    private final List<String> headers;

    public HeatmapSnapshot(List<RowData<D>> rows, List<String> headers) {
        this.rows = rows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
        this.headers = copyHeaders(headers);
    }

    public static <D> HeatmapSnapshot<D> initial() {
        return new HeatmapSnapshot<>(List.of(), DEFAULT_HEADERS);
    }

    /**
     * 用新的行替换当前数据；headers 为 null 时沿用现有表头与列数。
     */
    public HeatmapSnapshot<D> rebind(List<RowData<D>> newRows, List<String> newHeaders) {
        return new HeatmapSnapshot<>(newRows, newHeaders != null ? newHeaders : headers);
    }

    public List<RowData<D>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public List<String> getHeaders() {
        return headers;
    }

    /** 列数始终等于表头数量。 */
    public int getColumnCount() {
        return headers.size();
    }

    public String headerAt(int columnIndex) {
        if (columnIndex < 0 || columnIndex >= headers.size()) {
            return "";
        }
        return headers.get(columnIndex);
    }

    public D cellAt(int rowIndex, int columnIndex) {
        if (rowIndex < 0 || rowIndex >= rows.size()) {
            return null;
        }
        return rows.get(rowIndex).cellAt(columnIndex);
    }

    private static List<String> copyHeaders(List<String> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        List<String> copy = new ArrayList<>(source.size());
        for (String header : source) {
            copy.add(header == null ? "" : header);
        }
        return Collections.unmodifiableList(copy);
    }
}
