package tools.heatmap.ui;

/**
 * 方块点击回调。data 为 null 表示点中的方块没有数据。
 */
@FunctionalInterface
public interface CellClickListener<D> {
    void onCellClick(int rowIndex, int columnIndex, D data);
}
