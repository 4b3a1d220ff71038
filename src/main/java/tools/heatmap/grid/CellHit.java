package tools.heatmap.grid;

/**
 * 点击命中的方块。data 为 null 表示该方块没有数据。
 */
public record CellHit<D>(int rowIndex, int columnIndex, D data) {

    public boolean hasData() {
        return data != null;
    }
}
