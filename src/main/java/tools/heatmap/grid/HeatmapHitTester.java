package tools.heatmap.grid;

import java.awt.Insets;
import java.util.Optional;

/**
 * 把指针坐标换算为 (行, 列, 数据)。使用与绘制相同的 LayoutGeometry，
 * 落在方块之间间隙里的点不算命中。
 */
public final class HeatmapHitTester {
    private HeatmapHitTester() {
    }

    public static <D> Optional<CellHit<D>> resolveCell(float x, float y, Insets padding,
                                                       LayoutGeometry geometry, HeatmapSnapshot<D> snapshot) {
        if (geometry == null || snapshot == null || geometry.isDegenerate()) {
            return Optional.empty();
        }
        int rowCount = Math.min(geometry.rowCount(), snapshot.getRowCount());
        int columnCount = Math.min(geometry.columnCount(), snapshot.getColumnCount());
        if (rowCount <= 0 || columnCount <= 0) {
            return Optional.empty();
        }

        float localX = x - padding.left - geometry.gridOffsetX();
        float localY = y - padding.top - geometry.gridOffsetY();
        if (localX < 0f || localY < 0f || localX > geometry.gridWidth() || localY > geometry.gridHeight()) {
            return Optional.empty();
        }

        float pitch = geometry.pitch();
        int columnIndex = (int) Math.floor(localX / pitch);
        int rowIndex = (int) Math.floor(localY / pitch);
        if (columnIndex >= columnCount || rowIndex >= rowCount) {
            return Optional.empty();
        }
        // 落在间隙中：整除得到的下标合法，但点不在方块内
        if (localX - columnIndex * pitch > geometry.cellSide() || localY - rowIndex * pitch > geometry.cellSide()) {
            return Optional.empty();
        }
        return Optional.of(new CellHit<>(rowIndex, columnIndex, snapshot.cellAt(rowIndex, columnIndex)));
    }
}
