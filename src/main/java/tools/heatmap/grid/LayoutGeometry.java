package tools.heatmap.grid;

import java.awt.Insets;
import java.awt.geom.Rectangle2D;

/**
 * 一次测量的结果。绘制与点击命中共用同一份几何信息。
 *
 * @param cellSide         方块边长，恒不小于 0
 * @param cellGap          方块间距
 * @param maxLabelWidth    最长标签文字宽度
 * @param labelAreaWidth   标签区宽度（文字宽 + 标签间距，无数据时为 0）
 * @param headerAreaHeight 表头区高度（表头间距 + 文字高）
 * @param gridOffsetX      网格相对内容区左上角的水平偏移
 * @param gridOffsetY      网格相对内容区左上角的垂直偏移
 * @param rowCount         测量时的行数
 * @param columnCount      测量时的列数
 * @param measuredWidth    组件宽度（即宿主给出的宽度）
 * @param measuredHeight   组件所需高度（含上下内边距）
 */
public record LayoutGeometry(float cellSide, float cellGap, float maxLabelWidth, float labelAreaWidth,
                             float headerAreaHeight, float gridOffsetX, float gridOffsetY,
                             int rowCount, int columnCount, float measuredWidth, float measuredHeight) {

    public static final LayoutGeometry EMPTY = new LayoutGeometry(0f, 0f, 0f, 0f, 0f, 0f, 0f, 0, 0, 0f, 0f);

    /** 相邻两列（行）起点之间的距离。 */
    public float pitch() {
        return cellSide + cellGap;
    }

    public boolean isDegenerate() {
        return cellSide <= 0f || columnCount <= 0;
    }

    public float gridWidth() {
        if (columnCount <= 0) {
            return 0f;
        }
        return Math.max(0f, columnCount * pitch() - cellGap);
    }

    public float gridHeight() {
        if (rowCount <= 0) {
            return 0f;
        }
        return Math.max(0f, rowCount * pitch() - cellGap);
    }

    public float cellX(Insets padding, int columnIndex) {
        return padding.left + gridOffsetX + columnIndex * pitch();
    }

    public float rowY(Insets padding, int rowIndex) {
        return padding.top + gridOffsetY + rowIndex * pitch();
    }

    public Rectangle2D.Float cellBounds(Insets padding, int rowIndex, int columnIndex) {
        return new Rectangle2D.Float(cellX(padding, columnIndex), rowY(padding, rowIndex), cellSide, cellSide);
    }
}
