package tools.heatmap.grid;

import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;

/**
 * 自定义方块内容。只对有数据的方块调用，并且在方块底色绘制完成之后调用，
 * 传入的 Graphics2D 是独立副本，可以随意修改状态。
 */
@FunctionalInterface
public interface CellDrawAdapter<D> {
    void onDrawCell(Graphics2D g, Rectangle2D bounds, int rowIndex, int columnIndex, D data);
}
