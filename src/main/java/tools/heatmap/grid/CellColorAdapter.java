package tools.heatmap.grid;

import java.awt.Color;

/**
 * 动态方块颜色。对每个方块都会调用，无数据的方块传入 null；
 * 返回非 null 时覆盖默认的激活 / 未激活填充，返回 null 则使用默认填充。
 */
@FunctionalInterface
public interface CellColorAdapter<D> {
    Color colorFor(D data);
}
