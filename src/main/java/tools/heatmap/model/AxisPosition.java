package tools.heatmap.model;

/** 标签 / 表头相对网格的位置：LEADING 在左侧（或上方），TRAILING 在右侧（或下方）。 */
public enum AxisPosition {
    LEADING,
    TRAILING
}
