package tools.heatmap.model;

import java.awt.Color;
import java.util.Objects;

/**
 * 热力图外观配置：方块渐变色、间距、圆角，以及标签 / 表头的文字样式与位置。
 * 不可变，修改请使用 withXxx 生成新实例。长度与字号单位均为像素。
 */
public final class HeatmapStyle {
    public static final Color DEFAULT_ACTIVE_START = new Color(0x11, 0x63, 0x29);
    public static final Color DEFAULT_ACTIVE_END = new Color(0x2D, 0xA4, 0x4E);
    public static final Color DEFAULT_INACTIVE = new Color(0x22, 0x22, 0x22);

    private final Color activeColorStart;
    private final Color activeColorEnd;
    private final Color inactiveColorStart;
    private final Color inactiveColorEnd;
    private final float cellGap;
    private final float cellCornerRadius;
    private final float labelGridGap;
    private final Color labelTextColor;
    private final float labelTextSize;
    private final AxisPosition labelPosition;
    private final float headerGridGap;
    private final Color headerTextColor;
    private final float headerTextSize;
    private final AxisPosition headerPosition;

    public HeatmapStyle(Color activeColorStart, Color activeColorEnd, Color inactiveColorStart, Color inactiveColorEnd,
                        float cellGap, float cellCornerRadius,
                        float labelGridGap, Color labelTextColor, float labelTextSize, AxisPosition labelPosition,
                        float headerGridGap, Color headerTextColor, float headerTextSize, AxisPosition headerPosition) {
        this.activeColorStart = Objects.requireNonNull(activeColorStart, "activeColorStart");
        this.activeColorEnd = Objects.requireNonNull(activeColorEnd, "activeColorEnd");
        this.inactiveColorStart = Objects.requireNonNull(inactiveColorStart, "inactiveColorStart");
        this.inactiveColorEnd = Objects.requireNonNull(inactiveColorEnd, "inactiveColorEnd");
        this.cellGap = nonNegative(cellGap);
        this.cellCornerRadius = nonNegative(cellCornerRadius);
        this.labelGridGap = nonNegative(labelGridGap);
        this.labelTextColor = Objects.requireNonNull(labelTextColor, "labelTextColor");
        this.labelTextSize = nonNegative(labelTextSize);
        this.labelPosition = Objects.requireNonNull(labelPosition, "labelPosition");
        this.headerGridGap = nonNegative(headerGridGap);
        this.headerTextColor = Objects.requireNonNull(headerTextColor, "headerTextColor");
        this.headerTextSize = nonNegative(headerTextSize);
        this.headerPosition = Objects.requireNonNull(headerPosition, "headerPosition");
    }

    /**
     * 默认样式：绿色系激活渐变、深灰未激活色，8 像素间距、4 像素圆角，
     * 标签 14 号白字在左侧，表头 12 号灰字在底部。
     */
    public static HeatmapStyle defaults() {
        return new HeatmapStyle(DEFAULT_ACTIVE_START, DEFAULT_ACTIVE_END, DEFAULT_INACTIVE, DEFAULT_INACTIVE,
                8f, 4f,
                10f, Color.WHITE, 14f, AxisPosition.LEADING,
                10f, Color.GRAY, 12f, AxisPosition.TRAILING);
    }

    public Color getActiveColorStart() { return activeColorStart; }
    public Color getActiveColorEnd() { return activeColorEnd; }
    public Color getInactiveColorStart() { return inactiveColorStart; }
    public Color getInactiveColorEnd() { return inactiveColorEnd; }
    public float getCellGap() { return cellGap; }
    public float getCellCornerRadius() { return cellCornerRadius; }
    public float getLabelGridGap() { return labelGridGap; }
    public Color getLabelTextColor() { return labelTextColor; }
    public float getLabelTextSize() { return labelTextSize; }
    public AxisPosition getLabelPosition() { return labelPosition; }
    public float getHeaderGridGap() { return headerGridGap; }
    public Color getHeaderTextColor() { return headerTextColor; }
    public float getHeaderTextSize() { return headerTextSize; }
    public AxisPosition getHeaderPosition() { return headerPosition; }

    public HeatmapStyle withActiveColors(Color start, Color end) {
        return new HeatmapStyle(start, end, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                labelGridGap, labelTextColor, labelTextSize, labelPosition,
                headerGridGap, headerTextColor, headerTextSize, headerPosition);
    }

    public HeatmapStyle withInactiveColors(Color start, Color end) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, start, end, cellGap, cellCornerRadius,
                labelGridGap, labelTextColor, labelTextSize, labelPosition,
                headerGridGap, headerTextColor, headerTextSize, headerPosition);
    }

    public HeatmapStyle withCellGap(float gap) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, gap, cellCornerRadius,
                labelGridGap, labelTextColor, labelTextSize, labelPosition,
                headerGridGap, headerTextColor, headerTextSize, headerPosition);
    }

    public HeatmapStyle withCellCornerRadius(float radius) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, radius,
                labelGridGap, labelTextColor, labelTextSize, labelPosition,
                headerGridGap, headerTextColor, headerTextSize, headerPosition);
    }

    public HeatmapStyle withLabelGridGap(float gap) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                gap, labelTextColor, labelTextSize, labelPosition,
                headerGridGap, headerTextColor, headerTextSize, headerPosition);
    }

    public HeatmapStyle withLabelTextColor(Color color) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                labelGridGap, color, labelTextSize, labelPosition,
                headerGridGap, headerTextColor, headerTextSize, headerPosition);
    }

    public HeatmapStyle withLabelTextSize(float size) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                labelGridGap, labelTextColor, size, labelPosition,
                headerGridGap, headerTextColor, headerTextSize, headerPosition);
    }

    public HeatmapStyle withLabelPosition(AxisPosition position) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                labelGridGap, labelTextColor, labelTextSize, position,
                headerGridGap, headerTextColor, headerTextSize, headerPosition);
    }

    public HeatmapStyle withHeaderGridGap(float gap) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                labelGridGap, labelTextColor, labelTextSize, labelPosition,
                gap, headerTextColor, headerTextSize, headerPosition);
    }

    public HeatmapStyle withHeaderTextColor(Color color) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                labelGridGap, labelTextColor, labelTextSize, labelPosition,
                headerGridGap, color, headerTextSize, headerPosition);
    }

    public HeatmapStyle withHeaderTextSize(float size) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                labelGridGap, labelTextColor, labelTextSize, labelPosition,
                headerGridGap, headerTextColor, size, headerPosition);
    }

    public HeatmapStyle withHeaderPosition(AxisPosition position) {
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                labelGridGap, labelTextColor, labelTextSize, labelPosition,
                headerGridGap, headerTextColor, headerTextSize, position);
    }

    /**
     * 按缩放系数放大所有长度与字号，颜色与位置不变。用于 HiDPI 环境。
     */
    public HeatmapStyle scaled(float factor) {
        if (factor <= 0f || factor == 1f) {
            return this;
        }
        return new HeatmapStyle(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd,
                cellGap * factor, cellCornerRadius * factor,
                labelGridGap * factor, labelTextColor, labelTextSize * factor, labelPosition,
                headerGridGap * factor, headerTextColor, headerTextSize * factor, headerPosition);
    }

    private static float nonNegative(float value) {
        if (Float.isNaN(value) || value < 0f) {
            return 0f;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeatmapStyle that)) return false;
        return Float.compare(cellGap, that.cellGap) == 0
                && Float.compare(cellCornerRadius, that.cellCornerRadius) == 0
                && Float.compare(labelGridGap, that.labelGridGap) == 0
                && Float.compare(labelTextSize, that.labelTextSize) == 0
                && Float.compare(headerGridGap, that.headerGridGap) == 0
                && Float.compare(headerTextSize, that.headerTextSize) == 0
                && activeColorStart.equals(that.activeColorStart)
                && activeColorEnd.equals(that.activeColorEnd)
                && inactiveColorStart.equals(that.inactiveColorStart)
                && inactiveColorEnd.equals(that.inactiveColorEnd)
                && labelTextColor.equals(that.labelTextColor)
                && labelPosition == that.labelPosition
                && headerTextColor.equals(that.headerTextColor)
                && headerPosition == that.headerPosition;
    }

    @Override
    public int hashCode() {
        return Objects.hash(activeColorStart, activeColorEnd, inactiveColorStart, inactiveColorEnd, cellGap, cellCornerRadius,
                labelGridGap, labelTextColor, labelTextSize, labelPosition,
                headerGridGap, headerTextColor, headerTextSize, headerPosition);
    }
}
