package tools.heatmap.grid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.heatmap.model.AxisPosition;
import tools.heatmap.model.HeatmapStyle;
import tools.heatmap.model.RowData;

import java.awt.Insets;
import java.util.List;
import java.util.Objects;

/**
 * 布局计算：根据可用宽度、内边距、行数、列数与标签文字计算方块边长、
 * 标签区 / 表头区尺寸与网格偏移。纯计算，无副作用。
 */
public class HeatmapLayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(HeatmapLayoutEngine.class);
    private static final Insets NO_PADDING = new Insets(0, 0, 0, 0);

    private final TextMetrics textMetrics;

    public HeatmapLayoutEngine(TextMetrics textMetrics) {
        this.textMetrics = Objects.requireNonNull(textMetrics, "textMetrics");
    }

    public LayoutGeometry measure(float availableWidth, Insets padding, List<? extends RowData<?>> rows,
                                  int columnCount, HeatmapStyle style) {
        Insets insets = padding == null ? NO_PADDING : padding;
        List<? extends RowData<?>> safeRows = rows == null ? List.of() : rows;
        float width = sanitize(availableWidth);
        int rowCount = safeRows.size();

        // A. 左侧（或右侧）标签区：取最长文字宽度，避免截断
        float maxLabelWidth = 0f;
        for (RowData<?> row : safeRows) {
            float w = sanitize(textMetrics.width(row.getLabel(), style.getLabelTextSize()));
            if (w > maxLabelWidth) {
                maxLabelWidth = w;
            }
        }
        float labelAreaWidth = rowCount > 0 ? maxLabelWidth + style.getLabelGridGap() : 0f;

        // B. 方块边长 = (可用宽 - (列数-1)*间距) / 列数，列数为 0 时直接为 0
        float gridAvailableWidth = Math.max(0f, width - insets.left - insets.right - labelAreaWidth);
        float cellGap = style.getCellGap();
        float cellSide = 0f;
        if (columnCount > 0) {
            cellSide = Math.max(0f, (gridAvailableWidth - (columnCount - 1) * cellGap) / columnCount);
        }

        // C. 表头区高度 = 间距 + |ascent| + |descent|
        float headerAreaHeight = style.getHeaderGridGap() + sanitize(textMetrics.textHeight(style.getHeaderTextSize()));

        float gridOffsetX = style.getLabelPosition() == AxisPosition.LEADING ? labelAreaWidth : 0f;
        float gridOffsetY = style.getHeaderPosition() == AxisPosition.LEADING ? headerAreaHeight : 0f;

        // D. 总高度：没有行时只保留表头区
        float contentHeight = headerAreaHeight;
        if (rowCount > 0) {
            contentHeight += rowCount * cellSide + (rowCount - 1) * cellGap;
        }
        float measuredHeight = contentHeight + insets.top + insets.bottom;

        LayoutGeometry geometry = new LayoutGeometry(cellSide, cellGap, maxLabelWidth, labelAreaWidth, headerAreaHeight,
                gridOffsetX, gridOffsetY, rowCount, Math.max(0, columnCount), width, measuredHeight);
        log.debug("热力图测量: width={}, rows={}, columns={}, cellSide={}, height={}",
                width, rowCount, columnCount, cellSide, measuredHeight);
        return geometry;
    }

    private static float sanitize(float value) {
        if (Float.isNaN(value) || Float.isInfinite(value) || value < 0f) {
            return 0f;
        }
        return value;
    }
}
