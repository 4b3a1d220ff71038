package tools.heatmap.grid;

import tools.heatmap.model.AxisPosition;
import tools.heatmap.model.HeatmapStyle;
import tools.heatmap.model.RowData;

import java.awt.Color;
import java.awt.Font;
import java.awt.GradientPaint;
import java.awt.Graphics2D;
import java.awt.Insets;
import java.awt.Paint;
import java.awt.geom.Rectangle2D;
import java.awt.geom.RoundRectangle2D;
import java.util.List;
import java.util.Objects;

/**
 * 绘制流程：逐行绘制标签与方块，表头只在紧邻表头区的那一行绘制一次。
 * 只产生绘图副作用，不修改任何数据。
 */
public class HeatmapRenderer {
    private final TextMetrics textMetrics;
    private final Font baseFont;

    public HeatmapRenderer(TextMetrics textMetrics, Font baseFont) {
        this.textMetrics = Objects.requireNonNull(textMetrics, "textMetrics");
        this.baseFont = Objects.requireNonNull(baseFont, "baseFont");
    }

    public <D> void paint(Graphics2D g, HeatmapSnapshot<D> snapshot, LayoutGeometry geometry, Insets padding,
                          HeatmapStyle style, CellColorAdapter<? super D> colorAdapter,
                          CellDrawAdapter<? super D> cellAdapter) {
        List<RowData<D>> rows = snapshot.getRows();
        if (rows.isEmpty()) {
            return;
        }
        // 循环外预先计算文字度量
        float labelSize = style.getLabelTextSize();
        float labelBaselineOffset = (Math.abs(textMetrics.ascent(labelSize)) - Math.abs(textMetrics.descent(labelSize))) / 2f;
        float headerSize = style.getHeaderTextSize();
        float headerAscent = Math.abs(textMetrics.ascent(headerSize));
        float headerDescent = Math.abs(textMetrics.descent(headerSize));
        Font labelFont = baseFont.deriveFont(labelSize);
        Font headerFont = baseFont.deriveFont(headerSize);

        boolean drawCells = !geometry.isDegenerate();
        int columnCount = Math.min(geometry.columnCount(), snapshot.getColumnCount());
        int headerRow = style.getHeaderPosition() == AxisPosition.LEADING ? 0 : rows.size() - 1;
        float cellSide = geometry.cellSide();
        float arc = style.getCellCornerRadius() * 2f;

        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            RowData<D> row = rows.get(rowIndex);
            float topY = geometry.rowY(padding, rowIndex);
            float bottomY = topY + cellSide;

            // 1. 行标签，垂直居中于方块
            String label = row.getLabel();
            if (!label.isEmpty()) {
                float textX = style.getLabelPosition() == AxisPosition.LEADING
                        ? padding.left
                        : geometry.measuredWidth() - padding.right - textMetrics.width(label, labelSize);
                g.setFont(labelFont);
                g.setColor(style.getLabelTextColor());
                g.drawString(label, textX, topY + cellSide / 2f + labelBaselineOffset);
            }

            if (!drawCells) {
                continue;
            }

            // 2. 每行只构造一次填充，两端颜色相同时直接使用纯色
            Paint activeFill = fillFor(style.getActiveColorStart(), style.getActiveColorEnd(), topY, bottomY);
            Paint inactiveFill = fillFor(style.getInactiveColorStart(), style.getInactiveColorEnd(), topY, bottomY);

            for (int colIndex = 0; colIndex < columnCount; colIndex++) {
                float leftX = geometry.cellX(padding, colIndex);
                boolean hasData = row.hasCell(colIndex);
                D value = row.cellAt(colIndex);

                Paint fill = hasData ? activeFill : inactiveFill;
                if (colorAdapter != null) {
                    Color dynamic = colorAdapter.colorFor(value);
                    if (dynamic != null) {
                        fill = dynamic;
                    }
                }
                g.setPaint(fill);
                g.fill(new RoundRectangle2D.Float(leftX, topY, cellSide, cellSide, arc, arc));

                if (hasData && cellAdapter != null) {
                    Graphics2D overlay = (Graphics2D) g.create();
                    try {
                        Rectangle2D bounds = new Rectangle2D.Float(leftX, topY, cellSide, cellSide);
                        cellAdapter.onDrawCell(overlay, bounds, rowIndex, colIndex, value);
                    } finally {
                        overlay.dispose();
                    }
                }

                if (rowIndex == headerRow) {
                    String header = snapshot.headerAt(colIndex);
                    if (!header.isEmpty()) {
                        float baselineY = style.getHeaderPosition() == AxisPosition.LEADING
                                ? topY - style.getHeaderGridGap() - headerDescent
                                : bottomY + style.getHeaderGridGap() + headerAscent;
                        float headerX = leftX + cellSide / 2f - textMetrics.width(header, headerSize) / 2f;
                        g.setFont(headerFont);
                        g.setColor(style.getHeaderTextColor());
                        g.drawString(header, headerX, baselineY);
                    }
                }
            }
        }
    }

    private static Paint fillFor(Color start, Color end, float top, float bottom) {
        if (start.equals(end)) {
            return start;
        }
        return new GradientPaint(0f, top, start, 0f, bottom, end);
    }
}
