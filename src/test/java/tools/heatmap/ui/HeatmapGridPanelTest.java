package tools.heatmap.ui;

import org.junit.jupiter.api.Test;
import tools.heatmap.grid.CellHit;
import tools.heatmap.grid.FixedTextMetrics;
import tools.heatmap.grid.LayoutGeometry;
import tools.heatmap.model.AxisPosition;
import tools.heatmap.model.HeatmapStyle;
import tools.heatmap.model.RowData;

import javax.swing.border.EmptyBorder;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeatmapGridPanelTest {
    private static final List<String> WEEK = List.of("Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun");

    record Step(int day, int count) {
    }

    record Member(String name, List<Step> steps) {
    }

    private static HeatmapGridPanel<Step> newPanel() {
        HeatmapGridPanel<Step> panel = new HeatmapGridPanel<>(HeatmapStyle.defaults(), new FixedTextMetrics());
        // "Allen" 宽 35，标签区 45；7 列时方块 30
        panel.setSize(303, 200);
        return panel;
    }

    private static void bindAllen(HeatmapGridPanel<Step> panel) {
        panel.bindData(List.of(new Member("Allen", List.of(new Step(1, 7000), new Step(3, 3000)))),
                Member::name, Member::steps, s -> s.day() - 1, WEEK);
    }

    // 绘制相关用例不画任何文字，避免依赖系统字体
    private static void bindWithoutText(HeatmapGridPanel<Step> panel) {
        panel.setData(List.of(new RowData<>("", Map.of(0, new Step(1, 7000)))),
                List.of("", "", "", "", "", "", ""));
    }

    @Test
    void defaultsToTwelveMonthColumns() {
        HeatmapGridPanel<Step> panel = newPanel();

        assertEquals(12, panel.getColumnCount());
        assertEquals("Jan", panel.getColumnHeaders().get(0));
        assertTrue(panel.getRows().isEmpty());
    }

    @Test
    void headersDecideColumnCountAndSurviveRebind() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);
        assertEquals(7, panel.getColumnCount());

        panel.bindData(List.of(new Member("Bo", List.of(new Step(2, 100)))), Member::name, Member::steps,
                s -> s.day() - 1);

        assertEquals(7, panel.getColumnCount());
        assertEquals(WEEK, panel.getColumnHeaders());
        assertEquals("Bo", panel.getRows().get(0).getLabel());
        assertEquals(100, panel.getRows().get(0).cellAt(1).count());
    }

    @Test
    void setDataReplacesRows() {
        HeatmapGridPanel<Step> panel = newPanel();
        panel.setData(List.of(new RowData<>("X", Map.of(0, new Step(1, 1)))), List.of("A", "B"));

        assertEquals(2, panel.getColumnCount());
        assertEquals(1, panel.getRows().size());
    }

    @Test
    void resolveCellUsesCurrentGeometry() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);

        CellHit<Step> hit = panel.resolveCell(45 + 38 * 2 + 10, 10).orElseThrow();
        assertEquals(0, hit.rowIndex());
        assertEquals(2, hit.columnIndex());
        assertEquals(3000, hit.data().count());

        assertTrue(panel.resolveCell(45 + 34, 10).isEmpty());
    }

    @Test
    void mouseListenerOnlyInstalledWithClickListener() {
        HeatmapGridPanel<Step> panel = newPanel();
        int base = panel.getMouseListeners().length;

        panel.setCellClickListener((row, column, data) -> {
        });
        assertEquals(base + 1, panel.getMouseListeners().length);
        panel.setCellClickListener((row, column, data) -> {
        });
        assertEquals(base + 1, panel.getMouseListeners().length);

        panel.setCellClickListener(null);
        assertEquals(base, panel.getMouseListeners().length);
    }

    @Test
    void clickReportsRowColumnAndData() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);
        List<String> clicks = new ArrayList<>();
        panel.setCellClickListener((row, column, data) ->
                clicks.add(row + ":" + column + ":" + (data == null ? "-" : data.count())));

        assertTrue(panel.dispatchClick(50, 10));
        assertTrue(panel.dispatchClick(45 + 38 + 5, 10));
        assertFalse(panel.dispatchClick(5, 10));

        assertEquals(List.of("0:0:7000", "0:1:-"), clicks);
    }

    @Test
    void clickWithoutListenerIsIgnored() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);

        assertFalse(panel.dispatchClick(50, 10));
    }

    @Test
    void mutatingFromClickCallbackIsRejected() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);
        panel.setCellClickListener((row, column, data) -> panel.setCellGap(2f));

        assertThrows(IllegalStateException.class, () -> panel.dispatchClick(50, 10));
        // 回调结束后恢复可修改状态
        panel.setCellGap(2f);
        assertEquals(2f, panel.getHeatmapStyle().getCellGap());
    }

    @Test
    void mutatingFromPaintCallbackIsRejected() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindWithoutText(panel);
        panel.setCellAdapter((g, bounds, row, col, data) -> panel.setData(List.of(), null));

        BufferedImage image = new BufferedImage(303, 200, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            assertThrows(IllegalStateException.class, () -> panel.paintComponent(g));
        } finally {
            g.dispose();
        }
        assertEquals(1, panel.getRows().size());
    }

    @Test
    void borderChangeRemeasuresBeforeHitTest() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);
        assertEquals(30f, panel.currentGeometry().cellSide(), 0.001f);

        panel.setBorder(new EmptyBorder(0, 40, 0, 40));

        // 可用宽 303 - 80 - 45 = 178，方块 (178 - 6*8) / 7
        LayoutGeometry geometry = panel.currentGeometry();
        assertEquals(130f / 7f, geometry.cellSide(), 0.001f);
        assertEquals(303f - 40f, geometry.cellX(panel.getInsets(), 6) + geometry.cellSide(), 0.001f);

        assertTrue(panel.resolveCell(50, 5).isEmpty());
        assertEquals(0, panel.resolveCell(90, 5).orElseThrow().columnIndex());
        assertEquals(1, panel.resolveCell(115, 5).orElseThrow().columnIndex());
    }

    @Test
    void mutatingFontFromClickCallbackIsRejected() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);
        panel.setCellClickListener((row, column, data) -> panel.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 20)));

        assertThrows(IllegalStateException.class, () -> panel.dispatchClick(50, 10));
    }

    @Test
    void equalStyleKeepsCachedGeometry() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);
        LayoutGeometry before = panel.currentGeometry();

        panel.setCellGap(panel.getHeatmapStyle().getCellGap());
        panel.setLabelPosition(AxisPosition.LEADING);

        assertSame(before, panel.currentGeometry());
    }

    @Test
    void styleChangeRemeasures() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);
        LayoutGeometry before = panel.currentGeometry();

        panel.setHeaderPosition(AxisPosition.LEADING);
        LayoutGeometry after = panel.currentGeometry();

        assertNotSame(before, after);
        assertEquals(before.cellSide(), after.cellSide(), 0.001f);
        assertEquals(after.headerAreaHeight(), after.gridOffsetY(), 0.001f);
    }

    @Test
    void preferredHeightFollowsMeasuredHeight() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindAllen(panel);

        // 表头区 22 + 一行方块 30
        assertEquals(303, panel.getPreferredSize().width);
        assertEquals(52, panel.getPreferredSize().height);
    }

    @Test
    void adaptersCanBeClearedAgain() {
        HeatmapGridPanel<Step> panel = newPanel();
        bindWithoutText(panel);
        panel.setColorAdapter(data -> null);
        panel.setCellAdapter((g, bounds, row, col, data) -> {
        });
        panel.setColorAdapter(null);
        panel.setCellAdapter(null);

        BufferedImage image = new BufferedImage(303, 200, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            panel.paintComponent(g);
        } finally {
            g.dispose();
        }
        assertNull(panel.resolveCell(1, 1).orElse(null));
    }
}
