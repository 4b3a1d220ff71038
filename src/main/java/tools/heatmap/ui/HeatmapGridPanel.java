package tools.heatmap.ui;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.heatmap.grid.CellColorAdapter;
import tools.heatmap.grid.CellDrawAdapter;
import tools.heatmap.grid.CellHit;
import tools.heatmap.grid.FontTextMetrics;
import tools.heatmap.grid.HeatmapDataBinder;
import tools.heatmap.grid.HeatmapHitTester;
import tools.heatmap.grid.HeatmapLayoutEngine;
import tools.heatmap.grid.HeatmapRenderer;
import tools.heatmap.grid.HeatmapSnapshot;
import tools.heatmap.grid.LayoutGeometry;
import tools.heatmap.grid.TextMetrics;
import tools.heatmap.model.AxisPosition;
import tools.heatmap.model.HeatmapStyle;
import tools.heatmap.model.RowData;

import javax.swing.JComponent;
import javax.swing.JViewport;
import javax.swing.Scrollable;
import javax.swing.SwingConstants;
import javax.swing.SwingUtilities;
import javax.swing.UIManager;
import javax.swing.border.Border;
import java.awt.Color;
import java.awt.Container;
import java.awt.Dimension;
import java.awt.Font;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Insets;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * 活动热力图组件，类似 GitHub 提交记录或健身打卡记录。
 *
 * <ul>
 *     <li>自适应布局：自动测量标签宽度，方块边长随可用宽度变化；</li>
 *     <li>内边距取自组件的 Border（如 EmptyBorder）；</li>
 *     <li>列数由表头数量决定，重复绑定数据时可以不再传表头；</li>
 *     <li>支持动态颜色、自定义方块内容与方块点击回调，三者都可随时替换或置空。</li>
 * </ul>
 *
 * 所有方法都应在 EDT 上调用。绘制或点击回调执行期间修改数据或样式会抛出 IllegalStateException。
 */
public class HeatmapGridPanel<D> extends JComponent implements Scrollable {
    private static final Logger log = LoggerFactory.getLogger(HeatmapGridPanel.class);

    private final TextMetrics customMetrics;
    private TextMetrics textMetrics;
    private HeatmapLayoutEngine layoutEngine;
    private HeatmapRenderer renderer;

    private HeatmapStyle style;
    private HeatmapSnapshot<D> snapshot = HeatmapSnapshot.initial();
    private LayoutGeometry cachedGeometry;
    private Insets cachedInsets;

    private CellColorAdapter<? super D> colorAdapter;
    private CellDrawAdapter<? super D> cellAdapter;
    private CellClickListener<? super D> clickListener;
    private boolean clickHandlerInstalled;
    private boolean inCallback;

    private final MouseAdapter clickHandler = new MouseAdapter() {
        @Override
        public void mouseClicked(MouseEvent e) {
            if (SwingUtilities.isLeftMouseButton(e) && dispatchClick(e.getX(), e.getY())) {
                e.consume();
            }
        }
    };

    public HeatmapGridPanel() {
        this(HeatmapStyle.defaults());
    }

    public HeatmapGridPanel(HeatmapStyle style) {
        this(style, null);
    }

    /**
     * @param textMetrics 自定义文字度量；为 null 时使用组件字体的 AWT 度量
     */
    public HeatmapGridPanel(HeatmapStyle style, TextMetrics textMetrics) {
        this.style = Objects.requireNonNull(style, "style");
        this.customMetrics = textMetrics;
        rebuildTextPipeline();
        addComponentListener(new ComponentAdapter() {
            @Override
            public void componentResized(ComponentEvent e) {
                if (cachedGeometry == null || cachedGeometry.measuredWidth() != getWidth()) {
                    cachedGeometry = null;
                    revalidate();
                    repaint();
                }
            }
        });
    }

    // ---------------------------------------------------------------- 数据绑定

    public <T> void bindData(List<? extends T> items,
                             Function<? super T, String> labelOf,
                             Function<? super T, ? extends List<? extends D>> detailsOf) {
        bindData(items, labelOf, detailsOf, null, null);
    }

    public <T> void bindData(List<? extends T> items,
                             Function<? super T, String> labelOf,
                             Function<? super T, ? extends List<? extends D>> detailsOf,
                             ToIntFunction<? super D> indexOf) {
        bindData(items, labelOf, detailsOf, indexOf, null);
    }

    /**
     * 绑定任意业务数据。
     *
     * @param items     业务对象，每个对象对应一行
     * @param labelOf   取行标签
     * @param detailsOf 取该行的有序明细
     * @param indexOf   （可选）明细所在列，返回负数的明细会被丢弃；为 null 时按明细位置
     * @param headers   （可选）表头，传入时列数随表头数量变化；为 null 时沿用上一次的表头
     */
    public <T> void bindData(List<? extends T> items,
                             Function<? super T, String> labelOf,
                             Function<? super T, ? extends List<? extends D>> detailsOf,
                             ToIntFunction<? super D> indexOf,
                             List<String> headers) {
        ensureMutable("bindData");
        List<RowData<D>> rows = HeatmapDataBinder.toRows(items, labelOf, detailsOf, indexOf);
        replaceSnapshot(snapshot.rebind(rows, headers));
    }

    /**
     * 直接设置已构造好的行数据，表头规则同 {@link #bindData}。
     */
    public void setData(List<RowData<D>> rows, List<String> headers) {
        ensureMutable("setData");
        replaceSnapshot(snapshot.rebind(rows, headers));
    }

    private void replaceSnapshot(HeatmapSnapshot<D> next) {
        this.snapshot = next;
        log.debug("绑定热力图数据: {} 行, {} 列", next.getRowCount(), next.getColumnCount());
        invalidateGeometry();
    }

    public List<RowData<D>> getRows() {
        return snapshot.getRows();
    }

    public List<String> getColumnHeaders() {
        return snapshot.getHeaders();
    }

    public int getColumnCount() {
        return snapshot.getColumnCount();
    }

    // ---------------------------------------------------------------- 回调

    public void setColorAdapter(CellColorAdapter<? super D> colorAdapter) {
        this.colorAdapter = colorAdapter;
        repaint();
    }

    public void setCellAdapter(CellDrawAdapter<? super D> cellAdapter) {
        this.cellAdapter = cellAdapter;
        repaint();
    }

    /**
     * 设置方块点击回调。只有设置了回调才会监听鼠标事件，
     * 否则鼠标事件完全交给外层容器（例如滚动面板）处理。
     */
    public void setCellClickListener(CellClickListener<? super D> listener) {
        this.clickListener = listener;
        if (listener != null && !clickHandlerInstalled) {
            addMouseListener(clickHandler);
            clickHandlerInstalled = true;
        } else if (listener == null && clickHandlerInstalled) {
            removeMouseListener(clickHandler);
            clickHandlerInstalled = false;
        }
    }

    // ---------------------------------------------------------------- 样式

    public HeatmapStyle getHeatmapStyle() {
        return style;
    }

    public void setHeatmapStyle(HeatmapStyle newStyle) {
        applyStyle(Objects.requireNonNull(newStyle, "style"));
    }

    public void setLabelTextSize(float sizePx) {
        applyStyle(style.withLabelTextSize(sizePx));
    }

    public void setHeaderTextSize(float sizePx) {
        applyStyle(style.withHeaderTextSize(sizePx));
    }

    public void setLabelGridGap(float gapPx) {
        applyStyle(style.withLabelGridGap(gapPx));
    }

    public void setHeaderGridGap(float gapPx) {
        applyStyle(style.withHeaderGridGap(gapPx));
    }

    public void setCellGap(float gapPx) {
        applyStyle(style.withCellGap(gapPx));
    }

    public void setCellCornerRadius(float radiusPx) {
        applyStyle(style.withCellCornerRadius(radiusPx));
    }

    public void setLabelPosition(AxisPosition position) {
        applyStyle(style.withLabelPosition(Objects.requireNonNull(position, "position")));
    }

    public void setHeaderPosition(AxisPosition position) {
        applyStyle(style.withHeaderPosition(Objects.requireNonNull(position, "position")));
    }

    public void setActiveColors(Color start, Color end) {
        applyStyle(style.withActiveColors(start, end));
    }

    public void setInactiveColors(Color start, Color end) {
        applyStyle(style.withInactiveColors(start, end));
    }

    public void setLabelTextColor(Color color) {
        applyStyle(style.withLabelTextColor(color));
    }

    public void setHeaderTextColor(Color color) {
        applyStyle(style.withHeaderTextColor(color));
    }

    private void applyStyle(HeatmapStyle next) {
        ensureMutable("style");
        if (next.equals(style)) {
            return;
        }
        this.style = next;
        invalidateGeometry();
    }

    @Override
    public void setFont(Font font) {
        ensureMutable("font");
        super.setFont(font);
        rebuildTextPipeline();
        invalidateGeometry();
    }

    // ---------------------------------------------------------------- 测量

    /**
     * 当前宽度下的几何信息。数据或样式变化后第一次调用会重新测量，
     * 绘制与点击命中都通过这里取值。
     */
    public LayoutGeometry currentGeometry() {
        return geometryFor(getWidth());
    }

    private LayoutGeometry geometryFor(int width) {
        // 缓存同时以宽度和内边距为键，Border 更换后必须重新测量
        Insets insets = getInsets();
        LayoutGeometry geometry = cachedGeometry;
        if (geometry != null && geometry.measuredWidth() == Math.max(0, width) && insets.equals(cachedInsets)) {
            return geometry;
        }
        geometry = layoutEngine.measure(width, insets, snapshot.getRows(), snapshot.getColumnCount(), style);
        cachedGeometry = geometry;
        cachedInsets = insets;
        return geometry;
    }

    @Override
    public void setBorder(Border border) {
        super.setBorder(border);
        invalidateGeometry();
    }

    private void invalidateGeometry() {
        cachedGeometry = null;
        cachedInsets = null;
        revalidate();
        repaint();
    }

    @Override
    public Dimension getPreferredSize() {
        if (isPreferredSizeSet()) {
            return super.getPreferredSize();
        }
        int width = getWidth();
        if (width <= 0) {
            Container parent = getParent();
            width = parent != null ? parent.getWidth() : 0;
        }
        LayoutGeometry geometry = geometryFor(width);
        return new Dimension(width, (int) Math.ceil(geometry.measuredHeight()));
    }

    // ---------------------------------------------------------------- 绘制

    @Override
    protected void paintComponent(Graphics g) {
        super.paintComponent(g);
        LayoutGeometry geometry = currentGeometry();
        Graphics2D g2 = (Graphics2D) g.create();
        inCallback = true;
        try {
            if (isOpaque()) {
                g2.setColor(getBackground());
                g2.fillRect(0, 0, getWidth(), getHeight());
            }
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g2.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
            renderer.paint(g2, snapshot, geometry, getInsets(), style, colorAdapter, cellAdapter);
        } finally {
            inCallback = false;
            g2.dispose();
        }
    }

    // ---------------------------------------------------------------- 点击

    /**
     * 把组件坐标换算为方块，使用与绘制相同的几何信息。
     */
    public Optional<CellHit<D>> resolveCell(int x, int y) {
        return HeatmapHitTester.resolveCell(x, y, getInsets(), currentGeometry(), snapshot);
    }

    boolean dispatchClick(int x, int y) {
        CellClickListener<? super D> listener = clickListener;
        if (listener == null) {
            return false;
        }
        Optional<CellHit<D>> hit = resolveCell(x, y);
        if (hit.isEmpty()) {
            return false;
        }
        CellHit<D> cell = hit.get();
        inCallback = true;
        try {
            listener.onCellClick(cell.rowIndex(), cell.columnIndex(), cell.data());
        } finally {
            inCallback = false;
        }
        return true;
    }

    // ---------------------------------------------------------------- Scrollable

    @Override
    public Dimension getPreferredScrollableViewportSize() {
        return getPreferredSize();
    }

    @Override
    public int getScrollableUnitIncrement(Rectangle visibleRect, int orientation, int direction) {
        if (orientation == SwingConstants.VERTICAL) {
            return Math.max(1, Math.round(currentGeometry().pitch()));
        }
        return 16;
    }

    @Override
    public int getScrollableBlockIncrement(Rectangle visibleRect, int orientation, int direction) {
        return orientation == SwingConstants.VERTICAL ? visibleRect.height : visibleRect.width;
    }

    @Override
    public boolean getScrollableTracksViewportWidth() {
        return true;
    }

    @Override
    public boolean getScrollableTracksViewportHeight() {
        Container viewport = getParent();
        if (viewport instanceof JViewport) {
            return getPreferredSize().height < viewport.getHeight();
        }
        return false;
    }

    // ---------------------------------------------------------------- 内部

    private void ensureMutable(String operation) {
        if (inCallback) {
            throw new IllegalStateException("绘制或点击回调执行期间不允许修改热力图: " + operation);
        }
    }

    private void rebuildTextPipeline() {
        Font font = resolveBaseFont();
        this.textMetrics = customMetrics != null ? customMetrics : new FontTextMetrics(font);
        this.layoutEngine = new HeatmapLayoutEngine(textMetrics);
        this.renderer = new HeatmapRenderer(textMetrics, font);
    }

    private Font resolveBaseFont() {
        Font font = getFont();
        if (font == null) {
            font = UIManager.getFont("Label.font");
        }
        if (font == null) {
            font = new Font(Font.SANS_SERIF, Font.PLAIN, 12);
        }
        return font;
    }
}
