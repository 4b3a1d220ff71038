package tools.heatmap.ui;

import tools.heatmap.model.HeatmapStyle;

import javax.swing.LookAndFeel;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 一套界面主题：外观（LookAndFeel）加上与之匹配的热力图配色。
 */
public class ThemeOption {
    private final String id;
    private final String name;
    private final Supplier<LookAndFeel> lookAndFeelSupplier;
    private final UnaryOperator<HeatmapStyle> palette;

    public ThemeOption(String id, String name, Supplier<LookAndFeel> lookAndFeelSupplier,
                       UnaryOperator<HeatmapStyle> palette) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.lookAndFeelSupplier = Objects.requireNonNull(lookAndFeelSupplier, "lookAndFeelSupplier");
        this.palette = palette == null ? UnaryOperator.identity() : palette;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public LookAndFeel createLookAndFeel() {
        return lookAndFeelSupplier.get();
    }

    /** 把主题配色套用到已有样式上，尺寸与位置保持不变。 */
    public HeatmapStyle applyPalette(HeatmapStyle style) {
        return palette.apply(style);
    }

    @Override
    public String toString() {
        return name;
    }
}
