package tools.heatmap.ui;

import com.formdev.flatlaf.FlatDarculaLaf;
import com.formdev.flatlaf.FlatDarkLaf;
import com.formdev.flatlaf.FlatIntelliJLaf;
import com.formdev.flatlaf.FlatLightLaf;
import tools.heatmap.model.HeatmapStyle;
import tools.heatmap.util.OperationLog;

import javax.swing.SwingUtilities;
import javax.swing.UIManager;
import java.awt.Color;
import java.awt.Window;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 可选主题列表与异步切换。深色主题使用深灰未激活方块，浅色主题使用 GitHub 风格的浅灰方块。
 */
public class ThemeManager {
    static final Color LIGHT_INACTIVE = new Color(0xEB, 0xED, 0xF0);
    static final Color LIGHT_LABEL = new Color(0x24, 0x29, 0x2F);
    static final Color LIGHT_HEADER = new Color(0x57, 0x60, 0x6A);

    private final List<ThemeOption> options;

    public ThemeManager() {
        List<ThemeOption> list = new ArrayList<>();
        list.add(new ThemeOption("flat-dark", "暗色（Flat Dark）", FlatDarkLaf::new, darkPalette()));
        list.add(new ThemeOption("darcula", "Darcula 深色", FlatDarculaLaf::new, darkPalette()));
        list.add(new ThemeOption("flat-light", "浅色（Flat Light）", FlatLightLaf::new, lightPalette()));
        list.add(new ThemeOption("intellij", "蓝灰 IntelliJ", FlatIntelliJLaf::new, lightPalette()));
        options = Collections.unmodifiableList(list);
    }

    public List<ThemeOption> getOptions() {
        return options;
    }

    public Optional<ThemeOption> findById(String id) {
        return options.stream().filter(o -> o.getId().equals(id)).findFirst();
    }

    public ThemeOption findByIdOrDefault(String id) {
        return findById(id).orElse(options.get(0));
    }

    public void applyThemeAsync(ThemeOption option, Runnable afterApply) {
        if (option == null) {
            return;
        }
        SwingUtilities.invokeLater(() -> {
            try {
                UIManager.setLookAndFeel(option.createLookAndFeel());
                for (Window window : Window.getWindows()) {
                    SwingUtilities.updateComponentTreeUI(window);
                    window.invalidate();
                    window.validate();
                    window.repaint();
                }
                OperationLog.log("已切换主题: " + option.getName());
            } catch (Exception ex) {
                OperationLog.log("切换主题失败: " + ex.getMessage());
            }
            if (afterApply != null) {
                afterApply.run();
            }
        });
    }

    private static UnaryOperator<HeatmapStyle> darkPalette() {
        HeatmapStyle defaults = HeatmapStyle.defaults();
        return style -> style
                .withInactiveColors(defaults.getInactiveColorStart(), defaults.getInactiveColorEnd())
                .withLabelTextColor(defaults.getLabelTextColor())
                .withHeaderTextColor(defaults.getHeaderTextColor());
    }

    private static UnaryOperator<HeatmapStyle> lightPalette() {
        return style -> style
                .withInactiveColors(LIGHT_INACTIVE, LIGHT_INACTIVE)
                .withLabelTextColor(LIGHT_LABEL)
                .withHeaderTextColor(LIGHT_HEADER);
    }
}
