package tools.heatmap.app;

import com.formdev.flatlaf.FlatLaf;
import tools.heatmap.ui.HeatmapDemoFrame;
import tools.heatmap.ui.ThemeManager;
import tools.heatmap.ui.ThemeOption;
import tools.heatmap.ui.UiStyle;
import tools.heatmap.util.Config;

import javax.swing.SwingUtilities;

/**
 * 应用入口。按 heatmap.properties 中的 ui.theme 选择 FlatLaf 主题后打开演示窗口。
 */
public class Main {
    public static void main(String[] args) {
        // 设置 UTF-8
        System.setProperty("file.encoding", "UTF-8");
        ThemeOption theme = new ThemeManager().findByIdOrDefault(Config.getThemeId());
        FlatLaf.setup(theme.createLookAndFeel());
        UiStyle.installGlobalDefaults();
        SwingUtilities.invokeLater(() -> {
            HeatmapDemoFrame frame = new HeatmapDemoFrame();
            frame.setVisible(true);
        });
    }
}
