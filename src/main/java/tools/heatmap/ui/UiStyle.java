package tools.heatmap.ui;

import javax.swing.*;
import javax.swing.border.Border;
import javax.swing.border.CompoundBorder;
import javax.swing.border.EmptyBorder;
import javax.swing.border.MatteBorder;
import javax.swing.plaf.FontUIResource;
import java.awt.*;
import java.util.Enumeration;

/**
 * 演示窗口的统一样式：字体、留白、分区标题与分割线。
 */
public final class UiStyle {
    public static final Color BORDER = new Color(60, 64, 72);
    public static final Color MUTED_TEXT = new Color(140, 148, 160);

    private UiStyle() {
    }

    public static void installGlobalDefaults() {
        Font baseFont = new Font("SansSerif", Font.PLAIN, 13);
        FontUIResource resource = new FontUIResource(baseFont);
        Enumeration<Object> keys = UIManager.getDefaults().keys();
        while (keys.hasMoreElements()) {
            Object key = keys.nextElement();
            Object value = UIManager.get(key);
            if (value instanceof FontUIResource) {
                UIManager.put(key, resource);
            }
        }
        UIManager.put("defaultFont", resource);
        UIManager.put("Button.arc", 8);
        UIManager.put("Component.focusWidth", 1);
        UIManager.put("ScrollBar.width", 10);
    }

    public static Border panelPadding() {
        return new EmptyBorder(12, 12, 12, 12);
    }

    /** 热力图四周的内边距，组件据此计算 padding。 */
    public static Border heatmapPadding() {
        return new EmptyBorder(8, 12, 8, 12);
    }

    public static Border sectionLine() {
        return new CompoundBorder(new MatteBorder(0, 0, 1, 0, BORDER), new EmptyBorder(0, 0, 8, 0));
    }

    public static JLabel sectionTitle(String text) {
        JLabel label = new JLabel(text);
        label.setFont(label.getFont().deriveFont(Font.BOLD, 15f));
        return label;
    }

    public static JLabel caption(String text) {
        JLabel label = new JLabel(text);
        label.setForeground(MUTED_TEXT);
        return label;
    }
}
