package tools.heatmap.ui;

import tools.heatmap.sample.ActivityDetail;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;

/**
 * 成员步数热力图的动态配色与方块文字：按步数分四档着色，方块内显示以千为单位的步数。
 */
final class StepColors {
    static final Color LEVEL_1 = new Color(0x0E, 0x44, 0x29);
    static final Color LEVEL_2 = new Color(0x00, 0x6D, 0x32);
    static final Color LEVEL_3 = new Color(0x26, 0xA6, 0x41);
    static final Color LEVEL_4 = new Color(0x39, 0xD3, 0x53);

    private StepColors() {
    }

    /** 无记录返回 null，交回默认的未激活底色。 */
    static Color colorFor(ActivityDetail detail) {
        if (detail == null) {
            return null;
        }
        int count = detail.getCount();
        if (count < 3000) return LEVEL_1;
        if (count < 6000) return LEVEL_2;
        if (count < 9000) return LEVEL_3;
        return LEVEL_4;
    }

    static String countText(int count) {
        if (count >= 1000) {
            return (count / 1000) + "k";
        }
        return String.valueOf(Math.max(0, count));
    }

    static void drawCount(Graphics2D g, Rectangle2D bounds, int rowIndex, int columnIndex, ActivityDetail detail) {
        float size = (float) (bounds.getHeight() * 0.32);
        if (size < 6f) {
            return;
        }
        String text = countText(detail.getCount());
        g.setFont(g.getFont().deriveFont(Font.BOLD, size));
        FontMetrics fm = g.getFontMetrics();
        float x = (float) (bounds.getCenterX() - fm.stringWidth(text) / 2.0);
        float y = (float) (bounds.getCenterY() + (fm.getAscent() - fm.getDescent()) / 2.0);
        g.setColor(Color.WHITE);
        g.drawString(text, x, y);
    }
}
