package tools.heatmap.grid;

import java.awt.Font;
import java.awt.font.FontRenderContext;
import java.awt.font.LineMetrics;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 AWT 字体的文字度量，按字号缓存派生字体。
 * 使用抗锯齿 + 小数度量的 FontRenderContext，与绘制时的渲染提示保持一致。
 */
public class FontTextMetrics implements TextMetrics {
    private static final String METRICS_SAMPLE = "Mg";
    private static final FontRenderContext FRC = new FontRenderContext(null, true, true);
    static final int MAX_CACHED_FONTS = 8;

    private final Font baseFont;
    /** 按访问顺序淘汰，只保留最近使用的若干字号。 */
    private final Map<Float, Font> fontCache = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Float, Font> eldest) {
            return size() > MAX_CACHED_FONTS;
        }
    };

    public FontTextMetrics(Font baseFont) {
        this.baseFont = Objects.requireNonNull(baseFont, "baseFont");
    }

    public Font getBaseFont() {
        return baseFont;
    }

    public Font fontFor(float size) {
        return fontCache.computeIfAbsent(size, s -> baseFont.deriveFont(s.floatValue()));
    }

    int cachedFontCount() {
        return fontCache.size();
    }

    @Override
    public float width(String text, float size) {
        if (text == null || text.isEmpty()) {
            return 0f;
        }
        return (float) fontFor(size).getStringBounds(text, FRC).getWidth();
    }

    @Override
    public float ascent(float size) {
        return lineMetrics(size).getAscent();
    }

    @Override
    public float descent(float size) {
        return lineMetrics(size).getDescent();
    }

    private LineMetrics lineMetrics(float size) {
        return fontFor(size).getLineMetrics(METRICS_SAMPLE, FRC);
    }
}
