package tools.heatmap.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.heatmap.model.AxisPosition;
import tools.heatmap.model.HeatmapStyle;

import java.awt.Color;
import java.util.Locale;
import java.util.Properties;

/**
 * 把 properties 中的一组 &lt;prefix&gt;.xxx 属性解析为 {@link HeatmapStyle}。
 * 颜色格式为 #RRGGBB 或 #AARRGGBB；非法值记录警告并回退到默认值。
 * 只配置了起始色而没有配置结束色时，结束色等于起始色（即纯色填充）。
 */
public final class HeatmapStyleProperties {
    private static final Logger log = LoggerFactory.getLogger(HeatmapStyleProperties.class);

    private HeatmapStyleProperties() {
    }

    public static HeatmapStyle read(Properties props, String prefix, HeatmapStyle defaults) {
        if (props == null) {
            return defaults;
        }
        String base = prefix == null || prefix.isBlank() ? "" : prefix.trim() + ".";
        Reader reader = new Reader(props, base);

        Color activeStart = reader.color("activeColorStart", defaults.getActiveColorStart());
        Color activeEnd = reader.color("activeColorEnd",
                reader.has("activeColorStart") ? activeStart : defaults.getActiveColorEnd());
        Color inactiveStart = reader.color("inactiveColorStart", defaults.getInactiveColorStart());
        Color inactiveEnd = reader.color("inactiveColorEnd",
                reader.has("inactiveColorStart") ? inactiveStart : defaults.getInactiveColorEnd());

        return new HeatmapStyle(activeStart, activeEnd, inactiveStart, inactiveEnd,
                reader.length("cellGap", defaults.getCellGap()),
                reader.length("cellCornerRadius", defaults.getCellCornerRadius()),
                reader.length("labelGridGap", defaults.getLabelGridGap()),
                reader.color("labelTextColor", defaults.getLabelTextColor()),
                reader.length("labelTextSize", defaults.getLabelTextSize()),
                reader.position("labelPosition", defaults.getLabelPosition()),
                reader.length("headerGridGap", defaults.getHeaderGridGap()),
                reader.color("headerTextColor", defaults.getHeaderTextColor()),
                reader.length("headerTextSize", defaults.getHeaderTextSize()),
                reader.position("headerPosition", defaults.getHeaderPosition()));
    }

    /**
     * 解析 #RRGGBB / #AARRGGBB，无法解析时返回 null。
     */
    public static Color parseColor(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim();
        if (text.startsWith("#")) {
            text = text.substring(1);
        }
        if (text.length() != 6 && text.length() != 8) {
            return null;
        }
        try {
            long value = Long.parseLong(text, 16);
            if (text.length() == 6) {
                return new Color((int) value);
            }
            return new Color((int) value, true);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static final class Reader {
        private final Properties props;
        private final String base;

        Reader(Properties props, String base) {
            this.props = props;
            this.base = base;
        }

        boolean has(String key) {
            String raw = props.getProperty(base + key);
            return raw != null && !raw.isBlank() && parseColor(raw) != null;
        }

        Color color(String key, Color defaultValue) {
            String raw = props.getProperty(base + key);
            if (raw == null || raw.isBlank()) {
                return defaultValue;
            }
            Color parsed = parseColor(raw);
            if (parsed == null) {
                log.warn("颜色配置 {}{}={} 无效，使用默认值", base, key, raw);
                return defaultValue;
            }
            return parsed;
        }

        float length(String key, float defaultValue) {
            String raw = props.getProperty(base + key);
            if (raw == null || raw.isBlank()) {
                return defaultValue;
            }
            try {
                float value = Float.parseFloat(raw.trim());
                if (value < 0f || Float.isNaN(value) || Float.isInfinite(value)) {
                    log.warn("尺寸配置 {}{}={} 无效，使用默认值 {}", base, key, raw, defaultValue);
                    return defaultValue;
                }
                return value;
            } catch (NumberFormatException e) {
                log.warn("尺寸配置 {}{}={} 解析失败，使用默认值 {}", base, key, raw, defaultValue);
                return defaultValue;
            }
        }

        AxisPosition position(String key, AxisPosition defaultValue) {
            String raw = props.getProperty(base + key);
            if (raw == null || raw.isBlank()) {
                return defaultValue;
            }
            try {
                return AxisPosition.valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("位置配置 {}{}={} 无效，使用默认值 {}", base, key, raw, defaultValue);
                return defaultValue;
            }
        }
    }
}
