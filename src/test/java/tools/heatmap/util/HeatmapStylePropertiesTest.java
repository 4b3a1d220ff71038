package tools.heatmap.util;

import org.junit.jupiter.api.Test;
import tools.heatmap.model.AxisPosition;
import tools.heatmap.model.HeatmapStyle;

import java.awt.Color;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class HeatmapStylePropertiesTest {

    @Test
    void readsPrefixedValues() {
        Properties props = new Properties();
        props.setProperty("heatmap.weekly.activeColorStart", "#1F6FEB");
        props.setProperty("heatmap.weekly.activeColorEnd", "#58A6FF");
        props.setProperty("heatmap.weekly.cellGap", "6");
        props.setProperty("heatmap.weekly.headerPosition", "leading");
        props.setProperty("heatmap.other.cellGap", "1");

        HeatmapStyle style = HeatmapStyleProperties.read(props, "heatmap.weekly", HeatmapStyle.defaults());

        assertEquals(new Color(0x1F6FEB), style.getActiveColorStart());
        assertEquals(new Color(0x58A6FF), style.getActiveColorEnd());
        assertEquals(6f, style.getCellGap());
        assertEquals(AxisPosition.LEADING, style.getHeaderPosition());
        assertEquals(14f, style.getLabelTextSize());
    }

    @Test
    void endColorFollowsStartWhenOnlyStartConfigured() {
        Properties props = new Properties();
        props.setProperty("p.inactiveColorStart", "#EBEDF0");

        HeatmapStyle style = HeatmapStyleProperties.read(props, "p", HeatmapStyle.defaults());

        assertEquals(new Color(0xEBEDF0), style.getInactiveColorStart());
        assertEquals(new Color(0xEBEDF0), style.getInactiveColorEnd());
        assertEquals(HeatmapStyle.DEFAULT_ACTIVE_END, style.getActiveColorEnd());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty("p.activeColorStart", "green");
        props.setProperty("p.cellGap", "-4");
        props.setProperty("p.labelTextSize", "big");
        props.setProperty("p.labelPosition", "LEFT");

        HeatmapStyle style = HeatmapStyleProperties.read(props, "p", HeatmapStyle.defaults());

        assertEquals(HeatmapStyle.defaults(), style);
    }

    @Test
    void parseColorSupportsAlpha() {
        assertEquals(new Color(0x11, 0x22, 0x33, 0x80), HeatmapStyleProperties.parseColor("#80112233"));
        assertEquals(new Color(0x80112233, true).getRGB(), HeatmapStyleProperties.parseColor("#80112233").getRGB());
        assertEquals(0x80, HeatmapStyleProperties.parseColor("#80112233").getAlpha());
        assertEquals(new Color(0x112233), HeatmapStyleProperties.parseColor(" 112233 "));
        assertNull(HeatmapStyleProperties.parseColor("#12345"));
        assertNull(HeatmapStyleProperties.parseColor("#GGGGGG"));
    }
}
