package tools.heatmap.ui;

import org.junit.jupiter.api.Test;
import tools.heatmap.model.HeatmapStyle;

import java.awt.Color;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThemeManagerTest {

    private final ThemeManager manager = new ThemeManager();

    @Test
    void unknownIdFallsBackToFirstOption() {
        assertTrue(manager.findById("missing").isEmpty());
        assertEquals("flat-dark", manager.findByIdOrDefault("missing").getId());
        assertEquals("intellij", manager.findByIdOrDefault("intellij").getId());
    }

    @Test
    void lightPaletteKeepsSizesAndActiveColors() {
        HeatmapStyle base = HeatmapStyle.defaults().withCellGap(3f).withActiveColors(Color.RED, Color.ORANGE);

        HeatmapStyle light = manager.findByIdOrDefault("flat-light").applyPalette(base);

        assertEquals(ThemeManager.LIGHT_INACTIVE, light.getInactiveColorStart());
        assertEquals(ThemeManager.LIGHT_INACTIVE, light.getInactiveColorEnd());
        assertEquals(ThemeManager.LIGHT_LABEL, light.getLabelTextColor());
        assertEquals(ThemeManager.LIGHT_HEADER, light.getHeaderTextColor());
        assertEquals(3f, light.getCellGap());
        assertEquals(Color.RED, light.getActiveColorStart());
    }

    @Test
    void darkPaletteRestoresDefaults() {
        HeatmapStyle light = manager.findByIdOrDefault("flat-light").applyPalette(HeatmapStyle.defaults());

        HeatmapStyle dark = manager.findByIdOrDefault("darcula").applyPalette(light);

        assertEquals(HeatmapStyle.defaults(), dark);
    }
}
