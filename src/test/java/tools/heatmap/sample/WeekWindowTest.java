package tools.heatmap.sample;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WeekWindowTest {

    @Test
    void weekStartsOnMonday() {
        // 2024-05-16 是周四
        WeekWindow window = WeekWindow.of(LocalDate.of(2024, 5, 16), 0);

        assertEquals(LocalDate.of(2024, 5, 13), window.getStart());
        assertEquals(LocalDate.of(2024, 5, 19), window.getEnd());
    }

    @Test
    void offsetMovesWholeWeeks() {
        LocalDate monday = LocalDate.of(2024, 5, 13);

        assertEquals(LocalDate.of(2024, 5, 6), WeekWindow.of(monday, -1).getStart());
        assertEquals(LocalDate.of(2024, 5, 20), WeekWindow.of(monday, 1).getStart());
    }

    @Test
    void formatsBothEnds() {
        WeekWindow window = WeekWindow.of(LocalDate.of(2024, 12, 31), 0);

        assertEquals("Dec 30 - Jan 05", window.format(WeekWindow.SHORT_FORMAT));
        assertEquals("30.12.2024. - 05.01.2025.", window.format(WeekWindow.DOTTED_FORMAT));
    }
}
