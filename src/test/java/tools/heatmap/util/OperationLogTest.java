package tools.heatmap.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.swing.SwingUtilities;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OperationLogTest {

    @AfterEach
    void reset() {
        OperationLog.setAppender(null);
    }

    @Test
    void linesAreAppendedOnEdtWithTimestamp() throws Exception {
        List<String> lines = new ArrayList<>();
        List<Boolean> onEdt = new ArrayList<>();
        OperationLog.setAppender(line -> {
            lines.add(line);
            onEdt.add(SwingUtilities.isEventDispatchThread());
        });

        OperationLog.log("切换主题");
        OperationLog.log(null);
        SwingUtilities.invokeAndWait(() -> {
        });

        assertEquals(1, lines.size());
        assertTrue(lines.get(0).matches("\\[\\d{2}:\\d{2}:\\d{2}] 切换主题"));
        assertEquals(List.of(true), onEdt);
    }
}
