package tools.heatmap.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.SwingUtilities;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Consumer;

/**
 * 界面上的操作日志：通过 {@link #setAppender(Consumer)} 注入日志面板的追加方法，
 * 任意线程调用 {@link #log(String)}，最终都在 EDT 上追加；同时写一份到 slf4j。
 */
public final class OperationLog {
    private static final Logger log = LoggerFactory.getLogger(OperationLog.class);
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static volatile Consumer<String> appender = null;

    private OperationLog() {
    }

    public static void setAppender(Consumer<String> appender) {
        OperationLog.appender = appender;
    }

    public static void log(String message) {
        if (message == null) {
            return;
        }
        log.info(message);
        Consumer<String> target = appender;
        if (target == null) {
            return;
        }
        String line = "[" + LocalTime.now().format(FORMATTER) + "] " + message;
        if (SwingUtilities.isEventDispatchThread()) {
            target.accept(line);
        } else {
            SwingUtilities.invokeLater(() -> target.accept(line));
        }
    }
}
