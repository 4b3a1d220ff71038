package tools.heatmap.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.heatmap.model.HeatmapStyle;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * 读取热力图配置（heatmap.properties）：先读 classpath 默认值，再用工作目录下的同名文件覆盖。
 */
public class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);
    private static final String FILE_NAME = "heatmap.properties";
    private static final String DEFAULT_THEME_ID = "flat-dark";
    private static final Properties PROPS = new Properties();

    static {
        loadFromClasspath();
        loadFromWorkingDir();
    }

    private Config() {
    }

    private static void loadFromClasspath() {
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                PROPS.load(in);
                log.info("已从 classpath 读取 {}", FILE_NAME);
            }
        } catch (Exception e) {
            log.warn("读取 classpath 配置失败: {}", e.getMessage());
        }
    }

    private static void loadFromWorkingDir() {
        Path path = Path.of(FILE_NAME);
        if (!Files.exists(path)) {
            return;
        }
        try (InputStream in = Files.newInputStream(path)) {
            Properties override = new Properties();
            override.load(in);
            PROPS.putAll(override);
            log.info("已加载工作目录下的 {}，覆盖默认配置", FILE_NAME);
        } catch (Exception e) {
            log.warn("读取工作目录配置失败: {}", e.getMessage());
        }
    }

    /**
     * 读取以 prefix 开头的一组样式属性，未配置的项使用 {@link HeatmapStyle#defaults()}。
     */
    public static HeatmapStyle heatmapStyle(String prefix) {
        return HeatmapStyleProperties.read(PROPS, prefix, HeatmapStyle.defaults());
    }

    public static String getThemeId() {
        String raw = PROPS.getProperty("ui.theme");
        if (raw == null || raw.isBlank()) {
            return DEFAULT_THEME_ID;
        }
        return raw.trim();
    }

    public static String getSampleResource() {
        String raw = PROPS.getProperty("demo.sample.resource");
        if (raw == null || raw.isBlank()) {
            return "/sample-activities.json";
        }
        return raw.trim();
    }

    public static int getRandomSeed() {
        String raw = PROPS.getProperty("demo.random.seed");
        if (raw == null || raw.isBlank()) {
            return 20240101;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("配置项 demo.random.seed 解析失败，使用默认值: {}", raw);
            return 20240101;
        }
    }
}
