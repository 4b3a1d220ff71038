package tools.heatmap.sample;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 演示数据：从 classpath 的 JSON 文件读取成员活动记录。
 * <pre>
 * [{"label": "Allen", "details": [{"day": 1, "count": 7000}, {"day": 3, "count": 3000}]}]
 * </pre>
 */
public class SampleDataRepository {
    private static final Logger log = LoggerFactory.getLogger(SampleDataRepository.class);
    private static final Type ENTRY_LIST = new TypeToken<List<ActivityEntry>>() {
    }.getType();

    private final Gson gson = new Gson();

    /**
     * 读取 classpath 资源；资源缺失或格式错误时记录警告并返回空列表。
     */
    public List<ActivityEntry> loadFromClasspath(String resource) {
        try (InputStream in = SampleDataRepository.class.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("未找到演示数据资源: {}", resource);
                return List.of();
            }
            List<ActivityEntry> entries = parse(new InputStreamReader(in, StandardCharsets.UTF_8));
            log.info("已读取演示数据 {}: {} 条", resource, entries.size());
            return entries;
        } catch (IOException | JsonParseException e) {
            log.warn("读取演示数据失败 {}: {}", resource, e.getMessage());
            return List.of();
        }
    }

    public List<ActivityEntry> parse(Reader reader) {
        List<ActivityEntry> parsed = gson.fromJson(reader, ENTRY_LIST);
        if (parsed == null) {
            return List.of();
        }
        List<ActivityEntry> result = new ArrayList<>(parsed.size());
        parsed.stream().filter(Objects::nonNull).forEach(result::add);
        return result;
    }
}
