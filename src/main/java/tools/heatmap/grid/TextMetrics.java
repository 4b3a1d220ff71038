package tools.heatmap.grid;

/**
 * 文字度量服务：给定字号返回字符串宽度与行高相关的度量值。
 * 布局与绘制共用同一实现，保证测量结果与实际绘制一致。
 */
public interface TextMetrics {

    float width(String text, float size);

    /** 基线以上的高度。 */
    float ascent(float size);

    /** 基线以下的高度。 */
    float descent(float size);

    default float textHeight(float size) {
        return Math.abs(ascent(size)) + Math.abs(descent(size));
    }
}
