package org.exprengine.config;

import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 引擎的运行参数。每个遍历显式接收一份设置，不存在进程级的全局状态。
 * <p>
 * 环境变量：EXPRENGINE_MAX_TREE_DEPTH、EXPRENGINE_MAX_SIMPLIFY_ITERATIONS、EXPRENGINE_MEMOIZE_EVALUATION。
 * 未设置、空白或无法解析时使用默认值。
 */
@Getter
@Builder(toBuilder = true)
public final class EngineSettings {

    private static final Logger logger = LoggerFactory.getLogger(EngineSettings.class);

    static final String ENV_MAX_TREE_DEPTH = "EXPRENGINE_MAX_TREE_DEPTH";
    static final String ENV_MAX_SIMPLIFY_ITERATIONS = "EXPRENGINE_MAX_SIMPLIFY_ITERATIONS";
    static final String ENV_MEMOIZE_EVALUATION = "EXPRENGINE_MEMOIZE_EVALUATION";

    /** 各遍历按树深度递归，每层约占三个栈帧；这个深度在默认 1 MB 线程栈上可以安全完成 */
    public static final int DEFAULT_MAX_TREE_DEPTH = 1_000;
    public static final int DEFAULT_MAX_SIMPLIFY_ITERATIONS = 64;

    /** 各遍历在递归前检查的树深度上限 */
    @Builder.Default
    private final int maxTreeDepth = DEFAULT_MAX_TREE_DEPTH;

    /** 化简器求不动点的最大轮数 */
    @Builder.Default
    private final int maxSimplifyIterations = DEFAULT_MAX_SIMPLIFY_ITERATIONS;

    /** 求值时是否按结构身份缓存子树结果 */
    @Builder.Default
    private final boolean memoizeEvaluation = false;

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static EngineSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static EngineSettings fromEnvironment(Map<String, String> env) {
        EngineSettings settings = builder()
                .maxTreeDepth(parsePositiveInt(env.get(ENV_MAX_TREE_DEPTH), DEFAULT_MAX_TREE_DEPTH))
                .maxSimplifyIterations(parsePositiveInt(env.get(ENV_MAX_SIMPLIFY_ITERATIONS), DEFAULT_MAX_SIMPLIFY_ITERATIONS))
                .memoizeEvaluation(parseBoolean(env.get(ENV_MEMOIZE_EVALUATION), false))
                .build();
        logger.info("从环境变量加载 EngineSettings: {}", settings);
        return settings;
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                logger.warn("配置值 {} 不是正整数，使用默认值 {}", value, defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("无法解析配置值 {}，使用默认值 {}", value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "EngineSettings(maxTreeDepth=" + maxTreeDepth
                + ", maxSimplifyIterations=" + maxSimplifyIterations
                + ", memoizeEvaluation=" + memoizeEvaluation + ")";
    }
}
