package org.exprengine.passes;

import lombok.Getter;
import org.exprengine.config.EngineSettings;
import org.exprengine.core.ParameterTable;
import org.exprengine.core.SliceTable;
import org.exprengine.core.SpatialOperatorTable;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.Nodes;
import org.exprengine.utils.NumericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 把一个模型从符号形式降阶为求解器可以反复求值的形式：参数代入 → 离散化 → 化简。
 * 同时提供对降阶结果求雅可比（求导 + 化简）和求值的入口。
 * <p>
 * 所有表和设置都由构造参数显式传入；多个模型可以用各自的流水线并发降阶。
 */
@Getter
public final class LoweringPipeline {

    private static final Logger logger = LoggerFactory.getLogger(LoweringPipeline.class);

    private final ParameterTable parameters;
    private final SliceTable slices;
    private final SpatialOperatorTable operators;
    private final EngineSettings settings;

    private final ParameterSubstitution substitution;
    private final Discretizer discretizer;
    private final Simplifier simplifier;
    private final Differentiator differentiator;
    private final Evaluator evaluator;

    public LoweringPipeline(ParameterTable parameters, SliceTable slices, SpatialOperatorTable operators) {
        this(parameters, slices, operators, EngineSettings.defaults());
    }

    public LoweringPipeline(ParameterTable parameters, SliceTable slices, SpatialOperatorTable operators,
                            EngineSettings settings) {
        this.parameters = Objects.requireNonNull(parameters, "ParameterTable 不能为 null");
        this.slices = Objects.requireNonNull(slices, "SliceTable 不能为 null");
        this.operators = Objects.requireNonNull(operators, "SpatialOperatorTable 不能为 null");
        this.settings = Objects.requireNonNull(settings, "EngineSettings 不能为 null");
        this.substitution = new ParameterSubstitution(settings);
        this.discretizer = new Discretizer(settings);
        this.simplifier = new Simplifier(settings);
        this.differentiator = new Differentiator(settings);
        this.evaluator = new Evaluator(settings);
    }

    /**
     * 参数代入、离散化、化简。
     * @return 不含 Parameter、Variable 和空间算子的树。
     */
    public Node lower(Node model) {
        logger.info("开始降阶，树深度 {}", model.getDepth());
        Node substituted = substitution.substitute(model, parameters);
        logger.debug("参数代入后: {}", substituted);
        Node discretized = discretizer.discretize(substituted, slices, operators);
        logger.debug("离散化后: {}", discretized);
        Node simplified = simplifier.simplify(discretized);
        logger.info("降阶完成，结果形状 {}，树深度 {}", simplified.getShape(), simplified.getDepth());
        return simplified;
    }

    /**
     * 对已降阶的树求导并化简，结果同样可以直接求值。
     */
    public Node jacobian(Node lowered, Node withRespectTo) {
        if (!Nodes.isFullyLowered(lowered)) {
            logger.warn("对尚未完全降阶的树求导: {}", lowered);
        }
        return simplifier.simplify(differentiator.differentiate(lowered, withRespectTo));
    }

    public NumericValue evaluate(Node lowered, double t, double[] y) {
        return evaluator.evaluate(lowered, t, y);
    }
}
