package org.exprengine.passes;

import org.exprengine.config.EngineSettings;
import org.exprengine.exceptions.IndexOutOfRangeException;
import org.exprengine.exceptions.UnresolvedSymbolException;
import org.exprengine.expressions.BinaryOp;
import org.exprengine.expressions.Concatenation;
import org.exprengine.expressions.MatrixConstant;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.NodeVisitor;
import org.exprengine.expressions.Parameter;
import org.exprengine.expressions.Scalar;
import org.exprengine.expressions.StateVectorSlice;
import org.exprengine.expressions.Time;
import org.exprengine.expressions.UnaryOp;
import org.exprengine.expressions.Variable;
import org.exprengine.expressions.VectorConstant;
import org.exprengine.utils.NumericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 给定时间 t 和状态向量 y，计算一棵已降阶的树的数值。
 * <p>
 * 子节点总是先于父节点、从左到右求值，因此相同的 (树, t, y) 总是得到逐位相同的结果。
 * 除以零等奇异情况不报错，按 IEEE 语义得到无穷或 NaN。
 */
public final class Evaluator extends TreePass {

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    private static final String STAGE = "求值";

    public Evaluator() {
        this(EngineSettings.defaults());
    }

    public Evaluator(EngineSettings settings) {
        super(settings);
    }

    /**
     * @param tree 已完成参数代入和离散化的树。
     * @param t    时间。
     * @param y    状态向量；树中没有切片时可以为 null。调用方保证求值期间不修改它。
     * @return 求值结果。
     * @throws UnresolvedSymbolException 如果遇到 Parameter、Variable 或空间算子。
     * @throws IndexOutOfRangeException  如果 y 缺失或长度不足。
     */
    public NumericValue evaluate(Node tree, double t, double[] y) {
        checkDepth(tree);
        Map<Node, NumericValue> knownEvals = getSettings().isMemoizeEvaluation() ? new HashMap<>() : null;
        return tree.accept(new EvaluationVisitor(t, y, knownEvals));
    }

    /**
     * 带缓存的求值：结构相同的子树只计算一次，结果写入调用方提供的 knownEvals。
     * 同一个 knownEvals 只能用于同一组 (t, y)。
     */
    public NumericValue evaluate(Node tree, double t, double[] y, Map<Node, NumericValue> knownEvals) {
        checkDepth(tree);
        return tree.accept(new EvaluationVisitor(t, y, knownEvals));
    }

    private static final class EvaluationVisitor implements NodeVisitor<NumericValue> {

        private final double t;
        private final double[] y;
        private final Map<Node, NumericValue> knownEvals;

        private EvaluationVisitor(double t, double[] y, Map<Node, NumericValue> knownEvals) {
            this.t = t;
            this.y = y;
            this.knownEvals = knownEvals;
        }

        private NumericValue eval(Node node) {
            if (knownEvals == null || node.isLeaf()) {
                return node.accept(this);
            }
            NumericValue known = knownEvals.get(node);
            if (known != null) {
                return known;
            }
            NumericValue value = node.accept(this);
            knownEvals.put(node, value);
            return value;
        }

        @Override
        public NumericValue visitScalar(Scalar node) {
            return NumericValue.scalar(node.getValue());
        }

        @Override
        public NumericValue visitVectorConstant(VectorConstant node) {
            return node.toNumericValue();
        }

        @Override
        public NumericValue visitMatrixConstant(MatrixConstant node) {
            return node.toNumericValue();
        }

        @Override
        public NumericValue visitParameter(Parameter node) {
            logger.error("求值时遇到未代入的参数 {}", node.getName());
            throw new UnresolvedSymbolException(node.getName(), STAGE);
        }

        @Override
        public NumericValue visitVariable(Variable node) {
            logger.error("求值时遇到未离散化的变量 {}", node);
            throw new UnresolvedSymbolException(node.toString(), STAGE);
        }

        @Override
        public NumericValue visitStateVectorSlice(StateVectorSlice node) {
            if (y == null || node.getEnd() > y.length) {
                int actual = y == null ? 0 : y.length;
                logger.error("状态向量长度 {} 不足以读取 {}", actual, node);
                throw new IndexOutOfRangeException(node.getEnd(), actual);
            }
            return NumericValue.vector(Arrays.copyOfRange(y, node.getStart(), node.getEnd()));
        }

        @Override
        public NumericValue visitTime(Time node) {
            return NumericValue.scalar(t);
        }

        @Override
        public NumericValue visitUnaryOp(UnaryOp node) {
            if (node.getKind().isSpatial()) {
                logger.error("求值时遇到未离散化的空间算子 {}", node);
                throw new UnresolvedSymbolException(node.getKind().getSymbol(), STAGE);
            }
            return node.getKind().apply(eval(node.getChild()));
        }

        @Override
        public NumericValue visitBinaryOp(BinaryOp node) {
            NumericValue left = eval(node.getLeft());
            NumericValue right = eval(node.getRight());
            return node.getKind().apply(left, right);
        }

        @Override
        public NumericValue visitConcatenation(Concatenation node) {
            List<NumericValue> parts = new ArrayList<>(node.getChildren().size());
            for (Node child : node.getChildren()) {
                parts.add(eval(child));
            }
            return NumericValue.concatenate(parts);
        }
    }
}
