package org.exprengine.passes;

import org.exprengine.config.EngineSettings;
import org.exprengine.core.SliceTable;
import org.exprengine.core.SpatialOperator;
import org.exprengine.core.SpatialOperatorTable;
import org.exprengine.exceptions.NoSpatialOperatorForDomainException;
import org.exprengine.exceptions.UnmappedVariableException;
import org.exprengine.exceptions.UnresolvedSymbolException;
import org.exprengine.expressions.BinaryKind;
import org.exprengine.expressions.BinaryOp;
import org.exprengine.expressions.MatrixConstant;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.Nodes;
import org.exprengine.expressions.Parameter;
import org.exprengine.expressions.UnaryKind;
import org.exprengine.expressions.UnaryOp;
import org.exprengine.expressions.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 离散化：把 Variable 替换为状态向量切片，把空间算子替换为与离散算子矩阵的乘积。
 * <p>
 * 必须在参数代入之后执行。算子矩阵按算子种类和<b>离散化之前</b>子树的定义域查找。
 * 重建树时会重新校验形状，此前为 DEFERRED 的长度在这里第一次被检查。
 */
public final class Discretizer extends TreePass {

    private static final Logger logger = LoggerFactory.getLogger(Discretizer.class);

    private static final String STAGE = "离散化";

    public Discretizer() {
        this(EngineSettings.defaults());
    }

    public Discretizer(EngineSettings settings) {
        super(settings);
    }

    /**
     * @throws UnresolvedSymbolException           如果树中仍有 Parameter。
     * @throws UnmappedVariableException           如果某个变量没有切片。
     * @throws NoSpatialOperatorForDomainException 如果某个空间算子在其定义域上没有矩阵。
     */
    public Node discretize(Node tree, SliceTable slices, SpatialOperatorTable operators) {
        checkDepth(tree);
        Objects.requireNonNull(slices, "SliceTable 不能为 null");
        Objects.requireNonNull(operators, "SpatialOperatorTable 不能为 null");

        List<Node> parameters = Nodes.collect(tree, node -> node instanceof Parameter);
        if (!parameters.isEmpty()) {
            logger.error("离散化之前必须先完成参数代入，仍有参数: {}", parameters);
            throw new UnresolvedSymbolException(((Parameter) parameters.get(0)).getName(), STAGE);
        }

        Node result = tree.accept(new DiscretizationVisitor(slices, operators));
        logger.debug("离散化完成: {} -> {}", tree, result);
        return result;
    }

    private static final class DiscretizationVisitor extends TreeRewriter {

        private final SliceTable slices;
        private final SpatialOperatorTable operators;

        private DiscretizationVisitor(SliceTable slices, SpatialOperatorTable operators) {
            this.slices = slices;
            this.operators = operators;
        }

        @Override
        public Node visitVariable(Variable node) {
            return slices.lookup(node);
        }

        @Override
        public Node visitUnaryOp(UnaryOp node) {
            if (!node.getKind().isSpatial()) {
                return super.visitUnaryOp(node);
            }
            Node child = node.getChild();

            // div(grad(u))：若该定义域有融合的拉普拉斯矩阵，则一次替换两层
            if (node.getKind() == UnaryKind.DIVERGENCE
                    && child instanceof UnaryOp inner
                    && inner.getKind() == UnaryKind.GRADIENT
                    && operators.contains(SpatialOperator.LAPLACIAN, inner.getChild().getDomain())) {
                MatrixConstant laplacian = operators.lookup(SpatialOperator.LAPLACIAN, inner.getChild().getDomain());
                logger.debug("使用定义域 {} 上的拉普拉斯矩阵替换 {}", inner.getChild().getDomain(), node);
                return BinaryOp.of(BinaryKind.MATMUL, laplacian, rewrite(inner.getChild()));
            }

            MatrixConstant matrix = operators.lookup(node.getKind().toSpatialOperator(), child.getDomain());
            return BinaryOp.of(BinaryKind.MATMUL, matrix, rewrite(child));
        }
    }
}
