package org.exprengine.passes;

import org.exprengine.config.EngineSettings;
import org.exprengine.core.ParameterTable;
import org.exprengine.exceptions.UnknownParameterException;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.Parameter;
import org.exprengine.expressions.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 参数代入：把每个 Parameter(name) 替换为 Scalar(table[name])，得到不含参数的新树。
 * 不触碰 Variable 和 StateVectorSlice。
 */
public final class ParameterSubstitution extends TreePass {

    private static final Logger logger = LoggerFactory.getLogger(ParameterSubstitution.class);

    public ParameterSubstitution() {
        this(EngineSettings.defaults());
    }

    public ParameterSubstitution(EngineSettings settings) {
        super(settings);
    }

    /**
     * @throws UnknownParameterException 如果某个参数不在表中。
     */
    public Node substitute(Node tree, ParameterTable table) {
        checkDepth(tree);
        Objects.requireNonNull(table, "ParameterTable 不能为 null");
        Node result = tree.accept(new TreeRewriter() {
            @Override
            public Node visitParameter(Parameter node) {
                return Scalar.of(table.getValue(node.getName()));
            }
        });
        logger.debug("参数代入 {}: {} -> {}", table, tree, result);
        return result;
    }
}
