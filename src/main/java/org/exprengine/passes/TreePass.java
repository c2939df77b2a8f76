package org.exprengine.passes;

import lombok.Getter;
import org.exprengine.config.EngineSettings;
import org.exprengine.exceptions.TreeDepthExceededException;
import org.exprengine.expressions.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 所有树遍历的公共部分：持有设置，并在递归之前检查树深度。
 * 遍历本身是纯函数，实例不保存任何可变状态，可以被多个线程共享。
 */
@Getter
public abstract class TreePass {

    private static final Logger logger = LoggerFactory.getLogger(TreePass.class);

    private final EngineSettings settings;

    protected TreePass(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings 不能为 null");
    }

    /**
     * @throws TreeDepthExceededException 如果树比配置的上限更深。
     */
    protected void checkDepth(Node tree) {
        Objects.requireNonNull(tree, "tree 不能为 null");
        if (tree.getDepth() > settings.getMaxTreeDepth()) {
            logger.error("{}: 树深度 {} 超过上限 {}", getClass().getSimpleName(), tree.getDepth(), settings.getMaxTreeDepth());
            throw new TreeDepthExceededException(tree.getDepth(), settings.getMaxTreeDepth());
        }
    }
}
