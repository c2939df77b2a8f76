package org.exprengine.core;

import org.apache.commons.lang3.tuple.Pair;
import org.exprengine.exceptions.NoSpatialOperatorForDomainException;
import org.exprengine.expressions.MatrixConstant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * (空间算子, 定义域) 到离散算子矩阵的映射，由外部网格驱动根据网格生成。
 * 矩阵与参数取值无关，只取决于定义域。
 * 此类是不可变的。
 */
public final class SpatialOperatorTable {

    private static final Logger logger = LoggerFactory.getLogger(SpatialOperatorTable.class);

    private final Map<Pair<SpatialOperator, SortedSet<String>>, MatrixConstant> matrices;

    private SpatialOperatorTable(Map<Pair<SpatialOperator, SortedSet<String>>, MatrixConstant> matrices) {
        this.matrices = Collections.unmodifiableMap(new HashMap<>(matrices));
        logger.debug("创建 SpatialOperatorTable，共 {} 个矩阵", this.matrices.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws NoSpatialOperatorForDomainException 如果表中没有对应的矩阵。
     */
    public MatrixConstant lookup(SpatialOperator operator, Set<String> domain) {
        MatrixConstant matrix = matrices.get(key(operator, domain));
        if (matrix == null) {
            logger.error("没有定义域 {} 上的 {} 矩阵", domain, operator);
            throw new NoSpatialOperatorForDomainException(operator, domain);
        }
        return matrix;
    }

    public boolean contains(SpatialOperator operator, Set<String> domain) {
        return matrices.containsKey(key(operator, domain));
    }

    public int size() {
        return matrices.size();
    }

    private static Pair<SpatialOperator, SortedSet<String>> key(SpatialOperator operator, Collection<String> domain) {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(domain, "domain");
        return Pair.of(operator, Collections.unmodifiableSortedSet(new TreeSet<>(domain)));
    }

    public static final class Builder {
        private final Map<Pair<SpatialOperator, SortedSet<String>>, MatrixConstant> matrices = new HashMap<>();

        public Builder register(SpatialOperator operator, Collection<String> domain, double[][] matrix) {
            return register(operator, domain, MatrixConstant.of(matrix));
        }

        public Builder register(SpatialOperator operator, Collection<String> domain, MatrixConstant matrix) {
            Objects.requireNonNull(matrix, "matrix");
            MatrixConstant previous = matrices.put(key(operator, domain), matrix);
            if (previous != null) {
                logger.warn("定义域 {} 上的 {} 矩阵被覆盖", domain, operator);
            }
            return this;
        }

        public SpatialOperatorTable build() {
            return new SpatialOperatorTable(matrices);
        }
    }
}
