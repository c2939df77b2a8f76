package org.exprengine.core;

import lombok.Getter;
import org.exprengine.exceptions.UnmappedVariableException;
import org.exprengine.expressions.StateVectorSlice;
import org.exprengine.expressions.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 变量（按名称和定义域识别）到状态向量切片的映射，由外部网格驱动提供。
 * 此类是不可变的。
 */
public final class SliceTable {

    private static final Logger logger = LoggerFactory.getLogger(SliceTable.class);

    private final Map<Variable, StateVectorSlice> slices;

    /** 所有切片覆盖到的状态向量长度，即最大的 end */
    @Getter
    private final int stateSize;

    private SliceTable(Map<Variable, StateVectorSlice> slices) {
        this.slices = Collections.unmodifiableMap(new LinkedHashMap<>(slices));
        this.stateSize = slices.values().stream().mapToInt(StateVectorSlice::getEnd).max().orElse(0);
        logger.debug("创建 SliceTable: {}，状态向量长度 {}", this.slices, stateSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws UnmappedVariableException 如果变量没有对应的切片。
     */
    public StateVectorSlice lookup(Variable variable) {
        StateVectorSlice slice = slices.get(variable);
        if (slice == null) {
            logger.error("变量 {} 在切片表中没有对应的切片，已知变量: {}", variable, slices.keySet());
            throw new UnmappedVariableException(variable.toString());
        }
        return slice;
    }

    public boolean contains(Variable variable) {
        return slices.containsKey(variable);
    }

    public Map<Variable, StateVectorSlice> getSlices() {
        return slices;
    }

    @Override
    public String toString() {
        return slices.toString();
    }

    public static final class Builder {
        private final Map<Variable, StateVectorSlice> slices = new LinkedHashMap<>();
        private int next = 0;

        /**
         * 为变量指定明确的切片。
         */
        public Builder put(Variable variable, int start, int end) {
            Objects.requireNonNull(variable, "variable");
            StateVectorSlice slice = StateVectorSlice.of(start, end);
            slices.put(variable, slice);
            next = Math.max(next, end);
            return this;
        }

        /**
         * 把变量放在当前已分配区域之后，占用 size 个点。
         */
        public Builder append(Variable variable, int size) {
            return put(variable, next, next + size);
        }

        public SliceTable build() {
            return new SliceTable(slices);
        }
    }
}
