package org.exprengine.core;

import org.exprengine.exceptions.UnknownParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 参数名到数值的映射，由外部参数源提供，交给参数代入遍历使用。
 * 此类是不可变的。
 */
public final class ParameterTable {

    private static final Logger logger = LoggerFactory.getLogger(ParameterTable.class);

    private static final ParameterTable EMPTY = new ParameterTable(Collections.emptyMap());

    private final SortedMap<String, Double> values;

    private ParameterTable(Map<String, Double> values) {
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "ParameterTable: 参数名不能为 null");
            Objects.requireNonNull(entry.getValue(), "ParameterTable: 参数 '" + entry.getKey() + "' 的值不能为 null");
            if (!Double.isFinite(entry.getValue())) {
                logger.warn("参数 '{}' 的值 {} 不是有限数，求值结果会按 IEEE 语义传播", entry.getKey(), entry.getValue());
            }
        }
        this.values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
        logger.debug("创建 ParameterTable: {}", this);
    }

    public static ParameterTable of(Map<String, Double> values) {
        Objects.requireNonNull(values, "ParameterTable: values 不能为 null");
        return new ParameterTable(values);
    }

    public static ParameterTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 获取参数的数值。
     * @throws UnknownParameterException 如果表中没有此参数。
     */
    public double getValue(String name) {
        Double value = values.get(name);
        if (value == null) {
            logger.error("参数 '{}' 不存在于参数表 {} 中", name, this);
            throw new UnknownParameterException(name);
        }
        return value;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public SortedMap<String, Double> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((ParameterTable) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    public static final class Builder {
        private final Map<String, Double> values = new HashMap<>();

        public Builder put(String name, double value) {
            values.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder putAll(Map<String, Double> more) {
            values.putAll(Objects.requireNonNull(more, "more"));
            return this;
        }

        public ParameterTable build() {
            return new ParameterTable(values);
        }
    }
}
