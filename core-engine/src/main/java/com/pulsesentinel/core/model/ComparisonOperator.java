package com.pulsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Comparison applied between a metric value and a rule threshold.
 *
 * <p>
 * {@link #EQ} is exact {@code double} equality. Values produced by
 * arithmetic (averages, percentages) rarely compare equal to a literal
 * threshold, so {@code eq} is only dependable for integral metrics such as
 * {@code active_users} or {@code db_connections}. {@code NaN} never matches
 * any operator.
 * </p>
 *
 * @since 1.0.0
 */
public enum ComparisonOperator {

    GT(">") {
        @Override
        public boolean test(double value, double threshold) {
            return value > threshold;
        }
    },
    GTE(">=") {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LT("<") {
        @Override
        public boolean test(double value, double threshold) {
            return value < threshold;
        }
    },
    LTE("<=") {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    },
    EQ("==") {
        @Override
        public boolean test(double value, double threshold) {
            return value == threshold;
        }
    };

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Apply the comparison.
     *
     * @param value     observed metric value
     * @param threshold rule threshold
     * @return {@code true} if the rule condition holds
     */
    public abstract boolean test(double value, double threshold);

    public String getSymbol() {
        return symbol;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire identifier ({@code gt}, {@code gte}, {@code lt},
     * {@code lte}, {@code eq}).
     *
     * @param value identifier, case-insensitive
     * @return the operator
     * @throws IllegalArgumentException if {@code value} is unknown or {@code null}
     */
    @JsonCreator
    public static ComparisonOperator fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Operator must not be null");
        }
        for (ComparisonOperator op : values()) {
            if (op.id().equalsIgnoreCase(value.trim())) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: '" + value
                + "'. Supported: gt, gte, lt, lte, eq");
    }
}
