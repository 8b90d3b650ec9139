package com.sandy.agentops.alerting.entity;

import com.sandy.agentops.alerting.service.RuleValidationException;

/**
 * Threshold comparison applied as {@code value <op> threshold}.
 */
public enum ComparisonOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN -> value < threshold;
            case GREATER_OR_EQUAL -> value >= threshold;
            case LESS_OR_EQUAL -> value <= threshold;
            case EQUAL -> value == threshold;
            case NOT_EQUAL -> value != threshold;
        };
    }

    /**
     * Resolves an operator from its symbol ({@code ">"}, {@code "<="} ...).
     *
     * @throws RuleValidationException if the symbol is not one of the six supported operators
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol != null) {
            String s = symbol.trim();
            for (ComparisonOperator op : values()) {
                if (op.symbol.equals(s)) return op;
            }
        }
        throw new RuleValidationException("Unsupported comparison operator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
