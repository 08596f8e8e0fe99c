package com.apischema.core.version;

import java.util.Optional;

/**
 * Comparators allowed in a version clause.
 */
public enum VersionOperator {
    /** Strictly greater than the target */
    GT(">"),

    /** Strictly lower than the target */
    LT("<"),

    /** Equal to the target (also implied by a bare version) */
    EQ("=="),

    /** Greater than or equal to the target */
    GE(">="),

    /** Lower than or equal to the target */
    LE("<=");

    private final String symbol;

    VersionOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the textual form of this operator.
     *
     * @return symbol such as {@code ">="}
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Applies this operator to the result of {@code runtime.compareTo(target)}.
     *
     * @param comparison comparison result
     * @return true if the runtime version satisfies the operator
     */
    public boolean test(int comparison) {
        return switch (this) {
            case GT -> comparison > 0;
            case LT -> comparison < 0;
            case EQ -> comparison == 0;
            case GE -> comparison >= 0;
            case LE -> comparison <= 0;
        };
    }

    /**
     * Finds the operator with exactly the given symbol.
     *
     * @param symbol candidate symbol
     * @return matching operator, or empty
     */
    public static Optional<VersionOperator> fromSymbol(String symbol) {
        for (VersionOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
