package com.csd.pkginspect.model;

import com.csd.pkginspect.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum ComparisonOperator {
    EQ("==", "eq"),
    NE("!=", "ne"),
    LT("<", "lt"),
    LE("<=", "le"),
    GT(">", "gt"),
    GE(">=", "ge");

    private final String symbol;
    private final String alias;

    ComparisonOperator(String symbol, String alias) {
        this.symbol = symbol;
        this.alias = alias;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Applies this operator to the sign of a {@code compareTo} result.
     */
    public boolean test(int comparison) {
        switch (this) {
            case EQ: return comparison == 0;
            case NE: return comparison != 0;
            case LT: return comparison < 0;
            case LE: return comparison <= 0;
            case GT: return comparison > 0;
            case GE: return comparison >= 0;
            default: throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    /**
     * Accepts a symbol ({@code >=}) or a short name ({@code ge}), case-insensitive for names.
     */
    public static ComparisonOperator parse(String op) {
        if (op == null || op.isBlank()) {
            throw new InvalidArgumentException("A comparison operator must be specified.");
        }
        String trimmed = op.trim();
        for (ComparisonOperator candidate : values()) {
            if (candidate.symbol.equals(trimmed) || candidate.alias.equalsIgnoreCase(trimmed)) {
                return candidate;
            }
        }
        String valid = Arrays.stream(values())
                .map(o -> o.symbol + "/" + o.alias)
                .collect(Collectors.joining(", "));
        throw new InvalidArgumentException("The specified operator method '" + op
                + "' is not a valid comparison operator. Valid options: " + valid);
    }
}
