package com.apischema.core.version;

import java.util.Objects;
import java.util.Optional;

/**
 * A single comparator expression such as {@code ">=1.4"}.
 *
 * <p>Accepted forms:
 * <ol>
 *   <li>{@code VERSION} (same as {@code ==VERSION})</li>
 *   <li>{@code ==VERSION}, {@code >=VERSION}, {@code <=VERSION}</li>
 *   <li>{@code >VERSION}, {@code <VERSION}</li>
 * </ol>
 * Two-character comparators are tried before one-character ones.
 *
 * @param operator comparator
 * @param target version the runtime version is compared with
 */
public record VersionClause(VersionOperator operator, SemanticVersion target) {

    /**
     * Compact constructor with validation.
     */
    public VersionClause {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    /**
     * Parses one clause.
     *
     * @param clause clause text, surrounding whitespace ignored
     * @return parsed clause
     * @throws VersionParseException if the version part is malformed
     */
    public static VersionClause parse(String clause) {
        if (clause == null || clause.isBlank()) {
            throw new VersionParseException(clause, "Version clause must not be empty");
        }
        String text = clause.trim();

        if (text.length() >= 2) {
            Optional<VersionOperator> twoChar = VersionOperator.fromSymbol(text.substring(0, 2));
            if (twoChar.isPresent()) {
                return new VersionClause(twoChar.get(), SemanticVersion.parse(text.substring(2).trim()));
            }
        }

        Optional<VersionOperator> oneChar = VersionOperator.fromSymbol(text.substring(0, 1));
        if (oneChar.isPresent()) {
            return new VersionClause(oneChar.get(), SemanticVersion.parse(text.substring(1).trim()));
        }

        return new VersionClause(VersionOperator.EQ, SemanticVersion.parse(text));
    }

    /**
     * Parses {@code clause} and evaluates it against {@code runtimeVersion}.
     *
     * @param clause clause text
     * @param runtimeVersion version requested at runtime
     * @return true if the runtime version satisfies the clause
     * @throws VersionParseException if either version is malformed
     */
    public static boolean evaluate(String clause, String runtimeVersion) {
        return parse(clause).matches(SemanticVersion.parse(runtimeVersion));
    }

    /**
     * Evaluates this clause.
     *
     * @param runtimeVersion parsed runtime version
     * @return true if satisfied
     */
    public boolean matches(SemanticVersion runtimeVersion) {
        return operator.test(runtimeVersion.compareTo(target));
    }
}
