package com.apischema.core.version;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Comma-separated list of {@link VersionClause}s, all of which must hold.
 *
 * @param expression original constraint text, e.g. {@code ">1.3, <=1.6"}
 * @param clauses parsed clauses in declaration order
 */
public record VersionConstraint(String expression, List<VersionClause> clauses) {

    /**
     * Compact constructor with validation.
     */
    public VersionConstraint {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(clauses, "clauses must not be null");
        if (clauses.isEmpty()) {
            throw new VersionParseException(expression, "Version constraint has no clauses");
        }
        clauses = List.copyOf(clauses);
    }

    /**
     * Parses a constraint expression.
     *
     * @param expression comma-separated clauses
     * @return parsed constraint
     * @throws VersionParseException if any clause is malformed
     */
    public static VersionConstraint parse(String expression) {
        if (expression == null) {
            throw new VersionParseException(null, "Version constraint must not be null");
        }
        List<VersionClause> clauses = new ArrayList<>();
        for (String part : expression.split(",")) {
            clauses.add(VersionClause.parse(part.trim()));
        }
        return new VersionConstraint(expression, clauses);
    }

    /**
     * Checks every clause against the runtime version, stopping at the first failure.
     *
     * @param runtimeVersion parsed runtime version
     * @return true if all clauses hold
     */
    public boolean matches(SemanticVersion runtimeVersion) {
        return clauses.stream().allMatch(clause -> clause.matches(runtimeVersion));
    }

    @Override
    public String toString() {
        return expression;
    }
}
