package com.apischema.core.version;

import com.apischema.core.descriptor.DataShapeDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered mapping of version constraints to descriptors.
 *
 * <p>Entries are not required to be mutually exclusive: the first entry whose constraint
 * holds wins, so declaration order is part of the contract.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * VersionMap map = VersionMap.builder()
 *     .when(">1.3, <=1.6", meSerializer16)
 *     .when(">1.6", meSerializer)
 *     .build();
 * }</pre>
 *
 * @param entries entries in declaration order
 */
public record VersionMap(List<Entry> entries) {

    /**
     * Compact constructor with validation.
     */
    public VersionMap {
        Objects.requireNonNull(entries, "entries must not be null");
        entries = List.copyOf(entries);
    }

    /**
     * Starts an empty map.
     *
     * @return builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * One constraint/descriptor pair.
     *
     * @param constraint constraint the runtime version must satisfy
     * @param descriptor descriptor selected when it does
     */
    public record Entry(VersionConstraint constraint, DataShapeDescriptor descriptor) {
        /**
         * Compact constructor with validation.
         */
        public Entry {
            Objects.requireNonNull(constraint, "constraint must not be null");
            Objects.requireNonNull(descriptor, "descriptor must not be null");
        }
    }

    /**
     * Builder for {@link VersionMap}. Constraints are parsed as they are added.
     */
    public static final class Builder {
        private final List<Entry> entries = new ArrayList<>();

        private Builder() {
        }

        /**
         * Appends an entry.
         *
         * @param constraint constraint expression, e.g. {@code ">1.3, <=1.6"}
         * @param descriptor descriptor for matching versions
         * @return this builder
         * @throws VersionParseException if the expression is malformed
         */
        public Builder when(String constraint, DataShapeDescriptor descriptor) {
            entries.add(new Entry(VersionConstraint.parse(constraint), descriptor));
            return this;
        }

        public VersionMap build() {
            return new VersionMap(entries);
        }
    }
}
