package com.apischema.core.definition;

import java.util.List;

/**
 * Thrown when descriptors of a definition file nest each other in a cycle.
 */
public class CyclicDescriptorException extends IllegalStateException {

    private final List<String> cycle;

    /**
     * @param cycle descriptor names along the cycle, first name repeated at the end
     */
    public CyclicDescriptorException(List<String> cycle) {
        super("Cyclic descriptor nesting: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
