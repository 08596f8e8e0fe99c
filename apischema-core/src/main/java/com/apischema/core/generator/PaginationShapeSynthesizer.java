package com.apischema.core.generator;

import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.DeclaredField;
import com.apischema.core.descriptor.PrimitiveType;
import com.apischema.core.route.PaginationStrategy;

/**
 * Wraps a list item descriptor in the envelope its pagination strategy produces.
 *
 * <table>
 *   <caption>Envelope fields</caption>
 *   <tr><th>Strategy</th><th>Fields</th></tr>
 *   <tr><td>none, custom</td><td>results</td></tr>
 *   <tr><td>page number, limit/offset</td><td>results, count, next, previous</td></tr>
 *   <tr><td>cursor</td><td>results, next, previous</td></tr>
 * </table>
 */
public class PaginationShapeSynthesizer {

    static final String RESULTS = "results";
    static final String COUNT = "count";
    static final String NEXT = "next";
    static final String PREVIOUS = "previous";

    /**
     * Builds the paginated envelope.
     *
     * @param child descriptor of one item
     * @param strategy pagination strategy of the route, may be null; proxies are resolved once
     * @return envelope descriptor
     */
    public DataShapeDescriptor wrap(DataShapeDescriptor child, PaginationStrategy strategy) {
        DataShapeDescriptor item = child.many()
            ? new DataShapeDescriptor(child.name(), child.documentation(), child.fields(), child.errorStatusCodes(), false)
            : child;

        DataShapeDescriptor.Builder envelope = DataShapeDescriptor.builder(child.name() + "List")
            .field(DeclaredField.listOf(RESULTS, DeclaredField.nested(RESULTS, item)).asRequired());
        child.errorStatusCodes().forEach(envelope::errorStatus);

        if (strategy == null) {
            return envelope.build();
        }

        switch (strategy.resolve().style()) {
            case PAGE_NUMBER, LIMIT_OFFSET -> envelope
                .field(DeclaredField.primitive(COUNT, PrimitiveType.INTEGER).asRequired())
                .field(DeclaredField.primitive(NEXT, PrimitiveType.URL).asRequired())
                .field(DeclaredField.primitive(PREVIOUS, PrimitiveType.URL).asRequired());
            case CURSOR -> envelope
                .field(DeclaredField.primitive(NEXT, PrimitiveType.URL).asRequired())
                .field(DeclaredField.primitive(PREVIOUS, PrimitiveType.URL).asRequired());
            case CUSTOM -> {
                // results only
            }
        }
        return envelope.build();
    }
}
