package com.apischema.core.introspect;

import java.util.Optional;

/**
 * Optional source of model field metadata used to enrich path parameters.
 */
@FunctionalInterface
public interface ModelMetadataProvider {

    /**
     * Looks up a model field.
     *
     * @param model model name declared on the handler
     * @param field field name, i.e. the path variable
     * @return metadata, or empty when unknown
     */
    Optional<ModelFieldMetadata> lookup(String model, String field);

    /**
     * Returns a provider that knows nothing.
     *
     * @return empty provider
     */
    static ModelMetadataProvider none() {
        return (model, field) -> Optional.empty();
    }
}
