package com.apischema.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for document generation.
 *
 * <p>Loaded from {@code apischema.yaml}. Defines document metadata and generation switches.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * document:
 *   title: "Accounts API"
 *   version: "1.7"
 *   description: "User accounts and profiles"
 *   url: "https://api.example.com/"
 *
 * generation:
 *   coercePathPk: true
 *   defaultEncoding: "application/json"
 * }</pre>
 *
 * @param document document metadata
 * @param generation generation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchemaConfig(
    @JsonProperty("document") DocumentInfo document,
    @JsonProperty("generation") GenerationSettings generation
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public SchemaConfig {
        if (document == null) {
            document = DocumentInfo.defaults();
        }
        if (generation == null) {
            generation = GenerationSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static SchemaConfig defaults() {
        return new SchemaConfig(DocumentInfo.defaults(), GenerationSettings.defaults());
    }

    /**
     * Document metadata.
     *
     * @param title document title
     * @param version documented version, also used when a request names none
     * @param description document description
     * @param url base URL; when absent the request URL is used
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentInfo(
        @JsonProperty("title") String title,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description,
        @JsonProperty("url") String url
    ) {
        public DocumentInfo {
            if (title == null) {
                title = "API";
            }
            if (version == null) {
                version = "1.0";
            }
        }

        public static DocumentInfo defaults() {
            return new DocumentInfo("API", "1.0", null, null);
        }
    }

    /**
     * Generation switches.
     *
     * @param coercePathPk rename {@code {pk}} path variables to {@code {id}}
     * @param defaultEncoding request media type when a handler declares none
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenerationSettings(
        @JsonProperty("coercePathPk") Boolean coercePathPk,
        @JsonProperty("defaultEncoding") String defaultEncoding
    ) {
        public GenerationSettings {
            if (coercePathPk == null) {
                coercePathPk = Boolean.TRUE;
            }
            if (defaultEncoding == null || defaultEncoding.isBlank()) {
                defaultEncoding = "application/json";
            }
        }

        public static GenerationSettings defaults() {
            return new GenerationSettings(true, "application/json");
        }
    }
}
