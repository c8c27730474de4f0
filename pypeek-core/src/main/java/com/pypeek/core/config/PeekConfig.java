package com.pypeek.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pypeek.core.util.Languages;

import java.util.List;
import java.util.Locale;

/**
 * Root configuration for PyPeek.
 *
 * <p>Loaded from {@code pypeek.yaml}. Any section or field left out takes its default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * source:
 *   extensions: [".py", ".pyw"]
 *   allowShebang: true
 *
 * output:
 *   format: json
 *   showConditions: true
 * }</pre>
 *
 * @param source which files are treated as Python source
 * @param output how summaries are rendered
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PeekConfig(
    @JsonProperty("source") SourceConfig source,
    @JsonProperty("output") OutputConfig output
) {
    /** Default file extension list. */
    public static final List<String> DEFAULT_EXTENSIONS = List.of(Languages.PYTHON_EXTENSION);

    /** Default renderer id. */
    public static final String DEFAULT_FORMAT = "console";

    public PeekConfig {
        if (source == null) {
            source = new SourceConfig(null, null);
        }
        if (output == null) {
            output = new OutputConfig(null, null);
        }
    }

    /**
     * Creates the configuration used when no file is given or the file is unusable.
     *
     * @return default configuration
     */
    public static PeekConfig defaults() {
        return new PeekConfig(null, null);
    }

    /**
     * Source recognition settings.
     *
     * @param extensions file name suffixes that mark Python source
     * @param allowShebang whether a file starting with {@code #!} is Python source whatever its name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourceConfig(
        @JsonProperty("extensions") List<String> extensions,
        @JsonProperty("allowShebang") Boolean allowShebang
    ) {
        public SourceConfig {
            extensions = extensions == null || extensions.isEmpty() ? DEFAULT_EXTENSIONS : List.copyOf(extensions);
            if (allowShebang == null) {
                allowShebang = Boolean.TRUE;
            }
        }

        /**
         * Check if a file name carries one of the configured extensions.
         *
         * @param fileName file name or path
         * @return true if the name ends with a recognized extension
         */
        public boolean hasRecognizedExtension(String fileName) {
            return extensions.stream().anyMatch(fileName::endsWith);
        }
    }

    /**
     * Output settings.
     *
     * @param format renderer id (e.g., "console", "json")
     * @param showConditions whether return conditions are shown by default
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format,
        @JsonProperty("showConditions") Boolean showConditions
    ) {
        public OutputConfig {
            format = format == null || format.isBlank() ? DEFAULT_FORMAT : format.trim().toLowerCase(Locale.ROOT);
            if (showConditions == null) {
                showConditions = Boolean.FALSE;
            }
        }
    }
}
