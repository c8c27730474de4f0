package com.pypeek.core.renderer.impl;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pypeek.core.model.ModuleSummary;
import com.pypeek.core.renderer.RenderContext;
import com.pypeek.core.renderer.SummaryRenderer;

/**
 * Renderer that prints the summary as a JSON document.
 *
 * <p>The document has two fields: {@code file} (the file name) and {@code summary} (the
 * {@link ModuleSummary} as serialized by Jackson).
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code json.pretty} - Indent the output ("true"/"false", default: "true")</li>
 * </ul>
 */
public class JsonRenderer implements SummaryRenderer {

    private static final Logger logger = LoggerFactory.getLogger(JsonRenderer.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public void render(String fileName, ModuleSummary summary, RenderContext context) {
        boolean pretty = context.isEnabled(RenderContext.JSON_PRETTY, true);
        logger.debug("Rendering summary of {} as JSON (pretty: {})", fileName, pretty);

        System.out.println(toJson(fileName, summary, pretty));
        System.out.flush();
    }

    /**
     * Serializes a summary.
     *
     * @param fileName name of the summarized file
     * @param summary the summary
     * @param pretty whether to indent the output
     * @return JSON text
     * @throws IllegalStateException if serialization fails
     */
    public String toJson(String fileName, ModuleSummary summary, boolean pretty) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("file", fileName);
        document.put("summary", summary);

        try {
            return pretty
                ? MAPPER.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(document)
                : MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize summary of " + fileName, e);
        }
    }
}
