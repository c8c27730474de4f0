package com.pypeek.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RenderContext}.
 */
class RenderContextTest {

    @Test
    void isEnabled_parsesBooleansWithDefault() {
        RenderContext context = new RenderContext(Map.of("a", "TRUE", "b", "no"));

        assertThat(context.isEnabled("a", false)).isTrue();
        assertThat(context.isEnabled("b", true)).isFalse();
        assertThat(context.isEnabled("c", true)).isTrue();
    }

    @Test
    void settings_areCopied() {
        Map<String, String> settings = new HashMap<>();
        settings.put("json.pretty", "false");
        RenderContext context = new RenderContext(settings);

        settings.put("json.pretty", "true");

        assertThat(context.settings()).containsEntry("json.pretty", "false");
        assertThat(context.isEnabled("json.pretty", true)).isFalse();
        assertThat(new RenderContext(null).settings()).isEmpty();
        assertThat(RenderContext.empty().settings()).isEmpty();
    }
}
