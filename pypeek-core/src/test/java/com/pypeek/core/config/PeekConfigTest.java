package com.pypeek.core.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PeekConfig}.
 */
class PeekConfigTest {

    @Test
    void defaults_recognizePythonFilesAndConsoleOutput() {
        PeekConfig config = PeekConfig.defaults();

        assertThat(config.source().extensions()).containsExactly(".py");
        assertThat(config.source().allowShebang()).isTrue();
        assertThat(config.output().format()).isEqualTo("console");
        assertThat(config.output().showConditions()).isFalse();
    }

    @Test
    void emptyExtensionList_fallsBackToDefault() {
        PeekConfig.SourceConfig source = new PeekConfig.SourceConfig(List.of(), null);

        assertThat(source.extensions()).containsExactly(".py");
    }

    @Test
    void hasRecognizedExtension_matchesSuffix() {
        PeekConfig.SourceConfig source = new PeekConfig.SourceConfig(List.of(".py", ".pyw"), true);

        assertThat(source.hasRecognizedExtension("app.py")).isTrue();
        assertThat(source.hasRecognizedExtension("src/gui.pyw")).isTrue();
        assertThat(source.hasRecognizedExtension("app.pyc")).isFalse();
        assertThat(source.hasRecognizedExtension("py")).isFalse();
    }
}
