package com.pypeek;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the {@code pypeek} command.
 */
@DisplayName("PyPeek CLI")
class PyPeekCLITest {

    private static final String TOOL = """
        \"\"\"Small tool.\"\"\"

        def check(x):
            \"\"\"Check x.\"\"\"
            if x:
                return True
            return False

        def main():
            return 0

        if __name__ == "__main__":
            main()
        """;

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    @DisplayName("Prints the console summary of a Python file")
    void consoleSummary() throws IOException {
        Path file = write("tool.py", TOOL);

        int exitCode = run(file.toString());

        assertThat(exitCode).isEqualTo(PyPeekCLI.EXIT_OK);
        assertThat(stdout())
            .contains("📄 tool.py")
            .contains("📘 Module:\nSmall tool.")
            .contains("• check(x)\n  📘 Check x.\n  ↪ return True\n  ↪ return False\n")
            .contains("🚀 Entry Point:")
            .contains("Yes (has __main__ block)")
            .doesNotContain("[when:");
    }

    @Test
    @DisplayName("Annotates returns with conditions when --verbose is given")
    void verboseShowsConditions() throws IOException {
        Path file = write("tool.py", TOOL);

        int exitCode = run("--verbose", file.toString());

        assertThat(exitCode).isEqualTo(PyPeekCLI.EXIT_OK);
        assertThat(stdout())
            .contains("↪ return True  [when: x] ✅")
            .contains("↪ return False\n");
    }

    @Test
    @DisplayName("Prints JSON with --format json")
    void jsonFormat() throws IOException {
        Path file = write("tool.py", TOOL);

        int exitCode = run("--format", "JSON", file.toString());

        assertThat(exitCode).isEqualTo(PyPeekCLI.EXIT_OK);
        assertThat(stdout())
            .contains("\"file\" : \"tool.py\"")
            .contains("\"executable\" : true");
    }

    @Test
    @DisplayName("Reads output settings from a config file")
    void configFile() throws IOException {
        Path file = write("tool.py", TOOL);
        Path config = write("pypeek.yaml", "output:\n  showConditions: true\n");

        int exitCode = run("-c", config.toString(), file.toString());

        assertThat(exitCode).isEqualTo(PyPeekCLI.EXIT_OK);
        assertThat(stdout()).contains("[when: x] ✅");
    }

    @Test
    @DisplayName("Command-line format overrides the config file")
    void formatOptionOverridesConfig() throws IOException {
        Path file = write("tool.py", TOOL);
        Path config = write("pypeek.yaml", "output:\n  format: json\n");

        assertThat(run("-c", config.toString(), file.toString())).isEqualTo(PyPeekCLI.EXIT_OK);
        assertThat(stdout()).contains("\"summary\"");

        out.reset();
        assertThat(run("-c", config.toString(), "-f", "console", file.toString())).isEqualTo(PyPeekCLI.EXIT_OK);
        assertThat(stdout()).contains("📄 tool.py").doesNotContain("\"summary\"");
    }

    @Test
    @DisplayName("Rejects an unknown format")
    void unknownFormat() throws IOException {
        Path file = write("tool.py", TOOL);

        int exitCode = run("--format", "xml", file.toString());

        assertThat(exitCode).isEqualTo(PyPeekCLI.EXIT_UNKNOWN_FORMAT);
        assertThat(stderr()).contains("❌ Unknown format: xml");
        assertThat(stdout()).isEmpty();
    }

    @Test
    @DisplayName("Reports a missing file")
    void missingFile() {
        Path missing = tempDir.resolve("missing.py");

        int exitCode = run(missing.toString());

        assertThat(exitCode).isEqualTo(PyPeekCLI.EXIT_FAILURE);
        assertThat(stderr()).contains("❌ File not found: " + missing);
    }

    @Test
    @DisplayName("Reports syntax errors with line and column")
    void syntaxError() throws IOException {
        Path file = write("broken.py", "x = 1\ndef broken(:\n    pass\n");

        int exitCode = run(file.toString());

        assertThat(exitCode).isEqualTo(PyPeekCLI.EXIT_FAILURE);
        assertThat(stderr()).contains("❌ SyntaxError: ").contains(" at line 2, col ");
        assertThat(stdout()).doesNotContain("📄");
    }

    @Test
    @DisplayName("Skips files that are not Python")
    void skipsNonPythonFile() throws IOException {
        Path file = write("notes.txt", "just text\n");

        int exitCode = run(file.toString());

        assertThat(exitCode).isEqualTo(PyPeekCLI.EXIT_OK);
        assertThat(stdout()).contains("⚠️ Skipping: not a Python file or missing shebang");
    }

    @Test
    @DisplayName("Accepts extensionless scripts with a Python shebang")
    void shebangScript() throws IOException {
        Path file = write("deploy", "#!/usr/bin/env python3\ndef run():\n    pass\n");

        int exitCode = run(file.toString());

        assertThat(exitCode).isEqualTo(PyPeekCLI.EXIT_OK);
        assertThat(stdout()).contains("📄 deploy").contains("• run()\n  ↪ (no return)");
    }

    @Test
    @DisplayName("Requires a file argument")
    void missingArgument() {
        assertThat(run()).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    @DisplayName("--debug and --quiet are mutually exclusive")
    void exclusiveLogLevels() throws IOException {
        Path file = write("tool.py", TOOL);

        assertThat(run("--debug", "--quiet", file.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    @DisplayName("Finds registered renderers by id")
    void findRenderer() {
        assertThat(PyPeekCLI.findRenderer("console")).isNotNull();
        assertThat(PyPeekCLI.findRenderer("json")).isNotNull();
        assertThat(PyPeekCLI.findRenderer("html")).isNull();
    }

    private int run(String... args) {
        return new CommandLine(new PyPeekCLI()).execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
