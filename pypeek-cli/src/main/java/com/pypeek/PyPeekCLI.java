package com.pypeek;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pypeek.core.config.ConfigLoader;
import com.pypeek.core.config.PeekConfig;
import com.pypeek.core.renderer.RenderContext;
import com.pypeek.core.renderer.SummaryRenderer;
import com.pypeek.core.summarizer.Summarizer;
import com.pypeek.core.summarizer.SummaryResult;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Main CLI entry point for PyPeek.
 *
 * <p>PyPeek prints the structure of one Python file: module docstring, classes and their
 * methods, top-level functions, the {@code main} entry point, the return statements of each
 * function and whether the file has a {@code __main__} guard.
 *
 * <p><b>Options:</b>
 * <ul>
 *   <li>{@code --verbose} - Annotate returns with the conditions under which they are reached</li>
 *   <li>{@code -f, --format} - Output format: console or json</li>
 *   <li>{@code -c, --config} - Configuration file (default: {@code ./pypeek.yaml} if present)</li>
 *   <li>{@code --debug} / {@code -q, --quiet} - Log level DEBUG / ERROR</li>
 * </ul>
 *
 * <p><b>Exit codes:</b> 0 when the file was summarized or skipped, 1 when it could not be read
 * or parsed, 2 for an unknown output format.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * pypeek tool.py
 * pypeek --verbose tool.py
 * pypeek --format json scripts/deploy
 * }</pre>
 */
@Command(
    name = "pypeek",
    mixinStandardHelpOptions = true,
    version = "PyPeek 1.0.0-SNAPSHOT",
    description = "Shows the structure of a Python file: classes, functions, docstrings, return paths and main block status."
)
public class PyPeekCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PyPeekCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_UNKNOWN_FORMAT = 2;

    @Parameters(index = "0", paramLabel = "FILE", description = "Python file to analyze")
    private Path file;

    @Option(names = "--verbose", description = "Show conditions around return statements")
    private boolean verbose;

    @Option(names = {"-f", "--format"}, paramLabel = "ID", description = "Output format (console, json)")
    private String format;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE", description = "Configuration file (default: ./pypeek.yaml)")
    private Path configFile;

    @ArgGroup(exclusive = true)
    private LogLevel logLevel;

    static class LogLevel {
        @Option(names = "--debug", description = "Enable debug logging")
        boolean debug;

        @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
        boolean quiet;
    }

    @Override
    public Integer call() {
        configureLogging();

        PeekConfig config = configFile != null
            ? ConfigLoader.load(configFile)
            : ConfigLoader.loadFromDirectory(Path.of("").toAbsolutePath());

        String formatId = format != null ? format.trim().toLowerCase(Locale.ROOT) : config.output().format();
        SummaryRenderer renderer = findRenderer(formatId);
        if (renderer == null) {
            log.error("Unknown format: {}", formatId);
            System.err.println("❌ Unknown format: " + formatId);
            return EXIT_UNKNOWN_FORMAT;
        }

        boolean showConditions = verbose || config.output().showConditions();
        SummaryResult result = new Summarizer(config.source()).summarizeFile(file);

        if (result instanceof SummaryResult.Success success) {
            RenderContext context = new RenderContext(Map.of(
                RenderContext.CONSOLE_CONDITIONS, String.valueOf(showConditions)
            ));
            renderer.render(success.fileName(), success.summary(), context);
            return EXIT_OK;
        }
        if (result instanceof SummaryResult.Skipped skipped) {
            System.out.println("⚠️ Skipping: " + skipped.reason());
            return EXIT_OK;
        }
        if (result instanceof SummaryResult.SyntaxFailure failure) {
            System.err.printf("❌ SyntaxError: %s at line %d, col %d%n",
                failure.message(), failure.line(), failure.column());
            return EXIT_FAILURE;
        }

        SummaryResult.ReadFailure failure = (SummaryResult.ReadFailure) result;
        System.err.println("❌ " + failure.message());
        return EXIT_FAILURE;
    }

    /**
     * Looks up a renderer by id among those registered via SPI.
     *
     * @param id renderer id
     * @return the renderer, or {@code null} if none has this id
     */
    static SummaryRenderer findRenderer(String id) {
        log.debug("Discovering summary renderers via ServiceLoader");
        for (SummaryRenderer renderer : ServiceLoader.load(SummaryRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        return null;
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (logLevel != null && logLevel.quiet) {
            root.setLevel(Level.ERROR);
        } else if (logLevel != null && logLevel.debug) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.setOut(new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8));

        int exitCode = new CommandLine(new PyPeekCLI()).execute(args);
        System.exit(exitCode);
    }
}
