package com.pypeek.core.summarizer;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pypeek.core.ast.AstParser;
import com.pypeek.core.ast.AstParserFactory;
import com.pypeek.core.ast.PythonAst;
import com.pypeek.core.config.PeekConfig;
import com.pypeek.core.model.ModuleSummary;
import com.pypeek.core.util.Languages;
import com.pypeek.core.walker.TreeWalker;

/**
 * Parses one Python file and summarizes it.
 *
 * <p>A file is only parsed if its name carries a recognized extension or its text starts with
 * an interpreter line ({@code #!}). Expected failures come back as {@link SummaryResult}
 * variants; a {@link com.pypeek.core.walker.LineIndexException} is a defect and propagates.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Summarizer summarizer = new Summarizer();
 * SummaryResult result = summarizer.summarizeFile(Path.of("tool.py"));
 * if (result instanceof SummaryResult.Success success) {
 *     System.out.println(success.summary().topLevelFunctions());
 * }
 * }</pre>
 */
public class Summarizer {

    private static final Logger log = LoggerFactory.getLogger(Summarizer.class);

    static final String SKIP_REASON = "not a Python file or missing shebang";

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final AstParser<PythonAst.Module> parser;
    private final PeekConfig.SourceConfig sourceConfig;

    public Summarizer() {
        this(AstParserFactory.getPythonParser(), PeekConfig.defaults().source());
    }

    public Summarizer(PeekConfig.SourceConfig sourceConfig) {
        this(AstParserFactory.getPythonParser(), sourceConfig);
    }

    /**
     * @param parser parser producing the syntax tree
     * @param sourceConfig which files count as Python source
     * @throws IllegalStateException if the parser reports itself unavailable
     */
    public Summarizer(AstParser<PythonAst.Module> parser, PeekConfig.SourceConfig sourceConfig) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.sourceConfig = Objects.requireNonNull(sourceConfig, "sourceConfig must not be null");
        if (!parser.isAvailable()) {
            throw new IllegalStateException(parser.getLanguage() + " parser is not available");
        }
        log.debug("Summarizer ready with {} parser", parser.getLanguage());
    }

    /**
     * Summarizes source text that has already been read.
     *
     * @param fileName name of the file the text came from
     * @param source decoded file content
     * @return success, skip or syntax failure
     */
    public SummaryResult summarize(String fileName, String source) {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(source, "source must not be null");

        if (!isPythonSource(fileName, source)) {
            log.debug("Skipping {}: {}", fileName, SKIP_REASON);
            return new SummaryResult.Skipped(fileName, SKIP_REASON);
        }

        String text = normalizeLineEndings(source);
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }

        PythonAst.Module module;
        try {
            module = parser.parseString(text);
        } catch (AstParser.AstParseException e) {
            log.debug("Syntax error in {} at {}:{}: {}", fileName, e.getLine(), e.getColumn(), e.getMessage());
            return new SummaryResult.SyntaxFailure(fileName, e.getMessage(), e.getLine(), e.getColumn());
        }

        List<String> lines = List.of(text.split("\n", -1));
        ModuleSummary summary = new TreeWalker(lines).visitModule(module);
        log.debug("Summarized {}: {} classes, {} top-level functions, executable={}",
            fileName, summary.classes().size(), summary.topLevelFunctions().size(), summary.executable());
        return new SummaryResult.Success(fileName, summary);
    }

    /**
     * Reads a file as UTF-8 and summarizes it.
     *
     * @param path file to summarize
     * @return success, skip, syntax failure or read failure
     */
    public SummaryResult summarizeFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String fileName = path.getFileName() != null ? path.getFileName().toString() : path.toString();

        if (!Files.exists(path)) {
            log.debug("File not found: {}", path);
            return new SummaryResult.ReadFailure(fileName, "File not found: " + path);
        }

        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("File is not valid UTF-8: {}", path, e);
            return new SummaryResult.ReadFailure(fileName, "Failed to read file: " + path + " is not valid UTF-8");
        } catch (IOException e) {
            log.debug("Failed to read {}", path, e);
            return new SummaryResult.ReadFailure(fileName, "Failed to read file: " + describe(e));
        }

        return summarize(fileName, source);
    }

    private boolean isPythonSource(String fileName, String source) {
        return sourceConfig.hasRecognizedExtension(fileName)
            || (sourceConfig.allowShebang() && source.startsWith(Languages.SHEBANG));
    }

    static String normalizeLineEndings(String source) {
        if (source.indexOf('\r') < 0) {
            return source;
        }
        return source.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
