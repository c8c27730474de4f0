package com.pypeek.core.renderer.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pypeek.core.model.FunctionInfo;
import com.pypeek.core.model.ModuleSummary;
import com.pypeek.core.model.ReturnInfo;
import com.pypeek.core.renderer.RenderContext;
import com.pypeek.core.renderer.SummaryRenderer;

/**
 * Renderer that prints a human-readable summary to the console.
 *
 * <p>Sections are printed in a fixed order: module docstring, classes with their methods,
 * top-level functions, the {@code main} entry point, and whether the module is executable.
 * Empty sections are left out, except the executable line.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.conditions} - Annotate returns with their conditions ("true"/"false", default: "false")</li>
 * </ul>
 *
 * <p><b>Example Output:</b>
 * <pre>
 * 📄 tool.py
 * ──────────────────────────────
 *
 * 🔧 Top-Level Functions:
 * ──────────────────────────────
 * • check(x)
 *   ↪ return True  [when: x] ✅
 *   ↪ return False
 * </pre>
 */
public class ConsoleRenderer implements SummaryRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String RULE = "─".repeat(30);
    private static final String INDENT = "  ";
    private static final String NEGATION = "not";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(String fileName, ModuleSummary summary, RenderContext context) {
        boolean showConditions = context.isEnabled(RenderContext.CONSOLE_CONDITIONS, false);
        logger.debug("Rendering summary of {} to console (conditions: {})", fileName, showConditions);

        System.out.print(format(fileName, summary, showConditions));
        System.out.flush();
    }

    /**
     * Formats a summary the way {@link #render} prints it.
     *
     * @param fileName name of the summarized file
     * @param summary the summary
     * @param showConditions whether returns are annotated with their conditions
     * @return the formatted text, lines separated by {@code \n}
     */
    public String format(String fileName, ModuleSummary summary, boolean showConditions) {
        StringBuilder out = new StringBuilder();

        out.append('\n').append("📄 ").append(fileName).append('\n');
        out.append(RULE).append('\n');

        if (summary.moduleDoc() != null && !summary.moduleDoc().isBlank()) {
            out.append("\n📘 Module:\n");
            for (String line : cleanDoc(summary.moduleDoc()).split("\n")) {
                out.append(line).append('\n');
            }
        }

        if (!summary.classes().isEmpty()) {
            out.append("\n🏩 Classes:\n").append(RULE).append('\n');
            for (Map.Entry<String, List<FunctionInfo>> entry : summary.classes().entrySet()) {
                out.append("\n🧱 class ").append(entry.getKey()).append('\n');
                for (FunctionInfo method : entry.getValue()) {
                    appendFunction(out, method, 1, false, showConditions);
                }
            }
        }

        if (!summary.topLevelFunctions().isEmpty()) {
            out.append("\n🔧 Top-Level Functions:\n").append(RULE).append('\n');
            List<FunctionInfo> functions = summary.topLevelFunctions();
            for (int i = 0; i < functions.size(); i++) {
                appendFunction(out, functions.get(i), 0, i > 0, showConditions);
            }
        }

        if (summary.mainFunction() != null) {
            out.append("\n🚀 Entry Point:\n").append(RULE).append('\n');
            appendFunction(out, summary.mainFunction(), 0, false, showConditions);
        }

        out.append("\n🚀 Executable:\n");
        out.append(summary.executable() ? "Yes" : "No").append(" (has __main__ block)\n\n");

        return out.toString();
    }

    private void appendFunction(StringBuilder out, FunctionInfo function, int indent, boolean pad,
                                boolean showConditions) {
        if (pad) {
            out.append('\n');
        }
        String prefix = INDENT.repeat(indent);
        String bodyPrefix = INDENT.repeat(indent + 1);

        out.append(prefix).append("• ").append(function.name())
            .append('(').append(String.join(", ", function.parameters())).append(")\n");

        String summaryLine = firstDocLine(function.doc());
        if (summaryLine != null) {
            out.append(bodyPrefix).append("📘 ").append(summaryLine).append('\n');
        }

        if (!function.hasReturns()) {
            out.append(bodyPrefix).append("↪ (no return)\n");
            return;
        }

        for (ReturnInfo ret : function.returns()) {
            out.append(bodyPrefix).append("↪ ").append(ret.sourceLine());
            String conditions = String.join(" | ", ret.conditions());
            if (showConditions && !conditions.isEmpty()) {
                out.append("  [when: ").append(conditions).append("] ").append(mark(conditions));
            }
            out.append('\n');
        }
    }

    /**
     * A path containing any negated predicate is marked as the "otherwise" path.
     */
    static String mark(String conditions) {
        return conditions.toLowerCase(Locale.ROOT).contains(NEGATION) ? "❌" : "✅";
    }

    /**
     * Removes the indentation a docstring picks up from its source layout. The first line is
     * stripped on the left; the common leading whitespace of the remaining lines is removed and
     * leading and trailing blank lines are dropped. Tabs expand to columns of 8.
     */
    static String cleanDoc(String doc) {
        String[] lines = doc.split("\n", -1);
        int margin = Integer.MAX_VALUE;
        for (int i = 0; i < lines.length; i++) {
            lines[i] = expandTabs(lines[i]);
            if (i > 0 && !lines[i].isBlank()) {
                margin = Math.min(margin, lines[i].length() - lines[i].stripLeading().length());
            }
        }
        lines[0] = lines[0].stripLeading();
        for (int i = 1; i < lines.length; i++) {
            lines[i] = lines[i].length() > margin ? lines[i].substring(margin) : lines[i].stripLeading();
        }

        int start = 0;
        int end = lines.length;
        while (start < end && lines[start].isBlank()) {
            start++;
        }
        while (end > start && lines[end - 1].isBlank()) {
            end--;
        }
        return String.join("\n", Arrays.asList(lines).subList(start, end)).stripTrailing();
    }

    private static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder expanded = new StringBuilder();
        for (char c : line.toCharArray()) {
            if (c == '\t') {
                do {
                    expanded.append(' ');
                } while (expanded.length() % 8 != 0);
            } else {
                expanded.append(c);
            }
        }
        return expanded.toString();
    }

    private static String firstDocLine(String doc) {
        if (doc == null) {
            return null;
        }
        for (String line : doc.split("\n")) {
            if (!line.isBlank()) {
                return line.strip();
            }
        }
        return null;
    }
}
