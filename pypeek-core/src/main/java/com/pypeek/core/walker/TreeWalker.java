package com.pypeek.core.walker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.pypeek.core.ast.PythonAst;
import com.pypeek.core.model.FunctionInfo;
import com.pypeek.core.model.ModuleSummary;
import com.pypeek.core.model.ReturnInfo;

/**
 * Turns a parsed Python module into a {@link ModuleSummary}.
 *
 * <p>At the top level only class definitions, function definitions and {@code if} statements
 * are looked at. Inside a class body only methods and nested classes are. Function bodies are
 * walked in full for {@code return} statements, each annotated with the {@code if}/{@code else}
 * predicates enclosing it.
 *
 * <p>All traversal state belongs to a single {@link #visitModule} call, so one walker can be
 * reused, but it is bound to the source lines it was created with.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<String> lines = List.of(source.split("\n", -1));
 * ModuleSummary summary = new TreeWalker(lines).visitModule(module);
 * }</pre>
 *
 * @see ConditionStack
 */
public class TreeWalker {

    /** Name of the function treated as the entry point. */
    public static final String MAIN_FUNCTION = "main";

    /** Identifier compared in the executable guard. */
    public static final String MODULE_NAME_IDENTIFIER = "__name__";

    private final List<String> sourceLines;

    /**
     * @param sourceLines physical lines of the source the module was parsed from
     */
    public TreeWalker(List<String> sourceLines) {
        this.sourceLines = List.copyOf(Objects.requireNonNull(sourceLines, "sourceLines must not be null"));
    }

    /**
     * Summarizes a module.
     *
     * @param module parsed module
     * @return the module summary
     * @throws LineIndexException if a return refers to a line outside the source
     */
    public ModuleSummary visitModule(PythonAst.Module module) {
        SummaryBuilder summary = new SummaryBuilder();
        summary.moduleDoc = docstring(module.body());

        for (PythonAst.Statement statement : module.body()) {
            if (statement instanceof PythonAst.ClassDef classDef) {
                visitClass(classDef, summary);
            } else if (statement instanceof PythonAst.FunctionDef functionDef) {
                summary.place(visitFunction(functionDef));
            } else if (statement instanceof PythonAst.If ifStatement && detectExecutable(ifStatement)) {
                summary.executable = true;
            }
        }

        return summary.build();
    }

    /**
     * Records a class and its methods.
     *
     * <p>Only one class is tracked at a time. A nested class takes over as the current class,
     * and once it is done there is no current class for the rest of the enclosing body: outer
     * methods that follow a nested class are placed as if they were top-level functions.
     */
    void visitClass(PythonAst.ClassDef node, SummaryBuilder summary) {
        summary.currentClass = node.name();
        summary.classes.put(node.name(), new ArrayList<>());

        for (PythonAst.Statement statement : node.body()) {
            if (statement instanceof PythonAst.FunctionDef method) {
                summary.place(visitFunction(method));
            } else if (statement instanceof PythonAst.ClassDef nested) {
                visitClass(nested, summary);
            }
        }

        summary.currentClass = null;
    }

    /**
     * Summarizes one function or method, including its returns.
     *
     * @param node function definition
     * @return function summary
     */
    public FunctionInfo visitFunction(PythonAst.FunctionDef node) {
        List<ReturnInfo> returns = new ArrayList<>();
        walkBodyForReturns(node.body(), new ConditionStack(), returns);

        return new FunctionInfo(
            node.name(),
            node.parameters(),
            docstring(node.body()),
            returns,
            node.lineNumber(),
            node.isAsync()
        );
    }

    /**
     * Collects the returns of a statement list into {@code returns}, in source order.
     *
     * <p>An {@code if} pushes its test for the body and the negated test for the
     * {@code else}/{@code elif} branch. Every other statement that owns nested statements is
     * entered without touching the stack.
     *
     * @param statements statements to walk
     * @param conditions predicates enclosing {@code statements}; left as found on return
     * @param returns receives one entry per return
     */
    public void walkBodyForReturns(List<PythonAst.Statement> statements, ConditionStack conditions,
                                   List<ReturnInfo> returns) {
        for (PythonAst.Statement statement : statements) {
            if (statement instanceof PythonAst.If ifStatement) {
                String test = ifStatement.test().sourceText();

                conditions.push(test);
                walkBodyForReturns(ifStatement.body(), conditions, returns);
                conditions.pop();

                if (!ifStatement.orElse().isEmpty()) {
                    conditions.pushNegated(test);
                    walkBodyForReturns(ifStatement.orElse(), conditions, returns);
                    conditions.pop();
                }
            } else if (statement instanceof PythonAst.Return returnStatement) {
                int line = returnStatement.lineNumber();
                returns.add(new ReturnInfo(sourceLine(line), conditions.snapshot(), line));
            } else if (statement instanceof PythonAst.CompoundStatement compound) {
                for (List<PythonAst.Statement> suite : compound.suites()) {
                    walkBodyForReturns(suite, conditions, returns);
                }
            } else if (statement instanceof PythonAst.FunctionDef nestedFunction) {
                walkBodyForReturns(nestedFunction.body(), conditions, returns);
            } else if (statement instanceof PythonAst.ClassDef nestedClass) {
                walkBodyForReturns(nestedClass.body(), conditions, returns);
            }
        }
    }

    /**
     * Checks whether a top-level {@code if} is the {@code __name__} guard. Any comparison with
     * {@code __name__} as its left operand counts, whatever the operator or right-hand side.
     *
     * @param node the {@code if} statement
     * @return true if the test compares {@code __name__}
     */
    public boolean detectExecutable(PythonAst.If node) {
        return node.test() instanceof PythonAst.Compare compare
            && compare.left() instanceof PythonAst.Name name
            && MODULE_NAME_IDENTIFIER.equals(name.id());
    }

    private String sourceLine(int lineNumber) {
        if (lineNumber < 1 || lineNumber > sourceLines.size()) {
            throw new LineIndexException(lineNumber, sourceLines.size());
        }
        return sourceLines.get(lineNumber - 1).strip();
    }

    private static String docstring(List<PythonAst.Statement> body) {
        if (!body.isEmpty()
            && body.get(0) instanceof PythonAst.ExpressionStatement expression
            && expression.value() instanceof PythonAst.StringLiteral literal) {
            return literal.value();
        }
        return null;
    }

    /**
     * Mutable accumulator and traversal context for one {@link #visitModule} call.
     */
    static final class SummaryBuilder {
        private String currentClass;
        private String moduleDoc;
        private final Map<String, List<FunctionInfo>> classes = new LinkedHashMap<>();
        private final List<FunctionInfo> topLevelFunctions = new ArrayList<>();
        private FunctionInfo mainFunction;
        private boolean executable;

        /**
         * Files a function under the current class, as the entry point, or as top-level.
         */
        private void place(FunctionInfo function) {
            if (currentClass != null) {
                classes.get(currentClass).add(function);
            } else if (MAIN_FUNCTION.equals(function.name())) {
                mainFunction = function;
            } else {
                topLevelFunctions.add(function);
            }
        }

        private ModuleSummary build() {
            return new ModuleSummary(moduleDoc, classes, topLevelFunctions, mainFunction, executable);
        }
    }
}
