package com.pypeek.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Syntax tree node types for Python source code.
 *
 * <p>This class contains the closed set of record types the summarizer understands. Statement
 * kinds it does not inspect collapse into {@link CompoundStatement} (anything owning nested
 * blocks) or {@link SimpleStatement}; expressions collapse into {@link OtherExpression}.
 * All records are immutable.
 *
 * <p>Expressions carry the source text they were parsed from. The text is {@code null} when it
 * could not be recovered (for example around a syntax error the tree builder recovered from).
 *
 * @see com.pypeek.core.parser.python.PythonTreeBuilder
 * @since 1.0.0
 */
public final class PythonAst {

    private PythonAst() {
        // Utility class - no instantiation
    }

    /**
     * Root of a parsed file.
     *
     * @param body top-level statements in source order
     */
    public record Module(List<Statement> body) {
        public Module {
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    /**
     * A statement. Every statement knows the 1-indexed line of its first keyword or token.
     */
    public sealed interface Statement
        permits ClassDef, FunctionDef, If, Return, ExpressionStatement, CompoundStatement, SimpleStatement {

        int lineNumber();
    }

    /**
     * Represents a class definition.
     *
     * <p>Example:
     * <pre>{@code
     * @dataclass
     * class User(Model):
     *     def save(self): ...
     * }</pre>
     *
     * @param name class name (e.g., "User")
     * @param body statements of the class body
     * @param lineNumber line of the {@code class} keyword (1-indexed)
     */
    public record ClassDef(String name, List<Statement> body, int lineNumber) implements Statement {
        public ClassDef {
            Objects.requireNonNull(name, "name must not be null");
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    /**
     * Represents a function or method definition, {@code async} or not.
     *
     * @param name function name
     * @param parameters positional-or-keyword parameter names
     * @param body statements of the function body
     * @param lineNumber line of the {@code def} keyword (1-indexed)
     * @param isAsync whether this is an {@code async def}
     */
    public record FunctionDef(
        String name,
        List<String> parameters,
        List<Statement> body,
        int lineNumber,
        boolean isAsync
    ) implements Statement {
        public FunctionDef {
            Objects.requireNonNull(name, "name must not be null");
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
            body = body != null ? List.copyOf(body) : List.of();
        }
    }

    /**
     * Represents an {@code if} statement. An {@code elif} is an {@code If} that is the only
     * statement of the enclosing statement's {@code orElse}.
     *
     * @param test the condition
     * @param body statements run when the test holds
     * @param orElse statements of the {@code elif}/{@code else} branch (empty when absent)
     * @param lineNumber line of the {@code if}/{@code elif} keyword (1-indexed)
     */
    public record If(Expression test, List<Statement> body, List<Statement> orElse, int lineNumber)
        implements Statement {

        public If {
            Objects.requireNonNull(test, "test must not be null");
            body = body != null ? List.copyOf(body) : List.of();
            orElse = orElse != null ? List.copyOf(orElse) : List.of();
        }
    }

    /**
     * Represents a {@code return} statement.
     *
     * @param lineNumber line of the {@code return} keyword (1-indexed)
     */
    public record Return(int lineNumber) implements Statement {
    }

    /**
     * Represents a bare expression used as a statement (calls, docstrings, {@code yield}).
     *
     * @param value the expression
     * @param lineNumber line where the expression starts (1-indexed)
     */
    public record ExpressionStatement(Expression value, int lineNumber) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * Represents any other statement that owns nested blocks: {@code for}, {@code while},
     * {@code try}, {@code with}, {@code match} and their {@code async} forms.
     *
     * @param keyword introducing keyword (e.g., "for", "try")
     * @param suites nested blocks in source order (loop body then loop {@code else}; {@code try}
     *               body, handlers, {@code else}, {@code finally}; one per {@code case})
     * @param lineNumber line of the keyword (1-indexed)
     */
    public record CompoundStatement(String keyword, List<List<Statement>> suites, int lineNumber)
        implements Statement {

        public CompoundStatement {
            Objects.requireNonNull(keyword, "keyword must not be null");
            suites = suites != null ? suites.stream().map(List::copyOf).toList() : List.of();
        }
    }

    /**
     * Represents a statement without nested blocks that the summarizer does not inspect
     * (assignments, imports, {@code pass}, {@code raise}, ...).
     *
     * @param keyword statement kind (e.g., "import", "assign")
     * @param lineNumber line where the statement starts (1-indexed)
     */
    public record SimpleStatement(String keyword, int lineNumber) implements Statement {
    }

    /**
     * An expression. {@link #sourceText()} is the literal source of the expression, or
     * {@code null} if it could not be recovered.
     */
    public sealed interface Expression permits Name, StringLiteral, Compare, OtherExpression {

        String sourceText();
    }

    /**
     * A bare identifier, e.g. {@code __name__}.
     *
     * @param id identifier text
     * @param sourceText source text
     */
    public record Name(String id, String sourceText) implements Expression {
        public Name {
            Objects.requireNonNull(id, "id must not be null");
        }
    }

    /**
     * A (possibly implicitly concatenated) {@code str} literal. Bytes and f-strings are not
     * string literals in this sense.
     *
     * @param value evaluated string value
     * @param sourceText source text, including quotes and prefixes
     */
    public record StringLiteral(String value, String sourceText) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * A comparison chain, e.g. {@code a < b <= c} or {@code __name__ == "__main__"}.
     *
     * @param left leftmost operand
     * @param operators comparison operators in order (e.g., ["==", "not in"])
     * @param comparators the remaining operands
     * @param sourceText source text
     */
    public record Compare(
        Expression left,
        List<String> operators,
        List<Expression> comparators,
        String sourceText
    ) implements Expression {
        public Compare {
            Objects.requireNonNull(left, "left must not be null");
            operators = operators != null ? List.copyOf(operators) : List.of();
            comparators = comparators != null ? List.copyOf(comparators) : List.of();
        }
    }

    /**
     * Any expression the summarizer does not look inside.
     *
     * @param sourceText source text
     */
    public record OtherExpression(String sourceText) implements Expression {
    }
}
