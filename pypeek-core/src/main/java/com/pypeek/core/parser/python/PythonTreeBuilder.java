package com.pypeek.core.parser.python;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import com.pypeek.core.ast.PythonAst;
import com.pypeek.parser.PythonParser;

/**
 * Maps an ANTLR Python parse tree onto the {@link PythonAst} variants.
 *
 * <p>{@code elif} clauses become nested {@link PythonAst.If} nodes in the enclosing
 * {@code orElse}, decorators are dropped, and redundant parentheses around an expression are
 * looked through when classifying it. One instance serves one parse.
 */
public class PythonTreeBuilder {

    private final TokenStream tokens;

    /**
     * @param tokens token stream the parse tree was built from, used to recover expression text
     */
    public PythonTreeBuilder(TokenStream tokens) {
        this.tokens = tokens;
    }

    public PythonAst.Module build(PythonParser.File_inputContext ctx) {
        List<PythonAst.Statement> body = new ArrayList<>();
        for (PythonParser.StmtContext stmt : ctx.stmt()) {
            body.addAll(statements(stmt));
        }
        return new PythonAst.Module(body);
    }

    // Statements

    private List<PythonAst.Statement> statements(PythonParser.StmtContext ctx) {
        if (ctx.compound_stmt() != null) {
            return List.of(compoundStatement(ctx.compound_stmt()));
        }
        return simpleStatements(ctx.simple_stmts());
    }

    private List<PythonAst.Statement> block(PythonParser.BlockContext ctx) {
        if (ctx.simple_stmts() != null) {
            return simpleStatements(ctx.simple_stmts());
        }
        List<PythonAst.Statement> body = new ArrayList<>();
        for (PythonParser.StmtContext stmt : ctx.stmt()) {
            body.addAll(statements(stmt));
        }
        return body;
    }

    private PythonAst.Statement compoundStatement(PythonParser.Compound_stmtContext ctx) {
        int line = ctx.getStart().getLine();

        if (ctx.if_stmt() != null) {
            return ifStatement(ctx.if_stmt());
        }
        if (ctx.funcdef() != null) {
            return functionDef(ctx.funcdef(), false);
        }
        if (ctx.classdef() != null) {
            return classDef(ctx.classdef());
        }
        if (ctx.decorated() != null) {
            return decorated(ctx.decorated());
        }
        if (ctx.while_stmt() != null) {
            PythonParser.While_stmtContext loop = ctx.while_stmt();
            return new PythonAst.CompoundStatement("while", withElse(loop.block(), loop.else_clause()), line);
        }
        if (ctx.for_stmt() != null) {
            PythonParser.For_stmtContext loop = ctx.for_stmt();
            return new PythonAst.CompoundStatement("for", withElse(loop.block(), loop.else_clause()), line);
        }
        if (ctx.try_stmt() != null) {
            return tryStatement(ctx.try_stmt());
        }
        if (ctx.with_stmt() != null) {
            return new PythonAst.CompoundStatement("with", List.of(block(ctx.with_stmt().block())), line);
        }
        if (ctx.async_stmt() != null) {
            return asyncStatement(ctx.async_stmt());
        }
        return matchStatement(ctx.match_stmt());
    }

    private PythonAst.If ifStatement(PythonParser.If_stmtContext ctx) {
        List<PythonAst.Statement> orElse = ctx.else_clause() != null
            ? block(ctx.else_clause().block())
            : List.of();

        List<PythonParser.Elif_clauseContext> elifs = ctx.elif_clause();
        for (int i = elifs.size() - 1; i >= 0; i--) {
            PythonParser.Elif_clauseContext elif = elifs.get(i);
            PythonAst.If nested = new PythonAst.If(
                expression(elif.named_test()),
                block(elif.block()),
                orElse,
                elif.ELIF().getSymbol().getLine()
            );
            orElse = List.of(nested);
        }

        return new PythonAst.If(
            expression(ctx.named_test()),
            block(ctx.block()),
            orElse,
            ctx.IF().getSymbol().getLine()
        );
    }

    private PythonAst.FunctionDef functionDef(PythonParser.FuncdefContext ctx, boolean isAsync) {
        return new PythonAst.FunctionDef(
            ctx.NAME().getText(),
            parameterNames(ctx.parameters()),
            block(ctx.block()),
            ctx.DEF().getSymbol().getLine(),
            isAsync
        );
    }

    /**
     * Names of the positional-or-keyword parameters: everything before a bare or named
     * {@code *} and {@code **}, minus anything declared positional-only with {@code /}.
     */
    private static List<String> parameterNames(PythonParser.ParametersContext ctx) {
        List<String> names = new ArrayList<>();
        if (ctx.typedargslist() == null) {
            return names;
        }

        for (PythonParser.ParameterContext parameter : ctx.typedargslist().parameter()) {
            if (parameter instanceof PythonParser.PlainParameterContext plain) {
                names.add(plain.tfpdef().NAME().getText());
            } else if (parameter instanceof PythonParser.PositionalOnlyMarkerContext) {
                names.clear();
            } else {
                break;
            }
        }
        return names;
    }

    private PythonAst.ClassDef classDef(PythonParser.ClassdefContext ctx) {
        return new PythonAst.ClassDef(
            ctx.NAME().getText(),
            block(ctx.block()),
            ctx.CLASS().getSymbol().getLine()
        );
    }

    private PythonAst.Statement decorated(PythonParser.DecoratedContext ctx) {
        if (ctx.classdef() != null) {
            return classDef(ctx.classdef());
        }
        if (ctx.async_funcdef() != null) {
            return functionDef(ctx.async_funcdef().funcdef(), true);
        }
        return functionDef(ctx.funcdef(), false);
    }

    private PythonAst.Statement asyncStatement(PythonParser.Async_stmtContext ctx) {
        int line = ctx.getStart().getLine();
        if (ctx.funcdef() != null) {
            return functionDef(ctx.funcdef(), true);
        }
        if (ctx.with_stmt() != null) {
            return new PythonAst.CompoundStatement("async with", List.of(block(ctx.with_stmt().block())), line);
        }
        PythonParser.For_stmtContext loop = ctx.for_stmt();
        return new PythonAst.CompoundStatement("async for", withElse(loop.block(), loop.else_clause()), line);
    }

    private PythonAst.CompoundStatement tryStatement(PythonParser.Try_stmtContext ctx) {
        List<List<PythonAst.Statement>> suites = new ArrayList<>();
        suites.add(block(ctx.block()));
        for (PythonParser.Except_clauseContext handler : ctx.except_clause()) {
            suites.add(block(handler.block()));
        }
        if (ctx.else_clause() != null) {
            suites.add(block(ctx.else_clause().block()));
        }
        if (ctx.finally_clause() != null) {
            suites.add(block(ctx.finally_clause().block()));
        }
        return new PythonAst.CompoundStatement("try", suites, ctx.TRY().getSymbol().getLine());
    }

    private PythonAst.CompoundStatement matchStatement(PythonParser.Match_stmtContext ctx) {
        List<List<PythonAst.Statement>> suites = new ArrayList<>();
        for (PythonParser.Case_blockContext caseBlock : ctx.case_block()) {
            suites.add(block(caseBlock.block()));
        }
        return new PythonAst.CompoundStatement("match", suites, ctx.getStart().getLine());
    }

    private List<List<PythonAst.Statement>> withElse(PythonParser.BlockContext body,
                                                     PythonParser.Else_clauseContext elseClause) {
        List<List<PythonAst.Statement>> suites = new ArrayList<>();
        suites.add(block(body));
        if (elseClause != null) {
            suites.add(block(elseClause.block()));
        }
        return suites;
    }

    private List<PythonAst.Statement> simpleStatements(PythonParser.Simple_stmtsContext ctx) {
        List<PythonAst.Statement> body = new ArrayList<>();
        for (PythonParser.Simple_stmtContext stmt : ctx.simple_stmt()) {
            body.add(simpleStatement(stmt));
        }
        return body;
    }

    private PythonAst.Statement simpleStatement(PythonParser.Simple_stmtContext ctx) {
        int line = ctx.getStart().getLine();

        if (ctx.return_stmt() != null) {
            return new PythonAst.Return(ctx.return_stmt().RETURN().getSymbol().getLine());
        }
        if (ctx.yield_stmt() != null) {
            return new PythonAst.ExpressionStatement(expression(ctx.yield_stmt()), line);
        }
        if (ctx.expr_stmt() != null) {
            PythonParser.Expr_stmtContext exprStmt = ctx.expr_stmt();
            if (exprStmt.annassign() == null && exprStmt.augassign() == null && exprStmt.ASSIGN().isEmpty()) {
                return new PythonAst.ExpressionStatement(expression(exprStmt.testlist_star_expr(0)), line);
            }
            return new PythonAst.SimpleStatement("assign", line);
        }
        return new PythonAst.SimpleStatement(ctx.getStart().getText(), line);
    }

    // Expressions

    private PythonAst.Expression expression(ParserRuleContext ctx) {
        String text = ExpressionText.of(ctx, tokens);
        ParserRuleContext node = unwrap(ctx);

        if (node instanceof PythonParser.ComparisonContext comparison && !comparison.comp_op().isEmpty()) {
            List<String> operators = new ArrayList<>();
            for (PythonParser.Comp_opContext op : comparison.comp_op()) {
                operators.add(operatorText(op));
            }
            List<PythonAst.Expression> comparators = new ArrayList<>();
            for (int i = 1; i < comparison.expr().size(); i++) {
                comparators.add(expression(comparison.expr(i)));
            }
            return new PythonAst.Compare(expression(comparison.expr(0)), operators, comparators, text);
        }

        if (node instanceof PythonParser.AtomContext atom) {
            if (atom.NAME() != null) {
                return new PythonAst.Name(atom.NAME().getText(), text);
            }
            if (!atom.STRING().isEmpty()) {
                List<String> pieces = atom.STRING().stream().map(TerminalNode::getText).toList();
                String value = StringLiterals.evaluate(pieces);
                if (value != null) {
                    return new PythonAst.StringLiteral(value, text);
                }
            }
        }

        return new PythonAst.OtherExpression(text);
    }

    /**
     * Descends through single-child wrapper rules and redundant parentheses to the node that
     * determines what kind of expression this is.
     */
    private static ParserRuleContext unwrap(ParserRuleContext ctx) {
        ParserRuleContext current = ctx;
        while (true) {
            if (current.getChildCount() == 1 && current.getChild(0) instanceof ParserRuleContext child) {
                current = child;
            } else if (current instanceof PythonParser.AtomContext atom
                && atom.OPEN_PAREN() != null
                && atom.testlist_comp() != null
                && atom.testlist_comp().getChildCount() == 1
                && atom.testlist_comp().getChild(0) instanceof PythonParser.Named_testContext inner) {
                current = inner;
            } else {
                return current;
            }
        }
    }

    private static String operatorText(PythonParser.Comp_opContext op) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < op.getChildCount(); i++) {
            ParseTree child = op.getChild(i);
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(child.getText());
        }
        return text.toString();
    }
}
