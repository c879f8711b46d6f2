package me.christianrobert.pyibackport.transformer.rewrite;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.util.NameChains;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;

import java.util.List;

/**
 * Where a new {@code from module import ...} statement goes.
 *
 * <p>The <i>import run</i> is the block of consecutive import statements starting at the first
 * module-level import before any compound statement. A new statement for module {@code M} is
 * inserted:
 * <ul>
 *   <li>before the first from-import in the run that is relative or imports from a module sorting after {@code M}</li>
 *   <li>otherwise after the last statement of the run</li>
 *   <li>without a run: after a leading docstring, or before the first statement</li>
 * </ul>
 * It is never appended at the end of the file unless the file has no statements at all.
 */
final class ImportInsertionPoint {

    private final int tokenIndex;
    private final boolean needsLineBreak;

    private ImportInsertionPoint(int tokenIndex, boolean needsLineBreak) {
        this.tokenIndex = tokenIndex;
        this.needsLineBreak = needsLineBreak;
    }

    /**
     * Token index to insert before.
     */
    int getTokenIndex() {
        return tokenIndex;
    }

    /**
     * Whether the statement follows a last line without line break, so the inserted text must start with one.
     */
    boolean needsLineBreak() {
        return needsLineBreak;
    }

    static ImportInsertionPoint find(PyStubParser.ModuleContext module, String importModule, TokenStream tokens) {
        List<PyStubParser.StatementContext> statements = module.statement();

        int runStart = importRunStart(statements);
        if (runStart >= 0) {
            int runEnd = importRunEnd(statements, runStart);
            for (int i = runStart; i <= runEnd; i++) {
                PyStubParser.StatementContext statement = statements.get(i);
                for (PyStubParser.SmallStatementContext small : statement.simpleStatements().smallStatement()) {
                    if (small.importFrom() == null) {
                        continue;
                    }
                    String other = small.importFrom().relativeModule().getText();
                    if (other.startsWith(".") || other.compareTo(importModule) > 0) {
                        return before(statement);
                    }
                }
            }
            return after(statements.get(runEnd));
        }

        if (statements.isEmpty()) {
            return new ImportInsertionPoint(tokens.size() - 1, false);
        }
        if (isDocstring(statements.get(0))) {
            return after(statements.get(0));
        }
        return before(statements.get(0));
    }

    /**
     * Index of the first statement of the import run, or -1 when there is none.
     */
    static int importRunStart(List<PyStubParser.StatementContext> statements) {
        for (int i = 0; i < statements.size(); i++) {
            PyStubParser.StatementContext statement = statements.get(i);
            if (statement.compoundStatement() != null) {
                return -1;
            }
            if (isImportStatement(statement)) {
                return i;
            }
        }
        return -1;
    }

    static int importRunEnd(List<PyStubParser.StatementContext> statements, int runStart) {
        int runEnd = runStart;
        while (runEnd + 1 < statements.size() && isImportStatement(statements.get(runEnd + 1))) {
            runEnd++;
        }
        return runEnd;
    }

    static ImportInsertionPoint before(PyStubParser.StatementContext statement) {
        return new ImportInsertionPoint(statement.getStart().getTokenIndex(), false);
    }

    /**
     * Right after a statement: past the NEWLINE of a simple statement line, or past the last
     * token (usually a DEDENT) of a compound statement.
     */
    static ImportInsertionPoint after(PyStubParser.StatementContext statement) {
        Token last = statement.simpleStatements() != null
                ? statement.simpleStatements().NEWLINE().getSymbol()
                : statement.getStop();
        boolean unterminated = last.getType() == PyStubParser.NEWLINE && last.getText().isEmpty();
        return new ImportInsertionPoint(last.getTokenIndex() + 1, unterminated);
    }

    static boolean isImportStatement(PyStubParser.StatementContext statement) {
        if (statement.simpleStatements() == null) {
            return false;
        }
        for (PyStubParser.SmallStatementContext small : statement.simpleStatements().smallStatement()) {
            if (small.importName() == null && small.importFrom() == null) {
                return false;
            }
        }
        return true;
    }

    static boolean isDocstring(PyStubParser.StatementContext statement) {
        if (statement.simpleStatements() == null || statement.simpleStatements().smallStatement().size() != 1) {
            return false;
        }
        PyStubParser.ExpressionStatementContext expression =
                statement.simpleStatements().smallStatement(0).expressionStatement();
        if (expression == null || expression.starExpressions() == null
                || expression.starExpressions().starExpr().size() != 1) {
            return false;
        }
        PyStubParser.ExprContext expr = expression.starExpressions().starExpr(0).expr();
        return NameChains.isStringLiteral(expr);
    }
}
