package me.christianrobert.pyibackport.transformer.rewrite;

import me.christianrobert.pyibackport.antlr.PyStubParser;

import java.util.List;

/**
 * Where the synthesized {@code TypeVar}-like declarations go.
 *
 * <p>All declarations of a module form one group, placed after the leading statements that
 * belong to the module header:
 * <ul>
 *   <li>a module docstring (first statement only)</li>
 *   <li>import lines</li>
 *   <li>conditional imports: an {@code if} whose block starts with an import</li>
 *   <li>the export list, {@code __all__ = [...]}</li>
 * </ul>
 * The scan stops at the first other statement. When nothing was scanned, the group goes after
 * the import run, or before the first statement.
 */
final class DeclarationInsertionPoint {

    private static final String EXPORT_LIST = "__all__";

    private DeclarationInsertionPoint() {
    }

    static ImportInsertionPoint find(PyStubParser.ModuleContext module) {
        List<PyStubParser.StatementContext> statements = module.statement();

        int last = -1;
        for (int i = 0; i < statements.size(); i++) {
            PyStubParser.StatementContext statement = statements.get(i);
            boolean header = (i == 0 && ImportInsertionPoint.isDocstring(statement))
                    || ImportInsertionPoint.isImportStatement(statement)
                    || isConditionalImport(statement)
                    || isExportList(statement);
            if (!header) {
                break;
            }
            last = i;
        }
        if (last >= 0) {
            return ImportInsertionPoint.after(statements.get(last));
        }

        int runStart = ImportInsertionPoint.importRunStart(statements);
        if (runStart >= 0) {
            return ImportInsertionPoint.after(statements.get(ImportInsertionPoint.importRunEnd(statements, runStart)));
        }
        // not empty: every declaration belongs to a statement
        return ImportInsertionPoint.before(statements.get(0));
    }

    private static boolean isConditionalImport(PyStubParser.StatementContext statement) {
        if (statement.compoundStatement() == null || statement.compoundStatement().ifStatement() == null) {
            return false;
        }
        PyStubParser.BlockContext block = statement.compoundStatement().ifStatement().block();
        PyStubParser.SimpleStatementsContext first = block.simpleStatements() != null
                ? block.simpleStatements()
                : block.statement(0).simpleStatements();
        if (first == null) {
            return false;
        }
        PyStubParser.SmallStatementContext small = first.smallStatement(0);
        return small.importName() != null || small.importFrom() != null;
    }

    private static boolean isExportList(PyStubParser.StatementContext statement) {
        if (statement.simpleStatements() == null || statement.simpleStatements().smallStatement().size() != 1) {
            return false;
        }
        PyStubParser.SmallStatementContext small = statement.simpleStatements().smallStatement(0);
        if (small.assignment() != null) {
            List<PyStubParser.StarExpressionsContext> sides = small.assignment().starExpressions();
            int targets = small.assignment().yieldExpr() != null ? sides.size() : sides.size() - 1;
            return targets == 1 && EXPORT_LIST.equals(sides.get(0).getText());
        }
        return small.annAssign() != null && EXPORT_LIST.equals(small.annAssign().expr().getText());
    }
}
