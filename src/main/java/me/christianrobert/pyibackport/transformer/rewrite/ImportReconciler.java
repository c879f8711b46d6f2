package me.christianrobert.pyibackport.transformer.rewrite;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.imports.ImportDelta;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.TokenStreamRewriter;
import org.antlr.v4.runtime.misc.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Applies an {@link ImportDelta} to the from-imports of a module.
 *
 * <p><b>Existing statements</b> ({@code from m import ...}, not relative, not a wildcard):</p>
 * <ul>
 *   <li>names scheduled for removal are dropped</li>
 *   <li>names to add from {@code m} go to the first module-level statement importing from {@code m}</li>
 *   <li>a statement left without names is removed with its line; when that would leave an
 *       indented block without statements, its first line becomes {@code ...}</li>
 *   <li>a changed statement lists its names sorted, keeping {@code as} clauses and the one-line
 *       or parenthesized multi-line layout</li>
 * </ul>
 *
 * <p><b>New statements</b>: one per module still missing, in module order, at the
 * {@link ImportInsertionPoint} of that module.</p>
 */
class ImportReconciler {

    private static final Logger log = LoggerFactory.getLogger(ImportReconciler.class);

    private static final Comparator<ImportedName> NAME_ORDER =
            Comparator.comparing((ImportedName n) -> n.name).thenComparing(n -> n.alias == null ? "" : n.alias);

    private final ImportDelta delta;
    private final TokenStream tokens;
    private final TokenStreamRewriter rewriter;
    private final InsertionQueue insertions;
    private final String lineEnding;

    /**
     * One entry of an import list, with its original text ({@code A as B}).
     */
    private static class ImportedName {
        final String name;
        final String alias;
        final String text;

        ImportedName(String name, String alias, String text) {
            this.name = name;
            this.alias = alias;
            this.text = text;
        }
    }

    ImportReconciler(ImportDelta delta, TokenStream tokens, TokenStreamRewriter rewriter, InsertionQueue insertions,
                     String lineEnding) {
        this.delta = delta;
        this.tokens = tokens;
        this.rewriter = rewriter;
        this.insertions = insertions;
        this.lineEnding = lineEnding;
    }

    /**
     * @param fromImports the module-level from-imports, in document order
     */
    void reconcile(PyStubParser.ModuleContext module, List<PyStubParser.ImportFromContext> fromImports) {
        if (delta.isEmpty()) {
            return;
        }

        Map<String, SortedSet<String>> pending = new TreeMap<>();
        for (ModuleSymbol addition : delta.getAdditions()) {
            pending.computeIfAbsent(addition.getModule(), m -> new TreeSet<>()).add(addition.getSymbol());
        }

        Set<PyStubParser.SmallStatementContext> emptied = new LinkedHashSet<>();
        for (PyStubParser.ImportFromContext ctx : fromImports) {
            String importModule = ctx.relativeModule().getText();
            PyStubParser.ImportAsNamesContext names = ctx.importTargets().importAsNames();
            if (names == null || importModule.startsWith(".")) {
                continue;
            }

            List<ImportedName> kept = new ArrayList<>();
            for (PyStubParser.ImportAsNameContext importAsName : names.importAsName()) {
                String name = importAsName.name(0).getText();
                String alias = importAsName.name().size() > 1 ? importAsName.name(1).getText() : null;
                if (!delta.isDeleted(importModule, name, alias)) {
                    kept.add(new ImportedName(name, alias, originalText(importAsName)));
                }
            }

            SortedSet<String> added = null;
            if (isTopLevel(ctx)) {
                added = pending.remove(importModule);
            }
            if (added == null && kept.size() == names.importAsName().size()) {
                continue;
            }

            if (added != null) {
                for (String name : added) {
                    kept.add(new ImportedName(name, null, name));
                }
            }

            if (kept.isEmpty()) {
                log.trace("Removing emptied import from {}", importModule);
                emptied.add((PyStubParser.SmallStatementContext) ctx.getParent());
            } else {
                kept.sort(NAME_ORDER);
                rewriter.replace(names.getStart(), names.getStop(), join(kept, ctx));
                log.trace("Rewrote import from {}: {} names", importModule, kept.size());
            }
        }

        removeAll(emptied);

        for (Map.Entry<String, SortedSet<String>> entry : pending.entrySet()) {
            String text = "from " + entry.getKey() + " import " + String.join(", ", entry.getValue()) + lineEnding;
            ImportInsertionPoint point = ImportInsertionPoint.find(module, entry.getKey(), tokens);
            insertions.insertBefore(point.getTokenIndex(), point.needsLineBreak() ? lineEnding + text : text);
            log.trace("Adding import: {}", text.trim());
        }
    }

    private String join(List<ImportedName> names, PyStubParser.ImportFromContext ctx) {
        PyStubParser.ImportAsNamesContext original = ctx.importTargets().importAsNames();
        String separator = ", ";
        boolean parenthesized = ctx.importTargets().getToken(PyStubParser.OPEN_PAREN, 0) != null;
        if (parenthesized && original.getStart().getLine() != original.getStop().getLine()) {
            separator = "," + lineEnding + " ".repeat(original.getStart().getCharPositionInLine());
        }

        List<String> texts = new ArrayList<>();
        for (ImportedName name : names) {
            texts.add(name.text);
        }
        return String.join(separator, texts);
    }

    /**
     * Removes emptied imports, line by line. A line losing all its statements is removed as a
     * whole, otherwise only the statements and their semicolons go.
     */
    private void removeAll(Set<PyStubParser.SmallStatementContext> emptied) {
        Map<PyStubParser.SimpleStatementsContext, List<PyStubParser.SmallStatementContext>> byLine =
                new LinkedHashMap<>();
        for (PyStubParser.SmallStatementContext small : emptied) {
            byLine.computeIfAbsent((PyStubParser.SimpleStatementsContext) small.getParent(), l -> new ArrayList<>())
                    .add(small);
        }

        Set<PyStubParser.BlockContext> placeholders = new HashSet<>();
        for (Map.Entry<PyStubParser.SimpleStatementsContext, List<PyStubParser.SmallStatementContext>> entry
                : byLine.entrySet()) {
            PyStubParser.SimpleStatementsContext line = entry.getKey();
            List<PyStubParser.SmallStatementContext> smalls = line.smallStatement();
            if (entry.getValue().size() < smalls.size()) {
                removeStatements(smalls, entry.getValue());
                continue;
            }

            PyStubParser.BlockContext block = enclosingBlock(line);
            if (block != null && isEmptied(block, byLine) && placeholders.add(block)) {
                // the block keeps one statement
                rewriter.replace(smalls.get(0).getStart(), smalls.get(smalls.size() - 1).getStop(), "...");
            } else if (line.getParent() instanceof PyStubParser.BlockContext) {
                // "if c: from m import x" cannot lose its only line
                rewriter.replace(smalls.get(0).getStart(), smalls.get(smalls.size() - 1).getStop(), "...");
            } else {
                int start = lineStart(line.getStart().getTokenIndex());
                rewriter.delete(start, line.NEWLINE().getSymbol().getTokenIndex());
            }
        }
    }

    /**
     * Removes some statements of a line that keeps at least one.
     */
    private void removeStatements(List<PyStubParser.SmallStatementContext> smalls,
                                  List<PyStubParser.SmallStatementContext> removed) {
        int lastKept = -1;
        for (int i = 0; i < smalls.size(); i++) {
            if (!removed.contains(smalls.get(i))) {
                lastKept = i;
            }
        }

        for (int i = 0; i < lastKept; i++) {
            if (removed.contains(smalls.get(i))) {
                // "a; b" -> "b"
                int next = smalls.get(i + 1).getStart().getTokenIndex();
                rewriter.delete(smalls.get(i).getStart().getTokenIndex(), next - 1);
            }
        }
        if (lastKept < smalls.size() - 1) {
            // "a; b" -> "a"
            int previous = smalls.get(lastKept).getStop().getTokenIndex();
            rewriter.delete(previous + 1, smalls.get(smalls.size() - 1).getStop().getTokenIndex());
        }
    }

    /**
     * The indented block a line belongs to, or null for a module-level line.
     */
    private static PyStubParser.BlockContext enclosingBlock(PyStubParser.SimpleStatementsContext line) {
        ParserRuleContext parent = line.getParent();
        if (parent instanceof PyStubParser.StatementContext && parent.getParent() instanceof PyStubParser.BlockContext) {
            return (PyStubParser.BlockContext) parent.getParent();
        }
        return null;
    }

    /**
     * Whether every statement of the block is a line whose statements are all removed.
     */
    private static boolean isEmptied(PyStubParser.BlockContext block,
                                     Map<PyStubParser.SimpleStatementsContext, List<PyStubParser.SmallStatementContext>> byLine) {
        for (PyStubParser.StatementContext statement : block.statement()) {
            PyStubParser.SimpleStatementsContext line = statement.simpleStatements();
            if (line == null || !byLine.containsKey(line)
                    || byLine.get(line).size() < line.smallStatement().size()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Index of the first token of the physical line, so that deleting an indented statement
     * also deletes its indentation.
     */
    private int lineStart(int index) {
        int start = index;
        while (start > 0) {
            Token previous = tokens.get(start - 1);
            boolean indentation = previous.getType() == PyStubParser.WS
                    || previous.getType() == PyStubParser.INDENT
                    || previous.getType() == PyStubParser.DEDENT;
            if (!indentation) {
                break;
            }
            start--;
        }
        return start;
    }

    private String originalText(ParserRuleContext ctx) {
        return tokens.getText(Interval.of(ctx.getStart().getTokenIndex(), ctx.getStop().getTokenIndex()));
    }

    private static boolean isTopLevel(PyStubParser.ImportFromContext ctx) {
        ParserRuleContext statement = ctx.getParent().getParent().getParent();
        return statement.getParent() instanceof PyStubParser.ModuleContext;
    }
}
