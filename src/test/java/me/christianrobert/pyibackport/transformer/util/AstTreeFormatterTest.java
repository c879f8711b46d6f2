package me.christianrobert.pyibackport.transformer.util;

import me.christianrobert.pyibackport.transformer.catalog.BackportCatalog;
import me.christianrobert.pyibackport.transformer.catalog.DenylistCatalog;
import me.christianrobert.pyibackport.transformer.collect.CollectionResult;
import me.christianrobert.pyibackport.transformer.collect.StubCollector;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import me.christianrobert.pyibackport.transformer.parser.AntlrParser;
import me.christianrobert.pyibackport.transformer.parser.ParseResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AstTreeFormatterTest {

    private final AntlrParser parser = new AntlrParser();

    @Test
    void formatsRulesAndTokens() {
        ParseResult parsed = parser.parseModule("x: int\n");

        String tree = AstTreeFormatter.format(parsed.getTree());

        // two children (statement and EOF), so the module line carries a text snippet
        assertTrue(tree.startsWith("Module [x:int\\n<EOF>]\n"), tree);
        assertTrue(tree.contains("\n  Statement"), tree);
        assertTrue(tree.contains("\"int\" (NAME)"), tree);
        assertTrue(tree.contains("(EOF)"), tree);
    }

    @Test
    void namesLayoutTokens() {
        ParseResult parsed = parser.parseModule("class A:\n    x: int\n");

        String tree = AstTreeFormatter.format(parsed.getTree());

        assertTrue(tree.contains("\"\" (INDENT)"), tree);
        assertTrue(tree.contains("\"\" (DEDENT)"), tree);
    }

    @Test
    void marksLoweredAndKeptDeclarations() {
        String source = "class A[T = int]: ...\ndef f[U](x: U) -> U: ...\n";
        ParseResult parsed = parser.parseModule(source);
        CollectionResult collection = new StubCollector(PythonVersion.PY312, new BackportCatalog(), new DenylistCatalog())
                .collect(parsed.getTree());

        String tree = AstTreeFormatter.format(parsed.getTree(), collection);

        assertTrue(tree.contains("ClassDef [LOWERED: T]"), tree);
        assertTrue(tree.contains("FunctionDef [KEPT: U]"), tree);
    }

    @Test
    void nullTree() {
        assertEquals("(null tree)", AstTreeFormatter.format(null));
    }
}
