package me.christianrobert.pyibackport.transformer.parser;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.context.StubTransformationException;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the stub parser and the layout tokens of PyStubTokenSource.
 */
class AntlrParserTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    @Test
    void parseEmptyModule() {
        ParseResult result = parser.parseModule("");

        assertTrue(result.isSuccess());
        assertNotNull(result.getTree());
        assertTrue(result.getTree().statement().isEmpty());
    }

    @Test
    void parseCommentsAndBlankLinesOnly() {
        ParseResult result = parser.parseModule("# just a comment\n\n   \n# another\n");

        assertTrue(result.isSuccess(), "Comment-only input should parse: " + result.getErrorMessage());
        assertTrue(result.getTree().statement().isEmpty());
    }

    @Test
    void parseFunctionAndClass() {
        String source = """
                from typing import overload

                class Box[T](Base, metaclass=Meta):
                    value: T
                    @overload
                    def get(self) -> T: ...
                    @overload
                    def get(self, default: T) -> T: ...

                def spam[T: (int, str), *Ts, **P](x: T, *args: *Ts) -> T: ...
                """;

        ParseResult result = parser.parseModule(source);

        assertTrue(result.isSuccess(), "Parsing should succeed: " + result.getErrorMessage());
        assertEquals(3, result.getTree().statement().size());
    }

    @Test
    void parseTypeAliasAndTypeAsName() {
        ParseResult result = parser.parseModule("type Pair[T] = tuple[T, T]\ntype: int\n");

        assertTrue(result.isSuccess(), "Parsing should succeed: " + result.getErrorMessage());
        PyStubParser.SmallStatementContext first = result.getTree().statement(0).simpleStatements().smallStatement(0);
        PyStubParser.SmallStatementContext second = result.getTree().statement(1).simpleStatements().smallStatement(0);
        assertNotNull(first.typeAlias());
        assertNotNull(second.annAssign());
    }

    @Test
    void tokenStreamReproducesInput() {
        String source = "import sys  # comment\n"
                + "from typing import (\n"
                + "    Any,\n"
                + "    List,\n"
                + ")\n"
                + "\n"
                + "if sys.version_info >= (3, 10):\n"
                + "\tdef f(x: int, \\\n"
                + "\t      y: str) -> None: ...\n"
                + "x: int";

        ParseResult result = parser.parseModule(source);

        assertTrue(result.isSuccess(), "Parsing should succeed: " + result.getErrorMessage());
        assertEquals(source, result.getTokens().getText());
    }

    @Test
    void indentAndDedentAreEmitted() {
        ParseResult result = parser.parseModule("class A:\n    x: int\n    y: int\nz: int\n");

        assertTrue(result.isSuccess());
        int indents = 0;
        int dedents = 0;
        for (Token token : result.getTokens().getTokens()) {
            if (token.getType() == PyStubParser.INDENT) {
                indents++;
            }
            if (token.getType() == PyStubParser.DEDENT) {
                dedents++;
            }
        }
        assertEquals(1, indents);
        assertEquals(1, dedents);
    }

    @Test
    void missingFinalNewlineGetsSyntheticNewline() {
        ParseResult result = parser.parseModule("x: int");

        assertTrue(result.isSuccess());
        Token newline = result.getTree().statement(0).simpleStatements().NEWLINE().getSymbol();
        assertEquals("", newline.getText());
    }

    @Test
    void syntaxErrorIsReported() {
        ParseResult result = parser.parseModule("def (x): ...\n");

        assertTrue(result.hasErrors());
        assertNotNull(result.getErrorMessage());
        assertTrue(result.getErrorMessage().startsWith("Line 1:"));
    }

    @Test
    void inconsistentDedentIsReported() {
        ParseResult result = parser.parseModule("class A:\n        x: int\n    y: int\n");

        assertTrue(result.hasErrors());
    }

    @Test
    void nullSourceIsRejected() {
        assertThrows(StubTransformationException.class, () -> parser.parseModule(null));
    }
}
