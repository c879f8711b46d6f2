package me.christianrobert.pyibackport.transformer.parser;

import me.christianrobert.pyibackport.antlr.PyStubLexer;
import me.christianrobert.pyibackport.antlr.PyStubParser;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenFactory;
import org.antlr.v4.runtime.TokenSource;
import org.antlr.v4.runtime.WritableToken;
import org.antlr.v4.runtime.misc.Pair;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Wraps the generated PyStubLexer and adds Python's layout tokens.
 *
 * <p>The raw lexer emits every line break as NEWLINE. This source decides which ones end a
 * logical line:
 * <ul>
 *   <li>the first NEWLINE after a statement stays on the default channel</li>
 *   <li>NEWLINEs inside brackets, on blank lines and after comment-only lines move to the hidden channel</li>
 * </ul>
 *
 * <p>INDENT and DEDENT are zero-width tokens (empty text) inserted before the first token of a
 * logical line whose indentation differs from the enclosing block. At end of input a synthetic
 * empty NEWLINE closes an unterminated last line, followed by the pending DEDENTs.
 *
 * <p>No character of the input is dropped: hidden tokens keep the exact text, so rendering the
 * token stream reproduces the source.
 */
public class PyStubTokenSource implements TokenSource {

    private static final int TAB_SIZE = 8;

    private final PyStubLexer lexer;
    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int openBrackets;
    private boolean atLineStart = true;

    private int currentLine = -1;
    private int lineIndent;
    private boolean measuringIndent;

    public PyStubTokenSource(PyStubLexer lexer) {
        this.lexer = lexer;
        this.indents.push(0);
    }

    @Override
    public Token nextToken() {
        if (!pending.isEmpty()) {
            return pending.poll();
        }

        Token token = lexer.nextToken();
        if (token.getType() == Token.EOF) {
            return finish(token);
        }

        trackIndentation(token);

        if (token.getChannel() != Token.DEFAULT_CHANNEL) {
            return token;
        }

        switch (token.getType()) {
            case PyStubLexer.NEWLINE -> {
                if (openBrackets > 0 || atLineStart) {
                    ((WritableToken) token).setChannel(Token.HIDDEN_CHANNEL);
                } else {
                    atLineStart = true;
                }
                return token;
            }
            case PyStubLexer.OPEN_PAREN, PyStubLexer.OPEN_BRACK, PyStubLexer.OPEN_BRACE -> openBrackets++;
            case PyStubLexer.CLOSE_PAREN, PyStubLexer.CLOSE_BRACK, PyStubLexer.CLOSE_BRACE -> {
                if (openBrackets > 0) {
                    openBrackets--;
                }
            }
            default -> {
            }
        }

        if (atLineStart) {
            atLineStart = false;
            emitIndentation(token);
        }
        pending.add(token);
        return pending.poll();
    }

    private void trackIndentation(Token token) {
        if (token.getLine() != currentLine) {
            currentLine = token.getLine();
            lineIndent = 0;
            measuringIndent = true;
        }
        if (!measuringIndent) {
            return;
        }

        int type = token.getType();
        if (type == PyStubLexer.WS) {
            for (char c : token.getText().toCharArray()) {
                if (c == '\t') {
                    lineIndent = (lineIndent / TAB_SIZE + 1) * TAB_SIZE;
                } else if (c == '\f') {
                    lineIndent = 0;
                } else {
                    lineIndent++;
                }
            }
        } else if (type != PyStubLexer.BOM) {
            measuringIndent = false;
        }
    }

    private void emitIndentation(Token first) {
        int width = lineIndent;
        if (width > indents.peek()) {
            indents.push(width);
            pending.add(layoutToken(PyStubParser.INDENT, first));
            return;
        }

        while (width < indents.peek()) {
            indents.pop();
            pending.add(layoutToken(PyStubParser.DEDENT, first));
        }
        if (width != indents.peek()) {
            lexer.getErrorListenerDispatch().syntaxError(lexer, first, first.getLine(),
                    first.getCharPositionInLine(), "unindent does not match any outer indentation level", null);
        }
    }

    private Token finish(Token eof) {
        if (!atLineStart) {
            atLineStart = true;
            pending.add(layoutToken(PyStubLexer.NEWLINE, eof));
        }
        while (indents.peek() > 0) {
            indents.pop();
            pending.add(layoutToken(PyStubParser.DEDENT, eof));
        }
        pending.add(eof);
        return pending.poll();
    }

    private Token layoutToken(int type, Token anchor) {
        CommonToken token = new CommonToken(new Pair<>(this, lexer.getInputStream()), type,
                Token.DEFAULT_CHANNEL, anchor.getStartIndex(), anchor.getStartIndex() - 1);
        token.setText("");
        token.setLine(anchor.getLine());
        token.setCharPositionInLine(anchor.getCharPositionInLine());
        return token;
    }

    @Override
    public int getLine() {
        return lexer.getLine();
    }

    @Override
    public int getCharPositionInLine() {
        return lexer.getCharPositionInLine();
    }

    @Override
    public CharStream getInputStream() {
        return lexer.getInputStream();
    }

    @Override
    public String getSourceName() {
        return lexer.getSourceName();
    }

    @Override
    public void setTokenFactory(TokenFactory<?> factory) {
        lexer.setTokenFactory(factory);
    }

    @Override
    public TokenFactory<?> getTokenFactory() {
        return lexer.getTokenFactory();
    }
}
