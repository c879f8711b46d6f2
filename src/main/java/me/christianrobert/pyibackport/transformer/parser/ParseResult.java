package me.christianrobert.pyibackport.transformer.parser;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import org.antlr.v4.runtime.CommonTokenStream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing a stub file.
 * Contains the parse tree, the full token stream (hidden tokens included) and any syntax errors.
 */
public class ParseResult {

    private final PyStubParser.ModuleContext tree;
    private final CommonTokenStream tokens;
    private final List<String> errors;
    private final String source;

    public ParseResult(PyStubParser.ModuleContext tree, CommonTokenStream tokens, List<String> errors, String source) {
        this.tree = tree;
        this.tokens = tokens;
        this.errors = new ArrayList<>(errors);
        this.source = source;
    }

    /**
     * Gets the ANTLR parse tree root node.
     */
    public PyStubParser.ModuleContext getTree() {
        return tree;
    }

    /**
     * Gets the token stream the tree was parsed from. Rewrites are applied to this stream.
     */
    public CommonTokenStream getTokens() {
        return tokens;
    }

    /**
     * Gets the list of syntax errors encountered during lexing and parsing.
     */
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Gets the original stub source that was parsed.
     */
    public String getSource() {
        return source;
    }

    /**
     * Checks if parsing was successful (no errors).
     */
    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /**
     * Checks if parsing encountered errors.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }
}
