package me.christianrobert.pyibackport.transformer.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when the input cannot be parsed as stub syntax.
 */
public class StubSyntaxException extends StubTransformationException {

    private final List<String> syntaxErrors;

    public StubSyntaxException(String message, List<String> syntaxErrors) {
        super(message);
        this.syntaxErrors = new ArrayList<>(syntaxErrors);
    }

    public List<String> getSyntaxErrors() {
        return Collections.unmodifiableList(syntaxErrors);
    }

    @Override
    public String getKind() {
        return "SyntaxError";
    }
}
