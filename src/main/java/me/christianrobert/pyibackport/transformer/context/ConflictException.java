package me.christianrobert.pyibackport.transformer.context;

/**
 * Raised when the input contradicts itself, e.g. two declarations in one module that use the
 * same type parameter name with different bounds.
 */
public class ConflictException extends StubTransformationException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, String stubSource, String context) {
        super(message, stubSource, context);
    }

    @Override
    public String getKind() {
        return "ConflictError";
    }
}
