package me.christianrobert.pyibackport.transformer.context;

/**
 * Raised for constructs that are valid Python but have no place in a stub file:
 * executable statements, quoted annotations, module-level {@code __getattr__}, {@code __future__} imports.
 */
public class PolicyViolationException extends StubTransformationException {

    public PolicyViolationException(String message) {
        super(message);
    }

    public PolicyViolationException(String message, String stubSource, String context) {
        super(message, stubSource, context);
    }

    @Override
    public String getKind() {
        return "PolicyViolation";
    }
}
