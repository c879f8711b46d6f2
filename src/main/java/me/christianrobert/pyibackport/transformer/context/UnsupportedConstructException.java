package me.christianrobert.pyibackport.transformer.context;

/**
 * Raised for legal stub constructs the backport does not handle, such as nested imports,
 * conflicting import aliases, starred or denylisted base classes.
 */
public class UnsupportedConstructException extends StubTransformationException {

    public UnsupportedConstructException(String message) {
        super(message);
    }

    public UnsupportedConstructException(String message, String stubSource, String context) {
        super(message, stubSource, context);
    }

    @Override
    public String getKind() {
        return "UnsupportedConstruct";
    }
}
