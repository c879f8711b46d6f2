package me.christianrobert.pyibackport.transformer.context;

/**
 * Base class of every error raised while backporting a stub file.
 * Captures the offending source fragment and where in the file it was found.
 *
 * <p>Subclasses name the kind of failure: {@link PolicyViolationException},
 * {@link UnsupportedConstructException}, {@link ConflictException} and
 * {@link StubSyntaxException}. None of them is recovered from internally; a failed run
 * produces no output.
 */
public class StubTransformationException extends RuntimeException {

    private final String stubSource;
    private final String context;

    public StubTransformationException(String message) {
        super(message);
        this.stubSource = null;
        this.context = null;
    }

    public StubTransformationException(String message, Throwable cause) {
        super(message, cause);
        this.stubSource = null;
        this.context = null;
    }

    public StubTransformationException(String message, String stubSource, String context) {
        super(message);
        this.stubSource = stubSource;
        this.context = context;
    }

    public StubTransformationException(String message, String stubSource, String context, Throwable cause) {
        super(message, cause);
        this.stubSource = stubSource;
        this.context = context;
    }

    public String getStubSource() {
        return stubSource;
    }

    public String getContext() {
        return context;
    }

    /**
     * Short name of the failure kind, used in results and CLI messages.
     */
    public String getKind() {
        return "TransformationError";
    }

    /**
     * Gets a detailed error message including the stub fragment and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getKind()).append(": ").append(getMessage());
        if (stubSource != null) {
            sb.append("\nStub source: ").append(stubSource);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
