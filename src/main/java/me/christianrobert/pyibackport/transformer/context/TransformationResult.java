package me.christianrobert.pyibackport.transformer.context;

/**
 * Result of a backport operation.
 * Contains either the rewritten stub source or an error message with its kind.
 * Optionally includes the parse tree dump for debugging.
 */
public class TransformationResult {

    private final boolean success;
    private final String stubSource;
    private final String transformedSource;
    private final String targetVersion;
    private final String errorKind;
    private final String errorMessage;
    private final String astTree;  // Optional parse tree representation (null by default)

    private TransformationResult(boolean success, String stubSource, String transformedSource, String targetVersion,
                                 String errorKind, String errorMessage, String astTree) {
        this.success = success;
        this.stubSource = stubSource;
        this.transformedSource = transformedSource;
        this.targetVersion = targetVersion;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.astTree = astTree;
    }

    /**
     * Creates a successful transformation result.
     */
    public static TransformationResult success(String stubSource, String transformedSource, String targetVersion) {
        return new TransformationResult(true, stubSource, transformedSource, targetVersion, null, null, null);
    }

    /**
     * Creates a successful transformation result with the parse tree dump.
     */
    public static TransformationResult successWithAst(String stubSource, String transformedSource, String targetVersion,
                                                      String astTree) {
        return new TransformationResult(true, stubSource, transformedSource, targetVersion, null, null, astTree);
    }

    /**
     * Creates a failed transformation result.
     */
    public static TransformationResult failure(String stubSource, String errorMessage) {
        return new TransformationResult(false, stubSource, null, null, null, errorMessage, null);
    }

    /**
     * Creates a failed transformation result from a backport error.
     */
    public static TransformationResult failure(String stubSource, String targetVersion,
                                               StubTransformationException exception) {
        return new TransformationResult(false, stubSource, null, targetVersion, exception.getKind(),
                exception.getDetailedMessage(), null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getStubSource() {
        return stubSource;
    }

    public String getTransformedSource() {
        return transformedSource;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TransformationResult{success=true, target=" + targetVersion +
                   (astTree != null ? ", hasAstTree=true" : "") + "}";
        } else {
            return "TransformationResult{success=false, kind=" + errorKind + ", error='" + errorMessage + "'}";
        }
    }
}
