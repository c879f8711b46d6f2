package me.christianrobert.pyibackport.transformer.model;

/**
 * Variance of an ordinary type parameter, with the keyword argument it is declared by.
 */
public enum Variance {

    INVARIANT(null),
    COVARIANT("covariant"),
    CONTRAVARIANT("contravariant"),
    INFERRED("infer_variance");

    private final String keyword;

    Variance(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Keyword argument of {@code TypeVar(...)} that declares this variance, or null for invariant.
     */
    public String getKeyword() {
        return keyword;
    }

    /**
     * Variance suggested by the naming convention of a type parameter:
     * {@code _co} covariant, {@code _contra} contravariant, anything else inferred.
     */
    public static Variance fromNameSuffix(String name) {
        if (name.endsWith("_contra")) {
            return CONTRAVARIANT;
        }
        if (name.endsWith("_co")) {
            return COVARIANT;
        }
        return INFERRED;
    }
}
