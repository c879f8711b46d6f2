package me.christianrobert.pyibackport.transformer.catalog;

/**
 * Why a standard-library symbol needs a replacement on older targets.
 */
public enum BackportKind {
    /**
     * Newer symbol that typing_extensions (or another compatibility module) provides for older versions.
     */
    COMPATIBILITY_MODULE,

    /**
     * Symbol that does not exist before a version, replaced by the closest older equivalent.
     */
    STDLIB_RELOCATION,

    /**
     * Deprecated typing alias, always replaced by the symbol it aliases.
     */
    DEPRECATED_ALIAS
}
