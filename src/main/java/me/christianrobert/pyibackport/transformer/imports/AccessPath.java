package me.christianrobert.pyibackport.transformer.imports;

import java.util.Objects;

/**
 * How a dotted access expression reaches an import.
 *
 * <p>Example: with {@code import collections.abc as cabc}, the expression {@code cabc.Set.x}
 * has alias {@code cabc}, import {@code collections.abc} and member path {@code Set.x}.
 * Unimported builtins resolve with import {@code builtins} and an empty alias.
 */
public final class AccessPath {

    private final String alias;
    private final String importFqn;
    private final String memberPath;

    public AccessPath(String alias, String importFqn, String memberPath) {
        this.alias = Objects.requireNonNull(alias, "alias");
        this.importFqn = Objects.requireNonNull(importFqn, "importFqn");
        this.memberPath = memberPath;
    }

    /**
     * Local spelling of the import in the expression, empty for implicit builtins.
     */
    public String getAlias() {
        return alias;
    }

    /**
     * Fully-qualified name of the imported module or symbol.
     */
    public String getImportFqn() {
        return importFqn;
    }

    /**
     * Dotted attribute path after the import alias, or null when the expression is the alias itself.
     */
    public String getMemberPath() {
        return memberPath;
    }

    /**
     * Fully-qualified name of the whole access expression.
     */
    public String getQualifiedName() {
        return memberPath == null ? importFqn : importFqn + "." + memberPath;
    }

    /**
     * Number of dotted components the alias occupies in the expression.
     */
    public int getAliasLength() {
        return alias.isEmpty() ? 0 : alias.split("\\.").length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccessPath)) return false;
        AccessPath that = (AccessPath) o;
        return alias.equals(that.alias) && importFqn.equals(that.importFqn)
                && Objects.equals(memberPath, that.memberPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, importFqn, memberPath);
    }

    @Override
    public String toString() {
        return "AccessPath{" + alias + " = " + importFqn + (memberPath == null ? "" : " -> " + memberPath) + "}";
    }
}
