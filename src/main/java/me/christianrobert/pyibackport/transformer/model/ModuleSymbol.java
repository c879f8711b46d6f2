package me.christianrobert.pyibackport.transformer.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A symbol exported by a module, e.g. {@code typing_extensions.TypeVar}.
 * Ordered by module, then symbol, which is the order new import statements are written in.
 */
public final class ModuleSymbol implements Comparable<ModuleSymbol> {

    public static final String TYPING = "typing";
    public static final String TYPING_EXTENSIONS = "typing_extensions";
    public static final String BUILTINS = "builtins";

    private static final Comparator<ModuleSymbol> ORDER =
            Comparator.comparing(ModuleSymbol::getModule).thenComparing(ModuleSymbol::getSymbol);

    private final String module;
    private final String symbol;

    public ModuleSymbol(String module, String symbol) {
        this.module = Objects.requireNonNull(module, "module");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
    }

    public static ModuleSymbol typing(String symbol) {
        return new ModuleSymbol(TYPING, symbol);
    }

    public static ModuleSymbol typingExtensions(String symbol) {
        return new ModuleSymbol(TYPING_EXTENSIONS, symbol);
    }

    /**
     * Splits a fully-qualified name at its last dot ({@code "collections.abc.Buffer"}).
     */
    public static ModuleSymbol parse(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        if (dot <= 0 || dot == qualifiedName.length() - 1) {
            throw new IllegalArgumentException("Not a qualified name: " + qualifiedName);
        }
        return new ModuleSymbol(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1));
    }

    public String getModule() {
        return module;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getQualifiedName() {
        return module + "." + symbol;
    }

    /**
     * The same symbol from the other typing module, if this one is from typing or typing_extensions.
     */
    public ModuleSymbol inOtherTypingModule() {
        if (TYPING.equals(module)) {
            return typingExtensions(symbol);
        }
        if (TYPING_EXTENSIONS.equals(module)) {
            return typing(symbol);
        }
        return null;
    }

    @Override
    public int compareTo(ModuleSymbol other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleSymbol)) return false;
        ModuleSymbol that = (ModuleSymbol) o;
        return module.equals(that.module) && symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, symbol);
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }
}
