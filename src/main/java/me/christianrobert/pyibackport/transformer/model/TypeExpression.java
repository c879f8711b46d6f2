package me.christianrobert.pyibackport.transformer.model;

import org.antlr.v4.runtime.ParserRuleContext;

import java.util.Objects;

/**
 * An expression used inside a type parameter (bound, constraint or default).
 *
 * <p>Either points at a node of the parse tree, or references a module symbol that has to be
 * spelled out at render time (e.g. {@code builtins.object} replacing {@code Any}).
 * Two expressions are equal when their token text is equal, so {@code int|str} and
 * {@code int | str} compare equal.
 */
public final class TypeExpression {

    /**
     * What the expression denotes, as far as type parameter normalization cares.
     */
    public enum Meaning {
        /** {@code typing.Any} or {@code typing_extensions.Any}. */
        ANY,
        /** {@code builtins.object}. */
        OBJECT,
        OTHER
    }

    private final ParserRuleContext node;
    private final ModuleSymbol reference;
    private final String text;
    private final Meaning meaning;

    private TypeExpression(ParserRuleContext node, ModuleSymbol reference, String text, Meaning meaning) {
        this.node = node;
        this.reference = reference;
        this.text = text;
        this.meaning = meaning;
    }

    public static TypeExpression of(ParserRuleContext node, Meaning meaning) {
        Objects.requireNonNull(node, "node");
        return new TypeExpression(node, null, node.getText(), meaning);
    }

    public static TypeExpression of(ParserRuleContext node) {
        return of(node, Meaning.OTHER);
    }

    public static TypeExpression reference(ModuleSymbol symbol) {
        Meaning meaning = ModuleSymbol.BUILTINS.equals(symbol.getModule()) && "object".equals(symbol.getSymbol())
                ? Meaning.OBJECT
                : Meaning.OTHER;
        return new TypeExpression(null, symbol, symbol.getQualifiedName(), meaning);
    }

    public ParserRuleContext getNode() {
        return node;
    }

    public ModuleSymbol getReference() {
        return reference;
    }

    public boolean isReference() {
        return reference != null;
    }

    public String getText() {
        return text;
    }

    public Meaning getMeaning() {
        return meaning;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeExpression)) return false;
        return text.equals(((TypeExpression) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
