package me.christianrobert.pyibackport.transformer.model;

/**
 * What a {@link TypeParameter} needs from the rewrite pass to print itself.
 */
public interface RenderContext {

    /**
     * How the symbol is spelled in the rewritten module (an import alias, a dotted access, or
     * its bare name once the import has been added).
     */
    String reference(ModuleSymbol symbol);

    /**
     * Current text of the expression, with any rewrites inside it applied.
     */
    String render(TypeExpression expression);
}
