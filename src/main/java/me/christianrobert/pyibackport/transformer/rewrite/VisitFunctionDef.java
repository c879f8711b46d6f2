package me.christianrobert.pyibackport.transformer.rewrite;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.collect.GenericDeclaration;

/**
 * Static helper for generic function definitions.
 *
 * <h3>PEP 695:</h3>
 * <pre>
 * def first[T](xs: list[T]) -&gt; T: ...
 * </pre>
 *
 * <h3>Lowered:</h3>
 * <pre>
 * T = TypeVar("T")
 * def first(xs: list[T]) -&gt; T: ...
 * </pre>
 *
 * <p>The type parameter list is removed; the {@code TypeVar} declarations are inserted by
 * {@link StubRewriter} at module level, after the imports, so methods declare theirs there too.</p>
 */
public class VisitFunctionDef {

    public static void v(PyStubParser.FunctionDefContext ctx, StubRewriter r) {
        // Grammar: decorator* ASYNC? DEF name typeParams? '(' parameters? ')' ('->' annotation)? ':' block
        GenericDeclaration declaration = r.getCollection().getDeclaration(ctx);
        if (declaration == null || !declaration.isLowered()) {
            return;
        }
        r.getRewriter().delete(ctx.typeParams().getStart(), ctx.typeParams().getStop());
    }
}
