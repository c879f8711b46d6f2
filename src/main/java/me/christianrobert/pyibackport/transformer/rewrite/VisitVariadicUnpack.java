package me.christianrobert.pyibackport.transformer.rewrite;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import me.christianrobert.pyibackport.transformer.util.NameChains;
import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Static helper for star-unpacking of variadic type parameters.
 *
 * <p>Star-unpacking in subscripts and {@code *args} annotations needs Python 3.11. For older
 * targets, {@code *Ts} becomes {@code Unpack[Ts]}, but only for names registered as
 * {@code TypeVarTuple}; other starred expressions are left alone.</p>
 *
 * <h3>Examples (target 3.10):</h3>
 * <pre>
 * tuple[int, *Ts]        -&gt; tuple[int, Unpack[Ts]]
 * def f(*args: *Ts)      -&gt; def f(*args: Unpack[Ts])
 * Callable[[*Ts], None]  -&gt; Callable[[Unpack[Ts]], None]
 * </pre>
 *
 * <p><strong>Grammar:</strong></p>
 * <pre>
 * subscriptItem  : '*' expr          # starredItem
 * starAnnotation : '*' expr
 * starExpr       : '*' expr
 * </pre>
 */
public class VisitVariadicUnpack {

    /**
     * @param starred the starred node, from its {@code *} through the expression
     * @param expr the expression after the {@code *}
     * @param r StubRewriter instance
     */
    public static void v(ParserRuleContext starred, PyStubParser.ExprContext expr, StubRewriter r) {
        if (r.getTarget().isAtLeast(PythonVersion.PY311)) {
            return;
        }
        String name = NameChains.bareName(expr);
        if (name == null || !r.getCollection().getVariadicNames().contains(name)) {
            return;
        }

        String unpack = r.reference(ModuleSymbol.typingExtensions("Unpack"));
        r.replace(starred, unpack + "[" + r.textOf(expr) + "]");
    }
}
