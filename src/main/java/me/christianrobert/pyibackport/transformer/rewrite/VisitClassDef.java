package me.christianrobert.pyibackport.transformer.rewrite;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.collect.GenericDeclaration;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for generic class definitions.
 *
 * <h3>PEP 695:</h3>
 * <pre>
 * class Box[T]: ...
 * class Pair[K, V](Base, metaclass=Meta): ...
 * class Reader[T_co](Protocol): ...
 * </pre>
 *
 * <h3>Lowered:</h3>
 * <pre>
 * class Box(Generic[T]): ...
 * class Pair(Base, Generic[K, V], metaclass=Meta): ...
 * class Reader(Protocol[T_co]): ...
 * </pre>
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li>A plain {@code Protocol} base is subscripted with the parameters instead of adding {@code Generic}</li>
 *   <li>Otherwise {@code Generic[...]} goes after the last positional base, before any keyword argument</li>
 *   <li>Without a base list, one is created</li>
 * </ul>
 */
public class VisitClassDef {

    public static void v(PyStubParser.ClassDefContext ctx, StubRewriter r) {
        // Grammar: decorator* CLASS name typeParams? ('(' arguments? ')')? ':' block
        GenericDeclaration declaration = r.getCollection().getDeclaration(ctx);
        if (declaration == null || !declaration.isLowered()) {
            return;
        }

        String elements = r.subscriptElements(declaration);
        PyStubParser.TypeParamsContext typeParams = ctx.typeParams();

        if (declaration.getProtocolBase() != null) {
            r.getRewriter().delete(typeParams.getStart(), typeParams.getStop());
            r.getRewriter().insertAfter(declaration.getProtocolBase().getStop(), "[" + elements + "]");
            return;
        }

        String generic = r.reference(ModuleSymbol.typing("Generic")) + "[" + elements + "]";

        Token openParen = ctx.getToken(PyStubParser.OPEN_PAREN, 0) != null
                ? ctx.getToken(PyStubParser.OPEN_PAREN, 0).getSymbol()
                : null;
        if (openParen == null) {
            r.getRewriter().replace(typeParams.getStart(), typeParams.getStop(), "(" + generic + ")");
            return;
        }

        r.getRewriter().delete(typeParams.getStart(), typeParams.getStop());
        if (ctx.arguments() == null) {
            r.getRewriter().insertAfter(openParen, generic);
            return;
        }

        List<PyStubParser.ArgumentContext> positional = new ArrayList<>();
        PyStubParser.ArgumentContext firstOther = null;
        for (PyStubParser.ArgumentContext argument : ctx.arguments().argument()) {
            if (argument instanceof PyStubParser.PositionalArgumentContext) {
                positional.add(argument);
            } else if (firstOther == null) {
                firstOther = argument;
            }
        }

        if (!positional.isEmpty()) {
            r.getRewriter().insertAfter(positional.get(positional.size() - 1).getStop(), ", " + generic);
        } else {
            r.getRewriter().insertBefore(firstOther.getStart(), generic + ", ");
        }
    }
}
