package me.christianrobert.pyibackport.transformer.util;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for name and attribute chains such as {@code Self} or {@code collections.abc.Buffer}.
 *
 * <p>A chain is <i>pure</i> when it consists of names joined by dots only. The <i>outermost</i>
 * pure chain is the one not continued by an enclosing attribute access; in
 * {@code a.b[c].d} that is {@code a.b}, while in {@code a.b.c} it is the whole expression.
 */
public final class NameChains {

    private NameChains() {
    }

    public static boolean isPureChain(PyStubParser.ExprContext expr) {
        PyStubParser.ExprContext current = expr;
        while (current instanceof PyStubParser.AttributeExprContext) {
            current = ((PyStubParser.AttributeExprContext) current).expr();
        }
        return isNameAtom(current);
    }

    public static boolean isNameAtom(PyStubParser.ExprContext expr) {
        return expr instanceof PyStubParser.AtomExprContext
                && ((PyStubParser.AtomExprContext) expr).atom() instanceof PyStubParser.NameAtomContext;
    }

    /**
     * Whether {@code expr} is a pure chain that is not the value of an enclosing attribute access.
     */
    public static boolean isOutermostChain(PyStubParser.ExprContext expr) {
        if (!isPureChain(expr)) {
            return false;
        }
        ParserRuleContext parent = expr.getParent();
        return !(parent instanceof PyStubParser.AttributeExprContext
                && ((PyStubParser.AttributeExprContext) parent).expr() == expr);
    }

    /**
     * Nodes of a pure chain from the innermost name to the whole chain:
     * {@code a}, {@code a.b}, {@code a.b.c}.
     */
    public static List<PyStubParser.ExprContext> prefixes(PyStubParser.ExprContext chain) {
        List<PyStubParser.ExprContext> nodes = new ArrayList<>();
        PyStubParser.ExprContext current = chain;
        while (current instanceof PyStubParser.AttributeExprContext) {
            nodes.add(0, current);
            current = ((PyStubParser.AttributeExprContext) current).expr();
        }
        nodes.add(0, current);
        return nodes;
    }

    /**
     * Dotted text of a pure chain, without whitespace or comments.
     */
    public static String dotted(PyStubParser.ExprContext chain) {
        return chain.getText();
    }

    /**
     * The bare name if {@code expr} is a single name, else null.
     */
    public static String bareName(PyStubParser.ExprContext expr) {
        return isNameAtom(expr) ? expr.getText() : null;
    }

    /**
     * Whether {@code expr} is a (possibly implicitly concatenated) string literal.
     */
    public static boolean isStringLiteral(PyStubParser.ExprContext expr) {
        return expr instanceof PyStubParser.AtomExprContext
                && ((PyStubParser.AtomExprContext) expr).atom() instanceof PyStubParser.StringAtomContext;
    }
}
