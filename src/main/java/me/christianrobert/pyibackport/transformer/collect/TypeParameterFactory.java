package me.christianrobert.pyibackport.transformer.collect;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.context.PolicyViolationException;
import me.christianrobert.pyibackport.transformer.context.UnsupportedConstructException;
import me.christianrobert.pyibackport.transformer.model.TypeExpression;
import me.christianrobert.pyibackport.transformer.model.TypeParameter;
import me.christianrobert.pyibackport.transformer.model.Variance;
import me.christianrobert.pyibackport.transformer.util.NameChains;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Builds {@link TypeParameter}s from the parse tree.
 *
 * <p><strong>Grammar:</strong>
 * <pre>
 * typeParam
 *     : name (':' expr)? ('=' expr)?     # typeVarParam
 *     | '*' name ('=' starredDefault)?   # typeVarTupleParam
 *     | '**' name ('=' expr)?            # paramSpecParam
 * </pre>
 *
 * <p>A bound written as a parenthesized tuple, {@code T: (int, str)}, is a constraint list.
 */
class TypeParameterFactory {

    private final Function<PyStubParser.ExprContext, TypeExpression.Meaning> meanings;

    /**
     * @param meanings tells whether an expression denotes {@code Any}, {@code object} or something else
     */
    TypeParameterFactory(Function<PyStubParser.ExprContext, TypeExpression.Meaning> meanings) {
        this.meanings = meanings;
    }

    /**
     * @param inferVariance whether the declaration is a class, the only place variance matters
     */
    TypeParameter create(PyStubParser.TypeParamContext ctx, boolean inferVariance, String declaration) {
        if (ctx instanceof PyStubParser.TypeVarParamContext) {
            return createTypeVar((PyStubParser.TypeVarParamContext) ctx, inferVariance, declaration);
        }
        if (ctx instanceof PyStubParser.TypeVarTupleParamContext) {
            PyStubParser.TypeVarTupleParamContext tuple = (PyStubParser.TypeVarTupleParamContext) ctx;
            String name = tuple.name().getText();
            PyStubParser.StarredDefaultContext starred = tuple.starredDefault();
            if (starred == null) {
                return TypeParameter.typeVarTuple(name, null, false);
            }
            checkNotQuoted(starred.expr(), name, declaration);
            boolean star = starred.getStart().getType() == PyStubParser.STAR;
            return TypeParameter.typeVarTuple(name, expression(starred.expr()), star);
        }

        PyStubParser.ParamSpecParamContext spec = (PyStubParser.ParamSpecParamContext) ctx;
        String name = spec.name().getText();
        if (spec.expr() == null) {
            return TypeParameter.paramSpec(name, null);
        }
        checkNotQuoted(spec.expr(), name, declaration);
        return TypeParameter.paramSpec(name, expression(spec.expr()));
    }

    private TypeParameter createTypeVar(PyStubParser.TypeVarParamContext ctx, boolean inferVariance,
                                        String declaration) {
        String name = ctx.name().getText();

        PyStubParser.ExprContext boundExpr = null;
        PyStubParser.ExprContext defaultExpr = null;
        List<PyStubParser.ExprContext> exprs = ctx.expr();
        if (ctx.getToken(PyStubParser.COLON, 0) != null) {
            boundExpr = exprs.get(0);
        }
        if (ctx.getToken(PyStubParser.ASSIGN, 0) != null) {
            defaultExpr = exprs.get(exprs.size() - 1);
        }

        TypeExpression bound = null;
        List<TypeExpression> constraints = new ArrayList<>();
        if (boundExpr != null) {
            List<PyStubParser.StarExprContext> elements = tupleElements(boundExpr);
            if (elements == null) {
                checkNotQuoted(boundExpr, name, declaration);
                bound = expression(boundExpr);
            } else {
                for (PyStubParser.StarExprContext element : elements) {
                    if (element.getStart().getType() == PyStubParser.STAR) {
                        throw new UnsupportedConstructException("Starred type constraints are not supported",
                                element.getText(), declaration);
                    }
                    checkNotQuoted(element.expr(), name, declaration);
                    constraints.add(expression(element.expr()));
                }
            }
        }

        TypeExpression defaultValue = null;
        if (defaultExpr != null) {
            checkNotQuoted(defaultExpr, name, declaration);
            defaultValue = expression(defaultExpr);
        }

        Variance variance = Variance.INVARIANT;
        if (inferVariance) {
            variance = Variance.fromNameSuffix(name);
            if (!constraints.isEmpty()) {
                if (variance != Variance.INFERRED) {
                    throw new UnsupportedConstructException("Constrained type parameter '" + name
                            + "' must be invariant, but its name suggests " + variance.getKeyword(),
                            ctx.getText(), declaration);
                }
                variance = Variance.INVARIANT;
            }
        }

        return TypeParameter.typeVar(name, variance, bound, constraints, defaultValue);
    }

    private TypeExpression expression(PyStubParser.ExprContext expr) {
        return TypeExpression.of(expr, meanings.apply(expr));
    }

    /**
     * Elements of a parenthesized tuple such as {@code (int, str)}, or null if {@code expr} is not one.
     */
    private static List<PyStubParser.StarExprContext> tupleElements(PyStubParser.ExprContext expr) {
        if (!(expr instanceof PyStubParser.AtomExprContext)) {
            return null;
        }
        PyStubParser.AtomContext atom = ((PyStubParser.AtomExprContext) expr).atom();
        if (!(atom instanceof PyStubParser.ParenAtomContext)) {
            return null;
        }
        PyStubParser.StarExpressionsContext items = ((PyStubParser.ParenAtomContext) atom).starExpressions();
        if (items == null) {
            return null;
        }
        boolean tuple = items.starExpr().size() > 1 || items.getToken(PyStubParser.COMMA, 0) != null;
        return tuple ? items.starExpr() : null;
    }

    private static void checkNotQuoted(PyStubParser.ExprContext expr, String parameter, String declaration) {
        if (NameChains.isStringLiteral(expr)) {
            throw new PolicyViolationException("Quoted annotations should not be included in stubs (type parameter '"
                    + parameter + "')", expr.getText(), declaration);
        }
    }
}
