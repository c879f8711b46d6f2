package me.christianrobert.pyibackport.transformer.rewrite;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.collect.GenericDeclaration;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import me.christianrobert.pyibackport.transformer.model.TypeParameter;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for {@code type} statements.
 *
 * <h3>PEP 695:</h3>
 * <pre>
 * type Pair[T] = tuple[T, T]
 * type RPair[T1, T0] = tuple[T0, T1]
 * </pre>
 *
 * <h3>Lowered:</h3>
 * <pre>
 * Pair: TypeAlias = tuple[T, T]
 * RPair = TypeAliasType("RPair", tuple[T0, T1], type_params=(T1, T0))
 * </pre>
 *
 * <h3>Notes:</h3>
 * <ul>
 *   <li>With no or one parameter the order of parameters cannot differ from the order of use,
 *       so {@code TypeAlias} is enough</li>
 *   <li>With two or more, {@code TypeAliasType} keeps the declared order; it comes from
 *       typing_extensions below 3.12</li>
 *   <li>{@code type_params} lists the parameter objects themselves, so a {@code TypeVarTuple}
 *       is not unpacked there</li>
 * </ul>
 */
public class VisitTypeAlias {

    public static void v(PyStubParser.TypeAliasContext ctx, StubRewriter r) {
        // Grammar: TYPE name typeParams? '=' expr
        GenericDeclaration declaration = r.getCollection().getDeclaration(ctx);
        if (declaration == null || !declaration.isLowered()) {
            return;
        }

        String name = ctx.name().getText();
        String value = r.textOf(ctx.expr());
        List<TypeParameter> parameters = declaration.getParameters();

        String replacement;
        if (parameters.size() < 2) {
            replacement = name + ": " + r.reference(ModuleSymbol.typing("TypeAlias")) + " = " + value;
        } else {
            List<String> names = new ArrayList<>();
            for (TypeParameter parameter : parameters) {
                names.add(parameter.getName());
            }
            ModuleSymbol aliasType = r.getTarget().isBefore(PythonVersion.PY312)
                    ? ModuleSymbol.typingExtensions("TypeAliasType")
                    : ModuleSymbol.typing("TypeAliasType");
            replacement = name + " = " + r.reference(aliasType) + "(\"" + name + "\", " + value
                    + ", type_params=(" + String.join(", ", names) + "))";
        }

        r.getRewriter().replace(ctx.getStart(), ctx.expr().getStop(), replacement);
    }
}
