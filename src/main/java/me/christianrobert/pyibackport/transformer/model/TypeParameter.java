package me.christianrobert.pyibackport.transformer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A PEP 695 type parameter, lowered to an explicit {@code TypeVar}, {@code TypeVarTuple} or
 * {@code ParamSpec} declaration.
 *
 * <p>Instances are immutable and compare structurally. The factories normalize the
 * expressions the way the declaration is printed:
 * <ul>
 *   <li>a bound of {@code object} or {@code Any} is dropped</li>
 *   <li>{@code Any} among the constraints becomes {@code object}</li>
 *   <li>a default of {@code Any} becomes the bound, or {@code object} without a bound; for
 *       {@code TypeVarTuple} and {@code ParamSpec} it is always {@code object}</li>
 * </ul>
 */
public final class TypeParameter {

    public enum Kind {
        TYPE_VAR("TypeVar"),
        TYPE_VAR_TUPLE("TypeVarTuple"),
        PARAM_SPEC("ParamSpec");

        private final String constructor;

        Kind(String constructor) {
            this.constructor = constructor;
        }

        public String getConstructor() {
            return constructor;
        }
    }

    private static final TypeExpression OBJECT =
            TypeExpression.reference(new ModuleSymbol(ModuleSymbol.BUILTINS, "object"));

    private final Kind kind;
    private final String name;
    private final Variance variance;
    private final TypeExpression bound;
    private final List<TypeExpression> constraints;
    private final TypeExpression defaultValue;
    private final boolean starredDefault;

    private TypeParameter(Kind kind, String name, Variance variance, TypeExpression bound,
                          List<TypeExpression> constraints, TypeExpression defaultValue, boolean starredDefault) {
        this.kind = kind;
        this.name = Objects.requireNonNull(name, "name");
        this.variance = variance;
        this.bound = bound;
        this.constraints = constraints;
        this.defaultValue = defaultValue;
        this.starredDefault = starredDefault;
    }

    /**
     * Ordinary type parameter ({@code T}, {@code T: int}, {@code T: (int, str)}, {@code T = int}).
     *
     * @param constraints empty when the parameter is not constrained
     * @throws IllegalArgumentException if both a bound and constraints are given
     */
    public static TypeParameter typeVar(String name, Variance variance, TypeExpression bound,
                                        List<TypeExpression> constraints, TypeExpression defaultValue) {
        if (bound != null && !constraints.isEmpty()) {
            throw new IllegalArgumentException("Type parameter " + name + " cannot have both a bound and constraints");
        }

        TypeExpression effectiveBound = bound;
        if (bound != null && bound.getMeaning() != TypeExpression.Meaning.OTHER) {
            effectiveBound = null;
        }

        List<TypeExpression> effectiveConstraints = new ArrayList<>(constraints.size());
        for (TypeExpression constraint : constraints) {
            effectiveConstraints.add(constraint.getMeaning() == TypeExpression.Meaning.ANY ? OBJECT : constraint);
        }

        TypeExpression effectiveDefault = defaultValue;
        if (defaultValue != null && defaultValue.getMeaning() == TypeExpression.Meaning.ANY) {
            effectiveDefault = effectiveBound != null ? effectiveBound : OBJECT;
        }

        return new TypeParameter(Kind.TYPE_VAR, name, variance, effectiveBound,
                Collections.unmodifiableList(effectiveConstraints), effectiveDefault, false);
    }

    /**
     * Variadic type parameter ({@code *Ts}, {@code *Ts = *tuple[int, ...]}).
     *
     * @param starredDefault whether the default was written as {@code *expr}
     */
    public static TypeParameter typeVarTuple(String name, TypeExpression defaultValue, boolean starredDefault) {
        return new TypeParameter(Kind.TYPE_VAR_TUPLE, name, Variance.INVARIANT, null, List.of(),
                anyAsObject(defaultValue), defaultValue != null && starredDefault);
    }

    /**
     * Parameter specification ({@code **P}, {@code **P = [int, str]}).
     */
    public static TypeParameter paramSpec(String name, TypeExpression defaultValue) {
        return new TypeParameter(Kind.PARAM_SPEC, name, Variance.INVARIANT, null, List.of(),
                anyAsObject(defaultValue), false);
    }

    private static TypeExpression anyAsObject(TypeExpression expression) {
        return expression != null && expression.getMeaning() == TypeExpression.Meaning.ANY ? OBJECT : expression;
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public Variance getVariance() {
        return variance;
    }

    public TypeExpression getBound() {
        return bound;
    }

    public List<TypeExpression> getConstraints() {
        return constraints;
    }

    public TypeExpression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean isStarredDefault() {
        return starredDefault;
    }

    /**
     * Module symbols that must be importable to declare this parameter for the given target.
     */
    public Set<ModuleSymbol> requiredSupport(PythonVersion target) {
        Set<ModuleSymbol> required = new TreeSet<>();
        switch (kind) {
            case TYPE_VAR -> {
                boolean extensions = (target.isBefore(PythonVersion.PY313) && hasDefault())
                        || (target.isBefore(PythonVersion.PY312) && variance == Variance.INFERRED);
                required.add(new ModuleSymbol(typingModule(extensions), kind.getConstructor()));
            }
            case TYPE_VAR_TUPLE -> {
                if (target.isBefore(PythonVersion.PY311) || starredDefault) {
                    String module = typingModule(target.isBefore(PythonVersion.PY313));
                    required.add(new ModuleSymbol(module, kind.getConstructor()));
                    required.add(new ModuleSymbol(module, "Unpack"));
                } else {
                    boolean extensions = target.isBefore(PythonVersion.PY313) && hasDefault();
                    required.add(new ModuleSymbol(typingModule(extensions), kind.getConstructor()));
                }
            }
            case PARAM_SPEC -> {
                boolean extensions = target.isBefore(PythonVersion.PY313) && hasDefault();
                required.add(new ModuleSymbol(typingModule(extensions), kind.getConstructor()));
            }
        }
        return required;
    }

    /**
     * The explicit declaration, e.g. {@code T_co = TypeVar("T_co", covariant=True, bound=int)}.
     */
    public String renderDeclaration(PythonVersion target, RenderContext context) {
        List<String> arguments = new ArrayList<>();
        arguments.add('"' + name + '"');

        switch (kind) {
            case TYPE_VAR -> {
                for (TypeExpression constraint : constraints) {
                    arguments.add(context.render(constraint));
                }
                if (variance.getKeyword() != null) {
                    arguments.add(variance.getKeyword() + "=True");
                }
                if (bound != null) {
                    arguments.add("bound=" + context.render(bound));
                }
                if (defaultValue != null) {
                    arguments.add("default=" + context.render(defaultValue));
                }
            }
            case TYPE_VAR_TUPLE -> {
                if (defaultValue != null) {
                    String rendered = context.render(defaultValue);
                    if (starredDefault) {
                        rendered = context.reference(supportSymbol(target, "Unpack")) + "[" + rendered + "]";
                    }
                    arguments.add("default=" + rendered);
                }
            }
            case PARAM_SPEC -> {
                if (defaultValue != null) {
                    arguments.add("default=" + context.render(defaultValue));
                }
            }
        }

        String constructor = context.reference(supportSymbol(target, kind.getConstructor()));
        return name + " = " + constructor + "(" + String.join(", ", arguments) + ")";
    }

    /**
     * How the parameter appears inside {@code Generic[...]}, {@code Protocol[...]} or
     * {@code type_params=(...)}.
     */
    public String renderSubscriptElement(PythonVersion target, RenderContext context) {
        return switch (kind) {
            case TYPE_VAR, PARAM_SPEC -> name;
            case TYPE_VAR_TUPLE -> target.isAtLeast(PythonVersion.PY311)
                    ? "*" + name
                    : context.reference(supportSymbol(target, "Unpack")) + "[" + name + "]";
        };
    }

    private ModuleSymbol supportSymbol(PythonVersion target, String symbol) {
        for (ModuleSymbol candidate : requiredSupport(target)) {
            if (candidate.getSymbol().equals(symbol)) {
                return candidate;
            }
        }
        // Unpack for a variadic declared at 3.11+ without a starred default
        return new ModuleSymbol(typingModule(target.isBefore(PythonVersion.PY311)), symbol);
    }

    private static String typingModule(boolean extensions) {
        return extensions ? ModuleSymbol.TYPING_EXTENSIONS : ModuleSymbol.TYPING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeParameter)) return false;
        TypeParameter that = (TypeParameter) o;
        return kind == that.kind
                && name.equals(that.name)
                && variance == that.variance
                && Objects.equals(bound, that.bound)
                && constraints.equals(that.constraints)
                && Objects.equals(defaultValue, that.defaultValue)
                && starredDefault == that.starredDefault;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, variance, bound, constraints, defaultValue, starredDefault);
    }

    @Override
    public String toString() {
        return kind.getConstructor() + "(" + name + ")";
    }
}
