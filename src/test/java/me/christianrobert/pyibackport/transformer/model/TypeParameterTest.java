package me.christianrobert.pyibackport.transformer.model;

import org.antlr.v4.runtime.ParserRuleContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TypeParameterTest {

    private static final TypeExpression INT = TypeExpression.reference(new ModuleSymbol(ModuleSymbol.BUILTINS, "int"));
    private static final TypeExpression STR = TypeExpression.reference(new ModuleSymbol(ModuleSymbol.BUILTINS, "str"));
    private static final TypeExpression OBJECT = TypeExpression.reference(new ModuleSymbol(ModuleSymbol.BUILTINS, "object"));

    private final List<ModuleSymbol> referenced = new ArrayList<>();

    // Spells every symbol by its bare name and records it
    private final RenderContext context = new RenderContext() {
        @Override
        public String reference(ModuleSymbol symbol) {
            referenced.add(symbol);
            return symbol.getSymbol();
        }

        @Override
        public String render(TypeExpression expression) {
            return expression.isReference() ? reference(expression.getReference()) : expression.getText();
        }
    };

    @Test
    void plainTypeVar() {
        TypeParameter t = TypeParameter.typeVar("T", Variance.INVARIANT, null, List.of(), null);

        assertEquals("T = TypeVar(\"T\")", t.renderDeclaration(PythonVersion.PY310, context));
        assertEquals(Set.of(ModuleSymbol.typing("TypeVar")), t.requiredSupport(PythonVersion.PY310));
        assertEquals("T", t.renderSubscriptElement(PythonVersion.PY310, context));
    }

    @Test
    void boundAndVariance() {
        TypeParameter t = TypeParameter.typeVar("T_co", Variance.COVARIANT, INT, List.of(), null);

        assertEquals("T_co = TypeVar(\"T_co\", covariant=True, bound=int)",
                t.renderDeclaration(PythonVersion.PY310, context));
    }

    @Test
    void constraintsArePositional() {
        TypeParameter z = TypeParameter.typeVar("Z", Variance.INVARIANT, null, List.of(INT, STR), null);

        assertEquals("Z = TypeVar(\"Z\", int, str)", z.renderDeclaration(PythonVersion.PY310, context));
        assertNull(z.getBound());
    }

    @Test
    void boundAndConstraintsTogetherAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> TypeParameter.typeVar("Z", Variance.INVARIANT, INT, List.of(STR), null));
    }

    @Test
    void objectBoundIsDropped() {
        TypeParameter t = TypeParameter.typeVar("T", Variance.INVARIANT, OBJECT, List.of(), null);

        assertNull(t.getBound());
        assertEquals("T = TypeVar(\"T\")", t.renderDeclaration(PythonVersion.PY310, context));
    }

    @Test
    void inferredVarianceNeedsTypingExtensionsBefore312() {
        TypeParameter t = TypeParameter.typeVar("T", Variance.INFERRED, null, List.of(), null);

        assertEquals(Set.of(ModuleSymbol.typingExtensions("TypeVar")), t.requiredSupport(PythonVersion.PY311));
        assertEquals(Set.of(ModuleSymbol.typing("TypeVar")), t.requiredSupport(PythonVersion.PY312));
        assertEquals("T = TypeVar(\"T\", infer_variance=True)", t.renderDeclaration(PythonVersion.PY310, context));
        assertTrue(referenced.contains(ModuleSymbol.typingExtensions("TypeVar")));
    }

    @Test
    void defaultNeedsTypingExtensionsBefore313() {
        TypeParameter t = TypeParameter.typeVar("T", Variance.INVARIANT, null, List.of(), INT);

        assertEquals(Set.of(ModuleSymbol.typingExtensions("TypeVar")), t.requiredSupport(PythonVersion.PY312));
        assertEquals(Set.of(ModuleSymbol.typing("TypeVar")), t.requiredSupport(PythonVersion.PY313));
        assertEquals("T = TypeVar(\"T\", default=int)", t.renderDeclaration(PythonVersion.PY312, context));
    }

    @Test
    void typeVarTupleBefore311UsesUnpack() {
        TypeParameter ts = TypeParameter.typeVarTuple("Ts", null, false);

        assertEquals(Set.of(ModuleSymbol.typingExtensions("TypeVarTuple"), ModuleSymbol.typingExtensions("Unpack")),
                ts.requiredSupport(PythonVersion.PY310));
        assertEquals("Unpack[Ts]", ts.renderSubscriptElement(PythonVersion.PY310, context));
        assertEquals("Ts = TypeVarTuple(\"Ts\")", ts.renderDeclaration(PythonVersion.PY310, context));
    }

    @Test
    void typeVarTupleFrom311IsStarred() {
        TypeParameter ts = TypeParameter.typeVarTuple("Ts", null, false);

        assertEquals(Set.of(ModuleSymbol.typing("TypeVarTuple")), ts.requiredSupport(PythonVersion.PY311));
        assertEquals("*Ts", ts.renderSubscriptElement(PythonVersion.PY311, context));
    }

    @Test
    void starredTypeVarTupleDefaultIsUnpacked() {
        TypeParameter ts = TypeParameter.typeVarTuple("Ts", INT, true);

        assertTrue(ts.isStarredDefault());
        assertEquals("Ts = TypeVarTuple(\"Ts\", default=Unpack[int])", ts.renderDeclaration(PythonVersion.PY311, context));
        assertTrue(referenced.contains(ModuleSymbol.typingExtensions("Unpack")));
    }

    @Test
    void paramSpec() {
        TypeParameter p = TypeParameter.paramSpec("P", null);

        assertEquals("P = ParamSpec(\"P\")", p.renderDeclaration(PythonVersion.PY310, context));
        assertEquals(Set.of(ModuleSymbol.typing("ParamSpec")), p.requiredSupport(PythonVersion.PY310));
        assertEquals("P", p.renderSubscriptElement(PythonVersion.PY310, context));
    }

    @Test
    void equalityIncludesVariance() {
        TypeParameter inferred = TypeParameter.typeVar("T", Variance.INFERRED, null, List.of(), null);
        TypeParameter invariant = TypeParameter.typeVar("T", Variance.INVARIANT, null, List.of(), null);
        TypeParameter bounded = TypeParameter.typeVar("T", Variance.INVARIANT, INT, List.of(), null);

        assertNotEquals(inferred, invariant);
        assertNotEquals(invariant, bounded);
        assertEquals(invariant, TypeParameter.typeVar("T", Variance.INVARIANT, null, List.of(), null));
        assertEquals(invariant.hashCode(), TypeParameter.typeVar("T", Variance.INVARIANT, null, List.of(), null).hashCode());
    }

    @Test
    void anyDefaultBecomesObjectForEveryKind() {
        TypeExpression any = TypeExpression.of(new ParserRuleContext(), TypeExpression.Meaning.ANY);

        assertEquals("T = TypeVar(\"T\", default=object)",
                TypeParameter.typeVar("T", Variance.INVARIANT, null, List.of(), any)
                        .renderDeclaration(PythonVersion.PY310, context));
        assertEquals("T = TypeVar(\"T\", bound=int, default=int)",
                TypeParameter.typeVar("T", Variance.INVARIANT, INT, List.of(), any)
                        .renderDeclaration(PythonVersion.PY310, context));
        assertEquals("Ts = TypeVarTuple(\"Ts\", default=object)",
                TypeParameter.typeVarTuple("Ts", any, false).renderDeclaration(PythonVersion.PY311, context));
        assertEquals("P = ParamSpec(\"P\", default=object)",
                TypeParameter.paramSpec("P", any).renderDeclaration(PythonVersion.PY310, context));
    }

    @Test
    void varianceFromNameSuffix() {
        assertEquals(Variance.COVARIANT, Variance.fromNameSuffix("T_co"));
        assertEquals(Variance.CONTRAVARIANT, Variance.fromNameSuffix("T_contra"));
        assertEquals(Variance.INFERRED, Variance.fromNameSuffix("T"));
        assertEquals(Variance.INFERRED, Variance.fromNameSuffix("K_in"));
        assertEquals(Variance.INFERRED, Variance.fromNameSuffix("V_out"));
    }

    @Test
    void parseTargetVersion() {
        assertEquals(PythonVersion.PY311, PythonVersion.parseTarget(" 3.11 "));
        assertThrows(IllegalArgumentException.class, () -> PythonVersion.parseTarget("3.9"));
        assertThrows(IllegalArgumentException.class, () -> PythonVersion.parseTarget(""));
        assertTrue(PythonVersion.PY310.isBefore(PythonVersion.PY311));
    }
}
