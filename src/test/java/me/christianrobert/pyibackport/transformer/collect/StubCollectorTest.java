package me.christianrobert.pyibackport.transformer.collect;

import me.christianrobert.pyibackport.transformer.catalog.BackportCatalog;
import me.christianrobert.pyibackport.transformer.catalog.DenylistCatalog;
import me.christianrobert.pyibackport.transformer.context.ConflictException;
import me.christianrobert.pyibackport.transformer.context.PolicyViolationException;
import me.christianrobert.pyibackport.transformer.context.StubTransformationException;
import me.christianrobert.pyibackport.transformer.context.UnsupportedConstructException;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import me.christianrobert.pyibackport.transformer.model.TypeParameter;
import me.christianrobert.pyibackport.transformer.model.Variance;
import me.christianrobert.pyibackport.transformer.parser.AntlrParser;
import me.christianrobert.pyibackport.transformer.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the first pass: declarations found, imports planned and constructs rejected.
 */
class StubCollectorTest {

    private AntlrParser parser;
    private BackportCatalog backports;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
        backports = new BackportCatalog();
    }

    private CollectionResult collect(String source, PythonVersion target) {
        ParseResult parsed = parser.parseModule(source);
        assertTrue(parsed.isSuccess(), "Parsing should succeed: " + parsed.getErrorMessage());
        return new StubCollector(target, backports, new DenylistCatalog()).collect(parsed.getTree());
    }

    private <T extends StubTransformationException> T rejected(Class<T> kind, String source, PythonVersion target) {
        return assertThrows(kind, () -> collect(source, target));
    }

    // ========== DECLARATIONS ==========

    @Test
    void classParametersInferVarianceFromNames() {
        CollectionResult result = collect("class C[T_contra, T, T_co]: ...\n", PythonVersion.PY310);

        assertTrue(result.hasLoweredDeclarations());
        List<TypeParameter> parameters = result.getDeclarationsByOwner().values().iterator().next();
        assertEquals(3, parameters.size());
        assertEquals(Variance.CONTRAVARIANT, parameters.get(0).getVariance());
        assertEquals(Variance.INFERRED, parameters.get(1).getVariance());
        assertEquals(Variance.COVARIANT, parameters.get(2).getVariance());
    }

    @Test
    void functionParametersAreInvariant() {
        CollectionResult result = collect("def f[T](x: T) -> T: ...\n", PythonVersion.PY310);

        TypeParameter t = result.getDeclarationsByOwner().values().iterator().next().get(0);
        assertEquals(Variance.INVARIANT, t.getVariance());
        assertTrue(result.getNeededSupport().contains(ModuleSymbol.typing("TypeVar")));
    }

    @Test
    void classNeedsGenericAndTypingExtensionsTypeVar() {
        CollectionResult result = collect("class C[T]: ...\n", PythonVersion.PY310);

        assertTrue(result.getNeededSupport().contains(ModuleSymbol.typing("Generic")));
        assertTrue(result.getNeededSupport().contains(ModuleSymbol.typingExtensions("TypeVar")));
        assertTrue(result.getImportDelta().getAdditions().contains(ModuleSymbol.typingExtensions("TypeVar")));
    }

    @Test
    void existingImportSatisfiesSupport() {
        CollectionResult result = collect("from typing import TypeVar\ndef f[T](x: T) -> T: ...\n", PythonVersion.PY310);

        assertTrue(result.getSatisfiedSupport().contains(ModuleSymbol.typing("TypeVar")));
        assertTrue(result.getImportDelta().isEmpty());
    }

    @Test
    void nothingIsLoweredFrom313() {
        CollectionResult result = collect("class C[T = int]: ...\ndef f[T](x: T) -> T: ...\n", PythonVersion.PY313);

        assertFalse(result.hasLoweredDeclarations());
        assertEquals(2, result.getDeclarations().size());
    }

    @Test
    void only312DeclarationsWithDefaultsAreLowered() {
        CollectionResult result = collect("class A[T = int]: ...\nclass B[U]: ...\n", PythonVersion.PY312);

        assertTrue(result.hasLoweredDeclarations());
        assertEquals(1, result.getDeclarationsByOwner().size());
        assertEquals("T", result.getDeclarationsByOwner().values().iterator().next().get(0).getName());
    }

    @Test
    void equalParametersAreDeclaredOnce() {
        CollectionResult result = collect("def f[T](x: T) -> T: ...\ndef g[T](x: T) -> T: ...\n", PythonVersion.PY310);

        assertEquals(1, result.getDeclarationsByOwner().size());
    }

    @Test
    void variadicNamesAreRecorded() {
        CollectionResult result = collect("class A[*Ts]: ...\n", PythonVersion.PY310);

        assertTrue(result.getVariadicNames().contains("Ts"));
    }

    @Test
    void classBasesAreRecorded() {
        CollectionResult result = collect("from typing import Protocol\nclass R[T_co](Protocol): ...\n",
                PythonVersion.PY310);

        assertEquals(List.of("Protocol"), result.getClassBases().get("R"));
        assertFalse(result.getNeededSupport().contains(ModuleSymbol.typing("Generic")));
    }

    @Test
    void relocatedFromImportIsReplaced() {
        CollectionResult result = collect("from typing import Self\n", PythonVersion.PY310);

        assertTrue(result.getImportDelta().getDeletions().contains(ModuleSymbol.typing("Self")));
        assertTrue(result.getImportDelta().getAdditions().contains(ModuleSymbol.typingExtensions("Self")));
    }

    // ========== CONFLICTS ==========

    @Test
    void differentParametersWithSameNameConflict() {
        rejected(ConflictException.class,
                "def f[T: int](x: T) -> T: ...\ndef g[T: str](x: T) -> T: ...\n", PythonVersion.PY310);
    }

    @Test
    void parametersDifferingOnlyInVarianceConflict() {
        ConflictException e = rejected(ConflictException.class,
                "def f[T_co](x: T_co) -> T_co: ...\nclass Box[T_co]: ...\n", PythonVersion.PY310);
        assertTrue(e.getMessage().contains("'T_co'"), e.getMessage());

        rejected(ConflictException.class,
                "class Box[T_co]: ...\ndef f[T_co](x: T_co) -> T_co: ...\n", PythonVersion.PY310);
    }

    @Test
    void subscriptedGenericBaseConflicts() {
        rejected(ConflictException.class, "from typing import Generic\nclass C[T](Generic[T]): ...\n",
                PythonVersion.PY310);
    }

    // ========== POLICY VIOLATIONS ==========

    @Test
    void functionBodyMustBeEllipsis() {
        PolicyViolationException e = rejected(PolicyViolationException.class, "def f() -> None: pass\n",
                PythonVersion.PY310);

        assertTrue(e.getMessage().contains("Function body must contain only `...`"));
    }

    @Test
    void docstringBodyIsAllowed() {
        assertDoesNotThrow(() -> collect("def f() -> None:\n    \"\"\"Docs.\"\"\"\n    ...\n", PythonVersion.PY310));
    }

    @Test
    void uselessStatements() {
        rejected(PolicyViolationException.class, "pass\n", PythonVersion.PY310);
        rejected(PolicyViolationException.class, "for x in y: ...\n", PythonVersion.PY310);
    }

    @Test
    void invalidExpressions() {
        rejected(PolicyViolationException.class, "x = lambda: 1\n", PythonVersion.PY310);
        rejected(PolicyViolationException.class, "x = a and b\n", PythonVersion.PY310);
        rejected(PolicyViolationException.class, "x = f\"{y}\"\n", PythonVersion.PY310);
    }

    @Test
    void quotedAnnotations() {
        rejected(PolicyViolationException.class, "x: 'int'\n", PythonVersion.PY310);
        rejected(PolicyViolationException.class, "def f(x: 'int') -> None: ...\n", PythonVersion.PY310);
        rejected(PolicyViolationException.class, "type X = 'int'\n", PythonVersion.PY312);
        rejected(PolicyViolationException.class,
                "from typing import TypeVar\nT = TypeVar(\"T\", bound=\"int\")\n", PythonVersion.PY310);
    }

    @Test
    void futureImportsAndModuleGetattr() {
        rejected(PolicyViolationException.class, "from __future__ import annotations\n", PythonVersion.PY310);
        rejected(PolicyViolationException.class, "def __getattr__(name: str) -> int: ...\n", PythonVersion.PY310);
    }

    @Test
    void classLevelGetattrIsAllowed() {
        assertDoesNotThrow(() -> collect("class A:\n    def __getattr__(self, name: str) -> int: ...\n",
                PythonVersion.PY310));
    }

    // ========== UNSUPPORTED CONSTRUCTS ==========

    @Test
    void nestedImportsAndAliases() {
        rejected(UnsupportedConstructException.class, "class A:\n    import os\n", PythonVersion.PY310);
        rejected(UnsupportedConstructException.class, "class A:\n    type X = int\n", PythonVersion.PY312);
    }

    @Test
    void wildcardImportFromTyping() {
        rejected(UnsupportedConstructException.class, "from typing import *\n", PythonVersion.PY310);
        assertDoesNotThrow(() -> collect("from os import *\n", PythonVersion.PY310));
    }

    @Test
    void importAliasingByAssignment() {
        UnsupportedConstructException e = rejected(UnsupportedConstructException.class,
                "from typing import List\nL = List\n", PythonVersion.PY310);

        assertTrue(e.getMessage().contains("Multiple import aliases for 'typing.List'"));
        rejected(UnsupportedConstructException.class, "from typing import List\nList = int\n", PythonVersion.PY310);
    }

    @Test
    void starredBaseClass() {
        rejected(UnsupportedConstructException.class, "class A(*bases): ...\n", PythonVersion.PY310);
    }

    @Test
    void denylistedNames() {
        UnsupportedConstructException e = rejected(UnsupportedConstructException.class,
                "import asyncio\nx: asyncio.TaskGroup\n", PythonVersion.PY310);

        assertTrue(e.getMessage().contains("(allowed from Python 3.11)"));
        assertDoesNotThrow(() -> collect("import asyncio\nx: asyncio.TaskGroup\n", PythonVersion.PY311));
    }

    @Test
    void denylistedBases() {
        rejected(UnsupportedConstructException.class, "class B(bool): ...\n", PythonVersion.PY313);
        rejected(UnsupportedConstructException.class, "from pathlib import Path\nclass P(Path): ...\n",
                PythonVersion.PY311);
        assertDoesNotThrow(() -> collect("from pathlib import Path\nclass P(Path): ...\n", PythonVersion.PY312));
    }

    @Test
    void renamedRelocatedImport() {
        rejected(UnsupportedConstructException.class, "from typing import List as L\n", PythonVersion.PY310);
    }

    @Test
    void constrainedParameterWithVarianceSuffix() {
        rejected(UnsupportedConstructException.class, "class C[T_co: (int, str)]: ...\n", PythonVersion.PY310);
    }

    @Test
    void versionChecksAreAllowed() {
        assertDoesNotThrow(() -> collect("import sys\nif sys.version_info >= (3, 10):\n    x: int\n",
                PythonVersion.PY310));
    }
}
