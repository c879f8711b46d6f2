package me.christianrobert.pyibackport.transformer.imports;

import me.christianrobert.pyibackport.transformer.context.PolicyViolationException;
import me.christianrobert.pyibackport.transformer.context.UnsupportedConstructException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for import bookkeeping and symbol resolution.
 */
class ImportTableTest {

    private ImportTable imports;

    @BeforeEach
    void setUp() {
        imports = new ImportTable();
    }

    // ========== resolve ==========

    @Test
    void resolveDirectFromImport() {
        imports.registerImport("Self", "typing", null);

        assertEquals(Optional.of("Self"), imports.resolve("typing", "Self"));
        assertEquals(Optional.empty(), imports.resolve("typing_extensions", "Self"));
    }

    @Test
    void resolveAliasedFromImport() {
        imports.registerImport("Buffer", "collections.abc", "Buf");

        assertEquals(Optional.of("Buf"), imports.resolve("collections.abc", "Buffer"));
    }

    @Test
    void resolveThroughModuleImport() {
        imports.registerModuleImport("collections.abc", null);

        assertEquals(Optional.of("collections.abc.Buffer"), imports.resolve("collections.abc", "Buffer"));
        assertEquals(Optional.of("collections.OrderedDict"), imports.resolve("collections", "OrderedDict"));
    }

    @Test
    void resolveThroughAliasedModuleImport() {
        imports.registerModuleImport("typing", "t");

        assertEquals(Optional.of("t.List"), imports.resolve("typing", "List"));
        assertFalse(imports.isImported("typing.List"));
    }

    @Test
    void resolveThroughStarImport() {
        imports.registerImport("*", "os.path", null);

        assertEquals(Optional.of("join"), imports.resolve("os.path", "join"));
    }

    @Test
    void resolveBuiltins() {
        assertEquals(Optional.of("int"), imports.resolve("builtins", "int"));
    }

    @Test
    void resolveShadowedBuiltin() {
        imports.declareGlobalName("int");

        assertEquals(Optional.of("__builtins__.int"), imports.resolve("builtins", "int"));
    }

    @Test
    void resolveFromTypingFallsBackToTypingExtensions() {
        imports.registerImport("TypeVar", "typing_extensions", null);

        assertEquals(Optional.of("TypeVar"), imports.resolveFromTyping("TypeVar"));
        assertEquals(Optional.empty(), imports.resolveFromTyping("Generic"));
    }

    // ========== access expressions ==========

    @Test
    void resolveAccessExpressionWithMemberPath() {
        imports.registerModuleImport("collections.abc", "cabc");

        Optional<AccessPath> path = imports.resolveAccessExpression("cabc.Set.x");

        assertTrue(path.isPresent());
        assertEquals("cabc", path.get().getAlias());
        assertEquals("collections.abc", path.get().getImportFqn());
        assertEquals("Set.x", path.get().getMemberPath());
    }

    @Test
    void resolveAccessExpressionPrefersLongestPrefix() {
        imports.registerModuleImport("collections.abc", null);

        Optional<AccessPath> path = imports.resolveAccessExpression("collections.abc.Buffer");

        assertTrue(path.isPresent());
        assertEquals("collections.abc", path.get().getAlias());
        assertEquals("Buffer", path.get().getMemberPath());
    }

    @Test
    void qualifyBareNameAsBuiltin() {
        Optional<AccessPath> path = imports.qualify("int");

        assertTrue(path.isPresent());
        assertEquals("builtins", path.get().getImportFqn());
        assertEquals("int", path.get().getMemberPath());
    }

    @Test
    void qualifyLocalNameIsEmpty() {
        imports.declareGlobalName("Local");

        assertTrue(imports.qualify("Local").isEmpty());
        assertTrue(imports.qualify("unknown.attr").isEmpty());
    }

    @Test
    void qualifyExplicitBuiltins() {
        Optional<AccessPath> path = imports.qualify("__builtins__.str");

        assertTrue(path.isPresent());
        assertEquals("builtins", path.get().getImportFqn());
        assertEquals("str", path.get().getMemberPath());
    }

    // ========== registration errors ==========

    @Test
    void futureImportIsRejected() {
        assertThrows(PolicyViolationException.class, () -> imports.registerImport("annotations", "__future__", null));
    }

    @Test
    void sameNameUnderTwoAliasesIsRejected() {
        imports.registerImport("List", "typing", null);

        assertThrows(UnsupportedConstructException.class, () -> imports.registerImport("List", "typing", "L"));
    }

    @Test
    void repeatedIdenticalImportIsAccepted() {
        imports.registerImport("List", "typing", null);

        assertDoesNotThrow(() -> imports.registerImport("List", "typing", null));
        assertEquals(Optional.of("typing.List"), imports.lookupAlias("List"));
        assertTrue(imports.isImportedAlias("List"));
    }
}
