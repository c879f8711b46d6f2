package me.christianrobert.pyibackport.transformer.imports;

import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImportDeltaTest {

    private ImportTable imports;
    private ImportDelta delta;

    @BeforeEach
    void setUp() {
        imports = new ImportTable();
        delta = new ImportDelta(imports);
    }

    @Test
    void requireMissingSymbolSchedulesImport() {
        String spelling = delta.require(ModuleSymbol.typing("TypeVar"));

        assertEquals("TypeVar", spelling);
        assertTrue(delta.getAdditions().contains(ModuleSymbol.typing("TypeVar")));
        assertFalse(delta.isEmpty());
    }

    @Test
    void requireReachableSymbolReusesImport() {
        imports.registerModuleImport("typing", "t");

        assertEquals("t.Generic", delta.require(ModuleSymbol.typing("Generic")));
        assertTrue(delta.isEmpty());
    }

    @Test
    void typingSymbolIsSatisfiedByTypingExtensionsImport() {
        imports.registerImport("TypeVar", "typing_extensions", null);

        assertTrue(delta.isSatisfied(ModuleSymbol.typing("TypeVar")));
        assertEquals("TypeVar", delta.require(ModuleSymbol.typing("TypeVar")));
        assertTrue(delta.isEmpty());
    }

    @Test
    void typingExtensionsReplacesTypingVariant() {
        imports.registerImport("TypeVar", "typing", null);
        delta.require(ModuleSymbol.typing("Generic"));

        delta.require(ModuleSymbol.typingExtensions("TypeVar"));

        assertTrue(delta.getAdditions().contains(ModuleSymbol.typingExtensions("TypeVar")));
        assertTrue(delta.getDeletions().contains(ModuleSymbol.typing("TypeVar")));
        assertTrue(delta.isDeleted("typing", "TypeVar", null));
    }

    @Test
    void laterTypingRequestUsesTypingExtensionsVariant() {
        delta.require(ModuleSymbol.typingExtensions("TypeVar"));

        assertEquals(ModuleSymbol.typingExtensions("TypeVar"), delta.preferred(ModuleSymbol.typing("TypeVar")));
        delta.require(ModuleSymbol.typing("TypeVar"));

        assertFalse(delta.getAdditions().contains(ModuleSymbol.typing("TypeVar")));
    }

    @Test
    void discardedSymbolIsNoLongerReachable() {
        imports.registerImport("Self", "typing", null);
        delta.discard(ModuleSymbol.typing("Self"));

        assertFalse(delta.isSatisfied(ModuleSymbol.typing("Self")));
        assertEquals("Self", delta.require(ModuleSymbol.typing("Self")));
        assertTrue(delta.getAdditions().contains(ModuleSymbol.typing("Self")));
    }

    @Test
    void isDeletedIgnoresRenamedImports() {
        delta.discard(ModuleSymbol.typing("List"));

        assertTrue(delta.isDeleted("typing", "List", null));
        assertTrue(delta.isDeleted("typing", "List", "List"));
        assertFalse(delta.isDeleted("typing", "List", "L"));
        assertFalse(delta.isDeleted("typing", "Dict", null));
    }
}
