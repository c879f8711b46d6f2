package me.christianrobert.pyibackport.transformer.catalog;

import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the relocation table of newer symbols.
 */
class BackportCatalogTest {

    private BackportCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new BackportCatalog();
    }

    @Test
    void typingSymbolsMoveToTypingExtensionsBeforeTheirVersion() {
        assertEquals(Optional.of(ModuleSymbol.typingExtensions("override")),
                catalog.relocation("typing", "override", PythonVersion.PY311));
        assertEquals(Optional.empty(), catalog.relocation("typing", "override", PythonVersion.PY312));
        assertEquals(Optional.of(PythonVersion.PY312), catalog.lookup("typing", "override"));
    }

    @Test
    void bufferComesFromTypingExtensions() {
        assertEquals(Optional.of(ModuleSymbol.typingExtensions("Buffer")),
                catalog.relocation("collections.abc", "Buffer", PythonVersion.PY310));
        assertTrue(catalog.findActive("collections.abc", "Buffer", PythonVersion.PY312).isEmpty());
    }

    @Test
    void stdlibRelocation() {
        BackportRequirement requirement = catalog.findActive("enum", "ReprEnum", PythonVersion.PY310).orElseThrow();

        assertEquals(new ModuleSymbol("enum", "Enum"), requirement.getRelocation());
        assertEquals(BackportKind.STDLIB_RELOCATION, requirement.getKind());
    }

    @Test
    void utcIsRelocatedToAnAttribute() {
        BackportRequirement requirement = catalog.findActive("datetime", "UTC", PythonVersion.PY310).orElseThrow();

        assertTrue(requirement.isRelocatedToAttribute());
        assertEquals("datetime.timezone.utc", requirement.getRelocation().getQualifiedName());
        assertTrue(catalog.findActive("datetime", "UTC", PythonVersion.PY311).isEmpty());
    }

    @Test
    void deprecatedAliasesApplyToEveryTarget() {
        for (PythonVersion target : PythonVersion.supportedTargets()) {
            assertEquals(Optional.of(new ModuleSymbol("builtins", "list")), catalog.relocation("typing", "List", target));
            assertEquals(Optional.of(new ModuleSymbol("collections.abc", "Callable")),
                    catalog.relocation("typing_extensions", "Callable", target));
        }
    }

    @Test
    void unknownSymbolHasNoRequirement() {
        assertTrue(catalog.find("typing", "Any").isEmpty());
        assertTrue(catalog.find("os", "PathLike").isEmpty());
    }

    @Test
    void requirementsByKind() {
        int total = catalog.getRequirementsByKind(BackportKind.COMPATIBILITY_MODULE).size()
                + catalog.getRequirementsByKind(BackportKind.STDLIB_RELOCATION).size()
                + catalog.getRequirementsByKind(BackportKind.DEPRECATED_ALIAS).size();

        assertEquals(catalog.getTotalCount(), total);
        assertTrue(catalog.getRequirementsByKind(BackportKind.DEPRECATED_ALIAS).stream()
                .allMatch(r -> r.getMinVersion().equals(PythonVersion.NEVER)));
    }

    @Test
    void builderRequiresSourceAndRelocation() {
        assertThrows(IllegalStateException.class, () -> BackportRequirement.builder().source("typing", "X").build());
    }
}
