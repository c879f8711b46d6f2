package me.christianrobert.pyibackport.transformer.catalog;

import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DenylistCatalogTest {

    private final DenylistCatalog denylist = new DenylistCatalog();

    @Test
    void deniedNameUntilItsVersion() {
        assertEquals(Optional.of(PythonVersion.PY311), denylist.deniedName("asyncio.TaskGroup", PythonVersion.PY310));
        assertEquals(Optional.empty(), denylist.deniedName("asyncio.TaskGroup", PythonVersion.PY311));
    }

    @Test
    void neverAllowedName() {
        for (PythonVersion target : PythonVersion.supportedTargets()) {
            assertEquals(Optional.of(PythonVersion.NEVER), denylist.deniedName("typing.cast", target));
        }
    }

    @Test
    void deniedBases() {
        assertEquals(Optional.of(PythonVersion.NEVER), denylist.deniedBase("builtins.object", PythonVersion.PY313));
        assertEquals(Optional.of(PythonVersion.NEVER), denylist.deniedBase("builtins.bool", PythonVersion.PY310));
        assertEquals(Optional.of(PythonVersion.PY312), denylist.deniedBase("pathlib.Path", PythonVersion.PY311));
        assertEquals(Optional.empty(), denylist.deniedBase("pathlib.Path", PythonVersion.PY312));
        assertEquals(Optional.empty(), denylist.deniedBase("builtins.int", PythonVersion.PY310));
    }

    @Test
    void defaultWildcardModules() {
        assertTrue(denylist.isDeniedWildcard("typing"));
        assertTrue(denylist.isDeniedWildcard("typing_extensions"));
        assertTrue(denylist.isDeniedWildcard("builtins"));
        assertFalse(denylist.isDeniedWildcard("os"));
    }

    @Test
    void customWildcardModules() {
        DenylistCatalog custom = new DenylistCatalog(List.of("os"));

        assertTrue(custom.isDeniedWildcard("os"));
        assertFalse(custom.isDeniedWildcard("typing"));
        assertEquals(1, custom.getWildcardModules().size());
    }
}
