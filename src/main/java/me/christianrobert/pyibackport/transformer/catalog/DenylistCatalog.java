package me.christianrobert.pyibackport.transformer.catalog;

import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static me.christianrobert.pyibackport.transformer.model.PythonVersion.NEVER;
import static me.christianrobert.pyibackport.transformer.model.PythonVersion.PY311;
import static me.christianrobert.pyibackport.transformer.model.PythonVersion.PY312;
import static me.christianrobert.pyibackport.transformer.model.PythonVersion.PY313;
import static me.christianrobert.pyibackport.transformer.model.PythonVersion.PY314;

/**
 * Symbols a stub cannot use when targeting older versions, keyed by the version from which
 * they are allowed ({@link PythonVersion#NEVER} for symbols that are never allowed).
 * <p>
 * Names are checked on every reference outside import statements, bases on class base lists,
 * and wildcard modules on {@code from m import *}.
 */
public class DenylistCatalog {

    public static final List<String> DEFAULT_WILDCARD_MODULES =
            List.of(ModuleSymbol.BUILTINS, ModuleSymbol.TYPING, ModuleSymbol.TYPING_EXTENSIONS);

    private final Map<String, PythonVersion> names = new LinkedHashMap<>();
    private final Map<String, PythonVersion> bases = new LinkedHashMap<>();
    private final Set<String> wildcardModules;

    public DenylistCatalog() {
        this(DEFAULT_WILDCARD_MODULES);
    }

    public DenylistCatalog(List<String> wildcardModules) {
        this.wildcardModules = Collections.unmodifiableSet(new LinkedHashSet<>(wildcardModules));

        registerNames();
        registerBases();
    }

    private void registerNames() {
        names.put("annotationlib.ForwardRef", PY314);
        names.put("ast.TryStar", PY311);
        names.put("ast.TypeAlias", PY312);
        names.put("ast.TypeVar", PY312);
        names.put("ast.TypeVarTuple", PY312);
        names.put("ast.ParamSpec", PY312);
        names.put("ast.PyCF_OPTIMIZED_AST", PY313);
        names.put("asyncio.Barrier", PY311);
        names.put("asyncio.Runner", PY311);
        names.put("asyncio.TaskGroup", PY311);
        names.put("builtins._IncompleteInputError", PY313);
        names.put("builtins.BaseExceptionGroup", PY311);
        names.put("builtins.ExceptionGroup", PY311);
        names.put("builtins.reveal_locals", NEVER);
        names.put("builtins.reveal_type", NEVER);
        names.put("enum.verify", PY311);
        names.put("enum.member", PY311);
        names.put("enum.property", PY311);
        names.put("enum.global_enum", PY311);
        names.put("functools.cache", NEVER);
        names.put("functools.lru_cache", NEVER);
        names.put("functools.singledispatch", NEVER);
        // use `async def` instead
        names.put("inspect.markcoroutinefunction", NEVER);
        names.put("typing.ByteString", NEVER);
        names.put("typing.cast", NEVER);
        names.put("typing.assert_never", NEVER);
        names.put("typing.assert_type", NEVER);
        names.put("typing.clear_overloads", NEVER);
        names.put("typing.no_type_check_decorator", NEVER);
        names.put("typing.reveal_type", NEVER);

        for (String name : List.of("WSGIEnvironment", "WSGIApplication", "StartResponse", "InputStream",
                "ErrorStream", "FileWrapper")) {
            names.put("wsgiref.types." + name, PY311);
        }
    }

    private void registerBases() {
        bases.put("builtins.bool", NEVER);
        bases.put("builtins.object", NEVER);
        bases.put("calendar.Month", PY312);
        bases.put("calendar.Day", PY312);
        bases.put("inspect.BufferFlags", PY312);
        bases.put("inspect.FrameInfo", PY311);
        bases.put("inspect.Traceback", PY311);
        bases.put("pathlib.PurePath", PY312);
        bases.put("pathlib.Path", PY312);
    }

    /**
     * The version from which the name may be referenced, if it is denylisted for {@code target}.
     */
    public Optional<PythonVersion> deniedName(String qualifiedName, PythonVersion target) {
        return denied(names, qualifiedName, target);
    }

    /**
     * The version from which the class may be subclassed, if it is denylisted for {@code target}.
     */
    public Optional<PythonVersion> deniedBase(String qualifiedName, PythonVersion target) {
        return denied(bases, qualifiedName, target);
    }

    public boolean isDeniedWildcard(String module) {
        return wildcardModules.contains(module);
    }

    public Set<String> getWildcardModules() {
        return wildcardModules;
    }

    private static Optional<PythonVersion> denied(Map<String, PythonVersion> table, String qualifiedName,
                                                  PythonVersion target) {
        PythonVersion allowedSince = table.get(qualifiedName);
        if (allowedSince != null && target.isBefore(allowedSince)) {
            return Optional.of(allowedSince);
        }
        return Optional.empty();
    }
}
