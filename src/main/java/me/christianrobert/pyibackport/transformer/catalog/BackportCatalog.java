package me.christianrobert.pyibackport.transformer.catalog;

import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static me.christianrobert.pyibackport.transformer.model.PythonVersion.NEVER;
import static me.christianrobert.pyibackport.transformer.model.PythonVersion.PY310;
import static me.christianrobert.pyibackport.transformer.model.PythonVersion.PY311;
import static me.christianrobert.pyibackport.transformer.model.PythonVersion.PY312;
import static me.christianrobert.pyibackport.transformer.model.PythonVersion.PY313;
import static me.christianrobert.pyibackport.transformer.model.PythonVersion.PY314;

/**
 * Central catalog of standard-library symbols that must be spelled differently on older targets.
 * <p>
 * Three groups:
 * - typing_extensions backports of typing (and a few other stdlib) symbols
 * - stdlib symbols replaced by their closest older equivalent (e.g. {@code enum.StrEnum})
 * - deprecated typing aliases, relocated for every target (e.g. {@code typing.List})
 * <p>
 * Read-only after construction.
 */
public class BackportCatalog {

    private final List<BackportRequirement> allRequirements;
    private final Map<ModuleSymbol, BackportRequirement> bySource;

    public BackportCatalog() {
        allRequirements = new ArrayList<>();

        registerStdlibRelocations();
        registerCompatibilityBackports();
        registerDeprecatedAliases(ModuleSymbol.TYPING);
        registerDeprecatedAliases(ModuleSymbol.TYPING_EXTENSIONS);

        bySource = new HashMap<>();
        for (BackportRequirement requirement : allRequirements) {
            bySource.put(requirement.getSource(), requirement);
        }
    }

    private void registerStdlibRelocations() {
        relocate("asyncio", "BrokenBarrierError", ModuleSymbol.BUILTINS, "RuntimeError", PY311);
        relocate("asyncio", "QueueShutDown", ModuleSymbol.BUILTINS, "Exception", PY313);
        relocate(ModuleSymbol.BUILTINS, "EncodingWarning", ModuleSymbol.BUILTINS, "Warning", PY310);
        relocate(ModuleSymbol.BUILTINS, "PythonFinalizationError", ModuleSymbol.BUILTINS, "RuntimeError", PY313);

        // TODO: lower calendar.Month and calendar.Day to Literal[1, ..., 12] / Literal[0, ..., 6]
        relocate("calendar", "Month", ModuleSymbol.BUILTINS, "int", PY312);
        relocate("calendar", "Day", ModuleSymbol.BUILTINS, "int", PY312);

        allRequirements.add(BackportRequirement.builder()
                .source("datetime", "UTC")
                .relocation("datetime.timezone", "utc")
                .minVersion(PY311)
                .relocatedToAttribute(true)
                .notes("timezone is a class, so utc is reached as timezone.utc")
                .build());

        relocate("dbm.sqlite3", "error", ModuleSymbol.BUILTINS, "OSError", PY313);
        relocate("enum", "EnumType", "enum", "EnumMeta", PY311);
        relocate("enum", "ReprEnum", "enum", "Enum", PY311);

        allRequirements.add(BackportRequirement.builder()
                .source("enum", "StrEnum")
                .relocation("enum", "Enum")
                .minVersion(PY311)
                .notes("Only meaningful as a base class, where it acts as str & Enum")
                .build());

        relocate("inspect", "BufferFlags", ModuleSymbol.BUILTINS, "int", PY312);
        relocate("pathlib", "UnsupportedOperation", ModuleSymbol.BUILTINS, "NotImplementedError", PY313);
        relocate("queue", "ShutDown", ModuleSymbol.BUILTINS, "Exception", PY313);
        relocate("re", "PatternError", "re", "error", PY313);
        relocate("sys.monitoring", "events", ModuleSymbol.BUILTINS, "int", PY312);
        relocate("types", "EllipsisType", ModuleSymbol.BUILTINS, "type", PY310);
        relocate("types", "NoneType", ModuleSymbol.BUILTINS, "type", PY310);
        relocate("types", "NotImplementedType", ModuleSymbol.BUILTINS, "type", PY310);
        relocate("types", "UnionType", ModuleSymbol.TYPING, "_UnionGenericAlias", PY310);
    }

    private void registerCompatibilityBackports() {
        backport("annotationlib", "Format", PY314);
        backport("collections.abc", "Buffer", PY312);
        backport("types", "CapsuleType", PY313);
        backport("warnings", "deprecated", PY313);

        // typing, in the order the symbols were added
        backport(ModuleSymbol.TYPING, "Concatenate", PY310);
        backport(ModuleSymbol.TYPING, "ParamSpec", PY310);
        backport(ModuleSymbol.TYPING, "ParamSpecArgs", PY310);
        backport(ModuleSymbol.TYPING, "ParamSpecKwargs", PY310);
        backport(ModuleSymbol.TYPING, "TypeAlias", PY310);
        backport(ModuleSymbol.TYPING, "TypeGuard", PY310);
        backport(ModuleSymbol.TYPING, "is_typeddict", PY310);
        backport(ModuleSymbol.TYPING, "LiteralString", PY311);
        backport(ModuleSymbol.TYPING, "Never", PY311);
        backport(ModuleSymbol.TYPING, "NotRequired", PY311);
        backport(ModuleSymbol.TYPING, "Required", PY311);
        backport(ModuleSymbol.TYPING, "Self", PY311);
        backport(ModuleSymbol.TYPING, "TypeVarTuple", PY311);
        backport(ModuleSymbol.TYPING, "Unpack", PY311);
        backport(ModuleSymbol.TYPING, "dataclass_transform", PY311);
        backport(ModuleSymbol.TYPING, "TypeAliasType", PY312);
        backport(ModuleSymbol.TYPING, "override", PY312);
        backport(ModuleSymbol.TYPING, "NoDefault", PY313);
        backport(ModuleSymbol.TYPING, "ReadOnly", PY313);
        backport(ModuleSymbol.TYPING, "TypeIs", PY313);
        backport(ModuleSymbol.TYPING, "get_protocol_members", PY313);
        backport(ModuleSymbol.TYPING, "is_protocol", PY313);
        backport(ModuleSymbol.TYPING, "Doc", PY314);
        backport(ModuleSymbol.TYPING, "TypeForm", PY314);
        backport(ModuleSymbol.TYPING, "evaluate_forward_ref", PY314);
    }

    private void registerDeprecatedAliases(String typingModule) {
        alias(typingModule, "Text", ModuleSymbol.BUILTINS, "str");
        for (String name : List.of("Dict", "List", "Set", "FrozenSet", "Tuple", "Type")) {
            alias(typingModule, name, ModuleSymbol.BUILTINS, name.toLowerCase());
        }

        alias(typingModule, "IntVar", typingModule, "TypeVar");
        alias(typingModule, "runtime", typingModule, "runtime_checkable");

        alias(typingModule, "DefaultDict", "collections", "defaultdict");
        alias(typingModule, "Deque", "collections", "deque");
        for (String name : List.of("ChainMap", "Counter", "OrderedDict")) {
            alias(typingModule, name, "collections", name);
        }

        alias(typingModule, "AbstractSet", "collections.abc", "Set");
        for (String name : List.of(
                "Collection", "Container", "ItemsView", "KeysView", "ValuesView", "Mapping", "MappingView",
                "MutableMapping", "MutableSequence", "MutableSet", "Sequence", "Coroutine", "AsyncGenerator",
                "AsyncIterable", "AsyncIterator", "Awaitable", "Iterable", "Iterator", "Callable", "Generator",
                "Hashable", "Reversible", "Sized")) {
            alias(typingModule, name, "collections.abc", name);
        }

        alias(typingModule, "ContextManager", "contextlib", "AbstractContextManager");
        alias(typingModule, "AsyncContextManager", "contextlib", "AbstractAsyncContextManager");

        alias(typingModule, "Pattern", "re", "Pattern");
        alias(typingModule, "Match", "re", "Match");
    }

    private void relocate(String module, String symbol, String newModule, String newSymbol, PythonVersion since) {
        allRequirements.add(BackportRequirement.builder()
                .source(module, symbol)
                .relocation(newModule, newSymbol)
                .minVersion(since)
                .kind(BackportKind.STDLIB_RELOCATION)
                .build());
    }

    private void backport(String module, String symbol, PythonVersion since) {
        allRequirements.add(BackportRequirement.builder()
                .source(module, symbol)
                .relocation(ModuleSymbol.TYPING_EXTENSIONS, symbol)
                .minVersion(since)
                .kind(BackportKind.COMPATIBILITY_MODULE)
                .build());
    }

    private void alias(String module, String symbol, String newModule, String newSymbol) {
        allRequirements.add(BackportRequirement.builder()
                .source(module, symbol)
                .relocation(newModule, newSymbol)
                .minVersion(NEVER)
                .kind(BackportKind.DEPRECATED_ALIAS)
                .build());
    }

    /**
     * The requirement registered for {@code module.symbol}, regardless of target.
     */
    public Optional<BackportRequirement> find(String module, String symbol) {
        return Optional.ofNullable(bySource.get(new ModuleSymbol(module, symbol)));
    }

    /**
     * First version in which {@code module.symbol} can be used as is.
     */
    public Optional<PythonVersion> lookup(String module, String symbol) {
        return find(module, symbol).map(BackportRequirement::getMinVersion);
    }

    /**
     * The requirement for {@code module.symbol} if it applies to {@code target}.
     */
    public Optional<BackportRequirement> findActive(String module, String symbol, PythonVersion target) {
        return find(module, symbol).filter(requirement -> requirement.isActiveFor(target));
    }

    /**
     * Where {@code module.symbol} must be taken from for {@code target}, if it has to move.
     */
    public Optional<ModuleSymbol> relocation(String module, String symbol, PythonVersion target) {
        return findActive(module, symbol, target).map(BackportRequirement::getRelocation);
    }

    public List<BackportRequirement> getAllRequirements() {
        return new ArrayList<>(allRequirements);
    }

    public List<BackportRequirement> getRequirementsByKind(BackportKind kind) {
        return allRequirements.stream()
                .filter(r -> r.getKind() == kind)
                .collect(Collectors.toList());
    }

    public int getTotalCount() {
        return allRequirements.size();
    }
}
