package me.christianrobert.pyibackport.transformer.imports;

import me.christianrobert.pyibackport.transformer.context.PolicyViolationException;
import me.christianrobert.pyibackport.transformer.context.UnsupportedConstructException;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Module-level imports of a stub and the names they bind.
 *
 * <p>Answers two questions for the transformation passes:
 * <ul>
 *   <li>{@link #resolve}: how is {@code module.symbol} spelled in this file, if it is reachable at all?</li>
 *   <li>{@link #resolveAccessExpression}: which import does a dotted expression go through?</li>
 * </ul>
 *
 * <p><b>Bindings:</b></p>
 * <pre>
 * import a.b.c          a -> a, a.b -> a.b, a.b.c -> a.b.c
 * import a.b.c as abc   a.b.c -> abc
 * from a import x as y  a.x -> y
 * from a import *       a.* -> *
 * </pre>
 *
 * <p>Only module-level imports are supported; the collector rejects nested ones before they get here.
 */
public class ImportTable {

    private static final Logger log = LoggerFactory.getLogger(ImportTable.class);

    private static final String STAR = "*";
    private static final String BUILTINS_ALIAS = "__builtins__";
    private static final Set<String> CHECK_ONLY_TYPING_NAMES = Set.of("reveal_type", "reveal_locals");

    // import fqn -> alias (insertion ordered, the order imports appear in)
    private final Map<String, String> imports = new LinkedHashMap<>();
    // alias -> import fqn, without star imports
    private final Map<String, String> importsByAlias = new HashMap<>();
    // access expression -> resolved access path (empty when it does not go through an import)
    private final Map<String, Optional<AccessPath>> accessCache = new HashMap<>();
    private final Set<String> globalNames = new LinkedHashSet<>();

    /**
     * Registers one imported name.
     *
     * @param name imported name ({@code a.b.c} for {@code import a.b.c}, {@code x} or {@code *} for from-imports)
     * @param module module of a from-import (possibly relative, e.g. {@code .pkg}), null for plain imports
     * @param alias the {@code as} name, null if absent
     * @return the fully-qualified name of the import
     * @throws PolicyViolationException for {@code __future__} imports
     * @throws UnsupportedConstructException if the same name was already imported under another alias
     */
    public String registerImport(String name, String module, String alias) {
        String fqn = module == null ? name : stripTrailingDot(module) + "." + name;

        if (fqn.startsWith("__future__")) {
            throw new PolicyViolationException("__future__ imports are useless in stubs", fqn, "import");
        }

        String effectiveAlias = alias != null ? alias : name;
        String existing = imports.putIfAbsent(fqn, effectiveAlias);
        if (existing != null && !existing.equals(effectiveAlias)) {
            throw new UnsupportedConstructException("'" + fqn + "' cannot be imported as another name ('"
                    + effectiveAlias + "', already imported as '" + existing + "')", fqn, "import");
        }

        if (!STAR.equals(name)) {
            importsByAlias.put(effectiveAlias, fqn);
            globalNames.add(firstComponent(effectiveAlias));
        }
        accessCache.clear();

        log.trace("Registered import {} as {}", fqn, effectiveAlias);
        return fqn;
    }

    /**
     * Registers {@code import a.b.c}, which also binds {@code a.b} and {@code a} when there is no alias.
     */
    public String registerModuleImport(String dottedName, String alias) {
        String fqn = registerImport(dottedName, null, alias);
        if (alias == null) {
            String parent = fqn;
            while (parent.contains(".")) {
                parent = parent.substring(0, parent.lastIndexOf('.'));
                registerImport(parent, null, null);
            }
        }
        return fqn;
    }

    /**
     * Records a name bound at module level by a class, function, assignment or type alias.
     */
    public void declareGlobalName(String name) {
        globalNames.add(name);
    }

    /**
     * How {@code module.symbol} can be accessed in this file.
     *
     * <p>Resolution order: a direct or aliased import, a star import of the module, an unshadowed
     * builtin, then the nearest imported enclosing package. A shadowed builtin falls back to
     * {@code __builtins__.name}.
     *
     * @return the spelling to use, or empty if the symbol is not reachable
     */
    public Optional<String> resolve(String module, String symbol) {
        String fqn = module + "." + symbol;

        String alias = imports.get(fqn);
        if (alias == null) {
            alias = imports.get(module + "." + STAR);
        }
        if (alias != null) {
            return Optional.of(STAR.equals(alias) ? symbol : alias);
        }

        String fallback = null;
        if (ModuleSymbol.BUILTINS.equals(module) || (isTypingModule(module) && CHECK_ONLY_TYPING_NAMES.contains(symbol))) {
            fallback = symbol;
            if (!globalNames.contains(symbol)) {
                return Optional.of(symbol);
            }
        }

        String[] parts = fqn.split("\\.");
        for (int i = parts.length - 1; i > 0; i--) {
            String pkg = String.join(".", Arrays.copyOfRange(parts, 0, i));
            String rest = String.join(".", Arrays.copyOfRange(parts, i, parts.length));

            String packageAlias = lookupPackage(pkg + "." + STAR);
            if (packageAlias == null) {
                packageAlias = lookupPackage(pkg);
            }
            if (packageAlias != null) {
                return Optional.of(STAR.equals(packageAlias) ? rest : packageAlias + "." + rest);
            }
        }

        return Optional.ofNullable(fallback);
    }

    public Optional<String> resolve(ModuleSymbol symbol) {
        return resolve(symbol.getModule(), symbol.getSymbol());
    }

    /**
     * Resolves {@code typing.name}, then {@code typing_extensions.name}.
     */
    public Optional<String> resolveFromTyping(String symbol) {
        Optional<String> resolved = resolve(ModuleSymbol.TYPING, symbol);
        return resolved.isPresent() ? resolved : resolve(ModuleSymbol.TYPING_EXTENSIONS, symbol);
    }

    /**
     * Which import a dotted name or attribute chain goes through.
     *
     * <p>The expression itself is tried as an alias first, then its prefixes from longest to shortest.
     * Results are memoized until the next import is registered.
     *
     * @param dotted dotted source text, e.g. {@code tpx.Buffer} or {@code Self}
     */
    public Optional<AccessPath> resolveAccessExpression(String dotted) {
        Optional<AccessPath> cached = accessCache.get(dotted);
        if (cached != null) {
            return cached;
        }

        Optional<AccessPath> result = Optional.empty();
        String direct = importsByAlias.get(dotted);
        if (direct != null) {
            result = Optional.of(new AccessPath(dotted, direct, null));
        } else {
            String prefix = dotted;
            String member = null;
            while (prefix.contains(".")) {
                int dot = prefix.lastIndexOf('.');
                String last = prefix.substring(dot + 1);
                member = member == null ? last : last + "." + member;
                prefix = prefix.substring(0, dot);

                String importFqn = importsByAlias.get(prefix);
                if (importFqn != null) {
                    result = Optional.of(new AccessPath(prefix, importFqn, member));
                    break;
                }
            }
        }

        accessCache.put(dotted, result);
        return result;
    }

    /**
     * Best-effort resolution of a dotted expression to what it refers to.
     *
     * <p>Falls back to builtins for {@code __builtins__.x} and for bare names that are neither
     * imported nor bound at module level. Names bound in this file resolve to nothing.
     */
    public Optional<AccessPath> qualify(String dotted) {
        Optional<AccessPath> imported = resolveAccessExpression(dotted);
        if (imported.isPresent()) {
            return imported;
        }

        String first = firstComponent(dotted);
        if (BUILTINS_ALIAS.equals(first) && dotted.length() > first.length()) {
            return Optional.of(new AccessPath(BUILTINS_ALIAS, ModuleSymbol.BUILTINS, dotted.substring(first.length() + 1)));
        }
        if (first.equals(dotted) && !globalNames.contains(dotted)) {
            return Optional.of(new AccessPath("", ModuleSymbol.BUILTINS, dotted));
        }
        return Optional.empty();
    }

    /**
     * Whether a local name is bound by an import.
     */
    public boolean isImportedAlias(String name) {
        return importsByAlias.containsKey(name);
    }

    /**
     * Fully-qualified name imported under the given alias, if any.
     */
    public Optional<String> lookupAlias(String alias) {
        return Optional.ofNullable(importsByAlias.get(alias));
    }

    public boolean isImported(String fqn) {
        return imports.containsKey(fqn);
    }

    public Map<String, String> getImports() {
        return Collections.unmodifiableMap(imports);
    }

    public Set<String> getGlobalNames() {
        return Collections.unmodifiableSet(globalNames);
    }

    private String lookupPackage(String key) {
        if (ModuleSymbol.BUILTINS.equals(key)) {
            String alias = imports.get(key);
            return alias != null ? alias : BUILTINS_ALIAS;
        }
        return imports.get(key);
    }

    private static boolean isTypingModule(String module) {
        return ModuleSymbol.TYPING.equals(module) || ModuleSymbol.TYPING_EXTENSIONS.equals(module);
    }

    private static String stripTrailingDot(String module) {
        return module.endsWith(".") ? module.substring(0, module.length() - 1) : module;
    }

    private static String firstComponent(String name) {
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
