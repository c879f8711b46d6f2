package me.christianrobert.pyibackport.transformer.imports;

import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Imports to add and from-imported names to remove, applied to the module once at its end.
 *
 * <p>{@link #require} is the single way both passes get hold of a symbol: it reuses whatever
 * import already reaches the symbol and only schedules a new {@code from module import symbol}
 * when nothing does.
 *
 * <p>A symbol required from typing_extensions wins over the same name from typing, so the
 * bare name is never imported from both modules.
 */
public class ImportDelta {

    private static final Logger log = LoggerFactory.getLogger(ImportDelta.class);

    private final ImportTable imports;
    private final SortedSet<ModuleSymbol> additions = new TreeSet<>();
    private final SortedSet<ModuleSymbol> deletions = new TreeSet<>();

    public ImportDelta(ImportTable imports) {
        this.imports = imports;
    }

    /**
     * How to spell {@code symbol} in the rewritten module, scheduling an import if needed.
     */
    public String require(ModuleSymbol symbol) {
        ModuleSymbol effective = preferred(symbol);

        Optional<String> existing = resolveExisting(effective);
        if (existing.isPresent()) {
            return existing.get();
        }

        if (additions.add(effective)) {
            log.trace("Scheduled import of {}", effective);
            if (ModuleSymbol.TYPING_EXTENSIONS.equals(effective.getModule())) {
                ModuleSymbol fromTyping = effective.inOtherTypingModule();
                additions.remove(fromTyping);
                deletions.add(fromTyping);
            }
        }
        return effective.getSymbol();
    }

    /**
     * Whether {@code symbol} is reachable through an import that is already in the module.
     */
    public boolean isSatisfied(ModuleSymbol symbol) {
        return resolveExisting(preferred(symbol)).isPresent();
    }

    /**
     * Removes {@code module.symbol} from the from-imports that import it under its own name.
     */
    public void discard(ModuleSymbol symbol) {
        deletions.add(symbol);
        log.trace("Scheduled removal of {}", symbol);
    }

    /**
     * The symbol actually used for {@code symbol}: the typing_extensions variant when that one
     * is imported by this delta.
     */
    public ModuleSymbol preferred(ModuleSymbol symbol) {
        if (ModuleSymbol.TYPING.equals(symbol.getModule())) {
            ModuleSymbol extension = symbol.inOtherTypingModule();
            if (additions.contains(extension)) {
                return extension;
            }
        }
        return symbol;
    }

    /**
     * Whether a from-imported {@code module.name [as alias]} has to be removed.
     */
    public boolean isDeleted(String module, String name, String alias) {
        return (alias == null || alias.equals(name)) && deletions.contains(new ModuleSymbol(module, name));
    }

    public SortedSet<ModuleSymbol> getAdditions() {
        return Collections.unmodifiableSortedSet(additions);
    }

    public SortedSet<ModuleSymbol> getDeletions() {
        return Collections.unmodifiableSortedSet(deletions);
    }

    public ImportTable getImports() {
        return imports;
    }

    public boolean isEmpty() {
        return additions.isEmpty() && deletions.isEmpty();
    }

    private Optional<String> resolveExisting(ModuleSymbol symbol) {
        if (additions.contains(symbol)) {
            return Optional.of(symbol.getSymbol());
        }
        if (deletions.contains(symbol)) {
            // the import that reaches it is going away
            return Optional.empty();
        }

        Optional<String> resolved = imports.resolve(symbol);
        if (resolved.isEmpty() && ModuleSymbol.TYPING.equals(symbol.getModule())) {
            // typing_extensions re-exports everything typing has
            resolved = imports.resolve(symbol.inOtherTypingModule());
        }
        return resolved;
    }
}
