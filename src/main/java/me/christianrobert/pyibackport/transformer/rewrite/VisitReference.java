package me.christianrobert.pyibackport.transformer.rewrite;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.catalog.BackportRequirement;
import me.christianrobert.pyibackport.transformer.imports.AccessPath;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.util.NameChains;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Static helper for renaming references to relocated symbols.
 *
 * <p>Handles the outermost pure name chain of an expression: a bare name or a dotted
 * attribute access on names only.</p>
 *
 * <h3>Examples (target 3.11):</h3>
 * <pre>
 * from enum import ReprEnum      class E(ReprEnum)          -&gt; class E(Enum)
 * import collections.abc         collections.abc.Buffer     -&gt; Buffer   (from typing_extensions)
 * import typing as t             t.List[int]                -&gt; list[int]
 * from datetime import UTC       UTC                        -&gt; timezone.utc
 * import types                   types.NoneType.__name__    -&gt; type.__name__
 * </pre>
 *
 * <h3>Algorithm:</h3>
 * <ol>
 *   <li>Resolve the chain to a fully-qualified name through the import table</li>
 *   <li>Find the longest prefix of that name, no shorter than the import itself, that has an
 *       active relocation for the target</li>
 *   <li>Replace the matching prefix of the expression with the spelling of the relocation,
 *       scheduling its import; attributes after the prefix are kept</li>
 * </ol>
 *
 * <p>Names defined in the file itself resolve to nothing and are never renamed.</p>
 */
public class VisitReference {

    private static final Logger log = LoggerFactory.getLogger(VisitReference.class);

    /**
     * Renames the relocated prefix of a pure name chain, if any.
     *
     * @param chain outermost pure chain
     * @param r StubRewriter instance (import table, catalog, token rewriter)
     */
    public static void v(PyStubParser.ExprContext chain, StubRewriter r) {
        Optional<AccessPath> access = r.getCollection().getImports().qualify(NameChains.dotted(chain));
        if (access.isEmpty()) {
            return;
        }

        String[] parts = access.get().getQualifiedName().split("\\.");
        int importParts = access.get().getImportFqn().split("\\.").length;

        for (int k = parts.length; k >= Math.max(importParts, 2); k--) {
            String module = String.join(".", Arrays.copyOfRange(parts, 0, k - 1));
            String symbol = parts[k - 1];

            Optional<BackportRequirement> requirement =
                    r.getBackports().findActive(module, symbol, r.getTarget());
            if (requirement.isEmpty()) {
                continue;
            }

            // the expression spells the import with its alias, the rest one component per name
            int prefixLength = k - importParts + access.get().getAliasLength();
            List<PyStubParser.ExprContext> prefixes = NameChains.prefixes(chain);
            if (prefixLength < 1 || prefixLength > prefixes.size()) {
                return;
            }
            PyStubParser.ExprContext prefix = prefixes.get(prefixLength - 1);

            String replacement = spell(requirement.get(), r);
            if (!replacement.equals(prefix.getText())) {
                log.trace("Renaming {} to {}", prefix.getText(), replacement);
                r.replace(prefix, replacement);
            }
            return;
        }
    }

    private static String spell(BackportRequirement requirement, StubRewriter r) {
        ModuleSymbol relocation = requirement.getRelocation();
        if (requirement.isRelocatedToAttribute()) {
            // datetime.timezone.utc: import the class, then access the attribute
            return r.reference(ModuleSymbol.parse(relocation.getModule())) + "." + relocation.getSymbol();
        }
        return r.reference(relocation);
    }
}
