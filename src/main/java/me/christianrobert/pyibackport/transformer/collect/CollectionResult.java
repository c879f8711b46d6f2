package me.christianrobert.pyibackport.transformer.collect;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.imports.ImportDelta;
import me.christianrobert.pyibackport.transformer.imports.ImportTable;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import me.christianrobert.pyibackport.transformer.model.TypeParameter;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the collector learned about a module, handed to the rewrite pass.
 */
public class CollectionResult {

    private final PythonVersion target;
    private final ImportTable imports;
    private final ImportDelta importDelta;
    private final TypeParameterRegistry registry;
    private final Map<ParserRuleContext, GenericDeclaration> declarations;
    private final Map<PyStubParser.StatementContext, List<TypeParameter>> declarationsByOwner;
    private final List<PyStubParser.ImportFromContext> fromImports;
    private final Map<String, List<String>> classBases;
    private final Set<ModuleSymbol> neededSupport;
    private final Set<ModuleSymbol> satisfiedSupport;

    CollectionResult(PythonVersion target, ImportTable imports, ImportDelta importDelta,
                     TypeParameterRegistry registry, Map<ParserRuleContext, GenericDeclaration> declarations,
                     Map<PyStubParser.StatementContext, List<TypeParameter>> declarationsByOwner,
                     List<PyStubParser.ImportFromContext> fromImports, Map<String, List<String>> classBases,
                     Set<ModuleSymbol> neededSupport, Set<ModuleSymbol> satisfiedSupport) {
        this.target = target;
        this.imports = imports;
        this.importDelta = importDelta;
        this.registry = registry;
        this.declarations = declarations;
        this.declarationsByOwner = declarationsByOwner;
        this.fromImports = fromImports;
        this.classBases = classBases;
        this.neededSupport = neededSupport;
        this.satisfiedSupport = satisfiedSupport;
    }

    public PythonVersion getTarget() {
        return target;
    }

    public ImportTable getImports() {
        return imports;
    }

    /**
     * Imports to add and remove; the rewrite pass keeps adding to it.
     */
    public ImportDelta getImportDelta() {
        return importDelta;
    }

    public TypeParameterRegistry getRegistry() {
        return registry;
    }

    /**
     * The generic declaration for a class, function or type alias node, if it has one.
     */
    public GenericDeclaration getDeclaration(ParserRuleContext node) {
        return declarations.get(node);
    }

    public Map<ParserRuleContext, GenericDeclaration> getDeclarations() {
        return Collections.unmodifiableMap(declarations);
    }

    /**
     * Parameters to declare, grouped by the module-level statement that introduces them, in document order.
     */
    public Map<PyStubParser.StatementContext, List<TypeParameter>> getDeclarationsByOwner() {
        return Collections.unmodifiableMap(declarationsByOwner);
    }

    /**
     * From-imports outside classes and functions, in document order.
     */
    public List<PyStubParser.ImportFromContext> getFromImports() {
        return Collections.unmodifiableList(fromImports);
    }

    /**
     * Base class names per qualified class name, after unwrapping {@code cast(...)}.
     */
    public Map<String, List<String>> getClassBases() {
        return Collections.unmodifiableMap(classBases);
    }

    /**
     * Symbols the lowered declarations need that no existing import provides.
     */
    public Set<ModuleSymbol> getNeededSupport() {
        return Collections.unmodifiableSet(neededSupport);
    }

    /**
     * Symbols the lowered declarations need that existing imports already provide.
     */
    public Set<ModuleSymbol> getSatisfiedSupport() {
        return Collections.unmodifiableSet(satisfiedSupport);
    }

    public Set<String> getVariadicNames() {
        return registry.variadicNames();
    }

    public boolean hasLoweredDeclarations() {
        for (GenericDeclaration declaration : declarations.values()) {
            if (declaration.isLowered()) {
                return true;
            }
        }
        return false;
    }
}
