package me.christianrobert.pyibackport.transformer.collect;

import me.christianrobert.pyibackport.antlr.PyStubBaseVisitor;
import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.catalog.BackportCatalog;
import me.christianrobert.pyibackport.transformer.catalog.BackportRequirement;
import me.christianrobert.pyibackport.transformer.catalog.DenylistCatalog;
import me.christianrobert.pyibackport.transformer.context.ConflictException;
import me.christianrobert.pyibackport.transformer.context.PolicyViolationException;
import me.christianrobert.pyibackport.transformer.context.UnsupportedConstructException;
import me.christianrobert.pyibackport.transformer.imports.AccessPath;
import me.christianrobert.pyibackport.transformer.imports.ImportDelta;
import me.christianrobert.pyibackport.transformer.imports.ImportTable;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import me.christianrobert.pyibackport.transformer.model.TypeExpression;
import me.christianrobert.pyibackport.transformer.model.TypeParameter;
import me.christianrobert.pyibackport.transformer.util.NameChains;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * First pass: collects imports, generic declarations and class bases of a stub module.
 *
 * <p>Walks the tree once in document order and rejects everything the rewrite pass cannot
 * handle, so that the rewrite never fails halfway. Work that needs the complete import table
 * (name resolution of bases and references, relocated from-imports, support symbols) is done
 * in {@link #collect} after the walk.</p>
 *
 * <p><b>Rejections:</b></p>
 * <ul>
 *   <li>{@link PolicyViolationException}: executable statements and expressions, quoted
 *       annotations, module-level {@code __getattr__}/{@code __dir__}, non-trivial function bodies</li>
 *   <li>{@link UnsupportedConstructException}: nested imports and type aliases, denylisted
 *       wildcard imports, names and bases, starred bases, aliasing imports by assignment</li>
 *   <li>{@link ConflictException}: a type parameter name reused with a different declaration,
 *       PEP 695 parameters on a class that also subclasses {@code Generic[...]}</li>
 * </ul>
 *
 * <p>Usage: {@code new StubCollector(target, backports, denylist).collect(tree)}; one instance per module.</p>
 */
public class StubCollector extends PyStubBaseVisitor<Void> {

    private static final Logger log = LoggerFactory.getLogger(StubCollector.class);

    private static final Set<String> FORBIDDEN_MODULE_FUNCTIONS = Set.of("__getattr__", "__dir__");
    private static final Set<String> LEGACY_ANNOTATION_KEYWORDS = Set.of("bound", "default");
    private static final Set<String> GENERIC_BASES = Set.of(
            "typing.Generic", "typing_extensions.Generic", "typing.Protocol", "typing_extensions.Protocol");
    private static final Set<String> PROTOCOL_BASES = Set.of("typing.Protocol", "typing_extensions.Protocol");
    private static final Set<String> TYPE_ALIAS_ANNOTATIONS = Set.of("typing.TypeAlias", "typing_extensions.TypeAlias");
    private static final Set<String> CAST_FUNCTIONS = Set.of("typing.cast", "typing_extensions.cast");
    private static final Set<String> ANY = Set.of("typing.Any", "typing_extensions.Any");

    private final PythonVersion target;
    private final BackportCatalog backports;
    private final DenylistCatalog denylist;

    private final ImportTable imports = new ImportTable();
    private final ScopeStack scopes = new ScopeStack();
    private final TypeParameterRegistry registry = new TypeParameterRegistry();

    private final List<GenericDeclaration> declarations = new ArrayList<>();
    private final Map<ParserRuleContext, GenericDeclaration> declarationsByNode = new IdentityHashMap<>();
    private final List<PendingBase> pendingBases = new ArrayList<>();
    private final List<PyStubParser.ExprContext> references = new ArrayList<>();
    private final List<PyStubParser.ImportFromContext> fromImports = new ArrayList<>();

    private PyStubParser.StatementContext currentOwner;

    /**
     * A positional class base, resolved once all imports are known.
     */
    private static class PendingBase {
        final String className;
        final PyStubParser.ClassDefContext classDef;
        final PyStubParser.ExprContext expr;

        PendingBase(String className, PyStubParser.ClassDefContext classDef, PyStubParser.ExprContext expr) {
            this.className = className;
            this.classDef = classDef;
            this.expr = expr;
        }
    }

    public StubCollector(PythonVersion target, BackportCatalog backports, DenylistCatalog denylist) {
        if (target == null) {
            throw new IllegalArgumentException("Target version cannot be null");
        }
        this.target = target;
        this.backports = backports;
        this.denylist = denylist;

        log.debug("StubCollector created for target {}", target);
    }

    /**
     * Walks the module and resolves everything that needs the complete import table.
     */
    public CollectionResult collect(PyStubParser.ModuleContext module) {
        visit(module);

        log.debug("Collected {} imports, {} generic declarations, {} references",
                imports.getImports().size(), declarations.size(), references.size());

        ImportDelta delta = new ImportDelta(imports);
        Map<PyStubParser.StatementContext, List<TypeParameter>> byOwner = buildTypeParameters();
        Map<String, List<String>> classBases = resolveClassBases();
        Set<ParserRuleContext> exempt = exemptCastCallees();
        checkReferences(exempt);
        relocateFromImports(delta);

        Set<ModuleSymbol> needed = new TreeSet<>();
        Set<ModuleSymbol> satisfied = new TreeSet<>();
        requireSupport(delta, byOwner, needed, satisfied);

        log.debug("Support symbols: {} needed, {} already imported", needed.size(), satisfied.size());

        return new CollectionResult(target, imports, delta, registry, declarationsByNode, byOwner,
                fromImports, classBases, needed, satisfied);
    }

    // ========== Statements ==========

    @Override
    public Void visitStatement(PyStubParser.StatementContext ctx) {
        if (ctx.getParent() instanceof PyStubParser.ModuleContext) {
            currentOwner = ctx;
        }
        return visitChildren(ctx);
    }

    @Override
    public Void visitDelStatement(PyStubParser.DelStatementContext ctx) {
        throw uselessStatement("del", ctx);
    }

    @Override
    public Void visitPassStatement(PyStubParser.PassStatementContext ctx) {
        throw uselessStatement("pass", ctx);
    }

    @Override
    public Void visitReturnStatement(PyStubParser.ReturnStatementContext ctx) {
        throw uselessStatement("return", ctx);
    }

    @Override
    public Void visitRaiseStatement(PyStubParser.RaiseStatementContext ctx) {
        throw uselessStatement("raise", ctx);
    }

    @Override
    public Void visitGlobalStatement(PyStubParser.GlobalStatementContext ctx) {
        throw uselessStatement("global", ctx);
    }

    @Override
    public Void visitNonlocalStatement(PyStubParser.NonlocalStatementContext ctx) {
        throw uselessStatement("nonlocal", ctx);
    }

    @Override
    public Void visitAssertStatement(PyStubParser.AssertStatementContext ctx) {
        throw uselessStatement("assert", ctx);
    }

    @Override
    public Void visitBreakStatement(PyStubParser.BreakStatementContext ctx) {
        throw uselessStatement("break", ctx);
    }

    @Override
    public Void visitContinueStatement(PyStubParser.ContinueStatementContext ctx) {
        throw uselessStatement("continue", ctx);
    }

    @Override
    public Void visitForStatement(PyStubParser.ForStatementContext ctx) {
        throw uselessStatement("for", ctx);
    }

    @Override
    public Void visitWhileStatement(PyStubParser.WhileStatementContext ctx) {
        throw uselessStatement("while", ctx);
    }

    @Override
    public Void visitTryStatement(PyStubParser.TryStatementContext ctx) {
        throw uselessStatement("try", ctx);
    }

    @Override
    public Void visitWithStatement(PyStubParser.WithStatementContext ctx) {
        throw uselessStatement("with", ctx);
    }

    // ========== Imports ==========

    @Override
    public Void visitImportName(PyStubParser.ImportNameContext ctx) {
        requireModuleLevelImport(ctx);
        for (PyStubParser.DottedAsNameContext dotted : ctx.dottedAsName()) {
            String alias = dotted.name() != null ? dotted.name().getText() : null;
            imports.registerModuleImport(dotted.dottedName().getText(), alias);
        }
        return null;
    }

    @Override
    public Void visitImportFrom(PyStubParser.ImportFromContext ctx) {
        requireModuleLevelImport(ctx);

        String module = ctx.relativeModule().getText();
        PyStubParser.ImportTargetsContext targets = ctx.importTargets();
        if (targets.importAsNames() == null) {
            if (denylist.isDeniedWildcard(module)) {
                throw new UnsupportedConstructException("Wildcard imports from '" + module + "' are not supported",
                        ctx.getText(), "import");
            }
            imports.registerImport("*", module, null);
        } else {
            for (PyStubParser.ImportAsNameContext name : targets.importAsNames().importAsName()) {
                String alias = name.name().size() > 1 ? name.name(1).getText() : null;
                imports.registerImport(name.name(0).getText(), module, alias);
            }
        }
        fromImports.add(ctx);
        return null;
    }

    private void requireModuleLevelImport(ParserRuleContext ctx) {
        if (!scopes.isModuleLevel()) {
            throw new UnsupportedConstructException("Only top-level import statements are supported",
                    ctx.getText(), scopes.qualifiedName());
        }
    }

    // ========== Assignments ==========

    @Override
    public Void visitAssignment(PyStubParser.AssignmentContext ctx) {
        List<PyStubParser.StarExpressionsContext> sides = ctx.starExpressions();
        int targetCount = ctx.yieldExpr() != null ? sides.size() : sides.size() - 1;
        PyStubParser.ExprContext value = ctx.yieldExpr() != null ? null : singleExpr(sides.get(sides.size() - 1));

        checkAssignedImport(value);
        for (int i = 0; i < targetCount; i++) {
            String name = NameChains.bareName(singleExpr(sides.get(i)));
            if (name != null) {
                declareAssignmentTarget(name, ctx);
            }
        }
        if (targetCount == 1 && value instanceof PyStubParser.CallExprContext) {
            checkLegacyTypeVarLike(NameChains.bareName(singleExpr(sides.get(0))),
                    (PyStubParser.CallExprContext) value);
        }

        // targets are not references
        if (ctx.yieldExpr() != null) {
            return visit(ctx.yieldExpr());
        }
        return visit(sides.get(sides.size() - 1));
    }

    @Override
    public Void visitAnnAssign(PyStubParser.AnnAssignContext ctx) {
        PyStubParser.ExprContext value = ctx.starExpressions() != null ? singleExpr(ctx.starExpressions()) : null;
        checkAssignedImport(value);

        String name = NameChains.bareName(ctx.expr());
        if (name != null) {
            declareAssignmentTarget(name, ctx);
        }

        PyStubParser.ExprContext annotation = ctx.annotation().expr();
        if (value != null && NameChains.isStringLiteral(value) && NameChains.isPureChain(annotation)
                && TYPE_ALIAS_ANNOTATIONS.contains(qualifiedName(annotation).orElse(""))) {
            throw quotedAnnotation(value, name != null ? name : ctx.expr().getText());
        }

        if (name == null) {
            visit(ctx.expr());
        }
        visit(ctx.annotation());
        if (ctx.starExpressions() != null) {
            visit(ctx.starExpressions());
        }
        if (ctx.yieldExpr() != null) {
            visit(ctx.yieldExpr());
        }
        return null;
    }

    private void declareAssignmentTarget(String name, ParserRuleContext ctx) {
        if (imports.isImportedAlias(name)) {
            throw new UnsupportedConstructException("Imported name '" + name + "' cannot be assigned to",
                    ctx.getText(), scopes.qualifiedName());
        }
        if (scopes.isModuleLevel()) {
            imports.declareGlobalName(name);
        }
    }

    /**
     * {@code X = imported_name} would create a second alias for the import.
     */
    private void checkAssignedImport(PyStubParser.ExprContext value) {
        if (value == null || !NameChains.isPureChain(value)) {
            return;
        }
        Optional<String> fqn = imports.lookupAlias(NameChains.dotted(value));
        if (fqn.isPresent()) {
            throw new UnsupportedConstructException("Multiple import aliases for '" + fqn.get() + "'",
                    value.getText(), scopes.qualifiedName());
        }
    }

    /**
     * {@code T = TypeVar("T", "int", bound="str")}: the annotation positions must not be quoted.
     */
    private void checkLegacyTypeVarLike(String target, PyStubParser.CallExprContext call) {
        if (target == null || call.arguments() == null || !NameChains.isPureChain(call.expr())) {
            return;
        }
        List<PyStubParser.ArgumentContext> args = call.arguments().argument();
        if (args.size() < 2 || !(args.get(0) instanceof PyStubParser.PositionalArgumentContext)) {
            return;
        }
        PyStubParser.ExprContext first = ((PyStubParser.PositionalArgumentContext) args.get(0)).expr();
        if (!NameChains.isStringLiteral(first) || !target.equals(stringValue(first))) {
            return;
        }

        String context = target + " = " + call.expr().getText() + "(...)";
        for (PyStubParser.ArgumentContext arg : args.subList(1, args.size())) {
            PyStubParser.ExprContext expr = null;
            if (arg instanceof PyStubParser.PositionalArgumentContext) {
                expr = ((PyStubParser.PositionalArgumentContext) arg).expr();
            } else if (arg instanceof PyStubParser.KeywordArgumentContext) {
                PyStubParser.KeywordArgumentContext keyword = (PyStubParser.KeywordArgumentContext) arg;
                if (LEGACY_ANNOTATION_KEYWORDS.contains(keyword.name().getText())) {
                    expr = keyword.expr();
                }
            }
            if (expr != null && NameChains.isStringLiteral(expr)) {
                throw quotedAnnotation(expr, context);
            }
        }
    }

    // ========== Annotations ==========

    @Override
    public Void visitAnnotation(PyStubParser.AnnotationContext ctx) {
        if (NameChains.isStringLiteral(ctx.expr())) {
            throw quotedAnnotation(ctx.expr(), scopes.qualifiedName());
        }
        return visitChildren(ctx);
    }

    @Override
    public Void visitStarAnnotation(PyStubParser.StarAnnotationContext ctx) {
        if (ctx.expr() != null && NameChains.isStringLiteral(ctx.expr())) {
            throw quotedAnnotation(ctx.expr(), scopes.qualifiedName());
        }
        return visitChildren(ctx);
    }

    // ========== Declarations ==========

    @Override
    public Void visitTypeAlias(PyStubParser.TypeAliasContext ctx) {
        String name = ctx.name().getText();
        if (!scopes.isModuleLevel()) {
            throw new UnsupportedConstructException("Only top-level type aliases are supported",
                    ctx.getText(), scopes.qualify(name));
        }
        if (NameChains.isStringLiteral(ctx.expr())) {
            throw quotedAnnotation(ctx.expr(), "type " + name);
        }

        imports.declareGlobalName(name);
        addDeclaration(new GenericDeclaration(GenericDeclaration.Kind.TYPE_ALIAS, ctx, name, ctx.typeParams(),
                currentOwner));
        return visitChildren(ctx);
    }

    @Override
    public Void visitFunctionDef(PyStubParser.FunctionDefContext ctx) {
        String name = ctx.name().getText();
        String qualifiedName = scopes.qualify(name);

        if (scopes.isModuleLevel()) {
            if (FORBIDDEN_MODULE_FUNCTIONS.contains(name)) {
                throw new PolicyViolationException("Module-level " + name + "() cannot be used in a stub",
                        "def " + name, qualifiedName);
            }
            imports.declareGlobalName(name);
        }
        checkFunctionBody(ctx.block(), qualifiedName);

        if (ctx.typeParams() != null) {
            addDeclaration(new GenericDeclaration(GenericDeclaration.Kind.FUNCTION, ctx, qualifiedName,
                    ctx.typeParams(), currentOwner));
        }

        scopes.push(name);
        try {
            return visitChildren(ctx);
        } finally {
            scopes.pop();
        }
    }

    @Override
    public Void visitClassDef(PyStubParser.ClassDefContext ctx) {
        String name = ctx.name().getText();
        String qualifiedName = scopes.qualify(name);

        if (scopes.isModuleLevel()) {
            imports.declareGlobalName(name);
        }

        if (ctx.arguments() != null) {
            for (PyStubParser.ArgumentContext argument : ctx.arguments().argument()) {
                if (argument instanceof PyStubParser.StarArgumentContext) {
                    throw new UnsupportedConstructException("'" + qualifiedName + "': starred base classes are not supported",
                            argument.getText(), qualifiedName);
                }
                if (argument instanceof PyStubParser.PositionalArgumentContext) {
                    pendingBases.add(new PendingBase(qualifiedName, ctx,
                            ((PyStubParser.PositionalArgumentContext) argument).expr()));
                }
                // keyword arguments (metaclass=...) and **kwargs are not bases
            }
        }

        if (ctx.typeParams() != null) {
            addDeclaration(new GenericDeclaration(GenericDeclaration.Kind.CLASS, ctx, qualifiedName,
                    ctx.typeParams(), currentOwner));
        }

        scopes.push(name);
        try {
            return visitChildren(ctx);
        } finally {
            scopes.pop();
        }
    }

    private void addDeclaration(GenericDeclaration declaration) {
        declarations.add(declaration);
        declarationsByNode.put(declaration.getNode(), declaration);
        log.trace("Found generic declaration {}", declaration.getQualifiedName());
    }

    /**
     * A stub function body is {@code ...}, optionally preceded by a docstring.
     */
    private void checkFunctionBody(PyStubParser.BlockContext block, String qualifiedName) {
        List<PyStubParser.SimpleStatementsContext> lines = new ArrayList<>();
        if (block.simpleStatements() != null) {
            lines.add(block.simpleStatements());
        } else {
            for (PyStubParser.StatementContext statement : block.statement()) {
                if (statement.simpleStatements() == null) {
                    throw invalidBody(statement, qualifiedName);
                }
                lines.add(statement.simpleStatements());
            }
        }

        for (PyStubParser.SimpleStatementsContext line : lines) {
            for (PyStubParser.SmallStatementContext small : line.smallStatement()) {
                PyStubParser.ExpressionStatementContext expression = small.expressionStatement();
                PyStubParser.ExprContext expr = expression != null && expression.starExpressions() != null
                        ? singleExpr(expression.starExpressions())
                        : null;
                if (!isEllipsis(expr) && !NameChains.isStringLiteral(expr)) {
                    throw invalidBody(small, qualifiedName);
                }
            }
        }
    }

    private static PolicyViolationException invalidBody(ParserRuleContext ctx, String qualifiedName) {
        return new PolicyViolationException("Function body must contain only `...`", ctx.getText(), qualifiedName);
    }

    // ========== Expressions ==========

    @Override
    public Void visitAtomExpr(PyStubParser.AtomExprContext ctx) {
        if (NameChains.isOutermostChain(ctx)) {
            references.add(ctx);
            return null;
        }
        return visitChildren(ctx);
    }

    @Override
    public Void visitAttributeExpr(PyStubParser.AttributeExprContext ctx) {
        if (NameChains.isOutermostChain(ctx)) {
            references.add(ctx);
            return null;
        }
        return visitChildren(ctx);
    }

    @Override
    public Void visitStringAtom(PyStubParser.StringAtomContext ctx) {
        for (TerminalNode string : ctx.STRING()) {
            String text = string.getText();
            String prefix = text.substring(0, Math.max(firstQuote(text), 0));
            if (prefix.indexOf('f') >= 0 || prefix.indexOf('F') >= 0) {
                throw new PolicyViolationException("f-strings are useless in stubs", text, scopes.qualifiedName());
            }
        }
        return null;
    }

    @Override
    public Void visitAndExpr(PyStubParser.AndExprContext ctx) {
        throw new PolicyViolationException("Boolean operations are useless in stubs", ctx.getText(),
                scopes.qualifiedName());
    }

    @Override
    public Void visitOrExpr(PyStubParser.OrExprContext ctx) {
        throw new PolicyViolationException("Boolean operations are useless in stubs", ctx.getText(),
                scopes.qualifiedName());
    }

    @Override
    public Void visitLambdaExpr(PyStubParser.LambdaExprContext ctx) {
        throw invalidExpression("lambda", ctx);
    }

    @Override
    public Void visitAwaitExpr(PyStubParser.AwaitExprContext ctx) {
        throw invalidExpression("await", ctx);
    }

    @Override
    public Void visitYieldExpr(PyStubParser.YieldExprContext ctx) {
        throw invalidExpression("yield", ctx);
    }

    // ========== Resolution (after the walk) ==========

    /**
     * Builds the type parameters of every declaration, decides which declarations are lowered
     * and registers their parameters module-wide.
     */
    private Map<PyStubParser.StatementContext, List<TypeParameter>> buildTypeParameters() {
        TypeParameterFactory factory = new TypeParameterFactory(this::meaningOf);
        Map<PyStubParser.StatementContext, List<TypeParameter>> byOwner = new LinkedHashMap<>();

        for (GenericDeclaration declaration : declarations) {
            if (declaration.getTypeParams() != null) {
                boolean inferVariance = declaration.getKind() == GenericDeclaration.Kind.CLASS;
                for (PyStubParser.TypeParamContext param : declaration.getTypeParams().typeParam()) {
                    declaration.addParameter(factory.create(param, inferVariance, declaration.getQualifiedName()));
                }
            }

            declaration.setLowered(shouldLower(declaration));
            if (!declaration.isLowered()) {
                continue;
            }

            for (TypeParameter parameter : declaration.getParameters()) {
                if (registry.register(parameter, declaration.getQualifiedName()) == TypeParameterRegistry.Outcome.REGISTERED) {
                    byOwner.computeIfAbsent(declaration.getOwner(), owner -> new ArrayList<>()).add(parameter);
                }
            }
            log.trace("Lowering {}", declaration);
        }
        return byOwner;
    }

    /**
     * PEP 695 syntax exists since 3.12; defaults (PEP 696) since 3.13.
     */
    private boolean shouldLower(GenericDeclaration declaration) {
        if (target.isAtLeast(PythonVersion.PY313)) {
            return false;
        }
        if (target.isAtLeast(PythonVersion.PY312)) {
            return declaration.hasDefaults();
        }
        return true;
    }

    private Map<String, List<String>> resolveClassBases() {
        Map<String, List<String>> classBases = new LinkedHashMap<>();

        for (PendingBase base : pendingBases) {
            PyStubParser.ExprContext expr = unwrapCast(base.expr);

            PyStubParser.ExprContext nameExpr = expr;
            boolean subscripted = false;
            if (expr instanceof PyStubParser.SubscriptExprContext) {
                nameExpr = ((PyStubParser.SubscriptExprContext) expr).expr();
                subscripted = true;
            }
            if (!NameChains.isPureChain(nameExpr)) {
                throw new UnsupportedConstructException("'" + base.className
                        + "': unsupported class argument expression", expr.getText(), base.className);
            }

            String baseName = NameChains.dotted(nameExpr);
            classBases.computeIfAbsent(base.className, name -> new ArrayList<>()).add(baseName);

            Optional<String> qualified = qualifiedName(nameExpr);
            if (qualified.isEmpty()) {
                // defined in this file
                continue;
            }
            String fqn = qualified.get();

            Optional<PythonVersion> allowedSince = denylist.deniedBase(fqn, target);
            if (allowedSince.isPresent()) {
                throw new UnsupportedConstructException("'" + fqn + "' cannot be subclassed when targeting Python "
                        + target + describeAllowed(allowedSince.get()), expr.getText(), base.className);
            }

            GenericDeclaration declaration = declarationsByNode.get(base.classDef);
            if (declaration == null) {
                continue;
            }
            if (subscripted && GENERIC_BASES.contains(fqn)) {
                throw new ConflictException("Can't use type params with a subscripted '" + fqn + "' base class",
                        expr.getText(), base.className);
            }
            if (!subscripted && PROTOCOL_BASES.contains(fqn) && declaration.getProtocolBase() == null) {
                declaration.setProtocolBase(expr);
            }
        }
        return classBases;
    }

    private PyStubParser.ExprContext unwrapCast(PyStubParser.ExprContext expr) {
        PyStubParser.ExprContext current = expr;
        while (isCastCall(current)) {
            List<PyStubParser.ArgumentContext> args = ((PyStubParser.CallExprContext) current).arguments().argument();
            PyStubParser.ArgumentContext value = args.get(1);
            if (!(value instanceof PyStubParser.PositionalArgumentContext)) {
                break;
            }
            current = ((PyStubParser.PositionalArgumentContext) value).expr();
        }
        return current;
    }

    private boolean isCastCall(PyStubParser.ExprContext expr) {
        if (!(expr instanceof PyStubParser.CallExprContext)) {
            return false;
        }
        PyStubParser.CallExprContext call = (PyStubParser.CallExprContext) expr;
        return call.arguments() != null
                && call.arguments().argument().size() == 2
                && NameChains.isPureChain(call.expr())
                && CAST_FUNCTIONS.contains(qualifiedName(call.expr()).orElse(""));
    }

    /**
     * Callees of the {@code cast(...)} wrappers in class bases, which may use the otherwise
     * denylisted {@code typing.cast}.
     */
    private Set<ParserRuleContext> exemptCastCallees() {
        Set<ParserRuleContext> exempt = new HashSet<>();
        for (PendingBase base : pendingBases) {
            PyStubParser.ExprContext current = base.expr;
            while (isCastCall(current)) {
                PyStubParser.CallExprContext call = (PyStubParser.CallExprContext) current;
                exempt.add(call.expr());
                PyStubParser.ArgumentContext value = call.arguments().argument().get(1);
                if (!(value instanceof PyStubParser.PositionalArgumentContext)) {
                    break;
                }
                current = ((PyStubParser.PositionalArgumentContext) value).expr();
            }
        }
        return exempt;
    }

    private void checkReferences(Set<ParserRuleContext> exempt) {
        for (PyStubParser.ExprContext reference : references) {
            if (exempt.contains(reference)) {
                continue;
            }
            Optional<String> qualified = qualifiedName(reference);
            if (qualified.isEmpty()) {
                continue;
            }

            String fqn = qualified.get();
            int dot = fqn.indexOf('.');
            while (dot > 0) {
                int next = fqn.indexOf('.', dot + 1);
                String prefix = next < 0 ? fqn : fqn.substring(0, next);
                Optional<PythonVersion> allowedSince = denylist.deniedName(prefix, target);
                if (allowedSince.isPresent()) {
                    throw new UnsupportedConstructException("'" + prefix + "' cannot be used when targeting Python "
                            + target + describeAllowed(allowedSince.get()), reference.getText(), "reference");
                }
                dot = next;
            }
        }
    }

    /**
     * Drops from-imports of relocated symbols and schedules the imports of their replacements.
     */
    private void relocateFromImports(ImportDelta delta) {
        for (PyStubParser.ImportFromContext ctx : fromImports) {
            String module = ctx.relativeModule().getText();
            PyStubParser.ImportAsNamesContext names = ctx.importTargets().importAsNames();
            if (names == null || module.startsWith(".")) {
                continue;
            }

            for (PyStubParser.ImportAsNameContext importAsName : names.importAsName()) {
                String name = importAsName.name(0).getText();
                String alias = importAsName.name().size() > 1 ? importAsName.name(1).getText() : null;

                Optional<BackportRequirement> requirement = backports.findActive(module, name, target);
                if (requirement.isEmpty()) {
                    continue;
                }

                ModuleSymbol relocation = requirement.get().getRelocation();
                if (alias != null && !alias.equals(name)) {
                    throw new UnsupportedConstructException("'" + module + "." + name + "' is relocated to '"
                            + relocation + "' for Python " + target + " and cannot be imported as '" + alias + "'",
                            importAsName.getText(), "import");
                }

                delta.discard(new ModuleSymbol(module, name));
                if (requirement.get().isRelocatedToAttribute()) {
                    delta.require(ModuleSymbol.parse(relocation.getModule()));
                } else {
                    delta.require(relocation);
                }
                log.trace("Relocating import {}.{} to {}", module, name, relocation);
            }
        }
    }

    private void requireSupport(ImportDelta delta, Map<PyStubParser.StatementContext, List<TypeParameter>> byOwner,
                                Set<ModuleSymbol> needed, Set<ModuleSymbol> satisfied) {
        List<ModuleSymbol> required = new ArrayList<>();
        for (List<TypeParameter> parameters : byOwner.values()) {
            for (TypeParameter parameter : parameters) {
                required.addAll(parameter.requiredSupport(target));
            }
        }

        for (GenericDeclaration declaration : declarations) {
            if (!declaration.isLowered()) {
                continue;
            }
            switch (declaration.getKind()) {
                case CLASS -> {
                    if (declaration.getProtocolBase() == null) {
                        required.add(ModuleSymbol.typing("Generic"));
                    }
                }
                case TYPE_ALIAS -> required.add(declaration.getParameters().size() < 2
                        ? ModuleSymbol.typing("TypeAlias")
                        : typeAliasTypeSymbol());
                case FUNCTION -> {
                }
            }
        }

        for (ModuleSymbol symbol : required) {
            if (delta.isSatisfied(symbol)) {
                satisfied.add(delta.preferred(symbol));
            } else {
                needed.add(delta.preferred(symbol));
            }
            delta.require(symbol);
        }
    }

    private ModuleSymbol typeAliasTypeSymbol() {
        return target.isBefore(PythonVersion.PY312)
                ? ModuleSymbol.typingExtensions("TypeAliasType")
                : ModuleSymbol.typing("TypeAliasType");
    }

    // ========== Helpers ==========

    private Optional<String> qualifiedName(PyStubParser.ExprContext chain) {
        return imports.qualify(NameChains.dotted(chain)).map(AccessPath::getQualifiedName);
    }

    private TypeExpression.Meaning meaningOf(PyStubParser.ExprContext expr) {
        if (!NameChains.isPureChain(expr)) {
            return TypeExpression.Meaning.OTHER;
        }
        String fqn = qualifiedName(expr).orElse("");
        if (ANY.contains(fqn)) {
            return TypeExpression.Meaning.ANY;
        }
        if ("builtins.object".equals(fqn)) {
            return TypeExpression.Meaning.OBJECT;
        }
        return TypeExpression.Meaning.OTHER;
    }

    private static String describeAllowed(PythonVersion allowedSince) {
        return allowedSince.equals(PythonVersion.NEVER) ? "" : " (allowed from Python " + allowedSince + ")";
    }

    /**
     * The expression of a one-element expression list without star or trailing comma, else null.
     */
    private static PyStubParser.ExprContext singleExpr(PyStubParser.StarExpressionsContext ctx) {
        if (ctx == null || ctx.starExpr().size() != 1 || ctx.getToken(PyStubParser.COMMA, 0) != null) {
            return null;
        }
        PyStubParser.StarExprContext starExpr = ctx.starExpr(0);
        return starExpr.getStart().getType() == PyStubParser.STAR ? null : starExpr.expr();
    }

    private static boolean isEllipsis(PyStubParser.ExprContext expr) {
        return expr instanceof PyStubParser.AtomExprContext
                && ((PyStubParser.AtomExprContext) expr).atom() instanceof PyStubParser.EllipsisAtomContext;
    }

    /**
     * Value of a single, unprefixed or raw short string literal; null for anything fancier.
     */
    private static String stringValue(PyStubParser.ExprContext expr) {
        String text = expr.getText();
        int quote = firstQuote(text);
        if (quote < 0 || text.length() - quote < 2) {
            return null;
        }
        String body = text.substring(quote);
        char q = body.charAt(0);
        if (body.charAt(body.length() - 1) != q || body.startsWith("" + q + q + q)) {
            return null;
        }
        return body.substring(1, body.length() - 1);
    }

    private static int firstQuote(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                return i;
            }
        }
        return -1;
    }

    private PolicyViolationException uselessStatement(String keyword, ParserRuleContext ctx) {
        return new PolicyViolationException("'" + keyword + "' statements are useless in stubs", ctx.getText(),
                scopes.qualifiedName());
    }

    private PolicyViolationException invalidExpression(String keyword, ParserRuleContext ctx) {
        return new PolicyViolationException("'" + keyword + "' is an invalid expression", ctx.getText(),
                scopes.qualifiedName());
    }

    private static PolicyViolationException quotedAnnotation(PyStubParser.ExprContext expr, String context) {
        return new PolicyViolationException("Quoted annotations should not be included in stubs", expr.getText(),
                context);
    }
}
