package me.christianrobert.pyibackport.transformer.rewrite;

import me.christianrobert.pyibackport.antlr.PyStubBaseVisitor;
import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.catalog.BackportCatalog;
import me.christianrobert.pyibackport.transformer.collect.CollectionResult;
import me.christianrobert.pyibackport.transformer.collect.GenericDeclaration;
import me.christianrobert.pyibackport.transformer.model.ModuleSymbol;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import me.christianrobert.pyibackport.transformer.model.RenderContext;
import me.christianrobert.pyibackport.transformer.model.TypeExpression;
import me.christianrobert.pyibackport.transformer.model.TypeParameter;
import me.christianrobert.pyibackport.transformer.util.NameChains;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStreamRewriter;
import org.antlr.v4.runtime.misc.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Second pass: rewrites the token stream of a stub module using what the collector found.
 *
 * <p>Walks the tree post-order, so every node is rewritten after its children. Edits are
 * recorded on a {@link TokenStreamRewriter}; untouched regions of the input, whitespace and
 * comments included, come out byte for byte.</p>
 *
 * <p><b>Design:</b></p>
 * <ul>
 *   <li>Extends PyStubBaseVisitor&lt;Void&gt;, delegating each construct to a static
 *       {@code VisitXxx.v(ctx, rewriter)} helper</li>
 *   <li>Implements {@link RenderContext}: every symbol it writes goes through the collector's
 *       {@link me.christianrobert.pyibackport.transformer.imports.ImportDelta}</li>
 *   <li>Type parameter declarations and new imports are queued and inserted at module exit</li>
 * </ul>
 *
 * <p>Outermost name chains are handled as a whole ({@link VisitReference}); the visitor does not
 * descend into them. Assignment targets and import statements are not visited.</p>
 */
public class StubRewriter extends PyStubBaseVisitor<Void> implements RenderContext {

    private static final Logger log = LoggerFactory.getLogger(StubRewriter.class);

    private final CollectionResult collection;
    private final BackportCatalog backports;
    private final CommonTokenStream tokens;
    private final TokenStreamRewriter rewriter;
    private final InsertionQueue insertions = new InsertionQueue();
    private final String lineEnding;

    // type parameter expression node -> its text after renames, captured before the brackets are removed
    private final Map<ParserRuleContext, String> renderedExpressions = new IdentityHashMap<>();

    public StubRewriter(CollectionResult collection, BackportCatalog backports, CommonTokenStream tokens) {
        if (collection == null) {
            throw new IllegalArgumentException("Collection result cannot be null");
        }
        if (tokens == null) {
            throw new IllegalArgumentException("Token stream cannot be null");
        }
        this.collection = collection;
        this.backports = backports;
        this.tokens = tokens;
        this.rewriter = new TokenStreamRewriter(tokens);
        this.lineEnding = lineEndingOf(tokens);

        log.debug("StubRewriter created for target {}", collection.getTarget());
    }

    /**
     * Rewrites the module and returns the new source text.
     */
    public String rewrite(PyStubParser.ModuleContext module) {
        visit(module);
        return rewriter.getText();
    }

    // ========== Module ==========

    @Override
    public Void visitModule(PyStubParser.ModuleContext ctx) {
        visitChildren(ctx);

        // render first: rendering may still schedule imports
        StringBuilder declarations = new StringBuilder();
        for (List<TypeParameter> parameters : collection.getDeclarationsByOwner().values()) {
            for (TypeParameter parameter : parameters) {
                declarations.append(parameter.renderDeclaration(getTarget(), this)).append(lineEnding);
            }
        }

        new ImportReconciler(collection.getImportDelta(), tokens, rewriter, insertions, lineEnding)
                .reconcile(ctx, collection.getFromImports());

        if (declarations.length() > 0) {
            ImportInsertionPoint point = DeclarationInsertionPoint.find(ctx);
            insertions.insertBefore(point.getTokenIndex(),
                    point.needsLineBreak() ? lineEnding + declarations : declarations.toString());
        }
        insertions.applyTo(rewriter);

        log.debug("Rewrote module: {} declaration groups, {} imports added, {} removed",
                collection.getDeclarationsByOwner().size(),
                collection.getImportDelta().getAdditions().size(), collection.getImportDelta().getDeletions().size());
        return null;
    }

    // ========== Statements ==========

    @Override
    public Void visitImportName(PyStubParser.ImportNameContext ctx) {
        return null;
    }

    @Override
    public Void visitImportFrom(PyStubParser.ImportFromContext ctx) {
        return null;
    }

    @Override
    public Void visitAssignment(PyStubParser.AssignmentContext ctx) {
        if (ctx.yieldExpr() != null) {
            return visit(ctx.yieldExpr());
        }
        List<PyStubParser.StarExpressionsContext> sides = ctx.starExpressions();
        return visit(sides.get(sides.size() - 1));
    }

    @Override
    public Void visitAnnAssign(PyStubParser.AnnAssignContext ctx) {
        visit(ctx.annotation());
        if (ctx.starExpressions() != null) {
            visit(ctx.starExpressions());
        }
        return null;
    }

    @Override
    public Void visitTypeAlias(PyStubParser.TypeAliasContext ctx) {
        visitChildren(ctx);
        VisitTypeAlias.v(ctx, this);
        return null;
    }

    @Override
    public Void visitFunctionDef(PyStubParser.FunctionDefContext ctx) {
        visitChildren(ctx);
        VisitFunctionDef.v(ctx, this);
        return null;
    }

    @Override
    public Void visitClassDef(PyStubParser.ClassDefContext ctx) {
        visitChildren(ctx);
        VisitClassDef.v(ctx, this);
        return null;
    }

    @Override
    public Void visitTypeParams(PyStubParser.TypeParamsContext ctx) {
        visitChildren(ctx);

        GenericDeclaration declaration = collection.getDeclaration(ctx.getParent());
        if (declaration != null && declaration.isLowered()) {
            for (TypeParameter parameter : declaration.getParameters()) {
                cacheRendered(parameter.getBound());
                for (TypeExpression constraint : parameter.getConstraints()) {
                    cacheRendered(constraint);
                }
                cacheRendered(parameter.getDefaultValue());
            }
        }
        return null;
    }

    // ========== Expressions ==========

    @Override
    public Void visitAtomExpr(PyStubParser.AtomExprContext ctx) {
        if (NameChains.isOutermostChain(ctx)) {
            VisitReference.v(ctx, this);
            return null;
        }
        return visitChildren(ctx);
    }

    @Override
    public Void visitAttributeExpr(PyStubParser.AttributeExprContext ctx) {
        if (NameChains.isOutermostChain(ctx)) {
            VisitReference.v(ctx, this);
            return null;
        }
        return visitChildren(ctx);
    }

    @Override
    public Void visitStarredItem(PyStubParser.StarredItemContext ctx) {
        visitChildren(ctx);
        VisitVariadicUnpack.v(ctx, ctx.expr(), this);
        return null;
    }

    @Override
    public Void visitStarExpr(PyStubParser.StarExprContext ctx) {
        visitChildren(ctx);
        if (ctx.getStart().getType() == PyStubParser.STAR) {
            VisitVariadicUnpack.v(ctx, ctx.expr(), this);
        }
        return null;
    }

    @Override
    public Void visitStarAnnotation(PyStubParser.StarAnnotationContext ctx) {
        visitChildren(ctx);
        if (ctx.expr() != null) {
            VisitVariadicUnpack.v(ctx, ctx.expr(), this);
        }
        return null;
    }

    // ========== RenderContext ==========

    @Override
    public String reference(ModuleSymbol symbol) {
        return collection.getImportDelta().require(symbol);
    }

    @Override
    public String render(TypeExpression expression) {
        if (expression.isReference()) {
            return reference(expression.getReference());
        }
        String rendered = renderedExpressions.get(expression.getNode());
        return rendered != null ? rendered : textOf(expression.getNode());
    }

    // ========== Helper access ==========

    public CollectionResult getCollection() {
        return collection;
    }

    public BackportCatalog getBackports() {
        return backports;
    }

    public PythonVersion getTarget() {
        return collection.getTarget();
    }

    public TokenStreamRewriter getRewriter() {
        return rewriter;
    }

    /**
     * Text of a node with the edits made so far.
     */
    public String textOf(ParserRuleContext ctx) {
        return rewriter.getText(interval(ctx));
    }

    /**
     * Replaces the tokens of a node, including hidden tokens between them.
     */
    public void replace(ParserRuleContext ctx, String text) {
        rewriter.replace(ctx.getStart(), ctx.getStop(), text);
    }

    /**
     * The rendered subscript elements of a declaration, e.g. {@code T, *Ts}.
     */
    public String subscriptElements(GenericDeclaration declaration) {
        List<String> elements = new ArrayList<>();
        for (TypeParameter parameter : declaration.getParameters()) {
            elements.add(parameter.renderSubscriptElement(getTarget(), this));
        }
        return String.join(", ", elements);
    }

    private void cacheRendered(TypeExpression expression) {
        if (expression != null && !expression.isReference()) {
            renderedExpressions.put(expression.getNode(), textOf(expression.getNode()));
        }
    }

    /**
     * Line ending of the first line break in the input, {@code \n} when there is none.
     */
    static String lineEndingOf(CommonTokenStream tokens) {
        for (Token token : tokens.getTokens()) {
            if (token.getType() == PyStubParser.NEWLINE && !token.getText().isEmpty()) {
                return token.getText();
            }
        }
        return "\n";
    }

    private static Interval interval(ParserRuleContext ctx) {
        return Interval.of(ctx.getStart().getTokenIndex(), ctx.getStop().getTokenIndex());
    }
}
