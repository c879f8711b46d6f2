package me.christianrobert.pyibackport.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.pyibackport.transformer.catalog.BackportCatalog;
import me.christianrobert.pyibackport.transformer.catalog.DenylistCatalog;
import me.christianrobert.pyibackport.transformer.collect.CollectionResult;
import me.christianrobert.pyibackport.transformer.collect.StubCollector;
import me.christianrobert.pyibackport.transformer.context.StubSyntaxException;
import me.christianrobert.pyibackport.transformer.context.StubTransformationException;
import me.christianrobert.pyibackport.transformer.context.TransformationResult;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import me.christianrobert.pyibackport.transformer.parser.AntlrParser;
import me.christianrobert.pyibackport.transformer.parser.ParseResult;
import me.christianrobert.pyibackport.transformer.rewrite.StubRewriter;
import me.christianrobert.pyibackport.transformer.util.AstTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Backports a single stub file to an older Python target.
 *
 * <p>Architecture:
 * <pre>
 * .pyi source → ANTLR Parse → StubCollector → StubRewriter → .pyi source
 *                   ↓               ↓               ↓
 *              PyStubParser   CollectionResult  TokenStreamRewriter
 * </pre>
 *
 * <p>The collector validates the whole module and decides every lowering before the rewriter
 * touches a token, so a rejected file never yields partial output.</p>
 *
 * <p>Two entry points:
 * <ul>
 *   <li>{@link #transform(String, PythonVersion)} returns the new source and propagates
 *       {@link StubTransformationException} subclasses (CLI)</li>
 *   <li>{@link #transformToResult(String, String, boolean)} never throws and wraps the outcome in a
 *       {@link TransformationResult} (REST)</li>
 * </ul>
 */
@ApplicationScoped
public class StubTransformationService {

    private static final Logger log = LoggerFactory.getLogger(StubTransformationService.class);

    // Read-only, shared by all runs
    private final BackportCatalog backports = new BackportCatalog();

    @Inject
    AntlrParser parser;

    public StubTransformationService() {
    }

    public StubTransformationService(AntlrParser parser) {
        this.parser = parser;
    }

    /**
     * Backports a stub module using the default wildcard denylist.
     *
     * @param source Stub file content
     * @param target Oldest Python version the output must support
     * @return The rewritten stub source
     * @throws StubTransformationException if the stub is rejected; no output is produced then
     */
    public String transform(String source, PythonVersion target) {
        return transform(source, target, DenylistCatalog.DEFAULT_WILDCARD_MODULES);
    }

    /**
     * Backports a stub module.
     *
     * @param source Stub file content
     * @param target Oldest Python version the output must support
     * @param wildcardDenylist Modules whose wildcard imports are rejected
     * @return The rewritten stub source
     */
    public String transform(String source, PythonVersion target, List<String> wildcardDenylist) {
        return run(source, target, wildcardDenylist).transformed;
    }

    /**
     * Backports a stub module and reports the outcome as a result object.
     *
     * @param source Stub file content
     * @param targetVersion Target such as {@code "3.10"}
     * @param includeAst Whether to include the parse tree dump (for debugging)
     * @return TransformationResult containing either the rewritten source or error details
     */
    public TransformationResult transformToResult(String source, String targetVersion, boolean includeAst) {
        return transformToResult(source, targetVersion, includeAst, DenylistCatalog.DEFAULT_WILDCARD_MODULES);
    }

    public TransformationResult transformToResult(String source, String targetVersion, boolean includeAst,
                                                  List<String> wildcardDenylist) {
        if (source == null) {
            return TransformationResult.failure(null, "Stub source cannot be null");
        }

        PythonVersion target;
        try {
            target = PythonVersion.parseTarget(targetVersion);
        } catch (IllegalArgumentException e) {
            return TransformationResult.failure(source, e.getMessage());
        }

        try {
            Outcome outcome = run(source, target, wildcardDenylist);
            log.info("Successfully backported stub to Python {}", target);

            if (includeAst) {
                return TransformationResult.successWithAst(source, outcome.transformed, target.toString(),
                        AstTreeFormatter.format(outcome.parseResult.getTree(), outcome.collection));
            }
            return TransformationResult.success(source, outcome.transformed, target.toString());

        } catch (StubTransformationException e) {
            log.debug("Backport rejected: {}", e.getDetailedMessage());
            return TransformationResult.failure(source, target.toString(), e);

        } catch (Exception e) {
            log.error("Unexpected error during backport", e);
            return TransformationResult.failure(source, "Unexpected error: " + e.getMessage());
        }
    }

    private Outcome run(String source, PythonVersion target, List<String> wildcardDenylist) {
        if (target == null) {
            throw new IllegalArgumentException("Target version cannot be null");
        }
        if (parser == null) {
            throw new IllegalStateException("AntlrParser not injected");
        }

        log.debug("Backporting stub to Python {}", target);
        log.trace("Stub source: {}", source);

        // STEP 1: Parse
        log.debug("Step 1: Parsing stub");
        ParseResult parseResult = parser.parseModule(source);
        if (parseResult.hasErrors()) {
            log.warn("Parse failed: {}", parseResult.getErrorMessage());
            throw new StubSyntaxException("Parse errors: " + parseResult.getErrorMessage(), parseResult.getErrors());
        }

        // STEP 2: Collect
        log.debug("Step 2: Collecting imports, declarations and references");
        StubCollector collector = new StubCollector(target, backports, new DenylistCatalog(wildcardDenylist));
        CollectionResult collection = collector.collect(parseResult.getTree());
        log.debug("Collection complete: {} generic declarations, {} import changes",
                collection.getDeclarations().size(),
                collection.getImportDelta().getAdditions().size() + collection.getImportDelta().getDeletions().size());

        // STEP 3: Rewrite
        log.debug("Step 3: Rewriting token stream");
        StubRewriter rewriter = new StubRewriter(collection, backports, parseResult.getTokens());
        String transformed = rewriter.rewrite(parseResult.getTree());
        log.trace("Backported stub: {}", transformed);

        return new Outcome(parseResult, collection, transformed);
    }

    private static class Outcome {
        final ParseResult parseResult;
        final CollectionResult collection;
        final String transformed;

        Outcome(ParseResult parseResult, CollectionResult collection, String transformed) {
            this.parseResult = parseResult;
            this.collection = collection;
            this.transformed = transformed;
        }
    }
}
