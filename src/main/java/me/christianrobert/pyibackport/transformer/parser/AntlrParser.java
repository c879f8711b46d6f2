package me.christianrobert.pyibackport.transformer.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.pyibackport.antlr.PyStubLexer;
import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.context.StubTransformationException;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionContextCache;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the ANTLR PyStubParser.
 * Handles lexer and parser instantiation, error collection, and the layout token source.
 *
 * Uses two-stage parsing strategy:
 * 1. Try SLL(*) mode first (fast, low memory)
 * 2. Fall back to LL(*) mode if SLL fails (slower, handles all cases, reports errors)
 *
 * Clears ANTLR's static DFA and PredictionContext caches after each parse. Both are shared
 * across parser instances and otherwise keep growing when many stub files are processed
 * by one long-running service.
 *
 * This is the only class that directly instantiates ANTLR parsers.
 *
 * Note: Uses @Dependent scope because it is stateless; it is both injected
 * (StubTransformationService) and created with new (CLI, tests).
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    /**
     * Clears the PredictionContextCache to prevent memory accumulation.
     * Uses reflection because PredictionContextCache doesn't expose a public clear() method.
     */
    private void clearPredictionContextCache(PredictionContextCache cache) {
        if (cache == null) {
            return;
        }

        try {
            Field cacheField = PredictionContextCache.class.getDeclaredField("cache");
            cacheField.setAccessible(true);
            Map<?, ?> internalCache = (Map<?, ?>) cacheField.get(cache);

            if (internalCache != null) {
                int sizeBefore = internalCache.size();
                internalCache.clear();
                log.trace("Cleared PredictionContextCache ({} entries removed)", sizeBefore);
            }
        } catch (NoSuchFieldException | IllegalAccessException | RuntimeException e) {
            log.warn("Failed to clear PredictionContextCache via reflection (ANTLR API may have changed): {}",
                    e.getMessage());
        }
    }

    /**
     * Parses a complete stub module.
     * Empty and whitespace-only input is valid and yields an empty module.
     *
     * @param source Stub file content
     * @return ParseResult containing the parse tree, token stream and errors
     */
    public ParseResult parseModule(String source) {
        if (source == null) {
            throw new StubTransformationException("Stub source cannot be null");
        }

        log.debug("Parsing stub module ({} characters)", source.length());

        try {
            return parseTwoStage(source);
        } catch (StubTransformationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to parse stub module", e);
            throw new StubTransformationException("Failed to parse stub: " + e.getMessage(), null, "ANTLR parsing", e);
        }
    }

    private ParseResult parseTwoStage(String source) {
        List<String> errors = new ArrayList<>();
        BaseErrorListener collector = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg,
                                    RecognitionException e) {
                String error = String.format("Line %d:%d - %s", line, charPositionInLine, msg);
                errors.add(error);
                log.warn("Parse error: {}", error);
            }
        };

        PyStubLexer lexer = new PyStubLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(collector);
        CommonTokenStream tokens = new CommonTokenStream(new PyStubTokenSource(lexer));

        PyStubParser parser = null;
        PyStubParser.ModuleContext tree;
        try {
            // Stage 1: SLL(*) without error recovery
            parser = new PyStubParser(tokens);
            parser.getInterpreter().clearDFA();
            parser.removeErrorListeners();
            parser.setErrorHandler(new BailErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

            try {
                log.trace("Attempting SLL(*) parse");
                tree = parser.module();
                log.trace("SLL(*) parse succeeded");

            } catch (Exception sllException) {
                log.trace("SLL(*) parse failed, falling back to LL(*)");

                // Stage 2: LL(*) with full error recovery and reporting
                tokens.seek(0);
                parser.reset();
                parser.removeErrorListeners();
                parser.setErrorHandler(new DefaultErrorStrategy());
                parser.getInterpreter().setPredictionMode(PredictionMode.LL);
                parser.addErrorListener(collector);

                tree = parser.module();
                log.debug("LL(*) parse completed with {} errors", errors.size());
            }

            tokens.fill();
            return new ParseResult(tree, tokens, errors, source);

        } finally {
            if (parser != null) {
                parser.getInterpreter().clearDFA();
                clearPredictionContextCache(parser.getInterpreter().getSharedContextCache());
                log.trace("Cleared DFA and PredictionContext caches");
            }
        }
    }
}
