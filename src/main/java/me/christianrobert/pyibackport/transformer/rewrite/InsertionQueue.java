package me.christianrobert.pyibackport.transformer.rewrite;

import org.antlr.v4.runtime.TokenStreamRewriter;

import java.util.Map;
import java.util.TreeMap;

/**
 * Text to insert before token indexes, applied to the rewriter in one go.
 *
 * <p>TokenStreamRewriter puts the later of two inserts at the same index first. Collecting
 * the inserts here keeps them in the order they were queued: new import statements before
 * the type parameter declarations that land at the same statement.
 */
class InsertionQueue {

    private final Map<Integer, StringBuilder> inserts = new TreeMap<>();

    void insertBefore(int tokenIndex, String text) {
        inserts.computeIfAbsent(tokenIndex, index -> new StringBuilder()).append(text);
    }

    boolean isEmpty() {
        return inserts.isEmpty();
    }

    void applyTo(TokenStreamRewriter rewriter) {
        for (Map.Entry<Integer, StringBuilder> insert : inserts.entrySet()) {
            rewriter.insertBefore(insert.getKey(), insert.getValue().toString());
        }
        inserts.clear();
    }
}
