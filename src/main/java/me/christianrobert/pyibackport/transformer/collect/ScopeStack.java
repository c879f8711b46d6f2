package me.christianrobert.pyibackport.transformer.collect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Names of the classes and functions enclosing the node being visited, outermost first.
 */
public class ScopeStack {

    private final Deque<String> names = new ArrayDeque<>();

    public void push(String name) {
        names.addLast(name);
    }

    public String pop() {
        if (names.isEmpty()) {
            throw new IllegalStateException("Scope stack is empty");
        }
        return names.removeLast();
    }

    public boolean isModuleLevel() {
        return names.isEmpty();
    }

    public int depth() {
        return names.size();
    }

    /**
     * Dot-joined names, e.g. {@code Outer.Inner.method}.
     */
    public String qualifiedName() {
        return String.join(".", names);
    }

    /**
     * Qualified name of a declaration named {@code name} in the current scope.
     */
    public String qualify(String name) {
        return names.isEmpty() ? name : qualifiedName() + "." + name;
    }

    public List<String> toList() {
        return Collections.unmodifiableList(new ArrayList<>(names));
    }
}
