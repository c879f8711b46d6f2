package me.christianrobert.pyibackport.transformer.collect;

import me.christianrobert.pyibackport.transformer.context.ConflictException;
import me.christianrobert.pyibackport.transformer.model.TypeParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Module-wide registry of lowered type parameters, keyed by name.
 *
 * <p>Every name goes {@code Unseen -> Registered}; a repeated declaration then either equals
 * the registered one in every field, variance included ({@code Deduplicated}, nothing new is
 * emitted), or does not, which is a conflict and aborts the run. The first declaration of a name owns the emitted
 * {@code TypeVar}-like statement.
 */
public class TypeParameterRegistry {

    private static final Logger log = LoggerFactory.getLogger(TypeParameterRegistry.class);

    public enum Outcome {
        REGISTERED,
        DEDUPLICATED
    }

    private final Map<String, TypeParameter> byName = new LinkedHashMap<>();
    private final Map<String, String> declaredBy = new HashMap<>();

    /**
     * Registers a parameter declared by {@code declaration}.
     *
     * @throws ConflictException if a different parameter with the same name is registered
     */
    public Outcome register(TypeParameter parameter, String declaration) {
        TypeParameter existing = byName.get(parameter.getName());
        if (existing == null) {
            byName.put(parameter.getName(), parameter);
            declaredBy.put(parameter.getName(), declaration);
            log.trace("Registered type parameter {} of {}", parameter, declaration);
            return Outcome.REGISTERED;
        }

        if (existing.equals(parameter)) {
            log.trace("Deduplicated type parameter {} of {}", parameter, declaration);
            return Outcome.DEDUPLICATED;
        }

        throw new ConflictException("Type parameter '" + parameter.getName() + "' of '" + declaration
                + "' conflicts with the one declared by '" + declaredBy.get(parameter.getName()) + "'",
                parameter.getName(), declaration);
    }

    public Optional<TypeParameter> lookup(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Names registered as {@code TypeVarTuple}.
     */
    public Set<String> variadicNames() {
        Set<String> names = new LinkedHashSet<>();
        for (TypeParameter parameter : byName.values()) {
            if (parameter.getKind() == TypeParameter.Kind.TYPE_VAR_TUPLE) {
                names.add(parameter.getName());
            }
        }
        return names;
    }

    public List<TypeParameter> getParameters() {
        return new ArrayList<>(byName.values());
    }

    public int size() {
        return byName.size();
    }
}
