package me.christianrobert.pyibackport.transformer.collect;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.model.TypeParameter;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A class, function or type alias declared with PEP 695 syntax, as seen by the collector.
 */
public class GenericDeclaration {

    public enum Kind {
        CLASS,
        FUNCTION,
        TYPE_ALIAS
    }

    private final Kind kind;
    private final ParserRuleContext node;
    private final String qualifiedName;
    private final PyStubParser.TypeParamsContext typeParams;
    private final PyStubParser.StatementContext owner;

    private final List<TypeParameter> parameters = new ArrayList<>();
    private boolean lowered;
    private PyStubParser.ExprContext protocolBase;

    public GenericDeclaration(Kind kind, ParserRuleContext node, String qualifiedName,
                              PyStubParser.TypeParamsContext typeParams, PyStubParser.StatementContext owner) {
        this.kind = kind;
        this.node = node;
        this.qualifiedName = qualifiedName;
        this.typeParams = typeParams;
        this.owner = owner;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The ClassDefContext, FunctionDefContext or TypeAliasContext.
     */
    public ParserRuleContext getNode() {
        return node;
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    /**
     * The bracketed parameter list, null for a type alias without one.
     */
    public PyStubParser.TypeParamsContext getTypeParams() {
        return typeParams;
    }

    /**
     * Module-level statement the declaration belongs to; lowered parameters are declared before it.
     */
    public PyStubParser.StatementContext getOwner() {
        return owner;
    }

    public List<TypeParameter> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    void addParameter(TypeParameter parameter) {
        parameters.add(parameter);
    }

    public boolean isLowered() {
        return lowered;
    }

    void setLowered(boolean lowered) {
        this.lowered = lowered;
    }

    /**
     * The {@code Protocol} base to subscript instead of adding {@code Generic}, if the class has one.
     */
    public PyStubParser.ExprContext getProtocolBase() {
        return protocolBase;
    }

    void setProtocolBase(PyStubParser.ExprContext protocolBase) {
        this.protocolBase = protocolBase;
    }

    public boolean hasDefaults() {
        for (TypeParameter parameter : parameters) {
            if (parameter.hasDefault()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return kind + " " + qualifiedName + parameters;
    }
}
