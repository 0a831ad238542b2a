package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.model.SymbolKind;

import java.util.Set;

/**
 * Which node kinds of a grammar are definitions, which carry the definition's name, and which
 * are decorators written as siblings in front of a definition.
 */
public final class NodeKinds {

    private final Set<String> functionKinds;
    private final Set<String> classKinds;
    private final Set<String> identifierKinds;
    private final Set<String> decoratorKinds;

    public NodeKinds(Set<String> functionKinds, Set<String> classKinds, Set<String> identifierKinds) {
        this(functionKinds, classKinds, identifierKinds, Set.of());
    }

    public NodeKinds(Set<String> functionKinds, Set<String> classKinds, Set<String> identifierKinds,
                     Set<String> decoratorKinds) {
        this.functionKinds = Set.copyOf(functionKinds);
        this.classKinds = Set.copyOf(classKinds);
        this.identifierKinds = Set.copyOf(identifierKinds);
        this.decoratorKinds = Set.copyOf(decoratorKinds);
    }

    /** FUNCTION, CLASS, or null when the node is not a definition. */
    public SymbolKind definitionKind(String nodeKind) {
        if (functionKinds.contains(nodeKind)) return SymbolKind.FUNCTION;
        if (classKinds.contains(nodeKind)) return SymbolKind.CLASS;
        return null;
    }

    public boolean isIdentifier(String nodeKind) {
        return identifierKinds.contains(nodeKind);
    }

    public boolean isDecorator(String nodeKind) {
        return decoratorKinds.contains(nodeKind);
    }

    // Python decorators sit inside decorated_definition above the header; the docstring and the
    // patch anchor both hang off the header, so they are not treated as leading siblings.
    static final NodeKinds PYTHON = new NodeKinds(
            Set.of("function_definition"),
            Set.of("class_definition"),
            Set.of("identifier"));

    static final NodeKinds JAVASCRIPT = new NodeKinds(
            Set.of("function_declaration", "generator_function_declaration", "method_definition"),
            Set.of("class_declaration"),
            Set.of("identifier", "property_identifier"),
            Set.of("decorator"));

    static final NodeKinds TYPESCRIPT = new NodeKinds(
            Set.of("function_declaration", "generator_function_declaration", "method_definition"),
            Set.of("class_declaration", "abstract_class_declaration", "interface_declaration"),
            Set.of("identifier", "type_identifier", "property_identifier"),
            Set.of("decorator"));

    static final NodeKinds GO = new NodeKinds(
            Set.of("function_declaration", "method_declaration"),
            Set.of("type_spec"),
            Set.of("identifier", "field_identifier", "type_identifier"));

    /** JavaParser node class names. */
    static final NodeKinds JAVA = new NodeKinds(
            Set.of("MethodDeclaration", "ConstructorDeclaration"),
            Set.of("ClassOrInterfaceDeclaration", "EnumDeclaration", "RecordDeclaration"),
            Set.of("SimpleName"));
}
