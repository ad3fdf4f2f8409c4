package com.sharpgen.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.sharpgen.core.ast.AccessModifier;
import com.sharpgen.core.ast.AccessorDefinition;
import com.sharpgen.core.ast.AstNode;
import com.sharpgen.core.ast.AstVisitor;
import com.sharpgen.core.ast.AttributeDefinition;
import com.sharpgen.core.ast.ClassDefinition;
import com.sharpgen.core.ast.CompilationUnit;
import com.sharpgen.core.ast.ConstructorDefinition;
import com.sharpgen.core.ast.DocComment;
import com.sharpgen.core.ast.FieldDefinition;
import com.sharpgen.core.ast.GenericParameterDefinition;
import com.sharpgen.core.ast.InterfaceDefinition;
import com.sharpgen.core.ast.MethodDefinition;
import com.sharpgen.core.ast.Modifier;
import com.sharpgen.core.ast.NamespaceDefinition;
import com.sharpgen.core.ast.ParameterDefinition;
import com.sharpgen.core.ast.ParameterModifier;
import com.sharpgen.core.ast.PropertyDefinition;
import com.sharpgen.core.format.CodeFormatter;
import com.sharpgen.core.format.IndentScope;
import com.sharpgen.core.generator.GeneratorOptions;

/**
 * Renders AST nodes as C# source for one generation session.
 *
 * <p>Every visit returns the node's text with each line indented at the formatter's current
 * depth and without a trailing line break. Child members are rendered back through
 * {@link AstNode#accept(AstVisitor)} inside an {@link IndentScope}, so nesting depth is owned
 * by the formatter alone.
 *
 * <p>Not thread-safe; create one instance per session.
 */
final class CSharpRenderer implements AstVisitor<String> {

    private static final String NEWLINE = "\n";
    private static final String BLANK_LINE = "\n\n";
    private static final String OPEN_BRACE = "{";
    private static final String CLOSE_BRACE = "}";
    private static final String STATEMENT_END = ";";
    private static final Pattern LEADING_BLANK_LINES = Pattern.compile("^(?:[ \\t]*(?:\\r\\n|\\r|\\n))+");

    private final CodeFormatter formatter;
    private final GeneratorOptions options;

    // Members of an interface body carry no access or modifier keywords and have no bodies
    private boolean insideInterface;

    // Set while rendering the namespaces of a compilation unit that cannot use the file-scoped form
    private boolean blockNamespaces;

    CSharpRenderer(CodeFormatter formatter) {
        this.formatter = formatter;
        this.options = formatter.options();
    }

    // ----- containers -----

    @Override
    public String visitCompilationUnit(CompilationUnit node) {
        List<String> sections = new ArrayList<>();
        String usings = formatter.formatUsings(node.usings());
        if (!usings.isEmpty()) {
            sections.add(usings);
        }
        // A file-scoped namespace must be the only namespace and must enclose every type.
        boolean enclosingBlockForm = blockNamespaces;
        blockNamespaces = node.namespaces().size() > 1
            || (!node.namespaces().isEmpty() && (!node.classes().isEmpty() || !node.interfaces().isEmpty()));
        try {
            node.namespaces().forEach(namespace -> sections.add(namespace.accept(this)));
        } finally {
            blockNamespaces = enclosingBlockForm;
        }
        node.classes().forEach(type -> sections.add(type.accept(this)));
        node.interfaces().forEach(type -> sections.add(type.accept(this)));
        return joinSections(sections);
    }

    @Override
    public String visitNamespace(NamespaceDefinition node) {
        List<AstNode> types = new ArrayList<>();
        types.addAll(node.classes());
        types.addAll(node.interfaces());

        List<String> lines = new ArrayList<>();
        if (options.fileScopedNamespaces() && !blockNamespaces) {
            lines.add(formatter.indentText("namespace " + node.name() + STATEMENT_END));
            String body = renderMembers(types);
            if (!body.isEmpty()) {
                lines.add("");
                lines.add(body);
            }
        } else {
            lines.add(formatter.indentText("namespace " + node.name()));
            appendBlock(lines, types);
        }
        return String.join(NEWLINE, lines);
    }

    @Override
    public String visitClass(ClassDefinition node) {
        List<String> lines = new ArrayList<>();
        appendPreamble(lines, node.documentation(), node.attributes());

        List<String> inheritance = new ArrayList<>();
        if (node.baseClass() != null && !node.baseClass().isBlank()) {
            inheritance.add(node.baseClass());
        }
        inheritance.addAll(node.interfaces());

        String header = CSharpSyntax.modifierPrefix(node.access(), node.modifiers(), CSharpSyntax.CLASS_MODIFIERS)
            + "class " + node.name()
            + genericList(node.genericParameters())
            + inheritanceList(inheritance);
        lines.add(formatter.indentText(header));
        appendConstraints(lines, node.genericParameters());

        if (node.hasNoMembers()) {
            lines.add(formatter.indentText(OPEN_BRACE));
            lines.add(formatter.indentText(CLOSE_BRACE));
            return String.join(NEWLINE, lines);
        }

        List<AstNode> members = new ArrayList<>();
        members.addAll(node.fields());
        members.addAll(node.constructors());
        members.addAll(node.properties());
        members.addAll(node.methods());

        boolean enclosingInterface = insideInterface;
        insideInterface = false;
        try {
            appendBlock(lines, members);
        } finally {
            insideInterface = enclosingInterface;
        }
        return String.join(NEWLINE, lines);
    }

    @Override
    public String visitInterface(InterfaceDefinition node) {
        List<String> lines = new ArrayList<>();
        appendPreamble(lines, node.documentation(), node.attributes());

        String header = CSharpSyntax.accessPrefix(node.access())
            + "interface " + node.name()
            + genericList(node.genericParameters())
            + inheritanceList(node.baseInterfaces());
        lines.add(formatter.indentText(header));
        appendConstraints(lines, node.genericParameters());

        List<AstNode> members = new ArrayList<>();
        members.addAll(node.properties());
        members.addAll(node.methods());

        boolean enclosingInterface = insideInterface;
        insideInterface = true;
        try {
            appendBlock(lines, members);
        } finally {
            insideInterface = enclosingInterface;
        }
        return String.join(NEWLINE, lines);
    }

    // ----- members -----

    @Override
    public String visitField(FieldDefinition node) {
        List<String> lines = new ArrayList<>();
        appendPreamble(lines, node.documentation(), node.attributes());

        StringBuilder declaration = new StringBuilder()
            .append(CSharpSyntax.modifierPrefix(node.access(), node.modifiers(), CSharpSyntax.FIELD_MODIFIERS))
            .append(node.type()).append(' ').append(node.name());
        if (node.initialValue() != null && !node.initialValue().isBlank()) {
            declaration.append(" = ").append(node.initialValue());
        }
        declaration.append(STATEMENT_END);
        lines.add(formatter.indentText(declaration.toString()));
        return String.join(NEWLINE, lines);
    }

    @Override
    public String visitConstructor(ConstructorDefinition node) {
        List<String> lines = new ArrayList<>();
        appendPreamble(lines, node.documentation(), node.attributes());

        String header;
        if (node.hasModifier(Modifier.STATIC)) {
            header = "static " + node.name() + "()";
        } else {
            header = CSharpSyntax.accessPrefix(node.access())
                + node.name() + "(" + parameterList(node.parameters()) + ")";
            if (node.baseCall() != null && !node.baseCall().isBlank()) {
                header += " : " + node.baseCall();
            }
        }

        if (!node.hasBody()) {
            lines.add(formatter.indentText(header + " { }"));
        } else {
            lines.add(formatter.indentText(header));
            appendBody(lines, node.body());
        }
        return String.join(NEWLINE, lines);
    }

    @Override
    public String visitProperty(PropertyDefinition node) {
        List<String> lines = new ArrayList<>();
        appendPreamble(lines, node.documentation(), node.attributes());

        String header = insideInterface
            ? node.type() + " " + node.name()
            : CSharpSyntax.modifierPrefix(node.access(), node.modifiers(), CSharpSyntax.PROPERTY_MODIFIERS)
                + node.type() + " " + node.name();
        AccessModifier ownerAccess = insideInterface ? null : node.access();

        if (insideInterface || node.isAutoImplemented()) {
            String accessors = node.accessors().stream()
                .map(accessor -> accessorPrefix(accessor, ownerAccess) + accessor.kind().keyword() + STATEMENT_END)
                .collect(Collectors.joining(" "));
            lines.add(formatter.indentText(header + (accessors.isEmpty() ? " { }" : " { " + accessors + " }")));
            return String.join(NEWLINE, lines);
        }

        lines.add(formatter.indentText(header));
        lines.add(formatter.indentText(OPEN_BRACE));
        try (IndentScope scope = formatter.indent()) {
            for (AccessorDefinition accessor : node.accessors()) {
                lines.add(renderAccessor(accessor, ownerAccess));
            }
        }
        lines.add(formatter.indentText(CLOSE_BRACE));
        return String.join(NEWLINE, lines);
    }

    @Override
    public String visitAccessor(AccessorDefinition node) {
        return renderAccessor(node, null);
    }

    @Override
    public String visitMethod(MethodDefinition node) {
        List<String> lines = new ArrayList<>();
        appendPreamble(lines, node.documentation(), node.attributes());

        String prefix = insideInterface
            ? ""
            : CSharpSyntax.modifierPrefix(node.access(), node.modifiers(), CSharpSyntax.METHOD_MODIFIERS);
        String signature = prefix + node.returnType() + " " + node.name()
            + genericList(node.genericParameters())
            + "(" + parameterList(node.parameters()) + ")";
        lines.add(formatter.indentText(signature));
        appendConstraints(lines, node.genericParameters());

        if (insideInterface || node.hasModifier(Modifier.ABSTRACT) || !node.hasBody()) {
            int last = lines.size() - 1;
            lines.set(last, lines.get(last) + STATEMENT_END);
        } else {
            appendBody(lines, node.body());
        }
        return String.join(NEWLINE, lines);
    }

    // ----- fragments -----

    @Override
    public String visitParameter(ParameterDefinition node) {
        return formatter.indentText(parameterText(node));
    }

    @Override
    public String visitAttribute(AttributeDefinition node) {
        return formatter.indentText(attributeText(node));
    }

    @Override
    public String visitGenericParameter(GenericParameterDefinition node) {
        return formatter.indentText(node.name());
    }

    // ----- helpers -----

    private String parameterText(ParameterDefinition node) {
        StringBuilder parameter = new StringBuilder();
        if (options.generateAttributes() && !node.attributes().isEmpty()) {
            parameter.append(node.attributes().stream()
                .map(this::attributeText)
                .collect(Collectors.joining(" ")));
            parameter.append(' ');
        }
        for (ParameterModifier modifier : ParameterModifier.values()) {
            if (node.hasModifier(modifier)) {
                parameter.append(modifier.keyword()).append(' ');
            }
        }
        parameter.append(node.type()).append(' ').append(node.name());
        if (node.defaultValue() != null && !node.defaultValue().isBlank()) {
            parameter.append(" = ").append(node.defaultValue());
        }
        return parameter.toString();
    }

    private void appendPreamble(List<String> lines, DocComment documentation, List<AttributeDefinition> attributes) {
        if (options.generateDocumentation() && documentation != null) {
            lines.add(formatter.formatDocumentation(documentation));
        }
        if (options.generateAttributes()) {
            for (AttributeDefinition attribute : attributes) {
                lines.add(attribute.accept(this));
            }
        }
    }

    private void appendBlock(List<String> lines, List<? extends AstNode> members) {
        lines.add(formatter.indentText(OPEN_BRACE));
        try (IndentScope scope = formatter.indent()) {
            String body = renderMembers(members);
            if (!body.isEmpty()) {
                lines.add(body);
            }
        }
        lines.add(formatter.indentText(CLOSE_BRACE));
    }

    private void appendBody(List<String> lines, String body) {
        lines.add(formatter.indentText(OPEN_BRACE));
        try (IndentScope scope = formatter.indent()) {
            lines.add(formatter.indentLines(LEADING_BLANK_LINES.matcher(body).replaceFirst("").stripTrailing()));
        }
        lines.add(formatter.indentText(CLOSE_BRACE));
    }

    private void appendConstraints(List<String> lines, List<GenericParameterDefinition> genericParameters) {
        try (IndentScope scope = formatter.indent()) {
            for (GenericParameterDefinition parameter : genericParameters) {
                if (!parameter.constraints().isEmpty()) {
                    lines.add(formatter.indentText(
                        "where " + parameter.name() + " : " + String.join(", ", parameter.constraints())));
                }
            }
        }
    }

    private String renderMembers(List<? extends AstNode> members) {
        List<String> rendered = new ArrayList<>(members.size());
        for (AstNode member : members) {
            rendered.add(member.accept(this));
        }
        return joinSections(rendered);
    }

    private String renderAccessor(AccessorDefinition accessor, AccessModifier ownerAccess) {
        String declaration = accessorPrefix(accessor, ownerAccess) + accessor.kind().keyword();
        if (!accessor.hasBody()) {
            return formatter.indentText(declaration + STATEMENT_END);
        }
        List<String> lines = new ArrayList<>();
        lines.add(formatter.indentText(declaration));
        appendBody(lines, accessor.body());
        return String.join(NEWLINE, lines);
    }

    private static String accessorPrefix(AccessorDefinition accessor, AccessModifier ownerAccess) {
        AccessModifier access = accessor.access();
        if (access == null || access == AccessModifier.NONE || access == ownerAccess) {
            return "";
        }
        return access.keyword() + " ";
    }

    private String parameterList(List<ParameterDefinition> parameters) {
        List<String> rendered = new ArrayList<>(parameters.size());
        for (ParameterDefinition parameter : parameters) {
            rendered.add(parameterText(parameter));
        }
        return formatter.formatParameterList(rendered);
    }

    private String attributeText(AttributeDefinition attribute) {
        if (attribute.arguments().isEmpty()) {
            return "[" + attribute.name() + "]";
        }
        String arguments = attribute.arguments().stream()
            .map(CSharpSyntax::literal)
            .collect(Collectors.joining(", "));
        return "[" + attribute.name() + "(" + arguments + ")]";
    }

    private static String genericList(List<GenericParameterDefinition> genericParameters) {
        if (genericParameters.isEmpty()) {
            return "";
        }
        return genericParameters.stream()
            .map(GenericParameterDefinition::name)
            .collect(Collectors.joining(", ", "<", ">"));
    }

    private static String inheritanceList(List<String> supertypes) {
        if (supertypes.isEmpty()) {
            return "";
        }
        return " : " + String.join(", ", supertypes);
    }

    private static String joinSections(List<String> sections) {
        return sections.stream()
            .filter(section -> section != null && !section.isBlank())
            .collect(Collectors.joining(BLANK_LINE));
    }
}
