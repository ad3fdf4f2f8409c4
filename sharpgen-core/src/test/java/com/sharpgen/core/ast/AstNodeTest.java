package com.sharpgen.core.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the AST node records.
 */
class AstNodeTest {

    @Test
    void classDefinition_nullCollectionsAndAccess_areNormalized() {
        ClassDefinition definition = new ClassDefinition("Widget", null, null, null, null, null,
            null, null, null, null, null, null);

        assertThat(definition.access()).isEqualTo(AccessModifier.NONE);
        assertThat(definition.modifiers()).isEmpty();
        assertThat(definition.fields()).isEmpty();
        assertThat(definition.attributes()).isEmpty();
        assertThat(definition.baseClass()).isNull();
        assertThat(definition.hasNoMembers()).isTrue();
    }

    @Test
    void compilationUnit_nullLists_areEmpty() {
        CompilationUnit unit = new CompilationUnit(null, null, null, null);

        assertThat(unit.usings()).isEmpty();
        assertThat(unit.namespaces()).isEmpty();
        assertThat(unit.classes()).isEmpty();
        assertThat(unit.interfaces()).isEmpty();
    }

    @Test
    void methodBuilder_defaultsToVoidWithoutBody() {
        MethodDefinition method = MethodDefinition.builder("Run").build();

        assertThat(method.returnType()).isEqualTo("void");
        assertThat(method.hasBody()).isFalse();
        assertThat(method.access()).isEqualTo(AccessModifier.NONE);
    }

    @Test
    void classDefinition_withNullName_throwsException() {
        assertThatThrownBy(() -> ClassDefinition.builder(null).build())
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("name");
    }

    @Test
    void fieldDefinition_withNullType_throwsException() {
        assertThatThrownBy(() -> FieldDefinition.builder("_count", null).build())
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("type");
    }

    @Test
    void accessorDefinition_withNullKind_throwsException() {
        assertThatThrownBy(() -> new AccessorDefinition(null, null, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("kind");
    }

    @Test
    void docComment_withNullSummary_throwsException() {
        assertThatThrownBy(() -> DocComment.of(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("summary");
    }

    @Test
    void attributeDefinition_copiesArgumentsAndAllowsNull() {
        List<Object> arguments = new ArrayList<>();
        arguments.add("a");
        arguments.add(null);

        AttributeDefinition attribute = new AttributeDefinition("Note", arguments);
        arguments.add("b");

        assertThat(attribute.arguments()).containsExactly("a", null);
        assertThatThrownBy(() -> attribute.arguments().add("c"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void classDefinition_listsAreUnmodifiable() {
        ClassDefinition definition = ClassDefinition.builder("Widget").addInterface("IWidget").build();

        assertThatThrownBy(() -> definition.interfaces().add("IOther"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void docComment_withParameter_returnsCopyKeepingOrder() {
        DocComment base = DocComment.of("Adds numbers.");

        DocComment documented = base.withParameter("a", "First.").withParameter("b", "Second.")
            .withReturns("Sum.");

        assertThat(base.parameters()).isEmpty();
        assertThat(documented.parameters()).containsExactly(Map.entry("a", "First."), Map.entry("b", "Second."));
        assertThat(documented.returns()).isEqualTo("Sum.");
    }

    @Test
    void accessors_areOrderedGetSetInit() {
        PropertyDefinition property = PropertyDefinition.builder("Name", "string")
            .init()
            .getter()
            .build();

        assertThat(property.accessors()).extracting(AccessorDefinition::kind)
            .containsExactly(AccessorKind.GET, AccessorKind.INIT);
    }

    @Test
    void isAutoImplemented_falseWhenAnyAccessorHasBody() {
        PropertyDefinition auto = PropertyDefinition.builder("Name", "string").getter().setter().build();
        PropertyDefinition explicit = PropertyDefinition.builder("Name", "string")
            .getter(AccessorDefinition.get("return _name;"))
            .setter()
            .build();

        assertThat(auto.isAutoImplemented()).isTrue();
        assertThat(explicit.isAutoImplemented()).isFalse();
    }

    @Test
    void accessorHasBody_blankBody_isAbsent() {
        assertThat(AccessorDefinition.get("   ").hasBody()).isFalse();
        assertThat(AccessorDefinition.set().withAccess(AccessModifier.PRIVATE).access())
            .isEqualTo(AccessModifier.PRIVATE);
    }

    @Test
    void accessModifier_keywords() {
        assertThat(AccessModifier.PROTECTED_INTERNAL.keyword()).isEqualTo("protected internal");
        assertThat(AccessModifier.PRIVATE_PROTECTED.keyword()).isEqualTo("private protected");
        assertThat(AccessModifier.NONE.keyword()).isEmpty();
    }

    @Test
    void modifierAndParameterModifier_keywordsAreLowerCase() {
        assertThat(Modifier.READONLY.keyword()).isEqualTo("readonly");
        assertThat(ParameterModifier.PARAMS.keyword()).isEqualTo("params");
        assertThat(AccessorKind.INIT.keyword()).isEqualTo("init");
    }

    @Test
    void nodeKind_andVisitorDispatch() {
        AstNode node = GenericParameterDefinition.of("T", "class");

        String visited = node.accept(new KindVisitor());

        assertThat(node.nodeKind()).isEqualTo("genericParameter");
        assertThat(visited).isEqualTo("genericParameter:T");
    }

    private static final class KindVisitor implements AstVisitor<String> {
        @Override public String visitCompilationUnit(CompilationUnit node) { return node.nodeKind(); }
        @Override public String visitNamespace(NamespaceDefinition node) { return node.nodeKind(); }
        @Override public String visitClass(ClassDefinition node) { return node.nodeKind(); }
        @Override public String visitInterface(InterfaceDefinition node) { return node.nodeKind(); }
        @Override public String visitField(FieldDefinition node) { return node.nodeKind(); }
        @Override public String visitConstructor(ConstructorDefinition node) { return node.nodeKind(); }
        @Override public String visitProperty(PropertyDefinition node) { return node.nodeKind(); }
        @Override public String visitAccessor(AccessorDefinition node) { return node.nodeKind(); }
        @Override public String visitMethod(MethodDefinition node) { return node.nodeKind(); }
        @Override public String visitParameter(ParameterDefinition node) { return node.nodeKind(); }
        @Override public String visitAttribute(AttributeDefinition node) { return node.nodeKind(); }
        @Override public String visitGenericParameter(GenericParameterDefinition node) {
            return node.nodeKind() + ":" + node.name();
        }
    }
}
