package com.sharpgen.core.json;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.sharpgen.core.ast.AttributeDefinition;
import com.sharpgen.core.ast.CodeExpression;

/**
 * Jackson module that configures deserialization for the AST records.
 *
 * <p>Most records map directly through their canonical constructors. Attribute arguments
 * are untyped, so they get a dedicated deserializer: JSON scalars become the matching Java
 * values and an object of the form {@code {"code": "typeof(Foo)"}} becomes a
 * {@link CodeExpression} emitted verbatim.
 */
public class AstModule extends SimpleModule {

    static final String CODE_FIELD = "code";

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.sharpgen", "sharpgen-core"));
        addDeserializer(AttributeDefinition.class, new AttributeDefinitionDeserializer());
    }

    static class AttributeDefinitionDeserializer extends StdDeserializer<AttributeDefinition> {

        AttributeDefinitionDeserializer() {
            super(AttributeDefinition.class);
        }

        @Override
        public AttributeDefinition deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            JsonNode node = parser.getCodec().readTree(parser);
            JsonNode name = node.get("name");
            if (name == null || !name.isTextual() || name.asText().isBlank()) {
                return context.reportInputMismatch(AttributeDefinition.class,
                    "Attribute requires a non-empty 'name'");
            }

            List<Object> arguments = new ArrayList<>();
            JsonNode argumentNodes = node.get("arguments");
            if (argumentNodes != null && argumentNodes.isArray()) {
                for (JsonNode argument : argumentNodes) {
                    arguments.add(toArgument(argument));
                }
            }
            return new AttributeDefinition(name.asText(), arguments);
        }

        private static Object toArgument(JsonNode argument) {
            if (argument.isNull()) {
                return null;
            }
            if (argument.isObject() && argument.has(CODE_FIELD)) {
                return CodeExpression.of(argument.get(CODE_FIELD).asText());
            }
            if (argument.isTextual()) {
                return argument.asText();
            }
            if (argument.isBoolean()) {
                return argument.booleanValue();
            }
            if (argument.isNumber()) {
                return argument.numberValue();
            }
            return CodeExpression.of(argument.toString());
        }
    }
}
