package io.flowcheck.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowcheck.core.flow.EnumValue;
import io.flowcheck.core.flow.EnumValues;
import io.flowcheck.core.flow.FlowDefinition;
import io.flowcheck.core.flow.Page;
import io.flowcheck.core.flow.PageTransition;
import io.flowcheck.core.flow.VariableDefinition;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Writes a `FlowDefinition` in the flow document format.
///
/// {@snippet lang=json :
/// {
///   "id": "survey",
///   "startPage": "index",
///   "variables": {"q1": "enum", "age": "number"},
///   "pages": [
///     {
///       "uid": "index",
///       "transitions": [{"condition": "q1.value == 'ao1'", "target": "a"}, {"target": "b"}],
///       "enumValues": {"q1": [{"uid": "ao1", "code": 1}]}
///     }
///   ]
/// }
/// }
///
/// @implNote Package-private. Registered by {@link FlowJacksonModule}.
/// @see FlowDefinitionDeserializer for the inverse operation
class FlowDefinitionSerializer extends StdSerializer<FlowDefinition> {

    @Serial private static final long serialVersionUID = -2793018463310985112L;

    FlowDefinitionSerializer() {
        super(FlowDefinition.class);
    }

    @Override
    public void serialize(FlowDefinition flow, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", flow.getId());
        gen.writeStringField("startPage", flow.getStartPage());

        gen.writeObjectFieldStart("variables");
        for (VariableDefinition variable : flow.getVariables().values()) {
            gen.writeStringField(variable.name(), variable.type().name().toLowerCase(Locale.ROOT));
        }
        gen.writeEndObject();

        gen.writeArrayFieldStart("pages");
        for (Page page : flow.getPages().values()) {
            writePage(page, gen);
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private void writePage(Page page, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("uid", page.uid());

        gen.writeArrayFieldStart("transitions");
        for (PageTransition transition : page.transitions()) {
            gen.writeStartObject();
            if (!transition.isUnconditional()) {
                gen.writeStringField("condition", transition.condition());
            }
            gen.writeStringField("target", transition.target());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        if (!page.enumValues().isEmpty()) {
            gen.writeObjectFieldStart("enumValues");
            for (EnumValues declaration : page.enumValues()) {
                gen.writeArrayFieldStart(declaration.variable());
                for (EnumValue value : declaration.values()) {
                    gen.writeStartObject();
                    gen.writeStringField("uid", value.uid());
                    gen.writeNumberField("code", value.code());
                    gen.writeEndObject();
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }
}
