package io.flowcheck.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Call;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Lookup;
import io.flowcheck.core.expr.Op;
import io.flowcheck.core.expr.Ref;
import io.flowcheck.core.expr.Symbol;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `Expr` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per variant:
/// - **`Atom`**: `{"type":"atom","value":1}`
/// - **`Symbol`**: `{"type":"symbol","name":"age","kind":"number"}`
/// - **`Op`**: `{"type":"op","operator":"and","args":[...]}`
/// - **`EnumIn`**: `{"type":"in","enum":"q1","members":["a","b"],"positive":true}`
/// - **`Lookup`**: `{"type":"lookup","path":["q1","value"]}`
/// - **`Call`**: `{"type":"call","function":{...},"args":[...]}`
/// - **`Ref`**: `{"type":"ref","value":"..."}`, the referenced object as text
///
/// @implNote Package-private. Registered by {@link FlowJacksonModule}. There is no
/// deserializer: conditions are read as text and compiled.
class ExprSerializer extends StdSerializer<Expr> {

    @Serial private static final long serialVersionUID = 2279046017745803296L;

    ExprSerializer() {
        super(Expr.class);
    }

    @Override
    public void serialize(Expr expr, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (expr instanceof Atom atom) {
            gen.writeStringField("type", "atom");
            gen.writeObjectField("value", atom.value());
        } else if (expr instanceof Symbol symbol) {
            gen.writeStringField("type", "symbol");
            gen.writeStringField("name", symbol.name());
            gen.writeStringField("kind", symbol.kind().label());
        } else if (expr instanceof Op op) {
            gen.writeStringField("type", "op");
            gen.writeStringField("operator", op.operator().symbol());
            writeList("args", op.args(), gen, provider);
        } else if (expr instanceof EnumIn in) {
            gen.writeStringField("type", "in");
            gen.writeStringField("enum", in.domain().name());
            gen.writeArrayFieldStart("members");
            for (Object member : in.members()) {
                gen.writeObject(member);
            }
            gen.writeEndArray();
            gen.writeBooleanField("positive", in.positive());
        } else if (expr instanceof Lookup lookup) {
            gen.writeStringField("type", "lookup");
            gen.writeArrayFieldStart("path");
            for (String segment : lookup.path()) {
                gen.writeString(segment);
            }
            gen.writeEndArray();
        } else if (expr instanceof Call call) {
            gen.writeStringField("type", "call");
            gen.writeFieldName("function");
            serialize(call.function(), gen, provider);
            writeList("args", call.args(), gen, provider);
        } else if (expr instanceof Ref ref) {
            gen.writeStringField("type", "ref");
            gen.writeStringField("value", String.valueOf(ref.value()));
        }
        gen.writeEndObject();
    }

    private void writeList(String field, Iterable<Expr> exprs, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (Expr child : exprs) {
            serialize(child, gen, provider);
        }
        gen.writeEndArray();
    }
}
