package io.flowcheck.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowcheck.core.AnalysisReport;
import io.flowcheck.core.ConditionError;
import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.graph.Edge;
import io.flowcheck.core.graph.SoundnessViolation;
import io.flowcheck.core.graph.TransitionGraph;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes an `AnalysisReport` for machine consumption.
///
/// Conditions are written in their infix text form. A transition whose condition failed to
/// compile appears as a boolean symbol such as `?index[0]->a`.
///
/// {@snippet lang=json :
/// {
///   "flowId": "survey",
///   "source": "index",
///   "sound": false,
///   "nodes": [{"id": "index", "predicate": "true"}],
///   "edges": [{"source": "index", "target": "a", "filter": "q1 in {'ao1'}"}],
///   "selfLoops": [],
///   "violations": [{"node": "index", "covered": "...", "uncovered": "..."}],
///   "conditionErrors": [],
///   "enums": [{"name": "q1", "kind": "string", "members": ["ao1", "ao2"]}]
/// }
/// }
///
/// @implNote Package-private. Registered by {@link FlowJacksonModule}. Reports are not
/// read back, so there is no deserializer.
class AnalysisReportSerializer extends StdSerializer<AnalysisReport> {

    @Serial private static final long serialVersionUID = -5372021149684230476L;

    AnalysisReportSerializer() {
        super(AnalysisReport.class);
    }

    @Override
    public void serialize(AnalysisReport report, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        TransitionGraph graph = report.graph();

        gen.writeStartObject();
        gen.writeStringField("flowId", report.flowId());
        gen.writeStringField("source", report.source());
        gen.writeBooleanField("sound", report.soundness().isSound());

        gen.writeArrayFieldStart("nodes");
        for (String node : graph.nodes()) {
            gen.writeStartObject();
            gen.writeStringField("id", node);
            writeCondition("predicate", graph.predicate(node).orElse(null), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("edges");
        for (Edge edge : graph.edges()) {
            gen.writeStartObject();
            gen.writeStringField("source", edge.source());
            gen.writeStringField("target", edge.target());
            writeCondition("filter", edge.filter(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("selfLoops");
        for (Map.Entry<String, Expr> loop : graph.selfLoops().entrySet()) {
            gen.writeStartObject();
            gen.writeStringField("node", loop.getKey());
            writeCondition("filter", loop.getValue(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("violations");
        for (SoundnessViolation violation : report.soundness().violations()) {
            gen.writeStartObject();
            gen.writeStringField("node", violation.node());
            writeCondition("covered", violation.covered(), gen);
            writeCondition("uncovered", violation.uncovered(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("conditionErrors");
        for (ConditionError error : report.conditionErrors()) {
            gen.writeStartObject();
            gen.writeStringField("page", error.page());
            gen.writeStringField("target", error.target());
            gen.writeStringField("condition", error.condition());
            gen.writeStringField("kind", error.kind());
            gen.writeStringField("message", error.message());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("enums");
        for (EnumDomain domain : report.enums().all()) {
            gen.writeStartObject();
            gen.writeStringField("name", domain.name());
            gen.writeStringField("kind", domain.kind().label());
            gen.writeArrayFieldStart("members");
            for (Object member : domain.members()) {
                gen.writeObject(member);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private static void writeCondition(String field, Expr condition, JsonGenerator gen)
            throws IOException {
        if (condition == null) {
            gen.writeNullField(field);
        } else {
            gen.writeStringField(field, condition.toString());
        }
    }
}
