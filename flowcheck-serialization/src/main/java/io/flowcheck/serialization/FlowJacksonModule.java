package io.flowcheck.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.flowcheck.core.AnalysisReport;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.flow.FlowDefinition;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all FlowCheck serialization configuration in one place.
///
/// - `FlowDefinition` - `FlowDefinitionSerializer` / `FlowDefinitionDeserializer`
/// - `Expr` - `ExprSerializer`, a `"type"` discriminated tree
/// - `AnalysisReport` - `AnalysisReportSerializer`, write-only
///
/// @implNote All registrations are explicit, no classpath scanning or reflection on the
/// domain types.
/// @see FlowSerializer for the convenience factory API
public class FlowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4417925093301582311L;

    public FlowJacksonModule() {
        super("FlowJacksonModule");

        addSerializer(FlowDefinition.class, new FlowDefinitionSerializer());
        addDeserializer(FlowDefinition.class, new FlowDefinitionDeserializer());

        addSerializer(Expr.class, new ExprSerializer());
        addSerializer(AnalysisReport.class, new AnalysisReportSerializer());
    }
}
