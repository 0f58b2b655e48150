package io.flowcheck.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.flowcheck.core.AnalysisReport;
import io.flowcheck.core.flow.FlowDefinition;

/// Utility class for reading flow documents from JSON and writing flows and analysis
/// reports to JSON.
///
/// ### Usage
/// {@snippet :
/// FlowDefinition flow = FlowSerializer.fromJson(Files.readString(path));
/// AnalysisReport report = new FlowAnalyzer().analyze(flow);
/// String json = FlowSerializer.toJson(report);
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via `createMapper()`.
///
/// @see FlowJacksonModule for the registered type handlers
public final class FlowSerializer {

    private FlowSerializer() {}

    /// Serializes a flow definition to pretty-printed JSON.
    ///
    /// @param flow the flow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(FlowDefinition flow) {
        try {
            return createMapper().writeValueAsString(flow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize flow: " + e.getMessage(), e);
        }
    }

    /// Serializes an analysis report to pretty-printed JSON.
    ///
    /// @param report the report to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(AnalysisReport report) {
        try {
            return createMapper().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    /// Deserializes a flow definition from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized and validated flow, never null
    /// @throws IllegalArgumentException if the JSON is malformed or a required field is missing
    /// @throws io.flowcheck.core.exception.ConfigurationException if the flow is inconsistent
    public static FlowDefinition fromJson(String json) {
        try {
            return createMapper().readValue(json, FlowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize flow: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for FlowCheck documents.
    ///
    /// Registers:
    /// - `FlowJacksonModule` for flows, expressions and reports
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new FlowJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
