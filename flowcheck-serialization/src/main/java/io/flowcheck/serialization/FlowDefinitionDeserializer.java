package io.flowcheck.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowcheck.core.flow.EnumValue;
import io.flowcheck.core.flow.EnumValues;
import io.flowcheck.core.flow.FlowDefinition;
import io.flowcheck.core.flow.Page;
import io.flowcheck.core.flow.PageTransition;
import io.flowcheck.core.flow.VariableType;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/// Reads a flow document into a validated `FlowDefinition`.
///
/// Fields are extracted manually from the `JsonNode` tree. Transitions without a
/// `"condition"` (or with a blank one) are unconditional. `"variables"` is optional.
///
/// ### Failures
/// - missing `id`, `startPage`, `pages`, page `uid` or transition `target`:
///   `JsonMappingException`
/// - unknown variable type, duplicate page, unknown start page or target:
///   {@link io.flowcheck.core.exception.ConfigurationException} from the flow builder
///
/// @implNote Package-private. Registered by {@link FlowJacksonModule}.
/// @see FlowDefinitionSerializer for the inverse operation
class FlowDefinitionDeserializer extends StdDeserializer<FlowDefinition> {

    @Serial private static final long serialVersionUID = 6168410723558034920L;

    FlowDefinitionDeserializer() {
        super(FlowDefinition.class);
    }

    @Override
    public FlowDefinition deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        FlowDefinition.Builder builder =
                FlowDefinition.builder()
                        .id(requiredText(p, root, "id"))
                        .startPage(requiredText(p, root, "startPage"));

        if (root.has("variables")) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.get("variables").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.variable(field.getKey(), VariableType.fromName(field.getValue().asText()));
            }
        }

        JsonNode pages = root.get("pages");
        if (pages == null || !pages.isArray()) {
            throw JsonMappingException.from(p, "Flow document requires a 'pages' array");
        }
        for (JsonNode page : pages) {
            builder.page(readPage(p, page));
        }
        return builder.build();
    }

    private Page readPage(JsonParser p, JsonNode node) throws JsonMappingException {
        String uid = requiredText(p, node, "uid");

        List<PageTransition> transitions = new ArrayList<>();
        JsonNode transitionsNode = node.get("transitions");
        if (transitionsNode != null) {
            for (JsonNode transition : transitionsNode) {
                String condition = textOrNull(transition, "condition");
                if (condition != null && condition.isBlank()) {
                    condition = null;
                }
                transitions.add(new PageTransition(condition, requiredText(p, transition, "target")));
            }
        }

        List<EnumValues> enumValues = new ArrayList<>();
        JsonNode enumNode = node.get("enumValues");
        if (enumNode != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = enumNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                List<EnumValue> values = new ArrayList<>();
                for (JsonNode value : field.getValue()) {
                    values.add(new EnumValue(requiredText(p, value, "uid"), value.path("code").asLong()));
                }
                enumValues.add(new EnumValues(field.getKey(), values));
            }
        }
        return new Page(uid, transitions, enumValues);
    }

    private static String requiredText(JsonParser p, JsonNode node, String field)
            throws JsonMappingException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw JsonMappingException.from(p, "Missing required field: " + field);
        }
        return value.asText();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
