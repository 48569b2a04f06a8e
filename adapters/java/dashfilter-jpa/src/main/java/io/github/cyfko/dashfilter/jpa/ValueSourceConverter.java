package io.github.cyfko.dashfilter.jpa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;
import io.github.cyfko.dashfilter.core.model.DatabaseValueSource;
import io.github.cyfko.dashfilter.core.model.OptionItem;
import io.github.cyfko.dashfilter.core.model.StaticValueSource;
import io.github.cyfko.dashfilter.core.model.ValueSource;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a selector's {@link ValueSource} as a JSON document.
 * <p>
 * The document carries a {@code kind} discriminator:
 * </p>
 * <pre>{@code
 * {"kind":"static","items":[{"value":"WON","label":"Won"}]}
 * {"kind":"database","sourceTable":"crm_deals","sourceColumn":"assigned_by_id",
 *  "labelTable":"crm_users","labelColumn":"name","labelValueColumn":"bitrix_id"}
 * }</pre>
 * <p>
 * Reading goes back through the model constructors, so a document edited by hand with an invalid
 * identifier fails with a {@link SelectorDefinitionException} instead of reaching SQL.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Converter
public class ValueSourceConverter implements AttributeConverter<ValueSource, String> {

    static final String KIND_STATIC = "static";
    static final String KIND_DATABASE = "database";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(ValueSource source) {
        if (source == null) {
            return null;
        }
        ObjectNode node = MAPPER.createObjectNode();
        if (source instanceof StaticValueSource staticSource) {
            node.put("kind", KIND_STATIC);
            ArrayNode items = node.putArray("items");
            for (OptionItem item : staticSource.items()) {
                ObjectNode itemNode = items.addObject();
                itemNode.set("value", MAPPER.valueToTree(item.value()));
                itemNode.put("label", item.label());
            }
        } else if (source instanceof DatabaseValueSource db) {
            node.put("kind", KIND_DATABASE);
            node.put("sourceTable", db.sourceTable());
            node.put("sourceColumn", db.sourceColumn());
            if (db.hasLabelJoin()) {
                node.put("labelTable", db.labelTable());
                node.put("labelColumn", db.labelColumn());
                node.put("labelValueColumn", db.labelValueColumn());
            }
        }
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize value source " + source, e);
        }
    }

    @Override
    public ValueSource convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SelectorDefinitionException("Stored value source is not valid JSON: " + e.getOriginalMessage());
        }

        String kind = node.path("kind").asText("");
        switch (kind) {
            case KIND_STATIC:
                List<OptionItem> items = new ArrayList<>();
                for (JsonNode itemNode : node.path("items")) {
                    Object value = toValue(itemNode.get("value"));
                    JsonNode label = itemNode.get("label");
                    items.add(new OptionItem(value, label == null || label.isNull() ? null : label.asText()));
                }
                return new StaticValueSource(items);
            case KIND_DATABASE:
                return new DatabaseValueSource(
                        text(node, "sourceTable"),
                        text(node, "sourceColumn"),
                        text(node, "labelTable"),
                        text(node, "labelColumn"),
                        text(node, "labelValueColumn"));
            default:
                throw new SelectorDefinitionException("Unknown value source kind: '" + kind + "'");
        }
    }

    private static Object toValue(JsonNode valueNode) {
        if (valueNode == null || valueNode.isNull()) {
            throw new SelectorDefinitionException("Static option without a value");
        }
        try {
            return MAPPER.treeToValue(valueNode, Object.class);
        } catch (JsonProcessingException e) {
            throw new SelectorDefinitionException("Unreadable option value: " + valueNode);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
