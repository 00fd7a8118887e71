package com.flamingo.ai.policyanalysis.service.analysis.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.policyanalysis.exception.SchemaValidationException;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Checks a parsed model response against the LangChain4j {@link JsonSchema} it was requested
 * with.
 *
 * <p>Covers what the analysis schema uses: required properties, JSON types, enum membership and
 * {@code additionalProperties: false}. Violations are reported as JSON-pointer-like paths.
 */
@Component
public class AnalysisSchemaValidator {

  /**
   * Validates {@code node} and throws if it does not conform.
   *
   * @throws SchemaValidationException listing every violation found
   */
  public void requireValid(JsonNode node, JsonSchema schema) {
    List<String> violations = validate(node, schema);
    if (!violations.isEmpty()) {
      throw new SchemaValidationException(violations);
    }
  }

  public List<String> validate(JsonNode node, JsonSchema schema) {
    List<String> violations = new ArrayList<>();
    check(node, schema.rootElement(), "$", violations);
    return violations;
  }

  private void check(JsonNode node, JsonSchemaElement element, String path, List<String> out) {
    if (node == null || node.isMissingNode()) {
      out.add(path + ": missing");
      return;
    }
    if (element instanceof JsonObjectSchema object) {
      checkObject(node, object, path, out);
    } else if (element instanceof JsonArraySchema array) {
      if (!node.isArray()) {
        out.add(path + ": expected array but was " + node.getNodeType());
        return;
      }
      for (int i = 0; i < node.size(); i++) {
        check(node.get(i), array.items(), path + "[" + i + "]", out);
      }
    } else if (element instanceof JsonEnumSchema enumeration) {
      if (!node.isTextual() || !enumeration.enumValues().contains(node.asText())) {
        out.add(
            path + ": '" + node.asText() + "' is not one of " + enumeration.enumValues());
      }
    } else if (element instanceof JsonStringSchema) {
      if (!node.isTextual()) {
        out.add(path + ": expected string but was " + node.getNodeType());
      }
    } else if (element instanceof JsonIntegerSchema) {
      if (!node.isIntegralNumber()) {
        out.add(path + ": expected integer but was " + node.getNodeType());
      }
    } else if (element instanceof JsonNumberSchema) {
      if (!node.isNumber()) {
        out.add(path + ": expected number but was " + node.getNodeType());
      }
    } else if (element instanceof JsonBooleanSchema) {
      if (!node.isBoolean()) {
        out.add(path + ": expected boolean but was " + node.getNodeType());
      }
    }
  }

  private void checkObject(JsonNode node, JsonObjectSchema schema, String path, List<String> out) {
    if (!node.isObject()) {
      out.add(path + ": expected object but was " + node.getNodeType());
      return;
    }
    Map<String, JsonSchemaElement> properties = schema.properties();

    if (schema.required() != null) {
      for (String name : schema.required()) {
        if (!node.has(name) || node.get(name).isNull()) {
          out.add(path + "." + name + ": required property missing");
        }
      }
    }

    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonSchemaElement propertySchema = properties == null ? null : properties.get(field.getKey());
      if (propertySchema == null) {
        if (Boolean.FALSE.equals(schema.additionalProperties())) {
          out.add(path + "." + field.getKey() + ": additional property not allowed");
        }
      } else if (!field.getValue().isNull()) {
        check(field.getValue(), propertySchema, path + "." + field.getKey(), out);
      }
    }
  }
}
