package com.flamingo.ai.policyanalysis.service.analysis.prompt;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

/**
 * The structured-output schema every analysis call is constrained to.
 *
 * <p>All properties are required and no additional properties are allowed, which is what strict
 * structured outputs demand. Bump {@link #SCHEMA_VERSION} whenever the shape changes: it is part
 * of the content fingerprint, so cached and versioned results from an older shape are not reused.
 */
public final class AnalysisSchema {

  public static final String SCHEMA_VERSION = "2025-01";
  public static final String SCHEMA_NAME = "bill_analysis_schema";

  private static final JsonSchema SCHEMA =
      JsonSchema.builder().name(SCHEMA_NAME).rootElement(buildRoot()).build();

  private AnalysisSchema() {}

  public static JsonSchema jsonSchema() {
    return SCHEMA;
  }

  private static JsonObjectSchema buildRoot() {
    return JsonObjectSchema.builder()
        .addProperty(
            "summary",
            JsonStringSchema.builder().description("A concise summary of the bill").build())
        .addProperty(
            "key_points",
            JsonArraySchema.builder()
                .description("List of key bullet points in the legislation")
                .items(keyPoint())
                .build())
        .addProperty(
            "public_health_impacts",
            section(
                "direct_effects", "indirect_effects", "funding_impact", "vulnerable_populations"))
        .addProperty(
            "local_government_impacts", section("administrative", "fiscal", "implementation"))
        .addProperty(
            "economic_impacts",
            section("direct_costs", "economic_effects", "benefits", "long_term_impact"))
        .addProperty("environmental_impacts", stringList())
        .addProperty("education_impacts", stringList())
        .addProperty("infrastructure_impacts", stringList())
        .addProperty("recommended_actions", stringList())
        .addProperty("immediate_actions", stringList())
        .addProperty("resource_needs", stringList())
        .addProperty("impact_summary", impactSummary())
        .addProperty(
            "confidence_score",
            JsonNumberSchema.builder()
                .description("Confidence in this analysis, from 0.0 to 1.0")
                .build())
        .required(
            "summary",
            "key_points",
            "public_health_impacts",
            "local_government_impacts",
            "economic_impacts",
            "environmental_impacts",
            "education_impacts",
            "infrastructure_impacts",
            "recommended_actions",
            "immediate_actions",
            "resource_needs",
            "impact_summary",
            "confidence_score")
        .additionalProperties(false)
        .build();
  }

  private static JsonSchemaElement keyPoint() {
    return JsonObjectSchema.builder()
        .addProperty(
            "point", JsonStringSchema.builder().description("The text of the bullet point").build())
        .addProperty(
            "impact_type",
            JsonEnumSchema.builder()
                .description("The overall tone or impact of this point")
                .enumValues("positive", "negative", "neutral")
                .build())
        .required("point", "impact_type")
        .additionalProperties(false)
        .build();
  }

  private static JsonSchemaElement impactSummary() {
    return JsonObjectSchema.builder()
        .addProperty(
            "primary_category",
            JsonEnumSchema.builder()
                .enumValues(
                    "public_health",
                    "local_gov",
                    "economic",
                    "environmental",
                    "education",
                    "infrastructure")
                .build())
        .addProperty(
            "impact_level",
            JsonEnumSchema.builder().enumValues("low", "moderate", "high", "critical").build())
        .addProperty(
            "relevance_to_texas",
            JsonEnumSchema.builder().enumValues("low", "moderate", "high").build())
        .required("primary_category", "impact_level", "relevance_to_texas")
        .additionalProperties(false)
        .build();
  }

  private static JsonSchemaElement section(String... lists) {
    JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
    for (String list : lists) {
      builder.addProperty(list, stringList());
    }
    return builder.required(lists).additionalProperties(false).build();
  }

  private static JsonSchemaElement stringList() {
    return JsonArraySchema.builder().items(JsonStringSchema.builder().build()).build();
  }
}
