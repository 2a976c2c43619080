package io.intellixity.federa.plan;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link QueryPlan}. */
public final class QueryPlanJsonSerializer extends JsonSerializer<QueryPlan> {
  @Override
  public void serialize(QueryPlan plan, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (plan == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    g.writeArrayFieldStart("relationalQueries");
    for (RelationalSubQuery q : plan.relationalQueries()) {
      g.writeStartObject();
      g.writeStringField("sourceId", q.sourceId());
      g.writeStringField("statement", q.statementText());
      g.writeStringField("alias", q.resultAlias());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeArrayFieldStart("toolCalls");
    for (ToolCall t : plan.toolCalls()) {
      g.writeStartObject();
      g.writeStringField("sourceId", t.sourceId());
      g.writeStringField("toolName", t.toolName());
      g.writeObjectField("parameters", t.parameters());
      g.writeStringField("alias", t.resultAlias());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeBooleanField("needsCombination", plan.needsCombination());
    g.writeEndObject();
  }
}
