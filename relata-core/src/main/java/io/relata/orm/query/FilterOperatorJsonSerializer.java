package io.relata.orm.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.relata.orm.value.Value;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/** Canonical JSON serializer for {@link FilterOperator}. */
public final class FilterOperatorJsonSerializer extends JsonSerializer<FilterOperator> {
  @Override
  public void serialize(FilterOperator op, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (op == null) {
      g.writeNull();
      return;
    }
    writeElement(op, g);
  }

  static String key(Operator op) {
    return op.name().toLowerCase(Locale.ROOT);
  }

  private static void writeElement(FilterOperator op, JsonGenerator g) throws IOException {
    if (op instanceof FilterOperator.And a) {
      writeGroup("and", a.children(), g);
      return;
    }
    if (op instanceof FilterOperator.Or o) {
      writeGroup("or", o.children(), g);
      return;
    }

    Filter f = ((FilterOperator.Single) op).filter();
    g.writeStartObject();
    g.writeObjectFieldStart(key(f.operator()));
    g.writeStringField("column", f.column());
    if (f.operator() == Operator.IN) {
      g.writeArrayFieldStart("values");
      for (Value v : f.operands()) writeValue(v, g);
      g.writeEndArray();
    } else if (f.operator().arity() == 1) {
      g.writeFieldName("value");
      writeValue(f.operand(), g);
    }
    g.writeEndObject();
    g.writeEndObject();
  }

  private static void writeGroup(String key, List<FilterOperator> children, JsonGenerator g) throws IOException {
    g.writeStartObject();
    g.writeArrayFieldStart(key);
    for (FilterOperator child : children) writeElement(child, g);
    g.writeEndArray();
    g.writeEndObject();
  }

  private static void writeValue(Value v, JsonGenerator g) throws IOException {
    if (v instanceof Value.IntegerValue i) {
      g.writeNumber(i.value());
    } else if (v instanceof Value.RealValue r) {
      g.writeNumber(r.value());
    } else if (v instanceof Value.TextValue t) {
      g.writeString(t.value());
    } else if (v instanceof Value.BlobValue b) {
      g.writeStartObject();
      g.writeStringField("blob", Base64.getEncoder().encodeToString(b.value()));
      g.writeEndObject();
    } else {
      g.writeNull();
    }
  }
}
