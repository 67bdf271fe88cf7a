package io.relata.orm.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.relata.orm.value.Value;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link FilterOperator}.
 * <p>
 * Accepts {@code {"and":[...]}}, {@code {"or":[...]}} and one-key condition objects such as
 * {@code {"gte":{"column":"age","value":18}}}. Anything else is an {@link IllegalArgumentException}.
 */
public final class FilterOperatorJsonDeserializer extends JsonDeserializer<FilterOperator> {
  @Override
  public FilterOperator deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    return parseElement(root);
  }

  private static FilterOperator parseElement(JsonNode n) {
    if (n == null || !n.isObject() || n.size() != 1) {
      throw new IllegalArgumentException("Filter element must be an object with exactly one key: " + n);
    }

    String key = n.fieldNames().next();
    JsonNode body = n.get(key);
    if ("and".equals(key)) return new FilterOperator.And(parseChildren(key, body));
    if ("or".equals(key)) return new FilterOperator.Or(parseChildren(key, body));

    Operator op = tryOp(key);
    if (op == null) throw new IllegalArgumentException("Unknown filter operator: " + key);
    if (body == null || !body.isObject()) throw new IllegalArgumentException(key + " must be an object");
    return FilterOperator.single(parseFilter(op, body));
  }

  private static List<FilterOperator> parseChildren(String key, JsonNode arr) {
    if (arr == null || !arr.isArray()) throw new IllegalArgumentException(key + " must be an array");
    List<FilterOperator> out = new ArrayList<>(arr.size());
    for (JsonNode x : arr) out.add(parseElement(x));
    return out;
  }

  private static Filter parseFilter(Operator op, JsonNode body) {
    JsonNode col = body.get("column");
    if (col == null || !col.isTextual()) throw new IllegalArgumentException(op + " requires column");
    String column = col.asText();

    if (op == Operator.IN) {
      JsonNode values = body.get("values");
      if (values == null || !values.isArray()) throw new IllegalArgumentException("in requires values array");
      List<Value> out = new ArrayList<>(values.size());
      for (JsonNode v : values) out.add(decodeValue(v));
      return new Filter(column, op, out);
    }
    if (op.arity() == 0) return new Filter(column, op, List.of());

    if (!body.has("value")) throw new IllegalArgumentException(op + " requires value");
    return new Filter(column, op, List.of(decodeValue(body.get("value"))));
  }

  private static Value decodeValue(JsonNode v) {
    if (v == null || v.isNull()) return Value.NULL;
    if (v.isBoolean()) return Value.from(v.booleanValue());
    if (v.isIntegralNumber()) return new Value.IntegerValue(v.longValue());
    if (v.isNumber()) return new Value.RealValue(v.doubleValue());
    if (v.isTextual()) return new Value.TextValue(v.asText());
    if (v.isObject() && v.size() == 1 && v.get("blob") != null && v.get("blob").isTextual()) {
      try {
        return new Value.BlobValue(Base64.getDecoder().decode(v.get("blob").asText()));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("blob is not valid base64", e);
      }
    }
    throw new IllegalArgumentException("Unsupported filter value: " + v);
  }

  private static Operator tryOp(String key) {
    for (Operator op : Operator.values()) {
      if (FilterOperatorJsonSerializer.key(op).equals(key)) return op;
    }
    return null;
  }
}
