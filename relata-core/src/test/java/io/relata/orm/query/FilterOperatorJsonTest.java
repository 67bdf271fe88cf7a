package io.relata.orm.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.relata.orm.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FilterOperatorJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesNestedGroups() throws Exception {
    String s = """
        {
          "and": [
            { "gt": { "column": "age", "value": 30 } },
            { "or": [
                { "eq": { "column": "is_active", "value": false } },
                { "is_null": { "column": "score" } }
            ] }
          ]
        }
        """;
    FilterOperator op = JSON.readValue(s, FilterOperator.class);
    assertTrue(op instanceof FilterOperator.And);
    FilterOperator.And and = (FilterOperator.And) op;
    assertEquals(2, and.children().size());

    Filter gt = ((FilterOperator.Single) and.children().get(0)).filter();
    assertEquals(Operator.GT, gt.operator());
    assertEquals(Value.of(30L), gt.operand());

    FilterOperator.Or or = (FilterOperator.Or) and.children().get(1);
    Filter eq = ((FilterOperator.Single) or.children().get(0)).filter();
    assertEquals(Value.of(0L), eq.operand());
    Filter isNull = ((FilterOperator.Single) or.children().get(1)).filter();
    assertEquals(Operator.IS_NULL, isNull.operator());
    assertTrue(isNull.operands().isEmpty());
  }

  @Test
  void writesCanonicalForm() throws Exception {
    FilterOperator op = FilterOperator.or(
        FilterOperator.single(Filter.in("id", List.of(1, 2))),
        FilterOperator.single(Filter.like("name", "%a%")),
        FilterOperator.single(Filter.isNotNull("email")));
    String json = JSON.writeValueAsString(op);
    assertEquals("{\"or\":[{\"in\":{\"column\":\"id\",\"values\":[1,2]}},"
        + "{\"like\":{\"column\":\"name\",\"value\":\"%a%\"}},"
        + "{\"is_not_null\":{\"column\":\"email\"}}]}", json);
  }

  @Test
  void blobsTravelAsBase64() throws Exception {
    FilterOperator op = FilterOperator.single(Filter.eq("payload", new byte[] {1, 2, 3}));
    String json = JSON.writeValueAsString(op);
    assertTrue(json.contains("{\"blob\":\"AQID\"}"));
    assertEquals(op, JSON.readValue(json, FilterOperator.class));
  }

  @Test
  void rejectsUnknownOperator() {
    String s = "{ \"between\": { \"column\": \"age\", \"value\": 1 } }";
    assertThrows(IllegalArgumentException.class, () -> JSON.readValue(s, FilterOperator.class));
  }

  @Test
  void rejectsWrongArity() {
    String s = "{ \"eq\": { \"column\": \"age\" } }";
    assertThrows(IllegalArgumentException.class, () -> JSON.readValue(s, FilterOperator.class));
  }
}
