package org.cellpainting.loaddata.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper that parses one NDJSON line into {@link Map}/{@link List} structures.
 *
 * <p>Object key order is preserved, which keeps metadata key order stable from input to manifest. Integral
 * floating-point values are read as integers, so {@code "site": 1.0} and {@code "site": 1} join alike.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory;

  public JsonSupport() {
    this(new JsonFactory());
  }

  public JsonSupport(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Parses a single JSON object.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object as an insertion-ordered map
   * @throws IllegalArgumentException when the text is not a single JSON object
   */
  public Map<String, Object> parseObject(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("expected a JSON object but found " + token);
      }
      Map<String, Object> value = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getMessage(), ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("unexpected end of JSON input");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getNumberValue();
      case VALUE_NUMBER_FLOAT -> floatValue(parser);
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("unsupported JSON token: " + token);
    };
  }

  /** Integral floats such as {@code 1.0} or {@code 1e3} become integers, so they render like {@code 1}. */
  private static Number floatValue(JsonParser parser) throws IOException {
    BigDecimal decimal = parser.getDecimalValue();
    if (decimal.signum() == 0) {
      return 0L;
    }
    BigDecimal stripped = decimal.stripTrailingZeros();
    if (stripped.scale() > 0) {
      return parser.getDoubleValue();
    }
    BigInteger integral = stripped.toBigIntegerExact();
    return integral.bitLength() < Long.SIZE ? integral.longValue() : integral;
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        return map;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        return list;
      }
      list.add(readValue(parser, token));
    }
  }
}
