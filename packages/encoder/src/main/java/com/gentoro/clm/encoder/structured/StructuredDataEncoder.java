package com.gentoro.clm.encoder.structured;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.clm.config.StructuredDataOptions;
import com.gentoro.clm.encoder.ComponentKind;
import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.exception.ExceptionUtil;
import com.gentoro.clm.exception.InvalidInputException;
import com.gentoro.clm.exception.RecordValidationException;
import com.gentoro.clm.output.EncoderOutput;
import com.gentoro.clm.token.ResolvedToken;
import com.gentoro.clm.token.TokenCategory;
import com.gentoro.clm.utility.JacksonUtility;
import com.gentoro.clm.utility.TextUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes a list of records as a dataset header followed by one bracketed row per record:
 * {@code [DATASET:TICKETS:COUNT=2]{id,status}[1,open][2,closed]}.
 */
public final class StructuredDataEncoder {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(StructuredDataEncoder.class);

  public static final String RECORD_ERRORS = "record_errors";

  public EncoderOutput encode(Object input, EncodingContext context) {
    StructuredDataOptions options = context.configuration().structured();
    Object parsed = parse(input);
    List<Object> raw = parsed instanceof List<?> list ? new ArrayList<Object>(list) : List.of(parsed);
    String original = JacksonUtility.toJson(parsed);

    List<Map<String, Object>> valid = new ArrayList<>();
    List<Map<String, Object>> errors = new ArrayList<>();
    for (int i = 0; i < raw.size(); i++) {
      try {
        valid.add(validate(i, raw.get(i), options));
      } catch (RecordValidationException e) {
        log.warn("Skipping record {}: {}", i, e.getMessage());
        errors.add(ExceptionUtil.toRecordError(e));
      }
    }

    List<String> fields = new FieldSelector(options).select(valid);
    ValueFormatter formatter = new ValueFormatter(options);
    String name = context.metadataString("dataset");
    ResolvedToken header =
        ResolvedToken.builder(TokenCategory.DATASET)
            .value(TextUtility.toTokenValue(name == null ? options.datasetName() : name))
            .attribute("COUNT", valid.size())
            .build();

    List<String> headerNames = fields.stream().map(ValueFormatter::escape).toList();
    StringBuilder sb =
        new StringBuilder(header.render())
            .append('{')
            .append(String.join(",", headerNames))
            .append('}');
    for (Map<String, Object> record : valid) {
      List<String> cells = new ArrayList<>(fields.size());
      for (String field : fields) {
        cells.add(formatter.format(record.get(field)));
      }
      sb.append('[').append(String.join(",", cells)).append(']');
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("records", raw.size());
    metadata.put("fields", fields);
    if (!errors.isEmpty()) {
      metadata.put(RECORD_ERRORS, errors);
    }
    return new EncoderOutput(
        ComponentKind.STRUCTURED_DATA, original, List.of(header.render()), sb.toString(), metadata);
  }

  /** Accepts a list, a single map or JSON text of either shape. */
  static Object parse(Object input) {
    Object value = input;
    if (input instanceof String text) {
      try {
        value = JacksonUtility.getLenientJsonMapper().readValue(text, new TypeReference<Object>() {});
      } catch (JsonProcessingException e) {
        throw new InvalidInputException("Structured input is not valid JSON", e);
      }
    }
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      return value;
    }
    throw new InvalidInputException(
        "Structured input must be a JSON object or array, got "
            + (value == null ? "null" : value.getClass().getSimpleName()));
  }

  private static Map<String, Object> validate(
      int index, Object record, StructuredDataOptions options) {
    if (!(record instanceof Map<?, ?> map)) {
      throw new RecordValidationException(index, null, "Record " + index + " is not an object");
    }
    Map<String, Object> collected = new LinkedHashMap<>();
    map.forEach((k, v) -> collected.put(String.valueOf(k), v));
    for (String required : options.requiredFields()) {
      if (collected.get(required) == null) {
        throw new RecordValidationException(
            index, required, "Record " + index + " is missing required field '" + required + "'");
      }
    }
    if (options.preserveStructure()) {
      return collected;
    }
    // required fields keep a nested value as one cell
    Map<String, Object> fields = new LinkedHashMap<>();
    collected.forEach(
        (k, v) -> {
          if (v instanceof Map<?, ?> nested
              && !nested.isEmpty()
              && !options.requiredFields().contains(k)) {
            flatten(k + ".", nested, fields);
          } else {
            fields.put(k, v);
          }
        });
    return fields;
  }

  /** Nested maps become dotted columns. */
  private static void flatten(String prefix, Map<?, ?> source, Map<String, Object> out) {
    source.forEach(
        (k, v) -> {
          String key = prefix + k;
          if (v instanceof Map<?, ?> nested && !nested.isEmpty()) {
            flatten(key + ".", nested, out);
          } else {
            out.put(key, v);
          }
        });
  }
}
