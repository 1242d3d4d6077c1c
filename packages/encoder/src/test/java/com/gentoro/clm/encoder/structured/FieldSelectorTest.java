package com.gentoro.clm.encoder.structured;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.config.FieldImportance;
import com.gentoro.clm.config.StructuredDataOptions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldSelectorTest {

  private static Map<String, Object> record() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("status", "open");
    record.put("notes", "called twice");
    record.put("id", 42);
    record.put("updated_at", "2024-02-01");
    record.put("region", "emea");
    record.put("flag", "y");
    record.put("empty", "");
    record.put("title", "Router reboot loop");
    return record;
  }

  @Test
  void testDefaultSelection() {
    List<String> fields =
        new FieldSelector(StructuredDataOptions.defaults()).select(List.of(record()));

    assertEquals(List.of("id", "title", "status", "region"), fields);
  }

  @Test
  void testConfiguredImportance() {
    StructuredDataOptions options =
        StructuredDataOptions.builder()
            .fieldImportance("notes", FieldImportance.CRITICAL)
            .fieldImportance("region", 0.1)
            .build();

    List<String> fields = new FieldSelector(options).select(List.of(record()));

    assertEquals(List.of("id", "title", "status", "notes"), fields);
  }

  @Test
  void testRequiredAndExcluded() {
    StructuredDataOptions options =
        StructuredDataOptions.builder()
            .requiredFields(List.of("flag"))
            .excludedFields(List.of("flag", "status"))
            .build();

    List<String> fields = new FieldSelector(options).select(List.of(record()));

    assertEquals(List.of("id", "title", "flag", "region"), fields);
  }

  @Test
  void testThreshold() {
    StructuredDataOptions options =
        StructuredDataOptions.builder().importanceThreshold(0.9).build();

    assertEquals(List.of("id", "status"), new FieldSelector(options).select(List.of(record())));
  }

  @Test
  void testDetect() {
    assertEquals(FieldImportance.CRITICAL, FieldSelector.detect("ID", 1));
    assertEquals(FieldImportance.LOW, FieldSelector.detect("_rev", "3-a"));
    assertEquals(FieldImportance.NEVER, FieldSelector.detect("closed_date", "2024-01-01"));
    assertEquals(FieldImportance.NEVER, FieldSelector.detect("comment", null));
    assertEquals(FieldImportance.LOW, FieldSelector.detect("code", "x"));
    assertEquals(FieldImportance.MEDIUM, FieldSelector.detect("body", "a".repeat(600)));
    assertEquals(FieldImportance.MEDIUM, FieldSelector.detect("count", 7));
  }

  @Test
  void testIsEmpty() {
    assertTrue(FieldSelector.isEmpty(null));
    assertTrue(FieldSelector.isEmpty(" "));
    assertTrue(FieldSelector.isEmpty(List.of()));
    assertTrue(FieldSelector.isEmpty(Map.of()));
    assertFalse(FieldSelector.isEmpty(0));
  }
}
