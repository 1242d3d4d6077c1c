package com.gentoro.clm.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Options of the structured-data encoder.
 *
 * @param requiredFields always part of the header; a record lacking one is rejected
 * @param excludedFields dropped unless also required
 * @param fieldImportance explicit importance score per field name, 0.0 to 1.0
 * @param importanceThreshold fields scoring at least this much are kept
 * @param maxFieldLength longer values are cut and suffixed with {@code ...}
 * @param preserveStructure render nested maps and arrays inline instead of flattening them
 * @param normalizeCase lower-case row values
 * @param datasetName name used in the header when the caller's metadata gives none
 * @param identityFields fields listed first in the header when present
 */
public record StructuredDataOptions(
    Set<String> requiredFields,
    Set<String> excludedFields,
    Map<String, Double> fieldImportance,
    double importanceThreshold,
    int maxFieldLength,
    boolean preserveStructure,
    boolean normalizeCase,
    String datasetName,
    List<String> identityFields) {

  public StructuredDataOptions {
    requiredFields = Collections.unmodifiableSet(new LinkedHashSet<>(requiredFields));
    excludedFields = Collections.unmodifiableSet(new LinkedHashSet<>(excludedFields));
    fieldImportance = Collections.unmodifiableMap(new LinkedHashMap<>(fieldImportance));
    identityFields = List.copyOf(identityFields);
    if (maxFieldLength <= 0) {
      throw new IllegalArgumentException("maxFieldLength must be positive, got " + maxFieldLength);
    }
  }

  public static StructuredDataOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.requiredFields = new LinkedHashSet<>(requiredFields);
    b.excludedFields = new LinkedHashSet<>(excludedFields);
    b.fieldImportance = new LinkedHashMap<>(fieldImportance);
    b.importanceThreshold = importanceThreshold;
    b.maxFieldLength = maxFieldLength;
    b.preserveStructure = preserveStructure;
    b.normalizeCase = normalizeCase;
    b.datasetName = datasetName;
    b.identityFields = identityFields;
    return b;
  }

  public static final class Builder {
    private Set<String> requiredFields = new LinkedHashSet<>();
    private Set<String> excludedFields = new LinkedHashSet<>();
    private Map<String, Double> fieldImportance = new LinkedHashMap<>();
    private double importanceThreshold = 0.5;
    private int maxFieldLength = 200;
    private boolean preserveStructure = true;
    private boolean normalizeCase = true;
    private String datasetName = "DATA";
    private List<String> identityFields = List.of("id", "title", "name", "type");

    public Builder requiredFields(Iterable<String> v) {
      this.requiredFields = new LinkedHashSet<>();
      if (v != null) v.forEach(this.requiredFields::add);
      return this;
    }

    public Builder excludedFields(Iterable<String> v) {
      this.excludedFields = new LinkedHashSet<>();
      if (v != null) v.forEach(this.excludedFields::add);
      return this;
    }

    public Builder fieldImportance(String field, double score) {
      this.fieldImportance.put(field, score);
      return this;
    }

    public Builder fieldImportance(String field, FieldImportance level) {
      return fieldImportance(field, level.score());
    }

    public Builder fieldImportance(Map<String, Double> v) {
      this.fieldImportance = v == null ? new LinkedHashMap<>() : new LinkedHashMap<>(v);
      return this;
    }

    public Builder importanceThreshold(double v) {
      this.importanceThreshold = v;
      return this;
    }

    public Builder maxFieldLength(int v) {
      this.maxFieldLength = v;
      return this;
    }

    public Builder preserveStructure(boolean v) {
      this.preserveStructure = v;
      return this;
    }

    public Builder normalizeCase(boolean v) {
      this.normalizeCase = v;
      return this;
    }

    public Builder datasetName(String v) {
      this.datasetName = v == null || v.isBlank() ? "DATA" : v;
      return this;
    }

    public Builder identityFields(List<String> v) {
      this.identityFields = v == null ? List.of() : v;
      return this;
    }

    public StructuredDataOptions build() {
      return new StructuredDataOptions(
          requiredFields,
          excludedFields,
          fieldImportance,
          importanceThreshold,
          maxFieldLength,
          preserveStructure,
          normalizeCase,
          datasetName,
          identityFields);
    }
  }
}
