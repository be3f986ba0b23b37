package pgdeps.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"object", "dependentCount", "foreignKeyCount"})
public record DependentCounts
  (
    SchemaObject object,
    int dependentCount,
    int foreignKeyCount
  )
{}
