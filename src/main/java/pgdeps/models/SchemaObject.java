package pgdeps.models;

import java.util.Objects;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import static java.util.Objects.requireNonNull;

/**
 * A table, view, function or other catalog entity, identified by its schema and name.
 * The kind and the catalog's own type string are descriptive only and take no part in
 * equality.
 */
@JsonPropertyOrder({"schema", "name", "kind", "catalogType"})
public record SchemaObject
  (
    String schema,
    String name,
    ObjectKind kind,
    String catalogType
  )
{
  public SchemaObject
  {
    requireNonNull(schema);
    requireNonNull(name);
    requireNonNull(kind);
    requireNonNull(catalogType);
  }

  public SchemaObject(String schema, String name, ObjectKind kind)
  {
    this(schema, name, kind, kind.name());
  }

  public static SchemaObject fromCatalog(String schema, String name, String catalogType)
  {
    return new SchemaObject(schema, name, ObjectKind.fromCatalogType(catalogType), catalogType);
  }

  @JsonIgnore
  public String getIdString()
  {
    return schema + "." + name;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof SchemaObject other)) return false;
    return schema.equals(other.schema) && name.equals(other.name);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(schema, name);
  }

  @Override
  public String toString()
  {
    return getIdString();
  }
}
