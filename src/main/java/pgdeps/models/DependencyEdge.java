package pgdeps.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;
import static java.util.Objects.requireNonNull;

/**
 * A directed dependency: {@code from} is the dependent (the view or function using
 * {@code to}, or the table holding a foreign key into {@code to}). The label lists the
 * referencing columns of a foreign key and is null for usage edges.
 */
@JsonPropertyOrder({"from", "to", "kind", "label"})
public record DependencyEdge
  (
    SchemaObject from,
    SchemaObject to,
    EdgeKind kind,
    @Nullable String label
  )
{
  public DependencyEdge
  {
    requireNonNull(from);
    requireNonNull(to);
    requireNonNull(kind);
    if (kind == EdgeKind.USES && label != null)
      throw new IllegalArgumentException("Usage edges carry no label.");
  }

  public static DependencyEdge uses(SchemaObject dependent, SchemaObject used)
  {
    return new DependencyEdge(dependent, used, EdgeKind.USES, null);
  }

  public static DependencyEdge foreignKey(SchemaObject referencer, SchemaObject referenced, @Nullable String columns)
  {
    return new DependencyEdge(referencer, referenced, EdgeKind.FOREIGN_KEY, columns);
  }

  @JsonIgnore
  public boolean isSelfLoop()
  {
    return from.equals(to);
  }
}
