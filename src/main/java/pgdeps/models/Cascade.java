package pgdeps.models;

import java.util.ArrayList;
import java.util.List;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"root", "truncated", "levels"})
public record Cascade
  (
    SchemaObject root,
    List<CascadeLevel> levels,
    boolean truncated
  )
{
  public Cascade
  {
    levels = List.copyOf(levels);
  }

  // All objects of the cascade in order of discovery, the root first.
  @JsonIgnore
  public List<SchemaObject> visited()
  {
    List<SchemaObject> objs = new ArrayList<>();
    for (CascadeLevel level : levels)
      objs.addAll(level.objects());
    return objs;
  }

  @JsonIgnore
  public List<DependencyEdge> edges()
  {
    List<DependencyEdge> edges = new ArrayList<>();
    for (CascadeLevel level : levels)
      edges.addAll(level.edges());
    return edges;
  }

  @JsonIgnore
  public CascadeLevel level(int depth)
  {
    return levels.get(depth);
  }
}
