package pgdeps.models;

import java.util.List;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Objects first discovered at one depth of a cascade, with the edges found when expanding
 * them. Depth 0 holds only the root.
 */
@JsonPropertyOrder({"depth", "objects", "edges"})
public record CascadeLevel
  (
    int depth,
    List<SchemaObject> objects,
    List<DependencyEdge> edges
  )
{
  public CascadeLevel
  {
    objects = List.copyOf(objects);
    edges = List.copyOf(edges);
  }
}
