package pgdeps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pgdeps.models.Cascade;
import pgdeps.models.CascadeLevel;
import pgdeps.models.DependencyEdge;
import pgdeps.models.DependentCounts;
import pgdeps.models.SchemaObject;
import static java.util.Objects.requireNonNull;

/**
 * Computes first-level dependent counts for a schema, or the full cascade of objects
 * depending on a root object, expanded breadth-first. Each object is expanded at most once,
 * at the level where it is first discovered; later edges reaching it are still recorded.
 */
public class DependencyResolver
{
  private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

  private final CatalogGateway catalog;
  private final int maxDepth;
  private final @Nullable Duration timeLimit;
  private final Clock clock;

  public DependencyResolver(CatalogGateway catalog)
  {
    this(catalog, 0, null, Clock.systemUTC());
  }

  /**
   * @param maxDepth number of levels to expand, 0 for no limit.
   * @param timeLimit time allowed for one cascade, checked between levels, or null for none.
   */
  public DependencyResolver
    (
      CatalogGateway catalog,
      int maxDepth,
      @Nullable Duration timeLimit,
      Clock clock
    )
  {
    if (maxDepth < 0)
      throw new IllegalArgumentException("Maximum depth cannot be negative.");
    this.catalog = requireNonNull(catalog);
    this.maxDepth = maxDepth;
    this.timeLimit = timeLimit;
    this.clock = requireNonNull(clock);
  }

  public List<DependentCounts> summarize(String schema)
  {
    return summarize(schema, SummaryOrder.CATALOG);
  }

  public List<DependentCounts> summarize(String schema, SummaryOrder order)
  {
    List<DependentCounts> res = new ArrayList<>();

    for (SchemaObject obj : catalog.listSchemaObjects(schema))
    {
      int dependents = catalog.directDependents(obj.schema(), obj.name()).size();
      int foreignKeys = catalog.foreignKeyReferences(obj.schema(), obj.name()).size();
      res.add(new DependentCounts(obj, dependents, foreignKeys));
    }

    if (order.comparator() != null)
      res.sort(order.comparator());

    log.debug("Summarized {} objects of schema {}.", res.size(), schema);

    return res;
  }

  public Cascade cascade(String schema, String name)
  {
    SchemaObject root = catalog.findObject(schema, name).orElseThrow(() -> new ObjectNotFoundException(schema, name));
    return cascade(root);
  }

  public Cascade cascade(SchemaObject root)
  {
    @Nullable Instant deadline = timeLimit != null ? clock.instant().plus(timeLimit) : null;

    Set<SchemaObject> visited = new HashSet<>();
    visited.add(root);

    List<CascadeLevel> levels = new ArrayList<>();
    List<SchemaObject> frontier = List.of(root);
    boolean truncated = false;

    while (!frontier.isEmpty())
    {
      int depth = levels.size();

      if (maxDepth > 0 && depth >= maxDepth)
      {
        levels.add(new CascadeLevel(depth, frontier, List.of()));
        truncated = true;
        log.debug("Stopped cascade of {} at depth {}, {} object(s) not expanded.", root, depth, frontier.size());
        break;
      }

      if (deadline != null && depth > 0 && !clock.instant().isBefore(deadline))
        throw new CascadeTimeoutException(root.getIdString(), requireNonNull(timeLimit), depth);

      List<DependencyEdge> levelEdges = new ArrayList<>();
      List<SchemaObject> nextFrontier = new ArrayList<>();

      for (SchemaObject obj : frontier)
      {
        List<DependencyEdge> objEdges = expand(obj);

        for (DependencyEdge edge : objEdges)
        {
          // First discovery wins; revisited objects keep their edge but are not expanded again.
          if (visited.add(edge.from()))
            nextFrontier.add(edge.from());
        }

        levelEdges.addAll(objEdges);
      }

      levels.add(new CascadeLevel(depth, frontier, levelEdges));
      frontier = nextFrontier;
    }

    Cascade cascade = new Cascade(root, levels, truncated);

    log.info(
      "Cascade of {}: {} level(s), {} object(s), {} edge(s).",
      root, levels.size(), visited.size(), cascade.edges().size()
    );

    return cascade;
  }

  private List<DependencyEdge> expand(SchemaObject obj)
  {
    List<DependencyEdge> usages = catalog.directDependents(obj.schema(), obj.name());
    List<DependencyEdge> foreignKeys = catalog.foreignKeyReferences(obj.schema(), obj.name());

    if (log.isDebugEnabled() && (!usages.isEmpty() || !foreignKeys.isEmpty()))
    {
      log.debug("OBJECT: {}", obj);
      for (DependencyEdge e : usages)
        log.debug("\t- USED IN {}: {}", e.from().kind(), e.from());
      for (DependencyEdge e : foreignKeys)
        log.debug("\t- REFERENCED BY: {} ({})", e.from(), e.label());
    }

    List<DependencyEdge> edges = new ArrayList<>(usages.size() + foreignKeys.size());
    edges.addAll(usages);
    edges.addAll(foreignKeys);
    return edges;
  }
}
