package pgdeps;

import java.util.List;
import java.util.Optional;
import pgdeps.models.DependencyEdge;
import pgdeps.models.SchemaObject;

/**
 * Read-only lookups against a database catalog, one level deep. Every operation throws
 * {@link CatalogUnavailableException} when the connection or the query fails.
 */
public interface CatalogGateway
{
  /**
   * Views and functions whose definitions reference the given object, as usage edges from
   * the dependent to the object.
   */
  List<DependencyEdge> directDependents(String schema, String name);

  /**
   * Tables declaring a foreign key into the given object, one edge per constraint, labeled
   * with the referencing column names.
   */
  List<DependencyEdge> foreignKeyReferences(String schema, String name);

  /**
   * Tables and views of the schema, ordered by name.
   */
  List<SchemaObject> listSchemaObjects(String schema);

  Optional<SchemaObject> findObject(String schema, String name);
}
