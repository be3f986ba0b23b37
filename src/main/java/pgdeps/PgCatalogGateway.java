package pgdeps;

import java.io.IOError;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pgdeps.models.DependencyEdge;
import pgdeps.models.SchemaObject;
import static java.util.Objects.requireNonNull;

/**
 * Catalog lookups against PostgreSQL's system catalogs. View and function dependents are
 * found by searching their definitions for the object's name with a {@link DefinitionMatcher},
 * so the results are only as precise as that text search.
 */
public class PgCatalogGateway implements CatalogGateway
{
  private static final Logger log = LoggerFactory.getLogger(PgCatalogGateway.class);

  private final Handle db;
  private final String directDependentsSql;
  private final String foreignKeyReferencesSql;
  private final String schemaObjectsSql;
  private final String findObjectSql;
  private final KnownObjects knownObjects = new KnownObjects();

  public PgCatalogGateway(Handle db)
  {
    this.db = requireNonNull(db);
    this.directDependentsSql = readResourceUtf8("pg-direct-dependents.sql");
    this.foreignKeyReferencesSql = readResourceUtf8("pg-foreign-key-references.sql");
    this.schemaObjectsSql = readResourceUtf8("pg-schema-objects.sql");
    this.findObjectSql = readResourceUtf8("pg-find-object.sql");
  }

  @Override
  public List<DependencyEdge> directDependents(String schema, String name)
  {
    SchemaObject target = knownObjects.resolve(schema, name);
    DefinitionMatcher matcher = new DefinitionMatcher(schema, name);

    List<DefinedObject> candidates = query("dependents of " + target, () ->
      db.createQuery(directDependentsSql)
      .bind("schema", schema)
      .bind("name", name)
      .map((rs, ctx) ->
        new DefinedObject(
          SchemaObject.fromCatalog(rs.getString("schema_name"), rs.getString("name"), rs.getString("type")),
          rs.getString("definition")
        )
      )
      .list()
    );

    // Overloaded functions share one name and come back once per signature.
    Set<DependencyEdge> edges = new LinkedHashSet<>();
    for (DefinedObject candidate : candidates)
    {
      if (matcher.references(candidate.object().schema(), candidate.definition()))
        edges.add(DependencyEdge.uses(knownObjects.remember(candidate.object()), target));
    }

    return new ArrayList<>(edges);
  }

  @Override
  public List<DependencyEdge> foreignKeyReferences(String schema, String name)
  {
    SchemaObject target = knownObjects.resolve(schema, name);

    return query("foreign keys into " + target, () ->
      db.createQuery(foreignKeyReferencesSql)
      .bind("schema", schema)
      .bind("name", name)
      .map((rs, ctx) ->
        DependencyEdge.foreignKey(
          knownObjects.remember(
            SchemaObject.fromCatalog(rs.getString("schema_name"), rs.getString("table_name"), "BASE TABLE")
          ),
          target,
          rs.getString("column_names")
        )
      )
      .list()
    );
  }

  @Override
  public List<SchemaObject> listSchemaObjects(String schema)
  {
    return query("objects of schema " + schema, () ->
      db.createQuery(schemaObjectsSql)
      .bind("schema", schema)
      .map((rs, ctx) ->
        knownObjects.remember(
          SchemaObject.fromCatalog(rs.getString("schema_name"), rs.getString("table_name"), rs.getString("table_type"))
        )
      )
      .list()
    );
  }

  @Override
  public Optional<SchemaObject> findObject(String schema, String name)
  {
    return query("object " + schema + "." + name, () ->
      db.createQuery(findObjectSql)
      .bind("schema", schema)
      .bind("name", name)
      .map((rs, ctx) ->
        knownObjects.remember(
          SchemaObject.fromCatalog(rs.getString("schema_name"), rs.getString("name"), rs.getString("object_type"))
        )
      )
      .findOne()
    );
  }

  private <T> T query(String what, Supplier<T> lookup)
  {
    try
    {
      log.trace("Querying catalog for {}.", what);
      return lookup.get();
    }
    catch (JdbiException e)
    {
      throw new CatalogUnavailableException("Catalog query for " + what + " failed: " + e.getMessage(), e);
    }
  }

  static String readResourceUtf8(String resourcePath)
  {
    try (InputStream is = PgCatalogGateway.class.getClassLoader().getResourceAsStream(resourcePath))
    {
      if (is == null)
        throw new RuntimeException("Resource not found: " + resourcePath);
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
    catch (IOException e)
    {
      throw new IOError(e);
    }
  }

  private record DefinedObject(SchemaObject object, String definition) {}
}
