package pgdeps;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pgdeps.models.CaseSensitivity;
import pgdeps.models.DependencyEdge;
import pgdeps.models.ObjectKind;
import pgdeps.models.SchemaObject;
import static java.util.Objects.requireNonNull;

/**
 * Catalog lookups through JDBC's {@link DatabaseMetaData}, for databases without a
 * dedicated gateway. View definitions come from the standard information_schema.views;
 * function bodies are not available through JDBC metadata, so no function dependents are
 * reported.
 */
public class JdbcCatalogGateway implements CatalogGateway
{
  private static final Logger log = LoggerFactory.getLogger(JdbcCatalogGateway.class);

  private static final String VIEW_DEFINITIONS_SQL =
    "select table_schema, table_name, view_definition\n" +
    "from information_schema.views\n" +
    "where table_schema not in ('INFORMATION_SCHEMA', 'information_schema', 'pg_catalog')\n" +
    "order by table_schema, table_name";

  private final Connection conn;
  private @Nullable CaseSensitivity caseSensitivity;
  private final KnownObjects knownObjects = new KnownObjects();

  public JdbcCatalogGateway(Connection conn)
  {
    this.conn = requireNonNull(conn);
  }

  @Override
  public List<DependencyEdge> directDependents(String schema, String name)
  {
    try
    {
      SchemaObject target = resolveTarget(schema, name);
      DefinitionMatcher matcher = new DefinitionMatcher(target.schema(), target.name());

      List<DependencyEdge> edges = new ArrayList<>();

      try (PreparedStatement ps = conn.prepareStatement(VIEW_DEFINITIONS_SQL);
           ResultSet rs = ps.executeQuery())
      {
        while (rs.next())
        {
          String viewSchema = rs.getString("table_schema");
          String viewName = rs.getString("table_name");
          @Nullable String definition = rs.getString("view_definition");

          SchemaObject view = SchemaObject.fromCatalog(viewSchema, viewName, "VIEW");

          if (definition != null && !view.equals(target) && matcher.references(viewSchema, definition))
            edges.add(DependencyEdge.uses(knownObjects.remember(view), target));
        }
      }

      return edges;
    }
    catch (SQLException e)
    {
      throw new CatalogUnavailableException("Could not fetch dependents of " + schema + "." + name + ": " + e.getMessage(), e);
    }
  }

  @Override
  public List<DependencyEdge> foreignKeyReferences(String schema, String name)
  {
    try
    {
      SchemaObject target = resolveTarget(schema, name);
      DatabaseMetaData dbmd = conn.getMetaData();

      // Rows come ordered by referencing table and key sequence, so components of several keys
      // from one table interleave; group them by constraint.
      Map<String, FkBuilder> fkBldrs = new LinkedHashMap<>();

      try (ResultSet rs = dbmd.getExportedKeys(null, target.schema(), target.name()))
      {
        while (rs.next())
        {
          SchemaObject srcRel = knownObjects.remember(
            SchemaObject.fromCatalog(rs.getString("FKTABLE_SCHEM"), rs.getString("FKTABLE_NAME"), "TABLE")
          );
          @Nullable String fkName = rs.getString("FK_NAME");
          short compNum = rs.getShort("KEY_SEQ");

          String key = srcRel.getIdString() + "/" + Objects.toString(fkName, "");

          fkBldrs.computeIfAbsent(key, k -> new FkBuilder(srcRel, fkName))
            .addComponent(compNum, rs.getString("FKCOLUMN_NAME"));
        }
      }

      List<DependencyEdge> edges = new ArrayList<>();
      for (FkBuilder fkBldr : fkBldrs.values())
        edges.add(fkBldr.build(target));

      return edges;
    }
    catch (SQLException e)
    {
      throw new CatalogUnavailableException("Could not fetch foreign keys into " + schema + "." + name + ": " + e.getMessage(), e);
    }
  }

  @Override
  public List<SchemaObject> listSchemaObjects(String schema)
  {
    try
    {
      DatabaseMetaData dbmd = conn.getMetaData();
      String nSchema = normalizeDatabaseIdentifier(schema, getCaseSensitivity(dbmd));

      List<SchemaObject> objs = fetchRelations(dbmd, nSchema, null);
      objs.sort(Comparator.comparing(SchemaObject::name));

      return objs;
    }
    catch (SQLException e)
    {
      throw new CatalogUnavailableException("Could not list objects of schema " + schema + ": " + e.getMessage(), e);
    }
  }

  @Override
  public Optional<SchemaObject> findObject(String schema, String name)
  {
    try
    {
      return lookupObject(schema, name);
    }
    catch (SQLException e)
    {
      throw new CatalogUnavailableException("Could not look up " + schema + "." + name + ": " + e.getMessage(), e);
    }
  }

  // The inspected object as already read from the catalog, without looking it up again.
  private SchemaObject resolveTarget(String schema, String name)
    throws SQLException
  {
    CaseSensitivity caseSens = getCaseSensitivity(conn.getMetaData());
    return knownObjects.resolve(
      normalizeDatabaseIdentifier(schema, caseSens),
      normalizeDatabaseIdentifier(name, caseSens)
    );
  }

  private Optional<SchemaObject> lookupObject(String schema, String name)
    throws SQLException
  {
    DatabaseMetaData dbmd = conn.getMetaData();
    CaseSensitivity caseSens = getCaseSensitivity(dbmd);

    String nSchema = normalizeDatabaseIdentifier(schema, caseSens);
    String nName = normalizeDatabaseIdentifier(name, caseSens);

    List<SchemaObject> relations = fetchRelations(dbmd, nSchema, nName);
    if (!relations.isEmpty())
      return Optional.of(relations.get(0));

    try (ResultSet rs = dbmd.getFunctions(null, nSchema, nName))
    {
      while (rs.next())
      {
        if (nSchema.equals(rs.getString("FUNCTION_SCHEM")) && nName.equals(rs.getString("FUNCTION_NAME")))
          return Optional.of(knownObjects.remember(SchemaObject.fromCatalog(nSchema, nName, "FUNCTION")));
      }
    }

    return Optional.empty();
  }

  private List<SchemaObject> fetchRelations
    (
      DatabaseMetaData dbmd,
      String schema,
      @Nullable String name
    )
    throws SQLException
  {
    List<SchemaObject> objs = new ArrayList<>();

    // Table type names vary between drivers ("TABLE", "BASE TABLE"), so classify rather than filter.
    try (ResultSet rs = dbmd.getTables(null, schema, name, null))
    {
      while (rs.next())
      {
        String relSchema = rs.getString("TABLE_SCHEM");
        String relName = rs.getString("TABLE_NAME");
        String relType = rs.getString("TABLE_TYPE");

        // The patterns treat '_' and '%' as wildcards.
        if (!schema.equals(relSchema) || (name != null && !name.equals(relName)))
          continue;

        SchemaObject obj = SchemaObject.fromCatalog(relSchema, relName, relType);

        if (obj.kind() == ObjectKind.TABLE || obj.kind() == ObjectKind.VIEW)
          objs.add(knownObjects.remember(obj));
        else
          log.debug("Skipping {} of catalog type {}.", obj, relType);
      }
    }

    return objs;
  }

  private CaseSensitivity getCaseSensitivity(DatabaseMetaData dbmd)
    throws SQLException
  {
    if (caseSensitivity == null)
      caseSensitivity = getDatabaseCaseSensitivity(dbmd);
    return caseSensitivity;
  }

  public static CaseSensitivity getDatabaseCaseSensitivity(DatabaseMetaData dbmd)
    throws SQLException
  {
    if (dbmd.storesLowerCaseIdentifiers())
      return CaseSensitivity.INSENSITIVE_STORED_LOWER;
    else if (dbmd.storesUpperCaseIdentifiers())
      return CaseSensitivity.INSENSITIVE_STORED_UPPER;
    else if (dbmd.storesMixedCaseIdentifiers())
      return CaseSensitivity.INSENSITIVE_STORED_MIXED;
    else
      return CaseSensitivity.SENSITIVE;
  }

  public static String normalizeDatabaseIdentifier(String id, CaseSensitivity caseSens)
  {
    if (id.length() > 1 && id.startsWith("\"") && id.endsWith("\""))
      return id.substring(1, id.length() - 1);
    else if (caseSens == CaseSensitivity.INSENSITIVE_STORED_LOWER)
      return id.toLowerCase();
    else if (caseSens == CaseSensitivity.INSENSITIVE_STORED_UPPER)
      return id.toUpperCase();
    else
      return id;
  }


  /////////////////////////////////////////////////////////
  // auxiliary builder class

  private static class FkBuilder
  {
    private final SchemaObject srcRel;
    private final @Nullable String constraintName;
    private final SortedMap<Short, String> columnsBySeq;

    FkBuilder(SchemaObject srcRel, @Nullable String constraintName)
    {
      this.srcRel = srcRel;
      this.constraintName = constraintName;
      this.columnsBySeq = new TreeMap<>();
    }

    void addComponent(short keySeq, String column)
    {
      columnsBySeq.put(keySeq, column);
    }

    DependencyEdge build(SchemaObject tgtRel)
    {
      log.debug("Foreign key {} from {} into {}.", constraintName, srcRel, tgtRel);
      return DependencyEdge.foreignKey(srcRel, tgtRel, String.join(", ", columnsBySeq.values()));
    }
  }
}
