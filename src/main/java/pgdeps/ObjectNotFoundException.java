package pgdeps;

public class ObjectNotFoundException extends DependencyInspectionException
{
  private final String schema;
  private final String name;

  public ObjectNotFoundException(String schema, String name)
  {
    super("Object not found: " + schema + "." + name);
    this.schema = schema;
    this.name = name;
  }

  public String getSchema() { return schema; }

  public String getName() { return name; }
}
