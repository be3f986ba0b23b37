package pgdeps;

import java.util.regex.Pattern;

/**
 * Decides whether the SQL text of a view or function definition refers to a given object.
 * The qualified name, with or without double quotes around its parts, matches anywhere;
 * the bare name only matches for definitions owned by the object's own schema. A dollar sign
 * ends a name, as in the dollar-quoted body of a PostgreSQL function.
 */
public class DefinitionMatcher
{
  private final String schema;
  private final Pattern qualifiedPattern;
  private final Pattern unqualifiedPattern;

  public DefinitionMatcher(String schema, String name)
  {
    this.schema = schema;
    this.qualifiedPattern = Pattern.compile(
      "(?<![\\w.\"])\"?" + Pattern.quote(schema) + "\"?\\s*\\.\\s*\"?" + Pattern.quote(name) + "\"?(?!\\w)",
      Pattern.CASE_INSENSITIVE
    );
    this.unqualifiedPattern = Pattern.compile(
      "(?<![\\w.\"])\"?" + Pattern.quote(name) + "\"?(?!\\w)",
      Pattern.CASE_INSENSITIVE
    );
  }

  public boolean references(String definitionSchema, String definition)
  {
    if (qualifiedPattern.matcher(definition).find())
      return true;

    return definitionSchema.equalsIgnoreCase(schema) && unqualifiedPattern.matcher(definition).find();
  }
}
