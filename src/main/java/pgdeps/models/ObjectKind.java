package pgdeps.models;

import java.util.Locale;
import org.jetbrains.annotations.Nullable;

public enum ObjectKind
{
  TABLE,
  VIEW,
  FUNCTION,
  OTHER;

  // Classify a catalog-reported object type, e.g. "BASE TABLE" from information_schema.tables.
  public static ObjectKind fromCatalogType(@Nullable String catalogType)
  {
    if (catalogType == null)
      return OTHER;

    return switch (catalogType.trim().toUpperCase(Locale.ROOT))
    {
      case "TABLE", "BASE TABLE" -> TABLE;
      case "VIEW", "MATERIALIZED VIEW" -> VIEW;
      case "FUNCTION", "PROCEDURE" -> FUNCTION;
      default -> OTHER;
    };
  }
}
