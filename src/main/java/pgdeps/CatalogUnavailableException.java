package pgdeps;

/**
 * The catalog could not be reached or one of its lookups could not be executed.
 */
public class CatalogUnavailableException extends DependencyInspectionException
{
  public CatalogUnavailableException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
