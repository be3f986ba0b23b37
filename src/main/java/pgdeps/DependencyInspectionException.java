package pgdeps;

public class DependencyInspectionException extends RuntimeException
{
  public DependencyInspectionException(String message)
  {
    super(message);
  }

  public DependencyInspectionException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
