package pgdeps;

public class RenderBackendFailureException extends DependencyInspectionException
{
  public RenderBackendFailureException(String message)
  {
    super(message);
  }

  public RenderBackendFailureException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
