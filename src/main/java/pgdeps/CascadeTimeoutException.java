package pgdeps;

import java.time.Duration;

public class CascadeTimeoutException extends DependencyInspectionException
{
  public CascadeTimeoutException(String rootId, Duration timeLimit, int completedLevels)
  {
    super(
      "Cascade for " + rootId + " exceeded its time limit of " + timeLimit.toSeconds() + "s " +
      "after " + completedLevels + " level(s)."
    );
  }
}
