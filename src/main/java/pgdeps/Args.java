package pgdeps;

import java.util.List;
import java.util.Optional;


public class Args
{
  private Args() {}

  public static int pluckIntOption(List<String> remArgs, String optionName, int defaultValue)
  {
    Optional<String> value = pluckStringOption(remArgs, optionName);
    if ( value.isEmpty() )
      return defaultValue;

    try
    {
      return Integer.parseInt(value.get());
    }
    catch (NumberFormatException e)
    {
      throw new IllegalArgumentException("Option " + optionName + " expects an integer, got '" + value.get() + "'.");
    }
  }

  public static Optional<String> pluckStringOption(List<String> remArgs, String optionName)
  {
    int argIx = remArgs.indexOf(optionName);

    if ( argIx != -1 )
    {
      if ( argIx == remArgs.size() - 1 )
        throw new IllegalArgumentException("Option " + optionName + " requires a value.");
      remArgs.remove(argIx);
      return Optional.of(remArgs.remove(argIx));
    }

    return Optional.empty();
  }

  // Option given under either its long or short name.
  public static Optional<String> pluckStringOption(List<String> remArgs, String optionName, String shortName)
  {
    Optional<String> value = pluckStringOption(remArgs, optionName);
    return value.isPresent() ? value : pluckStringOption(remArgs, shortName);
  }

  public static boolean pluckFlag(List<String> remArgs, String... names)
  {
    boolean found = false;
    for (String name : names)
      found |= remArgs.remove(name);
    return found;
  }
}
