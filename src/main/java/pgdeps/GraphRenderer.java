package pgdeps;

import java.nio.file.Path;

/**
 * Turns a Graphviz DOT description into an output file of the requested format.
 */
public interface GraphRenderer
{
  void render(String dot, String format, Path outputFile);
}
