package pgdeps;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pgdeps.models.Cascade;
import pgdeps.models.DependencyEdge;
import pgdeps.models.EdgeKind;
import pgdeps.models.ObjectKind;
import pgdeps.models.SchemaObject;
import static java.util.Objects.requireNonNull;

/**
 * Describes a cascade as a Graphviz directed graph, with edges drawn from each object to the
 * objects depending on it, and hands it to a {@link GraphRenderer}.
 */
public class GraphExporter
{
  private static final Logger log = LoggerFactory.getLogger(GraphExporter.class);

  public static final String DOT_FORMAT = "dot";

  private static final Pattern FORMAT_PATTERN = Pattern.compile("[A-Za-z0-9_:.-]+");

  private final GraphRenderer renderer;

  public GraphExporter(GraphRenderer renderer)
  {
    this.renderer = requireNonNull(renderer);
  }

  public static Path outputFile(Path outputDir, Cascade cascade, String format)
  {
    SchemaObject root = cascade.root();
    return outputDir.resolve(root.schema() + "." + root.name() + "." + format);
  }

  /**
   * Write the cascade's graph under the output directory, as
   * {@code <schema>.<root>.<format>}. The dot format is written directly; others go
   * through the renderer.
   */
  public Path export(Cascade cascade, Path outputDir, String format)
  {
    if (!FORMAT_PATTERN.matcher(format).matches())
      throw new RenderBackendFailureException("Unsupported graph format: '" + format + "'.");

    Path outputFile = outputFile(outputDir, cascade, format);
    String dot = toDot(cascade);

    try
    {
      Files.createDirectories(outputDir);

      if (DOT_FORMAT.equals(format))
        Files.writeString(outputFile, dot, StandardCharsets.UTF_8);
      else
        renderer.render(dot, format, outputFile);
    }
    catch (IOException e)
    {
      throw new RenderBackendFailureException("Could not write graph " + outputFile + ": " + e.getMessage(), e);
    }

    log.info("Graph written to {}", outputFile);

    return outputFile;
  }

  public String toDot(Cascade cascade)
  {
    StringBuilder sb = new StringBuilder();

    sb.append("digraph ").append(quote(cascade.root().getIdString())).append(" {\n");
    sb.append("  rankdir=LR;\n");
    sb.append("  size=\"8,5\";\n");

    for (SchemaObject obj : cascade.visited())
    {
      sb.append("  ").append(quote(obj.getIdString()))
        .append(" [").append(nodeStyle(obj.kind())).append("];\n");
    }

    for (DependencyEdge edge : cascade.edges())
    {
      sb.append("  ").append(quote(edge.to().getIdString()))
        .append(" -> ").append(quote(edge.from().getIdString()));

      if (edge.kind() == EdgeKind.FOREIGN_KEY && edge.label() != null)
        sb.append(" [label=").append(quote(edge.label())).append("]");

      sb.append(";\n");
    }

    sb.append("}\n");

    return sb.toString();
  }

  static String nodeStyle(ObjectKind kind)
  {
    return switch (kind)
    {
      case TABLE -> "style=solid, color=black";
      case VIEW -> "style=filled, color=lightgrey";
      case FUNCTION -> "style=filled, color=lightblue2";
      case OTHER -> "style=dashed, color=gray40";
    };
  }

  static String quote(String id)
  {
    return "\"" + id.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
