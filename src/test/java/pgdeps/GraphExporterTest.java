package pgdeps;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pgdeps.models.Cascade;
import pgdeps.models.CascadeLevel;
import pgdeps.models.DependencyEdge;
import pgdeps.models.ObjectKind;
import pgdeps.models.SchemaObject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphExporterTest
{
  @TempDir
  Path tempDir;

  private final SchemaObject t1 = new SchemaObject("s", "t1", ObjectKind.TABLE);
  private final SchemaObject v1 = new SchemaObject("s", "v1", ObjectKind.VIEW);
  private final SchemaObject f1 = new SchemaObject("s", "f1", ObjectKind.FUNCTION);
  private final SchemaObject t2 = new SchemaObject("s", "t2", ObjectKind.TABLE);
  private final SchemaObject seq = new SchemaObject("s", "seq", ObjectKind.OTHER, "SEQUENCE");

  private final Cascade cascade = new Cascade(
    t1,
    List.of(
      new CascadeLevel(0, List.of(t1), List.of(DependencyEdge.uses(v1, t1), DependencyEdge.foreignKey(t2, t1, "t1_id"))),
      new CascadeLevel(1, List.of(v1, t2), List.of(DependencyEdge.uses(f1, v1), DependencyEdge.uses(seq, t2))),
      new CascadeLevel(2, List.of(f1, seq), List.of())
    ),
    false
  );

  @Test
  void dotHasOneStyledNodePerVisitedObject()
  {
    String dot = new GraphExporter(failingRenderer()).toDot(cascade);

    assertThat(dot).startsWith("digraph \"s.t1\" {\n  rankdir=LR;\n  size=\"8,5\";\n");
    assertThat(dot)
      .contains("\"s.t1\" [style=solid, color=black];")
      .contains("\"s.v1\" [style=filled, color=lightgrey];")
      .contains("\"s.f1\" [style=filled, color=lightblue2];")
      .contains("\"s.seq\" [style=dashed, color=gray40];");
  }

  @Test
  void edgesPointFromUsedObjectToDependent()
  {
    String dot = new GraphExporter(failingRenderer()).toDot(cascade);

    assertThat(dot)
      .contains("\"s.t1\" -> \"s.v1\";")
      .contains("\"s.t1\" -> \"s.t2\" [label=\"t1_id\"];")
      .contains("\"s.v1\" -> \"s.f1\";");
    assertThat(dot.lines().filter(l -> l.contains("->")).count()).isEqualTo(4);
  }

  @Test
  void quotesAreEscaped()
  {
    assertThat(GraphExporter.quote("s.\"odd\"")).isEqualTo("\"s.\\\"odd\\\"\"");
  }

  @Test
  void dotFormatIsWrittenWithoutBackend() throws IOException
  {
    Path out = new GraphExporter(failingRenderer()).export(cascade, tempDir.resolve("graphs"), "dot");

    assertThat(out).isEqualTo(tempDir.resolve("graphs").resolve("s.t1.dot"));
    assertThat(Files.readString(out)).contains("digraph");
  }

  @Test
  void otherFormatsGoToTheRenderer()
  {
    List<String> calls = new ArrayList<>();
    GraphRenderer recording = (dot, format, outputFile) -> calls.add(format + " " + outputFile.getFileName());

    Path out = new GraphExporter(recording).export(cascade, tempDir, "svg");

    assertThat(out.getFileName().toString()).isEqualTo("s.t1.svg");
    assertThat(calls).containsExactly("svg s.t1.svg");
  }

  @Test
  void rendererFailureIsReported()
  {
    GraphExporter exporter = new GraphExporter(new DotCommandRenderer("no-such-graphviz-executable-4711"));

    assertThatThrownBy(() -> exporter.export(cascade, tempDir, "pdf"))
      .isInstanceOf(RenderBackendFailureException.class)
      .hasMessageContaining("no-such-graphviz-executable-4711");
  }

  @Test
  void suspiciousFormatIsRejected()
  {
    assertThatThrownBy(() -> new GraphExporter(failingRenderer()).export(cascade, tempDir, "../pdf"))
      .isInstanceOf(RenderBackendFailureException.class);
  }

  @Test
  void unwritableOutputDirectoryIsReported() throws IOException
  {
    Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");

    assertThatThrownBy(() -> new GraphExporter(failingRenderer()).export(cascade, file, "dot"))
      .isInstanceOf(RenderBackendFailureException.class);
  }

  private static GraphRenderer failingRenderer()
  {
    return (dot, format, outputFile) -> {
      throw new AssertionError("renderer not expected to be called");
    };
  }
}
