package pgdeps;

import java.util.List;
import java.util.Objects;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.Nullable;
import pgdeps.models.Cascade;
import pgdeps.models.CascadeLevel;
import pgdeps.models.DependencyEdge;
import pgdeps.models.DependentCounts;
import pgdeps.models.EdgeKind;
import pgdeps.models.SchemaObject;

public class ReportFormatter
{
  public static final List<String> SUMMARY_HEADERS =
    List.of("Schema", "Type", "Name", "Dependents", "Foreign keys");

  public static final List<String> CASCADE_HEADERS =
    List.of("Level", "Object", "Dep./For. Type", "Dep./For. object", "Foreign key");

  private final ObjectMapper objectMapper;

  public ReportFormatter()
  {
    this.objectMapper = new ObjectMapper();
    this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
  }

  public String formatSummary(List<DependentCounts> rows)
  {
    TextTable table = new TextTable(SUMMARY_HEADERS, false, false, false, true, true);

    for (DependentCounts row : rows)
    {
      SchemaObject obj = row.object();
      table.addRow(List.of(
        obj.schema(),
        obj.catalogType(),
        obj.name(),
        String.valueOf(row.dependentCount()),
        String.valueOf(row.foreignKeyCount())
      ));
    }

    return table.render();
  }

  /**
   * One row per edge. Level and parent object are only printed on the first row of each
   * parent within a level.
   */
  public String formatCascade(Cascade cascade)
  {
    TextTable table = new TextTable(CASCADE_HEADERS);

    if (cascade.edges().isEmpty())
      table.addRow(List.of("0", cascade.root().getIdString(), "", "", ""));

    for (CascadeLevel level : cascade.levels())
    {
      @Nullable SchemaObject prevParent = null;

      for (DependencyEdge edge : level.edges())
      {
        boolean newParent = !Objects.equals(prevParent, edge.to());
        prevParent = edge.to();

        table.addRow(List.of(
          newParent ? String.valueOf(level.depth()) : "",
          newParent ? edge.to().getIdString() : "",
          edge.kind() == EdgeKind.FOREIGN_KEY ? "FOREIGN KEY" : edge.from().catalogType(),
          edge.from().getIdString(),
          edge.label() != null ? edge.label() : ""
        ));
      }
    }

    String res = table.render();

    if (cascade.truncated())
      res += "(cascade stopped at depth " + (cascade.levels().size() - 1) + ")\n";

    return res;
  }

  public String toJson(Object report)
  {
    try
    {
      return objectMapper.writeValueAsString(report);
    }
    catch (JsonProcessingException e)
    {
      throw new RuntimeException(e);
    }
  }
}
