package pgdeps;

import java.util.ArrayList;
import java.util.List;

/**
 * Column-aligned plain text table: a header line, a dashed rule under each column, then the
 * rows. Right-aligned columns suit counts.
 */
public class TextTable
{
  private static final String GUTTER = "  ";

  private final List<String> headers;
  private final boolean[] rightAligned;
  private final List<List<String>> rows = new ArrayList<>();

  public TextTable(List<String> headers, boolean... rightAligned)
  {
    this.headers = List.copyOf(headers);
    this.rightAligned = new boolean[headers.size()];
    System.arraycopy(rightAligned, 0, this.rightAligned, 0, Math.min(rightAligned.length, headers.size()));
  }

  public TextTable addRow(List<String> row)
  {
    if (row.size() != headers.size())
      throw new IllegalArgumentException("Expected " + headers.size() + " cells, got " + row.size() + ".");
    rows.add(List.copyOf(row));
    return this;
  }

  public String render()
  {
    int[] widths = new int[headers.size()];
    for (int i = 0; i < widths.length; ++i)
    {
      widths[i] = headers.get(i).length();
      for (List<String> row : rows)
        widths[i] = Math.max(widths[i], row.get(i).length());
    }

    StringBuilder sb = new StringBuilder();
    appendLine(sb, headers, widths);

    List<String> rules = new ArrayList<>();
    for (int w : widths)
      rules.add("-".repeat(w));
    appendLine(sb, rules, widths);

    for (List<String> row : rows)
      appendLine(sb, row, widths);

    return sb.toString();
  }

  private void appendLine(StringBuilder sb, List<String> cells, int[] widths)
  {
    StringBuilder line = new StringBuilder();
    for (int i = 0; i < cells.size(); ++i)
    {
      if (i > 0)
        line.append(GUTTER);
      String cell = cells.get(i);
      String pad = " ".repeat(widths[i] - cell.length());
      line.append(rightAligned[i] ? pad + cell : cell + pad);
    }
    sb.append(line.toString().stripTrailing()).append('\n');
  }
}
