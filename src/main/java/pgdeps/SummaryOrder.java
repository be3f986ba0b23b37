package pgdeps;

import java.util.Comparator;
import org.jetbrains.annotations.Nullable;
import pgdeps.models.DependentCounts;

public enum SummaryOrder
{
  CATALOG(null),
  NAME(Comparator.comparing((DependentCounts c) -> c.object().name())),
  DEPENDENTS(
    Comparator.comparingInt(DependentCounts::dependentCount).reversed()
      .thenComparing(c -> c.object().name())
  ),
  FOREIGN_KEYS(
    Comparator.comparingInt(DependentCounts::foreignKeyCount).reversed()
      .thenComparing(c -> c.object().name())
  );

  private final @Nullable Comparator<DependentCounts> comparator;

  SummaryOrder(@Nullable Comparator<DependentCounts> comparator)
  {
    this.comparator = comparator;
  }

  // Null when rows keep the catalog's listing order.
  public @Nullable Comparator<DependentCounts> comparator()
  {
    return comparator;
  }

  public static SummaryOrder fromOptionValue(String value)
  {
    return switch (value)
    {
      case "catalog" -> CATALOG;
      case "name" -> NAME;
      case "dependents" -> DEPENDENTS;
      case "foreign-keys" -> FOREIGN_KEYS;
      default -> throw new IllegalArgumentException("Unknown sort order: " + value);
    };
  }
}
