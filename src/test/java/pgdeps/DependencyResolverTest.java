package pgdeps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pgdeps.models.Cascade;
import pgdeps.models.CascadeLevel;
import pgdeps.models.DependencyEdge;
import pgdeps.models.DependentCounts;
import pgdeps.models.SchemaObject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyResolverTest
{
  private InMemoryCatalogGateway catalog;
  private SchemaObject t1;
  private SchemaObject v1;
  private SchemaObject f1;
  private SchemaObject t2;

  @BeforeEach
  void setUp()
  {
    catalog = new InMemoryCatalogGateway();
    t1 = catalog.table("s", "t1");
    v1 = catalog.view("s", "v1");
    f1 = catalog.function("s", "f1");
    t2 = catalog.table("s", "t2");
    catalog
      .uses(v1, t1)
      .uses(f1, v1)
      .foreignKey(t2, t1, "t1_id");
  }

  @Test
  void cascadeWalksUsagesAndForeignKeysLevelByLevel()
  {
    Cascade cascade = new DependencyResolver(catalog).cascade(t1);

    assertThat(cascade.levels()).hasSize(3);

    CascadeLevel level0 = cascade.level(0);
    assertThat(level0.objects()).containsExactly(t1);
    assertThat(level0.edges()).containsExactly(
      DependencyEdge.uses(v1, t1),
      DependencyEdge.foreignKey(t2, t1, "t1_id")
    );

    CascadeLevel level1 = cascade.level(1);
    assertThat(level1.objects()).containsExactly(v1, t2);
    assertThat(level1.edges()).containsExactly(DependencyEdge.uses(f1, v1));

    CascadeLevel level2 = cascade.level(2);
    assertThat(level2.objects()).containsExactly(f1);
    assertThat(level2.edges()).isEmpty();

    assertThat(cascade.visited()).containsExactly(t1, v1, t2, f1);
    assertThat(cascade.truncated()).isFalse();
  }

  @Test
  void cascadeByNameLooksUpTheRootFirst()
  {
    Cascade cascade = new DependencyResolver(catalog).cascade("s", "t1");

    assertThat(cascade.root()).isEqualTo(t1);
    assertThat(cascade.root().catalogType()).isEqualTo("BASE TABLE");
  }

  @Test
  void unknownRootFailsBeforeAnyTraversal()
  {
    assertThatThrownBy(() -> new DependencyResolver(catalog).cascade("s", "missing"))
      .isInstanceOf(ObjectNotFoundException.class)
      .hasMessageContaining("s.missing");

    assertThat(catalog.expansionsOf(t1)).isZero();
  }

  @Test
  void cascadeIsDeterministic()
  {
    DependencyResolver resolver = new DependencyResolver(catalog);

    assertThat(resolver.cascade(t1)).isEqualTo(resolver.cascade(t1));
  }

  @Test
  void selfReferencingForeignKeyIsRecordedOnceAndNotReexpanded()
  {
    InMemoryCatalogGateway cat = new InMemoryCatalogGateway();
    SchemaObject node = cat.table("s", "node");
    cat.foreignKey(node, node, "parent_id");

    Cascade cascade = new DependencyResolver(cat).cascade(node);

    assertThat(cascade.levels()).hasSize(1);
    assertThat(cascade.level(0).edges()).hasSize(1);
    DependencyEdge edge = cascade.level(0).edges().get(0);
    assertThat(edge.isSelfLoop()).isTrue();
    assertThat(edge.label()).isEqualTo("parent_id");
    assertThat(cat.expansionsOf(node)).isEqualTo(1);
  }

  @Test
  void diamondIsExpandedOnceWithBothEdgesKept()
  {
    InMemoryCatalogGateway cat = new InMemoryCatalogGateway();
    SchemaObject root = cat.table("s", "root");
    SchemaObject a = cat.view("s", "a");
    SchemaObject b = cat.view("s", "b");
    SchemaObject c = cat.view("s", "c");
    cat.uses(a, root).uses(b, root).uses(c, a).uses(c, b);

    Cascade cascade = new DependencyResolver(cat).cascade(root);

    assertThat(cascade.level(1).objects()).containsExactly(a, b);
    assertThat(cascade.level(1).edges()).containsExactly(DependencyEdge.uses(c, a), DependencyEdge.uses(c, b));
    assertThat(cascade.level(2).objects()).containsExactly(c);
    assertThat(cat.expansionsOf(c)).isEqualTo(1);
  }

  @Test
  void cyclesTerminate()
  {
    InMemoryCatalogGateway cat = new InMemoryCatalogGateway();
    SchemaObject t = cat.table("s", "t");
    SchemaObject fa = cat.function("s", "fa");
    SchemaObject fb = cat.function("s", "fb");
    cat.uses(fa, t).uses(fb, fa).uses(fa, fb);

    Cascade cascade = new DependencyResolver(cat).cascade(t);

    assertThat(cascade.visited()).containsExactly(t, fa, fb);
    assertThat(cascade.edges()).hasSize(3);
    assertThat(cat.expansionsOf(fa)).isEqualTo(1);
    assertThat(cat.expansionsOf(fb)).isEqualTo(1);
  }

  @Test
  void everyObjectIsDiscoveredAtExactlyOneLevel()
  {
    InMemoryCatalogGateway cat = new InMemoryCatalogGateway();
    SchemaObject t = cat.table("s", "t");
    SchemaObject va = cat.view("s", "va");
    SchemaObject vb = cat.view("s", "vb");
    SchemaObject child = cat.table("s", "child");
    // vb is reached from t at level 0 and again from va at level 1.
    cat.uses(va, t).uses(vb, t).uses(vb, va).foreignKey(child, t, "t_id").uses(va, vb);

    Cascade cascade = new DependencyResolver(cat).cascade(t);

    Set<SchemaObject> seen = new HashSet<>();
    for (CascadeLevel level : cascade.levels())
      for (SchemaObject obj : level.objects())
        assertThat(seen.add(obj)).as("first discovery of %s", obj).isTrue();

    assertThat(seen).containsExactlyInAnyOrder(t, va, vb, child);
    assertThat(cascade.level(1).edges()).contains(DependencyEdge.uses(vb, va), DependencyEdge.uses(va, vb));
  }

  @Test
  void everyCatalogEdgeOfAVisitedObjectIsRecorded()
  {
    Cascade cascade = new DependencyResolver(catalog).cascade(t1);

    for (SchemaObject obj : cascade.visited())
    {
      List<DependencyEdge> fromCatalog = catalog.directDependents(obj.schema(), obj.name());
      assertThat(cascade.edges()).containsAll(fromCatalog);
      assertThat(cascade.edges()).containsAll(catalog.foreignKeyReferences(obj.schema(), obj.name()));
    }
  }

  @Test
  void maxDepthKeepsUnexpandedFrontierAsLastLevel()
  {
    DependencyResolver resolver = new DependencyResolver(catalog, 1, null, Clock.systemUTC());

    Cascade cascade = resolver.cascade(t1);

    assertThat(cascade.levels()).hasSize(2);
    assertThat(cascade.level(1).objects()).containsExactly(v1, t2);
    assertThat(cascade.level(1).edges()).isEmpty();
    assertThat(cascade.truncated()).isTrue();
    assertThat(catalog.expansionsOf(v1)).isZero();
  }

  @Test
  void negativeMaxDepthIsRejected()
  {
    assertThatThrownBy(() -> new DependencyResolver(catalog, -1, null, Clock.systemUTC()))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void timeLimitIsCheckedBetweenLevels()
  {
    Clock frozen = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    DependencyResolver resolver = new DependencyResolver(catalog, 0, Duration.ZERO, frozen);

    assertThatThrownBy(() -> resolver.cascade(t1))
      .isInstanceOf(CascadeTimeoutException.class)
      .hasMessageContaining("s.t1");

    assertThat(catalog.expansionsOf(t1)).isEqualTo(1);
    assertThat(catalog.expansionsOf(v1)).isZero();
  }

  @Test
  void timeLimitDoesNotAffectSingleLevelCascade()
  {
    Clock frozen = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    DependencyResolver resolver = new DependencyResolver(catalog, 0, Duration.ZERO, frozen);

    assertThat(resolver.cascade(f1).levels()).hasSize(1);
  }

  @Test
  void catalogFailureAbortsCascade()
  {
    catalog.failOn(f1);

    assertThatThrownBy(() -> new DependencyResolver(catalog).cascade(t1))
      .isInstanceOf(CatalogUnavailableException.class)
      .hasMessageContaining("s.f1");
  }

  @Test
  void summaryCountsFirstLevelOnly()
  {
    List<DependentCounts> rows = new DependencyResolver(catalog).summarize("s");

    assertThat(rows).containsExactly(
      new DependentCounts(t1, 1, 1),
      new DependentCounts(v1, 1, 0),
      new DependentCounts(t2, 0, 0)
    );
  }

  @Test
  void summaryCanBeSorted()
  {
    DependencyResolver resolver = new DependencyResolver(catalog);

    assertThat(names(resolver.summarize("s", SummaryOrder.NAME))).containsExactly("t1", "t2", "v1");
    assertThat(names(resolver.summarize("s", SummaryOrder.DEPENDENTS))).containsExactly("t1", "v1", "t2");
    assertThat(names(resolver.summarize("s", SummaryOrder.FOREIGN_KEYS))).containsExactly("t1", "t2", "v1");
  }

  @Test
  void catalogFailureAbortsSummary()
  {
    catalog.failOn(t2);

    assertThatThrownBy(() -> new DependencyResolver(catalog).summarize("s"))
      .isInstanceOf(CatalogUnavailableException.class);
  }

  private static List<String> names(List<DependentCounts> rows)
  {
    return rows.stream().map(c -> c.object().name()).toList();
  }
}
