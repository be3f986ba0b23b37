package pgdeps;

import java.io.Console;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pgdeps.models.Cascade;
import pgdeps.models.DependentCounts;

public class DependencyReporter
{
  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_GRAPH_FAILURE = 2;

  private static final String VERBOSE_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  private final PrintStream out;
  private final GraphRenderer graphRenderer;

  public DependencyReporter(PrintStream out, GraphRenderer graphRenderer)
  {
    this.out = out;
    this.graphRenderer = graphRenderer;
  }

  private static String usage()
  {
    return """
      Expected arguments: [options] <schema>
        schema: Schema to report on. Without --table, reports for every table and view of the schema
                the number of first level dependents (views and functions using it) and foreign keys.
        [Options]
           -t, --table <name>: Cascade all objects depending on this table, view or function, printed
                as a leveled table and drawn as a graph.
           --jdbc-props <file>: JDBC properties file, with properties jdbc.driverClassName, jdbc.url,
                jdbc.username, jdbc.password. Replaces the connection options below.
           --host <host>: Database host address. Default localhost.
           -p, --port <port>: Database port. Default 5432.
           -d, --database <name>: Database name. Default current user name.
           -u, --user <name>: Database user name. Default current user name.
           -P, --password <password>: User password. Taken from PGPASSWORD or prompted if not set.
           --catalog <pg|jdbc>: Catalog queries to use, PostgreSQL specific or generic JDBC metadata. Default pg.
           --format <format>: Graph output format, any format supported by Graphviz dot. Default pdf.
           --output-dir <dir>: Directory for the graph file <schema>.<table>.<format>. Default current directory.
           --no-graph: Only print the cascade table.
           --max-depth <n>: Number of cascade levels to expand, 0 for all. Default 0.
           --timeout-seconds <n>: Give up a cascade running longer than this.
           --sort <catalog|name|dependents|foreign-keys>: Row order of the summary. Default catalog.
           --json: Print JSON instead of text tables.
           -v, --verbose: Log each expanded object.
      """;
  }

  public static void main(String[] args)
  {
    boolean helpRequested = args.length == 1 && (args[0].equals("-h") || args[0].equals("--help"));
    if ( helpRequested )
    {
      System.out.println(usage());
      return;
    }

    // Must be set before the first logger is created.
    if ( Arrays.asList(args).contains("-v") || Arrays.asList(args).contains("--verbose") )
      System.setProperty(VERBOSE_PROPERTY, "debug");

    int exitCode = new DependencyReporter(System.out, new DotCommandRenderer()).run(args);
    System.exit(exitCode);
  }

  public int run(String[] args)
  {
    Logger log = LoggerFactory.getLogger(DependencyReporter.class);

    var remArgs = new ArrayList<>(Arrays.asList(args));

    Options opts;
    try
    {
      opts = parseOptions(remArgs);
    }
    catch (IllegalArgumentException e)
    {
      log.error(e.getMessage());
      log.error(usage());
      return EXIT_FAILURE;
    }
    catch (RuntimeException e)
    {
      log.error(e.getMessage());
      return EXIT_FAILURE;
    }

    log.debug("Schema: {}", opts.schema);
    log.debug("Connection: {}", opts.connection);
    log.debug("Catalog queries: {}", opts.catalog);

    Jdbi jdbi;
    try
    {
      jdbi = opts.connection.createJdbi();
    }
    catch (RuntimeException e)
    {
      log.error(e.getMessage());
      return EXIT_FAILURE;
    }

    try (Handle db = openHandle(jdbi))
    {
      CatalogGateway catalog = "jdbc".equals(opts.catalog)
        ? new JdbcCatalogGateway(db.getConnection())
        : new PgCatalogGateway(db);

      DependencyResolver resolver = new DependencyResolver(catalog, opts.maxDepth, opts.timeLimit, Clock.systemUTC());
      ReportFormatter formatter = new ReportFormatter();

      if ( opts.table == null )
      {
        List<DependentCounts> rows = resolver.summarize(opts.schema, opts.order);
        out.print(opts.json ? formatter.toJson(rows) + "\n" : formatter.formatSummary(rows));
        return EXIT_OK;
      }

      Cascade cascade = resolver.cascade(opts.schema, opts.table);
      out.print(opts.json ? formatter.toJson(cascade) + "\n" : formatter.formatCascade(cascade));

      if ( opts.graph )
      {
        try
        {
          new GraphExporter(graphRenderer).export(cascade, opts.outputDir, opts.format);
        }
        catch (RenderBackendFailureException e)
        {
          log.error("Graph rendering failed: " + e.getMessage());
          return EXIT_GRAPH_FAILURE;
        }
      }

      return EXIT_OK;
    }
    catch (DependencyInspectionException e)
    {
      log.error(e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private static Handle openHandle(Jdbi jdbi)
  {
    try
    {
      return jdbi.open();
    }
    catch (JdbiException e)
    {
      throw new CatalogUnavailableException("Could not connect to the database: " + e.getMessage(), e);
    }
  }

  static Options parseOptions(List<String> remArgs)
  {
    @Nullable String jdbcProps = Args.pluckStringOption(remArgs, "--jdbc-props").orElse(null);
    String host = Args.pluckStringOption(remArgs, "--host").orElse("localhost");
    int port = Args.pluckIntOption(remArgs, "--port", Args.pluckIntOption(remArgs, "-p", 5432));
    String currentUser = Optional.ofNullable(System.getenv("USER")).orElse("");
    String database = Args.pluckStringOption(remArgs, "--database", "-d").orElse(currentUser);
    String user = Args.pluckStringOption(remArgs, "--user", "-u").orElse(currentUser);
    @Nullable String password = Args.pluckStringOption(remArgs, "--password", "-P").orElse(null);
    @Nullable String table = Args.pluckStringOption(remArgs, "--table", "-t").orElse(null);
    String catalog = Args.pluckStringOption(remArgs, "--catalog").orElse("pg");
    String format = Args.pluckStringOption(remArgs, "--format").orElse("pdf");
    Path outputDir = Paths.get(Args.pluckStringOption(remArgs, "--output-dir").orElse("."));
    int maxDepth = Args.pluckIntOption(remArgs, "--max-depth", 0);
    int timeoutSeconds = Args.pluckIntOption(remArgs, "--timeout-seconds", 0);
    SummaryOrder order = SummaryOrder.fromOptionValue(Args.pluckStringOption(remArgs, "--sort").orElse("catalog"));
    boolean noGraph = Args.pluckFlag(remArgs, "--no-graph");
    boolean json = Args.pluckFlag(remArgs, "--json");
    Args.pluckFlag(remArgs, "-v", "--verbose");

    if ( !catalog.equals("pg") && !catalog.equals("jdbc") )
      throw new IllegalArgumentException("Unknown catalog type: " + catalog);
    if ( maxDepth < 0 )
      throw new IllegalArgumentException("Option --max-depth cannot be negative.");
    if ( timeoutSeconds < 0 )
      throw new IllegalArgumentException("Option --timeout-seconds cannot be negative.");

    for (String arg : remArgs)
    {
      if ( arg.startsWith("-") )
        throw new IllegalArgumentException("Unknown option: " + arg);
    }
    if ( remArgs.size() != 1 )
      throw new IllegalArgumentException("Expected exactly one schema argument.");

    String schema = remArgs.get(0);

    ConnectionSettings connection;
    if ( jdbcProps != null )
    {
      Path jdbcPropsFile = Paths.get(jdbcProps);
      if ( !Files.isRegularFile(jdbcPropsFile) )
        throw new IllegalArgumentException("File not found: " + jdbcPropsFile);
      connection = ConnectionSettings.fromPropertiesFile(jdbcPropsFile);
    }
    else
      connection = ConnectionSettings.forPostgres(host, port, database, user, password != null ? password : promptPassword(user));

    return new Options(
      schema,
      table,
      connection,
      catalog,
      format,
      outputDir,
      !noGraph,
      maxDepth,
      timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null,
      order,
      json
    );
  }

  private static String promptPassword(String user)
  {
    @Nullable String envPassword = System.getenv("PGPASSWORD");
    if ( envPassword != null )
      return envPassword;

    @Nullable Console console = System.console();
    if ( console == null )
      throw new IllegalArgumentException("No password given and no console to prompt for it.");

    char[] pw = console.readPassword("Database password for %s: ", user);
    if ( pw == null )
      throw new IllegalArgumentException("No password given.");

    return new String(pw);
  }

  record Options
    (
      String schema,
      @Nullable String table,
      ConnectionSettings connection,
      String catalog,
      String format,
      Path outputDir,
      boolean graph,
      int maxDepth,
      @Nullable Duration timeLimit,
      SummaryOrder order,
      boolean json
    )
  {}
}
