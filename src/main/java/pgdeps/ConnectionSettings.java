package pgdeps;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.SqlStatements;
import org.jetbrains.annotations.Nullable;

/**
 * Where and as whom to connect: either read from a JDBC properties file with properties
 * jdbc.driverClassName, jdbc.url, jdbc.username and jdbc.password, or assembled from
 * PostgreSQL host, port and database.
 */
public record ConnectionSettings
  (
    @Nullable String driverClassName,
    String url,
    String username,
    String password
  )
{
  public static ConnectionSettings fromPropertiesFile(Path propsFile)
  {
    Properties props = new Properties();

    try (InputStream is = Files.newInputStream(propsFile))
    {
      props.load(is);
    }
    catch (IOException e)
    {
      throw new RuntimeException("Could not read connection properties file " + propsFile + ".", e);
    }

    if ( !props.containsKey("jdbc.driverClassName") ||
         !props.containsKey("jdbc.url") ||
         !props.containsKey("jdbc.username") ||
         !props.containsKey("jdbc.password") )
      throw new RuntimeException(
        "Expected connection properties " +
        "{ jdbc.driverClassName, jdbc.url, jdbc.username, jdbc.password } " +
        "in connection properties file."
      );

    return new ConnectionSettings(
      props.getProperty("jdbc.driverClassName"),
      props.getProperty("jdbc.url"),
      props.getProperty("jdbc.username"),
      props.getProperty("jdbc.password")
    );
  }

  public static ConnectionSettings forPostgres
    (
      String host,
      int port,
      String database,
      String username,
      String password
    )
  {
    String url = "jdbc:postgresql://" + host + ":" + port + "/" + database;
    return new ConnectionSettings("org.postgresql.Driver", url, username, password);
  }

  public Jdbi createJdbi()
  {
    try
    {
      if (driverClassName != null)
        Class.forName(driverClassName);
    }
    catch (ClassNotFoundException e)
    {
      throw new RuntimeException("JDBC driver class not found: " + driverClassName, e);
    }

    Jdbi jdbi = Jdbi.create(url, username, password);

    jdbi.getConfig(SqlStatements.class).setUnusedBindingAllowed(true);

    return jdbi;
  }

  @Override
  public String toString()
  {
    return "ConnectionSettings[url=" + url + ", username=" + username + "]";
  }
}
