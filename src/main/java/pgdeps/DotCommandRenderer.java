package pgdeps;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static java.util.Objects.requireNonNull;

/**
 * Renders through the Graphviz {@code dot} executable, feeding the graph on its standard
 * input.
 */
public class DotCommandRenderer implements GraphRenderer
{
  private static final Logger log = LoggerFactory.getLogger(DotCommandRenderer.class);

  private static final long TIMEOUT_SECONDS = 120;

  private final String executable;

  public DotCommandRenderer()
  {
    this("dot");
  }

  public DotCommandRenderer(String executable)
  {
    this.executable = requireNonNull(executable);
  }

  @Override
  public void render(String dot, String format, Path outputFile)
  {
    List<String> command = List.of(executable, "-T" + format, "-o", outputFile.toString());
    log.debug("Running {}", String.join(" ", command));

    try
    {
      Process proc = new ProcessBuilder(command)
        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
        .redirectErrorStream(false)
        .start();

      try (OutputStream os = proc.getOutputStream())
      {
        os.write(dot.getBytes(StandardCharsets.UTF_8));
      }

      String stderr = new String(proc.getErrorStream().readAllBytes(), StandardCharsets.UTF_8).trim();

      if (!proc.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS))
      {
        proc.destroyForcibly();
        throw new RenderBackendFailureException(executable + " did not finish within " + TIMEOUT_SECONDS + "s.");
      }

      if (proc.exitValue() != 0)
        throw new RenderBackendFailureException(
          executable + " failed with exit status " + proc.exitValue() + (stderr.isEmpty() ? "." : ": " + stderr)
        );
    }
    catch (IOException e)
    {
      throw new RenderBackendFailureException("Could not run " + executable + ": " + e.getMessage(), e);
    }
    catch (InterruptedException e)
    {
      Thread.currentThread().interrupt();
      throw new RenderBackendFailureException("Interrupted while waiting for " + executable + ".", e);
    }
  }
}
