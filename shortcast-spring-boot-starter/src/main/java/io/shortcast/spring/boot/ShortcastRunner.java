package io.shortcast.spring.boot;

import io.shortcast.RunMode;
import io.shortcast.Shortcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.List;
import java.util.Objects;

/**
 * Command surface: runs {@link Shortcast} in the mode given on the command line.
 *
 * <pre>
 * java -jar app.jar                              # continuous (default)
 * java -jar app.jar --mode=fetch-only
 * java -jar app.jar --mode=run-once --force-fetch
 * </pre>
 *
 * <p>{@code --force-fetch} bypasses the fetch cooldown for this invocation only. In continuous
 * mode the runner blocks until the application shuts down unless
 * {@code shortcast.runner.await-termination=false}.
 */
public class ShortcastRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(ShortcastRunner.class);

  static final String MODE_OPTION = "mode";
  static final String FORCE_FETCH_OPTION = "force-fetch";

  private final Shortcast shortcast;
  private final boolean awaitTermination;

  public ShortcastRunner(Shortcast shortcast, boolean awaitTermination) {
    this.shortcast = Objects.requireNonNull(shortcast, "shortcast");
    this.awaitTermination = awaitTermination;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    RunMode mode = RunMode.parse(lastValue(args.getOptionValues(MODE_OPTION)));
    boolean forceFetch = isForceFetch(args.getOptionValues(FORCE_FETCH_OPTION));
    log.info("Starting shortcast in {} mode{}", mode.code(), forceFetch ? " (forced fetch)" : "");

    shortcast.run(mode, forceFetch);

    if (mode == RunMode.CONTINUOUS && awaitTermination) {
      shortcast.awaitTermination();
      log.info("Shortcast scheduler stopped");
    }
  }

  private static String lastValue(List<String> values) {
    return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
  }

  private static boolean isForceFetch(List<String> values) {
    if (values == null) {
      return false;
    }
    // bare --force-fetch binds an empty list
    return values.isEmpty() || Boolean.parseBoolean(lastValue(values));
  }
}
