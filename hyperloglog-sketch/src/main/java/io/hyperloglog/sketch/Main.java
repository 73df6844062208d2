package io.hyperloglog.sketch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Counts distinct lines read from stdin.
 *
 * <p>With a state file the estimator is restored from it first (when it exists) and dumped back to it at
 * the end, so counts accumulate across invocations.
 */
public class Main
{
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  static HyperLogLog run(HyperLogLog estimator, BufferedReader reader) throws IOException
  {
    long lines = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      estimator.add(line);
      lines++;
    }
    log.debug("Read {} lines", lines);
    return estimator;
  }

  static HyperLogLog load(int precision, Path stateFile) throws IOException
  {
    HyperLogLog estimator = HyperLogLog.create(precision);
    if (stateFile != null && Files.exists(stateFile)) {
      try (InputStream in = Files.newInputStream(stateFile)) {
        estimator.restore(in);
      }
      if (estimator.precision() != precision) {
        log.warn("State file {} has precision {}, ignoring requested precision {}", stateFile, estimator.precision(), precision);
      }
    }
    return estimator;
  }

  static void save(HyperLogLog estimator, Path stateFile) throws IOException
  {
    try (OutputStream out = Files.newOutputStream(stateFile)) {
      estimator.dump(out);
    }
    log.info("Saved {} to {}", estimator, stateFile);
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 1 || args.length > 3) {
      System.err.println("Arguments: <precision> [<stateFile>] [<protectThreshold>]");
      System.exit(1);
    }

    final int precision = Integer.parseInt(args[0]);
    final Path stateFile = args.length >= 2 ? Paths.get(args[1]) : null;

    HyperLogLog estimator = load(precision, stateFile);
    long start = System.currentTimeMillis();
    run(estimator, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    System.out.printf("%.1f%n", estimator.estimate(false));
    if (args.length == 3) {
      estimator.protect(Integer.parseInt(args[2]));
      System.out.printf("%.1f%n", estimator.estimate(true));
    }
    log.info("Time = {} ms", System.currentTimeMillis() - start);

    if (stateFile != null) {
      save(estimator, stateFile);
    }
  }
}
