package com.mk.fx.qa.bench.cfg;

import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Unmatched;

/**
 * Benchmark flags as typed on the command line, turned into {@code --bench.*} Spring arguments
 * before the application starts.
 *
 * <p>Every flag is accepted as {@code -c 3}, {@code -c=3}, {@code --concurrency 3} or {@code
 * --concurrency=3}. Arguments that are not benchmark flags, such as {@code
 * --spring.profiles.active=dev} or {@code --bench.headers.X-Run=1}, are passed through untouched.
 * Values are not checked here; binding and validation of {@link BenchProperties} reject bad ones.
 */
@Command(name = "endpoint-bench")
public final class BenchCommandLine {

  @Option(names = {"-c", "--concurrency"})
  private String concurrency;

  @Option(names = {"-t", "--timeout"})
  private String timeoutMs;

  @Option(names = {"-r", "--repeat"})
  private String repeat;

  @Option(names = {"-e", "--endpoints"})
  private String endpoints;

  @Option(names = "--requests")
  private String totalRequests;

  @Option(names = "--url")
  private String baseUrl;

  @Option(names = "--mode")
  private String mode;

  @Option(names = "--seed")
  private String seed;

  @Option(names = "--latency-merge")
  private String latencyMerge;

  @Option(names = "--report-file")
  private String reportFile;

  @Unmatched private List<String> passThrough = new ArrayList<>();

  private BenchCommandLine() {}

  /**
   * Rewrites benchmark flags into Spring property arguments.
   *
   * @throws CommandLine.ParameterException if a flag is missing its value
   */
  public static String[] toSpringArgs(String... args) {
    var parsed = new BenchCommandLine();
    new CommandLine(parsed).setUnmatchedArgumentsAllowed(true).parseArgs(args);

    List<String> springArgs = new ArrayList<>(parsed.passThrough);
    addProperty(springArgs, "concurrency", parsed.concurrency);
    addProperty(springArgs, "timeout-ms", parsed.timeoutMs);
    addProperty(springArgs, "repeat", parsed.repeat);
    addProperty(springArgs, "endpoints", parsed.endpoints);
    addProperty(springArgs, "total-requests", parsed.totalRequests);
    addProperty(springArgs, "base-url", parsed.baseUrl);
    addProperty(springArgs, "mode", parsed.mode);
    addProperty(springArgs, "seed", parsed.seed);
    addProperty(springArgs, "latency-merge", parsed.latencyMerge);
    addProperty(springArgs, "report-file", parsed.reportFile);
    return springArgs.toArray(new String[0]);
  }

  private static void addProperty(List<String> springArgs, String property, String value) {
    if (value != null) {
      springArgs.add("--bench." + property + "=" + value);
    }
  }
}
