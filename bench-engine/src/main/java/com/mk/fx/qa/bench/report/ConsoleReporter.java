package com.mk.fx.qa.bench.report;

import com.mk.fx.qa.bench.cfg.RunConfig;
import com.mk.fx.qa.bench.metrics.EndpointMetrics;
import com.mk.fx.qa.bench.metrics.GlobalSummary;
import com.mk.fx.qa.bench.metrics.RunSummary;
import java.io.PrintStream;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Objects;

/** Prints the benchmark as fixed-width text tables. Not thread-safe. */
public class ConsoleReporter {

  static final String COLUMN_HEADER =
      pad("endpoint", 20)
          + pad("total", 8)
          + pad("succ", 8)
          + pad("fail", 8)
          + pad("time(ms)", 12)
          + pad("thr/s", 12)
          + pad("avgLat(ms)", 12)
          + pad("p90(ms)", 12)
          + pad("p99(ms)", 12);

  private final PrintStream out;
  private final DecimalFormat number =
      new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));

  public ConsoleReporter(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  public void printHeader(RunConfig config) {
    out.println();
    out.println("=== Benchmark report ===");
    out.println(
        "Target: "
            + config.baseUrl()
            + ", Mode: "
            + config.mode()
            + ", Concurrency: "
            + config.concurrency()
            + ", Timeout: "
            + config.timeout().toMillis()
            + "ms, Repeat: "
            + config.repeat()
            + ", Requests/run: "
            + config.requestsPerRun());
    out.println("Endpoints: " + String.join(", ", config.endpoints()));
    out.println("========================");
    out.println();
  }

  public void printRun(RunSummary run, int runCount) {
    out.println("--- Run " + run.runIndex() + "/" + runCount + " (" + run.durationMs() + "ms) ---");
    out.println(COLUMN_HEADER);
    run.metrics().forEach(this::printRow);
    out.println();
  }

  public void printSummary(GlobalSummary summary) {
    out.println(
        "=== Final summary ("
            + summary.runCount()
            + " runs, latency merge: "
            + summary.latencyMerge()
            + ") ===");
    out.println(COLUMN_HEADER);
    summary.metrics().forEach(this::printRow);
    out.flush();
  }

  void printRow(EndpointMetrics m) {
    out.println(formatRow(m));
  }

  String formatRow(EndpointMetrics m) {
    return pad(m.endpoint(), 20)
        + pad(m.totalRequests(), 8)
        + pad(m.successes(), 8)
        + pad(m.failures(), 8)
        + pad(m.runDurationMs() + "ms", 12)
        + pad(number.format(m.throughputReqPerSec()) + "/s", 12)
        + pad("avg:" + number.format(m.latency().avg()) + "ms", 12)
        + pad("p90:" + number.format(m.latency().p90()) + "ms", 12)
        + pad("p99:" + number.format(m.latency().p99()) + "ms", 12);
  }

  private static String pad(Object value, int width) {
    var text = String.valueOf(value);
    if (text.length() >= width) {
      return text;
    }
    return text + " ".repeat(width - text.length());
  }
}
