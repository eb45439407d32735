package com.mk.fx.qa.stress.metrics;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders snapshots and final reports as text and writes them to the log. Each report is emitted as
 * a single log event so concurrent failure diagnostics never interleave with its lines.
 */
@Slf4j
public final class StressReportPrinter {

  private static final int NAME_WIDTH = 30;
  private static final DateTimeFormatter SNAPSHOT_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter FAILURE_TIME =
      DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSSS");

  private StressReportPrinter() {
    throw new UnsupportedOperationException("StressReportPrinter cannot be instantiated");
  }

  public static void printSnapshot(StressSnapshot snapshot) {
    log.info("\n{}", formatSnapshot(snapshot));
  }

  public static void printFinalReport(StressRunReport report) {
    log.info("\n{}", formatFinalReport(report));
  }

  public static String formatSnapshot(StressSnapshot snapshot) {
    var sb = new StringBuilder();
    sb.append('[')
        .append(SNAPSHOT_TIME.format(LocalDateTime.ofInstant(snapshot.timestamp(), ZoneId.systemDefault())))
        .append(']')
        .append(" Total: ")
        .append(String.format("%,d", snapshot.totalRequests()));
    if (snapshot.stalled()) {
      sb.append(" (stalled)");
    }
    sb.append(" Runtime: ").append(formatRuntime(snapshot.runtime())).append('\n');

    if (snapshot.reuseAddressFailures() > 0) {
      sb.append("~~ Reuse address failures: ")
          .append(String.format("%,d", snapshot.reuseAddressFailures()))
          .append(" ~~\n");
    }

    for (OperationCounts counts : snapshot.operations()) {
      appendCounts(sb, pad(counts.operation()), counts);
    }
    appendCounts(sb, pad("    TOTAL"), snapshot.totals());
    return sb.toString();
  }

  public static String formatLatency(LatencyReport latency) {
    if (latency == null) {
      return "Latency(ms) : n=0";
    }
    return String.format(
        "Latency(ms) : n=%d, p50=%s, p75=%s, p99=%s, p999=%s, max=%s",
        latency.samples(),
        latency.p50(),
        latency.p75(),
        latency.p99(),
        latency.p999(),
        latency.max());
  }

  public static String formatFinalReport(StressRunReport report) {
    var sb = new StringBuilder();
    sb.append("Stress Run Final Report\n\n");
    sb.append(formatSnapshot(report.snapshot())).append('\n');
    sb.append(formatLatency(report.latency())).append("\n\n");

    var types = report.failureTypes();
    if (types.isEmpty()) {
      return sb.toString();
    }

    sb.append("There were a total of ")
        .append(report.totalFailures())
        .append(" failures classified into ")
        .append(types.size())
        .append(" different types:\n\n");

    int i = 0;
    for (FailureTypeSummary failure : types) {
      sb.append("Failure Type ").append(++i).append('/').append(types.size()).append(":\n");
      sb.append(failure.errorText()).append('\n');
      for (FailureTypeSummary.OperationFailures operation : failure.operations()) {
        sb.append('\t')
            .append(pad(operation.operation()))
            .append("Fail: ")
            .append(operation.count())
            .append('\t')
            .append(
                operation.occurrences().stream()
                    .map(StressReportPrinter::formatOccurrence)
                    .collect(Collectors.joining(", ")))
            .append('\n');
      }
      sb.append('\t').append(pad("    TOTAL")).append("Fail: ").append(failure.failureCount());
      sb.append("\n\n");
    }
    return sb.toString();
  }

  static String formatRuntime(Duration runtime) {
    long seconds = runtime.getSeconds();
    return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
  }

  private static void appendCounts(StringBuilder sb, String label, OperationCounts counts) {
    sb.append('\t')
        .append(label)
        .append("Success: ")
        .append(String.format("%,d", counts.successes()))
        .append("\tCanceled: ")
        .append(String.format("%,d", counts.cancellations()))
        .append("\tFail: ")
        .append(String.format("%,d", counts.failures()))
        .append('\n');
  }

  private static String formatOccurrence(FailureTypeSummary.Occurrence occurrence) {
    return "Timestamps: "
        + FAILURE_TIME.format(LocalDateTime.ofInstant(occurrence.timestamp(), ZoneId.systemDefault()))
        + ", Duration: "
        + occurrence.duration()
        + ", Cancelled: "
        + occurrence.cancelled();
  }

  private static String pad(String name) {
    return String.format("%-" + NAME_WIDTH + "s", name);
  }
}
