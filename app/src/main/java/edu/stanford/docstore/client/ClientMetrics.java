package edu.stanford.docstore.client;

import com.codahale.metrics.*;
import java.io.File;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Process-wide metric registry for the client, plus optional log and CSV reporters. */
@UtilityClass
@Slf4j // Slf4jReporter needs an slf4j logger
public class ClientMetrics {
  public static final long METRIC_REPORTING_PERIOD_SEC = 10;

  public static final MetricRegistry registry = new MetricRegistry();
  private static Slf4jReporter logReporter = null;
  private static CsvReporter csvReporter = null;

  public void startReporting(File metricsDirectory) {
    startLogReporting();
    startCsvReporting(metricsDirectory);
  }

  public void startLogReporting() {
    if (logReporter != null) {
      return;
    }
    logReporter =
        Slf4jReporter.forRegistry(registry)
            .outputTo(log)
            .filter(MetricFilter.contains("docstore-client"))
            .convertRatesTo(TimeUnit.SECONDS)
            .convertDurationsTo(TimeUnit.MILLISECONDS)
            .build();
    logReporter.start(METRIC_REPORTING_PERIOD_SEC, TimeUnit.SECONDS);
  }

  public void startCsvReporting(File metricsDirectory) {
    if (csvReporter != null) {
      return;
    }
    log.atInfo().log("Writing metrics to " + metricsDirectory.toPath().toAbsolutePath());
    if (!metricsDirectory.isDirectory() && !metricsDirectory.mkdirs()) {
      throw new IllegalStateException("Could not create metrics directory " + metricsDirectory);
    }
    csvReporter =
        CsvReporter.forRegistry(registry)
            .formatFor(Locale.US)
            .convertRatesTo(TimeUnit.SECONDS)
            .convertDurationsTo(TimeUnit.MILLISECONDS)
            .build(metricsDirectory);
    csvReporter.start(METRIC_REPORTING_PERIOD_SEC, TimeUnit.SECONDS);
  }

  /** Flushes a final report and stops every running reporter. */
  public void stopReporting() {
    if (logReporter != null) {
      logReporter.report();
      logReporter.stop();
      logReporter = null;
    }
    if (csvReporter != null) {
      csvReporter.report();
      csvReporter.stop();
      csvReporter = null;
    }
  }
}
