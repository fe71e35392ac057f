package com.aiadvent.techdebt.scan;

import com.aiadvent.techdebt.authorship.AuthorshipModels.AICodeSummary;
import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipAnalysis;
import com.aiadvent.techdebt.authorship.AuthorshipSummarizer;
import com.aiadvent.techdebt.config.TechDebtProperties;
import com.aiadvent.techdebt.model.EnterpriseMetrics;
import com.aiadvent.techdebt.model.FileReport;
import com.aiadvent.techdebt.model.ScanReport;
import com.aiadvent.techdebt.model.ScanResult;
import com.aiadvent.techdebt.model.SkippedFile;
import com.aiadvent.techdebt.model.SkippedFile.Reason;
import com.aiadvent.techdebt.model.SourceUnit;
import com.aiadvent.techdebt.scoring.EnterpriseMetricsCalculator;
import com.aiadvent.techdebt.scoring.ScanAggregator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Entry point of a scan: filters the supplied files, analyzes the survivors in parallel on the
 * worker pool and reduces the per-file reports on the calling thread. A file that cannot be
 * read, is too large, fails or times out is listed as skipped and the scan goes on.
 */
@Service
public class TechDebtScanService {

  private static final Logger log = LoggerFactory.getLogger(TechDebtScanService.class);

  private final TechDebtProperties properties;
  private final FileAnalyzer fileAnalyzer;
  private final ScanAggregator scanAggregator;
  private final AuthorshipSummarizer authorshipSummarizer;
  private final EnterpriseMetricsCalculator enterpriseMetricsCalculator;
  private final TestCoverageEstimator testCoverageEstimator;
  private final ExecutorService executor;
  private final IgnoreGlobMatcher ignoreMatcher;
  private final MeterRegistry meterRegistry;
  private final Timer scanTimer;
  private final Counter scannedFilesCounter;
  private final Counter failedFilesCounter;
  private final Counter skippedFilesCounter;
  private final DistributionSummary findingsSummary;

  public TechDebtScanService(
      TechDebtProperties properties,
      FileAnalyzer fileAnalyzer,
      ScanAggregator scanAggregator,
      AuthorshipSummarizer authorshipSummarizer,
      EnterpriseMetricsCalculator enterpriseMetricsCalculator,
      TestCoverageEstimator testCoverageEstimator,
      @Qualifier(ScanWorkerConfiguration.EXECUTOR_BEAN) ExecutorService executor,
      @Nullable MeterRegistry meterRegistry) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.fileAnalyzer = Objects.requireNonNull(fileAnalyzer, "fileAnalyzer");
    this.scanAggregator = Objects.requireNonNull(scanAggregator, "scanAggregator");
    this.authorshipSummarizer =
        Objects.requireNonNull(authorshipSummarizer, "authorshipSummarizer");
    this.enterpriseMetricsCalculator =
        Objects.requireNonNull(enterpriseMetricsCalculator, "enterpriseMetricsCalculator");
    this.testCoverageEstimator =
        Objects.requireNonNull(testCoverageEstimator, "testCoverageEstimator");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.ignoreMatcher = IgnoreGlobMatcher.of(properties.getIgnoreGlobs());
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.meterRegistry = registry;
    this.scanTimer = this.meterRegistry.timer("techdebt_scan_duration");
    this.scannedFilesCounter = this.meterRegistry.counter("techdebt_scan_files_scanned_total");
    this.failedFilesCounter = this.meterRegistry.counter("techdebt_scan_files_failed_total");
    this.skippedFilesCounter = this.meterRegistry.counter("techdebt_scan_files_skipped_total");
    this.findingsSummary = this.meterRegistry.summary("techdebt_scan_findings");
  }

  /** Scans with a coverage estimated from the paths of the supplied files. */
  public ScanReport scan(List<SourceUnit> files) {
    if (files == null) {
      throw new IllegalArgumentException("files must not be null");
    }
    List<String> paths = files.stream().filter(Objects::nonNull).map(SourceUnit::path).toList();
    return scan(files, testCoverageEstimator.estimate(paths));
  }

  public ScanReport scan(List<SourceUnit> files, double testCoveragePercent) {
    if (files == null) {
      throw new IllegalArgumentException("files must not be null");
    }
    if (files.contains(null)) {
      throw new IllegalArgumentException("files must not contain null entries");
    }
    double coverage = Math.max(0, Math.min(100, testCoveragePercent));
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<SkippedFile> skipped = new ArrayList<>();
      List<SourceUnit> accepted = select(files, skipped);
      log.info(
          "techdebt.scan.started files={} accepted={} skipped={}",
          files.size(),
          accepted.size(),
          skipped.size());

      List<FileReport> reports = analyzeAll(accepted, skipped);
      ScanResult result = scanAggregator.aggregate(reports, coverage);

      AICodeSummary aiSummary = null;
      if (properties.getAuthorship().isEnabled()) {
        List<AuthorshipAnalysis> analyses =
            reports.stream()
                .map(FileReport::authorshipAnalysis)
                .flatMap(Optional::stream)
                .toList();
        aiSummary = authorshipSummarizer.summarize(analyses);
      }
      EnterpriseMetrics enterprise = enterpriseMetricsCalculator.calculate(result);

      scannedFilesCounter.increment(reports.size());
      skippedFilesCounter.increment(skipped.size());
      findingsSummary.record(result.issues().size());
      log.info(
          "techdebt.scan.completed files={} issues={} rating={} debtMinutes={} cost={}",
          result.summary().totalFiles(),
          result.summary().totalIssues(),
          result.summary().technicalDebt().sqaleRating(),
          result.summary().technicalDebt().totalMinutes(),
          String.format(Locale.ROOT, "%.2f", result.businessImpact().financialCost()));

      return new ScanReport(
          result,
          aiSummary,
          enterprise,
          enterpriseMetricsCalculator.benchmarks(enterprise),
          skipped,
          properties.getDependencyAudit().enabledTools(),
          Instant.now());
    } finally {
      sample.stop(scanTimer);
    }
  }

  private List<SourceUnit> select(List<SourceUnit> files, List<SkippedFile> skipped) {
    List<SourceUnit> accepted = new ArrayList<>(files.size());
    long maxBytes = properties.getMaxFileBytes();
    for (SourceUnit unit : files) {
      if (ignoreMatcher.isIgnored(unit.path())) {
        log.debug("techdebt.scan.ignored path={}", unit.path());
        skipped.add(new SkippedFile(unit.path(), Reason.IGNORED, "matched an ignore glob"));
        continue;
      }
      if (unit.content() == null) {
        log.debug("techdebt.scan.unreadable path={}", unit.path());
        skipped.add(new SkippedFile(unit.path(), Reason.UNREADABLE, "content is not available"));
        continue;
      }
      long size = unit.content().getBytes(StandardCharsets.UTF_8).length;
      if (size > maxBytes) {
        log.debug("techdebt.scan.too_large path={} bytes={} limit={}", unit.path(), size, maxBytes);
        skipped.add(
            new SkippedFile(
                unit.path(), Reason.TOO_LARGE, size + " bytes exceeds limit of " + maxBytes));
        continue;
      }
      accepted.add(unit);
    }
    return accepted;
  }

  private List<FileReport> analyzeAll(List<SourceUnit> units, List<SkippedFile> skipped) {
    List<Future<FileReport>> futures = new ArrayList<>(units.size());
    try {
      for (SourceUnit unit : units) {
        futures.add(executor.submit(() -> fileAnalyzer.analyze(unit)));
      }
    } catch (RejectedExecutionException ex) {
      futures.forEach(future -> future.cancel(true));
      throw new IllegalStateException("Scan worker pool rejected the scan", ex);
    }

    Duration timeout = properties.getWorker().getFileTimeout();
    List<FileReport> reports = new ArrayList<>(units.size());
    for (int i = 0; i < units.size(); i++) {
      SourceUnit unit = units.get(i);
      Future<FileReport> future = futures.get(i);
      try {
        reports.add(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
      } catch (TimeoutException ex) {
        future.cancel(true);
        failedFilesCounter.increment();
        log.warn("techdebt.scan.timeout path={} timeout={}", unit.path(), timeout);
        skipped.add(
            new SkippedFile(unit.path(), Reason.TIMED_OUT, "analysis exceeded " + timeout));
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        failedFilesCounter.increment();
        log.warn("techdebt.scan.failed path={} message={}", unit.path(), cause.getMessage(), cause);
        skipped.add(
            new SkippedFile(unit.path(), Reason.FAILED, String.valueOf(cause.getMessage())));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        futures.forEach(pending -> pending.cancel(true));
        throw new IllegalStateException("Scan interrupted", ex);
      }
    }
    return reports;
  }
}
