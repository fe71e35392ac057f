package com.aiadvent.techdebt.config;

import com.aiadvent.techdebt.model.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "techdebt")
public class TechDebtProperties {

  private List<String> ignoreGlobs =
      new ArrayList<>(
          List.of(
              "**/node_modules/**",
              "**/dist/**",
              "**/.git/**",
              "**/build/**",
              "**/.next/**",
              "**/vendor/**"));

  @Positive private long maxFileBytes = 1024 * 1024;

  private List<String> complexityMarkers = new ArrayList<>();

  @Min(1)
  private int duplicateMinLength = 50;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double duplicateRatioThreshold = 0.25;

  private boolean requireTests = true;

  private Map<Severity, Integer> severityWeights = defaultSeverityWeights();

  @Valid private Scoring scoring = new Scoring();
  @Valid private Authorship authorship = new Authorship();
  @Valid private Worker worker = new Worker();
  private DependencyAudit dependencyAudit = new DependencyAudit();

  public List<String> getIgnoreGlobs() {
    return ignoreGlobs;
  }

  public void setIgnoreGlobs(List<String> ignoreGlobs) {
    this.ignoreGlobs = ignoreGlobs != null ? new ArrayList<>(ignoreGlobs) : new ArrayList<>();
  }

  public long getMaxFileBytes() {
    return maxFileBytes;
  }

  public void setMaxFileBytes(long maxFileBytes) {
    this.maxFileBytes = maxFileBytes;
  }

  public List<String> getComplexityMarkers() {
    return complexityMarkers;
  }

  public void setComplexityMarkers(List<String> complexityMarkers) {
    this.complexityMarkers =
        complexityMarkers != null ? new ArrayList<>(complexityMarkers) : new ArrayList<>();
  }

  public int getDuplicateMinLength() {
    return duplicateMinLength;
  }

  public void setDuplicateMinLength(int duplicateMinLength) {
    this.duplicateMinLength = duplicateMinLength;
  }

  public double getDuplicateRatioThreshold() {
    return duplicateRatioThreshold;
  }

  public void setDuplicateRatioThreshold(double duplicateRatioThreshold) {
    this.duplicateRatioThreshold = duplicateRatioThreshold;
  }

  public boolean isRequireTests() {
    return requireTests;
  }

  public void setRequireTests(boolean requireTests) {
    this.requireTests = requireTests;
  }

  public Map<Severity, Integer> getSeverityWeights() {
    return severityWeights;
  }

  /** Partial maps are merged over the defaults so an override of one severity keeps the rest. */
  public void setSeverityWeights(Map<Severity, Integer> severityWeights) {
    Map<Severity, Integer> merged = defaultSeverityWeights();
    if (severityWeights != null) {
      severityWeights.forEach(
          (severity, weight) -> {
            if (severity != null && weight != null && weight >= 0) {
              merged.put(severity, weight);
            }
          });
    }
    this.severityWeights = merged;
  }

  public int severityWeight(Severity severity) {
    return severityWeights.getOrDefault(severity, 0);
  }

  public Scoring getScoring() {
    return scoring;
  }

  public void setScoring(Scoring scoring) {
    this.scoring = scoring != null ? scoring : new Scoring();
  }

  public Authorship getAuthorship() {
    return authorship;
  }

  public void setAuthorship(Authorship authorship) {
    this.authorship = authorship != null ? authorship : new Authorship();
  }

  public Worker getWorker() {
    return worker;
  }

  public void setWorker(Worker worker) {
    this.worker = worker != null ? worker : new Worker();
  }

  public DependencyAudit getDependencyAudit() {
    return dependencyAudit;
  }

  public void setDependencyAudit(DependencyAudit dependencyAudit) {
    this.dependencyAudit = dependencyAudit != null ? dependencyAudit : new DependencyAudit();
  }

  private static Map<Severity, Integer> defaultSeverityWeights() {
    Map<Severity, Integer> weights = new EnumMap<>(Severity.class);
    weights.put(Severity.BLOCKER, 20);
    weights.put(Severity.CRITICAL, 15);
    weights.put(Severity.MAJOR, 10);
    weights.put(Severity.MINOR, 5);
    weights.put(Severity.INFO, 1);
    return weights;
  }

  public static class Scoring {

    /** Development cost assumed for one line of code, in minutes. */
    @Positive private double minutesPerLine = 30;

    /** Developer hourly rate in USD. */
    @Positive private double hourlyRate = 75;

    public double getMinutesPerLine() {
      return minutesPerLine;
    }

    public void setMinutesPerLine(double minutesPerLine) {
      this.minutesPerLine = minutesPerLine;
    }

    public double getHourlyRate() {
      return hourlyRate;
    }

    public void setHourlyRate(double hourlyRate) {
      this.hourlyRate = hourlyRate;
    }
  }

  public static class Authorship {

    private boolean enabled = true;

    @Min(0)
    @Max(100)
    private int likelihoodThreshold = 70;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getLikelihoodThreshold() {
      return likelihoodThreshold;
    }

    public void setLikelihoodThreshold(int likelihoodThreshold) {
      this.likelihoodThreshold = likelihoodThreshold;
    }
  }

  public static class Worker {

    @Min(1)
    private int maxConcurrency = Math.max(1, Runtime.getRuntime().availableProcessors());

    private Duration fileTimeout = Duration.ofSeconds(30);

    private String threadNamePrefix = "techdebt-scan-";

    public int getMaxConcurrency() {
      return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
      this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    public Duration getFileTimeout() {
      return fileTimeout;
    }

    public void setFileTimeout(Duration fileTimeout) {
      if (fileTimeout != null && !fileTimeout.isNegative() && !fileTimeout.isZero()) {
        this.fileTimeout = fileTimeout;
      }
    }

    public String getThreadNamePrefix() {
      return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
      if (threadNamePrefix != null && !threadNamePrefix.isBlank()) {
        this.threadNamePrefix = threadNamePrefix;
      }
    }
  }

  /**
   * Toggles for the package-manager audits run by the reporting layer. The scan core only
   * carries them; nothing here shells out.
   */
  public static class DependencyAudit {

    private boolean npm = true;
    private boolean pip = false;
    private boolean maven = false;

    public boolean isNpm() {
      return npm;
    }

    public void setNpm(boolean npm) {
      this.npm = npm;
    }

    public boolean isPip() {
      return pip;
    }

    public void setPip(boolean pip) {
      this.pip = pip;
    }

    public boolean isMaven() {
      return maven;
    }

    public void setMaven(boolean maven) {
      this.maven = maven;
    }

    public List<String> enabledTools() {
      List<String> tools = new ArrayList<>();
      if (npm) {
        tools.add("npm");
      }
      if (pip) {
        tools.add("pip");
      }
      if (maven) {
        tools.add("maven");
      }
      return List.copyOf(tools);
    }
  }
}
