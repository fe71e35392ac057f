package com.aiadvent.techdebt.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.techdebt.model.Severity;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class TechDebtPropertiesTest {

  @Test
  void defaultsMatchTheDocumentedConfiguration() {
    TechDebtProperties properties = new TechDebtProperties();

    assertThat(properties.getIgnoreGlobs()).contains("**/node_modules/**", "**/.git/**");
    assertThat(properties.getMaxFileBytes()).isEqualTo(1024 * 1024);
    assertThat(properties.getDuplicateMinLength()).isEqualTo(50);
    assertThat(properties.getDuplicateRatioThreshold()).isEqualTo(0.25);
    assertThat(properties.isRequireTests()).isTrue();
    assertThat(properties.getComplexityMarkers()).isEmpty();
    assertThat(properties.severityWeight(Severity.BLOCKER)).isEqualTo(20);
    assertThat(properties.severityWeight(Severity.INFO)).isEqualTo(1);
    assertThat(properties.getScoring().getMinutesPerLine()).isEqualTo(30.0);
    assertThat(properties.getScoring().getHourlyRate()).isEqualTo(75.0);
    assertThat(properties.getAuthorship().getLikelihoodThreshold()).isEqualTo(70);
    assertThat(properties.getWorker().getFileTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(properties.getWorker().getThreadNamePrefix()).isEqualTo("techdebt-scan-");
    assertThat(properties.getDependencyAudit().enabledTools()).containsExactly("npm");
  }

  @Test
  void bindsOverridesFromPropertySources() {
    Map<String, Object> source = new HashMap<>();
    source.put("techdebt.ignore-globs[0]", "**/generated/**");
    source.put("techdebt.complexity-markers[0]", "TODO");
    source.put("techdebt.severity-weights.major", "12");
    source.put("techdebt.scoring.hourly-rate", "120");
    source.put("techdebt.authorship.enabled", "false");
    source.put("techdebt.worker.max-concurrency", "3");
    source.put("techdebt.worker.file-timeout", "5s");
    source.put("techdebt.dependency-audit.pip", "true");
    source.put("techdebt.dependency-audit.maven", "true");

    Binder binder = new Binder(new MapConfigurationPropertySource(source));
    TechDebtProperties properties =
        binder.bind("techdebt", Bindable.of(TechDebtProperties.class)).get();

    assertThat(properties.getIgnoreGlobs()).containsExactly("**/generated/**");
    assertThat(properties.getComplexityMarkers()).containsExactly("TODO");
    assertThat(properties.severityWeight(Severity.MAJOR)).isEqualTo(12);
    assertThat(properties.severityWeight(Severity.CRITICAL)).isEqualTo(15);
    assertThat(properties.getScoring().getHourlyRate()).isEqualTo(120.0);
    assertThat(properties.getAuthorship().isEnabled()).isFalse();
    assertThat(properties.getWorker().getMaxConcurrency()).isEqualTo(3);
    assertThat(properties.getWorker().getFileTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(properties.getDependencyAudit().enabledTools())
        .containsExactly("npm", "pip", "maven");
  }

  @Test
  void ignoresUnusableValues() {
    TechDebtProperties properties = new TechDebtProperties();
    properties.getWorker().setMaxConcurrency(0);
    properties.getWorker().setFileTimeout(Duration.ZERO);
    properties.getWorker().setThreadNamePrefix("  ");
    properties.setSeverityWeights(Map.of(Severity.MINOR, -3));
    properties.setIgnoreGlobs(null);

    assertThat(properties.getWorker().getMaxConcurrency()).isEqualTo(1);
    assertThat(properties.getWorker().getFileTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(properties.getWorker().getThreadNamePrefix()).isEqualTo("techdebt-scan-");
    assertThat(properties.severityWeight(Severity.MINOR)).isEqualTo(5);
    assertThat(properties.getIgnoreGlobs()).isEmpty();
  }
}
