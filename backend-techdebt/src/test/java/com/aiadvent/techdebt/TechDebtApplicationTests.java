package com.aiadvent.techdebt;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.techdebt.config.TechDebtProperties;
import com.aiadvent.techdebt.model.ScanReport;
import com.aiadvent.techdebt.model.SourceUnit;
import com.aiadvent.techdebt.scan.TechDebtScanService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    classes = TechDebtApplication.class,
    properties = {"techdebt.worker.max-concurrency=2", "techdebt.scoring.hourly-rate=100"})
class TechDebtApplicationTests {

  @Autowired private TechDebtScanService scanService;

  @Autowired private TechDebtProperties properties;

  @Test
  void contextLoadsAndBindsProperties() {
    assertThat(properties.getWorker().getMaxConcurrency()).isEqualTo(2);
    assertThat(properties.getScoring().getHourlyRate()).isEqualTo(100.0);
    assertThat(properties.getIgnoreGlobs()).contains("**/node_modules/**");
  }

  @Test
  void scansThroughTheWiredService() {
    ScanReport report =
        scanService.scan(
            List.of(
                new SourceUnit("src/app.js", "const result = eval(input);\n"),
                new SourceUnit("node_modules/lib/index.js", "eval(x);\n")),
            50);

    assertThat(report.result().summary().totalFiles()).isEqualTo(1);
    assertThat(report.result().issues()).extracting(f -> f.kind().code()).contains("eval_usage");
    assertThat(report.skippedFiles()).hasSize(1);
    assertThat(report.aiSummary()).isNotNull();
    assertThat(report.benchmarks()).hasSize(5);
  }
}
