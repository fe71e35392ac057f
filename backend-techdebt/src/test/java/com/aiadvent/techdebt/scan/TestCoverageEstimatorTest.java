package com.aiadvent.techdebt.scan;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TestCoverageEstimatorTest {

  private final TestCoverageEstimator estimator = new TestCoverageEstimator();

  @Test
  void ratioOfTestFilesToSourceFiles() {
    assertThat(estimator.estimate(List.of("src/a.js", "src/b.ts", "src/a.test.js", "README.md")))
        .isEqualTo(50.0);
  }

  @Test
  void cappedAtOneHundred() {
    assertThat(
            estimator.estimate(
                List.of("src/a.py", "tests/test_a.py", "tests/test_b.py", "a.spec.ts")))
        .isEqualTo(100.0);
  }

  @Test
  void noSourcesMeansNoCoverage() {
    assertThat(estimator.estimate(List.of("a.test.js", "b.spec.ts"))).isZero();
    assertThat(estimator.estimate(List.of())).isZero();
    assertThat(estimator.estimate(null)).isZero();
  }

  @Test
  void recognisesTestLocations() {
    assertThat(TestCoverageEstimator.isTestPath("test/Main.java")).isTrue();
    assertThat(TestCoverageEstimator.isTestPath("web/__tests__/app.jsx")).isTrue();
    assertThat(TestCoverageEstimator.isTestPath("src/cart.spec.tsx")).isTrue();
    assertThat(TestCoverageEstimator.isTestPath("src/contest/a.js")).isFalse();
    assertThat(TestCoverageEstimator.isTestPath("src/latest.js")).isFalse();
  }
}
