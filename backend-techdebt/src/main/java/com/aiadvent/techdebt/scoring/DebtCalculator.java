package com.aiadvent.techdebt.scoring;

import com.aiadvent.techdebt.config.TechDebtProperties;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Debt ratio, SQALE letter rating and the simplified maintainability index. */
@Component
public class DebtCalculator {

  private final TechDebtProperties properties;

  public DebtCalculator(TechDebtProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  /** Debt as a percentage of the estimated development cost; 0 for an empty code base. */
  public double debtRatio(long debtMinutes, long linesOfCode) {
    double developmentCost = linesOfCode * properties.getScoring().getMinutesPerLine();
    if (developmentCost <= 0) {
      return 0.0;
    }
    return Math.max(0.0, debtMinutes / developmentCost * 100);
  }

  public static String rating(double debtRatio) {
    if (debtRatio <= 5) {
      return "A";
    }
    if (debtRatio <= 10) {
      return "B";
    }
    if (debtRatio <= 20) {
      return "C";
    }
    if (debtRatio <= 50) {
      return "D";
    }
    return "E";
  }

  public static double maintainabilityIndex(
      long linesOfCode, long cyclomaticComplexity, double commentRatio) {
    double complexityPenalty = Math.min(cyclomaticComplexity / 10.0, 30);
    double sizePenalty = linesOfCode > 0 ? Math.min(Math.log(linesOfCode) * 2, 30) : 0;
    double index = 100 - complexityPenalty - sizePenalty + commentRatio * 10;
    return Math.max(0, Math.min(100, index));
  }
}
