package com.aiadvent.techdebt.authorship;

import com.aiadvent.techdebt.analysis.DuplicateWindows;
import com.aiadvent.techdebt.analysis.FunctionSpans;
import com.aiadvent.techdebt.analysis.LanguageProfile;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.analysis.SourceLines;
import com.aiadvent.techdebt.analysis.TextMetricsExtractor;
import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipAnalysis;
import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipIndicators;
import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipPattern;
import com.aiadvent.techdebt.authorship.AuthorshipModels.LineMetadata;
import com.aiadvent.techdebt.authorship.AuthorshipModels.PatternSeverity;
import com.aiadvent.techdebt.authorship.AuthorshipModels.StaticCodeMetrics;
import com.aiadvent.techdebt.config.TechDebtProperties;
import com.aiadvent.techdebt.model.TextMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scores how likely a file is machine-generated. Every matched signal adds fixed points to
 * either the machine or the human side; the likelihood is the machine share of the total, with
 * human points discounted by {@link #HUMAN_WEIGHT}.
 */
@Component
public class AuthorshipClassifier {

  static final double HUMAN_WEIGHT = 0.7;
  static final int UNINFORMED_LIKELIHOOD = 50;
  private static final int SNIPPET_LENGTH = 80;

  private static final List<Pattern> GENERIC_COMMENTS =
      List.of(
          Pattern.compile("^\\s*//\\s*This function", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*This method", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*#\\s*This function", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*Initialize", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*TODO:", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*Helper function", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*Utility", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*Main function", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*Returns?:", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*Parameters?:", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*@param", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*@returns?", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*Example:", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*Usage:", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*/\\*\\*\\s*$"),
          Pattern.compile("^\\s*//\\s*Function to", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\s*//\\s*Method to", Pattern.CASE_INSENSITIVE));

  private static final Pattern GENERIC_NAMES =
      Pattern.compile(
          "\\b(?:const|let|var)\\s+(?:data|result|response|value|item|element|temp|tmp|obj|arr"
              + "|str|num|output|input)\\b");

  private static final List<Pattern> BOILERPLATE =
      List.of(
          Pattern.compile("try\\s*\\{\\s*//\\s*TODO", Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "catch\\s*\\(\\s*error\\s*\\)\\s*\\{\\s*console\\.(?:log|error)",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile("function\\s+\\w+\\s*\\(\\s*\\)\\s*\\{\\s*//", Pattern.CASE_INSENSITIVE),
          Pattern.compile("eslint-disable", Pattern.CASE_INSENSITIVE),
          Pattern.compile("prettier-ignore", Pattern.CASE_INSENSITIVE));

  private static final List<ToolSignature> TOOL_SIGNATURES =
      List.of(
          new ToolSignature("github\\s*copilot", "GitHub Copilot"),
          new ToolSignature("generated\\s*by\\s*(?:ai|copilot|chatgpt)", "AI Generator"),
          new ToolSignature("chatgpt", "ChatGPT"),
          new ToolSignature("claude\\s*(?:ai)?", "Claude"),
          new ToolSignature("auto-generated", "Auto-generator"),
          new ToolSignature("AI-generated", "AI"));

  private static final Pattern NARRATIVE_COMMENT =
      Pattern.compile("//\\s*(?!TODO|FIXME|NOTE|HACK|This|Function|Method)[A-Z][a-z]+.*[.!?]");
  private static final Pattern DOMAIN_VOCABULARY =
      Pattern.compile(
          "\\b(?:user|customer|order|product|invoice|payment|account|profile|transaction"
              + "|session|auth|config)\\w+",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern REFACTOR_NOTE =
      Pattern.compile(
          "//\\s*(?:refactor|optimize|improve|cleanup|performance|memory|FIXME|HACK|XXX)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern DEBUG_ARTIFACT =
      Pattern.compile(
          "console\\.(?:log|debug|warn|error)\\([^)\\n]*//|print\\([^)\\n]*#",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern DECLARATION_LINE =
      Pattern.compile("^\\s*(?:const|let|var|function|class|interface|type|enum)\\s+");
  private static final Pattern CONDITIONAL_OPERATOR =
      Pattern.compile("(?:if|while|for)\\s*\\([^)\\n]*[<>=!&|]+");
  private static final Pattern DECLARED_NAME =
      Pattern.compile("(?:const|let|var|function)\\s+([a-zA-Z_$][a-zA-Z0-9_$]*)");
  private static final Pattern CAMEL_HUMP = Pattern.compile("[a-z][A-Z]");
  private static final Pattern LEADING_WHITESPACE = Pattern.compile("^\\s*");

  private static final Pattern HAS_FUNCTION =
      Pattern.compile("function\\s+\\w+|const\\s+\\w+\\s*=\\s*\\([^)\\n]*\\)\\s*=>");
  private static final Pattern HAS_CLASS = Pattern.compile("class\\s+\\w+");
  private static final Pattern HAS_MODULES =
      Pattern.compile("import\\s+.*from|export\\s+(?:default|const|function|class)");
  private static final Pattern HAS_TRY = Pattern.compile("\\btry\\s*\\{");
  private static final Pattern HAS_ERROR_CHECK =
      Pattern.compile("\\bif\\s*\\([^)\\n]*(?:error|err|exception)", Pattern.CASE_INSENSITIVE);
  private static final Pattern HAS_THROW =
      Pattern.compile("\\bthrow\\s+new\\s+\\w+(?:Error|Exception)\\b");

  private record ToolSignature(Pattern pattern, String tool) {
    ToolSignature(String regex, String tool) {
      this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), tool);
    }
  }

  private final TextMetricsExtractor textMetricsExtractor;
  private final int duplicateMinLength;

  @Autowired
  public AuthorshipClassifier(
      TextMetricsExtractor textMetricsExtractor, TechDebtProperties properties) {
    this(
        textMetricsExtractor,
        Objects.requireNonNull(properties, "properties").getDuplicateMinLength());
  }

  AuthorshipClassifier(TextMetricsExtractor textMetricsExtractor, int duplicateMinLength) {
    this.textMetricsExtractor =
        Objects.requireNonNull(textMetricsExtractor, "textMetricsExtractor");
    this.duplicateMinLength = Math.max(1, duplicateMinLength);
  }

  public AuthorshipAnalysis classify(RuleContext context) {
    Objects.requireNonNull(context, "context");
    List<String> lines = context.lines();
    String content = context.content();
    TextMetrics text = textMetricsExtractor.extract(lines);
    StaticCodeMetrics metrics = staticMetrics(lines, content, text, context.profile());

    Score score = new Score();
    int codeLines = text.codeLines();

    if (metrics.sumCyclomatic() < 5 && metrics.maxNesting() < 2 && codeLines > 20) {
      score.ai(
          30,
          "low_complexity_pattern",
          "Low cyclomatic complexity (%d) for %d lines of code"
              .formatted(metrics.sumCyclomatic(), codeLines),
          PatternSeverity.HIGH,
          85);
    }
    if (metrics.keywordRatio() > 0.15) {
      score.ai(
          25,
          "high_keyword_density",
          "High keyword density (%s%%)".formatted(percent(metrics.keywordRatio())),
          PatternSeverity.HIGH,
          78);
    }
    if (metrics.avgCountLineCode() > 0 && metrics.avgCountLineCode() < 20) {
      double deviation = functionLengthDeviation(lines, context.profile());
      if (deviation < 5) {
        score.ai(
            20,
            "uniform_function_length",
            "Uniform function lengths (deviation: %s)".formatted(oneDecimal(deviation)),
            PatternSeverity.MEDIUM,
            72);
      }
    }

    double commentRatio = text.commentRatio();
    if (commentRatio > 0.25) {
      score.ai(
          25,
          "excessive_comments",
          "High comment ratio (%s%%)".formatted(percent(commentRatio)),
          PatternSeverity.HIGH,
          82);
    } else if (commentRatio < 0.05 && codeLines > 30) {
      score.ai(
          15,
          "minimal_comments",
          "Very few comments for %d lines of code".formatted(codeLines),
          PatternSeverity.MEDIUM,
          70);
    }

    int genericComments = countGenericComments(lines);
    if (genericComments > 3) {
      score.ai(
          30,
          "generic_comments",
          "%d generic template-style comments".formatted(genericComments),
          PatternSeverity.HIGH,
          88);
    }

    int genericNames = count(GENERIC_NAMES, content);
    if (genericNames > 5) {
      score.ai(
          28,
          "generic_naming",
          "%d generic variable names (data, result, ...)".formatted(genericNames),
          PatternSeverity.HIGH,
          82);
    } else if (genericNames == 0 && codeLines > 20) {
      score.human(18);
    }

    Indentation indentation = indentation(lines);
    if (indentation.perfect()) {
      score.ai(
          12,
          "perfect_indentation",
          "Every indentation is a multiple of four spaces",
          PatternSeverity.LOW,
          65);
    }

    int boilerplate = (int) BOILERPLATE.stream().filter(p -> p.matcher(content).find()).count();
    if (boilerplate > 2) {
      score.ai(
          15,
          "boilerplate_code",
          "%d boilerplate patterns detected".formatted(boilerplate),
          PatternSeverity.MEDIUM,
          70);
    }

    int repetitive = DuplicateWindows.scan(lines, duplicateMinLength).blocks();
    if (repetitive > 3) {
      score.ai(
          20,
          "repetitive_structures",
          "%d repeated code structures".formatted(repetitive),
          PatternSeverity.HIGH,
          80);
    }

    if (NARRATIVE_COMMENT.matcher(content).find()) {
      score.human(20);
    }
    if (DOMAIN_VOCABULARY.matcher(content).find()) {
      score.human(15);
    }
    if (REFACTOR_NOTE.matcher(content).find()) {
      score.human(25);
    }
    if (DEBUG_ARTIFACT.matcher(content).find()) {
      score.human(12);
    }

    for (ToolSignature signature : TOOL_SIGNATURES) {
      if (signature.pattern().matcher(content).find()) {
        int index = firstMatchingLine(signature.pattern(), lines);
        score.ai(
            new AuthorshipPattern(
                "ai_signature",
                "%s signature detected in code or comments".formatted(signature.tool()),
                PatternSeverity.HIGH,
                95,
                index >= 0 ? index + 1 : null,
                index >= 0 ? snippet(lines.get(index)) : null),
            60);
      }
    }

    int aiLikelihood = likelihood(score.aiPoints, score.humanPoints);
    AuthorshipIndicators indicators =
        new AuthorshipIndicators(
            indentation.consistency(),
            (int) Math.round(commentQuality(lines, text.commentLines())),
            (int) Math.round(namingQuality(content)),
            structureQuality(content),
            errorHandlingQuality(content));
    return new AuthorshipAnalysis(
        context.path(),
        aiLikelihood,
        100 - aiLikelihood,
        score.patterns,
        metrics,
        indicators,
        new LineMetadata(
            text.totalLines(), text.codeLines(), text.commentLines(), text.blankLines()));
  }

  static int likelihood(double aiPoints, double humanPoints) {
    if (aiPoints + humanPoints <= 0) {
      return UNINFORMED_LIKELIHOOD;
    }
    double share = aiPoints / (aiPoints + humanPoints * HUMAN_WEIGHT) * 100;
    return (int) Math.round(Math.min(100, share));
  }

  StaticCodeMetrics staticMetrics(
      List<String> lines, String content, TextMetrics text, LanguageProfile profile) {
    int declarations = 0;
    int functions = 0;
    int maxNesting = 0;
    int conditionalOperators = 0;
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      if (DECLARATION_LINE.matcher(line).find()) {
        declarations++;
      }
      if (profile.countFunctions(line) > 0) {
        functions++;
      }
      // per-line balance, not a running depth
      int delta = SourceLines.count(line, '{') - SourceLines.count(line, '}');
      maxNesting = Math.max(maxNesting, delta);
      conditionalOperators += count(CONDITIONAL_OPERATOR, line);
    }
    int nonBlank = text.nonBlankLines();
    double avgLines = functions > 0 ? (double) nonBlank / functions : 0.0;
    double operatorRatio =
        text.tokenCount() > 0 ? (double) conditionalOperators / text.tokenCount() : 0.0;
    return new StaticCodeMetrics(
        profile.countBranches(content),
        avgLines,
        declarations,
        functions,
        maxNesting,
        text.blankLines(),
        text.keywordRatio(),
        operatorRatio);
  }

  private static double functionLengthDeviation(List<String> lines, LanguageProfile profile) {
    List<FunctionSpans.Span> spans = FunctionSpans.find(lines, profile);
    if (spans.size() < 2) {
      return 0.0;
    }
    double mean = spans.stream().mapToInt(FunctionSpans.Span::length).average().orElse(0);
    double variance =
        spans.stream().mapToDouble(span -> Math.pow(span.length() - mean, 2)).sum() / spans.size();
    return Math.sqrt(variance);
  }

  private static int countGenericComments(List<String> lines) {
    int count = 0;
    for (String line : lines) {
      for (Pattern pattern : GENERIC_COMMENTS) {
        if (pattern.matcher(line).find()) {
          count++;
          break;
        }
      }
    }
    return count;
  }

  record Indentation(int consistency, boolean perfect) {}

  static Indentation indentation(List<String> lines) {
    int indented = 0;
    boolean allEven = true;
    boolean allQuad = true;
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      Matcher matcher = LEADING_WHITESPACE.matcher(line);
      int width = matcher.find() ? matcher.end() : 0;
      allEven &= width % 2 == 0;
      allQuad &= width % 4 == 0;
      indented++;
    }
    if (indented == 0) {
      return new Indentation(0, false);
    }
    return new Indentation(allEven ? 90 : 60, allQuad && indented > 10);
  }

  static double commentQuality(List<String> lines, int commentLines) {
    if (commentLines == 0) {
      return 50;
    }
    int meaningful = 0;
    for (String line : lines) {
      String trimmed = line.trim();
      if (!trimmed.startsWith("//") && !trimmed.startsWith("#")) {
        continue;
      }
      String comment = trimmed.substring(trimmed.startsWith("#") ? 1 : 2).trim();
      if (comment.length() > 20 && comment.matches(".*[.!?]$")) {
        meaningful++;
      }
    }
    return Math.min(100.0, (double) meaningful / commentLines * 100);
  }

  static double namingQuality(String content) {
    Matcher matcher = DECLARED_NAME.matcher(content);
    int total = 0;
    int descriptive = 0;
    while (matcher.find()) {
      total++;
      String name = matcher.group(1);
      if (name.length() > 5 && CAMEL_HUMP.matcher(name).find()) {
        descriptive++;
      }
    }
    return total == 0 ? 50 : (double) descriptive / total * 100;
  }

  static int structureQuality(String content) {
    int score = 50;
    if (HAS_FUNCTION.matcher(content).find()) {
      score += 20;
    }
    if (HAS_CLASS.matcher(content).find()) {
      score += 15;
    }
    if (HAS_MODULES.matcher(content).find()) {
      score += 15;
    }
    return Math.min(100, score);
  }

  static int errorHandlingQuality(String content) {
    int score = 0;
    if (HAS_TRY.matcher(content).find()) {
      score += 40;
    }
    if (HAS_ERROR_CHECK.matcher(content).find()) {
      score += 30;
    }
    if (HAS_THROW.matcher(content).find()) {
      score += 30;
    }
    return score;
  }

  private static int count(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  private static int firstMatchingLine(Pattern pattern, List<String> lines) {
    for (int i = 0; i < lines.size(); i++) {
      if (pattern.matcher(lines.get(i)).find()) {
        return i;
      }
    }
    return -1;
  }

  private static String snippet(String line) {
    String trimmed = line.trim();
    return trimmed.length() > SNIPPET_LENGTH ? trimmed.substring(0, SNIPPET_LENGTH) : trimmed;
  }

  private static String percent(double ratio) {
    return oneDecimal(ratio * 100);
  }

  private static String oneDecimal(double value) {
    return String.format(Locale.ROOT, "%.1f", value);
  }

  private static final class Score {
    private double aiPoints;
    private double humanPoints;
    private final List<AuthorshipPattern> patterns = new ArrayList<>();

    void ai(int points, String type, String description, PatternSeverity severity, int confidence) {
      ai(AuthorshipPattern.of(type, description, severity, confidence), points);
    }

    void ai(AuthorshipPattern pattern, int points) {
      aiPoints += points;
      patterns.add(pattern);
    }

    void human(int points) {
      humanPoints += points;
    }
  }
}
