package sid.cli;

import java.nio.file.Path;
import java.util.List;
import sid.policy.Policy;
import sid.stability.StabilityAnalyzer;

/** Options shared by the commands; each command reads the subset it needs. */
record CliOptions(
    Path packagePath,
    String stateId,
    String diagramId,
    double tolerance,
    boolean requireAll,
    String expr,
    Path diagramPath,
    String pattern,
    String replacement,
    String ruleId,
    boolean fixpoint,
    Path requestPath,
    Policy policy,
    Integer horizonCap,
    Long seed,
    List<String> ruleIds) {

  static final String DEFAULT_RULE_ID = "cli_rule";

  CliOptions {
    if (tolerance < 0.0) {
      throw new IllegalArgumentException("tolerance must be non-negative");
    }
    ruleId = ruleId == null || ruleId.isBlank() ? DEFAULT_RULE_ID : ruleId;
    ruleIds = ruleIds == null ? List.of() : List.copyOf(ruleIds);
  }

  boolean hasExpr() {
    return expr != null && !expr.isBlank();
  }

  boolean hasDiagramPath() {
    return diagramPath != null;
  }

  Path requirePackage() {
    if (packagePath == null) {
      throw new IllegalArgumentException("--package is required");
    }
    return packagePath;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path packagePath;
    private String stateId;
    private String diagramId;
    private double tolerance = StabilityAnalyzer.DEFAULT_TOLERANCE;
    private boolean requireAll;
    private String expr;
    private Path diagramPath;
    private String pattern;
    private String replacement;
    private String ruleId;
    private boolean fixpoint;
    private Path requestPath;
    private Policy policy;
    private Integer horizonCap;
    private Long seed;
    private List<String> ruleIds = List.of();

    Builder packagePath(Path packagePath) {
      this.packagePath = packagePath;
      return this;
    }

    Builder stateId(String stateId) {
      this.stateId = stateId;
      return this;
    }

    Builder diagramId(String diagramId) {
      this.diagramId = diagramId;
      return this;
    }

    Builder tolerance(double tolerance) {
      this.tolerance = tolerance;
      return this;
    }

    Builder requireAll(boolean requireAll) {
      this.requireAll = requireAll;
      return this;
    }

    Builder expr(String expr) {
      this.expr = expr;
      return this;
    }

    Builder diagramPath(Path diagramPath) {
      this.diagramPath = diagramPath;
      return this;
    }

    Builder pattern(String pattern) {
      this.pattern = pattern;
      return this;
    }

    Builder replacement(String replacement) {
      this.replacement = replacement;
      return this;
    }

    Builder ruleId(String ruleId) {
      this.ruleId = ruleId;
      return this;
    }

    Builder fixpoint(boolean fixpoint) {
      this.fixpoint = fixpoint;
      return this;
    }

    Builder requestPath(Path requestPath) {
      this.requestPath = requestPath;
      return this;
    }

    Builder policy(Policy policy) {
      this.policy = policy;
      return this;
    }

    Builder horizonCap(Integer horizonCap) {
      this.horizonCap = horizonCap;
      return this;
    }

    Builder seed(Long seed) {
      this.seed = seed;
      return this;
    }

    Builder ruleIds(List<String> ruleIds) {
      if (ruleIds != null) {
        this.ruleIds = List.copyOf(ruleIds);
      }
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          packagePath,
          stateId,
          diagramId,
          tolerance,
          requireAll,
          expr,
          diagramPath,
          pattern,
          replacement,
          ruleId,
          fixpoint,
          requestPath,
          policy,
          horizonCap,
          seed,
          ruleIds);
    }
  }
}
