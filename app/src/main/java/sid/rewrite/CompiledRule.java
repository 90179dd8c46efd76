package sid.rewrite;

import java.util.Objects;
import sid.ast.Expr;

/** A {@link RewriteRule} with parsed pattern and replacement. */
public record CompiledRule(RewriteRule rule, Expr pattern, Expr replacement) {

  public CompiledRule {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(replacement, "replacement");
  }

  public String id() {
    return rule.id();
  }
}
