package sid.rewrite;

import com.google.gson.JsonObject;
import java.util.List;
import java.util.Objects;
import sid.ast.ExprParser;
import sid.ast.ParseException;

/**
 * Rule as written: pattern and replacement text plus optional metadata and CRF preconditions
 * ({@code admissible}, {@code no_hard_conflict}).
 */
public record RewriteRule(
    String id,
    String pattern,
    String replacement,
    JsonObject metadata,
    List<String> preconditions) {

  public RewriteRule {
    Objects.requireNonNull(id, "id");
    metadata = metadata == null ? new JsonObject() : metadata.deepCopy();
    preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
  }

  public static RewriteRule of(String id, String pattern, String replacement) {
    return new RewriteRule(id, pattern, replacement, null, List.of());
  }

  public CompiledRule compile() throws ParseException {
    if (pattern == null || pattern.isBlank()) {
      throw new ParseException("Rule " + id + " has no pattern", 0);
    }
    if (replacement == null || replacement.isBlank()) {
      throw new ParseException("Rule " + id + " has no replacement", 0);
    }
    return new CompiledRule(this, ExprParser.parse(pattern), ExprParser.parse(replacement));
  }
}
