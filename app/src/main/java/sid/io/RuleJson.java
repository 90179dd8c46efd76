package sid.io;

import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.List;
import sid.rewrite.RewriteRule;

/**
 * Rewrite rule JSON: {@code {id, pattern | pattern_expr, replacement | replacement_expr,
 * metadata?, preconditions?}}. Text is kept as written and parsed when the rule is compiled.
 */
public final class RuleJson {
  private RuleJson() {}

  public static RewriteRule read(JsonObject obj) {
    String id = JsonFields.requireString(obj, "id", "Rewrite rule");
    return new RewriteRule(
        id,
        JsonFields.firstString(obj, "pattern", "pattern_expr"),
        JsonFields.firstString(obj, "replacement", "replacement_expr"),
        JsonFields.object(obj, "metadata"),
        JsonFields.strings(obj, "preconditions"));
  }

  public static List<RewriteRule> readAll(List<JsonObject> objects) {
    List<RewriteRule> rules = new ArrayList<>(objects.size());
    for (JsonObject obj : objects) {
      rules.add(read(obj));
    }
    return rules;
  }

  public static JsonObject toJsonObject(RewriteRule rule) {
    JsonObject obj = new JsonObject();
    obj.addProperty("id", rule.id());
    obj.addProperty("pattern", rule.pattern());
    obj.addProperty("replacement", rule.replacement());
    if (rule.metadata().size() > 0) {
      obj.add("metadata", rule.metadata().deepCopy());
    }
    if (!rule.preconditions().isEmpty()) {
      obj.add("preconditions", JsonFields.array(rule.preconditions()));
    }
    return obj;
  }
}
