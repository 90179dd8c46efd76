package sid.crf;

import sid.model.Node;

/** Per-operator well-formedness rules shared by predicates and diagnostics. */
public final class OperatorRules {
  public static final String TARGET_COMPARTMENT = "target_compartment";

  private OperatorRules() {}

  public static boolean collapseMissingIrreversible(Node node) {
    return switch (node.op()) {
      case O -> !node.irreversible();
      case P, S_PLUS, S_MINUS, C, T, ATOM -> false;
    };
  }

  public static boolean transportMissingTarget(Node node) {
    return switch (node.op()) {
      case T -> node.metaString(TARGET_COMPARTMENT).isEmpty();
      case P, S_PLUS, S_MINUS, O, C, ATOM -> false;
    };
  }

  public static boolean hasTransportTarget(Node node) {
    return switch (node.op()) {
      case T -> node.metaString(TARGET_COMPARTMENT).isPresent();
      case P, S_PLUS, S_MINUS, O, C, ATOM -> false;
    };
  }
}
