package sid.crf;

import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.model.Diagram;

/** Dispatches conflicts to resolution strategies; strategies record their effect on the state. */
public final class ConflictResolver {
  private static final Logger LOG = LoggerFactory.getLogger(ConflictResolver.class);

  /** Resolves by conflict type; unknown types halt. */
  public ConflictResolution resolve(
      String conflictType, Conflict conflict, SidState state, Diagram diagram) {
    Objects.requireNonNull(state, "state");
    LOG.info("CRF: resolving conflict type '{}'", conflictType);
    return ConflictType.fromName(conflictType)
        .map(type -> apply(type.strategy(), conflict, state))
        .orElseGet(
            () -> {
              LOG.warn("CRF: unknown conflict type '{}', halting", conflictType);
              return apply(
                  ResolutionStrategy.HALT,
                  Conflict.hardViolation("Unknown conflict type: " + conflictType),
                  state);
            });
  }

  /** Resolves with a named strategy; unknown names halt. */
  public ConflictResolution resolveWith(
      String strategyName, Conflict conflict, SidState state, Diagram diagram) {
    Objects.requireNonNull(state, "state");
    return ResolutionStrategy.fromName(strategyName)
        .map(strategy -> apply(strategy, conflict, state))
        .orElseGet(
            () -> {
              LOG.warn("CRF: unknown strategy '{}', halting", strategyName);
              return apply(
                  ResolutionStrategy.HALT,
                  Conflict.hardViolation("Unknown strategy: " + strategyName),
                  state);
            });
  }

  private ConflictResolution apply(ResolutionStrategy strategy, Conflict conflict, SidState state) {
    Conflict details = Objects.requireNonNull(conflict, "conflict");
    return switch (strategy) {
      case ATTENUATE -> {
        String constraintId = details.constraintId() == null ? "unknown" : details.constraintId();
        state.attenuate(constraintId);
        LOG.info("CRF: attenuating constraint {}", constraintId);
        yield new ConflictResolution(
            strategy,
            true,
            "Attenuated soft constraint " + constraintId,
            Map.of("constraint_id", constraintId));
      }
      case DEFER -> {
        state.defer(details);
        yield new ConflictResolution(
            strategy,
            true,
            "Deferred conflict of type " + nullToUnknown(details.type()) + " to next compartment",
            Map.of("type", nullToUnknown(details.type())));
      }
      case PARTITION -> {
        state.partition(details.elements());
        yield new ConflictResolution(
            strategy,
            true,
            "Partitioned " + details.elements().size()
                + " conflicting elements into separate compartments",
            Map.of("elements", details.elements()));
      }
      case ESCALATE -> {
        state.escalate(details);
        String scope = details.scope() == null ? "local" : details.scope();
        yield new ConflictResolution(
            strategy,
            true,
            "Escalated " + scope + " conflict to global scope",
            Map.of("scope", scope));
      }
      case BIFURCATE -> {
        state.bifurcate(details.choices());
        yield new ConflictResolution(
            strategy,
            true,
            "Bifurcated state into " + details.choices().size() + " parallel branches",
            Map.of("choices", details.choices()));
      }
      case HALT -> {
        String reason =
            details.reason() == null ? "Unresolvable hard constraint violation" : details.reason();
        state.halt(reason);
        yield new ConflictResolution(
            strategy, false, "Halted execution: " + reason, Map.of("reason", reason));
      }
    };
  }

  private static String nullToUnknown(String value) {
    return value == null ? "unknown" : value;
  }
}
