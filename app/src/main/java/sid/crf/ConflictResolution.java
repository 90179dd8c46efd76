package sid.crf;

import java.util.Map;
import java.util.Objects;

/** What a strategy did. Only {@link ResolutionStrategy#HALT} reports {@code success == false}. */
public record ConflictResolution(
    ResolutionStrategy action, boolean success, String message, Map<String, Object> data) {

  public ConflictResolution {
    Objects.requireNonNull(action, "action");
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  public String actionName() {
    return action.wireName();
  }
}
