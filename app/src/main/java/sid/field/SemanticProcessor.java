package sid.field;

import java.util.Arrays;
import java.util.Objects;

/** One discretised scalar field with a fixed length and an I, N or U role. */
public final class SemanticProcessor {
  private final Role role;
  private final double[] field;
  private final double capacity;
  private long step;
  private SemanticMetrics metrics = SemanticMetrics.empty();

  /** Field of {@code length} entries holding {@code totalMass} spread uniformly. */
  public SemanticProcessor(Role role, int length, double totalMass) {
    this(role, length, totalMass, totalMass);
  }

  public SemanticProcessor(Role role, int length, double totalMass, double capacity) {
    this.role = Objects.requireNonNull(role, "role");
    if (length < 0) {
      throw new IllegalArgumentException("length must be non-negative: " + length);
    }
    if (!(totalMass >= 0.0) || Double.isInfinite(totalMass)) {
      throw new IllegalArgumentException("totalMass must be finite and non-negative: " + totalMass);
    }
    if (length == 0 && totalMass != 0.0) {
      throw new IllegalArgumentException("an empty field cannot hold mass " + totalMass);
    }
    if (capacity < 0.0) {
      throw new IllegalArgumentException("capacity must be non-negative: " + capacity);
    }
    this.field = new double[length];
    this.capacity = capacity;
    if (length > 0) {
      Arrays.fill(field, totalMass / length);
    }
  }

  public Role role() {
    return role;
  }

  public int length() {
    return field.length;
  }

  public double capacity() {
    return capacity;
  }

  public long step() {
    return step;
  }

  public SemanticMetrics metrics() {
    return metrics;
  }

  public double get(int index) {
    return field[index];
  }

  /** Snapshot of the field entries. */
  public double[] values() {
    return field.clone();
  }

  public double totalMass() {
    double sum = 0.0;
    for (double value : field) {
      sum += value;
    }
    return sum;
  }

  /** Adds {@code amount} to every entry; total mass grows by {@code amount * length}. */
  public void addUniform(double amount) {
    if (!(amount >= 0.0)) {
      throw new IllegalArgumentException("addUniform amount must be non-negative: " + amount);
    }
    for (int i = 0; i < field.length; i++) {
      field[i] += amount;
    }
  }

  public void scaleAll(double factor) {
    if (!(factor >= 0.0)) {
      throw new IllegalArgumentException("scaleAll factor must be non-negative: " + factor);
    }
    for (int i = 0; i < field.length; i++) {
      field[i] *= factor;
    }
  }

  /**
   * Moves {@code entry[i] * clamp(mask[i], 0, 1) * rate} from this field to {@code target} at
   * every index. Mask values outside [0,1] are clamped, not rejected.
   *
   * @return total mass moved
   */
  public double routeTo(SemanticProcessor target, double[] mask, double rate) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(mask, "mask");
    if (target == this) {
      throw new IllegalArgumentException("routeTo target must differ from the source");
    }
    if (mask.length != field.length || target.field.length != field.length) {
      throw new IllegalArgumentException(
          "routeTo length mismatch: field=" + field.length + " mask=" + mask.length
              + " target=" + target.field.length);
    }
    if (!(rate >= 0.0 && rate <= 1.0)) {
      throw new IllegalArgumentException("routeTo rate must be in [0,1]: " + rate);
    }
    double moved = 0.0;
    for (int i = 0; i < field.length; i++) {
      double delta = field[i] * clamp01(mask[i]) * rate;
      field[i] -= delta;
      target.field[i] += delta;
      moved += delta;
    }
    return moved;
  }

  /**
   * Removes {@code mask[i] * amount} from each entry, never below zero. Only valid on the U field.
   *
   * @return total mass removed
   */
  public double applyCollapse(double[] mask, double amount) {
    requireUndecided("applyCollapse");
    Objects.requireNonNull(mask, "mask");
    if (mask.length != field.length) {
      throw new IllegalArgumentException("applyCollapse mask length mismatch");
    }
    double removed = 0.0;
    for (int i = 0; i < field.length; i++) {
      if (mask[i] < 0.0 || mask[i] > 1.0) {
        throw new IllegalArgumentException("applyCollapse mask values must be in [0,1]");
      }
      double delta = Math.min(Math.max(mask[i] * amount, 0.0), field[i]);
      field[i] -= delta;
      removed += delta;
    }
    return removed;
  }

  /**
   * Applies {@code U'(x) = U(x) - alpha * (M_I(x) + M_N(x)) * U(x)}; alpha above 1 is treated as
   * 1.
   *
   * @return total mass removed
   */
  public double applyCollapseMask(CollapseMask mask, double alpha) {
    requireUndecided("applyCollapseMask");
    Objects.requireNonNull(mask, "mask");
    if (mask.length() != field.length) {
      throw new IllegalArgumentException("applyCollapseMask mask length mismatch");
    }
    if (!mask.isValid()) {
      throw new IllegalArgumentException("applyCollapseMask requires a valid mask: " + mask);
    }
    if (!(alpha >= 0.0)) {
      throw new IllegalArgumentException("applyCollapseMask alpha must be non-negative");
    }
    double effective = Math.min(alpha, 1.0);
    double removed = 0.0;
    for (int i = 0; i < field.length; i++) {
      double weight = clamp01(mask.inclusion(i) + mask.exclusion(i));
      double delta = Math.min(effective * weight * field[i], field[i]);
      field[i] -= delta;
      removed += delta;
    }
    return removed;
  }

  /** Recomputes {@link #metrics()} and advances the step counter. */
  public void commitStep() {
    metrics = computeMetrics();
    step++;
  }

  /** Pairwise flux between neighbouring entries; conserves the field total. */
  void diffuse(double rate) {
    if (field.length < 2 || rate <= 0.0) {
      return;
    }
    double[] snapshot = field.clone();
    for (int i = 0; i + 1 < snapshot.length; i++) {
      double flux = rate * (snapshot[i] - snapshot[i + 1]);
      field[i] -= flux;
      field[i + 1] += flux;
    }
  }

  /** Removes {@code amount} in proportion to each entry's share of the total. */
  double[] withdrawProportionally(double amount) {
    double total = totalMass();
    double[] withdrawn = new double[field.length];
    if (total <= 0.0 || amount <= 0.0) {
      return withdrawn;
    }
    double fraction = Math.min(amount / total, 1.0);
    for (int i = 0; i < field.length; i++) {
      withdrawn[i] = field[i] * fraction;
      field[i] -= withdrawn[i];
    }
    return withdrawn;
  }

  void deposit(int index, double amount) {
    field[index] += amount;
  }

  private void requireUndecided(String operation) {
    if (role != Role.U) {
      throw new IllegalStateException(operation + " requires role U, was " + role);
    }
  }

  private SemanticMetrics computeMetrics() {
    if (field.length == 0) {
      return SemanticMetrics.empty();
    }
    double sum = 0.0;
    double sumSq = 0.0;
    double div = 0.0;
    for (int i = 0; i < field.length; i++) {
      sum += field[i];
      sumSq += field[i] * field[i];
      if (i > 0) {
        div += Math.abs(field[i] - field[i - 1]);
      }
    }
    double load = capacity > 0.0 ? sum / capacity : 1.0;
    double mean = sum / field.length;
    double variance = Math.max(sumSq / field.length - mean * mean, 0.0);
    double divergence = field.length > 1 ? div / (field.length - 1) : 0.0;
    return new SemanticMetrics(1.0 - clamp01(load), 1.0 / (1.0 + variance), divergence);
  }

  private static double clamp01(double value) {
    if (!(value > 0.0)) {
      return 0.0;
    }
    return Math.min(value, 1.0);
  }

  @Override
  public String toString() {
    return "SemanticProcessor[" + role + ", length=" + field.length + ", mass=" + totalMass() + "]";
  }
}
