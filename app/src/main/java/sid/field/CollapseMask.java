package sid.field;

import java.util.Arrays;

/** Pair of inclusion/exclusion masks; valid when every entry is in [0,1] and {@code I + N <= 1}. */
public final class CollapseMask {
  private final double[] maskI;
  private final double[] maskN;

  public CollapseMask(int length) {
    this(new double[length], new double[length]);
  }

  public CollapseMask(double[] maskI, double[] maskN) {
    this.maskI = maskI.clone();
    this.maskN = maskN.clone();
  }

  public int length() {
    return maskI.length;
  }

  public double inclusion(int index) {
    return maskI[index];
  }

  public double exclusion(int index) {
    return maskN[index];
  }

  public void set(int index, double inclusion, double exclusion) {
    maskI[index] = inclusion;
    maskN[index] = exclusion;
  }

  public boolean isValid() {
    if (maskI.length != maskN.length) {
      return false;
    }
    for (int i = 0; i < maskI.length; i++) {
      if (!inUnitRange(maskI[i]) || !inUnitRange(maskN[i]) || maskI[i] + maskN[i] > 1.0) {
        return false;
      }
    }
    return true;
  }

  private static boolean inUnitRange(double value) {
    return value >= 0.0 && value <= 1.0;
  }

  @Override
  public String toString() {
    return "CollapseMask[I=" + Arrays.toString(maskI) + ", N=" + Arrays.toString(maskN) + "]";
  }
}
