package sid.engine;

import sid.field.MixerConfig;

/**
 * Session sizing: cells per field, the conserved budget and the mixer tuning.
 *
 * @param numNodes cells in each of the I, N and U fields
 * @param totalMass conserved budget {@code C}, split evenly across the fields at start
 * @param mixer mixer tuning
 */
public record EngineConfig(int numNodes, double totalMass, MixerConfig mixer) {
  public static final int DEFAULT_NUM_NODES = 100;
  public static final double DEFAULT_TOTAL_MASS = 1000.0;

  public static EngineConfig defaults() {
    return new EngineConfig(DEFAULT_NUM_NODES, DEFAULT_TOTAL_MASS, MixerConfig.defaults());
  }

  public static EngineConfig normalize(EngineConfig config) {
    if (config == null) {
      return defaults();
    }
    int numNodes = config.numNodes() > 0 ? config.numNodes() : DEFAULT_NUM_NODES;
    double totalMass =
        Double.isFinite(config.totalMass()) && config.totalMass() > 0.0
            ? config.totalMass()
            : DEFAULT_TOTAL_MASS;
    return new EngineConfig(numNodes, totalMass, MixerConfig.normalize(config.mixer()));
  }
}
