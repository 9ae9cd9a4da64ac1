package org.unchartedlands.simulation.random;

/**
 * Source of randomness for stochastic simulation steps such as migration trials.
 * Implementations should be pure with respect to their seed so that runs can be
 * reproduced, and support derivation of independent child streams.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Creates a derived provider that is deterministically based on this provider's seed and
     * the given scope/key. Use this to give each settlement its own sub-stream.
     *
     * @param scope a stable, descriptive scope name (e.g., "population")
     * @param key a stable key (e.g., the settlement id)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, String key);
}
