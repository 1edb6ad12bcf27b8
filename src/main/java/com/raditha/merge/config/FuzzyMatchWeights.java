package com.raditha.merge.config;

/**
 * Weights for combining name and parameter similarity when pairing renamed
 * definitions.
 *
 * @param nameWeight   Weight for name similarity (0.0-1.0)
 * @param paramsWeight Weight for parameter similarity (0.0-1.0)
 */
public record FuzzyMatchWeights(double nameWeight, double paramsWeight) {

    /**
     * Validate weights sum to 1.0.
     */
    public FuzzyMatchWeights {
        if (nameWeight < 0.0 || paramsWeight < 0.0) {
            throw new IllegalArgumentException("Weights cannot be negative");
        }
        double sum = nameWeight + paramsWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException(
                    String.format("Weights must sum to 1.0, got %.3f", sum));
        }
    }

    /**
     * Default weights: names matter more than parameters.
     */
    public static FuzzyMatchWeights balanced() {
        return new FuzzyMatchWeights(0.7, 0.3);
    }

    /**
     * Calculate combined score from the two similarities.
     */
    public double combine(double nameSimilarity, double paramSimilarity) {
        return (nameSimilarity * nameWeight) + (paramSimilarity * paramsWeight);
    }
}
