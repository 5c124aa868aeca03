package com.prpulse.pipeline.metrics;

/**
 * Weights of the contributor ranking score. Authoring counts more than reviewing.
 */
public record ContributionWeights(int pullRequestWeight, int reviewWeight) {

    public static final ContributionWeights DEFAULT = new ContributionWeights(3, 1);

    public long score(long prsCreated, long reviewsGiven) {
        return prsCreated * pullRequestWeight + reviewsGiven * reviewWeight;
    }
}
