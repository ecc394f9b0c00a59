package com.pfesentinel.core.ml;

import smile.anomaly.IsolationForest;

/**
 * {@link OutlierScorer} backed by Smile's isolation forest, fit fresh on each
 * batch.
 */
public class IsolationForestScorer implements OutlierScorer {

    private final int trees;
    private final double subsample;

    /**
     * @param trees     number of isolation trees
     * @param subsample fraction of the batch each tree is grown on, in (0, 1)
     */
    public IsolationForestScorer(int trees, double subsample) {
        if (trees < 1) {
            throw new IllegalArgumentException("trees must be >= 1, got: " + trees);
        }
        if (subsample <= 0 || subsample >= 1) {
            throw new IllegalArgumentException("subsample must be in (0, 1), got: " + subsample);
        }
        this.trees = trees;
        this.subsample = subsample;
    }

    @Override
    public double[] score(double[][] features) {
        int subsampleSize = Math.max(2, (int) Math.round(features.length * subsample));
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(subsampleSize) / Math.log(2)));
        IsolationForest forest = IsolationForest.fit(features, trees, maxDepth, subsample, 0);
        return forest.score(features);
    }

    public int getTrees() {
        return trees;
    }

    public double getSubsample() {
        return subsample;
    }
}
