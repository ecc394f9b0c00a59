package com.pfesentinel.core.ml;

/**
 * Fits an unsupervised model on a batch and scores the same batch.
 * <p>
 * Implementations keep no state between calls. Higher scores mean more
 * anomalous.
 * </p>
 */
public interface OutlierScorer {

    /**
     * @param features one row per point
     * @return one score per row
     */
    double[] score(double[][] features);
}
