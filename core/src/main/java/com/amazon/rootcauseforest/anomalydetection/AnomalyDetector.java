/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.rootcauseforest.anomalydetection;

import static com.amazon.rootcauseforest.CommonUtils.checkArgument;
import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.amazon.rootcauseforest.IsolationForest;
import com.amazon.rootcauseforest.ModelTrainingException;
import com.amazon.rootcauseforest.config.AnalysisConfig;
import com.amazon.rootcauseforest.feature.FeatureVector;
import com.amazon.rootcauseforest.model.EnrichedRecord;
import com.amazon.rootcauseforest.statistics.Standardizer;

/**
 * Scores a batch of featurized records with an isolation forest trained on the
 * same batch. The feature matrix is standardized column-wise first. The
 * {@code round(contamination * N)} records with the highest scores are flagged
 * as anomalies, and at least one when the scores are not all equal; among equal
 * scores the earlier record is flagged first.
 * <p>
 * A detector owns one forest and retrains it on every batch, so a detector
 * must not score two batches concurrently.
 */
@Slf4j
public class AnomalyDetector {

    private final double contamination;
    private final IsolationForest forest;

    public AnomalyDetector(AnalysisConfig config) {
        this(config.getContamination(),
                IsolationForest.builder().numberOfTrees(config.getNumberOfTrees()).sampleSize(config.getSampleSize())
                        .randomSeed(config.getRandomSeed())
                        .parallelExecutionEnabled(config.isParallelExecutionEnabled())
                        .threadPoolSize(config.getThreadPoolSize()));
    }

    public AnomalyDetector(double contamination, IsolationForest.Builder forestBuilder) {
        checkArgument(contamination > 0 && contamination <= 0.5, "contamination must be in (0, 0.5]");
        this.contamination = contamination;
        this.forest = checkNotNull(forestBuilder, "forestBuilder must not be null").build();
    }

    /**
     * @param records  the records to score
     * @param features the feature vectors of the records, in the same order
     * @return one scored record per input record, in input order
     * @throws ModelTrainingException if the forest cannot be trained on the
     *                                features
     */
    public List<ScoredRecord> detect(List<EnrichedRecord> records, List<FeatureVector> features) {
        checkNotNull(records, "records must not be null");
        checkNotNull(features, "features must not be null");
        checkArgument(records.size() == features.size(), "every record needs exactly one feature vector");
        if (records.isEmpty()) {
            return new ArrayList<>();
        }

        double[][] matrix = new double[features.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = features.get(i).toArray();
        }
        double[] scores = score(matrix);
        boolean[] flags = flag(scores, contamination);

        List<ScoredRecord> scored = new ArrayList<>(records.size());
        int anomalies = 0;
        for (int i = 0; i < scores.length; i++) {
            scored.add(new ScoredRecord(records.get(i), features.get(i), new AnomalyResult(scores[i], flags[i])));
            if (flags[i]) {
                anomalies++;
                log.debug("anomaly in service {} trace {} with score {}", records.get(i).getService(),
                        records.get(i).getTraceId(), scores[i]);
            }
        }
        log.info("scored {} records, flagged {} anomalies at contamination {}", scores.length, anomalies,
                contamination);
        return scored;
    }

    /**
     * @param matrix a raw feature matrix
     * @return the anomaly score of each row
     * @throws ModelTrainingException if the forest cannot be trained
     */
    public double[] score(double[][] matrix) {
        double[][] standardized;
        try {
            standardized = Standardizer.fit(matrix).transform(matrix);
        } catch (IllegalArgumentException e) {
            throw new ModelTrainingException("cannot standardize the feature matrix", e);
        }
        forest.fit(standardized);
        return forest.getAnomalyScores(standardized);
    }

    /**
     * @param n             number of scored records
     * @param contamination expected proportion of anomalies
     * @return round(contamination * n), half up
     */
    public static int anomalyCount(int n, double contamination) {
        return (int) Math.min(n, Math.round(contamination * n));
    }

    /**
     * Flags the records with the highest scores. A batch whose scores differ
     * always flags its highest-scoring record, however small the batch.
     *
     * @param scores        anomaly scores
     * @param contamination expected proportion of anomalies
     * @return the flag of each record
     */
    public static boolean[] flag(double[] scores, double contamination) {
        Integer[] order = new Integer[scores.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        // stable sort keeps earlier records first among equal scores
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> scores[i]).reversed());
        boolean[] flags = new boolean[scores.length];
        int count = anomalyCount(scores.length, contamination);
        if (count == 0 && scores.length > 0 && scores[order[0]] > scores[order[scores.length - 1]]) {
            count = 1;
        }
        for (int k = 0; k < count; k++) {
            flags[order[k]] = true;
        }
        return flags;
    }

    public double getContamination() {
        return contamination;
    }

    public IsolationForest getForest() {
        return forest;
    }
}
