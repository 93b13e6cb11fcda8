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

package com.amazon.rootcauseforest;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.rootcauseforest.anomalydetection.AnomalyDetector;
import com.amazon.rootcauseforest.anomalydetection.AnomalyResult;
import com.amazon.rootcauseforest.anomalydetection.RecordFilter;
import com.amazon.rootcauseforest.anomalydetection.ScoredRecord;
import com.amazon.rootcauseforest.config.AnalysisConfig;
import com.amazon.rootcauseforest.config.TrainingFailurePolicy;
import com.amazon.rootcauseforest.correlation.TimeCorrelator;
import com.amazon.rootcauseforest.feature.CategoricalVocabulary;
import com.amazon.rootcauseforest.feature.FeatureEngineer;
import com.amazon.rootcauseforest.feature.FeatureVector;
import com.amazon.rootcauseforest.model.EnrichedRecord;
import com.amazon.rootcauseforest.model.LogEvent;
import com.amazon.rootcauseforest.model.MetricSample;
import com.amazon.rootcauseforest.report.Report;
import com.amazon.rootcauseforest.report.ReportBuilder;
import com.amazon.rootcauseforest.rootcause.RCARecord;
import com.amazon.rootcauseforest.rootcause.RootCauseAggregator;
import com.amazon.rootcauseforest.suggestion.SuggestionEngine;

/**
 * Runs one batch analysis: correlation of log events with metrics, filtering,
 * feature construction, anomaly detection, root-cause aggregation and report
 * assembly. An analyzer holds no state between runs and performs no I/O.
 */
@Slf4j
@Getter
public class RootCauseAnalyzer {

    private final AnalysisConfig config;
    private final TimeCorrelator correlator;
    private final RecordFilter filter;
    private final FeatureEngineer featureEngineer;
    private final AnomalyDetector detector;
    private final RootCauseAggregator aggregator;
    private final ReportBuilder reportBuilder;

    public RootCauseAnalyzer(AnalysisConfig config) {
        this(config, new AnomalyDetector(config));
    }

    RootCauseAnalyzer(AnalysisConfig config, AnomalyDetector detector) {
        this.config = checkNotNull(config, "config must not be null");
        this.detector = checkNotNull(detector, "detector must not be null");
        correlator = new TimeCorrelator(config.getJoinTolerance());
        filter = new RecordFilter(config.getIgnoreMessages());
        featureEngineer = new FeatureEngineer(config.getThresholds());
        aggregator = new RootCauseAggregator(new SuggestionEngine());
        reportBuilder = new ReportBuilder(config.getTopErrorsLimit());
    }

    /**
     * @param events  parsed log events
     * @param samples parsed metric samples, possibly empty
     * @return the report of the run
     * @throws EmptyInputException      if there are no log events
     * @throws MalformedRecordException if an event lacks its service or trace id,
     *                                  or a metric sample is invalid
     * @throws ModelTrainingException   if the forest cannot be trained and the
     *                                  training failure policy is
     *                                  {@link TrainingFailurePolicy#ABORT}
     */
    public Report analyze(List<LogEvent> events, List<MetricSample> samples) {
        if (events == null || events.isEmpty()) {
            throw new EmptyInputException("no log events to analyze");
        }
        List<EnrichedRecord> records = correlator.correlate(events,
                (samples == null) ? Collections.emptyList() : samples);
        CategoricalVocabulary services = CategoricalVocabulary.ofServices(records);

        List<EnrichedRecord> candidates = filter.filter(records);
        log.info("{} of {} records remain after filtering", candidates.size(), records.size());
        if (candidates.isEmpty()) {
            log.info("all records are informational, nothing to score");
            return Report.empty();
        }

        List<FeatureVector> features = featureEngineer.featurize(candidates, services);
        List<ScoredRecord> scored = detect(candidates, features);
        List<RCARecord> rcaRecords = aggregator.aggregate(scored, records);
        return reportBuilder.build(scored, rcaRecords);
    }

    private List<ScoredRecord> detect(List<EnrichedRecord> candidates, List<FeatureVector> features) {
        try {
            return detector.detect(candidates, features);
        } catch (ModelTrainingException e) {
            if (config.getTrainingFailurePolicy() == TrainingFailurePolicy.ABORT) {
                throw e;
            }
            log.warn("model training failed, reporting all {} records as normal", candidates.size(), e);
            List<ScoredRecord> normal = new ArrayList<>(candidates.size());
            for (int i = 0; i < candidates.size(); i++) {
                normal.add(new ScoredRecord(candidates.get(i), features.get(i), new AnomalyResult(0.0, false)));
            }
            return normal;
        }
    }
}
