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

package com.amazon.rootcauseforest.state;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * A POJO holding the state of a
 * {@link com.amazon.rootcauseforest.rootcause.RCARecord}.
 */
@Data
public class RCARecordState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String traceId;
    private String rootCauseService;
    /**
     * ISO-8601 instant of the root-cause event
     */
    private String timestamp;
    private String message;
    private double anomalyScore;
    private Map<String, Double> metricSnapshot;
    private List<String> suggestions;
    /**
     * services in order of first appearance in the trace
     */
    private List<String> affectedServices;
}
