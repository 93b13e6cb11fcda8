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

package com.amazon.rootcauseforest.feature;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import com.amazon.rootcauseforest.model.EnrichedRecord;

/**
 * Integer codes for the distinct values of a categorical column. Codes are
 * assigned in sorted order of the values, so the table depends only on the set
 * of values and not on the order in which they were observed. The table is
 * built once per analysis and handed to the feature engineer explicitly.
 */
@EqualsAndHashCode
@ToString
public class CategoricalVocabulary {

    /**
     * Code of a value that is not in the table.
     */
    public static final int UNKNOWN_CODE = -1;

    private final Map<String, Integer> codes;

    private CategoricalVocabulary(Map<String, Integer> codes) {
        this.codes = Collections.unmodifiableMap(codes);
    }

    public static CategoricalVocabulary of(Collection<String> values) {
        checkNotNull(values, "values must not be null");
        Map<String, Integer> codes = new LinkedHashMap<>();
        for (String value : new TreeSet<>(values)) {
            codes.put(value, codes.size());
        }
        return new CategoricalVocabulary(codes);
    }

    /**
     * Builds the service table over every record of the run.
     *
     * @param records enriched records
     * @return the vocabulary of the services of the records
     */
    public static CategoricalVocabulary ofServices(Collection<EnrichedRecord> records) {
        checkNotNull(records, "records must not be null");
        return of(records.stream().map(EnrichedRecord::getService).collect(Collectors.toList()));
    }

    public int encode(String value) {
        Integer code = codes.get(value);
        return (code == null) ? UNKNOWN_CODE : code;
    }

    public int size() {
        return codes.size();
    }

    public Map<String, Integer> getCodes() {
        return codes;
    }
}
