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

package com.amazon.rootcauseforest.serialize;

import java.io.Reader;
import java.io.Writer;

import lombok.Getter;

import com.amazon.rootcauseforest.MalformedRecordException;
import com.amazon.rootcauseforest.report.Report;
import com.amazon.rootcauseforest.state.ReportMapper;
import com.amazon.rootcauseforest.state.ReportState;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * {@link Report} serialization. Internally we use the {@link ReportMapper}
 * class to convert a Report into a corresponding state object, and we use
 * <a href="https://github.com/google/gson">Gson</a> to write the state object
 * as a JSON document. Field names are written in lower case with underscores,
 * for example {@code anomaly_count} and {@code root_cause_service}. The Gson
 * instance is exposed so users can customize the output.
 */
@Getter
public class ReportSerDe {

    private final ReportMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization: snake case
     * field names, pretty printing and no HTML escaping.
     */
    public ReportSerDe() {
        this(new ReportMapper(), defaultGson());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper A ReportMapper instance, used to convert a Report to a
     *               corresponding state object.
     * @param gson   A Gson instance that will be used to generate JSON for a given
     *               {@link ReportState} object.
     */
    public ReportSerDe(ReportMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    public static Gson defaultGson() {
        return new GsonBuilder().setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .setPrettyPrinting().disableHtmlEscaping().create();
    }

    /**
     * Serializes a report to a json string.
     *
     * @param report A report
     * @return a json string serialized from the report.
     */
    public String toJson(Report report) {
        return gson.toJson(mapper.toState(report));
    }

    /**
     * Writes a report as json to the writer.
     *
     * @param report A report
     * @param writer the destination; it is not closed
     */
    public void toJson(Report report, Writer writer) {
        gson.toJson(mapper.toState(report), ReportState.class, writer);
    }

    /**
     * Deserializes a report from a json string.
     *
     * @param json a json string serialized from a report
     * @return the report
     * @throws MalformedRecordException if the json is not a report
     */
    public Report fromJson(String json) {
        try {
            return toModel(gson.fromJson(json, ReportState.class));
        } catch (JsonParseException e) {
            throw new MalformedRecordException("cannot parse report", e);
        }
    }

    public Report fromJson(Reader reader) {
        try {
            return toModel(gson.fromJson(reader, ReportState.class));
        } catch (JsonParseException e) {
            throw new MalformedRecordException("cannot parse report", e);
        }
    }

    private Report toModel(ReportState state) {
        if (state == null) {
            throw new MalformedRecordException("report document is empty");
        }
        return mapper.toModel(state);
    }
}
