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

package com.amazon.rootcauseforest.suggestion;

import static com.amazon.rootcauseforest.CommonUtils.checkNotNull;

import java.util.function.Predicate;

import lombok.Getter;

/**
 * A pure predicate over a {@link SuggestionContext} and the remediation text
 * emitted when it holds.
 */
@Getter
public class SuggestionRule {

    private final String name;
    private final Predicate<SuggestionContext> condition;
    private final String suggestion;

    public SuggestionRule(String name, Predicate<SuggestionContext> condition, String suggestion) {
        this.name = checkNotNull(name, "name must not be null");
        this.condition = checkNotNull(condition, "condition must not be null");
        this.suggestion = checkNotNull(suggestion, "suggestion must not be null");
    }

    public boolean matches(SuggestionContext context) {
        return condition.test(context);
    }

    /**
     * @param name     rule name
     * @param keywords lower case keywords
     * @param text     suggestion text
     * @return a rule matching a message that contains any of the keywords
     */
    public static SuggestionRule keyword(String name, String text, String... keywords) {
        return new SuggestionRule(name, context -> {
            for (String keyword : keywords) {
                if (context.getNormalizedMessage().contains(keyword)) {
                    return true;
                }
            }
            return false;
        }, text);
    }

    @Override
    public String toString() {
        return "SuggestionRule(" + name + ")";
    }
}
