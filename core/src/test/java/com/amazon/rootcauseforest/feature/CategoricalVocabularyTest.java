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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class CategoricalVocabularyTest {

    @Test
    public void testCodesFollowSortedOrder() {
        CategoricalVocabulary vocabulary = CategoricalVocabulary
                .of(Arrays.asList("loans-ms", "accounts-ms", "loans-ms", "cards-ms"));

        assertEquals(3, vocabulary.size());
        assertEquals(0, vocabulary.encode("accounts-ms"));
        assertEquals(1, vocabulary.encode("cards-ms"));
        assertEquals(2, vocabulary.encode("loans-ms"));
        assertEquals(CategoricalVocabulary.UNKNOWN_CODE, vocabulary.encode("gateway-ms"));
        assertThat(vocabulary.getCodes().keySet(), contains("accounts-ms", "cards-ms", "loans-ms"));
    }

    @Test
    public void testSameValuesGiveSameTable() {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            values.add("service-" + (i % 7));
        }
        CategoricalVocabulary expected = CategoricalVocabulary.of(values);

        Random random = new Random(3);
        for (int round = 0; round < 10; round++) {
            Collections.shuffle(values, random);
            assertEquals(expected, CategoricalVocabulary.of(values));
            assertEquals(expected.getCodes(), CategoricalVocabulary.of(values).getCodes());
        }
    }

    @Test
    public void testEmptyVocabulary() {
        CategoricalVocabulary vocabulary = CategoricalVocabulary.of(Collections.emptyList());
        assertEquals(0, vocabulary.size());
        assertEquals(CategoricalVocabulary.UNKNOWN_CODE, vocabulary.encode("any"));
    }
}
