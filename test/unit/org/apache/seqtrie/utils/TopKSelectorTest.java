/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.seqtrie.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class TopKSelectorTest
{
    Random rand = new Random(3);

    @Test
    public void testSelectsSmallest()
    {
        for (int limit : new int[] { 1, 2, 5, 20, 100 })
        {
            List<Integer> data = new ArrayList<>();
            for (int i = 0; i < 50; ++i)
                data.add(rand.nextInt(30));

            TopKSelector<Integer> selector = new TopKSelector<>(Comparator.naturalOrder(), limit);
            selector.addAll(data);

            List<Integer> expected = new ArrayList<>(data);
            Collections.sort(expected);
            expected = expected.subList(0, Math.min(limit, expected.size()));
            assertEquals(expected, selector.get());
            assertEquals(expected.size(), selector.size());
        }
    }

    @Test
    public void testFewerItemsThanLimit()
    {
        TopKSelector<String> selector = new TopKSelector<>(Comparator.naturalOrder(), 10);
        selector.add("c");
        selector.add("a");
        selector.add(null);
        selector.add("b");
        assertEquals(3, selector.size());
        assertEquals(List.of("a", "b", "c"), selector.get());
    }

    @Test
    public void testEqualItemsAtBoundaryKeepFirst()
    {
        // items compared by their first character only
        Comparator<String> byFirst = Comparator.comparing(s -> s.charAt(0));
        TopKSelector<String> selector = new TopKSelector<>(byFirst, 2);
        selector.add("b1");
        selector.add("a1");
        selector.add("b2");
        selector.add("b3");
        assertEquals(List.of("a1", "b1"), selector.get());
    }

    @Test
    public void testLimitReachedAfterGrowing()
    {
        List<Integer> data = new ArrayList<>();
        for (int i = 0; i < 200; ++i)
            data.add(rand.nextInt(1000));

        TopKSelector<Integer> selector = new TopKSelector<>(Comparator.naturalOrder(), 40);
        selector.addAll(data);

        List<Integer> expected = new ArrayList<>(data);
        Collections.sort(expected);
        assertEquals(expected.subList(0, 40), selector.get());
    }

    @Test
    public void testHugeLimit()
    {
        TopKSelector<Integer> selector = new TopKSelector<>(Comparator.naturalOrder(), Integer.MAX_VALUE);
        for (int i = 100; i > 0; --i)
            selector.add(i);
        assertEquals(100, selector.size());
        List<Integer> selected = selector.get();
        assertEquals(1, (int) selected.get(0));
        assertEquals(100, (int) selected.get(99));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidLimit()
    {
        new TopKSelector<Integer>(Comparator.naturalOrder(), 0);
    }
}
