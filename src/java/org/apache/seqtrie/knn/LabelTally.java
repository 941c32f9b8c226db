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
package org.apache.seqtrie.knn;

import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;

import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.Preconditions;

/**
 * Occurrence counts of labels, kept in ascending label order.
 * <p>
 * Used both as the data of the nodes of a {@link KnnTrie}, where it accumulates the labels a feature sequence was
 * trained with, and as the aggregate of the nearest candidates during classification.
 */
@NotThreadSafe
public class LabelTally<L>
{
    private final TreeMap<L, Integer> counts;

    public LabelTally(Comparator<? super L> labelOrder)
    {
        this.counts = new TreeMap<>(labelOrder);
    }

    public void increment(L label)
    {
        add(label, 1);
    }

    public void add(L label, int count)
    {
        Preconditions.checkNotNull(label, "Labels cannot be null");
        counts.merge(label, count, Integer::sum);
    }

    /**
     * Adds all counts of the given tally to this one.
     */
    public void addAll(LabelTally<L> other)
    {
        for (Map.Entry<L, Integer> e : other.counts.entrySet())
            add(e.getKey(), e.getValue());
    }

    public int count(L label)
    {
        return counts.getOrDefault(label, 0);
    }

    public boolean isEmpty()
    {
        return counts.isEmpty();
    }

    public int size()
    {
        return counts.size();
    }

    /**
     * Returns the label with the highest count. Ties are resolved in favour of the smallest label; an empty tally
     * returns the given default.
     */
    public L majority(L defaultLabel)
    {
        L best = defaultLabel;
        int bestCount = Integer.MIN_VALUE;
        for (Map.Entry<L, Integer> e : counts.entrySet())
        {
            if (e.getValue() > bestCount)
            {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    public LabelTally<L> copy()
    {
        LabelTally<L> copy = new LabelTally<>(counts.comparator());
        copy.counts.putAll(counts);
        return copy;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof LabelTally))
            return false;
        return counts.equals(((LabelTally<?>) o).counts);
    }

    @Override
    public int hashCode()
    {
        return counts.hashCode();
    }

    @Override
    public String toString()
    {
        StringBuilder b = new StringBuilder("[");
        for (Map.Entry<L, Integer> e : counts.entrySet())
            b.append("{ ").append(e.getKey()).append(" : ").append(e.getValue()).append(" }");
        return b.append(']').toString();
    }
}
