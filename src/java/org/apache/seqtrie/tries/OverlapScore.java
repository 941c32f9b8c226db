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
package org.apache.seqtrie.tries;

import java.util.Objects;

/**
 * Scores the overlap of two sequences: the number of positions at which they hold equal elements.
 */
public final class OverlapScore<E> implements ScoreFunction<E, Integer>
{
    @SuppressWarnings("rawtypes")
    private static final OverlapScore INSTANCE = new OverlapScore();

    private OverlapScore()
    {
    }

    @SuppressWarnings("unchecked")
    public static <E> OverlapScore<E> instance()
    {
        return (OverlapScore<E>) INSTANCE;
    }

    @Override
    public Integer initial()
    {
        return 0;
    }

    @Override
    public Integer step(Integer score, E query, E candidate)
    {
        return Objects.equals(query, candidate) ? score + 1 : score;
    }
}
