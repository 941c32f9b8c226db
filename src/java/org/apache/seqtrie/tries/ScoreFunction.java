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

/**
 * An incremental scorer comparing a query sequence with a candidate sequence of the same length, one element pair
 * at a time.
 *
 * @param <E> the type of the elements compared
 * @param <S> the type of the score
 */
public interface ScoreFunction<E, S>
{
    /**
     * @return the score of two empty sequences.
     */
    S initial();

    /**
     * Combines the score accumulated so far with the comparison of the next query and candidate elements.
     */
    S step(S score, E query, E candidate);
}
