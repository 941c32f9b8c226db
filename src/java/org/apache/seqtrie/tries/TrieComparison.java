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

import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Comparison of a pattern against the keys of a trie that have the same length as the pattern.
 */
public final class TrieComparison
{
    private TrieComparison()
    {
    }

    /**
     * Scores the pattern against every key of the trie of the pattern's length and passes each score, together with
     * the data of the key, to the result consumer.
     * <p>
     * This is done in a single pruning pre-order walk of the trie which consumes one pattern element per level: at
     * depth d the score of the node is the score of its parent stepped with the d-th pattern element and the node's
     * label. Nodes at the pattern's depth are reported and not descended into, so the walk never visits keys longer
     * than the pattern. Results are reported in ascending key order. An empty pattern matches the root only.
     */
    public static <E, V, S> void compare(Trie<E, V> trie,
                                         List<? extends E> pattern,
                                         ScoreFunction<? super E, S> scoreFunction,
                                         BiConsumer<? super S, ? super V> result)
    {
        int length = pattern.size();
        if (length == 0)
        {
            result.accept(scoreFunction.initial(), trie.match(Collections.emptyList()).data());
            return;
        }

        // scores[d] is the score of the node at depth d on the current path
        Object[] scores = new Object[length];
        scores[0] = scoreFunction.initial();
        trie.walk((path, label, data) -> {
            int depth = path.depth();
            @SuppressWarnings("unchecked")
            S score = scoreFunction.step((S) scores[depth - 1], pattern.get(depth - 1), label);
            if (depth == length)
            {
                result.accept(score, data);
                return false;
            }
            scores[depth] = score;
            return true;
        }, Direction.FORWARD);
    }
}
