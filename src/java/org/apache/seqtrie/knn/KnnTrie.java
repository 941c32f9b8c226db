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
import java.util.List;

import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.seqtrie.config.SeqTrieProperties;
import org.apache.seqtrie.tries.OverlapScore;
import org.apache.seqtrie.tries.Trie;
import org.apache.seqtrie.tries.TrieComparison;
import org.apache.seqtrie.utils.TopKSelector;

/**
 * A nearest-neighbour classifier over feature sequences stored in a trie.
 * <p>
 * Training counts, for every feature sequence, the labels it was seen with. Classification compares the query with
 * all trained sequences of the same length by the number of positions at which they agree ({@link OverlapScore}),
 * and takes a majority vote over the label counts of the best matching sequences. Shared prefixes of the trained
 * sequences are compared only once, and sequences of other lengths are never fully walked.
 * <p>
 * Example: trained with "test" as 1, "tent" as 2 and "tost" as 1, the query "tast" scores 3 against "test" and "tost"
 * and 2 against "tent", so it is classified as 1.
 *
 * @param <E> the type of features
 * @param <L> the type of labels
 */
@NotThreadSafe
public class KnnTrie<E, L>
{
    private static final Logger logger = LoggerFactory.getLogger(KnnTrie.class);

    private final Trie<E, LabelTally<L>> trie;
    private final Comparator<? super L> labelOrder;
    private final L defaultLabel;

    /**
     * @param featureOrder order of features, used to arrange the trie
     * @param labelOrder order of labels, used to break ties in the majority vote
     * @param defaultLabel the label returned when there is nothing to vote on
     */
    public KnnTrie(Comparator<? super E> featureOrder, Comparator<? super L> labelOrder, L defaultLabel)
    {
        this.trie = new Trie<>(featureOrder, () -> new LabelTally<>(labelOrder));
        this.labelOrder = labelOrder;
        this.defaultLabel = defaultLabel;
    }

    public static <E extends Comparable<? super E>, L extends Comparable<? super L>> KnnTrie<E, L> create(L defaultLabel)
    {
        return new KnnTrie<>(Comparator.naturalOrder(), Comparator.naturalOrder(), defaultLabel);
    }

    /**
     * Records one occurrence of the given label for the given feature sequence.
     */
    public void learn(Iterable<? extends E> features, L label)
    {
        LabelTally<L> tally = trie.at(features);
        tally.increment(label);
        if (logger.isTraceEnabled())
            logger.trace("Learned {} for {}, now {}", label, features, tally);
    }

    /**
     * Returns the majority label of the best matching trained sequence. When several sequences share the best score
     * the first one in key order is used. Returns the default label if no trained sequence has the query's length.
     */
    public L classify(List<? extends E> features)
    {
        BestMatch<L> best = new BestMatch<>();
        TrieComparison.compare(trie, features, OverlapScore.instance(), best::offer);
        logger.debug("Best match for {} has score {}: {}", features, best.score, best.tally);
        return best.tally == null ? defaultLabel : best.tally.majority(defaultLabel);
    }

    /**
     * Returns the majority label of the summed label counts of the k best matching trained sequences. A candidate
     * displaces a retained one only if its score is strictly higher than the lowest retained score.
     *
     * @throws IllegalArgumentException if k is not positive
     */
    public L classify(List<? extends E> features, int k)
    {
        Preconditions.checkArgument(k > 0, "k must be positive, got %s", k);

        TopKSelector<Candidate<L>> selector = new TopKSelector<>(Candidate.BY_DESCENDING_SCORE, k);
        TrieComparison.compare(trie, features, OverlapScore.instance(),
                               (score, tally) -> selector.add(new Candidate<>(score, tally)));

        LabelTally<L> labels = new LabelTally<>(labelOrder);
        for (Candidate<L> candidate : selector.getShared())
        {
            logger.debug("Retained candidate for {} with score {}: {}", features, candidate.score, candidate.tally);
            labels.addAll(candidate.tally);
        }
        return labels.majority(defaultLabel);
    }

    /**
     * {@link #classify(List, int)} with k taken from the {@code seqtrie.knn.default_k} system property.
     */
    public L classifyNearest(List<? extends E> features)
    {
        return classify(features, SeqTrieProperties.KNN_DEFAULT_K.getInt());
    }

    /**
     * Returns a copy of the label counts trained for exactly the given feature sequence.
     */
    public LabelTally<L> tally(Iterable<? extends E> features)
    {
        Trie.Match<LabelTally<L>> match = trie.match(features);
        return match.isExact() ? match.data().copy() : new LabelTally<>(labelOrder);
    }

    public String dump()
    {
        return trie.dump(LabelTally::toString);
    }

    private static class BestMatch<L>
    {
        int score;
        LabelTally<L> tally;

        void offer(int score, LabelTally<L> tally)
        {
            if (this.tally == null || score > this.score)
            {
                this.score = score;
                this.tally = tally;
            }
        }
    }

    private static class Candidate<L>
    {
        static final Comparator<Candidate<?>> BY_DESCENDING_SCORE = (a, b) -> Integer.compare(b.score, a.score);

        final int score;
        final LabelTally<L> tally;

        Candidate(int score, LabelTally<L> tally)
        {
            this.score = score;
            this.tally = tally;
        }
    }
}
