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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.Preconditions;

/**
 * A node of a {@link Trie}: a data value and the ordered, labelled edges to the node's children.
 * <p>
 * Labels and children are held in two parallel lists sorted by label, with no duplicate labels. A node exclusively
 * owns its children; there are no parent links, positions within the tree are expressed as a stack of
 * (owner, slot) pairs (see {@link TriePath}).
 */
@NotThreadSafe
final class TrieNode<E, V>
{
    V data;
    private final ArrayList<E> labels;
    private final ArrayList<TrieNode<E, V>> children;

    TrieNode(V data)
    {
        this(data, 0);
    }

    private TrieNode(V data, int capacity)
    {
        this.data = data;
        this.labels = new ArrayList<>(capacity);
        this.children = new ArrayList<>(capacity);
    }

    int size()
    {
        return labels.size();
    }

    boolean isLeaf()
    {
        return labels.isEmpty();
    }

    E label(int slot)
    {
        return labels.get(slot);
    }

    TrieNode<E, V> child(int slot)
    {
        return children.get(slot);
    }

    /**
     * Binary search for the given label.
     * @return the slot of the label if present, otherwise {@code -(insertion point) - 1}.
     */
    int search(E label, Comparator<? super E> comparator)
    {
        return Collections.binarySearch(labels, Preconditions.checkNotNull(label, "Trie labels cannot be null"), comparator);
    }

    /** Returns the child reached through the given label, or null if there is no such edge. */
    TrieNode<E, V> childFor(E label, Comparator<? super E> comparator)
    {
        int slot = search(label, comparator);
        return slot >= 0 ? children.get(slot) : null;
    }

    /** Returns the child reached through the given label, adding it with default data if there is no such edge. */
    TrieNode<E, V> childOrCreate(E label, Comparator<? super E> comparator, Supplier<V> defaultValue)
    {
        int slot = search(label, comparator);
        if (slot >= 0)
            return children.get(slot);

        slot = -1 - slot;
        TrieNode<E, V> child = new TrieNode<>(defaultValue.get());
        labels.add(slot, label);
        children.add(slot, child);
        return child;
    }

    void clear(V data)
    {
        this.data = data;
        labels.clear();
        children.clear();
    }

    /**
     * Deep copy of the subtree rooted at this node. Done with an explicit stack, as the depth of a trie is only
     * limited by the length of its longest key.
     */
    TrieNode<E, V> copy(UnaryOperator<V> valueCopier)
    {
        TrieNode<E, V> result = new TrieNode<>(valueCopier.apply(data), size());
        Deque<TrieNode<E, V>> sources = new ArrayDeque<>();
        Deque<TrieNode<E, V>> targets = new ArrayDeque<>();
        sources.push(this);
        targets.push(result);
        while (!sources.isEmpty())
        {
            TrieNode<E, V> source = sources.pop();
            TrieNode<E, V> target = targets.pop();
            for (int i = 0; i < source.size(); ++i)
            {
                TrieNode<E, V> sourceChild = source.children.get(i);
                TrieNode<E, V> targetChild = new TrieNode<>(valueCopier.apply(sourceChild.data), sourceChild.size());
                target.labels.add(source.labels.get(i));
                target.children.add(targetChild);
                sources.push(sourceChild);
                targets.push(targetChild);
            }
        }
        return result;
    }

    /** Checks that the labels of this node are strictly ascending. */
    void verifyOrder(Comparator<? super E> comparator)
    {
        Preconditions.checkState(labels.size() == children.size(),
                                 "Label and child counts differ: %s vs %s", labels.size(), children.size());
        for (int i = 1; i < labels.size(); ++i)
            Preconditions.checkState(comparator.compare(labels.get(i - 1), labels.get(i)) < 0,
                                     "Labels out of order at slot %s: %s before %s", i, labels.get(i - 1), labels.get(i));
    }
}
