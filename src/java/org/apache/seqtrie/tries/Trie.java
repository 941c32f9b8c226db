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

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.seqtrie.config.SeqTrieProperties;

/**
 * An in-memory trie mapping sequences of elements to data.
 * <p>
 * Keys are sequences of labels (e.g. the characters of a string or the entries of a feature vector); keys that share
 * a prefix share the nodes of that prefix. The trie does not distinguish between keys that were stored and prefixes
 * of stored keys: every node, including the root (which corresponds to the empty key), has a data value. Nodes that
 * were never explicitly given a value hold the default value provided at construction.
 * <p>
 * The children of each node are kept sorted by label, which gives all walks and cursors a deterministic order: a
 * depth-first pre-order walk presents keys in lexicographic order, each prefix before its extensions, e.g.
 * <pre>
 *  "", a, ab, abc, abd, t, te, tes, test, tr, tre, tree, tri, trie
 * </pre>
 * <p>
 * Insertion may invalidate cursors and must not be performed during a walk.
 *
 * @param <E> the type of key elements (edge labels)
 * @param <V> the type of the data stored at each node
 */
@NotThreadSafe
public class Trie<E, V>
{
    private static final Logger logger = LoggerFactory.getLogger(Trie.class);

    static final boolean DEBUG = SeqTrieProperties.TRIE_DEBUG.getBoolean();

    private final Comparator<? super E> comparator;
    private final Supplier<V> defaultValue;
    private TrieNode<E, V> root;

    public Trie(Comparator<? super E> comparator, Supplier<V> defaultValue)
    {
        this(comparator, defaultValue, new TrieNode<>(defaultValue.get()));
    }

    private Trie(Comparator<? super E> comparator, Supplier<V> defaultValue, TrieNode<E, V> root)
    {
        this.comparator = Preconditions.checkNotNull(comparator);
        this.defaultValue = Preconditions.checkNotNull(defaultValue);
        this.root = root;
    }

    /**
     * Creates a trie whose labels are ordered by their natural ordering.
     */
    public static <E extends Comparable<? super E>, V> Trie<E, V> create(Supplier<V> defaultValue)
    {
        return new Trie<>(Comparator.naturalOrder(), defaultValue);
    }

    /**
     * Returns the characters of the given string as a key.
     */
    public static List<Character> chars(CharSequence s)
    {
        return Lists.charactersOf(s);
    }

    /**
     * Visitor for {@link #eachElement}, receiving the label of each edge and the data of the node it leads to.
     */
    @FunctionalInterface
    public interface ElementVisitor<E, V>
    {
        /**
         * @return true to continue with the children of this node, false to skip them.
         */
        boolean visit(E label, V data);
    }

    /**
     * Visitor for {@link #each}, receiving the key of each node and its data.
     */
    @FunctionalInterface
    public interface KeyVisitor<E, V>
    {
        /**
         * @param key the labels from the root to the visited node. This is a view of the walk's state which changes
         *            as the walk proceeds; copy it to retain it.
         * @return true to continue with the children of this node, false to skip them.
         */
        boolean visit(List<E> key, V data);
    }

    /**
     * Used by walks that need the position and not only the label, e.g. {@link TrieComparison}.
     */
    interface PathVisitor<E, V>
    {
        boolean visit(TriePath<E, V> path, E label, V data);
    }

    /**
     * The result of a {@link #match}: whether the whole key was found, and the data of the longest prefix of the key
     * that the trie contains.
     */
    public static final class Match<V>
    {
        private final boolean exact;
        private final V data;

        Match(boolean exact, V data)
        {
            this.exact = exact;
            this.data = data;
        }

        public boolean isExact()
        {
            return exact;
        }

        public V data()
        {
            return data;
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o)
                return true;
            if (!(o instanceof Match))
                return false;
            Match<?> other = (Match<?>) o;
            return exact == other.exact && Objects.equals(data, other.data);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(exact, data);
        }

        @Override
        public String toString()
        {
            return (exact ? "exact " : "partial ") + data;
        }
    }

    /**
     * Stores the data for the given key, replacing any previous value of the key's node. Nodes created for the
     * prefixes of the key receive the default value; existing prefix nodes are not changed.
     */
    public void insert(Iterable<? extends E> key, V data)
    {
        nodeFor(key).data = data;
    }

    /**
     * Replaces the data of every prefix of the given key, including the empty prefix and the key itself, with the
     * result of applying the combiner to it. Missing nodes are created with the default value before the combiner
     * is applied.
     */
    public void insert(Iterable<? extends E> key, UnaryOperator<V> combiner)
    {
        TrieNode<E, V> node = root;
        node.data = combiner.apply(node.data);
        for (E element : key)
        {
            TrieNode<E, V> parent = node;
            node = node.childOrCreate(element, comparator, defaultValue);
            node.data = combiner.apply(node.data);
            if (DEBUG)
                parent.verifyOrder(comparator);
        }
    }

    /**
     * Returns the data of the given key, adding the key with default values if it is not present. Unlike
     * {@link #insert}, this never changes existing data.
     */
    public V at(Iterable<? extends E> key)
    {
        return nodeFor(key).data;
    }

    private TrieNode<E, V> nodeFor(Iterable<? extends E> key)
    {
        TrieNode<E, V> node = root;
        for (E element : key)
        {
            TrieNode<E, V> parent = node;
            node = node.childOrCreate(element, comparator, defaultValue);
            if (DEBUG)
                parent.verifyOrder(comparator);
        }
        return node;
    }

    /**
     * Follows the key along existing edges only. The result is exact if the whole key was found; either way it
     * carries the data of the deepest node reached, i.e. of the longest prefix of the key present in the trie (which
     * may be the root).
     */
    public Match<V> match(Iterable<? extends E> key)
    {
        TrieNode<E, V> node = root;
        for (E element : key)
        {
            TrieNode<E, V> child = node.childFor(element, comparator);
            if (child == null)
                return new Match<>(false, node.data);
            node = child;
        }
        return new Match<>(true, node.data);
    }

    /**
     * Returns a cursor positioned at the given key, or {@link #end()} if the trie does not contain it.
     */
    public TrieCursor<E, V> find(Iterable<? extends E> key)
    {
        return TrieCursor.find(root, key, comparator);
    }

    /**
     * Returns a cursor at the begin position, addressing the root.
     */
    public TrieCursor<E, V> begin()
    {
        return TrieCursor.begin(root);
    }

    /**
     * Returns a cursor at the end position, one past the last node of the trie.
     */
    public TrieCursor<E, V> end()
    {
        return TrieCursor.end(root);
    }

    /**
     * Calls the visitor with the label and data of every node except the root in depth-first pre-order, with
     * children in ascending label order.
     */
    public void eachElement(ElementVisitor<? super E, ? super V> visitor)
    {
        eachElement(visitor, Direction.FORWARD);
    }

    public void eachElement(ElementVisitor<? super E, ? super V> visitor, Direction direction)
    {
        walk((path, label, data) -> visitor.visit(label, data), direction);
    }

    /**
     * Calls the visitor with the key and data of every node in depth-first pre-order, starting with the root and
     * the empty key, with children in ascending label order.
     */
    public void each(KeyVisitor<E, ? super V> visitor)
    {
        each(visitor, Direction.FORWARD);
    }

    public void each(KeyVisitor<E, ? super V> visitor, Direction direction)
    {
        TriePath<E, V> path = new TriePath<>(root);
        List<E> key = path.keyView();
        if (visitor.visit(key, root.data))
            walk(path, (p, label, data) -> visitor.visit(key, data), direction);
    }

    void walk(PathVisitor<E, V> visitor, Direction direction)
    {
        walk(new TriePath<>(root), visitor, direction);
    }

    /**
     * Pre-order walk below the root. A false return from the visitor skips the children of the visited node; the
     * walk then continues with the next sibling, or the next sibling of the closest ancestor that has one.
     */
    private void walk(TriePath<E, V> path, PathVisitor<E, V> visitor, Direction direction)
    {
        if (root.isLeaf())
            return;

        path.push(root, direction.firstSlot(root.size()));
        while (!path.isEmpty())
        {
            TrieNode<E, V> owner = path.topOwner();
            int slot = path.topSlot();
            if (!direction.inRange(slot, owner.size()))
            {
                path.pop();
                if (!path.isEmpty())
                    path.advanceTop(direction.increase);
                continue;
            }

            TrieNode<E, V> child = owner.child(slot);
            if (visitor.visit(path, owner.label(slot), child.data) && !child.isLeaf())
                path.push(child, direction.firstSlot(child.size()));
            else
                path.advanceTop(direction.increase);
        }
    }

    /**
     * @return true if the trie has no nodes other than the root.
     */
    public boolean isLeaf()
    {
        return root.isLeaf();
    }

    /**
     * @return the number of nodes below the root, i.e. the number of distinct non-empty prefixes of the stored keys.
     */
    public int size()
    {
        int[] count = new int[1];
        walk((path, label, data) -> {
            ++count[0];
            return true;
        }, Direction.FORWARD);
        return count[0];
    }

    /**
     * Removes all nodes and resets the root to the default value.
     */
    public void clear()
    {
        root.clear(defaultValue.get());
        logger.debug("Cleared trie content");
    }

    /**
     * Returns a deep copy of this trie. Data values are shared between the two tries; use {@link #copy(UnaryOperator)}
     * for mutable data.
     */
    public Trie<E, V> copy()
    {
        return copy(UnaryOperator.identity());
    }

    /**
     * Returns a deep copy of this trie, with every data value passed through the given copier.
     */
    public Trie<E, V> copy(UnaryOperator<V> valueCopier)
    {
        return new Trie<>(comparator, defaultValue, root.copy(valueCopier));
    }

    /**
     * Moves the content of this trie to a new one, leaving this trie empty with a default root value. Cursors over
     * this trie are invalidated.
     */
    public Trie<E, V> transfer()
    {
        Trie<E, V> target = new Trie<>(comparator, defaultValue, root);
        root = new TrieNode<>(defaultValue.get());
        logger.debug("Transferred trie content to a new owner");
        return target;
    }

    /**
     * Constuct a textual representation of the trie using the given content-to-string mapper.
     */
    public String dump(Function<? super V, String> contentToString)
    {
        return new TrieDumper<E, V>(contentToString).dump(this);
    }

    @Override
    public String toString()
    {
        return dump(String::valueOf);
    }
}
