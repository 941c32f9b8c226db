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

import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A bidirectional depth-first pre-order cursor over a {@link Trie}.
 * <p>
 * The cursor is a stack of positions, one for each edge taken from the root to the current node, which is enough to
 * move in both directions without parent links. Two positions are outside the trie:<ul>
 * <li>the <em>begin</em> position, with an empty stack, which addresses the root itself. Because walks present the
 * root before any of its descendants, the root's data is the one visible before the first {@link #advance};</li>
 * <li>the <em>end</em> position, a single entry pointing one past the root's last edge.</li>
 * </ul>
 * For example, for a trie containing "tree", "trie" and "win", advancing from begin lists
 * <pre>
 *  t, tr, tre, tree, tri, trie, w, wi, win
 * </pre>
 * and then reaches end; retreating from end lists the same positions in the opposite order and then reaches begin.
 * <p>
 * Cursors are not valid across structural modifications of the trie. Changing data through {@link #setData} is
 * allowed.
 */
@NotThreadSafe
public final class TrieCursor<E, V>
{
    private final TriePath<E, V> path;

    private TrieCursor(TriePath<E, V> path)
    {
        this.path = path;
    }

    static <E, V> TrieCursor<E, V> begin(TrieNode<E, V> root)
    {
        return new TrieCursor<>(new TriePath<>(root));
    }

    static <E, V> TrieCursor<E, V> end(TrieNode<E, V> root)
    {
        TrieCursor<E, V> cursor = begin(root);
        cursor.toEnd();
        return cursor;
    }

    /** Positions the cursor on the node at the given key, or on end if the trie does not have all of it. */
    static <E, V> TrieCursor<E, V> find(TrieNode<E, V> root, Iterable<? extends E> key, Comparator<? super E> comparator)
    {
        TrieCursor<E, V> cursor = begin(root);
        TrieNode<E, V> node = root;
        for (E element : key)
        {
            int slot = node.search(element, comparator);
            if (slot < 0)
            {
                cursor.toEnd();
                break;
            }
            cursor.path.push(node, slot);
            node = node.child(slot);
        }
        return cursor;
    }

    private void toEnd()
    {
        path.clear();
        path.push(path.root, path.root.size());
    }

    public boolean atBegin()
    {
        return path.isEmpty();
    }

    public boolean atEnd()
    {
        return path.depth() == 1 && path.topOwner() == path.root && path.topSlot() == path.root.size();
    }

    /**
     * @return the length of the key of the current position; 0 at begin, 1 at end.
     */
    public int depth()
    {
        return path.depth();
    }

    /**
     * Move to the next node in pre-order: the first child of the current node if it has any, otherwise the next
     * sibling of the closest node on the path that still has one. Moves to end after the last node.
     *
     * @throws IllegalStateException if the cursor is at end
     */
    public TrieCursor<E, V> advance()
    {
        if (atBegin())
        {
            // For an empty trie this is the end position.
            path.push(path.root, 0);
            return this;
        }
        Preconditions.checkState(!atEnd(), "Cannot advance a cursor positioned at the end of the trie");

        TrieNode<E, V> current = path.current();
        if (!current.isLeaf())
        {
            path.push(current, 0);
            return this;
        }

        TrieNode<E, V> owner = path.topOwner();
        int slot = path.topSlot() + 1;
        path.pop();
        while (!path.isEmpty() && slot == owner.size())
        {
            owner = path.topOwner();
            slot = path.topSlot() + 1;
            path.pop();
        }
        path.push(owner, slot);
        return this;
    }

    /**
     * Move to the previous node in pre-order: the right-most descendant of the previous sibling if there is one,
     * otherwise the parent. Moves from end to the last node of the trie, and from the root's first child to begin.
     *
     * @throws IllegalStateException if the cursor is at begin
     */
    public TrieCursor<E, V> retreat()
    {
        Preconditions.checkState(!atBegin(), "Cannot retreat a cursor positioned at the beginning of the trie");

        TrieNode<E, V> owner = path.topOwner();
        int slot = path.topSlot();
        path.pop();
        if (slot == 0)
            return this;

        path.push(owner, --slot);
        TrieNode<E, V> node = owner.child(slot);
        while (!node.isLeaf())
        {
            int last = node.size() - 1;
            path.push(node, last);
            node = node.child(last);
        }
        return this;
    }

    public TrieCursor<E, V> move(Direction direction)
    {
        return direction.isForward() ? advance() : retreat();
    }

    /**
     * @return a copy of the labels leading from the root to the current node; empty at begin.
     */
    public List<E> key()
    {
        Preconditions.checkState(!atEnd(), "No key at the end of the trie");
        return path.key();
    }

    /**
     * @return the data of the current node; the root's data at begin.
     */
    public V data()
    {
        Preconditions.checkState(!atEnd(), "No data at the end of the trie");
        return path.current().data;
    }

    public void setData(V data)
    {
        Preconditions.checkState(!atEnd(), "No data at the end of the trie");
        path.current().data = data;
    }

    public TrieCursor<E, V> duplicate()
    {
        return new TrieCursor<>(path.duplicate());
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof TrieCursor))
            return false;
        return path.equals(((TrieCursor<?, ?>) o).path);
    }

    @Override
    public int hashCode()
    {
        return path.hashCode();
    }

    @Override
    public String toString()
    {
        if (atBegin())
            return "TrieCursor{begin}";
        if (atEnd())
            return "TrieCursor{end}";
        return MoreObjects.toStringHelper(this)
                          .add("key", path.keyView())
                          .add("data", path.current().data)
                          .toString();
    }
}
