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

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.agrona.collections.IntArrayList;

/**
 * A position in a trie, given as the stack of (owner node, child slot) pairs that leads to it from the root.
 * <p>
 * Entry {@code i} of the stack names the edge taken at depth {@code i + 1}; the node addressed by the path is the
 * child of the top owner at the top slot, or the root when the stack is empty. The top slot may be out of range for
 * its owner, which walks and cursors use to mark an exhausted node.
 */
final class TriePath<E, V>
{
    final TrieNode<E, V> root;
    private final ArrayList<TrieNode<E, V>> owners;
    private final IntArrayList slots;

    TriePath(TrieNode<E, V> root)
    {
        this.root = root;
        this.owners = new ArrayList<>();
        this.slots = new IntArrayList();
    }

    int depth()
    {
        return owners.size();
    }

    boolean isEmpty()
    {
        return owners.isEmpty();
    }

    void push(TrieNode<E, V> owner, int slot)
    {
        owners.add(owner);
        slots.addInt(slot);
    }

    void pop()
    {
        int last = owners.size() - 1;
        owners.remove(last);
        slots.removeAt(last);
    }

    void clear()
    {
        owners.clear();
        slots.clear();
    }

    TrieNode<E, V> topOwner()
    {
        return owners.get(owners.size() - 1);
    }

    int topSlot()
    {
        return slots.getInt(slots.size() - 1);
    }

    void advanceTop(int increase)
    {
        int last = slots.size() - 1;
        slots.setInt(last, slots.getInt(last) + increase);
    }

    /** The node addressed by this path. The top slot must be valid. */
    TrieNode<E, V> current()
    {
        return isEmpty() ? root : topOwner().child(topSlot());
    }

    E label(int level)
    {
        return owners.get(level).label(slots.getInt(level));
    }

    /**
     * A live view of the labels on the path. It reflects every later change of the path, so callers that need to
     * keep the key must copy it.
     */
    List<E> keyView()
    {
        return new AbstractList<E>()
        {
            @Override
            public E get(int index)
            {
                return label(index);
            }

            @Override
            public int size()
            {
                return depth();
            }
        };
    }

    List<E> key()
    {
        return ImmutableList.copyOf(keyView());
    }

    TriePath<E, V> duplicate()
    {
        TriePath<E, V> copy = new TriePath<>(root);
        for (int i = 0; i < depth(); ++i)
            copy.push(owners.get(i), slots.getInt(i));
        return copy;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof TriePath))
            return false;

        TriePath<?, ?> other = (TriePath<?, ?>) o;
        if (root != other.root || depth() != other.depth())
            return false;
        for (int i = 0; i < depth(); ++i)
        {
            if (owners.get(i) != other.owners.get(i) || slots.getInt(i) != other.slots.getInt(i))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode()
    {
        int result = System.identityHashCode(root);
        for (int i = 0; i < depth(); ++i)
            result = 31 * (31 * result + System.identityHashCode(owners.get(i))) + slots.getInt(i);
        return result;
    }
}
