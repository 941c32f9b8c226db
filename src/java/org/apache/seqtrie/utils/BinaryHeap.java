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

import java.util.Arrays;

/**
 * A base binary heap implementation with bounded size, supporting only operations that push
 * data down in the heap (i.e. after the initial initialization of the heap from a collection
 * of items, only the top item can be modified (replaced with a larger one)).
 * <p>
 * This class does not implement a priority queue (because a queue's purpose is to support
 * adding and removing items), but works very well for selecting the top items from data of
 * unbounded size ({@link TopKSelector}).
 */
public abstract class BinaryHeap
{
    protected Object[] heap;

    /**
     * Create a binary heap with the given array. The data must be heapified before being used.
     */
    public BinaryHeap(Object[] data)
    {
        this.heap = data;
        // Note that we can't perform any preparation here because the subclass defining greaterThan may have not been
        // initialized yet.
    }

    /**
     * Extend the backing array to the given length, keeping the items already placed in it. Only valid before the
     * data is heapified.
     */
    protected void growTo(int length)
    {
        heap = Arrays.copyOf(heap, length);
    }

    /**
     * Compare two objects and return true iff the first is greater.
     */
    protected abstract boolean greaterThan(Object a, Object b);

    /**
     * Turn the current list of items into a binary heap by using the initial heap construction
     * of the heapsort algorithm with complexity O(heap.length).
     */
    protected void heapify()
    {
        heapifyUpTo(heap.length);
    }

    /**
     * Turn the list of items until the given index into a binary heap by using the initial heap construction
     * of the heapsort algorithm with complexity O(heap.length).
     */
    protected void heapifyUpTo(int size)
    {
        for (int i = size / 2 - 1; i >= 0; --i)
            heapifyDownUpTo(heap[i], i, size);
    }

    /**
     * Return the next element in the heap without advancing.
     */
    protected Object peek()
    {
        return heap[0];
    }

    /**
     * Get and replace the top item with a new one. The new must compare greater than
     * or equal to the item being replaced.
     */
    protected Object replaceTop(Object newItem)
    {
        Object item = heap[0];
        heapifyDownUpTo(newItem, 0, heap.length);
        return item;
    }

    /**
     * Push the given state down in the heap from the given index until it finds its proper place among
     * the subheap rooted at that position.
     */
    private void heapifyDownUpTo(Object item, int index, int size)
    {
        while (true)
        {
            int next = index * 2 + 1;
            if (next >= size)
                break;
            // Select the smaller of the two children to push down to.
            if (next + 1 < size && greaterThan(heap[next], heap[next + 1]))
                ++next;
            // If the child is greater or equal, the invariant has been restored.
            if (!greaterThan(item, heap[next]))
                break;
            heap[index] = heap[next];
            index = next;
        }
        heap[index] = item;
    }

    /**
     * Sort the heap by repeatedly popping the top item and placing it at the end of the heap array.
     * The result will contain the elements in the heap sorted in descending order.
     * The heap must be heapified up to the size before calling this method.
     */
    protected void heapSortUpTo(int size)
    {
        // Sorting the ones from 1 will also make put the right value in heap[0]
        for (int i = size - 1; i >= 1; --i)
        {
            Object top = heap[0];
            heapifyDownUpTo(heap[i], 0, i);
            heap[i] = top;
        }
    }
}
