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

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * This class selects the smallest k items from a stream.
 * <p>
 * This is implemented as a binary heap with reversed comparator which keeps track of k items and keeps the largest of
 * them on top of the heap. When a new item arrives, it is checked against the top: if it is larger or equal, it can
 * be ignored as we already have k better items; if not, it replaces the top item and is pushed down to restore the
 * properties of the heap.
 * <p>
 * Until k items have been seen every item is retained. After that an item only enters the selection if it is strictly
 * smaller than the largest selected one, so among equal items at the boundary the ones that came first are kept.
 * <p>
 * The backing array grows as items arrive and never exceeds k, so space is O(min(n, k)) and a large limit costs
 * nothing until that many items have been added. This process has a time complexity of O(n log k) for n > k.
 * Duplicates are not removed and are returned in arbitrary order.
 */
public class TopKSelector<T> extends BinaryHeap
{
    private static final int INITIAL_CAPACITY = 16;

    private final Comparator<? super T> comparator;
    private final int limit;
    private int size;

    public TopKSelector(Comparator<? super T> comparator, int limit)
    {
        super(new Object[Math.min(checkLimit(limit), INITIAL_CAPACITY)]);
        this.comparator = comparator;
        this.limit = limit;
    }

    private static int checkLimit(int limit)
    {
        Preconditions.checkArgument(limit > 0, "Selection limit must be positive, got %s", limit);
        return limit;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected boolean greaterThan(Object a, Object b)
    {
        // Top-k uses an inverted comparator, so that the largest item, the one we should compare with and replace
        // if something smaller is added, sits at the top. This is also the comparator suitable for doing the final
        // heapsort steps required to arrange the end result in sort order.
        return comparator.compare((T) a, (T) b) < 0;
    }

    public void add(T newItem)
    {
        if (newItem == null)
            return;

        if (size < limit)
        {
            if (size == heap.length)
                growTo((int) Math.min(limit, 2L * heap.length));
            heap[size++] = newItem;
            // the array is exactly limit long once full
            if (size == limit)
                heapify();
        }
        else
        {
            if (greaterThan(newItem, peek()))
                replaceTop(newItem);
        }
    }

    public void addAll(Iterable<T> items)
    {
        for (T item : items)
            add(item);
    }

    public int size()
    {
        return size;
    }

    private int prepareAndReturnSize()
    {
        if (size < limit)
            heapifyUpTo(size);
        return size;
    }

    /**
     * Returns the selected items in ascending order. This sorts the selection in place; no items may be added
     * afterwards.
     */
    public List<T> get()
    {
        return new ArrayList<>(getShared());
    }

    public List<T> getShared()
    {
        heapSortUpTo(prepareAndReturnSize());
        return getUnsortedShared();
    }

    /**
     * Returns a view of the selected items in heap order.
     */
    private List<T> getUnsortedShared()
    {
        return new AbstractList<T>()
        {
            @Override
            @SuppressWarnings("unchecked")
            public T get(int i)
            {
                return (T) heap[i];
            }

            @Override
            public int size()
            {
                return TopKSelector.this.size;
            }
        };
    }
}
