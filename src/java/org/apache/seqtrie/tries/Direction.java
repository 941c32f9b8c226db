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
 * The order in which the children of a node are walked, and the direction in which a cursor moves.
 * <p>
 * Walks in both directions are pre-order, i.e. a node is always presented before its descendants. In the reverse
 * direction the children of each node are listed in descending label order, which is not the same as presenting the
 * forward walk in reverse.
 */
public enum Direction
{
    FORWARD(1)
    {
        public int start(int left, int right)
        {
            return left;
        }

        public int end(int left, int right)
        {
            return right;
        }

        public boolean le(int left, int right)
        {
            return left <= right;
        }

        public boolean isForward()
        {
            return true;
        }
    },
    REVERSE(-1)
    {
        public int start(int left, int right)
        {
            return right;
        }

        public int end(int left, int right)
        {
            return left;
        }

        public boolean le(int left, int right)
        {
            return left >= right;
        }

        public boolean isForward()
        {
            return false;
        }
    };

    /** Value that needs to be added to a slot index to advance the iteration, i.e. value corresponding to 1 */
    public final int increase;

    Direction(int increase)
    {
        this.increase = increase;
    }

    /** Returns the value to start iteration with, i.e. the bound corresponding to l for the forward direction */
    public abstract int start(int l, int r);
    /** Returns the value to end iteration with, i.e. the bound corresponding to r for the forward direction */
    public abstract int end(int l, int r);
    /** Returns the result of the operation corresponding to a<=b for the forward direction */
    public abstract boolean le(int a, int b);

    /**
     * Returns the first child slot of a node with the given number of children. For leaves this is already out of
     * range, i.e. {@link #inRange} is false for it.
     */
    public int firstSlot(int childCount)
    {
        return start(0, childCount - 1);
    }

    /** Returns true if the given slot, reached by starting at {@link #firstSlot} and advancing, is a valid child. */
    public boolean inRange(int slot, int childCount)
    {
        return slot >= 0 && le(slot, end(0, childCount - 1));
    }

    public abstract boolean isForward();
}
