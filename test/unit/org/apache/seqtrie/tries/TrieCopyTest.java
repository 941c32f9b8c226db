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

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import static org.apache.seqtrie.tries.Trie.chars;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TrieCopyTest
{
    private static Trie<Character, List<String>> makeTrie()
    {
        Trie<Character, List<String>> trie = Trie.create(ArrayList::new);
        trie.at(chars("tree")).add("tree");
        trie.at(chars("trie")).add("trie");
        trie.at(chars("win")).add("win");
        trie.at(chars("")).add("root");
        return trie;
    }

    @Test
    public void testCopyIsStructurallyIndependent()
    {
        Trie<Character, List<String>> trie = makeTrie();
        Trie<Character, List<String>> copy = trie.copy();
        assertEquals(trie.toString(), copy.toString());

        copy.at(chars("wine"));
        trie.at(chars("trip"));
        assertEquals(10, copy.size());
        assertEquals(10, trie.size());
        assertTrue(trie.find(chars("wine")).atEnd());
        assertTrue(copy.find(chars("trip")).atEnd());

        // values themselves are shared by the plain copy
        assertSame(trie.at(chars("tree")), copy.at(chars("tree")));
    }

    @Test
    public void testCopyWithValueCopier()
    {
        Trie<Character, List<String>> trie = makeTrie();
        Trie<Character, List<String>> copy = trie.copy(ArrayList::new);

        assertNotSame(trie.at(chars("tree")), copy.at(chars("tree")));
        copy.at(chars("tree")).add("copy");
        assertEquals(List.of("tree"), trie.at(chars("tree")));
        assertEquals(List.of("tree", "copy"), copy.at(chars("tree")));
        assertEquals(List.of("root"), copy.at(chars("")));
    }

    @Test
    public void testCopyOfEmptyTrie()
    {
        Trie<Character, Integer> trie = Trie.create(() -> 0);
        Trie<Character, Integer> copy = trie.copy();
        assertTrue(copy.isLeaf());
        copy.insert(chars("a"), 1);
        assertTrue(trie.isLeaf());
    }

    @Test
    public void testTransfer()
    {
        Trie<Character, List<String>> trie = makeTrie();
        String dump = trie.toString();
        int size = trie.size();

        Trie<Character, List<String>> target = trie.transfer();
        assertEquals(dump, target.toString());
        assertEquals(size, target.size());

        assertTrue(trie.isLeaf());
        assertEquals(List.of(), trie.at(chars("")));
        assertEquals("* -> []\n", trie.toString());

        // both remain usable and independent
        trie.at(chars("x")).add("x");
        assertTrue(target.find(chars("x")).atEnd());
        assertEquals(List.of("win"), target.match(chars("win")).data());
    }
}
