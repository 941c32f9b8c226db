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
package org.apache.seqtrie.config;

import org.junit.After;
import org.junit.Test;

import org.apache.seqtrie.exceptions.ConfigurationException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class SeqTriePropertiesTest
{
    @After
    public void resetProperties()
    {
        SeqTrieProperties.KNN_DEFAULT_K.reset();
        SeqTrieProperties.TRIE_DEBUG.clearValue();
    }

    @Test
    public void testDefaults()
    {
        SeqTrieProperties.KNN_DEFAULT_K.clearValue();
        assertEquals(1, SeqTrieProperties.KNN_DEFAULT_K.getInt());
        assertEquals("1", SeqTrieProperties.KNN_DEFAULT_K.getDefaultValue());
        assertFalse(SeqTrieProperties.TRIE_DEBUG.getBoolean());
        assertTrue(SeqTrieProperties.TRIE_DEBUG.getBoolean(true));
        assertNull(SeqTrieProperties.TRIE_DEBUG.getString());
    }

    @Test
    public void testOverrides()
    {
        SeqTrieProperties.KNN_DEFAULT_K.setString("7");
        assertEquals(7, SeqTrieProperties.KNN_DEFAULT_K.getInt());
        SeqTrieProperties.KNN_DEFAULT_K.setString("0x10");
        assertEquals(16, SeqTrieProperties.KNN_DEFAULT_K.getInt());
        assertEquals(16, SeqTrieProperties.KNN_DEFAULT_K.getInt(3));

        SeqTrieProperties.TRIE_DEBUG.setString("true");
        assertTrue(SeqTrieProperties.TRIE_DEBUG.getBoolean());
        assertEquals("seqtrie.trie.debug", SeqTrieProperties.TRIE_DEBUG.getKey());
    }

    @Test(expected = ConfigurationException.class)
    public void testInvalidInteger()
    {
        SeqTrieProperties.KNN_DEFAULT_K.setString("many");
        SeqTrieProperties.KNN_DEFAULT_K.getInt();
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingInteger()
    {
        SeqTrieProperties.TRIE_DEBUG.getInt();
    }
}
