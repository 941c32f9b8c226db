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

import java.util.List;
import java.util.function.Function;

/**
 * Simple utility class for dumping the structure of a trie to string, using only the public walk of the trie.
 * <p>
 * Every node is written on its own line, indented by its depth, as its incoming label followed by its data, e.g.
 * <pre>
 *  * -> 0
 *  t -> 1
 *   o -> 2
 * </pre>
 * where the root is shown as {@code *}.
 */
class TrieDumper<E, V>
{
    private final Function<? super V, String> contentToString;

    TrieDumper(Function<? super V, String> contentToString)
    {
        this.contentToString = contentToString;
    }

    String dump(Trie<E, V> trie)
    {
        StringBuilder b = new StringBuilder();
        trie.each((key, data) -> {
            appendLine(b, key, data);
            return true;
        });
        return b.toString();
    }

    private void appendLine(StringBuilder b, List<E> key, V data)
    {
        int depth = key.size();
        for (int i = 1; i < depth; ++i)
            b.append(' ');
        b.append(depth == 0 ? "*" : String.valueOf(key.get(depth - 1)))
         .append(" -> ")
         .append(contentToString.apply(data))
         .append('\n');
    }
}
