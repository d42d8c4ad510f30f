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
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.brooklyn.modelmap.text;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

/**
 * Reads configuration in the indentation-structured style of industry standard CLIs (IOS-style)
 * into nested maps.
 * <p>
 * The block
 * <pre>
 * interface FastEthernet1
 *     description this is a description
 *     switchport mode access
 *     shutdown
 * </pre>
 * gives
 * <pre>
 * #list: []
 * #text: interface FastEthernet1
 * interface:
 *   #text: FastEthernet1
 *   FastEthernet1:
 *     #standalone: true
 *     #list: [ {description: ...}, {switchport: ...} ]
 *     #text: shutdown
 *     description:
 *       #text: this is a description
 *       this:
 *         #text: is a description
 *         ...
 *     switchport:
 *       #text: mode access
 *       mode:
 *         #text: access
 *         access:
 *           #standalone: true
 *     shutdown:
 *       #standalone: true
 * </pre>
 * That is: indentation gives the hierarchy; every word of a line is one nesting level;
 * {@value #TEXT} holds the rest of the line from that level on; {@value #STANDALONE} marks the word
 * a line ends with; and {@value #LIST} keeps, in order, the (first word, sub-map) pairs of the
 * multi-word lines of a nested block, so repeated sibling commands can still be told apart.
 * <p>
 * Indentation is not checked for consistency: an ambiguous dedent closes whichever blocks the
 * indentation arithmetic says it does.
 */
public class IndentedConfigParser {

    public static final String TEXT = "#text";
    public static final String STANDALONE = "#standalone";
    public static final String LIST = "#list";

    private static final Splitter LINES = Splitter.onPattern("\r?\n");
    private static final Splitter WORDS = Splitter.on(' ');
    private static final Joiner JOIN_WORDS = Joiner.on(' ');

    private IndentedConfigParser() {}

    public static Map<String, Object> parse(String config) {
        return parse(LINES.splitToList(config));
    }

    public static Map<String, Object> parse(List<String> lines) {
        return parse(new ArrayDeque<String>(lines), 0, 0, false);
    }

    /**
     * Consumes lines from the front of <code>config</code> until the block at <code>currentIndent</code> ends.
     * Lines belonging to an enclosing block are pushed back for the caller.
     *
     * @param previousIndent indentation of the enclosing block
     * @param nested whether this call parses the block under a line (as opposed to a top-level sequence of lines)
     */
    public static Map<String, Object> parse(Deque<String> config, int currentIndent, int previousIndent, boolean nested) {
        Map<String, Object> parsed = new LinkedHashMap<String, Object>();
        while (!config.isEmpty()) {
            String line = CharMatcher.whitespace().trimTrailingFrom(config.pollFirst());
            String last = CharMatcher.whitespace().trimLeadingFrom(line);
            if (last.startsWith("!") || last.isEmpty()) {
                continue;
            }
            int leadingSpaces = line.length() - last.length();

            if (leadingSpaces > currentIndent) {
                Map<String, Object> current = parse(config, leadingSpaces, currentIndent, true);
                attachDataToPath(parsed, last, current, nested);
            } else if (leadingSpaces < currentIndent) {
                config.addFirst(line);
                break;
            } else if (!nested) {
                // a line at our own level opens its own block
                Map<String, Object> current = parse(config, leadingSpaces, currentIndent, true);
                attachDataToPath(parsed, last, current, nested);
            } else {
                config.addFirst(line);
                break;
            }
        }
        return parsed;
    }

    @SuppressWarnings("unchecked")
    static void attachDataToPath(Map<String, Object> obj, String pathText, Map<String, Object> data, boolean list) {
        List<Object> listEntries = (List<Object>) obj.get(LIST);
        if (listEntries==null) {
            listEntries = Lists.newArrayList();
            obj.put(LIST, listEntries);
        }

        LinkedList<String> path = Lists.newLinkedList(WORDS.split(pathText));
        Map<String, Object> o = obj;
        boolean first = true;
        String p;
        while (true) {
            o.put(TEXT, JOIN_WORDS.join(path));
            p = path.removeFirst();
            if (path.isEmpty()) break;

            o = childMap(o, p);
            if (first && list) {
                Map<String, Object> entry = new LinkedHashMap<String, Object>();
                entry.put(p, o);
                listEntries.add(entry);
                first = false;
            }
        }

        Object existing = o.get(p);
        if (existing instanceof Map) {
            ((Map<String, Object>) existing).putAll(data);
        } else {
            o.put(p, data);
        }
        ((Map<String, Object>) o.get(p)).put(STANDALONE, true);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> childMap(Map<String, Object> parent, String word) {
        Object child = parent.get(word);
        if (child instanceof Map) return (Map<String, Object>) child;
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        parent.put(word, result);
        return result;
    }

}
