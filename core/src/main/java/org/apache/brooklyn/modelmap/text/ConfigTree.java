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

import java.util.Iterator;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Accumulates a hierarchical configuration such as:
 * <pre>
 * interface Gi1
 *    description "A description for Gi1"
 *    shutdown
 *    exit
 * !
 * interface Gi2
 *    description "A description for Gi2"
 *    exit
 * !
 * logging something something
 * logging something else
 * </pre>
 * The header starts a section (<code>interface Gi1</code>; empty for the root) and the commands are the lines
 * within it. Children are kept strictly in insertion order since devices are sensitive to command order.
 * <pre>
 * ConfigTree config = new ConfigTree();
 * ConfigTree gi1 = config.newSection("interface Gi1");
 * gi1.addCommand("   shutdown");
 * gi1.addCommand("   exit");
 * config.addCommand("logging something else");
 * String text = config.toString();
 * </pre>
 */
public class ConfigTree {

    @Nullable
    private final String header;
    /** each child is either a {@link String} command or a nested {@link ConfigTree} */
    private final List<Object> children = Lists.newArrayList();

    public ConfigTree() {
        this(null);
    }

    public ConfigTree(@Nullable String header) {
        this.header = header;
    }

    @Nullable
    public String getHeader() {
        return header;
    }

    /** creates a new section, appends it to this one and returns it */
    public ConfigTree newSection(String header) {
        ConfigTree section = new ConfigTree(header);
        children.add(section);
        return section;
    }

    /** appends a command, unless exactly the same command is already a direct child */
    public void addCommand(String command) {
        if (!children.contains(command)) {
            children.add(command);
        }
    }

    /**
     * Removes and returns the first direct child section with the given header.
     * @throws IllegalArgumentException if there is no such section
     */
    public ConfigTree popSection(String header) {
        for (Iterator<Object> ci = children.iterator(); ci.hasNext(); ) {
            Object child = ci.next();
            if (child instanceof ConfigTree && header.equals(((ConfigTree)child).header)) {
                ci.remove();
                return (ConfigTree) child;
            }
        }
        throw new IllegalArgumentException("couldn't find "+header);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public List<Object> getChildren() {
        return ImmutableList.copyOf(children);
    }

    /** the configuration text: the header line if any, then every child depth-first, one line each */
    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        appendTo(text);
        return text.toString();
    }

    protected void appendTo(StringBuilder text) {
        if (!Strings.isNullOrEmpty(header)) {
            text.append(header).append("\n");
        }
        for (Object child: children) {
            if (child instanceof ConfigTree) {
                ((ConfigTree)child).appendTo(text);
            } else {
                text.append(child).append("\n");
            }
        }
    }

}
