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
package org.apache.brooklyn.modelmap.api.instance;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Immutable address of an instance inside a canonical tree: a sequence of member selectors
 * (by qualified member name) and entry selectors (list entries identified by their key leaves).
 */
public final class InstanceRoute implements Iterable<InstanceRoute.Selector> {

    public static final InstanceRoute ROOT = new InstanceRoute(ImmutableList.<Selector>of());

    public static abstract class Selector {
        private Selector() {}
    }

    /** selects the member of an object with the given qualified name */
    public static final class MemberName extends Selector {
        private final String name;
        public MemberName(String name) {
            this.name = Preconditions.checkNotNull(name, "name");
        }
        public String getName() {
            return name;
        }
        @Override
        public boolean equals(Object obj) {
            return obj instanceof MemberName && name.equals(((MemberName)obj).name);
        }
        @Override
        public int hashCode() {
            return name.hashCode();
        }
        @Override
        public String toString() {
            return "/"+name;
        }
    }

    /** selects the entry of a list whose key leaves have the given values */
    public static final class EntryKeys extends Selector {
        private final Map<String, Object> keys;
        public EntryKeys(Map<String, ?> keys) {
            Preconditions.checkArgument(!keys.isEmpty(), "at least one key is required");
            this.keys = ImmutableMap.copyOf(keys);
        }
        public Map<String, Object> getKeys() {
            return keys;
        }
        @Override
        public boolean equals(Object obj) {
            return obj instanceof EntryKeys && keys.equals(((EntryKeys)obj).keys);
        }
        @Override
        public int hashCode() {
            return keys.hashCode();
        }
        @Override
        public String toString() {
            return "["+Joiner.on(",").withKeyValueSeparator("=").join(keys)+"]";
        }
    }

    private final List<Selector> selectors;

    private InstanceRoute(List<Selector> selectors) {
        this.selectors = selectors;
    }

    public static InstanceRoute of(Selector ...selectors) {
        return new InstanceRoute(ImmutableList.copyOf(selectors));
    }

    public InstanceRoute appendMember(String name) {
        return append(new MemberName(name));
    }

    public InstanceRoute appendEntry(Map<String, ?> keys) {
        return append(new EntryKeys(keys));
    }

    public InstanceRoute append(Selector selector) {
        return new InstanceRoute(ImmutableList.<Selector>builder().addAll(selectors).add(selector).build());
    }

    /** the route with the last selector dropped; the root is its own parent */
    public InstanceRoute getParent() {
        if (selectors.isEmpty()) return this;
        return new InstanceRoute(selectors.subList(0, selectors.size()-1));
    }

    public List<Selector> getSelectors() {
        return selectors;
    }

    public boolean isRoot() {
        return selectors.isEmpty();
    }

    public int size() {
        return selectors.size();
    }

    @Override
    public Iterator<Selector> iterator() {
        return selectors.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof InstanceRoute && Objects.equal(selectors, ((InstanceRoute)obj).selectors);
    }

    @Override
    public int hashCode() {
        return selectors.hashCode();
    }

    @Override
    public String toString() {
        if (selectors.isEmpty()) return "/";
        return Joiner.on("").join(selectors);
    }

}
