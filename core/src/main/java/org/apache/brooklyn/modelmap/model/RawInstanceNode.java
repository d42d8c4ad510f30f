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
package org.apache.brooklyn.modelmap.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.api.instance.InstanceNode;
import org.apache.brooklyn.modelmap.api.instance.InstanceRoute;
import org.apache.brooklyn.modelmap.api.instance.InstanceRoute.EntryKeys;
import org.apache.brooklyn.modelmap.api.instance.InstanceRoute.MemberName;
import org.apache.brooklyn.modelmap.api.instance.InstanceRoute.Selector;
import org.apache.brooklyn.modelmap.api.schema.NodeKind;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;
import org.apache.brooklyn.modelmap.util.Maybe;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * {@link InstanceNode} over raw java structures (maps, lists and scalars).
 * The raw structure is not copied and must not be modified while in use.
 */
public class RawInstanceNode implements InstanceNode {

    private final Object value;
    private final InstanceRoute route;
    @Nullable private final SchemaNode schema;
    @Nullable private final RawInstanceNode root;

    /** creates the root of a tree */
    public RawInstanceNode(Object value, @Nullable SchemaNode schema) {
        this(value, InstanceRoute.ROOT, schema, null);
    }

    protected RawInstanceNode(Object value, InstanceRoute route, @Nullable SchemaNode schema, @Nullable RawInstanceNode root) {
        this.value = value;
        this.route = route;
        this.schema = schema;
        this.root = root;
    }

    @Override
    public InstanceRoute getRoute() {
        return route;
    }

    @Override
    @Nullable
    public SchemaNode getSchemaNode() {
        return schema;
    }

    @Override
    public Object getRawValue() {
        return value;
    }

    @Override
    public InstanceNode top() {
        return root==null ? this : root;
    }

    protected RawInstanceNode rootNode() {
        return root==null ? this : root;
    }

    @Override
    public Maybe<InstanceNode> goTo(InstanceRoute relative) {
        InstanceNode current = this;
        for (Selector s: relative) {
            Maybe<InstanceNode> next;
            if (s instanceof MemberName) {
                next = current.getMember(((MemberName)s).getName());
            } else {
                next = ((RawInstanceNode)current).getEntry(((EntryKeys)s).getKeys());
            }
            if (next.isAbsent()) {
                return Maybe.absent("Nonexistent instance "+current.getRoute().append(s));
            }
            current = next.get();
        }
        return Maybe.of(current);
    }

    @Override
    public Maybe<InstanceNode> getMember(String qualifiedName) {
        if (!(value instanceof Map)) return Maybe.absent(route+" is not an object");
        Map<?, ?> map = (Map<?, ?>) value;
        if (!map.containsKey(qualifiedName)) return Maybe.absent("No member "+qualifiedName+" at "+route);
        SchemaNode childSchema = schema==null ? null : SchemaNodes.findDataChild(schema, qualifiedName);
        return Maybe.<InstanceNode>of(new RawInstanceNode(map.get(qualifiedName), route.appendMember(qualifiedName), childSchema, rootNode()));
    }

    protected Maybe<InstanceNode> getEntry(Map<String, Object> keys) {
        for (InstanceNode entry: getEntries()) {
            if (matches(entry.getRawValue(), keys)) return Maybe.of(entry);
        }
        return Maybe.absent("No entry "+keys+" at "+route);
    }

    private static boolean matches(Object entry, Map<String, Object> keys) {
        if (!(entry instanceof Map)) return false;
        Map<?, ?> map = (Map<?, ?>) entry;
        for (Map.Entry<String, Object> k: keys.entrySet()) {
            Object v = map.get(k.getKey());
            if (v==null) return false;
            // keys coming from native data are often strings where the tree holds numbers
            if (!Objects.equals(v, k.getValue()) && !String.valueOf(v).equals(String.valueOf(k.getValue()))) return false;
        }
        return true;
    }

    @Override
    public List<InstanceNode> getEntries() {
        if (!(value instanceof List)) return ImmutableList.of();
        ImmutableList.Builder<InstanceNode> result = ImmutableList.builder();
        for (Object entry: (List<?>) value) {
            result.add(new RawInstanceNode(entry, entryRoute(entry), schema, rootNode()));
        }
        return result.build();
    }

    /** list entries are addressed by their keys; leaf-list elements share the route of the leaf-list */
    protected InstanceRoute entryRoute(Object entry) {
        if (schema==null || schema.getKind()!=NodeKind.LIST || !(entry instanceof Map)) return route;
        Map<String, Object> keys = Maps.newLinkedHashMap();
        for (String k: schema.getKeys()) {
            Object v = ((Map<?, ?>) entry).get(k);
            if (v!=null) keys.put(k, v);
        }
        if (keys.isEmpty()) return route;
        return route.appendEntry(keys);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()+"["+route+"="+value+"]";
    }

}
