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

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.api.schema.NodeKind;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Fluent construction of {@link BasicSchemaNode} trees:
 * <pre>
 * SchemaNode schema = SchemaBuilder.root()
 *     .module("openconfig-interfaces", m -&gt; m
 *         .container("interfaces", c -&gt; c
 *             .list("interface", ImmutableList.of("name"), l -&gt; l
 *                 .leaf("name")
 *                 .container("state", s -&gt; s.config(false).leaf("counter")))))
 *     .build();
 * </pre>
 * Namespaces and the config/state flag are inherited from the parent unless set explicitly.
 */
public class SchemaBuilder {

    private final NodeKind kind;
    private final String name;
    private final List<String> keys;
    private final List<SchemaBuilder> children = Lists.newArrayList();
    @Nullable private String namespace;
    @Nullable private Boolean config;
    /** namespace given to children created while inside {@link #module(String, Consumer)} */
    @Nullable private String childNamespace;

    protected SchemaBuilder(NodeKind kind, String name, List<String> keys) {
        this.kind = kind;
        this.name = name;
        this.keys = ImmutableList.copyOf(keys);
    }

    /** starts the root of a schema; the root is a container without a name or namespace */
    public static SchemaBuilder root() {
        return new SchemaBuilder(NodeKind.CONTAINER, "", ImmutableList.<String>of());
    }

    public SchemaBuilder namespace(String namespace) {
        this.namespace = namespace;
        return this;
    }

    public SchemaBuilder config(boolean config) {
        this.config = config;
        return this;
    }

    /** children created by the given body get the given namespace */
    public SchemaBuilder module(String namespace, Consumer<SchemaBuilder> body) {
        String previous = childNamespace;
        childNamespace = namespace;
        try {
            body.accept(this);
        } finally {
            childNamespace = previous;
        }
        return this;
    }

    public SchemaBuilder container(String name, Consumer<SchemaBuilder> body) {
        return child(NodeKind.CONTAINER, name, ImmutableList.<String>of(), body);
    }

    public SchemaBuilder group(String name, Consumer<SchemaBuilder> body) {
        return child(NodeKind.GROUP, name, ImmutableList.<String>of(), body);
    }

    public SchemaBuilder list(String name, String key, Consumer<SchemaBuilder> body) {
        return list(name, ImmutableList.of(key), body);
    }

    public SchemaBuilder list(String name, List<String> keys, Consumer<SchemaBuilder> body) {
        Preconditions.checkArgument(!keys.isEmpty(), "list %s needs at least one key", name);
        return child(NodeKind.LIST, name, keys, body);
    }

    public SchemaBuilder leaf(String name) {
        return leaf(name, null);
    }

    public SchemaBuilder leaf(String name, @Nullable Consumer<SchemaBuilder> body) {
        return child(NodeKind.LEAF, name, ImmutableList.<String>of(), body);
    }

    public SchemaBuilder leaves(String ...names) {
        for (String n: Arrays.asList(names)) leaf(n);
        return this;
    }

    public SchemaBuilder leafList(String name) {
        return leafList(name, null);
    }

    public SchemaBuilder leafList(String name, @Nullable Consumer<SchemaBuilder> body) {
        return child(NodeKind.LEAF_LIST, name, ImmutableList.<String>of(), body);
    }

    /** adds a child described elsewhere, e.g. by {@link YamlSchemaLoader} */
    public SchemaBuilder child(SchemaBuilder child) {
        if (child.namespace==null && childNamespace!=null) child.namespace = childNamespace;
        children.add(child);
        return this;
    }

    protected SchemaBuilder child(NodeKind kind, String name, List<String> keys, @Nullable Consumer<SchemaBuilder> body) {
        SchemaBuilder child = newChild(kind, name, keys);
        if (body!=null) body.accept(child);
        return child(child);
    }

    static SchemaBuilder newChild(NodeKind kind, String name, List<String> keys) {
        return new SchemaBuilder(kind, Preconditions.checkNotNull(name, "name"), keys);
    }

    public SchemaNode build() {
        return build(null, null, true);
    }

    protected BasicSchemaNode build(@Nullable SchemaNode dataParent, @Nullable String parentNamespace, boolean parentConfig) {
        String ns = namespace!=null ? namespace : parentNamespace;
        boolean cfg = config!=null ? config : parentConfig;
        if (dataParent!=null && ns==null) {
            throw new IllegalStateException("No namespace for "+kind.name().toLowerCase()+" "+name);
        }
        BasicSchemaNode node = new BasicSchemaNode(kind, name, ns, cfg, keys);
        node.setParent(dataParent);

        // group members hang off the group's parent
        SchemaNode childrenParent = kind==NodeKind.GROUP ? dataParent : node;
        List<SchemaNode> built = Lists.newArrayList();
        for (SchemaBuilder child: children) {
            built.add(child.build(childrenParent, ns, cfg));
        }
        if (kind.isLeafLike() && !built.isEmpty()) {
            throw new IllegalStateException("Leaf "+name+" cannot have children");
        }
        for (String key: keys) {
            if (!hasLeaf(built, key)) {
                throw new IllegalStateException("List "+name+" has no key leaf "+key);
            }
        }
        node.setChildren(built);
        return node;
    }

    private static boolean hasLeaf(List<SchemaNode> nodes, String leafName) {
        for (SchemaNode n: nodes) {
            if (n.getKind()==NodeKind.GROUP) {
                if (hasLeaf(n.getDataChildren(), leafName)) return true;
            } else if (n.getKind()==NodeKind.LEAF && n.getName().equals(leafName)) {
                return true;
            }
        }
        return false;
    }

}
