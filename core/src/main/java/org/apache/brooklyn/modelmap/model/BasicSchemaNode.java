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

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.api.schema.NodeKind;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Simple in-memory {@link SchemaNode}. Created by {@link SchemaBuilder}; immutable once built.
 * <p>
 * Children of a {@link NodeKind#GROUP} report the group's own parent as their parent,
 * as the group adds no level to data paths.
 */
public class BasicSchemaNode implements SchemaNode {

    private final NodeKind kind;
    private final String name;
    @Nullable private final String namespace;
    private final boolean config;
    private final List<String> keys;
    @Nullable private SchemaNode parent;
    private List<SchemaNode> children = ImmutableList.of();
    private String dataPath;

    BasicSchemaNode(NodeKind kind, String name, @Nullable String namespace, boolean config, List<String> keys) {
        this.kind = Preconditions.checkNotNull(kind, "kind");
        this.name = Preconditions.checkNotNull(name, "name");
        this.namespace = namespace;
        this.config = config;
        this.keys = ImmutableList.copyOf(keys);
    }

    void setParent(@Nullable SchemaNode parent) {
        this.parent = parent;
        if (parent==null) {
            dataPath = "/";
        } else if (kind==NodeKind.GROUP) {
            dataPath = parent.getDataPath();
        } else {
            String parentPath = parent.getDataPath();
            dataPath = (parentPath.endsWith("/") ? parentPath : parentPath+"/") + getQualifiedName();
        }
    }

    void setChildren(List<SchemaNode> children) {
        this.children = ImmutableList.copyOf(children);
    }

    @Override
    public NodeKind getKind() {
        return kind;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    @Nullable
    public String getNamespace() {
        return namespace;
    }

    @Override
    @Nullable
    public SchemaNode getParent() {
        return parent;
    }

    @Override
    public String getDataPath() {
        return dataPath;
    }

    @Override
    public List<SchemaNode> getDataChildren() {
        return children;
    }

    @Override
    public List<String> getKeys() {
        return keys;
    }

    @Override
    public boolean isConfig() {
        return config;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase()+"["+dataPath+(kind==NodeKind.GROUP ? ":"+name : "")+"]";
    }

}
