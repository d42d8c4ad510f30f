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
package org.apache.brooklyn.modelmap.api.schema;

import java.util.List;

import javax.annotation.Nullable;

/**
 * Read-only view of a node of an externally declared schema.
 * <p>
 * Implementations are expected to be immutable.
 */
public interface SchemaNode {

    NodeKind getKind();

    String getName();

    /** module namespace, or null for the schema root */
    @Nullable
    String getNamespace();

    /** null for the schema root */
    @Nullable
    SchemaNode getParent();

    /**
     * canonical path of the node, e.g. <code>/openconfig-interfaces:interfaces/interface/config</code>;
     * the root is <code>/</code>
     */
    String getDataPath();

    /** data children in schema order; group nodes are returned as they are, not flattened */
    List<SchemaNode> getDataChildren();

    /** names of the key leaves; empty unless this is a {@link NodeKind#LIST} */
    List<String> getKeys();

    /** true for configuration data, false for state data */
    boolean isConfig();

    /**
     * The member name used for this node in canonical trees:
     * <code>namespace:name</code> where the namespace differs from the parent's, otherwise just the name.
     */
    default String getQualifiedName() {
        SchemaNode parent = getParent();
        String ns = getNamespace();
        if (ns==null || (parent!=null && ns.equals(parent.getNamespace()))) {
            return getName();
        }
        return ns + ":" + getName();
    }

}
