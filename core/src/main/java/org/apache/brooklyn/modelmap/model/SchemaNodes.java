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

import com.google.common.collect.ImmutableList;

/** Static helpers over {@link SchemaNode} trees. */
public class SchemaNodes {

    private SchemaNodes() {}

    /** data children with the members of any groups spliced in place, recursively */
    public static List<SchemaNode> flattenedDataChildren(SchemaNode node) {
        ImmutableList.Builder<SchemaNode> result = ImmutableList.builder();
        addFlattened(node.getDataChildren(), result);
        return result.build();
    }

    private static void addFlattened(List<SchemaNode> children, ImmutableList.Builder<SchemaNode> result) {
        for (SchemaNode child: children) {
            if (child.getKind()==NodeKind.GROUP) {
                addFlattened(child.getDataChildren(), result);
            } else {
                result.add(child);
            }
        }
    }

    /**
     * finds the data child known by the given member name, which may be qualified
     * (<code>ns:name</code>) even where the namespace is the parent's
     */
    @Nullable
    public static SchemaNode findDataChild(SchemaNode node, String memberName) {
        for (SchemaNode child: flattenedDataChildren(node)) {
            if (memberName.equals(child.getQualifiedName()) || memberName.equals(child.getNamespace()+":"+child.getName())) {
                return child;
            }
        }
        return null;
    }

    /** the nearest {@link NodeKind#LIST} among the node and its ancestors, or null */
    @Nullable
    public static SchemaNode nearestList(SchemaNode node) {
        SchemaNode current = node;
        while (current!=null && current.getKind()!=NodeKind.LIST) {
            current = current.getParent();
        }
        return current;
    }

}
