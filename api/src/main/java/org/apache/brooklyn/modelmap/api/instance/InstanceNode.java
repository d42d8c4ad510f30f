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

import java.util.List;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.api.schema.SchemaNode;
import org.apache.brooklyn.modelmap.util.Maybe;

/**
 * Immutable node of a canonical tree.
 * <p>
 * Raw values are plain java structures: {@link java.util.Map} for containers and list entries,
 * {@link List} for lists and leaf-lists, and scalars (strings, numbers, booleans) for leaves.
 * Two instances hold the same data iff their raw values are equal.
 */
public interface InstanceNode {

    /** route from the root of the tree to this node */
    InstanceRoute getRoute();

    /** schema node describing this instance; null for list entries and leaf-list elements when not known */
    @Nullable
    SchemaNode getSchemaNode();

    Object getRawValue();

    /** the root of the tree this node belongs to */
    InstanceNode top();

    /** navigates from this node; absent if nothing exists at the given (relative) route */
    Maybe<InstanceNode> goTo(InstanceRoute route);

    /** the member with the given qualified name, if this is an object containing it */
    Maybe<InstanceNode> getMember(String qualifiedName);

    /** elements of a list or leaf-list instance, in order; empty for anything else */
    List<InstanceNode> getEntries();

}
