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
package org.apache.brooklyn.modelmap.handler;

import org.apache.brooklyn.modelmap.api.schema.NodeKind;

/** What a schema child name is bound to in a handler. */
public enum BindingKind {
    /** a nested handler for a container */
    CONTAINER,
    /** a nested handler for a list, applied to each of its entries */
    LIST,
    /** an accessor for a leaf */
    LEAF,
    /** an accessor for a leaf-list */
    LEAF_LIST,
    /** deliberately not processed; nothing is logged */
    UNNEEDED;

    /** whether a binding of this kind may be used for a schema node of the given kind */
    public boolean accepts(NodeKind kind) {
        switch (this) {
        case CONTAINER: return kind==NodeKind.CONTAINER;
        case LIST: return kind==NodeKind.LIST;
        case LEAF: return kind==NodeKind.LEAF;
        case LEAF_LIST: return kind==NodeKind.LEAF_LIST;
        case UNNEEDED: return kind!=NodeKind.GROUP;
        default: return false;
        }
    }
}
