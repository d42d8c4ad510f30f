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

import org.apache.brooklyn.modelmap.api.schema.InvalidSchemaPathException;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;
import org.apache.brooklyn.modelmap.api.schema.SchemaNodeNotFoundException;

/**
 * Entry point to an external schema: resolves schema paths, builds instance trees from raw data
 * and validates raw data.
 */
public interface DataModel {

    /** the schema root, whose data children are the top-level nodes of all modules */
    SchemaNode getSchema();

    /**
     * @throws InvalidSchemaPathException if the path is not syntactically a schema path
     * @throws SchemaNodeNotFoundException if the path is well-formed but names no node
     */
    SchemaNode getSchemaNode(String path);

    /** builds the root instance of a tree from its raw form (normally a map keyed by qualified member names) */
    InstanceNode fromRaw(Object raw);

    /** @throws ValidationException describing the first problem found */
    void validate(Object raw, ContentType contentType);

}
