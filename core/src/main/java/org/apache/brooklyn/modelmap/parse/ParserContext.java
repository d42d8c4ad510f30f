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
package org.apache.brooklyn.modelmap.parse;

import java.util.Map;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.api.ModelException;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;
import org.apache.brooklyn.modelmap.model.SchemaNodes;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * Immutable state for one frame of a parse.
 * Hooks return a modified copy, which is then what children and later hooks see;
 * the parent frame keeps its own context.
 */
public class ParserContext {

    private final SchemaNode schema;
    @Nullable private final Object nativeData;
    @Nullable private final Object rootNativeData;
    private final ImmutableMap<String, Object> keys;
    private final Map<String, Object> extra;

    public ParserContext(SchemaNode schema, @Nullable Object nativeData, @Nullable Object rootNativeData,
            Map<String, ?> keys, Map<String, Object> extra) {
        this.schema = Preconditions.checkNotNull(schema, "schema");
        this.nativeData = nativeData;
        this.rootNativeData = rootNativeData;
        this.keys = ImmutableMap.copyOf(keys);
        this.extra = Preconditions.checkNotNull(extra, "extra");
    }

    /** the schema node being processed: a container, a list, or the root */
    public SchemaNode getSchema() {
        return schema;
    }

    @Nullable
    public Object getNativeData() {
        return nativeData;
    }

    @Nullable
    public Object getRootNativeData() {
        return rootNativeData;
    }

    /** key value of the current entry of every enclosing list, by the list's data path */
    public Map<String, Object> getKeys() {
        return keys;
    }

    /**
     * The key value of the current entry of the nearest enclosing list.
     * @throws ModelException if not within a list entry
     */
    public Object getKey() {
        SchemaNode list = SchemaNodes.nearestList(schema);
        if (list==null) {
            throw new ModelException("No list encloses "+schema.getDataPath(), schema.getDataPath());
        }
        Object result = keys.get(list.getDataPath());
        if (result==null) {
            throw new ModelException("No entry of "+list.getDataPath()+" is being processed", schema.getDataPath());
        }
        return result;
    }

    /** caller-supplied map, the same instance throughout the parse */
    public Map<String, Object> getExtra() {
        return extra;
    }

    public ParserContext withNativeData(@Nullable Object nativeData) {
        return new ParserContext(schema, nativeData, rootNativeData, keys, extra);
    }

    public ParserContext withRootNativeData(@Nullable Object rootNativeData) {
        return new ParserContext(schema, nativeData, rootNativeData, keys, extra);
    }

    public ParserContext withKey(String listPath, Object key) {
        Preconditions.checkNotNull(key, "key for %s", listPath);
        Map<String, Object> newKeys = Maps.newLinkedHashMap(keys);
        newKeys.put(listPath, key);
        return new ParserContext(schema, nativeData, rootNativeData, newKeys, extra);
    }

    ParserContext withSchema(SchemaNode schema) {
        return new ParserContext(schema, nativeData, rootNativeData, keys, extra);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("path", schema.getDataPath()).add("keys", keys).toString();
    }

}
