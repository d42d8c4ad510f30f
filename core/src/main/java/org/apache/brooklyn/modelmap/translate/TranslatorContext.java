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
package org.apache.brooklyn.modelmap.translate;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.api.ModelException;
import org.apache.brooklyn.modelmap.api.instance.InstanceNode;
import org.apache.brooklyn.modelmap.api.instance.InstanceRoute;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;
import org.apache.brooklyn.modelmap.model.SchemaNodes;
import org.apache.brooklyn.modelmap.util.Maybe;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Immutable state for one frame of a translation.
 * <p>
 * {@link #getResult()} and {@link #getRootResult()} are accumulators, typically mutable
 * (e.g. a {@link org.apache.brooklyn.modelmap.text.ConfigTree} section); hooks may replace
 * them in the copy they return, which is what children and the matching post hook then see.
 */
public class TranslatorContext {

    private final SchemaNode schema;
    private final InstanceRoute path;
    @Nullable private final Object result;
    @Nullable private final Object rootResult;
    private final ImmutableMap<String, Object> keys;
    private final InstanceNode candidate;
    @Nullable private final InstanceNode running;
    private final boolean replace;
    private final ImmutableList<InstanceNode> toRemove;
    private final List<Object> valuesToRemove;
    private final Map<String, Object> extra;

    TranslatorContext(SchemaNode schema, InstanceRoute path, @Nullable Object result, @Nullable Object rootResult,
            Map<String, ?> keys, InstanceNode candidate, @Nullable InstanceNode running, boolean replace,
            List<InstanceNode> toRemove, List<?> valuesToRemove, Map<String, Object> extra) {
        this.schema = Preconditions.checkNotNull(schema, "schema");
        this.path = Preconditions.checkNotNull(path, "path");
        this.result = result;
        this.rootResult = rootResult;
        this.keys = ImmutableMap.copyOf(keys);
        this.candidate = Preconditions.checkNotNull(candidate, "candidate");
        this.running = running;
        this.replace = replace;
        this.toRemove = ImmutableList.copyOf(toRemove);
        this.valuesToRemove = Collections.unmodifiableList(Lists.<Object>newArrayList(valuesToRemove));
        this.extra = Preconditions.checkNotNull(extra, "extra");
    }

    static TranslatorContext root(SchemaNode schema, InstanceNode candidate, @Nullable InstanceNode running,
            boolean replace, Map<String, Object> extra) {
        return new TranslatorContext(schema, InstanceRoute.ROOT, null, null, ImmutableMap.<String, Object>of(),
            candidate, running, replace, ImmutableList.<InstanceNode>of(), ImmutableList.of(), extra);
    }

    /** the schema node being processed: a container, a list, or the root */
    public SchemaNode getSchema() {
        return schema;
    }

    /** route of the container or list entry being processed */
    public InstanceRoute getPath() {
        return path;
    }

    @Nullable
    public Object getResult() {
        return result;
    }

    @Nullable
    public Object getRootResult() {
        return rootResult;
    }

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
            throw new ModelException("No list encloses "+schema.getDataPath(), path.toString());
        }
        Object key = keys.get(list.getDataPath());
        if (key==null) {
            throw new ModelException("No entry of "+list.getDataPath()+" is being processed", path.toString());
        }
        return key;
    }

    public InstanceNode getCandidate() {
        return candidate;
    }

    /** the current data, or null when none was supplied */
    @Nullable
    public InstanceNode getRunning() {
        return running;
    }

    public boolean isReplace() {
        return replace;
    }

    /** running entries of the list being processed which are absent from the candidate */
    public List<InstanceNode> getToRemove() {
        return toRemove;
    }

    /** running values of the leaf-list being processed which are absent from the candidate */
    public List<Object> getValuesToRemove() {
        return valuesToRemove;
    }

    public Map<String, Object> getExtra() {
        return extra;
    }

    /** raw candidate value at {@link #getPath()}, or null */
    @Nullable
    public Object candidateValue() {
        return candidateValue(path);
    }

    @Nullable
    public Object candidateValue(InstanceRoute route) {
        return rawValue(candidate, route);
    }

    /** raw running value at {@link #getPath()}, or null (including when there is no running data) */
    @Nullable
    public Object runningValue() {
        return runningValue(path);
    }

    @Nullable
    public Object runningValue(InstanceRoute route) {
        return running==null ? null : rawValue(running, route);
    }

    @Nullable
    private static Object rawValue(InstanceNode tree, InstanceRoute route) {
        Maybe<InstanceNode> node = tree.goTo(route);
        return node.isPresent() ? node.get().getRawValue() : null;
    }

    public TranslatorContext withResult(@Nullable Object result) {
        return new TranslatorContext(schema, path, result, rootResult, keys, candidate, running, replace, toRemove, valuesToRemove, extra);
    }

    public TranslatorContext withRootResult(@Nullable Object rootResult) {
        return new TranslatorContext(schema, path, result, rootResult, keys, candidate, running, replace, toRemove, valuesToRemove, extra);
    }

    public TranslatorContext withPath(InstanceRoute path) {
        return new TranslatorContext(schema, path, result, rootResult, keys, candidate, running, replace, toRemove, valuesToRemove, extra);
    }

    public TranslatorContext withKey(String listPath, Object key) {
        Preconditions.checkNotNull(key, "key for %s", listPath);
        Map<String, Object> newKeys = Maps.newLinkedHashMap(keys);
        newKeys.put(listPath, key);
        return new TranslatorContext(schema, path, result, rootResult, newKeys, candidate, running, replace, toRemove, valuesToRemove, extra);
    }

    public TranslatorContext withToRemove(List<InstanceNode> toRemove) {
        return new TranslatorContext(schema, path, result, rootResult, keys, candidate, running, replace, toRemove, valuesToRemove, extra);
    }

    public TranslatorContext withValuesToRemove(List<?> valuesToRemove) {
        return new TranslatorContext(schema, path, result, rootResult, keys, candidate, running, replace, toRemove, valuesToRemove, extra);
    }

    TranslatorContext withSchema(SchemaNode schema) {
        return new TranslatorContext(schema, path, result, rootResult, keys, candidate, running, replace, toRemove, valuesToRemove, extra);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("path", path).add("replace", replace).add("keys", keys).toString();
    }

}
