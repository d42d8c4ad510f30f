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
package org.apache.brooklyn.modelmap.filter;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Decides which canonical paths take part in a partial traversal.
 * <p>
 * A path passes if it is an ancestor or a descendant of (or equal to) one of the included prefixes,
 * so that walking down from the root still reaches the included branches,
 * and it is not exactly one of the excluded paths.
 */
public class ModelFilter {

    /** includes everything */
    public static final ModelFilter ALL = new ModelFilter(null, null);

    private final List<String> include;
    private final ImmutableSet<String> exclude;

    public ModelFilter(@Nullable List<String> include, @Nullable List<String> exclude) {
        this.include = include==null || include.isEmpty() ? ImmutableList.of("") : ImmutableList.copyOf(include);
        this.exclude = exclude==null ? ImmutableSet.<String>of() : ImmutableSet.copyOf(exclude);
    }

    public List<String> getInclude() {
        return include;
    }

    public ImmutableSet<String> getExclude() {
        return exclude;
    }

    public boolean check(String path) {
        return isIncluded(path) && !exclude.contains(path);
    }

    private boolean isIncluded(String path) {
        for (String inc: include) {
            if (inc.startsWith(path) || path.startsWith(inc)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()+"[include="+include+"; exclude="+exclude+"]";
    }

}
