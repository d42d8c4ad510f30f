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
package org.apache.brooklyn.modelmap.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.util.Maybe;

/**
 * Lookups into nested native maps, such as those produced by {@link IndentedConfigParser},
 * for use by handler implementations.
 */
public class NativeMaps {

    private NativeMaps() {}

    /** follows the given keys through nested maps; absent as soon as a key is missing or a value is not a map */
    public static Maybe<Object> lookup(@Nullable Object data, String ...keys) {
        Object current = data;
        for (String key: keys) {
            if (!(current instanceof Map)) return Maybe.absent("no map at '"+key+"'");
            Map<?, ?> map = (Map<?, ?>) current;
            if (!map.containsKey(key)) return Maybe.absent("no '"+key+"'");
            current = map.get(key);
        }
        return Maybe.of(current);
    }

    /** as {@link #lookup(Object, String...)} returning the value as a string, or null */
    @Nullable
    public static String text(@Nullable Object data, String ...keys) {
        Object result = lookup(data, keys).orNull();
        return result==null ? null : result.toString();
    }

    /** true if the path exists and leads to a line which ended there, e.g. <code>shutdown</code> */
    public static boolean isStandalone(@Nullable Object data, String ...keys) {
        Object map = lookup(data, keys).orNull();
        return map instanceof Map && Boolean.TRUE.equals(((Map<?, ?>) map).get(IndentedConfigParser.STANDALONE));
    }

    /** the map at the path, or an empty map */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(@Nullable Object data, String ...keys) {
        Object map = lookup(data, keys).orNull();
        if (map instanceof Map) return (Map<String, Object>) map;
        return Collections.emptyMap();
    }

    /** the value at the path as a list: empty if absent, a singleton if a single value */
    public static List<Object> list(@Nullable Object data, String ...keys) {
        Object value = lookup(data, keys).orNull();
        if (value==null) return Collections.emptyList();
        if (value instanceof List) return Collections.unmodifiableList(new ArrayList<Object>((List<?>) value));
        return Collections.singletonList(value);
    }

}
