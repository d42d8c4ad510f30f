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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.apache.brooklyn.modelmap.api.schema.NodeKind;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Reads a schema description from YAML, for example:
 * <pre>
 * - module: openconfig-interfaces
 *   children:
 *   - container: interfaces
 *     children:
 *     - list: interface
 *       key: name
 *       children:
 *       - leaf: name
 *       - container: state
 *         config: false
 *         children:
 *         - leaf: counter
 * </pre>
 * Each entry names its kind (<code>container</code>, <code>list</code>, <code>leaf</code>,
 * <code>leaf-list</code>, <code>group</code>) or is a <code>module</code> entry giving the namespace
 * of the nodes it lists. Optional keys are <code>key</code> (a name or a list of names, lists only),
 * <code>namespace</code>, <code>config</code> and <code>children</code>.
 */
public class YamlSchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(YamlSchemaLoader.class);

    private static final Map<String, NodeKind> KINDS = ImmutableMap.of(
            "container", NodeKind.CONTAINER,
            "list", NodeKind.LIST,
            "leaf", NodeKind.LEAF,
            "leaf-list", NodeKind.LEAF_LIST,
            "group", NodeKind.GROUP);

    private static final String MODULE = "module";

    public SchemaNode load(String yaml) {
        Object parsed = new Yaml().load(yaml);
        return fromYamlObject(parsed);
    }

    public SchemaNode load(Reader reader) {
        Object parsed = new Yaml().load(reader);
        return fromYamlObject(parsed);
    }

    /** loads from a classpath resource, relative to the root of the classpath */
    public SchemaNode loadResource(String resource) {
        InputStream in = YamlSchemaLoader.class.getClassLoader().getResourceAsStream(resource);
        Preconditions.checkArgument(in!=null, "No schema resource %s", resource);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read schema resource "+resource, e);
        }
    }

    /** builds the schema from the list of entries SnakeYAML produced */
    protected SchemaNode fromYamlObject(Object yamlObject) {
        SchemaBuilder root = SchemaBuilder.root();
        for (Map<?, ?> entry: entries(yamlObject, "schema")) {
            if (entry.containsKey(MODULE)) {
                String ns = string(entry.get(MODULE), MODULE);
                log.debug("Loading schema module {}", ns);
                root.module(ns, m -> {
                    for (Map<?, ?> child: entries(entry.get("children"), ns)) {
                        m.child(node(child));
                    }
                });
            } else {
                root.child(node(entry));
            }
        }
        return root.build();
    }

    protected SchemaBuilder node(Map<?, ?> entry) {
        NodeKind kind = null;
        String name = null;
        for (Map.Entry<String, NodeKind> k: KINDS.entrySet()) {
            if (entry.containsKey(k.getKey())) {
                Preconditions.checkArgument(kind==null, "Schema entry %s declares more than one kind", entry);
                kind = k.getValue();
                name = string(entry.get(k.getKey()), k.getKey());
            }
        }
        Preconditions.checkArgument(kind!=null, "Schema entry %s does not declare its kind", entry);

        List<String> keys = ImmutableList.of();
        Object key = entry.get("key");
        if (key instanceof List) {
            ImmutableList.Builder<String> kb = ImmutableList.builder();
            for (Object k: (List<?>) key) kb.add(string(k, "key"));
            keys = kb.build();
        } else if (key!=null) {
            keys = ImmutableList.of(string(key, "key"));
        }
        Preconditions.checkArgument(kind==NodeKind.LIST || keys.isEmpty(), "Only lists have keys (%s)", name);
        Preconditions.checkArgument(kind!=NodeKind.LIST || !keys.isEmpty(), "List %s needs a key", name);

        SchemaBuilder result = SchemaBuilder.newChild(kind, name, keys);
        if (entry.containsKey("namespace")) result.namespace(string(entry.get("namespace"), "namespace"));
        if (entry.containsKey("config")) result.config(Boolean.parseBoolean(String.valueOf(entry.get("config"))));
        for (Map<?, ?> child: entries(entry.get("children"), name)) {
            result.child(node(child));
        }
        return result;
    }

    private static List<Map<?, ?>> entries(Object yamlObject, String context) {
        if (yamlObject==null) return ImmutableList.of();
        Preconditions.checkArgument(yamlObject instanceof List, "Expected a list of schema entries for %s, not %s", context, yamlObject);
        ImmutableList.Builder<Map<?, ?>> result = ImmutableList.builder();
        for (Object o: (List<?>) yamlObject) {
            Preconditions.checkArgument(o instanceof Map, "Expected a schema entry in %s, not %s", context, o);
            result.add((Map<?, ?>) o);
        }
        return result.build();
    }

    private static String string(Object value, String field) {
        Preconditions.checkArgument(value!=null, "Missing value for %s", field);
        return String.valueOf(value);
    }

}
