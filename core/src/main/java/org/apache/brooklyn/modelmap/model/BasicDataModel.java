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
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.brooklyn.modelmap.api.instance.ContentType;
import org.apache.brooklyn.modelmap.api.instance.DataModel;
import org.apache.brooklyn.modelmap.api.instance.InstanceNode;
import org.apache.brooklyn.modelmap.api.instance.ValidationException;
import org.apache.brooklyn.modelmap.api.schema.InvalidSchemaPathException;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;
import org.apache.brooklyn.modelmap.api.schema.SchemaNodeNotFoundException;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * {@link DataModel} over a {@link SchemaNode} tree, typically from {@link SchemaBuilder} or {@link YamlSchemaLoader},
 * building {@link RawInstanceNode} trees.
 * <p>
 * Validation is structural only: known members, the right shape for each node kind,
 * key leaves present and unique in list entries, and no state data where only configuration is allowed.
 */
public class BasicDataModel implements DataModel {

    private static final Pattern SEGMENT = Pattern.compile("([A-Za-z_][\\w.-]*:)?[A-Za-z_][\\w.-]*");

    private final SchemaNode schema;

    public BasicDataModel(SchemaNode schema) {
        this.schema = Preconditions.checkNotNull(schema, "schema");
    }

    public static BasicDataModel fromYamlResource(String resource) {
        return new BasicDataModel(new YamlSchemaLoader().loadResource(resource));
    }

    @Override
    public SchemaNode getSchema() {
        return schema;
    }

    @Override
    public SchemaNode getSchemaNode(String path) {
        if (path==null || !path.startsWith("/")) {
            throw new InvalidSchemaPathException(path, "must start with /");
        }
        if (path.equals("/")) return schema;

        List<String> segments = Splitter.on('/').splitToList(path.substring(1));
        for (String segment: segments) {
            if (!SEGMENT.matcher(segment).matches()) {
                throw new InvalidSchemaPathException(path, "bad segment '"+segment+"'");
            }
        }
        SchemaNode current = schema;
        for (String segment: segments) {
            current = SchemaNodes.findDataChild(current, segment);
            if (current==null) throw new SchemaNodeNotFoundException(path);
        }
        return current;
    }

    @Override
    public InstanceNode fromRaw(Object raw) {
        return new RawInstanceNode(raw, schema);
    }

    @Override
    public void validate(Object raw, ContentType contentType) {
        if (!(raw instanceof Map)) {
            throw new ValidationException("/", "expected an object, not "+describe(raw));
        }
        validateObject((Map<?, ?>) raw, schema, "", contentType);
    }

    protected void validateObject(Map<?, ?> raw, SchemaNode node, String path, ContentType contentType) {
        for (Map.Entry<?, ?> member: raw.entrySet()) {
            String name = String.valueOf(member.getKey());
            String memberPath = path + "/" + name;
            SchemaNode child = SchemaNodes.findDataChild(node, name);
            if (child==null) {
                throw new ValidationException(memberPath, "unknown member '"+name+"'");
            }
            if (!child.isConfig() && contentType==ContentType.CONFIG) {
                throw new ValidationException(memberPath, "state data not allowed in configuration");
            }
            validateValue(member.getValue(), child, memberPath, contentType);
        }
    }

    protected void validateValue(Object value, SchemaNode node, String path, ContentType contentType) {
        switch (node.getKind()) {
        case CONTAINER:
            if (!(value instanceof Map)) throw new ValidationException(path, "expected an object, not "+describe(value));
            validateObject((Map<?, ?>) value, node, path, contentType);
            return;
        case LIST:
            if (!(value instanceof List)) throw new ValidationException(path, "expected an array, not "+describe(value));
            Set<List<Object>> seen = Sets.newHashSet();
            for (Object entry: (List<?>) value) {
                if (!(entry instanceof Map)) throw new ValidationException(path, "expected list entries to be objects, not "+describe(entry));
                List<Object> keyValues = Lists.newArrayList();
                for (String key: node.getKeys()) {
                    Object keyValue = ((Map<?, ?>) entry).get(key);
                    if (keyValue==null) throw new ValidationException(path, "entry missing key '"+key+"'");
                    keyValues.add(keyValue);
                }
                if (!seen.add(keyValues)) throw new ValidationException(path, "duplicate entry "+keyValues);
                validateObject((Map<?, ?>) entry, node, path+keyValues, contentType);
            }
            return;
        case LEAF:
            if (!isScalar(value)) throw new ValidationException(path, "expected a scalar, not "+describe(value));
            return;
        case LEAF_LIST:
            if (!(value instanceof List)) throw new ValidationException(path, "expected an array, not "+describe(value));
            for (Object v: (List<?>) value) {
                if (!isScalar(v)) throw new ValidationException(path, "expected scalar elements, not "+describe(v));
            }
            return;
        default:
            throw new ValidationException(path, "unsupported node kind "+node.getKind());
        }
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static String describe(Object value) {
        return value==null ? "null" : value.getClass().getSimpleName()+" "+value;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()+"["+schema.getDataChildren()+"]";
    }

}
