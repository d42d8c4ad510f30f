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
import java.util.LinkedHashMap;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;

/**
 * Reads and writes raw canonical trees: nested maps (member order kept), lists and scalars.
 * JSON is the usual interchange form; YAML is accepted for hand-written fixtures.
 */
public class RawTrees {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> RAW_OBJECT = new TypeReference<LinkedHashMap<String, Object>>() {};

    private RawTrees() {}

    public static Map<String, Object> fromJson(String json) {
        try {
            return MAPPER.readValue(json, RAW_OBJECT);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid JSON tree: "+e.getMessage(), e);
        }
    }

    public static String toJson(Object raw) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot write tree as JSON: "+e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> fromYaml(String yaml) {
        Object result = new Yaml().load(yaml);
        Preconditions.checkArgument(result instanceof Map, "Expected a YAML map, not %s", result);
        return (Map<String, Object>) result;
    }

}
