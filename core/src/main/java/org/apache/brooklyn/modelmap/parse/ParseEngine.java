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

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.apache.brooklyn.modelmap.api.ModelException;
import org.apache.brooklyn.modelmap.api.schema.NodeKind;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;
import org.apache.brooklyn.modelmap.filter.ModelFilter;
import org.apache.brooklyn.modelmap.handler.Binding;
import org.apache.brooklyn.modelmap.handler.HandlerNotImplementedException;
import org.apache.brooklyn.modelmap.handler.UnsupportedNodeKindException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Walks the schema, dispatching each child to the binding in the current {@link Parser},
 * and accumulates the canonical tree (maps keyed by qualified member name, lists of maps, scalars).
 */
class ParseEngine {

    private static final Logger log = LoggerFactory.getLogger(ParseEngine.class);

    private final ModelFilter filter;
    private final boolean config;
    private final boolean state;

    ParseEngine(ModelFilter filter, boolean config, boolean state) {
        this.filter = filter;
        this.config = config;
        this.state = state;
    }

    /**
     * @param inheritedKeys names of the key leaves of the list whose entry this is,
     *   which are read even where the filter excludes them
     */
    Map<String, Object> processContainer(Parser parser, ParserContext context, Collection<String> inheritedKeys) {
        String path = context.getSchema().getDataPath();
        log.debug("{}: processing container", path);
        ParserContext ctx = parser.preProcess(context);
        Map<String, Object> result = Maps.newLinkedHashMap();
        if (!filter.check(path)) {
            log.debug("{}: excluded by filter", path);
            return result;
        }
        for (SchemaNode child: ctx.getSchema().getDataChildren()) {
            processChild(parser, ctx, child, inheritedKeys, result);
        }
        parser.postProcess(ctx);
        return result;
    }

    List<Map<String, Object>> processList(Parser parser, ParserContext context) {
        SchemaNode list = context.getSchema();
        String path = list.getDataPath();
        log.debug("{}: processing list", path);
        ElementExtractor extractor = parser.getElementExtractor();
        if (extractor==null) {
            throw new HandlerNotImplementedException("No element extraction for list "+path, path);
        }
        List<Map<String, Object>> result = Lists.newArrayList();
        List<String> keyNames = list.getKeys();
        for (Map.Entry<?, ?> element: extractor.extractElements(context)) {
            ParserContext elementContext = context.withKey(path, element.getKey()).withNativeData(element.getValue());
            result.add(processContainer(parser, elementContext, keyNames));
        }
        return result;
    }

    private void processChild(Parser parser, ParserContext ctx, SchemaNode child, Collection<String> inheritedKeys, Map<String, Object> result) {
        NodeKind kind = child.getKind();
        if (kind==NodeKind.GROUP) {
            for (SchemaNode member: child.getDataChildren()) {
                processChild(parser, ctx, member, inheritedKeys, result);
            }

        } else if (kind==NodeKind.CONTAINER) {
            Binding<Parser, LeafParser> binding = resolve(parser, child);
            if (binding==null) return;
            Map<String, Object> value = processContainer(binding.getHandler(), ctx.withSchema(child), ImmutableList.<String>of());
            if (!value.isEmpty()) result.put(child.getQualifiedName(), value);

        } else if (kind==NodeKind.LIST) {
            Binding<Parser, LeafParser> binding = resolve(parser, child);
            if (binding==null) return;
            List<Map<String, Object>> value = processList(binding.getHandler(), ctx.withSchema(child));
            if (!value.isEmpty()) result.put(child.getQualifiedName(), value);

        } else if (kind==NodeKind.LEAF || kind==NodeKind.LEAF_LIST) {
            if (!inheritedKeys.contains(child.getName())) {
                if (!filter.check(child.getDataPath())) {
                    log.debug("{}: excluded by filter", child.getDataPath());
                    return;
                }
                if ((child.isConfig() && !config) || (!child.isConfig() && !state)) {
                    return;
                }
            }
            Binding<Parser, LeafParser> binding = resolve(parser, child);
            if (binding==null) return;
            Object value = binding.getAccessor().parse(ctx);
            if (value!=null) result.put(child.getQualifiedName(), value);

        } else {
            log.error("{}: don't know how to process {} of kind {}", ctx.getSchema().getDataPath(), child.getName(), kind);
            throw new UnsupportedNodeKindException("Cannot process "+child.getName()+" of kind "+kind, child.getDataPath());
        }
    }

    /** the binding to use, or null if the child is not to be processed */
    private Binding<Parser, LeafParser> resolve(Parser parser, SchemaNode child) throws ModelException {
        Binding<Parser, LeafParser> binding = parser.getBinding(child.getName());
        if (binding==null) {
            log.info("{}: doesn't implement {}:{}", child.getParent()==null ? "/" : child.getParent().getDataPath(),
                child.getNamespace(), child.getName());
            return null;
        }
        if (binding.isUnneeded()) {
            return null;
        }
        return binding.checkFor(child);
    }

}
