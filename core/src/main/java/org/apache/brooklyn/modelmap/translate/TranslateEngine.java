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
import java.util.Objects;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.api.ModelException;
import org.apache.brooklyn.modelmap.api.instance.InstanceNode;
import org.apache.brooklyn.modelmap.api.instance.InstanceRoute;
import org.apache.brooklyn.modelmap.api.schema.NodeKind;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;
import org.apache.brooklyn.modelmap.handler.Binding;
import org.apache.brooklyn.modelmap.handler.UnsupportedNodeKindException;
import org.apache.brooklyn.modelmap.util.Maybe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Walks the schema alongside the candidate and running instances, only descending where
 * the data requires output: everything present in the candidate when replacing,
 * otherwise only what differs from running.
 */
class TranslateEngine {

    private static final Logger log = LoggerFactory.getLogger(TranslateEngine.class);

    void processContainer(Translator translator, TranslatorContext context) {
        log.debug("{}: processing container", context.getPath());
        TranslatorContext ctx = translator.preProcess(context);
        for (SchemaNode child: ctx.getSchema().getDataChildren()) {
            processChild(translator, ctx, child);
        }
        translator.postProcess(ctx);
    }

    void processList(Translator translator, TranslatorContext context) {
        SchemaNode list = context.getSchema();
        InstanceRoute path = context.getPath();
        log.debug("{}: processing list", path);

        List<InstanceNode> toRemove = Lists.newArrayList();
        InstanceNode running = context.getRunning();
        if (running!=null) {
            for (InstanceNode entry: entries(running, path)) {
                if (context.getCandidate().goTo(entry.getRoute()).isAbsent()) {
                    toRemove.add(entry);
                }
            }
        }
        TranslatorContext ctx = translator.preProcessList(context.withToRemove(toRemove));

        for (InstanceNode entry: entries(context.getCandidate(), path)) {
            InstanceRoute entryRoute = entry.getRoute();
            if (!ctx.isReplace() && !changed(ctx, entryRoute)) {
                log.debug("{}: no need to progress", entryRoute);
                continue;
            }
            TranslatorContext entryContext = ctx
                .withKey(list.getDataPath(), entryKey(list, entry))
                .withPath(entryRoute)
                .withToRemove(ImmutableList.<InstanceNode>of());
            processContainer(translator, entryContext);
        }
        translator.postProcessList(ctx);
    }

    private void processChild(Translator translator, TranslatorContext ctx, SchemaNode child) {
        NodeKind kind = child.getKind();
        if (kind==NodeKind.GROUP) {
            for (SchemaNode member: child.getDataChildren()) {
                processChild(translator, ctx, member);
            }
        } else if (kind==NodeKind.CONTAINER || kind==NodeKind.LIST) {
            processContainerOrList(translator, ctx, child);
        } else if (kind==NodeKind.LEAF) {
            processLeaf(translator, ctx, child);
        } else if (kind==NodeKind.LEAF_LIST) {
            processLeafList(translator, ctx, child);
        } else {
            log.error("{}: don't know how to process {} of kind {}", ctx.getPath(), child.getName(), kind);
            throw new UnsupportedNodeKindException("Cannot process "+child.getName()+" of kind "+kind, child.getDataPath());
        }
    }

    private void processContainerOrList(Translator translator, TranslatorContext ctx, SchemaNode child) {
        InstanceRoute route = ctx.getPath().appendMember(child.getQualifiedName());
        if (!presentIn(ctx.getCandidate(), route) && !presentIn(ctx.getRunning(), route)) {
            log.debug("{}: no need to progress", route);
            return;
        }
        Binding<Translator, LeafTranslator> binding = translator.getBinding(child.getName());
        if (binding==null) {
            log.info("{}: not implemented", route);
            return;
        }
        if (binding.isUnneeded()) return;
        binding.checkFor(child);

        TranslatorContext childContext = ctx.withSchema(child).withPath(route);
        if (child.getKind()==NodeKind.CONTAINER) {
            processContainer(binding.getHandler(), childContext);
        } else {
            processList(binding.getHandler(), childContext);
        }
    }

    private void processLeaf(Translator translator, TranslatorContext ctx, SchemaNode leaf) {
        InstanceRoute route = ctx.getPath().appendMember(leaf.getQualifiedName());
        if (!leafNeedsProgress(ctx, route)) {
            log.debug("{}: no need to progress", route);
            return;
        }
        Binding<Translator, LeafTranslator> binding = translator.getBinding(leaf.getName());
        if (binding==null) {
            log.info("{}: (set) not implemented", route);
            return;
        }
        if (binding.isUnneeded()) return;
        binding.checkFor(leaf);

        Object value = removedFromRunning(ctx, route) ? null : ctx.candidateValue(route);
        binding.getAccessor().translate(ctx, value);
    }

    private void processLeafList(Translator translator, TranslatorContext context, SchemaNode leafList) {
        InstanceRoute route = context.getPath().appendMember(leafList.getQualifiedName());
        if (!leafNeedsProgress(context, route)) {
            log.debug("{}: no need to progress", route);
            return;
        }
        List<Object> candidateValues = asList(context.candidateValue(route));
        List<Object> runningValues = asList(context.runningValue(route));
        List<Object> valuesToRemove = Lists.newArrayList();
        for (Object v: runningValues) {
            if (!candidateValues.contains(v)) valuesToRemove.add(v);
        }
        TranslatorContext ctx = translator.preProcessLeafList(context.withValuesToRemove(valuesToRemove));

        Binding<Translator, LeafTranslator> binding = translator.getBinding(leafList.getName());
        if (binding==null) {
            log.info("{}: (set) not implemented", route);
            return;
        }
        if (binding.isUnneeded()) return;
        binding.checkFor(leafList);

        Object value;
        if (removedFromRunning(ctx, route)) {
            value = null;
        } else if (!ctx.isReplace()) {
            List<Object> added = Lists.newArrayList();
            for (Object v: candidateValues) {
                if (!runningValues.contains(v)) added.add(v);
            }
            value = added;
        } else {
            value = candidateValues;
        }
        binding.getAccessor().translate(ctx, value);
        translator.postProcessLeafList(ctx);
    }

    private static boolean leafNeedsProgress(TranslatorContext ctx, InstanceRoute route) {
        if (ctx.isReplace()) {
            return presentIn(ctx.getCandidate(), route);
        }
        return changed(ctx, route) || removedFromRunning(ctx, route);
    }

    private static boolean changed(TranslatorContext ctx, InstanceRoute route) {
        return !Objects.equals(ctx.runningValue(route), ctx.candidateValue(route));
    }

    private static boolean removedFromRunning(TranslatorContext ctx, InstanceRoute route) {
        return presentIn(ctx.getRunning(), route) && !presentIn(ctx.getCandidate(), route);
    }

    private static boolean presentIn(@Nullable InstanceNode tree, InstanceRoute route) {
        return tree!=null && tree.goTo(route).isPresent();
    }

    private static List<InstanceNode> entries(InstanceNode tree, InstanceRoute route) {
        Maybe<InstanceNode> node = tree.goTo(route);
        return node.isPresent() ? node.get().getEntries() : Collections.<InstanceNode>emptyList();
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(@Nullable Object value) {
        if (value==null) return Collections.emptyList();
        if (value instanceof List) return (List<Object>) value;
        return Collections.singletonList(value);
    }

    /** the value of the first key leaf, by which handlers usually address the entry */
    private static Object entryKey(SchemaNode list, InstanceNode entry) {
        Object raw = entry.getRawValue();
        if (list.getKeys().isEmpty() || !(raw instanceof Map)) {
            throw new ModelException("Entry of "+list.getDataPath()+" has no key", entry.getRoute().toString());
        }
        Object key = ((Map<?, ?>) raw).get(list.getKeys().get(0));
        if (key==null) {
            throw new ModelException("Entry of "+list.getDataPath()+" is missing key "+list.getKeys().get(0), entry.getRoute().toString());
        }
        return key;
    }

}
