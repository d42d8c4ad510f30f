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

import java.util.List;
import java.util.Map;

import org.apache.brooklyn.modelmap.api.instance.DataModel;
import org.apache.brooklyn.modelmap.api.instance.InstanceNode;
import org.apache.brooklyn.modelmap.model.BasicDataModel;
import org.apache.brooklyn.modelmap.model.RawTrees;
import org.apache.brooklyn.modelmap.model.SchemaBuilder;
import org.apache.brooklyn.modelmap.test.LogWatcher;
import org.apache.brooklyn.modelmap.test.LogWatcher.EventPredicates;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import ch.qos.logback.classic.Level;

public class RootTranslatorTest {

    private static final Map<String, Object> EXTRA = ImmutableMap.<String, Object>of("os_version", "test");

    private DataModel model;
    private List<String> events;

    @BeforeMethod(alwaysRun = true)
    public void setUp() {
        model = new BasicDataModel(SchemaBuilder.root()
                .module("t", m -> m
                        .container("c", c -> c
                                .leaves("a", "b")
                                .leafList("tags")
                                .list("item", "id", l -> l.leaves("id", "value"))))
                .build());
        events = Lists.newArrayList();
    }

    protected Translator recordingTranslator() {
        Translator item = Translator.builder()
                .preProcessList(ctx -> {
                    List<Object> ids = Lists.newArrayList();
                    for (InstanceNode entry: ctx.getToRemove()) {
                        ids.add(((Map<?, ?>) entry.getRawValue()).get("id"));
                    }
                    events.add("remove="+ids);
                    return ctx;
                })
                .preProcess(ctx -> {
                    events.add("item "+ctx.getKey());
                    return ctx;
                })
                .unneeded("id")
                .leaf("value", (ctx, value) -> events.add("value="+value))
                .build();
        return Translator.builder()
                .container("c", Translator.builder()
                        .leaf("a", (ctx, value) -> events.add("a="+value))
                        .leaf("b", (ctx, value) -> events.add("b="+value))
                        .preProcessLeafList(ctx -> {
                            events.add("remove-tags="+ctx.getValuesToRemove());
                            return ctx;
                        })
                        .leafList("tags", (ctx, value) -> events.add("tags="+value))
                        .list("item", item)
                        .build())
                .build();
    }

    protected void translate(String candidate, String running, boolean replace) {
        RootTranslator.builder(model, recordingTranslator())
                .candidate(RawTrees.fromJson(candidate))
                .running(running==null ? null : RawTrees.fromJson(running))
                .replace(replace)
                .build().process();
    }

    @Test
    public void testTranslateWithExtra() {
        DataModel tests = BasicDataModel.fromYamlResource("schemas/yangify-tests.yaml");
        Translator element = Translator.builder()
                .preProcessList(ctx -> {
                    Assert.assertEquals(ctx.getExtra(), EXTRA);
                    return ctx;
                })
                .preProcess(ctx -> {
                    Assert.assertEquals(ctx.getExtra(), EXTRA);
                    Map<String, Object> entry = Maps.newLinkedHashMap();
                    rootResult(ctx).put(String.valueOf(ctx.getKey()), entry);
                    return ctx.withResult(entry);
                })
                .leaf("name", (ctx, value) -> result(ctx).put("name", value))
                .container("config", Translator.builder()
                        .leaf("description", (ctx, value) -> {
                            Assert.assertEquals(ctx.getExtra(), EXTRA);
                            result(ctx).put("description", value);
                        })
                        .build())
                .build();
        Translator root = Translator.builder()
                .container("start", Translator.builder()
                        .container("elements", Translator.builder().list("element", element).build())
                        .build())
                .build();

        Object translated = RootTranslator.builder(tests, root)
                .candidate(RawTrees.fromJson("{\"yangify-tests:start\": {\"elements\": {\"element\": ["
                        + "{\"name\": \"element1\", \"config\": {\"description\": \"this is element1.config.description\"}},"
                        + "{\"name\": \"element2\", \"config\": {\"description\": \"this is element2.config.description\"}}"
                        + "]}}}"))
                .extra(EXTRA)
                .init(ctx -> {
                    Map<String, Object> result = Maps.newLinkedHashMap();
                    return ctx.withRootResult(result).withResult(result);
                })
                .build().process();

        Assert.assertEquals(translated, RawTrees.fromJson("{"
                + "\"element1\": {\"name\": \"element1\", \"description\": \"this is element1.config.description\"},"
                + "\"element2\": {\"name\": \"element2\", \"description\": \"this is element2.config.description\"}}"));
    }

    @Test
    public void testNoRunningTranslatesEverything() {
        translate("{\"t:c\": {\"a\": \"x\", \"tags\": [\"p\", \"q\"], \"item\": [{\"id\": 1, \"value\": \"one\"}]}}", null, false);
        Assert.assertEquals(events, ImmutableList.of("a=x", "remove-tags=[]", "tags=[p, q]", "remove=[]", "item 1", "value=one"));
    }

    @Test
    public void testMergeOfIdenticalDataEmitsNothing() {
        String data = "{\"t:c\": {\"a\": \"x\", \"b\": \"y\", \"tags\": [\"p\"], \"item\": [{\"id\": 1, \"value\": \"one\"}]}}";
        translate(data, data, false);
        Assert.assertEquals(events, ImmutableList.of("remove=[]"));
    }

    @Test
    public void testMergeLeaves() {
        translate("{\"t:c\": {\"a\": \"changed\"}}", "{\"t:c\": {\"a\": \"x\", \"b\": \"y\"}}", false);
        Assert.assertEquals(events, ImmutableList.of("a=changed", "b=null"));
    }

    @Test
    public void testReplaceNeverVisitsAbsentLeaf() {
        translate("{\"t:c\": {\"a\": \"x\"}}", "{\"t:c\": {\"a\": \"x\", \"b\": \"y\"}}", true);
        Assert.assertEquals(events, ImmutableList.of("a=x"));
    }

    @Test
    public void testMergeLeafListRemoval() {
        translate("{\"t:c\": {\"tags\": [\"b\", \"c\"]}}", "{\"t:c\": {\"tags\": [\"a\", \"b\", \"c\"]}}", false);
        Assert.assertEquals(events, ImmutableList.of("remove-tags=[a]", "tags=[]"));
    }

    @Test
    public void testMergeLeafListAddition() {
        translate("{\"t:c\": {\"tags\": [\"b\", \"c\", \"d\"]}}", "{\"t:c\": {\"tags\": [\"a\", \"b\", \"c\"]}}", false);
        Assert.assertEquals(events, ImmutableList.of("remove-tags=[a]", "tags=[d]"));
    }

    @Test
    public void testReplaceLeafListGetsAllValues() {
        translate("{\"t:c\": {\"tags\": [\"b\", \"c\"]}}", "{\"t:c\": {\"tags\": [\"a\", \"b\", \"c\"]}}", true);
        Assert.assertEquals(events, ImmutableList.of("remove-tags=[a]", "tags=[b, c]"));
    }

    @Test
    public void testMergeLeafListRemovedEntirely() {
        translate("{\"t:c\": {\"a\": \"x\"}}", "{\"t:c\": {\"a\": \"x\", \"tags\": [\"a\"]}}", false);
        Assert.assertEquals(events, ImmutableList.of("remove-tags=[a]", "tags=null"));
    }

    @Test
    public void testMergeList() {
        translate("{\"t:c\": {\"item\": [{\"id\": 2, \"value\": \"TWO\"}, {\"id\": 4, \"value\": \"four\"}]}}",
                "{\"t:c\": {\"item\": [{\"id\": 1, \"value\": \"one\"}, {\"id\": 2, \"value\": \"two\"}, {\"id\": 3, \"value\": \"three\"}]}}",
                false);
        Assert.assertEquals(events, ImmutableList.of("remove=[1, 3]", "item 2", "value=TWO", "item 4", "value=four"));
    }

    @Test
    public void testMergeListSkipsUnchangedEntries() {
        translate("{\"t:c\": {\"item\": [{\"id\": 2, \"value\": \"two\"}, {\"id\": 4, \"value\": \"four\"}]}}",
                "{\"t:c\": {\"item\": [{\"id\": 1, \"value\": \"one\"}, {\"id\": 2, \"value\": \"two\"}]}}",
                false);
        Assert.assertEquals(events, ImmutableList.of("remove=[1]", "item 4", "value=four"));
    }

    @Test
    public void testReplaceListVisitsEveryEntry() {
        translate("{\"t:c\": {\"item\": [{\"id\": 2, \"value\": \"two\"}]}}",
                "{\"t:c\": {\"item\": [{\"id\": 1, \"value\": \"one\"}, {\"id\": 2, \"value\": \"two\"}]}}",
                true);
        Assert.assertEquals(events, ImmutableList.of("remove=[1]", "item 2", "value=two"));
    }

    @Test
    public void testContainerRemovedFromCandidate() {
        translate("{}", "{\"t:c\": {\"a\": \"x\", \"item\": [{\"id\": 1, \"value\": \"one\"}]}}", false);
        Assert.assertEquals(events, ImmutableList.of("a=null", "remove=[1]"));
    }

    @Test
    public void testResultSeenByChildrenAndPostProcess() {
        final List<Object> seen = Lists.newArrayList();
        Translator root = Translator.builder()
                .container("c", Translator.builder()
                        .preProcess(ctx -> ctx.withResult("section"))
                        .leaf("a", (ctx, value) -> seen.add(ctx.getResult()))
                        .postProcess(ctx -> {
                            seen.add("post "+ctx.getResult());
                            return ctx;
                        })
                        .build())
                .postProcess(ctx -> {
                    seen.add("root post "+ctx.getResult());
                    return ctx;
                })
                .build();
        RootTranslator.builder(model, root)
                .candidate(RawTrees.fromJson("{\"t:c\": {\"a\": \"x\"}}"))
                .init(ctx -> ctx.withResult("root"))
                .build().process();
        Assert.assertEquals(seen, ImmutableList.<Object>of("section", "post section", "root post root"));
    }

    @Test
    public void testMissingAccessorLogged() {
        Translator root = Translator.builder().container("c", Translator.builder().leaf("a", (ctx, value) -> events.add("a")).build()).build();
        try (LogWatcher watcher = new LogWatcher(Level.INFO, TranslateEngine.class).start()) {
            RootTranslator.builder(model, root)
                    .candidate(RawTrees.fromJson("{\"t:c\": {\"a\": \"x\", \"b\": \"y\", \"item\": [{\"id\": 1}]}}"))
                    .build().process();
            watcher.assertHasEvent(Predicates.and(EventPredicates.containsMessage("/t:c/b: (set) not implemented"),
                    EventPredicates.atLevel(Level.INFO)));
            watcher.assertHasEvent(EventPredicates.containsMessage("/t:c/item: not implemented"));
        }
        Assert.assertEquals(events, ImmutableList.of("a"));
    }

    @Test
    public void testPostReturnsRootResult() {
        Object result = RootTranslator.builder(model, Translator.empty())
                .candidate(RawTrees.fromJson("{}"))
                .init(ctx -> ctx.withRootResult(Lists.newArrayList("x")))
                .post(ctx -> ctx.withRootResult(ctx.getRootResult().toString()))
                .build().process();
        Assert.assertEquals(result, "[x]");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCandidateRequired() {
        RootTranslator.builder(model, Translator.empty()).build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> result(TranslatorContext ctx) {
        return (Map<String, Object>) ctx.getResult();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> rootResult(TranslatorContext ctx) {
        return (Map<String, Object>) ctx.getRootResult();
    }

}
