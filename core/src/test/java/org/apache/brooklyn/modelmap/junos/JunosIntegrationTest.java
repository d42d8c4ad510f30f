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
package org.apache.brooklyn.modelmap.junos;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.brooklyn.modelmap.api.instance.InstanceNode;
import org.apache.brooklyn.modelmap.model.BasicDataModel;
import org.apache.brooklyn.modelmap.model.RawTrees;
import org.apache.brooklyn.modelmap.parse.RootParser;
import org.apache.brooklyn.modelmap.translate.RootTranslator;
import org.apache.brooklyn.modelmap.xml.XmlElements;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;

/** Parses Junos XML into openconfig and renders changes back as Junos XML. */
public class JunosIntegrationTest {

    private BasicDataModel model;

    @BeforeClass(alwaysRun = true)
    public void setUp() {
        model = BasicDataModel.fromYamlResource("schemas/openconfig.yaml");
    }

    @Test
    public void testParse() throws Exception {
        InstanceNode parsed = RootParser.builder(model, JunosParsers.root())
                .nativeData(resource("junos/running.xml"))
                .init(JunosParsers.INIT)
                .build().process();
        Assert.assertEquals(parsed.getRawValue(), json("junos/running.json"));
    }

    @Test
    public void testParseFiltered() throws Exception {
        Map<String, Object> parsed = RootParser.builder(model, JunosParsers.root())
                .nativeData(resource("junos/running.xml"))
                .init(JunosParsers.INIT)
                .include(ImmutableList.of("/openconfig-vlan:vlans"))
                .exclude(ImmutableList.of("/openconfig-vlan:vlans/vlan/config/status"))
                .build().processRaw();
        Assert.assertEquals(parsed, RawTrees.fromJson("{\"openconfig-vlan:vlans\": {\"vlan\": ["
                + "{\"vlan-id\": 10, \"config\": {\"vlan-id\": 10, \"name\": \"prod\"}},"
                + "{\"vlan-id\": 20, \"config\": {\"vlan-id\": 20, \"name\": \"dev\"}}]}}"));
    }

    @Test
    public void testMerge() throws Exception {
        assertSameXml(translate(false), resource("junos/merge.xml"));
    }

    @Test
    public void testReplace() throws Exception {
        assertSameXml(translate(true), resource("junos/replace.xml"));
    }

    @Test
    public void testMergeWithoutChangesHasEmptySections() throws Exception {
        Object result = RootTranslator.builder(model, JunosTranslators.root())
                .candidate(json("junos/running.json"))
                .running(json("junos/running.json"))
                .init(JunosTranslators.INIT)
                .post(JunosTranslators.POST)
                .build().process();
        assertSameXml(result, "<configuration><interfaces/><vlans/></configuration>");
    }

    @Test
    public void testRoundTrip() throws Exception {
        Object xml = RootTranslator.builder(model, JunosTranslators.root())
                .candidate(json("junos/running.json"))
                .init(JunosTranslators.INIT)
                .post(JunosTranslators.POST)
                .build().process();
        InstanceNode reparsed = RootParser.builder(model, JunosParsers.root())
                .nativeData(xml)
                .init(JunosParsers.INIT)
                .build().process();
        Assert.assertEquals(reparsed.getRawValue(), json("junos/running.json"));
    }

    private Object translate(boolean replace) throws IOException {
        return RootTranslator.builder(model, JunosTranslators.root())
                .candidate(json("junos/candidate.json"))
                .running(json("junos/running.json"))
                .replace(replace)
                .init(JunosTranslators.INIT)
                .post(JunosTranslators.POST)
                .build().process();
    }

    private static void assertSameXml(Object actual, String expected) {
        Assert.assertTrue(actual instanceof String, "result="+actual);
        Assert.assertTrue(XmlElements.parse(expected).isEqualNode(XmlElements.parse((String) actual)), "result="+actual);
    }

    private static String resource(String name) throws IOException {
        return Resources.toString(Resources.getResource(name), StandardCharsets.UTF_8);
    }

    private static Map<String, Object> json(String name) throws IOException {
        return RawTrees.fromJson(resource(name));
    }

}
