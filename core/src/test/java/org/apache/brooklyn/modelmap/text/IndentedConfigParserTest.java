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

import static org.apache.brooklyn.modelmap.text.IndentedConfigParser.LIST;
import static org.apache.brooklyn.modelmap.text.IndentedConfigParser.STANDALONE;
import static org.apache.brooklyn.modelmap.text.IndentedConfigParser.TEXT;

import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

public class IndentedConfigParserTest {

    private static final String CONFIG = Joiner.on("\n").join(
            "interface Gi1",
            "   description foo bar",
            "   shutdown",
            "!",
            "interface Gi2",
            "   no shutdown",
            "");

    @Test
    public void testWordsBecomeLevels() {
        Map<String, Object> parsed = IndentedConfigParser.parse(CONFIG);
        Assert.assertEquals(NativeMaps.text(parsed, "interface", TEXT), "Gi2");
        Assert.assertEquals(NativeMaps.text(parsed, "interface", "Gi1", "description", TEXT), "foo bar");
        Assert.assertEquals(NativeMaps.text(parsed, "interface", "Gi1", "description", "foo", TEXT), "bar");
        Assert.assertTrue(NativeMaps.isStandalone(parsed, "interface", "Gi1", "description", "foo", "bar"));
        Assert.assertEquals(NativeMaps.text(parsed, "interface", "Gi2", "no", TEXT), "shutdown");
    }

    @Test
    public void testStandalone() {
        Map<String, Object> parsed = IndentedConfigParser.parse(CONFIG);
        Assert.assertTrue(NativeMaps.isStandalone(parsed, "interface", "Gi1"));
        Assert.assertTrue(NativeMaps.isStandalone(parsed, "interface", "Gi1", "shutdown"));
        Assert.assertFalse(NativeMaps.isStandalone(parsed, "interface", "Gi2", "shutdown"));
        Assert.assertTrue(NativeMaps.isStandalone(parsed, "interface", "Gi2", "no", "shutdown"));
    }

    @Test
    public void testListKeepsMultiWordLinesOfNestedBlock() {
        Map<String, Object> parsed = IndentedConfigParser.parse(CONFIG);
        // top-level lines are not nested so are never listed
        Assert.assertEquals(NativeMaps.list(parsed, LIST), ImmutableList.of());

        List<Object> gi1 = NativeMaps.list(parsed, "interface", "Gi1", LIST);
        Assert.assertEquals(gi1.size(), 1);
        Map<?, ?> entry = (Map<?, ?>) gi1.get(0);
        Assert.assertEquals(Iterables.getOnlyElement(entry.keySet()), "description");
        Assert.assertSame(entry.get("description"), NativeMaps.map(parsed, "interface", "Gi1", "description"));
    }

    @Test
    public void testCommentsAndBlankLinesSkipped() {
        Map<String, Object> parsed = IndentedConfigParser.parse(ImmutableList.of(
                "! a comment",
                "",
                "hostname r1",
                "   ",
                "   ! indented comment",
                "ip routing"));
        Assert.assertEquals(NativeMaps.text(parsed, "hostname", TEXT), "r1");
        Assert.assertTrue(NativeMaps.isStandalone(parsed, "hostname", "r1"));
        Assert.assertTrue(NativeMaps.isStandalone(parsed, "ip", "routing"));
        Assert.assertEquals(NativeMaps.text(parsed, TEXT), "ip routing");
    }

    @Test
    public void testDeeperNesting() {
        Map<String, Object> parsed = IndentedConfigParser.parse(ImmutableList.of(
                "router bgp 65000",
                "  address-family ipv4",
                "    neighbor 10.0.0.1 activate",
                "  exit-address-family",
                "hostname r1"));
        Map<String, Object> bgp = NativeMaps.map(parsed, "router", "bgp", "65000");
        Assert.assertTrue(NativeMaps.isStandalone(bgp, "address-family", "ipv4"));
        Assert.assertTrue(NativeMaps.isStandalone(bgp, "address-family", "ipv4", "neighbor", "10.0.0.1", "activate"));
        Assert.assertTrue(NativeMaps.isStandalone(bgp, "exit-address-family"));
        Assert.assertTrue(NativeMaps.isStandalone(parsed, "hostname", "r1"));
    }

    @Test
    public void testRepeatedBlocksMerge() {
        Map<String, Object> parsed = IndentedConfigParser.parse(ImmutableList.of(
                "interface Gi1",
                "   description first",
                "interface Gi1",
                "   shutdown"));
        Map<String, Object> gi1 = NativeMaps.map(parsed, "interface", "Gi1");
        Assert.assertEquals(NativeMaps.text(gi1, "description", TEXT), "first");
        Assert.assertTrue(NativeMaps.isStandalone(gi1, "shutdown"));
        Assert.assertEquals(gi1.get(STANDALONE), Boolean.TRUE);
    }

}
