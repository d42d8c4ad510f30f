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

import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

public class RawTreesTest {

    @Test
    public void testMemberOrderKept() {
        Map<String, Object> tree = RawTrees.fromJson("{\"z\": 1, \"a\": {\"y\": true, \"b\": [1, 2]}}");
        Assert.assertEquals(ImmutableList.copyOf(tree.keySet()), ImmutableList.of("z", "a"));
        String json = RawTrees.toJson(tree);
        Assert.assertTrue(json.indexOf("\"z\"") < json.indexOf("\"a\""), json);
        Assert.assertEquals(RawTrees.fromJson(json), tree);
    }

    @Test
    public void testFromYaml() {
        Map<String, Object> tree = RawTrees.fromYaml("openconfig-vlan:vlans:\n  vlan:\n  - vlan-id: 10\n");
        Assert.assertEquals(tree, RawTrees.fromJson("{\"openconfig-vlan:vlans\": {\"vlan\": [{\"vlan-id\": 10}]}}"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBadJson() {
        RawTrees.fromJson("{not json");
    }

}
