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

import org.apache.brooklyn.modelmap.api.instance.ContentType;
import org.apache.brooklyn.modelmap.api.instance.ValidationException;
import org.apache.brooklyn.modelmap.api.schema.InvalidSchemaPathException;
import org.apache.brooklyn.modelmap.api.schema.NodeKind;
import org.apache.brooklyn.modelmap.api.schema.SchemaNodeNotFoundException;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class BasicDataModelTest {

    private BasicDataModel model;

    @BeforeClass(alwaysRun = true)
    public void setUp() {
        model = BasicDataModel.fromYamlResource("schemas/openconfig.yaml");
    }

    @Test
    public void testGetSchemaNode() {
        Assert.assertSame(model.getSchemaNode("/"), model.getSchema());
        Assert.assertEquals(model.getSchemaNode("/openconfig-interfaces:interfaces/interface/config").getKind(), NodeKind.CONTAINER);
        Assert.assertEquals(model.getSchemaNode("/openconfig-interfaces:interfaces/openconfig-interfaces:interface").getName(), "interface");
        Assert.assertEquals(model.getSchemaNode("/openconfig-vlan:vlans/vlan/vlan-id").getKind(), NodeKind.LEAF);
    }

    @DataProvider(name = "invalidPaths")
    public Object[][] invalidPaths() {
        return new Object[][] { {"openconfig-vlan:vlans"}, {"/openconfig-vlan:vlans//vlan"}, {"/openconfig-vlan:vlans/"}, {"/1bad"} };
    }

    @Test(dataProvider = "invalidPaths", expectedExceptions = InvalidSchemaPathException.class)
    public void testInvalidPath(String path) {
        model.getSchemaNode(path);
    }

    @Test(expectedExceptions = SchemaNodeNotFoundException.class)
    public void testUnknownNode() {
        model.getSchemaNode("/openconfig-vlan:vlans/vlan/no-such-leaf");
    }

    @Test(expectedExceptions = SchemaNodeNotFoundException.class)
    public void testUnknownModule() {
        model.getSchemaNode("/openconfig-acl:acl");
    }

    @Test
    public void testValidateGood() {
        Map<String, Object> raw = RawTrees.fromJson("{\"openconfig-interfaces:interfaces\": {\"interface\": ["
                + "{\"name\": \"Gi1\", \"config\": {\"name\": \"Gi1\", \"enabled\": true}, \"state\": {\"oper-status\": \"UP\"}}]}}");
        model.validate(raw, ContentType.ALL);
    }

    @Test
    public void testValidateStateRejectedForConfig() {
        Map<String, Object> raw = RawTrees.fromJson("{\"openconfig-interfaces:interfaces\": {\"interface\": ["
                + "{\"name\": \"Gi1\", \"state\": {\"oper-status\": \"UP\"}}]}}");
        ValidationException e = assertInvalid(raw, ContentType.CONFIG);
        Assert.assertTrue(e.getReason().contains("state data"), "reason="+e.getReason());
        Assert.assertTrue(e.getPath().endsWith("/state"), "path="+e.getPath());
    }

    @Test
    public void testValidateUnknownMember() {
        assertInvalid(RawTrees.fromJson("{\"openconfig-vlan:vlans\": {\"bogus\": 1}}"), ContentType.ALL);
    }

    @Test
    public void testValidateMissingKey() {
        assertInvalid(RawTrees.fromJson("{\"openconfig-vlan:vlans\": {\"vlan\": [{\"config\": {\"name\": \"x\"}}]}}"), ContentType.ALL);
    }

    @Test
    public void testValidateDuplicateEntry() {
        assertInvalid(RawTrees.fromJson("{\"openconfig-vlan:vlans\": {\"vlan\": [{\"vlan-id\": 10}, {\"vlan-id\": 10}]}}"), ContentType.ALL);
    }

    @Test
    public void testValidateLeafMustBeScalar() {
        assertInvalid(RawTrees.fromJson("{\"openconfig-vlan:vlans\": {\"vlan\": [{\"vlan-id\": {\"x\": 1}}]}}"), ContentType.ALL);
    }

    private ValidationException assertInvalid(Map<String, Object> raw, ContentType type) {
        try {
            model.validate(raw, type);
        } catch (ValidationException e) {
            return e;
        }
        throw new AssertionError("Validation should have failed for "+raw);
    }

}
