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

import org.testng.Assert;
import org.testng.annotations.Test;

public class ConfigTreeTest {

    private static final String EXPECTED_SIMPLE =
            "interface Gi1\n"
            + "   description \"A description for Gi1\"\n"
            + "   shutdown\n"
            + "   exit\n"
            + "!\n"
            + "interface Gi2\n"
            + "   description \"A description for Gi2\"\n"
            + "   exit\n"
            + "!\n"
            + "logging something something\n"
            + "logging something else\n";

    private static final String EXPECTED_DOUBLE_NESTED =
            "interface Gi1\n"
            + "   description \"A description for Gi1\"\n"
            + "   shutdown\n"
            + "   another nest\n"
            + "      more subsubcommands\n"
            + "   exit\n"
            + "!\n"
            + "interface Gi2\n"
            + "   description \"A description for Gi2\"\n"
            + "   exit\n"
            + "!\n"
            + "logging something something\n"
            + "logging something else\n";

    @Test
    public void testSimple() {
        ConfigTree config = new ConfigTree();
        addInterface(config, "Gi1", true);
        addInterface(config, "Gi2", false);
        config.addCommand("logging something something");
        config.addCommand("logging something else");
        Assert.assertEquals(config.toString(), EXPECTED_SIMPLE);
    }

    @Test
    public void testPopSection() {
        ConfigTree config = new ConfigTree();
        addInterface(config, "Gi1", true);
        addInterface(config, "Gi2", false);
        addInterface(config, "Gi3", false);
        ConfigTree popped = config.popSection("interface Gi3");
        config.addCommand("logging something something");
        config.addCommand("logging something else");
        Assert.assertEquals(config.toString(), EXPECTED_SIMPLE);
        Assert.assertEquals(popped.getHeader(), "interface Gi3");
    }

    @Test
    public void testDoubleNested() {
        ConfigTree config = new ConfigTree();
        ConfigTree gi1 = config.newSection("interface Gi1");
        gi1.addCommand("   description \"A description for Gi1\"");
        gi1.addCommand("   shutdown");
        ConfigTree nest = gi1.newSection("   another nest");
        nest.addCommand("      more subsubcommands");
        gi1.addCommand("   exit");
        gi1.addCommand("!");
        addInterface(config, "Gi2", false);
        config.addCommand("logging something something");
        config.addCommand("logging something else");
        Assert.assertEquals(config.toString(), EXPECTED_DOUBLE_NESTED);
    }

    @Test
    public void testDuplicateCommandIgnored() {
        ConfigTree config = new ConfigTree();
        config.addCommand("no vlan 10");
        config.addCommand("no vlan 10");
        Assert.assertEquals(config.toString(), "no vlan 10\n");
    }

    @Test
    public void testEmpty() {
        ConfigTree config = new ConfigTree();
        Assert.assertTrue(config.isEmpty());
        Assert.assertEquals(config.toString(), "");
        config.newSection("interface Gi1");
        Assert.assertFalse(config.isEmpty());
        Assert.assertEquals(config.toString(), "interface Gi1\n");
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "couldn't find interface Gi9")
    public void testPopMissingSection() {
        ConfigTree config = new ConfigTree();
        addInterface(config, "Gi1", false);
        config.popSection("interface Gi9");
    }

    private static void addInterface(ConfigTree config, String name, boolean shutdown) {
        ConfigTree section = config.newSection("interface "+name);
        section.addCommand("   description \"A description for "+name+"\"");
        if (shutdown) section.addCommand("   shutdown");
        section.addCommand("   exit");
        section.addCommand("!");
    }

}
