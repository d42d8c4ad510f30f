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

import java.util.Map;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.handler.Binding;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Handler for one container or list of the schema when reading native data into the model.
 * <p>
 * Children are bound by their schema name (without namespace prefix) to a nested parser,
 * a {@link LeafParser}, or declared unneeded. Children with no binding are skipped and logged.
 * <pre>
 * Parser.builder()
 *     .extractElements(ctx -&gt; ...)
 *     .leaf("name", ctx -&gt; ...)
 *     .container("config", Parser.builder().leaf("mtu", ...).build())
 *     .unneeded("state")
 *     .build();
 * </pre>
 */
public class Parser {

    private final ParserHook preProcess;
    private final ParserHook postProcess;
    @Nullable private final ElementExtractor elementExtractor;
    private final ImmutableMap<String, Binding<Parser, LeafParser>> bindings;

    protected Parser(Builder builder) {
        this.preProcess = builder.preProcess;
        this.postProcess = builder.postProcess;
        this.elementExtractor = builder.elementExtractor;
        this.bindings = builder.bindings.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** a parser with no hooks and no bindings */
    public static Parser empty() {
        return builder().build();
    }

    public ParserContext preProcess(ParserContext context) {
        return preProcess.apply(context);
    }

    public ParserContext postProcess(ParserContext context) {
        return postProcess.apply(context);
    }

    @Nullable
    public ElementExtractor getElementExtractor() {
        return elementExtractor;
    }

    /** the binding for the schema child of the given name, or null if there is none */
    @Nullable
    public Binding<Parser, LeafParser> getBinding(String name) {
        return bindings.get(name);
    }

    public Map<String, Binding<Parser, LeafParser>> getBindings() {
        return bindings;
    }

    @Override
    public String toString() {
        return "Parser"+bindings.keySet();
    }

    public static class Builder {
        private ParserHook preProcess = ParserHook.IDENTITY;
        private ParserHook postProcess = ParserHook.IDENTITY;
        private ElementExtractor elementExtractor;
        private final ImmutableMap.Builder<String, Binding<Parser, LeafParser>> bindings = ImmutableMap.builder();

        public Builder preProcess(ParserHook hook) {
            this.preProcess = Preconditions.checkNotNull(hook, "hook");
            return this;
        }

        public Builder postProcess(ParserHook hook) {
            this.postProcess = Preconditions.checkNotNull(hook, "hook");
            return this;
        }

        /** required on any parser bound as a list */
        public Builder extractElements(ElementExtractor extractor) {
            this.elementExtractor = Preconditions.checkNotNull(extractor, "extractor");
            return this;
        }

        public Builder container(String name, Parser parser) {
            return bind(name, Binding.<Parser, LeafParser>container(parser));
        }

        public Builder list(String name, Parser parser) {
            return bind(name, Binding.<Parser, LeafParser>list(parser));
        }

        public Builder leaf(String name, LeafParser accessor) {
            return bind(name, Binding.<Parser, LeafParser>leaf(accessor));
        }

        public Builder leafList(String name, LeafParser accessor) {
            return bind(name, Binding.<Parser, LeafParser>leafList(accessor));
        }

        public Builder unneeded(String ...names) {
            for (String name: names) {
                bind(name, Binding.<Parser, LeafParser>unneeded());
            }
            return this;
        }

        public Builder bind(String name, Binding<Parser, LeafParser> binding) {
            bindings.put(Preconditions.checkNotNull(name, "name"), binding);
            return this;
        }

        /** @throws IllegalArgumentException if a name was bound twice */
        public Parser build() {
            return new Parser(this);
        }
    }

}
