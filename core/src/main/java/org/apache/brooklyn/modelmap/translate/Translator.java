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

import java.util.Map;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.handler.Binding;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Handler for one container or list of the schema when rendering a model instance to native form.
 * <p>
 * For a list, {@link Builder#preProcessList(TranslatorHook)} sees the entries to remove once,
 * then each entry which needs translating is processed as a container with this same translator.
 * The leaf-list hooks run around every leaf-list child of the container.
 */
public class Translator {

    private final TranslatorHook preProcess;
    private final TranslatorHook postProcess;
    private final TranslatorHook preProcessList;
    private final TranslatorHook postProcessList;
    private final TranslatorHook preProcessLeafList;
    private final TranslatorHook postProcessLeafList;
    private final ImmutableMap<String, Binding<Translator, LeafTranslator>> bindings;

    protected Translator(Builder builder) {
        this.preProcess = builder.preProcess;
        this.postProcess = builder.postProcess;
        this.preProcessList = builder.preProcessList;
        this.postProcessList = builder.postProcessList;
        this.preProcessLeafList = builder.preProcessLeafList;
        this.postProcessLeafList = builder.postProcessLeafList;
        this.bindings = builder.bindings.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Translator empty() {
        return builder().build();
    }

    public TranslatorContext preProcess(TranslatorContext context) {
        return preProcess.apply(context);
    }

    public TranslatorContext postProcess(TranslatorContext context) {
        return postProcess.apply(context);
    }

    public TranslatorContext preProcessList(TranslatorContext context) {
        return preProcessList.apply(context);
    }

    public TranslatorContext postProcessList(TranslatorContext context) {
        return postProcessList.apply(context);
    }

    public TranslatorContext preProcessLeafList(TranslatorContext context) {
        return preProcessLeafList.apply(context);
    }

    public TranslatorContext postProcessLeafList(TranslatorContext context) {
        return postProcessLeafList.apply(context);
    }

    @Nullable
    public Binding<Translator, LeafTranslator> getBinding(String name) {
        return bindings.get(name);
    }

    public Map<String, Binding<Translator, LeafTranslator>> getBindings() {
        return bindings;
    }

    @Override
    public String toString() {
        return "Translator"+bindings.keySet();
    }

    public static class Builder {
        private TranslatorHook preProcess = TranslatorHook.IDENTITY;
        private TranslatorHook postProcess = TranslatorHook.IDENTITY;
        private TranslatorHook preProcessList = TranslatorHook.IDENTITY;
        private TranslatorHook postProcessList = TranslatorHook.IDENTITY;
        private TranslatorHook preProcessLeafList = TranslatorHook.IDENTITY;
        private TranslatorHook postProcessLeafList = TranslatorHook.IDENTITY;
        private final ImmutableMap.Builder<String, Binding<Translator, LeafTranslator>> bindings = ImmutableMap.builder();

        public Builder preProcess(TranslatorHook hook) {
            this.preProcess = Preconditions.checkNotNull(hook, "hook");
            return this;
        }

        public Builder postProcess(TranslatorHook hook) {
            this.postProcess = Preconditions.checkNotNull(hook, "hook");
            return this;
        }

        public Builder preProcessList(TranslatorHook hook) {
            this.preProcessList = Preconditions.checkNotNull(hook, "hook");
            return this;
        }

        public Builder postProcessList(TranslatorHook hook) {
            this.postProcessList = Preconditions.checkNotNull(hook, "hook");
            return this;
        }

        public Builder preProcessLeafList(TranslatorHook hook) {
            this.preProcessLeafList = Preconditions.checkNotNull(hook, "hook");
            return this;
        }

        public Builder postProcessLeafList(TranslatorHook hook) {
            this.postProcessLeafList = Preconditions.checkNotNull(hook, "hook");
            return this;
        }

        public Builder container(String name, Translator translator) {
            return bind(name, Binding.<Translator, LeafTranslator>container(translator));
        }

        public Builder list(String name, Translator translator) {
            return bind(name, Binding.<Translator, LeafTranslator>list(translator));
        }

        public Builder leaf(String name, LeafTranslator accessor) {
            return bind(name, Binding.<Translator, LeafTranslator>leaf(accessor));
        }

        public Builder leafList(String name, LeafTranslator accessor) {
            return bind(name, Binding.<Translator, LeafTranslator>leafList(accessor));
        }

        public Builder unneeded(String ...names) {
            for (String name: names) {
                bind(name, Binding.<Translator, LeafTranslator>unneeded());
            }
            return this;
        }

        public Builder bind(String name, Binding<Translator, LeafTranslator> binding) {
            bindings.put(Preconditions.checkNotNull(name, "name"), binding);
            return this;
        }

        public Translator build() {
            return new Translator(this);
        }
    }

}
