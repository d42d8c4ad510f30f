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

import org.apache.brooklyn.modelmap.api.instance.DataModel;
import org.apache.brooklyn.modelmap.api.instance.InstanceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * Entry point for rendering a candidate instance of a {@link DataModel} to native form,
 * either in full (<code>replace</code>) or as the changes needed to get from a running instance.
 * <p>
 * The <code>init</code> hook normally sets the root result (e.g. a new
 * {@link org.apache.brooklyn.modelmap.text.ConfigTree}) and <code>post</code> finishes it;
 * {@link #process()} returns the root result of the context <code>post</code> returns.
 */
public class RootTranslator {

    private static final Logger log = LoggerFactory.getLogger(RootTranslator.class);

    private final DataModel model;
    private final Translator handler;
    private final InstanceNode candidate;
    @Nullable private final InstanceNode running;
    private final boolean replace;
    private final Map<String, Object> extra;
    private final TranslatorHook init;
    private final TranslatorHook post;

    protected RootTranslator(Builder builder) {
        this.model = builder.model;
        this.handler = builder.handler;
        this.candidate = builder.candidate;
        this.running = builder.running;
        this.replace = builder.replace;
        this.extra = builder.extra;
        this.init = builder.init;
        this.post = builder.post;
    }

    public static Builder builder(DataModel model, Translator handler) {
        return new Builder(model, handler);
    }

    @Nullable
    public Object process() {
        log.debug("Translating with {}", this);
        TranslatorContext context = init.apply(TranslatorContext.root(model.getSchema(), candidate, running, replace, extra));
        new TranslateEngine().processContainer(handler, context);
        return post.apply(context).getRootResult();
    }

    public DataModel getModel() {
        return model;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("replace", replace).add("running", running!=null).toString();
    }

    public static class Builder {
        private final DataModel model;
        private final Translator handler;
        private InstanceNode candidate;
        private InstanceNode running;
        private boolean replace;
        private Map<String, Object> extra = Maps.newLinkedHashMap();
        private TranslatorHook init = TranslatorHook.IDENTITY;
        private TranslatorHook post = TranslatorHook.IDENTITY;

        protected Builder(DataModel model, Translator handler) {
            this.model = Preconditions.checkNotNull(model, "model");
            this.handler = Preconditions.checkNotNull(handler, "handler");
        }

        /** the desired data, as a raw canonical tree */
        public Builder candidate(Object candidate) {
            return candidate(model.fromRaw(Preconditions.checkNotNull(candidate, "candidate")));
        }

        public Builder candidate(InstanceNode candidate) {
            this.candidate = candidate;
            return this;
        }

        /** the current data, as a raw canonical tree; null to translate the candidate in full */
        public Builder running(@Nullable Object running) {
            return running(running==null ? null : model.fromRaw(running));
        }

        public Builder running(@Nullable InstanceNode running) {
            this.running = running;
            return this;
        }

        /** whether to render the candidate in full, ignoring what is unchanged from running */
        public Builder replace(boolean replace) {
            this.replace = replace;
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            this.extra = Preconditions.checkNotNull(extra, "extra");
            return this;
        }

        public Builder init(TranslatorHook init) {
            this.init = Preconditions.checkNotNull(init, "init");
            return this;
        }

        public Builder post(TranslatorHook post) {
            this.post = Preconditions.checkNotNull(post, "post");
            return this;
        }

        /** @throws IllegalArgumentException if no candidate was given */
        public RootTranslator build() {
            Preconditions.checkArgument(candidate!=null, "candidate is required");
            return new RootTranslator(this);
        }
    }

}
