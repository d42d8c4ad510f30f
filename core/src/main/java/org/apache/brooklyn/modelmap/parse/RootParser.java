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

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.api.instance.ContentType;
import org.apache.brooklyn.modelmap.api.instance.DataModel;
import org.apache.brooklyn.modelmap.api.instance.InstanceNode;
import org.apache.brooklyn.modelmap.filter.ModelFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * Entry point for reading native data (device configuration, command output, etc)
 * into an instance of a {@link DataModel}.
 * <p>
 * Configure with {@link #builder(DataModel, Parser)}; a built instance can be processed repeatedly.
 */
public class RootParser {

    private static final Logger log = LoggerFactory.getLogger(RootParser.class);

    private final DataModel model;
    private final Parser handler;
    @Nullable private final Object nativeData;
    private final boolean config;
    private final boolean state;
    private final ModelFilter filter;
    private final Map<String, Object> extra;
    private final ParserHook init;
    private final ParserHook post;

    protected RootParser(Builder builder) {
        this.model = builder.model;
        this.handler = builder.handler;
        this.nativeData = builder.nativeData;
        this.config = builder.config;
        this.state = builder.state;
        this.filter = new ModelFilter(builder.include, builder.exclude);
        this.extra = builder.extra;
        this.init = builder.init;
        this.post = builder.post;
    }

    public static Builder builder(DataModel model, Parser handler) {
        return new Builder(model, handler);
    }

    /** parses and validates; see {@link #process(boolean)} */
    public InstanceNode process() {
        return process(true);
    }

    /**
     * Parses the native data into an instance of the model,
     * validated if requested against all data when state is included, otherwise against config only.
     *
     * @throws org.apache.brooklyn.modelmap.api.instance.ValidationException if validation is requested and fails
     */
    public InstanceNode process(boolean validate) {
        Map<String, Object> raw = processRaw();
        if (validate) {
            model.validate(raw, state ? ContentType.ALL : ContentType.CONFIG);
        }
        return model.fromRaw(raw);
    }

    /** parses the native data into the canonical raw tree, without validation */
    public Map<String, Object> processRaw() {
        log.debug("Parsing with {}", this);
        ParserContext context = init.apply(new ParserContext(model.getSchema(), nativeData, nativeData,
            ImmutableMap.<String, Object>of(), extra));
        Map<String, Object> result = new ParseEngine(filter, config, state).processContainer(handler, context, ImmutableList.<String>of());
        post.apply(context);
        return result;
    }

    public DataModel getModel() {
        return model;
    }

    public ModelFilter getFilter() {
        return filter;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("config", config).add("state", state).add("filter", filter).toString();
    }

    public static class Builder {
        private final DataModel model;
        private final Parser handler;
        private Object nativeData;
        private boolean config = true;
        private boolean state = false;
        private List<String> include = ImmutableList.of("/");
        private List<String> exclude = ImmutableList.of();
        private Map<String, Object> extra = Maps.newLinkedHashMap();
        private ParserHook init = ParserHook.IDENTITY;
        private ParserHook post = ParserHook.IDENTITY;

        protected Builder(DataModel model, Parser handler) {
            this.model = Preconditions.checkNotNull(model, "model");
            this.handler = Preconditions.checkNotNull(handler, "handler");
        }

        public Builder nativeData(@Nullable Object nativeData) {
            this.nativeData = nativeData;
            return this;
        }

        /** whether to read configuration leaves; defaults to true */
        public Builder config(boolean config) {
            this.config = config;
            return this;
        }

        /** whether to read operational state leaves; defaults to false */
        public Builder state(boolean state) {
            this.state = state;
            return this;
        }

        /** data paths to include; defaults to everything */
        public Builder include(List<String> include) {
            this.include = ImmutableList.copyOf(include);
            return this;
        }

        public Builder exclude(List<String> exclude) {
            this.exclude = ImmutableList.copyOf(exclude);
            return this;
        }

        /** passed as is to every hook and accessor, see {@link ParserContext#getExtra()} */
        public Builder extra(Map<String, Object> extra) {
            this.extra = Preconditions.checkNotNull(extra, "extra");
            return this;
        }

        /** runs once before the traversal; the context it returns is the root context */
        public Builder init(ParserHook init) {
            this.init = Preconditions.checkNotNull(init, "init");
            return this;
        }

        public Builder post(ParserHook post) {
            this.post = Preconditions.checkNotNull(post, "post");
            return this;
        }

        /** @throws IllegalArgumentException if neither config nor state is requested */
        public RootParser build() {
            Preconditions.checkArgument(config || state, "config and state can't be both false");
            return new RootParser(this);
        }
    }

}
