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
package org.apache.brooklyn.modelmap.handler;

import javax.annotation.Nullable;

import org.apache.brooklyn.modelmap.api.ModelException;
import org.apache.brooklyn.modelmap.api.schema.SchemaNode;

import com.google.common.base.Preconditions;

/**
 * Tagged descriptor of what handles one schema child:
 * a nested handler of type <code>H</code> (containers and lists),
 * an accessor of type <code>A</code> (leaves and leaf-lists),
 * or nothing, when {@link BindingKind#UNNEEDED}.
 */
public final class Binding<H, A> {

    private final BindingKind kind;
    @Nullable private final H handler;
    @Nullable private final A accessor;

    private Binding(BindingKind kind, @Nullable H handler, @Nullable A accessor) {
        this.kind = kind;
        this.handler = handler;
        this.accessor = accessor;
    }

    public static <H, A> Binding<H, A> container(H handler) {
        return new Binding<H, A>(BindingKind.CONTAINER, Preconditions.checkNotNull(handler, "handler"), null);
    }

    public static <H, A> Binding<H, A> list(H handler) {
        return new Binding<H, A>(BindingKind.LIST, Preconditions.checkNotNull(handler, "handler"), null);
    }

    public static <H, A> Binding<H, A> leaf(A accessor) {
        return new Binding<H, A>(BindingKind.LEAF, null, Preconditions.checkNotNull(accessor, "accessor"));
    }

    public static <H, A> Binding<H, A> leafList(A accessor) {
        return new Binding<H, A>(BindingKind.LEAF_LIST, null, Preconditions.checkNotNull(accessor, "accessor"));
    }

    public static <H, A> Binding<H, A> unneeded() {
        return new Binding<H, A>(BindingKind.UNNEEDED, null, null);
    }

    public BindingKind getKind() {
        return kind;
    }

    public boolean isUnneeded() {
        return kind==BindingKind.UNNEEDED;
    }

    public H getHandler() {
        Preconditions.checkState(handler!=null, "%s binding has no handler", kind);
        return handler;
    }

    public A getAccessor() {
        Preconditions.checkState(accessor!=null, "%s binding has no accessor", kind);
        return accessor;
    }

    /** @throws ModelException if this binding cannot be used for the given schema node */
    public Binding<H, A> checkFor(SchemaNode node) {
        if (!kind.accepts(node.getKind())) {
            throw new ModelException("Handler for "+node.getName()+" is bound as "+kind+" but the schema node is a "+node.getKind(), node.getDataPath());
        }
        return this;
    }

    @Override
    public String toString() {
        return "Binding["+kind+"]";
    }

}
