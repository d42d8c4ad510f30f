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

/** Runs around a container, list or leaf-list; returns the context seen from then on. */
public interface TranslatorHook {

    TranslatorHook IDENTITY = new TranslatorHook() {
        @Override
        public TranslatorContext apply(TranslatorContext context) {
            return context;
        }
        @Override
        public String toString() {
            return "TranslatorHook.IDENTITY";
        }
    };

    TranslatorContext apply(TranslatorContext context);

}
