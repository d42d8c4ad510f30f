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
package org.apache.brooklyn.modelmap.api;

import javax.annotation.Nullable;

/**
 * Base for the failures raised while walking a model,
 * optionally carrying the canonical path being processed when the failure occurred.
 */
public class ModelException extends RuntimeException {

    private static final long serialVersionUID = -3018447220618472901L;

    private final String path;

    public ModelException(String message) { this(message, (String)null); }
    public ModelException(String message, Throwable cause) { this(message, null, cause); }
    public ModelException(String message, @Nullable String path) { super(message); this.path = path; }
    public ModelException(String message, @Nullable String path, Throwable cause) { super(message, cause); this.path = path; }

    /** the canonical path the failure relates to, if known */
    @Nullable
    public String getPath() {
        return path;
    }

    @Override
    public String toString() {
        if (path==null) return super.toString();
        return super.toString() + " (at "+path+")";
    }

}
