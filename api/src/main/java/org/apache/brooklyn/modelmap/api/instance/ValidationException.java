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
package org.apache.brooklyn.modelmap.api.instance;

import org.apache.brooklyn.modelmap.api.ModelException;

/**
 * A raw tree does not conform to the schema.
 * Distinct from schema lookup failures so callers can decide to retry without validation.
 */
public class ValidationException extends ModelException {

    private static final long serialVersionUID = -6690521183014957743L;

    private final String reason;

    public ValidationException(String path, String reason) {
        super("Validation failed at "+path+": "+reason, path);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

}
