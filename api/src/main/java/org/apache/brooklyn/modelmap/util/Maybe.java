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
package org.apache.brooklyn.modelmap.util;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * A value which may be present (possibly null) or absent with the reason it was not found,
 * so that a caller doing {@link #get()} on something which was not there gets a useful message.
 * <p>
 * Used as the result of navigating model trees, where "not found" is an expected outcome
 * and not an error.
 */
public abstract class Maybe<T> {

    private Maybe() {}

    /** an absent whose {@link #get()} throws an {@link IllegalStateException} with the given message */
    public static <T> Maybe<T> absent(String message) {
        return new Absent<T>(Preconditions.checkNotNull(message, "message"));
    }

    /** a present instance; the argument may be null and the result is still present */
    public static <T> Maybe<T> of(@Nullable T value) {
        return new Present<T>(value);
    }

    public abstract boolean isPresent();

    /** @throws IllegalStateException if absent */
    public abstract T get();

    public boolean isAbsent() {
        return !isPresent();
    }

    @Nullable
    public T orNull() {
        return isPresent() ? get() : null;
    }

    private static final class Absent<T> extends Maybe<T> {
        private final String message;
        Absent(String message) {
            this.message = message;
        }
        @Override
        public boolean isPresent() {
            return false;
        }
        @Override
        public T get() {
            throw new IllegalStateException(message);
        }
        @Override
        public String toString() {
            return "Absent["+message+"]";
        }
    }

    private static final class Present<T> extends Maybe<T> {
        @Nullable private final T value;
        Present(@Nullable T value) {
            this.value = value;
        }
        @Override
        public boolean isPresent() {
            return true;
        }
        @Override
        public T get() {
            return value;
        }
        @Override
        public String toString() {
            return "Present[value="+value+"]";
        }
    }

}
