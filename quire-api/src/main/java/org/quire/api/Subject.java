/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.quire.api;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * Immutable snapshot of the attributes of the party on whose behalf blocks
 * are evaluated. The attributes used by the access control gates are typed
 * fields; anything else lives in the extensible {@link #getAttributes()
 * attribute map}.
 */
public final class Subject {

    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_EDITOR = "editor";
    public static final String ROLE_AUDITOR = "auditor";
    public static final String ROLE_VIEWER = "viewer";

    private final String id;
    private final String role;
    private final int clearanceLevel;
    private final String department;
    private final ImmutableMap<String, String> attributes;

    private Subject(Builder builder) {
        this.id = builder.id;
        this.role = builder.role;
        this.clearanceLevel = builder.clearanceLevel;
        this.department = builder.department;
        this.attributes = ImmutableMap.copyOf(builder.attributes);
    }

    @Nonnull
    public static Builder builder(@Nonnull String id, @Nonnull String role) {
        return new Builder(id, role);
    }

    @Nonnull
    public String getId() {
        return id;
    }

    @Nonnull
    public String getRole() {
        return role;
    }

    public int getClearanceLevel() {
        return clearanceLevel;
    }

    @CheckForNull
    public String getDepartment() {
        return department;
    }

    @Nonnull
    public Map<String, String> getAttributes() {
        return attributes;
    }

    @CheckForNull
    public String getAttribute(@Nonnull String name) {
        return attributes.get(name);
    }

    public boolean isAdmin() {
        return ROLE_ADMIN.equals(role);
    }

    /**
     * @return a builder initialized with the attributes of this subject
     */
    @Nonnull
    public Builder toBuilder() {
        Builder b = new Builder(id, role)
                .clearanceLevel(clearanceLevel)
                .department(department);
        b.attributes.putAll(attributes);
        return b;
    }

    @Nonnull
    public Subject withRole(@Nonnull String role) {
        return toBuilder().role(role).build();
    }

    @Nonnull
    public Subject withClearanceLevel(int clearanceLevel) {
        return toBuilder().clearanceLevel(clearanceLevel).build();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Subject)) {
            return false;
        }
        Subject that = (Subject) other;
        return clearanceLevel == that.clearanceLevel
                && id.equals(that.id)
                && role.equals(that.role)
                && Objects.equal(department, that.department)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, role, clearanceLevel, department, attributes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("role", role)
                .add("clearanceLevel", clearanceLevel)
                .add("department", department)
                .omitNullValues()
                .toString();
    }

    public static final class Builder {

        private final String id;
        private String role;
        private int clearanceLevel;
        private String department;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(String id, String role) {
            checkArgument(!Strings.isNullOrEmpty(id), "subject id must not be empty");
            this.id = id;
            this.role = checkNotNull(role);
        }

        public Builder role(@Nonnull String role) {
            this.role = checkNotNull(role);
            return this;
        }

        public Builder clearanceLevel(int clearanceLevel) {
            this.clearanceLevel = clearanceLevel;
            return this;
        }

        public Builder department(@Nullable String department) {
            this.department = department;
            return this;
        }

        public Builder attribute(@Nonnull String name, @Nonnull String value) {
            attributes.put(checkNotNull(name), checkNotNull(value));
            return this;
        }

        public Subject build() {
            return new Subject(this);
        }
    }
}
