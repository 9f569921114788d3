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

import java.util.Locale;

import javax.annotation.CheckForNull;
import javax.annotation.Nullable;

/**
 * Ordinal sensitivity label of a block. The {@link #getLevel() level} is the
 * minimum clearance a subject needs to see a block carrying this label.
 */
public enum Classification {

    PUBLIC("public", 0),
    INTERNAL("internal", 1),
    CONFIDENTIAL("confidential", 2),
    RESTRICTED("restricted", 3);

    private final String label;
    private final int level;

    Classification(String label, int level) {
        this.label = label;
        this.level = level;
    }

    public String getLabel() {
        return label;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Parses a label as stored in a document snapshot.
     *
     * @param label the label, case insensitive
     * @return the classification or {@code null} if the label is
     *         {@code null} or not one of the known labels
     */
    @CheckForNull
    public static Classification fromLabel(@Nullable String label) {
        if (label == null) {
            return null;
        }
        String l = label.trim().toLowerCase(Locale.ROOT);
        for (Classification c : values()) {
            if (c.label.equals(l)) {
                return c;
            }
        }
        return null;
    }

    /**
     * @param level a stored classification level
     * @return the classification or {@code null} if the level is out of range
     */
    @CheckForNull
    public static Classification fromLevel(int level) {
        for (Classification c : values()) {
            if (c.level == level) {
                return c;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
