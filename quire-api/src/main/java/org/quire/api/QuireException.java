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

import static java.lang.String.format;

/**
 * Main exception thrown by the secure document core when an operation
 * could not be carried out. Ordinary authorization denial is not an error
 * and is never reported through this exception.
 * <p>
 * The message is of the form {@code Quire<type><code>: <message>}, for
 * example {@code QuireAccess0003: subject may not sign block b1}.
 */
public class QuireException extends Exception {

    /**
     * Source name for exceptions thrown by the core.
     */
    public static final String QUIRE = "Quire";

    /**
     * The subject is not allowed to perform the operation.
     */
    public static final String ACCESS = "Access";

    /**
     * Block content or a signature failed an integrity check.
     */
    public static final String INTEGRITY = "Integrity";

    /**
     * A signing or target-document authority could not be reached or
     * gave an unusable answer.
     */
    public static final String AUTHORITY = "Authority";

    /**
     * Security metadata could not be interpreted.
     */
    public static final String METADATA = "Metadata";

    /**
     * The operation is not valid in the current state, for example on a
     * closed session.
     */
    public static final String STATE = "State";

    private static final long serialVersionUID = 4420396122107382519L;

    private final String source;

    private final String type;

    private final int code;

    public QuireException(String source, String type, int code, String message, Throwable cause) {
        super(format("%s%s%04d: %s", source, type, code, message), cause);
        this.source = source;
        this.type = type;
        this.code = code;
    }

    public QuireException(String type, int code, String message, Throwable cause) {
        this(QUIRE, type, code, message, cause);
    }

    public QuireException(String type, int code, String message) {
        this(type, code, message, null);
    }

    /**
     * Checks whether this exception is of the given type.
     *
     * @param type type name
     * @return {@code true} iff this exception is of the given type
     */
    public boolean isOfType(String type) {
        return this.type.equals(type);
    }

    public boolean isAccessViolation() {
        return isOfType(ACCESS);
    }

    public String getSource() {
        return source;
    }

    public String getType() {
        return type;
    }

    public int getCode() {
        return code;
    }
}
