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

/**
 * Ephemeral integrity state of a block. Recomputed on every load and never
 * persisted.
 */
public enum VerificationStatus {

    /** Not yet checked, or the check could not be completed. */
    UNKNOWN,

    /** A signature round trip is in flight. */
    VERIFYING,

    /** The current content matches the stored signature. */
    VERIFIED,

    /** The current content does not match the stored signature. */
    TAMPERED,

    /** The block carries no signature. */
    UNSIGNED
}
