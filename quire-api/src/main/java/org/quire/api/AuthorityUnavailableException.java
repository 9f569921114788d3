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
 * A signing or target-document authority could not be reached, timed out,
 * or failed while answering. Callers map this to
 * {@link VerificationStatus#UNKNOWN} or a denied resolution and never to a
 * positive outcome.
 */
public class AuthorityUnavailableException extends QuireException {

    private static final long serialVersionUID = -2193860310287046217L;

    public AuthorityUnavailableException(int code, String message, Throwable cause) {
        super(AUTHORITY, code, message, cause);
    }

    public AuthorityUnavailableException(int code, String message) {
        this(code, message, null);
    }
}
