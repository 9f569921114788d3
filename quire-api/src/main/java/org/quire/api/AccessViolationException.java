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

import javax.annotation.Nonnull;

/**
 * An edit touched a block the subject is not allowed to edit.
 */
public class AccessViolationException extends QuireException {

    private static final long serialVersionUID = -7725071596302357162L;

    private final String blockId;

    public AccessViolationException(int code, @Nonnull String blockId, String message) {
        super(ACCESS, code, message);
        this.blockId = blockId;
    }

    /**
     * @return the id of the first block that failed the edit check
     */
    @Nonnull
    public String getBlockId() {
        return blockId;
    }
}
