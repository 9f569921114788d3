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
package org.quire.spi.security;

import javax.annotation.Nullable;

import org.quire.api.BlockMetadata;
import org.quire.api.Subject;

/**
 * Decides whether a subject may see or edit a block, given the block's
 * security metadata. Implementations are deterministic and free of side
 * effects; a denial is an ordinary {@code false}, never an exception.
 */
public interface AccessEvaluator {

    /**
     * @param subject the subject, {@code null} for an unauthenticated caller
     * @param metadata the metadata, {@code null} if the block carries none
     * @return whether the subject may see the block
     */
    boolean evaluate(@Nullable Subject subject, @Nullable BlockMetadata metadata);

    /**
     * @param subject the subject, {@code null} for an unauthenticated caller
     * @param metadata the metadata, {@code null} if the block carries none
     * @return whether the subject may edit the block
     */
    boolean evaluateEdit(@Nullable Subject subject, @Nullable BlockMetadata metadata);
}
