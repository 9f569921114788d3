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
package org.quire.spi.persistence;

import java.util.List;

import javax.annotation.Nonnull;

import org.quire.api.Block;
import org.quire.api.QuireException;

/**
 * Durable storage of document snapshots. Blocks carry their security
 * metadata; verification status and tokens are never persisted.
 */
public interface PersistenceLayer {

    /**
     * @return the blocks of the document in order, empty if nothing was
     *         stored for it
     */
    @Nonnull
    List<Block> loadSnapshot(@Nonnull String docId) throws QuireException;

    void saveSnapshot(@Nonnull String docId, @Nonnull List<Block> blocks) throws QuireException;
}
