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
package org.quire.spi.state;

import java.util.List;

import javax.annotation.Nonnull;

import org.quire.api.Block;
import org.quire.api.QuireException;
import org.quire.spi.observation.Observable;

/**
 * Storage abstraction for the authoritative, replicated content of a
 * single document. The merge algorithm behind it is not part of the core:
 * the core only reads ordered snapshots, submits transactional edits and
 * listens to change notifications.
 */
public interface ContentStore extends Observable {

    @Nonnull
    String getDocId();

    /**
     * Returns an immutable snapshot of the current blocks in document
     * order. Later mutations never affect a returned snapshot.
     */
    @Nonnull
    List<Block> getBlocks();

    /**
     * Applies an edit atomically. Observers see either none or all of the
     * edit, and are notified after the new state became visible.
     *
     * @param editor the edit to apply
     * @return the blocks after the edit
     * @throws QuireException if the editor aborted the transaction, in
     *         which case the content is unchanged
     */
    @Nonnull
    List<Block> transact(@Nonnull BlockEditor editor) throws QuireException;
}
