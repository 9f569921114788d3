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
package org.quire.plugins.memory;

import java.util.List;
import java.util.concurrent.ConcurrentMap;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.quire.api.Block;
import org.quire.spi.persistence.PersistenceLayer;

/**
 * Keeps document snapshots in memory.
 */
public class MemoryPersistence implements PersistenceLayer {

    private final ConcurrentMap<String, List<Block>> snapshots = Maps.newConcurrentMap();

    @Nonnull
    @Override
    public List<Block> loadSnapshot(@Nonnull String docId) {
        List<Block> blocks = snapshots.get(docId);
        return blocks == null ? ImmutableList.<Block>of() : blocks;
    }

    @Override
    public void saveSnapshot(@Nonnull String docId, @Nonnull List<Block> blocks) {
        snapshots.put(docId, ImmutableList.copyOf(blocks));
    }
}
