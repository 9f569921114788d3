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
package org.quire.plugins.observation;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import org.quire.api.Block;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The blocks of a document a subject may see, in document order. The view
 * is derived and never authoritative; it is only ever replaced as a whole.
 */
public class FilteredView {

    private static final Logger log = LoggerFactory.getLogger(FilteredView.class);

    private final AtomicReference<List<Block>> blocks =
            new AtomicReference<List<Block>>(ImmutableList.<Block>of());

    private final List<FilteredViewListener> listeners = new CopyOnWriteArrayList<FilteredViewListener>();

    @Nonnull
    public List<Block> getBlocks() {
        return blocks.get();
    }

    @Nonnull
    public List<String> getBlockIds() {
        return Block.ids(blocks.get());
    }

    @Nonnull
    public Closeable addListener(@Nonnull final FilteredViewListener listener) {
        listeners.add(checkNotNull(listener));
        return new Closeable() {
            @Override
            public void close() {
                listeners.remove(listener);
            }
        };
    }

    void replace(@Nonnull List<Block> content) {
        List<Block> view = ImmutableList.copyOf(content);
        blocks.set(view);
        for (FilteredViewListener l : listeners) {
            try {
                l.viewChanged(view);
            } catch (RuntimeException e) {
                log.error("View listener {} failed", l, e);
            }
        }
    }
}
