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
package org.quire.plugins.reference;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.quire.api.ExternalReference;
import org.quire.api.ReferenceStatus;
import org.quire.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps track of the references of a document to blocks of other
 * documents. Only pointers and their last known status are kept, never the
 * content of the referenced blocks.
 */
public class ExternalReferenceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExternalReferenceRegistry.class);

    private final Clock clock;

    private final Map<String, ExternalReference> references = Maps.newLinkedHashMap();

    private final List<ReferenceListener> listeners = new CopyOnWriteArrayList<ReferenceListener>();

    public ExternalReferenceRegistry(@Nonnull Clock clock) {
        this.clock = checkNotNull(clock);
    }

    public void register(@Nonnull ExternalReference reference) {
        synchronized (references) {
            references.put(reference.getId(), reference);
        }
        fire(reference.getId(), reference);
    }

    @CheckForNull
    public ExternalReference get(@Nonnull String id) {
        synchronized (references) {
            return references.get(id);
        }
    }

    /**
     * @return all references in registration order
     */
    @Nonnull
    public List<ExternalReference> getAll() {
        synchronized (references) {
            return ImmutableList.copyOf(references.values());
        }
    }

    public boolean remove(@Nonnull String id) {
        boolean removed;
        synchronized (references) {
            removed = references.remove(id) != null;
        }
        if (removed) {
            fire(id, null);
        }
        return removed;
    }

    public void clear() {
        List<String> ids;
        synchronized (references) {
            ids = ImmutableList.copyOf(references.keySet());
            references.clear();
        }
        for (String id : ids) {
            fire(id, null);
        }
    }

    /**
     * Records the outcome of a resolution. The verification time is taken
     * from the clock of this registry.
     *
     * @return the updated reference, or {@code null} if no reference with
     *         that id is registered
     */
    @CheckForNull
    public ExternalReference updateStatus(@Nonnull String id, @Nonnull ReferenceStatus status) {
        ExternalReference updated;
        synchronized (references) {
            ExternalReference ref = references.get(id);
            if (ref == null) {
                return null;
            }
            updated = ref.withStatus(status, clock.getInstant());
            references.put(id, updated);
        }
        log.debug("Reference {} is now {}", id, status);
        fire(id, updated);
        return updated;
    }

    @Nonnull
    public Closeable addListener(@Nonnull final ReferenceListener listener) {
        listeners.add(checkNotNull(listener));
        return new Closeable() {
            @Override
            public void close() {
                listeners.remove(listener);
            }
        };
    }

    private void fire(String id, @Nullable ExternalReference reference) {
        for (ReferenceListener l : listeners) {
            try {
                l.referenceChanged(id, reference);
            } catch (RuntimeException e) {
                log.error("Reference listener {} failed for {}", l, id, e);
            }
        }
    }
}
