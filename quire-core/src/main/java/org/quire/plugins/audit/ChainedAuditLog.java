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
package org.quire.plugins.audit;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.List;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.hash.Hashing;
import org.quire.spi.audit.AuditEvent;
import org.quire.spi.audit.AuditSink;

/**
 * In-memory audit log whose entries form a hash chain: each entry hashes
 * its event together with the hash of the previous entry, so that a
 * modified or removed entry breaks every later link. Events are forwarded
 * to an optional delegate sink.
 */
public class ChainedAuditLog implements AuditSink {

    public static final String GENESIS_HASH = "genesis_hash";

    private final AuditSink delegate;

    private final List<Entry> entries = Lists.newArrayList();

    public ChainedAuditLog(@Nonnull AuditSink delegate) {
        this.delegate = checkNotNull(delegate);
    }

    public ChainedAuditLog() {
        this(AuditSink.NOOP);
    }

    @Override
    public void emit(@Nonnull AuditEvent event) {
        synchronized (entries) {
            String previous = entries.isEmpty() ? GENESIS_HASH : entries.get(entries.size() - 1).getHash();
            entries.add(new Entry(event, previous, hash(event, previous)));
        }
        delegate.emit(event);
    }

    @Nonnull
    public List<Entry> getEntries() {
        synchronized (entries) {
            return ImmutableList.copyOf(entries);
        }
    }

    /**
     * @return the index of the first entry that does not match its
     *         predecessor or its own event, {@code -1} if the chain is intact
     */
    public int verify() {
        return verify(getEntries());
    }

    /**
     * Verifies a chain of entries, for example one read back from storage.
     */
    public static int verify(@Nonnull List<Entry> chain) {
        String previous = GENESIS_HASH;
        for (int i = 0; i < chain.size(); i++) {
            Entry e = chain.get(i);
            if (!previous.equals(e.getPreviousHash()) || !hash(e.getEvent(), previous).equals(e.getHash())) {
                return i;
            }
            previous = e.getHash();
        }
        return -1;
    }

    static String hash(AuditEvent event, String previousHash) {
        String data = event.getTimestamp().toEpochMilli()
                + "|" + event.getSubjectId()
                + "|" + event.getAction()
                + "|" + event.getResourceId()
                + "|" + event.getDetails()
                + "|" + previousHash;
        return Hashing.sha256().hashString(data, UTF_8).toString();
    }

    public static final class Entry {

        private final AuditEvent event;
        private final String previousHash;
        private final String hash;

        public Entry(@Nonnull AuditEvent event, @Nonnull String previousHash, @Nonnull String hash) {
            this.event = checkNotNull(event);
            this.previousHash = checkNotNull(previousHash);
            this.hash = checkNotNull(hash);
        }

        @Nonnull
        public AuditEvent getEvent() {
            return event;
        }

        @Nonnull
        public String getPreviousHash() {
            return previousHash;
        }

        @Nonnull
        public String getHash() {
            return hash;
        }
    }
}
