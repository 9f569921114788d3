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
package org.quire;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.io.Closer;
import org.quire.api.Subject;
import org.quire.commons.concurrent.ExecutorCloser;
import org.quire.plugins.audit.LoggingAuditSink;
import org.quire.plugins.memory.MemoryPersistence;
import org.quire.security.authority.LocalSigningAuthority;
import org.quire.security.authorization.AbacEvaluator;
import org.quire.spi.audit.AuditSink;
import org.quire.spi.persistence.PersistenceLayer;
import org.quire.spi.reference.AuthorityProvider;
import org.quire.spi.reference.TargetDocumentAuthority;
import org.quire.spi.security.AccessEvaluator;
import org.quire.spi.security.SigningAuthority;
import org.quire.spi.state.ContentStore;
import org.quire.stats.Clock;

/**
 * Builder for a {@link SecureDocumentSession}.
 * <pre>
 * SecureDocumentSession session = new Quire(store)
 *         .with(signingAuthority)
 *         .with(authorities)
 *         .with(auditSink)
 *         .createSession(subject);
 * </pre>
 * Collaborators that are not given are replaced by local defaults: an
 * {@link AbacEvaluator}, a {@link LocalSigningAuthority} with a fresh key,
 * a {@link MemoryPersistence}, a {@link LoggingAuditSink}, no authorities
 * for other documents, the system clock and the configuration from system
 * properties.
 */
public class Quire {

    private static final AuthorityProvider NO_AUTHORITIES = new AuthorityProvider() {
        @Override
        public TargetDocumentAuthority getAuthority(@Nonnull String docId) {
            return null;
        }
    };

    private final ContentStore store;

    private AccessEvaluator evaluator;
    private SigningAuthority signingAuthority;
    private AuthorityProvider authorities = NO_AUTHORITIES;
    private PersistenceLayer persistence;
    private AuditSink audit;
    private Clock clock = Clock.SIMPLE;
    private SessionConfiguration config;
    private ScheduledExecutorService scheduledExecutor;
    private Executor executor;

    public Quire(@Nonnull ContentStore store) {
        this.store = checkNotNull(store);
    }

    /**
     * Default {@code ScheduledExecutorService} used for coalescing
     * recomputes. Its threads are daemons and idle threads are pruned after
     * one minute.
     */
    public static ScheduledExecutorService defaultScheduledExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(@Nonnull Runnable r) {
                Thread thread = new Thread(r, "quire-scheduled-executor-" + counter.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        });
        executor.setKeepAliveTime(1, TimeUnit.MINUTES);
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Default {@code ExecutorService} used for signing, verification and
     * handshake round trips.
     */
    public static ExecutorService defaultExecutorService() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<Runnable>(), new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(@Nonnull Runnable r) {
                Thread thread = new Thread(r, "quire-executor-" + counter.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        });
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Nonnull
    public Quire with(@Nonnull AccessEvaluator evaluator) {
        this.evaluator = checkNotNull(evaluator);
        return this;
    }

    @Nonnull
    public Quire with(@Nonnull SigningAuthority signingAuthority) {
        this.signingAuthority = checkNotNull(signingAuthority);
        return this;
    }

    @Nonnull
    public Quire with(@Nonnull AuthorityProvider authorities) {
        this.authorities = checkNotNull(authorities);
        return this;
    }

    @Nonnull
    public Quire with(@Nonnull PersistenceLayer persistence) {
        this.persistence = checkNotNull(persistence);
        return this;
    }

    @Nonnull
    public Quire with(@Nonnull AuditSink audit) {
        this.audit = checkNotNull(audit);
        return this;
    }

    @Nonnull
    public Quire with(@Nonnull Clock clock) {
        this.clock = checkNotNull(clock);
        return this;
    }

    @Nonnull
    public Quire with(@Nonnull SessionConfiguration config) {
        this.config = checkNotNull(config);
        return this;
    }

    @Nonnull
    public Quire with(@Nonnull ScheduledExecutorService scheduledExecutor) {
        this.scheduledExecutor = checkNotNull(scheduledExecutor);
        return this;
    }

    @Nonnull
    public Quire with(@Nonnull Executor executor) {
        this.executor = checkNotNull(executor);
        return this;
    }

    /**
     * Creates a session for the given subject. Executors created here are
     * shut down when the session is closed; executors passed in are not.
     */
    @Nonnull
    public SecureDocumentSession createSession(@Nullable Subject subject) {
        Closer closer = Closer.create();
        ScheduledExecutorService scheduled = scheduledExecutor;
        if (scheduled == null) {
            scheduled = defaultScheduledExecutor();
            closer.register(new ExecutorCloser(scheduled));
        }
        Executor exec = executor;
        if (exec == null) {
            ExecutorService executorService = defaultExecutorService();
            exec = executorService;
            closer.register(new ExecutorCloser(executorService));
        }
        return new SecureDocumentSession(
                store,
                evaluator == null ? new AbacEvaluator(store.getDocId()) : evaluator,
                signingAuthority == null ? new LocalSigningAuthority(clock) : signingAuthority,
                authorities,
                persistence == null ? new MemoryPersistence() : persistence,
                audit == null ? new LoggingAuditSink() : audit,
                clock,
                config == null ? SessionConfiguration.fromSystemProperties() : config,
                scheduled,
                exec,
                closer,
                subject);
    }
}
