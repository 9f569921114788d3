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
package org.quire.spi.observation;

import java.io.Closeable;

import javax.annotation.Nonnull;

/**
 * An {@code Observable} supports attaching {@link ContentObserver}
 * instances for listening to content changes.
 */
public interface Observable {

    /**
     * Register a new {@code ContentObserver}. Clients need to call
     * {@link Closeable#close()} on the returned registration to stop
     * receiving change notifications.
     *
     * @param observer the observer to add
     * @return a {@code Closeable} for removing the observer again
     */
    @Nonnull
    Closeable addObserver(@Nonnull ContentObserver observer);
}
