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

import java.util.List;

import javax.annotation.Nonnull;

import org.quire.api.Block;

/**
 * Extension point for observing changes of a document's authoritative
 * content. Changes are reported by passing the ordered block snapshots
 * before and after the change.
 * <p>
 * The "after" snapshot of one call is the "before" snapshot of the next
 * call for as long as the observer stays registered. Several mutations
 * may be reported by a single call.
 */
public interface ContentObserver {

    /**
     * @param before blocks before the change
     * @param after blocks after the change
     */
    void contentChanged(@Nonnull List<Block> before, @Nonnull List<Block> after);
}
