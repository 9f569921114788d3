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

/**
 * A mutation of a document, applied by {@link ContentStore#transact}.
 */
public interface BlockEditor {

    /**
     * Computes the new content of a document.
     *
     * @param current the blocks as of the start of the transaction
     * @return the blocks after the edit
     * @throws QuireException to abort the transaction without a change
     */
    @Nonnull
    List<Block> edit(@Nonnull List<Block> current) throws QuireException;
}
