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
package org.quire.security.authorization;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.Maps;
import org.quire.api.AccessViolationException;
import org.quire.api.Block;
import org.quire.api.BlockMetadata;
import org.quire.api.Subject;
import org.quire.plugins.metadata.MetadataShadowStore;
import org.quire.spi.security.AccessEvaluator;

/**
 * Validates the edit of a subject by comparing the content before and after
 * the edit. Changed and removed blocks are checked against the metadata
 * recorded before the edit, added blocks against the metadata they are
 * added with. Reordering alone is not an edit of any block.
 */
public class BlockEditValidator {

    private final AccessEvaluator evaluator;
    private final MetadataShadowStore metadata;

    public BlockEditValidator(@Nonnull AccessEvaluator evaluator, @Nonnull MetadataShadowStore metadata) {
        this.evaluator = checkNotNull(evaluator);
        this.metadata = checkNotNull(metadata);
    }

    /**
     * @throws AccessViolationException for the first block the subject may
     *         not touch
     */
    public void validate(@Nullable Subject subject, @Nonnull List<Block> before, @Nonnull List<Block> after)
            throws AccessViolationException {
        Map<String, Block> beforeById = Maps.newLinkedHashMap();
        for (Block b : before) {
            beforeById.put(b.getId(), b);
        }

        for (Block b : after) {
            Block previous = beforeById.remove(b.getId());
            if (previous == null) {
                checkEdit(subject, b.getId(), recorded(b.getId(), b.getMetadata()), "add");
            } else if (!previous.equals(b)) {
                checkEdit(subject, b.getId(), recorded(b.getId(), previous.getMetadata()), "modify");
            }
        }
        for (Block removed : beforeById.values()) {
            checkEdit(subject, removed.getId(), recorded(removed.getId(), removed.getMetadata()), "remove");
        }
    }

    //------------------------------------------------------------< private >---

    private BlockMetadata recorded(String blockId, @Nullable BlockMetadata fallback) {
        return metadata.get(blockId).orElse(fallback);
    }

    private void checkEdit(Subject subject, String blockId, BlockMetadata md, String operation)
            throws AccessViolationException {
        if (!evaluator.evaluateEdit(subject, md)) {
            String subjectId = subject == null ? "anonymous" : subject.getId();
            throw new AccessViolationException(1, blockId,
                    format("subject %s may not %s block %s", subjectId, operation, blockId));
        }
    }
}
