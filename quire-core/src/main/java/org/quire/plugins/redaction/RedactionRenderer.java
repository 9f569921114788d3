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
package org.quire.plugins.redaction;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import org.quire.api.Block;
import org.quire.api.BlockMetadata;
import org.quire.api.Subject;
import org.quire.api.VerificationStatus;
import org.quire.plugins.metadata.MetadataShadowStore;
import org.quire.spi.security.AccessEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a document for a subject with a redaction marker in place of
 * every block the subject may not see, and a tamper flag on every visible
 * block whose verification found a modification.
 */
public class RedactionRenderer {

    private static final Logger log = LoggerFactory.getLogger(RedactionRenderer.class);

    private final AccessEvaluator evaluator;
    private final MetadataShadowStore metadata;

    public RedactionRenderer(@Nonnull AccessEvaluator evaluator, @Nonnull MetadataShadowStore metadata) {
        this.evaluator = checkNotNull(evaluator);
        this.metadata = checkNotNull(metadata);
    }

    @Nonnull
    public List<RenderedBlock> render(@Nonnull List<Block> blocks, @Nullable Subject subject) {
        ImmutableList.Builder<RenderedBlock> rendered = ImmutableList.builder();
        for (Block block : blocks) {
            BlockMetadata md = metadata.getEffective(block.getId());
            if (isAllowed(subject, block, md)) {
                boolean tampered = metadata.getVerificationStatus(block.getId()) == VerificationStatus.TAMPERED;
                rendered.add(RenderedBlock.visible(block, tampered));
            } else {
                rendered.add(RenderedBlock.redacted(md.getEffectiveClassification()));
            }
        }
        return rendered.build();
    }

    private boolean isAllowed(Subject subject, Block block, BlockMetadata md) {
        try {
            return evaluator.evaluate(subject, md);
        } catch (RuntimeException e) {
            log.error("Evaluation of block {} failed, rendering it redacted", block.getId(), e);
            return false;
        }
    }
}
