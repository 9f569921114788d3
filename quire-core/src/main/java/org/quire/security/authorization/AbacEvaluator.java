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

import java.util.List;

import javax.annotation.Nullable;

import org.quire.api.BlockMetadata;
import org.quire.api.Classification;
import org.quire.api.Subject;
import org.quire.spi.security.AccessEvaluator;

/**
 * Attribute based evaluator. A block is visible to a subject iff all of
 * the following gates pass:
 * <ol>
 *     <li>classification: the subject's clearance is at least the level of
 *     the block's effective classification,</li>
 *     <li>ACL: the ACL is empty or names the subject's id or role,</li>
 *     <li>cross-origin: a restricted block imported from another document
 *     requires clearance 3 unless the subject is an administrator.</li>
 * </ol>
 * Missing metadata is evaluated as {@link BlockMetadata#DEFAULT}. A missing
 * subject is always denied.
 */
public class AbacEvaluator implements AccessEvaluator {

    static final int CROSS_ORIGIN_CLEARANCE = 3;

    private final String localDocId;

    /**
     * @param localDocId id of the document being evaluated; blocks whose
     *                   origin is a different document are imported
     */
    public AbacEvaluator(@Nullable String localDocId) {
        this.localDocId = localDocId;
    }

    public AbacEvaluator() {
        this(null);
    }

    @Override
    public boolean evaluate(@Nullable Subject subject, @Nullable BlockMetadata metadata) {
        if (subject == null) {
            return false;
        }
        BlockMetadata md = metadata == null ? BlockMetadata.DEFAULT : metadata;
        Classification classification = md.getEffectiveClassification();

        if (subject.getClearanceLevel() < classification.getLevel()) {
            return false;
        }

        List<String> acl = md.getAcl();
        if (!acl.isEmpty() && !acl.contains(subject.getId()) && !acl.contains(subject.getRole())) {
            return false;
        }

        if (isImported(md) && classification == Classification.RESTRICTED && !subject.isAdmin()) {
            return subject.getClearanceLevel() >= CROSS_ORIGIN_CLEARANCE;
        }
        return true;
    }

    @Override
    public boolean evaluateEdit(@Nullable Subject subject, @Nullable BlockMetadata metadata) {
        if (!evaluate(subject, metadata)) {
            return false;
        }
        return metadata == null || !metadata.isLocked() || subject.isAdmin();
    }

    //------------------------------------------------------------< private >---

    private boolean isImported(BlockMetadata md) {
        String origin = md.getOriginDocId();
        return origin != null && !origin.isEmpty() && !origin.equals(localDocId);
    }
}
