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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.quire.AbstractSecurityTest;
import org.quire.api.AccessViolationException;
import org.quire.api.Block;
import org.quire.api.BlockMetadata;
import org.quire.api.Classification;

public class BlockEditValidatorTest extends AbstractSecurityTest {

    private BlockEditValidator validator() {
        return new BlockEditValidator(evaluator, metadata);
    }

    @Test
    public void editOfUnrestrictedBlock() throws Exception {
        List<Block> before = ImmutableList.of(block("a", "one"), block("b", "two"));
        List<Block> after = ImmutableList.of(block("a", "one!"), block("b", "two"), block("c", "three"));
        validator().validate(viewer, before, after);
    }

    @Test
    public void reorderIsNotAnEdit() throws Exception {
        metadata.set("a", BlockMetadata.builder().locked(true).build());
        List<Block> before = ImmutableList.of(block("a", "one"), block("b", "two"));
        validator().validate(editor, before, ImmutableList.of(block("b", "two"), block("a", "one")));
    }

    @Test
    public void lockedBlockRejected() {
        metadata.set("a", BlockMetadata.builder().locked(true).build());
        List<Block> before = ImmutableList.of(block("a", "one"));
        try {
            validator().validate(editor, before, ImmutableList.of(block("a", "changed")));
            fail("locked block edited");
        } catch (AccessViolationException e) {
            assertEquals("a", e.getBlockId());
        }
    }

    @Test
    public void adminMayEditLockedBlock() throws Exception {
        metadata.set("a", BlockMetadata.builder().locked(true).build());
        validator().validate(admin, ImmutableList.of(block("a", "one")), ImmutableList.of(block("a", "two")));
    }

    @Test
    public void removalCheckedAgainstRecordedMetadata() {
        metadata.set("secret", classified(Classification.RESTRICTED));
        try {
            validator().validate(editor, ImmutableList.of(block("secret", "x"), block("b", "y")),
                    ImmutableList.of(block("b", "y")));
            fail("removal of invisible block accepted");
        } catch (AccessViolationException e) {
            assertEquals("secret", e.getBlockId());
        }
    }

    @Test
    public void downgradingMetadataInTheSameEditIsRejected() {
        metadata.set("a", classified(Classification.CONFIDENTIAL, "legal"));
        Block before = block("a", "x");
        Block after = block("a", "x").withMetadata(BlockMetadata.DEFAULT);
        try {
            validator().validate(editor, ImmutableList.of(before), ImmutableList.of(after));
            fail("edit judged by the new metadata");
        } catch (AccessViolationException e) {
            assertEquals("a", e.getBlockId());
        }
    }

    @Test
    public void addedBlockCheckedAgainstItsMetadata() {
        Block added = block("n", "x").withMetadata(classified(Classification.RESTRICTED));
        try {
            validator().validate(editor, ImmutableList.<Block>of(), ImmutableList.of(added));
            fail("added block above clearance accepted");
        } catch (AccessViolationException e) {
            assertEquals("n", e.getBlockId());
        }
    }
}
