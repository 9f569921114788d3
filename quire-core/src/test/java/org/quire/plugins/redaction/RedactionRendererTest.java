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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.quire.AbstractSecurityTest;
import org.quire.api.Block;
import org.quire.api.Classification;
import org.quire.api.VerificationStatus;

public class RedactionRendererTest extends AbstractSecurityTest {

    @Test
    public void redactsWhatSubjectMayNotSee() {
        metadata.set("b2", classified(Classification.CONFIDENTIAL));
        List<Block> blocks = ImmutableList.of(block("b1", "open"), block("b2", "closed"), block("b3", "open"));

        List<RenderedBlock> rendered = new RedactionRenderer(evaluator, metadata).render(blocks, viewer);

        assertEquals(3, rendered.size());
        assertFalse(rendered.get(0).isRedacted());
        assertEquals("open", rendered.get(0).getBlock().getPayload());
        assertTrue(rendered.get(1).isRedacted());
        assertNull(rendered.get(1).getBlock());
        assertEquals(Classification.CONFIDENTIAL, rendered.get(1).getRequiredClassification());
        assertFalse(rendered.get(2).isRedacted());
    }

    @Test
    public void flagsTamperedBlocks() {
        metadata.setVerificationStatus("b1", VerificationStatus.TAMPERED);
        metadata.setVerificationStatus("b2", VerificationStatus.VERIFIED);
        List<RenderedBlock> rendered = new RedactionRenderer(evaluator, metadata)
                .render(ImmutableList.of(block("b1", "x"), block("b2", "y")), editor);

        assertTrue(rendered.get(0).isTampered());
        assertFalse(rendered.get(1).isTampered());
    }

    @Test
    public void anonymousGetsOnlyMarkers() {
        List<RenderedBlock> rendered = new RedactionRenderer(evaluator, metadata)
                .render(ImmutableList.of(block("b1", "x")), null);
        assertTrue(rendered.get(0).isRedacted());
        assertEquals(Classification.PUBLIC, rendered.get(0).getRequiredClassification());
    }
}
