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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Test;

public class SessionConfigurationTest {

    @After
    public void clearProperties() {
        System.clearProperty(SessionConfiguration.PARAM_TOKEN_TTL_SECONDS);
        System.clearProperty(SessionConfiguration.PARAM_PREFETCH_ENABLED);
        System.clearProperty(SessionConfiguration.PARAM_DEBOUNCE_MILLIS);
    }

    @Test
    public void defaults() {
        SessionConfiguration config = SessionConfiguration.fromSystemProperties();
        assertEquals(TimeUnit.MINUTES.toMillis(5), config.getTokenTtlMillis());
        assertEquals(0, config.getTokenSkewMillis());
        assertEquals(50, config.getDebounceMillis());
        assertEquals(5000, config.getAuthorityTimeoutMillis());
        assertTrue(config.isPrefetchEnabled());
    }

    @Test
    public void systemPropertiesOverrideDefaults() {
        System.setProperty(SessionConfiguration.PARAM_TOKEN_TTL_SECONDS, "60");
        System.setProperty(SessionConfiguration.PARAM_PREFETCH_ENABLED, "false");
        SessionConfiguration config = SessionConfiguration.fromSystemProperties();
        assertEquals(60000, config.getTokenTtlMillis());
        assertFalse(config.isPrefetchEnabled());
    }

    @Test
    public void invalidPropertyFallsBackToDefault() {
        System.setProperty(SessionConfiguration.PARAM_TOKEN_TTL_SECONDS, "-1");
        System.setProperty(SessionConfiguration.PARAM_DEBOUNCE_MILLIS, "soon");
        SessionConfiguration config = SessionConfiguration.fromSystemProperties();
        assertEquals(300000, config.getTokenTtlMillis());
        assertEquals(50, config.getDebounceMillis());
    }

    @Test
    public void builderOverridesProperties() {
        System.setProperty(SessionConfiguration.PARAM_TOKEN_TTL_SECONDS, "60");
        SessionConfiguration config = SessionConfiguration.builder()
                .tokenTtl(2, TimeUnit.MINUTES)
                .debounce(0, TimeUnit.MILLISECONDS)
                .build();
        assertEquals(120000, config.getTokenTtlMillis());
        assertEquals(0, config.getDebounceMillis());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveTimeout() {
        SessionConfiguration.builder().authorityTimeout(0, TimeUnit.SECONDS);
    }
}
