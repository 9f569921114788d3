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
package org.quire.stats;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of wall clock time at millisecond accuracy. Token expiry,
 * provenance timestamps, audit events and reference verification times
 * are all read from a clock instance handed to the component, so that
 * tests can drive time explicitly through {@link Virtual}.
 */
public abstract class Clock {

    private long monotonic = 0;

    /**
     * Returns the current time in milliseconds since the epoch.
     *
     * @see System#currentTimeMillis()
     * @return current time in milliseconds since the epoch
     */
    public abstract long getTime();

    /**
     * Returns a monotonically increasing timestamp based on the current time.
     * A call to this method will always return a value that is greater than
     * or equal to a value returned by any previous call, even if the
     * underlying time source is adjusted backwards.
     *
     * @return monotonically increasing timestamp
     */
    public synchronized long getTimeMonotonic() {
        long now = getTime();
        if (now > monotonic) {
            monotonic = now;
        } else {
            now = monotonic;
        }
        return now;
    }

    /**
     * Convenience method that returns the {@link #getTime()} value
     * as an {@link Instant}.
     *
     * @return current time
     */
    public Instant getInstant() {
        return Instant.ofEpochMilli(getTime());
    }

    /**
     * Clock based on {@link System#currentTimeMillis()}.
     */
    public static final Clock SIMPLE = new Clock() {
        @Override
        public long getTime() {
            return System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return "Clock.SIMPLE";
        }
    };

    /**
     * A virtual clock that only moves when told to. Starts at the given
     * epoch millisecond value (zero by default).
     */
    public static class Virtual extends Clock {

        private final AtomicLong time;

        public Virtual() {
            this(0);
        }

        public Virtual(long start) {
            this.time = new AtomicLong(start);
        }

        @Override
        public long getTime() {
            return time.get();
        }

        /**
         * Moves this clock forward by the given amount.
         *
         * @param amount the amount, must not be negative
         * @param unit the unit of {@code amount}
         * @return the new time
         */
        public long advance(long amount, TimeUnit unit) {
            if (amount < 0) {
                throw new IllegalArgumentException("Cannot move a clock backwards: " + amount);
            }
            return time.addAndGet(unit.toMillis(amount));
        }

        /**
         * Sets this clock to the given point in time, unless it already
         * is past it.
         *
         * @param timestamp time in milliseconds since epoch
         */
        public void waitUntil(long timestamp) {
            long now = time.get();
            while (now < timestamp && !time.compareAndSet(now, timestamp)) {
                now = time.get();
            }
        }

        @Override
        public String toString() {
            return "Clock.Virtual";
        }
    }

}
