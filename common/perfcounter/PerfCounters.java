/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.common.perfcounter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named counters owned by a single rewrite system. Not thread-safe: a rewrite system is only
 * ever mutated by the thread that owns it.
 */
public class PerfCounters {

    public interface Counter {
        String name();

        void add(long delta);

        long get();
    }

    private final Map<String, Counter> counters;

    public PerfCounters() {
        this.counters = new LinkedHashMap<>();
    }

    public Counter register(String name) {
        return counters.computeIfAbsent(name, LongCounter::new);
    }

    public Counter get(String name) {
        Counter counter = counters.get(name);
        return counter != null ? counter : register(name);
    }

    public Collection<Counter> counters() {
        return Collections.unmodifiableCollection(counters.values());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        counters.values().forEach(counter -> sb.append(String.format("%-48s: %-20d\n", counter.name(), counter.get())));
        return sb.toString();
    }

    private static class LongCounter implements Counter {
        private final String name;
        private long value;

        private LongCounter(String name) {
            this.name = name;
            this.value = 0;
        }

        public String name() {
            return name;
        }

        public void add(long delta) {
            value += delta;
        }

        public long get() {
            return value;
        }
    }
}
