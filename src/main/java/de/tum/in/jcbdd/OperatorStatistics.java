/*
 * This file is part of JCBDD.
 * Copyright (c) 2024 The JCBDD authors.
 *
 * JCBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JCBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JCBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jcbdd;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Counters gathered by the apply engine for each {@link Operator}. The counters are purely diagnostic.
 */
public final class OperatorStatistics {
    private static final Logger logger = Logger.getLogger(OperatorStatistics.class.getName());

    private final Map<Operator, Counters> counters = new EnumMap<>(Operator.class);

    OperatorStatistics() {
        for (Operator operator : Operator.values()) {
            counters.put(operator, new Counters());
        }
    }

    void call(Operator operator) {
        counters.get(operator).calls.increment();
    }

    void terminalCase(Operator operator) {
        counters.get(operator).terminalCases.increment();
    }

    void cacheQuery(Operator operator) {
        counters.get(operator).cacheQueries.increment();
    }

    void cacheHit(Operator operator) {
        counters.get(operator).cacheHits.increment();
    }

    void countReduced(Operator operator) {
        counters.get(operator).reduced.increment();
    }

    public long calls(Operator operator) {
        return counters.get(operator).calls.sum();
    }

    public long terminalCases(Operator operator) {
        return counters.get(operator).terminalCases.sum();
    }

    public long cacheQueries(Operator operator) {
        return counters.get(operator).cacheQueries.sum();
    }

    public long cacheHits(Operator operator) {
        return counters.get(operator).cacheHits.sum();
    }

    /**
     * Number of times the reduction rule eliminated a node (both children equal) while applying {@code operator}.
     */
    public long reduced(Operator operator) {
        return counters.get(operator).reduced.sum();
    }

    public void reset() {
        counters.values().forEach(Counters::reset);
    }

    public String statistics() {
        StringBuilder builder = new StringBuilder(64 * (Operator.values().length + 1));
        builder.append(String.format("%-9s %12s %12s %12s %12s %12s%n",
                "Operator", "calls", "terminal", "cache query", "cache hit", "reduced"));
        counters.forEach((operator, counter) -> builder.append(String.format("%-9s %12d %12d %12d %12d %12d%n",
                operator,
                counter.calls.sum(),
                counter.terminalCases.sum(),
                counter.cacheQueries.sum(),
                counter.cacheHits.sum(),
                counter.reduced.sum())));
        return builder.toString();
    }

    public void log() {
        if (logger.isLoggable(Level.INFO)) {
            logger.info(statistics());
        }
    }

    private static final class Counters {
        final LongAdder calls = new LongAdder();
        final LongAdder terminalCases = new LongAdder();
        final LongAdder cacheQueries = new LongAdder();
        final LongAdder cacheHits = new LongAdder();
        final LongAdder reduced = new LongAdder();

        void reset() {
            calls.reset();
            terminalCases.reset();
            cacheQueries.reset();
            cacheHits.reset();
            reduced.reset();
        }
    }
}
