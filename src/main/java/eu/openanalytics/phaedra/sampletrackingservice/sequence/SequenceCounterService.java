/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.phaedra.sampletrackingservice.sequence;

import eu.openanalytics.phaedra.sampletrackingservice.exception.SequenceNotInitializedException;
import eu.openanalytics.phaedra.sampletrackingservice.model.SequenceCounter;
import java.util.Collection;
import java.util.List;

/**
 * Monotonic, externally continuable identifier counters.
 */
public interface SequenceCounterService {

    /**
     * Creates the counter, or moves an existing counter forward to {@code startValue}.
     * A counter is never moved backwards, so repeating the call has no effect.
     */
    SequenceCounter initialize(String counterName, long startValue, String prefix);

    /**
     * Reserves {@code count} consecutive values and returns them rendered, in increasing order.
     * Concurrent callers never receive overlapping values.
     *
     * @throws SequenceNotInitializedException if the counter was never initialized
     */
    List<String> reserve(String counterName, int count);

    default String reserveOne(String counterName) {
        return reserve(counterName, 1).get(0);
    }

    /**
     * Initializes the counter just past the highest value found among existing codes with the given prefix.
     */
    SequenceCounter alignWithExisting(String counterName, String prefix, Collection<String> existingCodes);

    /**
     * Returns the counter state without reserving anything.
     */
    SequenceCounter peek(String counterName);
}
