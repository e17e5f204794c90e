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

import eu.openanalytics.phaedra.sampletrackingservice.config.SampleTrackingProperties;
import eu.openanalytics.phaedra.sampletrackingservice.config.SampleTrackingProperties.CounterSettings;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Initializes the counters that have a configured start value. Counters aligned with legacy numbering
 * (case and specimen numbers) are normally left unconfigured and initialized explicitly.
 */
@Component
public class SequenceCounterBootstrap {

    private final SequenceCounterService sequenceCounterService;
    private final SampleTrackingProperties properties;

    public SequenceCounterBootstrap(SequenceCounterService sequenceCounterService, SampleTrackingProperties properties) {
        this.sequenceCounterService = sequenceCounterService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeConfiguredCounters() {
        for (CounterName counterName : CounterName.values()) {
            CounterSettings settings = properties.getCounter(counterName.getName());
            if (settings.getStart() != null) {
                sequenceCounterService.initialize(counterName.getName(), settings.getStart(), settings.getPrefix());
            }
        }
    }
}
