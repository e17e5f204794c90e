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
package eu.openanalytics.phaedra.sampletrackingservice.api;

import eu.openanalytics.phaedra.sampletrackingservice.dto.CounterRequestDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.SequenceCounterDTO;
import eu.openanalytics.phaedra.sampletrackingservice.model.SequenceCounter;
import eu.openanalytics.phaedra.sampletrackingservice.sequence.SequenceCounterService;
import eu.openanalytics.phaedra.sampletrackingservice.service.ModelMapper;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/counters")
@Validated
public class SequenceCounterController {

    private final SequenceCounterService sequenceCounterService;
    private final ModelMapper modelMapper;

    public SequenceCounterController(SequenceCounterService sequenceCounterService, ModelMapper modelMapper) {
        this.sequenceCounterService = sequenceCounterService;
        this.modelMapper = modelMapper;
    }

    /**
     * Initializes a counter at a start value, or just past the highest of the given existing codes.
     */
    @PutMapping("/{counterName}")
    public SequenceCounterDTO initializeCounter(@PathVariable String counterName, @Validated @RequestBody CounterRequestDTO request) {
        SequenceCounter counter;
        if (request.getExistingCodes() != null) {
            counter = sequenceCounterService.alignWithExisting(counterName, request.getPrefix(), request.getExistingCodes());
        } else if (request.getStartValue() != null) {
            counter = sequenceCounterService.initialize(counterName, request.getStartValue(), request.getPrefix());
        } else {
            throw new IllegalArgumentException("Either a start value or existing codes are required");
        }
        return modelMapper.map(counter).build();
    }

    @PostMapping("/{counterName}/reservations")
    @ResponseStatus(HttpStatus.CREATED)
    public List<String> reserve(@PathVariable String counterName, @RequestParam(value = "count", defaultValue = "1") int count) {
        return sequenceCounterService.reserve(counterName, count);
    }

    @GetMapping("/{counterName}")
    public SequenceCounterDTO getCounter(@PathVariable String counterName) {
        return modelMapper.map(sequenceCounterService.peek(counterName)).build();
    }
}
