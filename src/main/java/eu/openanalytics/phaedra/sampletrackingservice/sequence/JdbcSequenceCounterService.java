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
import eu.openanalytics.phaedra.sampletrackingservice.exception.SequenceNotInitializedException;
import eu.openanalytics.phaedra.sampletrackingservice.model.SequenceCounter;
import eu.openanalytics.phaedra.sampletrackingservice.repository.SequenceCounterRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.LongStream;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Counters persisted in the {@code sequence_counter} table. Every reservation locks the counter row,
 * so increment-and-read is serialized across requests and application instances.
 */
@Service
public class JdbcSequenceCounterService implements SequenceCounterService {

    private final SequenceCounterRepository sequenceCounterRepository;
    private final TransactionOperations transactionOperations;
    private final SampleTrackingProperties properties;
    private final Clock clock;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public JdbcSequenceCounterService(SequenceCounterRepository sequenceCounterRepository,
            TransactionOperations transactionOperations, SampleTrackingProperties properties, Clock clock) {
        this.sequenceCounterRepository = sequenceCounterRepository;
        this.transactionOperations = transactionOperations;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public SequenceCounter initialize(String counterName, long startValue, String prefix) {
        if (startValue < 0) throw new IllegalArgumentException("Start value must not be negative");
        CounterSettings settings = properties.getCounter(counterName);
        String resolvedPrefix = StringUtils.isNotBlank(prefix) ? prefix : settings.getPrefix();
        if (StringUtils.isBlank(resolvedPrefix)) {
            throw new IllegalArgumentException(String.format("No prefix given for counter '%s'", counterName));
        }

        try {
            return initializeLocked(counterName, startValue, resolvedPrefix);
        } catch (RuntimeException e) {
            // Two callers created the same missing counter; the row of the winner can now be locked.
            if (ExceptionUtils.indexOfType(e, DuplicateKeyException.class) < 0) throw e;
            logger.debug("Counter {} was created concurrently, retrying", counterName);
            return initializeLocked(counterName, startValue, resolvedPrefix);
        }
    }

    private SequenceCounter initializeLocked(String counterName, long startValue, String resolvedPrefix) {
        CounterSettings settings = properties.getCounter(counterName);
        return transactionOperations.execute(status -> {
            Optional<SequenceCounter> existing = sequenceCounterRepository.findByNameForUpdate(counterName);
            if (existing.isPresent()) {
                SequenceCounter counter = existing.get();
                if (startValue <= counter.getNextValue()) {
                    logger.debug("Counter {} already at {}, not moved to {}", counterName, counter.getNextValue(), startValue);
                    return counter;
                }
                logger.info("Advancing counter {} from {} to {}", counterName, counter.getNextValue(), startValue);
                return sequenceCounterRepository.save(counter
                        .withNextValue(startValue)
                        .withUpdatedOn(LocalDateTime.now(clock)));
            }

            logger.info("Initializing counter {} at {} with prefix {}", counterName, startValue, resolvedPrefix);
            return sequenceCounterRepository.save(SequenceCounter.builder()
                    .name(counterName)
                    .nextValue(startValue)
                    .prefix(resolvedPrefix)
                    .width(settings.getWidth())
                    .suffix(settings.getSuffix())
                    .updatedOn(LocalDateTime.now(clock))
                    .build());
        });
    }

    @Override
    public List<String> reserve(String counterName, int count) {
        if (count < 1) throw new IllegalArgumentException("At least one identifier must be reserved");

        return transactionOperations.execute(status -> {
            SequenceCounter counter = sequenceCounterRepository.findByNameForUpdate(counterName)
                    .orElseThrow(() -> new SequenceNotInitializedException(counterName));
            long first = counter.getNextValue();
            sequenceCounterRepository.save(counter
                    .withNextValue(first + count)
                    .withUpdatedOn(LocalDateTime.now(clock)));
            return LongStream.range(first, first + count)
                    .mapToObj(value -> IdentifierFormat.render(counter, value))
                    .toList();
        });
    }

    @Override
    public SequenceCounter alignWithExisting(String counterName, String prefix, Collection<String> existingCodes) {
        CounterSettings settings = properties.getCounter(counterName);
        String resolvedPrefix = StringUtils.isNotBlank(prefix) ? prefix : settings.getPrefix();
        long startValue = IdentifierFormat.highestValue(resolvedPrefix, existingCodes).stream()
                .map(highest -> highest + 1)
                .findFirst()
                .orElse(settings.getStart() == null ? 1L : settings.getStart());
        return initialize(counterName, startValue, resolvedPrefix);
    }

    @Override
    public SequenceCounter peek(String counterName) {
        return sequenceCounterRepository.findByName(counterName)
                .orElseThrow(() -> new SequenceNotInitializedException(counterName));
    }
}
