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
import eu.openanalytics.phaedra.sampletrackingservice.config.SampleTrackingProperties;
import eu.openanalytics.phaedra.sampletrackingservice.model.SequenceCounter;
import eu.openanalytics.phaedra.sampletrackingservice.support.InMemorySequenceCounterRepository;
import eu.openanalytics.phaedra.sampletrackingservice.support.SampleTrackingFixture;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.support.TransactionOperations;

public class JdbcSequenceCounterServiceTest {

    private SequenceCounterService sequenceCounterService;

    @BeforeEach
    public void before() {
        sequenceCounterService = new SampleTrackingFixture().sequenceCounterService;
    }

    @Test
    public void reserveReturnsConsecutiveCodes() {
        sequenceCounterService.initialize("specimen_counter", 420, "25");

        var codes = sequenceCounterService.reserve("specimen_counter", 3);

        Assertions.assertEquals(List.of("25_420", "25_421", "25_422"), codes);
        Assertions.assertEquals(423, sequenceCounterService.peek("specimen_counter").getNextValue());
    }

    @Test
    public void smallValuesArePaddedToWidth() {
        sequenceCounterService.initialize("case_counter", 7, "25");

        Assertions.assertEquals("25_007", sequenceCounterService.reserveOne("case_counter"));
    }

    @Test
    public void batchCountersUseTheirOwnFormat() {
        sequenceCounterService.initialize("amplification_batch_counter", 12, null);
        sequenceCounterService.initialize("separation_batch_counter", 3, null);
        sequenceCounterService.initialize("rerun_batch_counter", 1, null);

        Assertions.assertEquals("LDS_12", sequenceCounterService.reserveOne("amplification_batch_counter"));
        Assertions.assertEquals("ELEC_3", sequenceCounterService.reserveOne("separation_batch_counter"));
        Assertions.assertEquals("LDS_1_RR", sequenceCounterService.reserveOne("rerun_batch_counter"));
        Assertions.assertEquals("LDS_13", sequenceCounterService.reserveOne("amplification_batch_counter"));
    }

    @Test
    public void reserveOnUnknownCounterFails() {
        var ex = Assertions.assertThrows(SequenceNotInitializedException.class,
                () -> sequenceCounterService.reserve("specimen_counter", 1));
        Assertions.assertEquals("Sequence counter 'specimen_counter' has not been initialized", ex.getMessage());
    }

    @Test
    public void reserveRejectsEmptyReservation() {
        sequenceCounterService.initialize("specimen_counter", 1, "25");

        Assertions.assertThrows(IllegalArgumentException.class, () -> sequenceCounterService.reserve("specimen_counter", 0));
        Assertions.assertEquals(1, sequenceCounterService.peek("specimen_counter").getNextValue());
    }

    @Test
    public void initializeNeverMovesBackwards() {
        sequenceCounterService.initialize("specimen_counter", 420, "25");
        sequenceCounterService.reserve("specimen_counter", 2);

        var unchanged = sequenceCounterService.initialize("specimen_counter", 100, "25");
        Assertions.assertEquals(422, unchanged.getNextValue());

        var advanced = sequenceCounterService.initialize("specimen_counter", 500, "26");
        Assertions.assertEquals(500, advanced.getNextValue());
        Assertions.assertEquals("25", advanced.getPrefix());
        Assertions.assertEquals("25_500", sequenceCounterService.reserveOne("specimen_counter"));
    }

    @Test
    public void initializeRejectsUnknownCounter() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> sequenceCounterService.initialize("plate_counter", 1, "P"));
    }

    @Test
    public void interleavedReservationsNeverOverlap() {
        sequenceCounterService.initialize("specimen_counter", 1, "25");

        List<String> all = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            all.addAll(sequenceCounterService.reserve("specimen_counter", 2));
            all.addAll(sequenceCounterService.reserve("specimen_counter", 2));
        }

        Assertions.assertEquals(20, all.size());
        Assertions.assertEquals(20, new HashSet<>(all).size());
        for (int i = 1; i < all.size(); i++) {
            Assertions.assertTrue(all.get(i - 1).compareTo(all.get(i)) < 0);
        }
    }

    @Test
    public void alignWithExistingContinuesAfterHighestLegacyCode() {
        var legacyCodes = new ArrayList<String>(List.of("25_418", "25_420(25_419)F", "LDS_3", "2025_999"));
        legacyCodes.add(null);

        var counter = sequenceCounterService.alignWithExisting("specimen_counter", "25", legacyCodes);

        Assertions.assertEquals(421, counter.getNextValue());
        Assertions.assertEquals("25_421", sequenceCounterService.reserveOne("specimen_counter"));
    }

    @Test
    public void alignWithoutMatchingCodesStartsAtConfiguredStart() {
        var counter = sequenceCounterService.alignWithExisting("amplification_batch_counter", null, List.of("ELEC_4"));

        Assertions.assertEquals(1, counter.getNextValue());
        Assertions.assertEquals("LDS", counter.getPrefix());
    }

    @Test
    public void initializeRacingWithAnotherCallerUsesTheStoredCounter() {
        var repository = new InMemorySequenceCounterRepository() {
            private boolean raced;

            @Override
            public synchronized <S extends SequenceCounter> S save(S record) {
                if (record.getId() == null && !raced) {
                    raced = true;
                    super.save(record.withNextValue(500));
                    throw new DuplicateKeyException("duplicate key value violates unique constraint \"sequence_counter_name_key\"");
                }
                return super.save(record);
            }
        };
        var service = new JdbcSequenceCounterService(repository, TransactionOperations.withoutTransaction(),
                new SampleTrackingProperties(), SampleTrackingFixture.CLOCK);

        var counter = service.initialize("specimen_counter", 420, "25");

        Assertions.assertEquals(500, counter.getNextValue());
        Assertions.assertEquals(1, repository.count());
        Assertions.assertEquals("25_500", service.reserveOne("specimen_counter"));
    }
}
