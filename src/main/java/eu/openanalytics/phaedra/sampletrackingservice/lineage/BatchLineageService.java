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
package eu.openanalytics.phaedra.sampletrackingservice.lineage;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.exception.BatchNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.LineageMismatchException;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import eu.openanalytics.phaedra.sampletrackingservice.model.BatchLineage;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import eu.openanalytics.phaedra.sampletrackingservice.plate.PlateLayout;
import eu.openanalytics.phaedra.sampletrackingservice.repository.BatchLineageRepository;
import eu.openanalytics.phaedra.sampletrackingservice.repository.BatchRepository;
import eu.openanalytics.phaedra.sampletrackingservice.repository.SpecimenRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.collections4.CollectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Keeps track of which separation and rerun batches derive from which earlier batch.
 */
@Service
public class BatchLineageService {

    private final BatchRepository batchRepository;
    private final BatchLineageRepository batchLineageRepository;
    private final SpecimenRepository specimenRepository;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public BatchLineageService(BatchRepository batchRepository, BatchLineageRepository batchLineageRepository,
            SpecimenRepository specimenRepository, TransactionOperations transactionOperations, Clock clock) {
        this.batchRepository = batchRepository;
        this.batchLineageRepository = batchLineageRepository;
        this.specimenRepository = specimenRepository;
        this.transactionOperations = transactionOperations;
        this.clock = clock;
    }

    /**
     * Checks that a batch of {@code batchType} may carry {@code specimenCodes} over from {@code sourceBatchCode}.
     * Nothing is written.
     *
     * <ul>
     * <li>Separation: the source is an amplification or rerun batch that holds every carried specimen.</li>
     * <li>Rerun: the carried specimens are exactly the specimens of the source that are waiting for a rerun.</li>
     * </ul>
     */
    public Batch verify(BatchType batchType, String sourceBatchCode, Collection<String> specimenCodes) {
        if (batchType == BatchType.AMPLIFICATION) {
            throw new LineageMismatchException("Amplification batches do not derive from another batch");
        }
        if (sourceBatchCode == null) {
            throw new LineageMismatchException("A %s batch requires a source batch", batchType.getCode());
        }
        if (specimenCodes == null || specimenCodes.isEmpty()) {
            throw new LineageMismatchException("A %s batch must carry at least one specimen from batch %s", batchType.getCode(), sourceBatchCode);
        }
        Batch source = batchRepository.findByBatchCode(sourceBatchCode)
                .orElseThrow(() -> new BatchNotFoundException(sourceBatchCode));

        if (batchType == BatchType.SEPARATION) {
            if (!source.getBatchType().isAmplifying()) {
                throw new LineageMismatchException("Separation batch cannot derive from %s batch %s",
                        source.getBatchType().getCode(), sourceBatchCode);
            }
            Collection<String> missing = CollectionUtils.subtract(specimenCodes, PlateLayout.specimenCodes(source));
            if (!missing.isEmpty()) {
                throw new LineageMismatchException("Specimens %s are not part of batch %s",
                        String.join(", ", new TreeSet<>(missing)), sourceBatchCode);
            }
        } else {
            Set<String> waiting = rerunCandidates(sourceBatchCode);
            if (!waiting.equals(new TreeSet<>(specimenCodes))) {
                throw new LineageMismatchException("Rerun of batch %s must carry exactly the specimens waiting for a rerun %s, got %s",
                        sourceBatchCode, waiting, new TreeSet<>(specimenCodes));
            }
        }
        return source;
    }

    /**
     * Writes one lineage row per carried specimen. The caller is expected to have called {@link #verify} first.
     */
    public List<BatchLineage> record(String batchCode, String sourceBatchCode, Collection<String> specimenCodes) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<BatchLineage> rows = specimenCodes.stream()
                .map(specimenCode -> BatchLineage.builder()
                        .batchCode(batchCode)
                        .sourceBatchCode(sourceBatchCode)
                        .specimenCode(specimenCode)
                        .recordedOn(now)
                        .build())
                .toList();
        List<BatchLineage> saved = rows.stream().map(batchLineageRepository::save).toList();
        logger.info("Batch {} derives {} specimen(s) from batch {}", batchCode, saved.size(), sourceBatchCode);
        return saved;
    }

    /**
     * Records that the existing batch {@code newBatchCode} derives from {@code sourceBatchCode}.
     * For a rerun, the rerun counter of every carried specimen goes up by one.
     */
    public List<BatchLineage> deriveFrom(String newBatchCode, String sourceBatchCode, Collection<String> specimenCodes) {
        return transactionOperations.execute(status -> {
            Batch batch = batchRepository.findByBatchCode(newBatchCode)
                    .orElseThrow(() -> new BatchNotFoundException(newBatchCode));
            Set<String> carried = new LinkedHashSet<>(specimenCodes);

            verify(batch.getBatchType(), sourceBatchCode, carried);
            if (batch.getBatchType() == BatchType.SEPARATION) {
                Collection<String> notInBatch = CollectionUtils.subtract(carried, PlateLayout.specimenCodes(batch));
                if (!notInBatch.isEmpty()) {
                    throw new LineageMismatchException("Specimens %s are not part of batch %s",
                            String.join(", ", new TreeSet<>(notInBatch)), newBatchCode);
                }
            }

            if (batch.getBatchType() == BatchType.RERUN) {
                LocalDateTime now = LocalDateTime.now(clock);
                for (Specimen specimen : specimenRepository.findAllBySpecimenCodeForUpdate(carried)) {
                    specimenRepository.save(specimen
                            .withRerunCount(specimen.getRerunCount() + 1)
                            .withUpdatedOn(now));
                }
            }
            batchRepository.save(batch.withSourceBatchCode(sourceBatchCode));
            return record(newBatchCode, sourceBatchCode, carried);
        });
    }

    public List<BatchLineage> lineageOf(String batchCode) {
        return batchLineageRepository.findByBatchCode(batchCode);
    }

    public List<Batch> derivedBatches(String sourceBatchCode) {
        if (batchRepository.findByBatchCode(sourceBatchCode).isEmpty()) {
            throw new BatchNotFoundException(sourceBatchCode);
        }
        return batchRepository.findBySourceBatchCode(sourceBatchCode);
    }

    private Set<String> rerunCandidates(String sourceBatchCode) {
        Set<String> codes = new TreeSet<>();
        for (Specimen specimen : specimenRepository.findByWorkflowState(WorkflowState.RERUN_REQUIRED)) {
            if (Objects.equals(specimen.getAmplificationBatchCode(), sourceBatchCode)
                    || Objects.equals(specimen.getSeparationBatchCode(), sourceBatchCode)) {
                codes.add(specimen.getSpecimenCode());
            }
        }
        return codes;
    }
}
