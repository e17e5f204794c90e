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
package eu.openanalytics.phaedra.sampletrackingservice.repository;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;

public interface BatchRepository extends CrudRepository<Batch, Long> {

    Optional<Batch> findByBatchCode(String batchCode);

    /**
     * Loads a batch and locks its row until the surrounding transaction ends.
     */
    @Query("select * from batch b where b.batch_code = :batchCode for update")
    Optional<Batch> findByBatchCodeForUpdate(@Param("batchCode") String batchCode);

    List<Batch> findByBatchType(BatchType batchType);

    List<Batch> findBySourceBatchCode(String sourceBatchCode);

}
