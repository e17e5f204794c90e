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
package eu.openanalytics.phaedra.sampletrackingservice.support;

import eu.openanalytics.phaedra.sampletrackingservice.model.BatchLineage;
import eu.openanalytics.phaedra.sampletrackingservice.repository.BatchLineageRepository;
import java.util.List;

public class InMemoryBatchLineageRepository extends InMemoryCrudRepository<BatchLineage> implements BatchLineageRepository {

    @Override
    protected Long idOf(BatchLineage record) {
        return record.getId();
    }

    @Override
    protected BatchLineage withId(BatchLineage record, Long id) {
        return record.withId(id);
    }

    @Override
    public List<BatchLineage> findByBatchCode(String batchCode) {
        return findWhere(l -> l.getBatchCode().equals(batchCode));
    }

    @Override
    public List<BatchLineage> findBySourceBatchCode(String sourceBatchCode) {
        return findWhere(l -> l.getSourceBatchCode().equals(sourceBatchCode));
    }
}
