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

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;

public interface SpecimenRepository extends CrudRepository<Specimen, Long> {

    Optional<Specimen> findBySpecimenCode(String specimenCode);

    /**
     * Loads a specimen and locks its row until the surrounding transaction ends.
     */
    @Query("select * from specimen s where s.specimen_code = :specimenCode for update")
    Optional<Specimen> findBySpecimenCodeForUpdate(@Param("specimenCode") String specimenCode);

    /**
     * Loads and locks a set of specimens. Rows are locked in code order so that concurrent callers
     * with overlapping sets cannot deadlock.
     */
    @Query("select * from specimen s where s.specimen_code in (:specimenCodes) order by s.specimen_code for update")
    List<Specimen> findAllBySpecimenCodeForUpdate(@Param("specimenCodes") Collection<String> specimenCodes);

    List<Specimen> findByCaseNumber(String caseNumber);

    List<Specimen> findByWorkflowState(WorkflowState workflowState);

    List<Specimen> findByAmplificationBatchCode(String amplificationBatchCode);

    List<Specimen> findBySeparationBatchCode(String separationBatchCode);

    long countByWorkflowState(WorkflowState workflowState);
}
