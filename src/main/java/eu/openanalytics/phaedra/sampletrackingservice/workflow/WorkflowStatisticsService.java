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
package eu.openanalytics.phaedra.sampletrackingservice.workflow;

import eu.openanalytics.phaedra.sampletrackingservice.config.SampleTrackingProperties;
import eu.openanalytics.phaedra.sampletrackingservice.dto.BottleneckDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.WorkflowStatisticsDTO;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.repository.SpecimenRepository;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

@Service
public class WorkflowStatisticsService {

    private static final Set<WorkflowState> FINISHED_STATES = EnumSet.of(WorkflowState.REPORT_GENERATED, WorkflowState.DELIVERED);
    private static final Set<WorkflowState> NO_BOTTLENECK_STATES = EnumSet.of(WorkflowState.REPORT_GENERATED, WorkflowState.DELIVERED, WorkflowState.FAILED);

    private final SpecimenRepository specimenRepository;
    private final SampleTrackingProperties properties;

    public WorkflowStatisticsService(SpecimenRepository specimenRepository, SampleTrackingProperties properties) {
        this.specimenRepository = specimenRepository;
        this.properties = properties;
    }

    public WorkflowStatisticsDTO statistics() {
        Map<WorkflowState, Long> counts = new LinkedHashMap<>();
        for (WorkflowState state : WorkflowState.values()) {
            counts.put(state, specimenRepository.countByWorkflowState(state));
        }

        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        long finished = FINISHED_STATES.stream().mapToLong(counts::get).sum();
        double completionRate = total == 0 ? 0.0 : Math.round(finished * 1000.0 / total) / 10.0;

        int threshold = properties.getStatistics().getBottleneckThreshold();
        int highThreshold = properties.getStatistics().getHighSeverityThreshold();
        List<BottleneckDTO> bottlenecks = counts.entrySet().stream()
                .filter(e -> !NO_BOTTLENECK_STATES.contains(e.getKey()))
                .filter(e -> e.getValue() > threshold)
                .sorted(Map.Entry.<WorkflowState, Long>comparingByValue(Comparator.reverseOrder()))
                .map(e -> BottleneckDTO.builder()
                        .workflowState(e.getKey())
                        .count(e.getValue())
                        .severity(e.getValue() > highThreshold ? "high" : "medium")
                        .build())
                .toList();

        return WorkflowStatisticsDTO.builder()
                .totalSpecimens(total)
                .countsByState(counts)
                .completionRate(completionRate)
                .bottlenecks(bottlenecks)
                .build();
    }
}
