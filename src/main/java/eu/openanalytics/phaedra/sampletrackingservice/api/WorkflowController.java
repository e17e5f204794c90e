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

import eu.openanalytics.phaedra.sampletrackingservice.dto.WorkflowStatisticsDTO;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.plate.BatchQueueService;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.TransitionResult;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.WorkflowStateMachine;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.WorkflowStatisticsService;
import java.util.List;
import java.util.Set;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/workflow")
public class WorkflowController {

    private final WorkflowStatisticsService workflowStatisticsService;
    private final WorkflowStateMachine stateMachine;
    private final BatchQueueService batchQueueService;

    public WorkflowController(WorkflowStatisticsService workflowStatisticsService, WorkflowStateMachine stateMachine,
            BatchQueueService batchQueueService) {
        this.workflowStatisticsService = workflowStatisticsService;
        this.stateMachine = stateMachine;
        this.batchQueueService = batchQueueService;
    }

    @GetMapping("/statistics")
    public WorkflowStatisticsDTO getStatistics() {
        return workflowStatisticsService.statistics();
    }

    @GetMapping("/transitions")
    public Set<WorkflowState> getAllowedTargets(@RequestParam("from") String from) {
        return stateMachine.allowedTargets(WorkflowState.fromCode(from));
    }

    @PostMapping("/promotions")
    public List<TransitionResult> promote(@RequestParam("from") String from, @RequestParam("to") String to) {
        return batchQueueService.promoteReady(WorkflowState.fromCode(from), WorkflowState.fromCode(to));
    }
}
