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

import eu.openanalytics.phaedra.sampletrackingservice.dto.SpecimenDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.TransitionRequestDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.WorkflowEventDTO;
import eu.openanalytics.phaedra.sampletrackingservice.service.CaseRegistrationService;
import eu.openanalytics.phaedra.sampletrackingservice.service.ModelMapper;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.TransitionResult;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.WorkflowService;
import java.util.List;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/specimens")
@Validated
public class SpecimenController {

    private final CaseRegistrationService caseRegistrationService;
    private final WorkflowService workflowService;
    private final ModelMapper modelMapper;

    public SpecimenController(CaseRegistrationService caseRegistrationService, WorkflowService workflowService, ModelMapper modelMapper) {
        this.caseRegistrationService = caseRegistrationService;
        this.workflowService = workflowService;
        this.modelMapper = modelMapper;
    }

    @GetMapping("/{specimenCode}")
    public SpecimenDTO getSpecimen(@PathVariable String specimenCode) {
        return caseRegistrationService.getSpecimen(specimenCode);
    }

    @GetMapping("/{specimenCode}/display")
    public String getDisplayCode(@PathVariable String specimenCode) {
        return caseRegistrationService.getSpecimen(specimenCode).getDisplayCode();
    }

    @PutMapping("/{specimenCode}/state")
    public SpecimenDTO transition(@PathVariable String specimenCode, @Validated @RequestBody TransitionRequestDTO request) {
        return modelMapper.map(workflowService.transition(specimenCode, request.getTargetState(),
                request.getChangedBy(), request.getContext())).build();
    }

    @PostMapping("/transitions")
    public List<TransitionResult> transitionMany(@Validated @RequestBody TransitionRequestDTO request) {
        if (request.getSpecimenCodes() == null) {
            throw new IllegalArgumentException("Specimen codes are mandatory");
        }
        return workflowService.transitionMany(request.getSpecimenCodes(), request.getTargetState(),
                request.getChangedBy(), request.getContext());
    }

    @GetMapping("/{specimenCode}/history")
    public List<WorkflowEventDTO> getHistory(@PathVariable String specimenCode) {
        return workflowService.getHistory(specimenCode).stream()
                .map(e -> modelMapper.map(e).build())
                .toList();
    }
}
