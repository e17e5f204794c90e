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

import eu.openanalytics.phaedra.sampletrackingservice.dto.LabCaseDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.RegisterCaseRequestDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.validation.OnCreate;
import eu.openanalytics.phaedra.sampletrackingservice.service.CaseRegistrationService;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/cases")
@Validated
public class CaseController {

    private final CaseRegistrationService caseRegistrationService;

    public CaseController(CaseRegistrationService caseRegistrationService) {
        this.caseRegistrationService = caseRegistrationService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public LabCaseDTO registerCase(@Validated(OnCreate.class) @RequestBody RegisterCaseRequestDTO request) {
        return caseRegistrationService.registerCase(request);
    }

    @GetMapping("/{caseNumber}")
    public LabCaseDTO getCase(@PathVariable String caseNumber) {
        return caseRegistrationService.getCase(caseNumber);
    }
}
