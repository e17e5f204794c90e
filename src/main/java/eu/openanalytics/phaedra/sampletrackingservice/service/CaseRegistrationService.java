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
package eu.openanalytics.phaedra.sampletrackingservice.service;

import eu.openanalytics.phaedra.sampletrackingservice.dto.LabCaseDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.RegisterCaseRequestDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.RegisterCaseRequestDTO.ParticipantDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.SpecimenDTO;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.Sex;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.SpecimenRole;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.exception.CaseNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.SpecimenNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.model.LabCase;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import eu.openanalytics.phaedra.sampletrackingservice.repository.LabCaseRepository;
import eu.openanalytics.phaedra.sampletrackingservice.repository.SpecimenRepository;
import eu.openanalytics.phaedra.sampletrackingservice.sequence.CounterName;
import eu.openanalytics.phaedra.sampletrackingservice.sequence.SequenceCounterService;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

@Service
public class CaseRegistrationService {

    /** Specimen codes are handed out in this order: child first, then alleged father, then mother. */
    private static final List<SpecimenRole> NUMBERING_ORDER = List.of(SpecimenRole.CHILD, SpecimenRole.ALLEGED_FATHER, SpecimenRole.MOTHER);

    private final LabCaseRepository labCaseRepository;
    private final SpecimenRepository specimenRepository;
    private final SequenceCounterService sequenceCounterService;
    private final TransactionOperations transactionOperations;
    private final ModelMapper modelMapper;
    private final Clock clock;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public CaseRegistrationService(LabCaseRepository labCaseRepository, SpecimenRepository specimenRepository,
            SequenceCounterService sequenceCounterService, TransactionOperations transactionOperations,
            ModelMapper modelMapper, Clock clock) {
        this.labCaseRepository = labCaseRepository;
        this.specimenRepository = specimenRepository;
        this.sequenceCounterService = sequenceCounterService;
        this.transactionOperations = transactionOperations;
        this.modelMapper = modelMapper;
        this.clock = clock;
    }

    /**
     * Registers a family case: one case number, one specimen code per participant.
     * A child is linked to the alleged father when the father takes part.
     */
    public LabCaseDTO registerCase(RegisterCaseRequestDTO request) {
        List<ParticipantDTO> participants = orderedParticipants(request.getParticipants());

        return transactionOperations.execute(status -> {
            String caseNumber = sequenceCounterService.reserveOne(CounterName.CASE.getName());
            List<String> specimenCodes = sequenceCounterService.reserve(CounterName.SPECIMEN.getName(), participants.size());
            LocalDateTime now = LocalDateTime.now(clock);

            Map<SpecimenRole, String> codesByRole = new EnumMap<>(SpecimenRole.class);
            for (int i = 0; i < participants.size(); i++) {
                codesByRole.put(participants.get(i).getRole(), specimenCodes.get(i));
            }

            LabCase labCase = labCaseRepository.save(LabCase.builder()
                    .caseNumber(caseNumber)
                    .kitCode(StringUtils.isNotBlank(request.getKitCode()) ? request.getKitCode().trim() : caseNumber)
                    .submissionDate(request.getSubmissionDate() == null ? LocalDate.now(clock) : request.getSubmissionDate())
                    .motherPresent(codesByRole.containsKey(SpecimenRole.MOTHER))
                    .testPurpose(request.getTestPurpose())
                    .createdOn(now)
                    .build());

            List<SpecimenDTO> specimens = new ArrayList<>();
            for (ParticipantDTO participant : participants) {
                SpecimenRole role = participant.getRole();
                Specimen specimen = specimenRepository.save(Specimen.builder()
                        .specimenCode(codesByRole.get(role))
                        .caseNumber(caseNumber)
                        .kitCode(labCase.getKitCode())
                        .role(role)
                        .sex(resolveSex(participant))
                        .linkedSpecimenCode(role == SpecimenRole.CHILD ? codesByRole.get(SpecimenRole.ALLEGED_FATHER) : null)
                        .collectionDate(participant.getCollectionDate())
                        .workflowState(participant.getCollectionDate() != null ? WorkflowState.SAMPLE_COLLECTED : WorkflowState.REGISTERED)
                        .rerunCount(0)
                        .createdOn(now)
                        .updatedOn(now)
                        .build());
                specimens.add(modelMapper.map(specimen).build());
            }

            logger.info("Registered case {} (kit {}) with specimens {}", caseNumber, labCase.getKitCode(), specimenCodes);
            return modelMapper.map(labCase).specimens(specimens).build();
        });
    }

    public LabCaseDTO getCase(String caseNumber) {
        LabCase labCase = labCaseRepository.findByCaseNumber(caseNumber)
                .orElseThrow(() -> new CaseNotFoundException(caseNumber));
        List<SpecimenDTO> specimens = specimenRepository.findByCaseNumber(caseNumber).stream()
                .sorted(Comparator.comparing(Specimen::getSpecimenCode))
                .map(s -> modelMapper.map(s).build())
                .toList();
        return modelMapper.map(labCase).specimens(specimens).build();
    }

    public SpecimenDTO getSpecimen(String specimenCode) {
        return specimenRepository.findBySpecimenCode(specimenCode)
                .map(s -> modelMapper.map(s).build())
                .orElseThrow(() -> new SpecimenNotFoundException(specimenCode));
    }

    private static List<ParticipantDTO> orderedParticipants(List<ParticipantDTO> participants) {
        if (participants == null || participants.isEmpty() || participants.size() > NUMBERING_ORDER.size()) {
            throw new IllegalArgumentException("A case has one to three participants");
        }
        if (participants.stream().anyMatch(p -> p.getRole() == null)) {
            throw new IllegalArgumentException("Every participant needs a role");
        }
        if (participants.stream().map(ParticipantDTO::getRole).distinct().count() != participants.size()) {
            throw new IllegalArgumentException("A case has at most one participant per role");
        }
        return participants.stream()
                .sorted(Comparator.comparingInt(p -> NUMBERING_ORDER.indexOf(p.getRole())))
                .toList();
    }

    private static Sex resolveSex(ParticipantDTO participant) {
        if (participant.getSex() != null) return participant.getSex();
        return switch (participant.getRole()) {
            case MOTHER -> Sex.F;
            case ALLEGED_FATHER -> Sex.M;
            case CHILD -> null;
        };
    }
}
