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
package eu.openanalytics.phaedra.sampletrackingservice.dto;

import eu.openanalytics.phaedra.sampletrackingservice.dto.validation.OnCreate;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.Sex;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.SpecimenRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
public class RegisterCaseRequestDTO {

    /** External kit code; the case number is used when absent. */
    String kitCode;

    LocalDate submissionDate;

    String testPurpose;

    @Valid
    @NotEmpty(message = "At least one participant is required", groups = {OnCreate.class})
    @Size(max = 3, message = "A case has at most three participants", groups = {OnCreate.class})
    List<ParticipantDTO> participants;

    @Value
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
    public static class ParticipantDTO {

        @NotNull(message = "Role is mandatory", groups = {OnCreate.class})
        SpecimenRole role;

        Sex sex;

        LocalDate collectionDate;
    }
}
