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
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.ControlType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
public class AllocationRequestDTO {

    @NotNull(message = "Batch type is mandatory", groups = {OnCreate.class})
    BatchType batchType;

    @NotBlank(message = "Operator is mandatory", groups = {OnCreate.class})
    String operator;

    LocalDate processingDate;

    @NotEmpty(message = "At least one specimen is required", groups = {OnCreate.class})
    List<String> specimenCodes;

    /** Well position to control type. Null places the default controls, an empty map places none. */
    Map<String, ControlType> controls;

    String sourceBatchCode;
}
