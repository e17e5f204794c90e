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
package eu.openanalytics.phaedra.sampletrackingservice.codec;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.Sex;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.SpecimenRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Relation of a specimen to its case, as a tagged value instead of free text.
 * {@code sex} and {@code linkedCode} are null when the source label did not carry them.
 */
@Value
@Builder
@AllArgsConstructor
public class SpecimenRelation {
    SpecimenRole role;
    Sex sex;
    String linkedCode;
}
