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
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The three parts of a compact child code such as {@code 25_420(25_421)F}.
 */
@Value
@AllArgsConstructor
public class RelationCode {
    String childCode;
    String linkedParentCode;
    Sex sex;
}
