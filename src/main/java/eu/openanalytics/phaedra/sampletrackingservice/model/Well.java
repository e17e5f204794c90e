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
package eu.openanalytics.phaedra.sampletrackingservice.model;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.ControlType;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Content of one occupied well: either a specimen or a control, never both.
 */
@Value
@AllArgsConstructor
@Table("batch_well")
public class Well {

    String specimenCode;

    ControlType controlType;

    public static Well ofSpecimen(String specimenCode) {
        return new Well(specimenCode, null);
    }

    public static Well ofControl(ControlType controlType) {
        return new Well(null, controlType);
    }

    public boolean holdsControl() {
        return controlType != null;
    }

    /**
     * The specimen code, or the control tag for control wells.
     */
    public String label() {
        return holdsControl() ? controlType.getCode() : specimenCode;
    }
}
