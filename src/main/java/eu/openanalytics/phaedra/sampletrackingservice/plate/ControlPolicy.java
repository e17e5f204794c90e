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
package eu.openanalytics.phaedra.sampletrackingservice.plate;

import eu.openanalytics.phaedra.sampletrackingservice.config.SampleTrackingProperties.PlateSettings;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.ControlType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Fixed wells reserved for quality-control material on a plate.
 */
public class ControlPolicy {

    private static final ControlPolicy NONE = new ControlPolicy(Collections.emptySortedMap());

    private final SortedMap<WellPosition, ControlType> controls;

    private ControlPolicy(SortedMap<WellPosition, ControlType> controls) {
        this.controls = Collections.unmodifiableSortedMap(controls);
    }

    /**
     * Allelic ladder, positive control and negative control at the configured positions (A1, A2 and H12 unless overridden).
     */
    public static ControlPolicy defaultPolicy(PlateSettings settings) {
        Map<String, ControlType> controls = new LinkedHashMap<>();
        put(controls, settings.getAllelicLadderPosition(), ControlType.ALLELIC_LADDER);
        put(controls, settings.getPositiveControlPosition(), ControlType.POSITIVE_CONTROL);
        put(controls, settings.getNegativeControlPosition(), ControlType.NEGATIVE_CONTROL);
        return of(controls);
    }

    public static ControlPolicy none() {
        return NONE;
    }

    public static ControlPolicy of(Map<String, ControlType> controlsByPosition) {
        SortedMap<WellPosition, ControlType> controls = new TreeMap<>();
        controlsByPosition.forEach((position, controlType) -> {
            if (controlType == null) {
                throw new IllegalArgumentException(String.format("No control type given for well %s", position));
            }
            if (controls.put(WellPosition.of(position), controlType) != null) {
                throw new IllegalArgumentException(String.format("Well %s is assigned more than one control", position));
            }
        });
        return new ControlPolicy(controls);
    }

    public SortedMap<WellPosition, ControlType> getControls() {
        return controls;
    }

    public int size() {
        return controls.size();
    }

    public boolean occupies(WellPosition position) {
        return controls.containsKey(position);
    }

    private static void put(Map<String, ControlType> controls, String position, ControlType controlType) {
        if (controls.keySet().stream().anyMatch(p -> WellPosition.of(p).equals(WellPosition.of(position)))) {
            throw new IllegalArgumentException(String.format("Well %s is assigned more than one control", position));
        }
        controls.put(position, controlType);
    }
}
