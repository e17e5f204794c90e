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

import eu.openanalytics.phaedra.sampletrackingservice.exception.CapacityExceededException;
import eu.openanalytics.phaedra.sampletrackingservice.model.Batch;
import eu.openanalytics.phaedra.sampletrackingservice.model.Well;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Arranges controls and specimens on a plate.
 */
public final class PlateLayout {

    private PlateLayout() {
    }

    public static void checkCapacity(ControlPolicy controlPolicy, int specimenCount) {
        if (specimenCount + controlPolicy.size() > WellPosition.CAPACITY) {
            throw new CapacityExceededException(specimenCount, controlPolicy.size(), WellPosition.CAPACITY);
        }
    }

    /**
     * Controls go to their fixed wells, specimens fill the remaining wells row-major in the given order.
     * The returned map is ordered by position; unused wells are absent.
     */
    public static Map<String, Well> arrange(ControlPolicy controlPolicy, List<String> specimenCodes) {
        checkCapacity(controlPolicy, specimenCodes.size());

        Map<String, Well> wells = new LinkedHashMap<>();
        Iterator<String> specimens = specimenCodes.iterator();
        for (WellPosition position : WellPosition.all()) {
            var controlType = controlPolicy.getControls().get(position);
            if (controlType != null) {
                wells.put(position.toString(), Well.ofControl(controlType));
            } else if (specimens.hasNext()) {
                wells.put(position.toString(), Well.ofSpecimen(specimens.next()));
            }
        }
        return wells;
    }

    /**
     * The wells of a stored batch, ordered A1..H12.
     */
    public static Map<String, Well> ordered(Map<String, Well> wells) {
        return wells.entrySet().stream()
                .sorted(Map.Entry.comparingByKey((a, b) -> WellPosition.of(a).compareTo(WellPosition.of(b))))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * Position to specimen code or control tag, ordered A1..H12.
     */
    public static Map<String, String> describe(Batch batch) {
        return ordered(batch.getWells()).entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().label(), (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * Specimen codes of a batch in well order.
     */
    public static List<String> specimenCodes(Batch batch) {
        return ordered(batch.getWells()).values().stream()
                .filter(w -> !w.holdsControl())
                .map(Well::getSpecimenCode)
                .toList();
    }
}
