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
import eu.openanalytics.phaedra.sampletrackingservice.exception.CapacityExceededException;
import eu.openanalytics.phaedra.sampletrackingservice.model.Well;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PlateLayoutTest {

    private final ControlPolicy defaultPolicy = ControlPolicy.defaultPolicy(new PlateSettings());

    @Test
    public void controlsFirstThenSpecimensRowMajor() {
        var wells = PlateLayout.arrange(defaultPolicy, List.of("25_420", "25_421", "25_422"));

        Assertions.assertEquals(List.of("A1", "A2", "A3", "A4", "A5", "H12"), new ArrayList<>(wells.keySet()));
        Assertions.assertEquals(Well.ofControl(ControlType.ALLELIC_LADDER), wells.get("A1"));
        Assertions.assertEquals(Well.ofControl(ControlType.POSITIVE_CONTROL), wells.get("A2"));
        Assertions.assertEquals(Well.ofSpecimen("25_420"), wells.get("A3"));
        Assertions.assertEquals(Well.ofSpecimen("25_422"), wells.get("A5"));
        Assertions.assertEquals(Well.ofControl(ControlType.NEGATIVE_CONTROL), wells.get("H12"));
    }

    @Test
    public void fullPlateSkipsControlWells() {
        var specimens = IntStream.range(0, 93).mapToObj(i -> String.format("25_%03d", i)).toList();

        var wells = PlateLayout.arrange(defaultPolicy, specimens);

        Assertions.assertEquals(96, wells.size());
        Assertions.assertEquals("25_010", wells.get("B1").getSpecimenCode());
        Assertions.assertEquals("25_092", wells.get("H11").getSpecimenCode());
        Assertions.assertTrue(wells.get("H12").holdsControl());
    }

    @Test
    public void capacityIncludesControls() {
        var specimens = IntStream.range(0, 94).mapToObj(i -> String.format("25_%03d", i)).toList();

        var ex = Assertions.assertThrows(CapacityExceededException.class, () -> PlateLayout.arrange(defaultPolicy, specimens));
        Assertions.assertEquals("94 specimens and 3 controls do not fit on a plate of 96 wells", ex.getMessage());
        Assertions.assertEquals(94, PlateLayout.arrange(ControlPolicy.none(), specimens).size());
    }

    @Test
    public void customPolicy() {
        var policy = ControlPolicy.of(Map.of("h1", ControlType.POSITIVE_CONTROL));

        var wells = PlateLayout.arrange(policy, List.of("25_420"));

        Assertions.assertEquals(List.of("A1", "H1"), new ArrayList<>(wells.keySet()));
        Assertions.assertEquals("positive_control", wells.get("H1").label());
    }

    @Test
    public void controlPositionsMustBeValidAndDistinct() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> ControlPolicy.of(Map.of("I1", ControlType.POSITIVE_CONTROL)));

        var clash = new LinkedHashMap<String, ControlType>();
        clash.put("a1", ControlType.POSITIVE_CONTROL);
        clash.put("A1", ControlType.NEGATIVE_CONTROL);
        Assertions.assertThrows(IllegalArgumentException.class, () -> ControlPolicy.of(clash));

        var settings = new PlateSettings();
        settings.setNegativeControlPosition("A2");
        Assertions.assertThrows(IllegalArgumentException.class, () -> ControlPolicy.defaultPolicy(settings));
    }
}
