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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class WellPositionTest {

    @Test
    public void rowMajorIndex() {
        Assertions.assertEquals(0, WellPosition.of("A1").index());
        Assertions.assertEquals(11, WellPosition.of("A12").index());
        Assertions.assertEquals(14, WellPosition.of("b3").index());
        Assertions.assertEquals(95, WellPosition.of("H12").index());
        Assertions.assertEquals("B2", WellPosition.ofIndex(13).toString());
        Assertions.assertEquals(96, WellPosition.all().size());
        Assertions.assertEquals("H12", WellPosition.all().get(95).toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"A0", "A13", "I1", "1A", "", "AA1"})
    public void invalidPositions(String position) {
        Assertions.assertThrows(IllegalArgumentException.class, () -> WellPosition.of(position));
    }
}
