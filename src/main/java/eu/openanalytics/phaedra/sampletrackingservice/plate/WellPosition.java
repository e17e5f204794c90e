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

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;
import lombok.Value;

/**
 * A well of a 96-well plate, rows {@code A..H} and columns {@code 1..12}.
 * Positions are ordered row-major: A1..A12, B1..B12, ...
 */
@Value
public class WellPosition implements Comparable<WellPosition> {

    public static final int ROWS = 8;
    public static final int COLUMNS = 12;
    public static final int CAPACITY = ROWS * COLUMNS;

    private static final Pattern POSITION_REGEX = Pattern.compile("^([A-Ha-h])(\\d{1,2})$");

    /** 0-based row index */
    int row;

    /** 1-based column number */
    int column;

    public static WellPosition of(String position) {
        Matcher matcher = position == null ? null : POSITION_REGEX.matcher(position.trim());
        if (matcher == null || !matcher.matches()) {
            throw new IllegalArgumentException(String.format("Invalid well position '%s'", position));
        }
        int row = Character.toUpperCase(matcher.group(1).charAt(0)) - 'A';
        int column = Integer.parseInt(matcher.group(2));
        if (column < 1 || column > COLUMNS) {
            throw new IllegalArgumentException(String.format("Invalid well position '%s'", position));
        }
        return new WellPosition(row, column);
    }

    public static WellPosition ofIndex(int index) {
        if (index < 0 || index >= CAPACITY) {
            throw new IllegalArgumentException(String.format("Well index %d out of range", index));
        }
        return new WellPosition(index / COLUMNS, index % COLUMNS + 1);
    }

    public static List<WellPosition> all() {
        return IntStream.range(0, CAPACITY).mapToObj(WellPosition::ofIndex).toList();
    }

    public int index() {
        return row * COLUMNS + column - 1;
    }

    @Override
    public int compareTo(WellPosition other) {
        return Integer.compare(index(), other.index());
    }

    @Override
    public String toString() {
        return String.valueOf((char) ('A' + row)) + column;
    }
}
