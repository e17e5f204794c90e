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
package eu.openanalytics.phaedra.sampletrackingservice.sequence;

import eu.openanalytics.phaedra.sampletrackingservice.model.SequenceCounter;
import java.util.Collection;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Rendering of counter values as {@code {prefix}_{zero-padded value}[_{suffix}]}.
 */
public final class IdentifierFormat {

    public static final String SEPARATOR = "_";

    private IdentifierFormat() {
    }

    public static String render(SequenceCounter counter, long value) {
        return render(counter.getPrefix(), value, counter.getWidth(), counter.getSuffix());
    }

    public static String render(String prefix, long value, int width, String suffix) {
        StringBuilder identifier = new StringBuilder();
        identifier.append(prefix)
                .append(SEPARATOR)
                .append(StringUtils.leftPad(String.valueOf(value), Math.max(width, 1), '0'));
        if (StringUtils.isNotBlank(suffix)) {
            identifier.append(SEPARATOR).append(suffix);
        }
        return identifier.toString();
    }

    /**
     * Finds the highest value rendered with the given prefix in a set of existing (legacy) codes.
     * Codes may embed several identifiers, e.g. {@code 25_420(25_421)F}; all of them are considered.
     */
    public static OptionalLong highestValue(String prefix, Collection<String> existingCodes) {
        Pattern pattern = Pattern.compile("(?<![A-Za-z0-9])" + Pattern.quote(prefix + SEPARATOR) + "(\\d+)");
        long highest = -1;
        for (String code : existingCodes) {
            if (code == null) continue;
            Matcher matcher = pattern.matcher(code);
            while (matcher.find()) {
                highest = Math.max(highest, Long.parseLong(matcher.group(1)));
            }
        }
        return highest < 0 ? OptionalLong.empty() : OptionalLong.of(highest);
    }
}
