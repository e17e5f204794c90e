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
import eu.openanalytics.phaedra.sampletrackingservice.exception.MalformedRelationCodeException;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Encodes and decodes the compact relation notation used on child specimen codes,
 * {@code {childCode}({linkedParentCode}){M|F}}, and normalizes free-text relation labels
 * (as found in imported spreadsheets) to {@link SpecimenRelation} values.
 */
@Component
public class SpecimenRelationCodec {

    // example: 25_420(25_421)F
    public static final Pattern RELATION_CODE_REGEX = Pattern.compile("^([^()\\s]+)\\(([^()\\s]+)\\)([MF])$");
    // example: Child(25_421) F, Alleged Father M
    private static final Pattern TRAILING_SEX_REGEX = Pattern.compile("^(.*?)(?:\\s+|(?<=\\)))([MF])$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINKED_CODE_REGEX = Pattern.compile("\\(([^()]*)\\)");

    private static final Map<String, SpecimenRole> ROLE_LABELS = Map.of(
            "mother", SpecimenRole.MOTHER,
            "alleged father", SpecimenRole.ALLEGED_FATHER,
            "father", SpecimenRole.ALLEGED_FATHER,
            "child", SpecimenRole.CHILD);

    public String encode(String childCode, String linkedParentCode, Sex sex) {
        if (!isPlainCode(childCode) || !isPlainCode(linkedParentCode) || sex == null) {
            throw new MalformedRelationCodeException("Cannot encode relation of child %s to %s with sex %s",
                    childCode, linkedParentCode, sex);
        }
        return String.format("%s(%s)%s", childCode, linkedParentCode, sex.name());
    }

    public RelationCode decode(String relationCode) {
        if (relationCode == null) throw new MalformedRelationCodeException("Relation code is missing");
        Matcher matcher = RELATION_CODE_REGEX.matcher(relationCode.trim());
        if (!matcher.matches()) {
            throw new MalformedRelationCodeException("'%s' is not a valid relation code", relationCode);
        }
        return new RelationCode(matcher.group(1), matcher.group(2), Sex.valueOf(matcher.group(3)));
    }

    /**
     * Normalizes a free-text relation label such as {@code Child(25_421) F} or {@code Alleged Father}.
     * Matching of the role is case-insensitive; a trailing M/F token is read as the sex.
     */
    public SpecimenRelation normalize(String label) {
        if (StringUtils.isBlank(label)) throw new MalformedRelationCodeException("Relation label is missing");
        String text = label.trim();

        Sex sex = null;
        Matcher sexMatcher = TRAILING_SEX_REGEX.matcher(text);
        if (sexMatcher.matches() && StringUtils.isNotBlank(sexMatcher.group(1))) {
            sex = Sex.valueOf(sexMatcher.group(2).toUpperCase(Locale.ROOT));
            text = sexMatcher.group(1).trim();
        }

        String linkedCode = null;
        Matcher linkMatcher = LINKED_CODE_REGEX.matcher(text);
        if (linkMatcher.find()) {
            linkedCode = StringUtils.trimToNull(linkMatcher.group(1));
            text = linkMatcher.replaceAll(" ");
        }

        String roleLabel = StringUtils.normalizeSpace(text.replace('_', ' ').replace('-', ' ')).toLowerCase(Locale.ROOT);
        SpecimenRole role = ROLE_LABELS.get(roleLabel);
        if (role == null) {
            throw new MalformedRelationCodeException("Unknown relation label '%s'", label);
        }
        return new SpecimenRelation(role, sex, linkedCode);
    }

    /**
     * Renders the public code of a specimen: the compact relation form for a child linked to a parent,
     * the plain specimen code otherwise.
     */
    public String display(Specimen specimen) {
        if (specimen.getRole() == SpecimenRole.CHILD && specimen.getLinkedSpecimenCode() != null && specimen.getSex() != null) {
            return encode(specimen.getSpecimenCode(), specimen.getLinkedSpecimenCode(), specimen.getSex());
        }
        return specimen.getSpecimenCode();
    }

    private static boolean isPlainCode(String code) {
        return StringUtils.isNotBlank(code) && !StringUtils.containsAny(code, "() \t");
    }
}
