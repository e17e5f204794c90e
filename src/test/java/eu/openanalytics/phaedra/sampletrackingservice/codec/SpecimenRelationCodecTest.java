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
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.WorkflowState;
import eu.openanalytics.phaedra.sampletrackingservice.exception.MalformedRelationCodeException;
import eu.openanalytics.phaedra.sampletrackingservice.model.Specimen;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class SpecimenRelationCodecTest {

    private final SpecimenRelationCodec codec = new SpecimenRelationCodec();

    @Test
    public void encodeAndDecode() {
        var code = codec.encode("25_420", "25_421", Sex.F);
        Assertions.assertEquals("25_420(25_421)F", code);

        var decoded = codec.decode(code);
        Assertions.assertEquals(new RelationCode("25_420", "25_421", Sex.F), decoded);
    }

    @ParameterizedTest
    @ValueSource(strings = {"25_420", "25_420(25_421)", "25_420(25_421)X", "(25_421)F", "25_420()F", "25 420(25_421)M", "25_420(25_421)f", ""})
    public void decodeRejectsMalformedCodes(String code) {
        Assertions.assertThrows(MalformedRelationCodeException.class, () -> codec.decode(code));
    }

    @Test
    public void encodeRejectsCodesWithParentheses() {
        Assertions.assertThrows(MalformedRelationCodeException.class, () -> codec.encode("25_(420)", "25_421", Sex.M));
        Assertions.assertThrows(MalformedRelationCodeException.class, () -> codec.encode("25_420", " ", Sex.M));
        Assertions.assertThrows(MalformedRelationCodeException.class, () -> codec.encode("25_420", "25_421", null));
    }

    @ParameterizedTest
    @CsvSource({
            "'Child(25_421) F', CHILD, F, 25_421",
            "'Child(25_421)F', CHILD, F, 25_421",
            "'child (25_421) m', CHILD, M, 25_421",
            "'Alleged Father', ALLEGED_FATHER, , ",
            "'Alleged Father(25_420)', ALLEGED_FATHER, , 25_420",
            "'alleged_father', ALLEGED_FATHER, , ",
            "'Father M', ALLEGED_FATHER, M, ",
            "'MOTHER', MOTHER, , ",
            "' mother F ', MOTHER, F, "
    })
    public void normalizeLabels(String label, SpecimenRole role, Sex sex, String linkedCode) {
        var relation = codec.normalize(label);

        Assertions.assertEquals(role, relation.getRole());
        Assertions.assertEquals(sex, relation.getSex());
        Assertions.assertEquals(linkedCode, relation.getLinkedCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Grandmother", "Sibling(25_420) M", "F", "  "})
    public void normalizeRejectsUnknownLabels(String label) {
        Assertions.assertThrows(MalformedRelationCodeException.class, () -> codec.normalize(label));
    }

    @Test
    public void displayUsesCompactFormForLinkedChildren() {
        var child = Specimen.builder()
                .specimenCode("25_420").role(SpecimenRole.CHILD).sex(Sex.F).linkedSpecimenCode("25_421")
                .workflowState(WorkflowState.REGISTERED).build();
        var father = child.withRole(SpecimenRole.ALLEGED_FATHER).withSpecimenCode("25_421").withLinkedSpecimenCode(null).withSex(Sex.M);

        Assertions.assertEquals("25_420(25_421)F", codec.display(child));
        Assertions.assertEquals("25_421", codec.display(father));
        Assertions.assertEquals("25_420", codec.display(child.withLinkedSpecimenCode(null)));
    }
}
