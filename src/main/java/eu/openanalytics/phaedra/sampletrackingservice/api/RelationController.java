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
package eu.openanalytics.phaedra.sampletrackingservice.api;

import eu.openanalytics.phaedra.sampletrackingservice.codec.RelationCode;
import eu.openanalytics.phaedra.sampletrackingservice.codec.SpecimenRelation;
import eu.openanalytics.phaedra.sampletrackingservice.codec.SpecimenRelationCodec;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.Sex;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/relations")
public class RelationController {

    private final SpecimenRelationCodec relationCodec;

    public RelationController(SpecimenRelationCodec relationCodec) {
        this.relationCodec = relationCodec;
    }

    @GetMapping("/encode")
    public String encode(@RequestParam("childCode") String childCode, @RequestParam("parentCode") String parentCode,
            @RequestParam("sex") Sex sex) {
        return relationCodec.encode(childCode, parentCode, sex);
    }

    @GetMapping("/decode")
    public RelationCode decode(@RequestParam("code") String code) {
        return relationCodec.decode(code);
    }

    @GetMapping("/normalize")
    public SpecimenRelation normalize(@RequestParam("label") String label) {
        return relationCodec.normalize(label);
    }
}
