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
package eu.openanalytics.phaedra.sampletrackingservice.exception;

import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchStatus;

public class BatchNotActiveException extends UserVisibleException {

    private static final long serialVersionUID = -905871242436121377L;

    public BatchNotActiveException(String batchCode, BatchStatus status) {
        super("Batch %s is already %s", batchCode, status.getCode());
    }
}
