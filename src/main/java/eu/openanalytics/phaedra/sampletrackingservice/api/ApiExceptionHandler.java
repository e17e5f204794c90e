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

import eu.openanalytics.phaedra.sampletrackingservice.exception.BatchNotActiveException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.EntityNotFoundException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.IllegalTransitionException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.LineageMismatchException;
import eu.openanalytics.phaedra.sampletrackingservice.exception.UserVisibleException;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns core exceptions into the {@code {"error": ..., "status": "error"}} response body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    @ExceptionHandler(EntityNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage());
    }

    @ExceptionHandler({IllegalTransitionException.class, LineageMismatchException.class, BatchNotActiveException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(UserVisibleException ex) {
        return error(ex.getMessage());
    }

    @ExceptionHandler(UserVisibleException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUserVisible(UserVisibleException ex) {
        return error(ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return error(ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> malformedFields = new TreeMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(e -> malformedFields.putIfAbsent(e.getField(), e.getDefaultMessage()));
        Map<String, Object> body = error("Validation error");
        body.put("malformed_fields", malformedFields);
        return body;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleNotReadable(HttpMessageNotReadableException ex) {
        logger.debug("Unreadable request body", ex);
        return error("Validation error");
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new TreeMap<>();
        body.put("error", message);
        body.put("status", "error");
        return body;
    }
}
