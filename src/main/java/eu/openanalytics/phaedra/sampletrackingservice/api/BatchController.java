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

import eu.openanalytics.phaedra.sampletrackingservice.dto.AllocationRequestDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.BatchDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.BatchLineageDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.CompletionRequestDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.DeriveRequestDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.SpecimenDTO;
import eu.openanalytics.phaedra.sampletrackingservice.dto.validation.OnCreate;
import eu.openanalytics.phaedra.sampletrackingservice.enumeration.BatchType;
import eu.openanalytics.phaedra.sampletrackingservice.lineage.BatchLineageService;
import eu.openanalytics.phaedra.sampletrackingservice.plate.AllocationRequest;
import eu.openanalytics.phaedra.sampletrackingservice.plate.BatchCompletionService;
import eu.openanalytics.phaedra.sampletrackingservice.plate.BatchQueueService;
import eu.openanalytics.phaedra.sampletrackingservice.plate.ControlPolicy;
import eu.openanalytics.phaedra.sampletrackingservice.plate.PlateAllocationService;
import eu.openanalytics.phaedra.sampletrackingservice.service.ModelMapper;
import eu.openanalytics.phaedra.sampletrackingservice.workflow.TransitionResult;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/batches")
@Validated
public class BatchController {

    private final PlateAllocationService plateAllocationService;
    private final BatchCompletionService batchCompletionService;
    private final BatchQueueService batchQueueService;
    private final BatchLineageService batchLineageService;
    private final ModelMapper modelMapper;

    public BatchController(PlateAllocationService plateAllocationService, BatchCompletionService batchCompletionService,
            BatchQueueService batchQueueService, BatchLineageService batchLineageService, ModelMapper modelMapper) {
        this.plateAllocationService = plateAllocationService;
        this.batchCompletionService = batchCompletionService;
        this.batchQueueService = batchQueueService;
        this.batchLineageService = batchLineageService;
        this.modelMapper = modelMapper;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public BatchDTO allocate(@Validated(OnCreate.class) @RequestBody AllocationRequestDTO request) {
        return modelMapper.map(plateAllocationService.allocate(AllocationRequest.builder()
                .batchType(request.getBatchType())
                .operator(request.getOperator())
                .processingDate(request.getProcessingDate())
                .specimenCodes(request.getSpecimenCodes())
                .controlPolicy(request.getControls() == null ? null : ControlPolicy.of(request.getControls()))
                .sourceBatchCode(request.getSourceBatchCode())
                .build())).build();
    }

    @GetMapping("/{batchCode}")
    public BatchDTO getBatch(@PathVariable String batchCode) {
        return modelMapper.map(plateAllocationService.getBatch(batchCode)).build();
    }

    @GetMapping(params = {"type"})
    public List<BatchDTO> getBatches(@RequestParam("type") String type) {
        return plateAllocationService.getBatches(BatchType.fromCode(type)).stream()
                .map(b -> modelMapper.map(b).build())
                .toList();
    }

    @GetMapping("/{batchCode}/layout")
    public Map<String, String> getLayout(@PathVariable String batchCode) {
        return plateAllocationService.layoutOf(batchCode);
    }

    @GetMapping("/{batchCode}/specimens")
    public List<SpecimenDTO> getSpecimens(@PathVariable String batchCode) {
        return plateAllocationService.getSpecimensOfBatch(batchCode).stream()
                .map(s -> modelMapper.map(s).build())
                .toList();
    }

    @PostMapping("/{batchCode}/completion")
    public List<TransitionResult> complete(@PathVariable String batchCode, @Validated @RequestBody CompletionRequestDTO request) {
        return batchCompletionService.complete(batchCode, request.getOutcome(), request.getFailedSpecimenCodes());
    }

    @GetMapping("/{batchCode}/lineage")
    public List<BatchLineageDTO> getLineage(@PathVariable String batchCode) {
        return batchLineageService.lineageOf(batchCode).stream()
                .map(l -> modelMapper.map(l).build())
                .toList();
    }

    @PostMapping("/{batchCode}/lineage")
    @ResponseStatus(HttpStatus.CREATED)
    public List<BatchLineageDTO> derive(@PathVariable String batchCode, @Validated @RequestBody DeriveRequestDTO request) {
        return batchLineageService.deriveFrom(batchCode, request.getSourceBatchCode(), request.getSpecimenCodes()).stream()
                .map(l -> modelMapper.map(l).build())
                .toList();
    }

    @GetMapping("/{batchCode}/derived")
    public List<BatchDTO> getDerivedBatches(@PathVariable String batchCode) {
        return batchLineageService.derivedBatches(batchCode).stream()
                .map(b -> modelMapper.map(b).build())
                .toList();
    }

    @GetMapping("/queue")
    public List<SpecimenDTO> getQueue(@RequestParam("type") String type) {
        return batchQueueService.queue(BatchType.fromCode(type)).stream()
                .map(s -> modelMapper.map(s).build())
                .toList();
    }

    /**
     * Creates a batch from the queue; 204 when too few specimens are waiting.
     */
    @PostMapping("/queue")
    public ResponseEntity<BatchDTO> createFromQueue(@RequestParam("type") String type, @RequestParam("operator") String operator,
            @RequestParam(value = "processingDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate processingDate) {
        return batchQueueService.createFromQueue(BatchType.fromCode(type), operator, processingDate, null)
                .map(b -> ResponseEntity.status(HttpStatus.CREATED).body(modelMapper.map(b).build()))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
