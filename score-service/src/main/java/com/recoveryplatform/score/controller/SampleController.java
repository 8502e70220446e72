package com.recoveryplatform.score.controller;

import com.recoveryplatform.common.model.BiometricSample;
import com.recoveryplatform.score.dto.IngestResultDTO;
import com.recoveryplatform.score.dto.SampleDTO;
import com.recoveryplatform.score.service.SampleIngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * HTTP adapter for the health-data provider's sample deliveries.
 */
@RestController
@RequestMapping("/api/v1/samples")
public class SampleController {

    private static final Logger log = LoggerFactory.getLogger(SampleController.class);

    private final SampleIngestionService ingestionService;

    public SampleController(SampleIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping
    public Mono<ResponseEntity<IngestResultDTO>> ingest(@RequestBody List<SampleDTO> body) {
        log.info("Sample batch received. size={}", body.size());
        List<BiometricSample> samples = body.stream().map(SampleDTO::toSample).toList();
        return ingestionService.ingest(samples)
            .map(inserted -> ResponseEntity.ok(new IngestResultDTO(samples.size(), inserted)));
    }
}
