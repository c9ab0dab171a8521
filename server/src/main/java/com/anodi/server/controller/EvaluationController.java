package com.anodi.server.controller;

import com.anodi.server.ai.DistanceMatrix;
import com.anodi.server.ai.ScoreReport;
import com.anodi.server.service.AnodiEvaluationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/anodi")
public class EvaluationController {

    private static final Logger logger = LoggerFactory.getLogger(EvaluationController.class);
    private final AnodiEvaluationService evaluationService;

    public EvaluationController(AnodiEvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    public static class EvaluationRequest {
        // pixels[row][col], 0 or 1
        public int[][] reference;
        public List<int[][]> images;
        // Optional overrides of anodi_config.json
        public Integer patchSize;
        public List<Integer> factors;
    }

    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody EvaluationRequest request) {
        if (request == null || request.reference == null || request.images == null || request.images.isEmpty()) {
            return ResponseEntity.badRequest().body("A reference image and at least one image are required.");
        }
        logger.info("Received evaluation request for {} images.", request.images.size());
        try {
            ScoreReport report = evaluationService.evaluate(request.reference, request.images,
                    request.patchSize, request.factors);
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            // ValidationException and ConfigurationException
            logger.warn("Rejected evaluation request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/distance-matrix")
    public ResponseEntity<?> distanceMatrix(@RequestBody EvaluationRequest request) {
        if (request == null || request.images == null || request.images.isEmpty()) {
            return ResponseEntity.badRequest().body("At least one image is required.");
        }
        logger.info("Received distance matrix request for {} images.", request.images.size());
        try {
            DistanceMatrix matrix = evaluationService.distanceMatrix(request.images, request.reference,
                    request.patchSize, request.factors);
            return ResponseEntity.ok(matrix);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected distance matrix request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }
}
