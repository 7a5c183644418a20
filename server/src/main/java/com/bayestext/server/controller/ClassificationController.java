package com.bayestext.server.controller;

import com.bayestext.server.ai.ClassificationResult;
import com.bayestext.server.ai.NaiveBayesClassifier;
import com.bayestext.server.service.ClassifierService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ClassificationController {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationController.class);
    private final ClassifierService classifierService;

    public ClassificationController(ClassifierService classifierService) {
        this.classifierService = classifierService;
    }

    public static class TrainingRequest {
        public double[][] features;
        public int[] labels;
        // Optional, the configured delta is used when absent
        public Double delta;
    }

    public static class ClassificationRequest {
        public double[] feature;
    }

    @PostMapping("/train")
    public ResponseEntity<?> train(@RequestBody TrainingRequest request) {
        if (request.features == null || request.labels == null) {
            return ResponseEntity.badRequest().body("Both features and labels are required.");
        }

        logger.info("Received training request with {} examples.", request.labels.length);

        NaiveBayesClassifier classifier;
        try {
            classifier = classifierService.train(request.features, request.labels, request.delta);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected training request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("classes", classifier.classLabels());
        summary.put("vocabularySize", classifier.vocabularySize());
        summary.put("delta", classifier.getModel().requireTrained().getDelta());
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/classify")
    public ResponseEntity<?> classify(@RequestBody ClassificationRequest request) {
        if (!classifierService.isReady()) {
            return ResponseEntity.status(503).body("Model is not trained yet, please call /train first.");
        }

        if (request.feature == null) {
            return ResponseEntity.badRequest().body("Missing feature vector.");
        }

        try {
            ClassificationResult result = classifierService.classify(request.feature);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }
}
