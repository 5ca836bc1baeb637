package com.layeredcrf.server.controller;

import com.layeredcrf.server.service.LayeredGraphService;
import com.layeredcrf.server.service.TopologySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
public class GraphController {

    private static final Logger logger = LoggerFactory.getLogger(GraphController.class);

    // Keeps a single request from allocating an unbounded graph
    static final long MAX_SITES = 4_000_000L;

    private final LayeredGraphService graphService;

    public GraphController(LayeredGraphService graphService) {
        this.graphService = graphService;
    }

    public static class TopologyRequest {
        public int width;
        public int height;
        // Optional: edges crossing this line are moved to line.group
        public LayeredGraphService.EdgeLine line;
    }

    @PostMapping("/graph/topology")
    public ResponseEntity<?> topology(@RequestBody TopologyRequest request) {
        if (request == null || request.width <= 0 || request.height <= 0) {
            return ResponseEntity.badRequest().body("Width and height must be positive.");
        }
        if ((long) request.width * request.height > MAX_SITES) {
            return ResponseEntity.badRequest().body("Image too large, at most " + MAX_SITES + " sites.");
        }

        logger.info("Received topology request for {}x{}", request.width, request.height);
        try {
            TopologySummary summary = graphService.describeTopology(request.width, request.height, request.line);
            return ResponseEntity.ok(summary);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected topology request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }
}
