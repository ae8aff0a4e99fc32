package com.strategist.dispatch.api;

import com.strategist.core.engine.PlanningRequest;
import com.strategist.core.engine.StrategyEngine;
import com.strategist.core.model.StrategyPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for planning runs.
 */
@RestController
@RequestMapping("/api/v1/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final StrategyEngine strategyEngine;

    public PlanController(StrategyEngine strategyEngine) {
        this.strategyEngine = strategyEngine;
    }

    /**
     * POST /api/v1/plans: runs the pipeline up to the requested stage, reusing
     * any decomposition or task graph in the body. Synchronous.
     */
    @PostMapping
    public ResponseEntity<?> createPlan(@RequestBody PlanRequest request) {
        PlanningRequest planningRequest;
        try {
            planningRequest = request.toPlanningRequest();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid stage: " + request.stage()));
        }
        log.info("Planning request for domain {} up to {}", request.domain(), planningRequest.effectiveTarget());
        StrategyPlan plan = strategyEngine.execute(planningRequest);
        return ResponseEntity.ok(plan);
    }
}
