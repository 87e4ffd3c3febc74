package com.switchyard.dispatch.api;

import com.switchyard.core.model.AgentCategory;
import com.switchyard.core.model.RouteRequest;
import com.switchyard.core.model.RoutingDecision;
import com.switchyard.core.model.TaskResult;
import com.switchyard.core.orchestrator.Orchestrator;
import com.switchyard.core.router.ModelRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for routing requests to domain handlers.
 */
@RestController
@RequestMapping("/api/v1/route")
public class RouteController {

    private static final Logger log = LoggerFactory.getLogger(RouteController.class);

    private final Orchestrator orchestrator;
    private final ModelRouter modelRouter;

    public RouteController(Orchestrator orchestrator, ModelRouter modelRouter) {
        this.orchestrator = orchestrator;
        this.modelRouter = modelRouter;
    }

    /**
     * POST /api/v1/route: Route a request synchronously.
     * A handler failure is still 200 with {@code success=false}; only malformed input is 400.
     */
    @PostMapping
    public ResponseEntity<?> route(@RequestBody RouteApiRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "message is required"));
        }

        AgentCategory preferred = null;
        if (request.category() != null && !request.category().isBlank()) {
            try {
                preferred = AgentCategory.fromValue(request.category());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
            }
        }

        TaskResult result = orchestrator.route(
                new RouteRequest(request.message(), request.context(), preferred, request.requireReview()));
        RoutingDecision decision = modelRouter.route(request.message(), result.agent().value());
        log.debug("Routed to {} (success={}, tier={})", result.agent().value(), result.success(), decision.tier());
        return ResponseEntity.ok(RouteResponse.from(result, decision));
    }

    /**
     * POST /api/v1/route/tier: Compute tier preview without invoking any handler.
     */
    @PostMapping("/tier")
    public ResponseEntity<?> tier(@RequestBody RouteApiRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "message is required"));
        }
        String domain = request.category() == null || request.category().isBlank() ? "general" : request.category();
        return ResponseEntity.ok(modelRouter.route(request.message(), domain));
    }
}
