package com.switchyard.dispatch.cli;

import com.switchyard.core.model.AgentCategory;
import com.switchyard.core.model.RouteRequest;
import com.switchyard.core.model.RoutingDecision;
import com.switchyard.core.model.TaskResult;
import com.switchyard.core.orchestrator.Orchestrator;
import com.switchyard.core.router.ModelRouter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: switchyard route &lt;message&gt;
 * <p>
 * Routes one request through the in-process orchestrator and prints the result,
 * along with the compute tier the model router would pick for it.
 */
@Command(name = "route", mixinStandardHelpOptions = true, description = "Route a request to a domain handler")
@Component
public class RouteCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Request text")
    private String[] words;

    @Option(names = {"--category", "-c"}, description = "Force a category (trading, cad, sketch, work, inspector, system, general)")
    private String category;

    @Option(names = {"--review", "-r"}, description = "Pass the result through the inspector")
    private boolean review;

    private final Orchestrator orchestrator;
    private final ModelRouter modelRouter;

    public RouteCommand(Orchestrator orchestrator, ModelRouter modelRouter) {
        this.orchestrator = orchestrator;
        this.modelRouter = modelRouter;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String message = String.join(" ", words);

        AgentCategory preferred = null;
        if (category != null) {
            try {
                preferred = AgentCategory.fromValue(category);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
                return 2;
            }
        }

        RoutingDecision decision = modelRouter.route(message, preferred == null ? "general" : preferred.value());
        ConsoleOutput.info(String.format("Tier: %s | Model: %s/%s", decision.tier(), decision.provider(), decision.model()));

        TaskResult result = orchestrator.route(new RouteRequest(message, Map.of(), preferred, review));
        ConsoleOutput.result(result);
        return result.success() ? 0 : 1;
    }
}
