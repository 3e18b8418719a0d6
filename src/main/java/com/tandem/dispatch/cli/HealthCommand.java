package com.tandem.dispatch.cli;

import com.tandem.core.health.HealthCheckService;
import com.tandem.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: tandem health
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthCheckService.checkAll();
        boolean allUp = true;

        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}
