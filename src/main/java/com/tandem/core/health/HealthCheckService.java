package com.tandem.core.health;

import com.tandem.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Reports health of the task store, the wait scheduler and, when configured, the database.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskStore taskStore;
    private final ScheduledExecutorService waitScheduler;
    private final DataSource dataSource;

    public HealthCheckService(
            TaskStore taskStore,
            ScheduledExecutorService waitScheduler,
            @Autowired(required = false) DataSource dataSource) {
        this.taskStore = taskStore;
        this.waitScheduler = waitScheduler;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkWaitScheduler());
        if (dataSource != null) {
            results.add(checkDatabase());
        }
        return results;
    }

    private HealthStatus checkStore() {
        String backend = taskStore.getClass().getSimpleName();
        try {
            taskStore.findRecent(1);
            return new HealthStatus("store", HealthStatus.Status.UP,
                    "Task store reachable (" + backend + ")", Map.of("backend", backend));
        } catch (Exception e) {
            log.warn("Task store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Task store error: " + e.getMessage(), Map.of("backend", backend));
        }
    }

    private HealthStatus checkWaitScheduler() {
        if (waitScheduler.isShutdown()) {
            return HealthStatus.down("waits", "Wait scheduler is shut down");
        }
        return HealthStatus.up("waits", "Wait scheduler accepting work");
    }

    private HealthStatus checkDatabase() {
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid");
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }
}
