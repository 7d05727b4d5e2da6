package com.todoflow.api;

import com.todoflow.engine.coordinator.SessionCoordinator;
import com.todoflow.engine.coordinator.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Processes {@code todoflow.query} once at startup when it is set.
 */
@Component
public class QueryRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(QueryRunner.class);

    private final TodoflowProperties properties;
    private final SessionCoordinator coordinator;
    private final ResultExporter exporter;

    public QueryRunner(TodoflowProperties properties, SessionCoordinator coordinator, ResultExporter exporter) {
        this.properties = properties;
        this.coordinator = coordinator;
        this.exporter = exporter;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String query = properties.getQuery();
        if (query == null || query.isBlank()) {
            return;
        }

        SessionSnapshot snapshot = coordinator.process(query);
        log.info("Query '{}' finished as {}: {}", query, snapshot.state(), snapshot.statistics());
        snapshot.todos().forEach(todo -> log.info("  [{}] {}", todo.status(), todo.content()));

        String exportPath = properties.getExportPath();
        if (exportPath != null && !exportPath.isBlank()) {
            exporter.export(snapshot, Path.of(exportPath));
        }
    }
}
