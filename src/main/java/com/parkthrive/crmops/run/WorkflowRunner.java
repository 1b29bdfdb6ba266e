package com.parkthrive.crmops.run;

import com.parkthrive.crmops.config.FatalConfigException;
import com.parkthrive.crmops.config.RunConfigValidator;
import com.parkthrive.crmops.config.RunProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Runs the workflow named by the first non-option argument, or {@code crm.run.workflow}.
 * Exit code 0 after a completed run (individual record failures included), 2 when the
 * workflow could not start.
 */
@Slf4j
@Component
public class WorkflowRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_CONFIG_ERROR = 2;

    private final Map<String, Workflow> workflows = new TreeMap<>();
    private final RunConfigValidator validator;
    private final RunProperties runProperties;

    private int exitCode = 0;
    private CampaignRunStats lastRun;

    public WorkflowRunner(List<Workflow> workflows, RunConfigValidator validator, RunProperties runProperties) {
        workflows.forEach(w -> this.workflows.put(w.name(), w));
        this.validator = validator;
        this.runProperties = runProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        Optional<String> name = selectWorkflow(args);
        if (name.isEmpty()) {
            log.error("No workflow selected. Pass one of {} as argument or set crm.run.workflow", workflows.keySet());
            exitCode = EXIT_CONFIG_ERROR;
            return;
        }

        Workflow workflow = workflows.get(name.get());
        if (workflow == null) {
            log.error("Unknown workflow '{}'. Available: {}", name.get(), workflows.keySet());
            exitCode = EXIT_CONFIG_ERROR;
            return;
        }

        try {
            validator.requireValid(workflow);
        } catch (FatalConfigException e) {
            log.error("Workflow '{}' aborted before processing: {}", workflow.name(), e.getMessage());
            exitCode = EXIT_CONFIG_ERROR;
            return;
        }

        log.info("Starting workflow '{}'", workflow.name());
        try {
            lastRun = workflow.run();
        } catch (FatalConfigException e) {
            log.error("Workflow '{}' aborted before processing: {}", workflow.name(), e.getMessage());
            exitCode = EXIT_CONFIG_ERROR;
            return;
        }
        log.info("Workflow '{}' finished: {}", workflow.name(), lastRun.summary());
    }

    private Optional<String> selectWorkflow(ApplicationArguments args) {
        if (!args.getNonOptionArgs().isEmpty()) {
            return Optional.of(args.getNonOptionArgs().get(0).trim());
        }
        return Optional.ofNullable(runProperties.getWorkflow())
                .map(String::trim)
                .filter(s -> !s.isEmpty());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public Optional<CampaignRunStats> getLastRun() {
        return Optional.ofNullable(lastRun);
    }
}
