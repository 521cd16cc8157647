package com.upgradegate.automation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the upgrade and rollback playbooks with {@code ansible-playbook}.
 *
 * <p>Check mode adds {@code --check}. Variables are passed as one JSON
 * {@code -e} argument: {@code router_id}, {@code target_ver} and any extra vars.
 * A run that exceeds the timeout is killed and reported as a failure with
 * whatever output it produced.</p>
 */
public class AnsiblePlaybookBackend implements AutomationBackend {

    private static final Logger log = LoggerFactory.getLogger(AnsiblePlaybookBackend.class);

    private static final Duration STREAM_DRAIN_GRACE = Duration.ofSeconds(5);

    private final AnsibleSettings settings;
    private final PlaybookProcessExecutor processExecutor;
    private final Executor streamExecutor;
    private final ObjectMapper objectMapper;

    public AnsiblePlaybookBackend(AnsibleSettings settings, Executor streamExecutor, ObjectMapper objectMapper) {
        this(settings, new PlaybookProcessExecutor(), streamExecutor, objectMapper);
    }

    AnsiblePlaybookBackend(AnsibleSettings settings,
                           PlaybookProcessExecutor processExecutor,
                           Executor streamExecutor,
                           ObjectMapper objectMapper) {
        this.settings = settings;
        this.processExecutor = processExecutor;
        this.streamExecutor = streamExecutor;
        this.objectMapper = objectMapper;
    }

    @Override
    public AutomationResult run(AutomationRequest request) {
        String playbook = request.mode() == AutomationMode.ROLLBACK
            ? settings.rollbackPlaybook()
            : settings.upgradePlaybook();

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("router_id", request.deviceId());
        detail.put("target_ver", request.targetVersion());
        detail.put("mode", request.mode().getValue());
        detail.put("check_mode", request.mode() == AutomationMode.CHECK);
        detail.put("playbook", playbook);

        Path playbookPath = settings.ansibleDir().resolve("playbooks").resolve(playbook);
        Path inventoryPath = settings.ansibleDir().resolve(settings.inventoryFile());
        if (!Files.isRegularFile(playbookPath) || !Files.isRegularFile(inventoryPath)) {
            detail.put("error", "ansible setup incomplete: need " + playbookPath + " and " + inventoryPath);
            log.warn("Ansible run for {} not started: {}", request.deviceId(), detail.get("error"));
            return AutomationResult.failed(detail);
        }

        List<String> command = command(request, playbookPath, inventoryPath);
        long started = System.nanoTime();

        Process process;
        try {
            process = processExecutor.start(command, settings.ansibleDir(),
                Map.of("ANSIBLE_HOST_KEY_CHECKING", "False", "ANSIBLE_STDOUT_CALLBACK", "yaml"));
        } catch (IOException ex) {
            throw new AutomationException("failed to start ansible-playbook: " + ex.getMessage(), ex);
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        boolean finished = awaitExit(process, request.deviceId());

        if (!finished) {
            process.destroyForcibly();
            detail.put("timed_out", true);
            detail.put("error", "ansible-playbook exceeded " + settings.timeout().toSeconds() + "s and was killed");
        } else {
            detail.put("timed_out", false);
        }

        Integer exitCode = finished ? process.exitValue() : null;
        detail.put("returncode", exitCode);
        detail.put("stdout", collect(stdout));
        detail.put("stderr", collect(stderr));
        detail.put("execution_time_ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));

        boolean success = finished && exitCode == 0;
        log.info("ansible-playbook {} for {} mode={} finished success={} returncode={}",
            playbook, request.deviceId(), request.mode().getValue(), success, exitCode);
        return new AutomationResult(success, detail);
    }

    List<String> command(AutomationRequest request, Path playbookPath, Path inventoryPath) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("router_id", request.deviceId());
        vars.put("target_ver", request.targetVersion());
        vars.putAll(request.extraVars());

        List<String> command = new ArrayList<>(List.of(
            "ansible-playbook", "-i", inventoryPath.toString(), playbookPath.toString()));
        try {
            command.add("-e");
            command.add(objectMapper.writeValueAsString(vars));
        } catch (JsonProcessingException ex) {
            throw new AutomationException("extra vars are not serializable", ex);
        }
        if (request.mode() == AutomationMode.CHECK) {
            command.add("--check");
        }
        return command;
    }

    /**
     * Waits up to the timeout for the playbook to exit. Interrupts do not cut
     * the wait short: the device may already be changing, so the terminal
     * result is awaited and the interrupt flag restored afterwards.
     */
    private boolean awaitExit(Process process, String deviceId) {
        long deadline = System.nanoTime() + settings.timeout().toNanos();
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return process.waitFor(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (InterruptedException ex) {
                    interrupted = true;
                    log.warn("Interrupted while waiting for ansible on {}, still awaiting its exit", deviceId);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        }, streamExecutor);
    }

    private String collect(CompletableFuture<String> output) {
        try {
            return output.get(STREAM_DRAIN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            output.cancel(true);
            return "<output not drained>";
        } catch (ExecutionException ex) {
            return "<output unreadable: " + ex.getCause().getMessage() + ">";
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return "<output not drained>";
        }
    }
}
