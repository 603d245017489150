package io.github.orbit.runtime.provisioning;

import io.github.orbit.persistence.document.ScanDocument;
import io.github.orbit.persistence.repository.ScanRepository;
import io.github.orbit.runtime.config.OrbitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs the scan's deploy playbook with {@code ansible-playbook} and waits for it to exit.
 * Output goes to {@code logs/ansible.log} and to the scan's stored log lines. The scan's
 * API key doubles as the vault password and only lives on disk for the duration of the run.
 */
@Component
public class AnsiblePlaybookRunner implements ProvisioningClient {

    private static final Logger log = LoggerFactory.getLogger(AnsiblePlaybookRunner.class);
    static final String VAULT_PASS_FILE = ".vault_pass";
    static final String LOG_FILE = "ansible.log";

    private final ScanRepository scanRepository;
    private final ScanLogSink logSink;
    private final String executable;
    private final long timeoutMinutes;

    public AnsiblePlaybookRunner(ScanRepository scanRepository, ScanLogSink logSink, OrbitProperties properties) {
        this.scanRepository = scanRepository;
        this.logSink = logSink;
        this.executable = properties.ansible().executable();
        this.timeoutMinutes = properties.ansible().timeoutMinutes();
    }

    @Override
    public void execute(ProvisioningRequest request) throws ProvisioningException {
        String scanId = request.scanId();
        if (!Files.isDirectory(request.basePath())) {
            throw new ProvisioningException(scanId, "Ansible base path does not exist: " + request.basePath());
        }

        String vaultPassword = scanRepository.findById(scanId)
                .map(ScanDocument::getApiKey)
                .filter(key -> !key.isBlank())
                .orElseThrow(() -> new ProvisioningException(scanId, "Scan API key not found"));

        Path vaultPassFile = request.logDir().resolve(VAULT_PASS_FILE);
        try {
            Files.createDirectories(request.logDir());
            Files.writeString(vaultPassFile, vaultPassword, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProvisioningException(scanId, "Failed to prepare log directory " + request.logDir(), e);
        }

        try {
            run(request, vaultPassFile);
        } finally {
            try {
                Files.deleteIfExists(vaultPassFile);
            } catch (IOException e) {
                log.warn("Failed to remove vault password file for scan {}: {}", scanId, e.getMessage());
            }
        }
    }

    private void run(ProvisioningRequest request, Path vaultPassFile) throws ProvisioningException {
        String scanId = request.scanId();
        ProcessBuilder pb = new ProcessBuilder(command(request, vaultPassFile))
                .directory(request.basePath().toFile())
                .redirectErrorStream(false);
        Map<String, String> env = pb.environment();
        env.put("ANSIBLE_HOST_KEY_CHECKING", "false");
        env.put("ANSIBLE_ACTION_WARNINGS", "false");
        env.put("ANSIBLE_RETRY_FILES_ENABLED", "false");
        env.put("ANSIBLE_STDOUT_CALLBACK", "default");
        env.put("ANSIBLE_INVENTORY", request.inventory().toString());

        Path logFile = request.logDir().resolve(LOG_FILE);
        log.info("Running playbook {} for scan {} (log: {})", request.playbook(), scanId, logFile);

        try (PrintWriter fileLog = new PrintWriter(Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                     StandardOpenOption.CREATE, StandardOpenOption.APPEND));
             ScanLogSink.Writer scanLog = logSink.open(scanId)) {

            Process process = pb.start();
            Thread stdoutThread = pump(process.getInputStream(), "stdout", fileLog, scanLog, scanId);
            Thread stderrThread = pump(process.getErrorStream(), "stderr", fileLog, scanLog, scanId);

            boolean finished;
            if (timeoutMinutes > 0) {
                finished = process.waitFor(timeoutMinutes, TimeUnit.MINUTES);
            } else {
                process.waitFor();
                finished = true;
            }
            if (!finished) {
                process.destroyForcibly();
                stdoutThread.join(1000);
                stderrThread.join(1000);
                throw new ProvisioningException(scanId, "Playbook timed out after " + timeoutMinutes + " minutes");
            }

            // Pipes close on exit, so the pumps end once they have drained the last lines
            stdoutThread.join();
            stderrThread.join();
            scanLog.flush();

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new ProvisioningException(scanId, "Playbook exited with code " + exitCode);
            }
            log.info("Playbook for scan {} completed", scanId);
        } catch (IOException e) {
            throw new ProvisioningException(scanId, "Failed to run playbook: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException(scanId, "Interrupted while waiting for playbook", e);
        }
    }

    List<String> command(ProvisioningRequest request, Path vaultPassFile) {
        List<String> cmd = new ArrayList<>();
        cmd.add(executable);
        cmd.add("-i");
        cmd.add(request.inventory().toString());
        cmd.add("--forks");
        cmd.add("10");
        cmd.add("--vault-password-file");
        cmd.add(vaultPassFile.toString());
        cmd.add("-e");
        cmd.add("@" + request.scanDefinition());
        cmd.add("-e");
        cmd.add("scan_id=" + request.scanId());
        cmd.add(request.playbook().toString());
        return cmd;
    }

    private Thread pump(InputStream in, String stream, PrintWriter fileLog, ScanLogSink.Writer scanLog, String scanId) {
        Thread t = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (fileLog) {
                        fileLog.println(line);
                        fileLog.flush();
                    }
                    scanLog.append(stream, line);
                }
            } catch (IOException e) {
                log.debug("Stopped reading {} for scan {}: {}", stream, scanId, e.getMessage());
            }
        }, "ansible-" + stream + "-" + scanId);
        t.setDaemon(true);
        t.start();
        return t;
    }
}
