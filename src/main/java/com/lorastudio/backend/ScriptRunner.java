package com.lorastudio.backend;

import com.lorastudio.exception.BackendUnreachableException;
import com.lorastudio.exception.CaptionBackendException;
import com.lorastudio.exception.InferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs a captioning script and returns what it printed.
 *
 * stdout and stderr are drained concurrently so a chatty script cannot block
 * on a full pipe. Exit code 0 means success and the trimmed stdout is the
 * caption; otherwise the trimmed stderr (or the exit code) is the error.
 */
public class ScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

    /**
     * @param command     program and arguments
     * @param displayName used in error messages, e.g. "WD14 script"
     * @return trimmed stdout
     */
    public String run(List<String> command, String displayName) throws CaptionBackendException {
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new BackendUnreachableException("Failed to start " + displayName + ": " + e.getMessage(), e);
        }
        log.debug("Started {}: {}", displayName, command);

        // stdin is unused; close it so scripts reading it see EOF
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", displayName, e.getMessage());
        }

        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        String stdout = drain(process.getInputStream());

        int exitCode;
        String errorOutput;
        try {
            exitCode = process.waitFor();
            errorOutput = stderr.get();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InferenceException(displayName + " was interrupted", e);
        } catch (ExecutionException e) {
            errorOutput = "Stderr read error: " + e.getCause().getMessage();
            exitCode = process.exitValue();
        }

        if (exitCode == 0) {
            return stdout.trim();
        }
        String error = errorOutput.isBlank()
                ? displayName + " exited with code: " + exitCode
                : errorOutput.trim();
        throw new InferenceException(error);
    }

    private static String drain(InputStream in) {
        try (InputStream stream = in) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            stream.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "Read error: " + e.getMessage() + "\n";
        }
    }
}
