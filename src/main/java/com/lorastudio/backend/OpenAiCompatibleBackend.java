package com.lorastudio.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lorastudio.dto.ConnectionStatus;
import com.lorastudio.exception.BackendUnreachableException;
import com.lorastudio.exception.CaptionBackendException;
import com.lorastudio.exception.InferenceException;
import com.lorastudio.model.CaptionResult;
import com.lorastudio.service.ImageEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base for vision servers that speak the OpenAI chat-completions protocol.
 *
 * Each image is re-encoded as JPEG (optionally downscaled), sent inline as a
 * base64 data URL next to the prompt, and the caption is read from
 * {@code choices[0].message.content}. A request that times out is retried
 * once before the image is reported as failed.
 */
public abstract class OpenAiCompatibleBackend implements BatchCaptionBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleBackend.class);

    public static final int CHUNK_SIZE = 5;

    private static final String DEFAULT_MODEL = "default";
    private static final double TEMPERATURE = 0.7;
    private static final int MAX_ATTEMPTS = 2;
    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final int CONNECTION_TEST_TIMEOUT_MS = 5_000;
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final HttpBackendSettings settings;
    private final ImageEncoder imageEncoder;
    private final ObjectMapper objectMapper;

    protected OpenAiCompatibleBackend(HttpBackendSettings settings, ImageEncoder imageEncoder,
            ObjectMapper objectMapper) {
        this.settings = settings;
        this.imageEncoder = imageEncoder;
        this.objectMapper = objectMapper;
    }

    /** Full URL of the chat-completions endpoint. */
    protected abstract String chatCompletionsUrl();

    /** Full URL of the model listing endpoint. */
    protected abstract String modelsUrl();

    public HttpBackendSettings getSettings() {
        return settings;
    }

    @Override
    public int getChunkSize() {
        return CHUNK_SIZE;
    }

    @Override
    public CaptionResult generateSingle(String imagePath, String prompt) {
        try {
            return CaptionResult.success(imagePath, requestCaption(imagePath, prompt));
        } catch (CaptionBackendException e) {
            log.warn("{} caption failed for {}: {}", getProvider().getValue(), imagePath, e.getMessage());
            return CaptionResult.failure(imagePath, e.getMessage());
        }
    }

    /**
     * Fans the chunk out over a fixed pool of {@code concurrency} request
     * threads and waits for all of them. Results come back in input order.
     */
    @Override
    public List<CaptionResult> generateBatch(List<String> imagePaths, String prompt, int concurrency) {
        if (imagePaths.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(BatchCaptionBackend.clampConcurrency(concurrency), imagePaths.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, requestThreadFactory());
        try {
            List<Future<CaptionResult>> futures = new ArrayList<>(imagePaths.size());
            for (String path : imagePaths) {
                futures.add(pool.submit(() -> generateSingle(path, prompt)));
            }

            List<CaptionResult> results = new ArrayList<>(imagePaths.size());
            for (int i = 0; i < futures.size(); i++) {
                String path = imagePaths.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    results.add(CaptionResult.failure(path, cause.getMessage()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    results.add(CaptionResult.failure(path, "Interrupted while waiting for caption"));
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Lists the models the server offers. Never throws.
     */
    public ConnectionStatus testConnection() {
        String url = modelsUrl();
        try {
            HttpURLConnection conn = (HttpURLConnection) new URL(url).openConnection();
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(CONNECTION_TEST_TIMEOUT_MS);
            conn.setReadTimeout(CONNECTION_TEST_TIMEOUT_MS);
            try {
                int code = conn.getResponseCode();
                if (code < 200 || code >= 300) {
                    return ConnectionStatus.failed("Server returned status: " + code);
                }
                JsonNode root;
                try (InputStream in = conn.getInputStream()) {
                    root = objectMapper.readTree(in);
                }
                List<String> models = new ArrayList<>();
                for (JsonNode entry : root.path("data")) {
                    String id = entry.path("id").asText("");
                    if (!id.isEmpty()) {
                        models.add(id);
                    }
                }
                log.info("Connected to {} at {} ({} models)", getProvider().getValue(), url, models.size());
                return ConnectionStatus.connected(models);
            } finally {
                conn.disconnect();
            }
        } catch (IOException e) {
            log.info("Connection test to {} failed: {}", url, e.getMessage());
            return ConnectionStatus.failed("Connection failed: " + e.getMessage());
        }
    }

    private String requestCaption(String imagePath, String prompt) throws CaptionBackendException {
        Path path = Path.of(imagePath);
        if (!Files.isRegularFile(path)) {
            throw new InferenceException("Image file not found");
        }

        String dataUrl;
        try {
            dataUrl = imageEncoder.toJpegDataUrl(path, settings.getMaxImageDimension());
        } catch (IOException | RuntimeException e) {
            // decoders throw unchecked exceptions on some malformed files
            throw new InferenceException("Failed to encode image: " + e.getMessage(), e);
        }

        byte[] body = buildRequestBody(prompt, dataUrl);
        int timeoutSecs = settings.effectiveTimeoutSecs();

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return postChatCompletion(body, timeoutSecs * 1000);
            } catch (SocketTimeoutException e) {
                if (attempt < MAX_ATTEMPTS) {
                    log.warn("Request for {} timed out after {}s, retrying once", path.getFileName(), timeoutSecs);
                }
            }
        }
        throw new InferenceException("Request timed out after " + timeoutSecs + " seconds (tried "
                + MAX_ATTEMPTS + " times). Try a larger timeout in settings or use smaller images.");
    }

    private byte[] buildRequestBody(String prompt, String dataUrl) throws InferenceException {
        ObjectNode root = objectMapper.createObjectNode();
        String model = settings.getModel();
        root.put("model", model != null && !model.isBlank() ? model : DEFAULT_MODEL);

        ArrayNode messages = root.putArray("messages");
        ObjectNode message = messages.addObject();
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        content.addObject()
                .put("type", "text")
                .put("text", prompt);
        ObjectNode image = content.addObject();
        image.put("type", "image_url");
        image.putObject("image_url").put("url", dataUrl);

        root.put("max_tokens", settings.effectiveMaxTokens());
        root.put("temperature", TEMPERATURE);
        root.put("stream", false);

        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (IOException e) {
            throw new InferenceException("Failed to build request: " + e.getMessage(), e);
        }
    }

    /**
     * Posts one chat-completion request. Timeouts surface as
     * {@link SocketTimeoutException} so the caller can retry them.
     */
    private String postChatCompletion(byte[] body, int readTimeoutMs)
            throws SocketTimeoutException, CaptionBackendException {
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) new URL(chatCompletionsUrl()).openConnection();
            conn.setRequestMethod("POST");
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json");
            conn.setRequestProperty("Accept", "application/json");
            conn.setConnectTimeout(Math.min(CONNECT_TIMEOUT_MS, readTimeoutMs));
            conn.setReadTimeout(readTimeoutMs);

            try (OutputStream out = conn.getOutputStream()) {
                out.write(body);
            }

            int code = conn.getResponseCode();
            if (code < 200 || code >= 300) {
                String errorBody = readFully(conn.getErrorStream());
                if (errorBody.length() > MAX_ERROR_BODY_CHARS) {
                    errorBody = errorBody.substring(0, MAX_ERROR_BODY_CHARS) + "…";
                }
                throw new InferenceException("Server error " + code + ": " + errorBody);
            }

            String responseBody = readFully(conn.getInputStream());
            return parseCaption(responseBody);
        } catch (SocketTimeoutException e) {
            throw e;
        } catch (IOException e) {
            throw new BackendUnreachableException("Request failed: " + e.getMessage(), e);
        } finally {
            if (conn != null) {
                conn.disconnect();
            }
        }
    }

    String parseCaption(String responseBody) throws InferenceException {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new InferenceException("Failed to parse response: " + e.getMessage(), e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new InferenceException("Failed to parse response: no message content in choices[0]");
        }
        return content.asText().trim();
    }

    private static String readFully(InputStream in) throws IOException {
        if (in == null) {
            return "";
        }
        try (InputStream stream = in) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            stream.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    private ThreadFactory requestThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        String prefix = getProvider().getValue() + "-request-";
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
