package com.batchembedding;

import com.batchembedding.transport.RawResponse;
import com.batchembedding.transport.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Performs a single synchronous JSON POST and hands back the status code and body.
 *
 * <p>Non-2xx responses are not failures here: their error stream is returned as the body so the
 * caller can read structured API errors. Only a failed exchange raises {@link TransportException}.</p>
 */
public class HttpHelper {

    private static final Logger logger = LogManager.getLogger(HttpHelper.class);
    private final URL apiUrl;
    private final Map<String, String> headers;
    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;

    public HttpHelper(Map<String, Object> config) {
        String url = ConfigValues.getString(config, ClientConstants.CONFIG_API_URL, ClientConstants.DEFAULT_API_URL);
        try {
            this.apiUrl = new URL(url);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(ClientConstants.ERROR_INVALID_CONFIG + ClientConstants.CONFIG_API_URL + "]: " + url, e);
        }
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(ConfigValues.getStringMap(config, ClientConstants.CONFIG_HEADERS)));
        this.connectTimeoutMillis = timeoutMillis(config, ClientConstants.CONFIG_CONNECT_TIMEOUT, ClientConstants.DEFAULT_CONNECT_TIMEOUT);
        this.readTimeoutMillis = timeoutMillis(config, ClientConstants.CONFIG_READ_TIMEOUT, ClientConstants.DEFAULT_READ_TIMEOUT);
    }

    // HttpURLConnection rejects negative timeouts only when the request is made; zero means no timeout.
    private static int timeoutMillis(Map<String, Object> config, String key, String defaultValue) {
        String value = ConfigValues.getString(config, key, defaultValue);
        long millis = parseDurationToMillis(value);
        if (millis < 0 || millis > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(ClientConstants.ERROR_INVALID_CONFIG + key + "]: " + value);
        }
        return (int) millis;
    }

    public RawResponse post(String requestBody, String authorization) throws TransportException {
        HttpURLConnection connection = null;
        try {
            logger.debug("Opening HTTP connection to: {}", apiUrl);
            connection = (HttpURLConnection) apiUrl.openConnection();
            connection.setRequestMethod("POST");
            connection.setRequestProperty("Content-Type", "application/json");
            connection.setRequestProperty("Accept", "application/json");
            if (authorization != null) {
                connection.setRequestProperty("Authorization", authorization);
            }
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                logger.debug("Setting header: {} = {}", entry.getKey(), mask(entry.getValue()));
                connection.setRequestProperty(entry.getKey(), entry.getValue());
            }
            connection.setDoOutput(true);
            connection.setConnectTimeout(connectTimeoutMillis);
            connection.setReadTimeout(readTimeoutMillis);

            byte[] input = requestBody.getBytes(StandardCharsets.UTF_8);
            logger.debug("Sending request body to API (length: {} bytes)", input.length);
            try (OutputStream os = connection.getOutputStream()) {
                os.write(input, 0, input.length);
            }

            int responseCode = connection.getResponseCode();
            logger.debug("Received HTTP response code: {}", responseCode);
            String body;
            if (responseCode >= 200 && responseCode < 300) {
                try (InputStream is = connection.getInputStream()) {
                    body = readFully(is);
                }
            } else {
                try (InputStream es = connection.getErrorStream()) {
                    body = es != null ? readFully(es) : "";
                }
            }
            return new RawResponse(responseCode, body);
        } catch (IOException e) {
            logger.warn("HTTP exchange with {} failed: {}", apiUrl, e.getMessage());
            throw new TransportException(ClientConstants.ERROR_API_REQUEST_FAILED + e, e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    public URL getApiUrl() {
        return apiUrl;
    }

    int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    int getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    private static String readFully(InputStream is) throws IOException {
        return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static String mask(String value) {
        return value.substring(0, Math.min(4, value.length())) + "...";
    }

    static long parseDurationToMillis(String durationString) {
        String trimmed = durationString.trim();
        try {
            if (trimmed.endsWith("ms")) {
                return Long.parseLong(trimmed.substring(0, trimmed.length() - 2));
            } else if (trimmed.endsWith("s")) {
                return Long.parseLong(trimmed.substring(0, trimmed.length() - 1)) * 1000;
            } else if (trimmed.endsWith("m")) {
                return Long.parseLong(trimmed.substring(0, trimmed.length() - 1)) * 60 * 1000;
            } else if (trimmed.endsWith("h")) {
                return Long.parseLong(trimmed.substring(0, trimmed.length() - 1)) * 60 * 60 * 1000;
            }
            return Long.parseLong(trimmed) * 1000;
        } catch (NumberFormatException e) {
            try {
                return Duration.parse("PT" + trimmed.toUpperCase()).toMillis();
            } catch (DateTimeParseException inner) {
                throw new IllegalArgumentException("cannot parse duration [" + durationString + "]", inner);
            }
        }
    }
}
