package com.verlumen.chrono.http;

import com.google.common.flogger.FluentLogger;
import com.google.common.io.CharStreams;
import com.google.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.net.HttpURLConnection;
import java.nio.charset.StandardCharsets;
import java.util.Map;

final class HttpClientImpl implements HttpClient {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    private final HttpURLConnectionFactory httpURLConnectionFactory;

    @Inject
    HttpClientImpl(HttpURLConnectionFactory httpURLConnectionFactory) {
        this.httpURLConnectionFactory = httpURLConnectionFactory;
    }

    @Override
    public HttpResponse postJson(String url, Map<String, String> headers, String body)
        throws IOException {
        logger.atFine().log("Making POST request to URL: %s (%d characters)", url, body.length());

        HttpURLConnection con = null;
        try {
            con = httpURLConnectionFactory.create(url);
            con.setRequestMethod("POST");
            con.setDoOutput(true);
            con.setRequestProperty("Content-Type", "application/json");
            for (Map.Entry<String, String> header : headers.entrySet()) {
                con.setRequestProperty(header.getKey(), header.getValue());
            }

            byte[] payload = body.getBytes(StandardCharsets.UTF_8);
            try (OutputStream out = con.getOutputStream()) {
                out.write(payload);
            }

            int responseCode = con.getResponseCode();
            logger.atFine().log("Received response code %d from %s", responseCode, url);

            InputStream stream = responseCode < HttpURLConnection.HTTP_BAD_REQUEST
                ? con.getInputStream()
                : con.getErrorStream();
            String response = readFully(stream);
            if (responseCode >= HttpURLConnection.HTTP_BAD_REQUEST) {
                logger.atWarning().log("POST to %s returned HTTP %d: %s", url, responseCode, response);
            }
            return new HttpResponse(responseCode, response);
        } catch (IOException e) {
            logger.atWarning().withCause(e).log("Failed to execute POST request to %s", url);
            throw e;
        } finally {
            if (con != null) {
                con.disconnect();
            }
        }
    }

    private static String readFully(InputStream stream) throws IOException {
        if (stream == null) {
            return "";
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return CharStreams.toString(reader);
        }
    }
}
