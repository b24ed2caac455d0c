package com.verlumen.chrono.http;

import java.io.IOException;
import java.util.Map;

public interface HttpClient {
    /**
     * Posts a JSON body. Any response the server sends back, including 4xx and 5xx, is returned;
     * only transport failures raise.
     */
    HttpResponse postJson(String url, Map<String, String> headers, String body) throws IOException;
}
