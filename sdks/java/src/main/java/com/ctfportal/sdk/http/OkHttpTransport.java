package com.ctfportal.sdk.http;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link Transport} backed by OkHttp. Relative URLs are resolved against the base URL.
 */
public class OkHttpTransport implements Transport, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OkHttpTransport.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final String baseUrl;
    private final OkHttpClient httpClient;

    public OkHttpTransport(String baseUrl, Duration timeout) {
        this(baseUrl, new OkHttpClient.Builder()
                .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .callTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .build());
    }

    public OkHttpTransport(String baseUrl, OkHttpClient httpClient) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.httpClient = httpClient;
    }

    @Override
    public ApiResponse send(RequestDescriptor descriptor) throws IOException {
        Request request = toRequest(descriptor);
        logger.debug("{} {}", request.method(), request.url());

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String bodyString = responseBody != null ? responseBody.string() : "";
            logger.debug("{} {} -> {}", request.method(), request.url(), response.code());
            return new ApiResponse(response.code(), response.headers().toMultimap(), bodyString);
        }
    }

    String resolve(String url) {
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        return baseUrl + (url.startsWith("/") ? url : "/" + url);
    }

    private Request toRequest(RequestDescriptor descriptor) {
        Request.Builder requestBuilder = new Request.Builder()
                .url(resolve(descriptor.getUrl()))
                .header("Accept", "application/json");

        for (Map.Entry<String, String> header : descriptor.getHeaders().entrySet()) {
            requestBuilder.header(header.getKey(), header.getValue());
        }

        RequestBody requestBody = null;
        if (descriptor.getBody() != null) {
            MediaType mediaType = descriptor.getContentType() != null
                    ? MediaType.parse(descriptor.getContentType())
                    : JSON;
            requestBody = RequestBody.create(descriptor.getBody(), mediaType);
        }

        switch (descriptor.getMethod()) {
            case "GET":
                requestBuilder.get();
                break;
            case "HEAD":
                requestBuilder.head();
                break;
            case "POST":
                requestBuilder.post(requestBody != null ? requestBody : RequestBody.create("", JSON));
                break;
            case "PUT":
                requestBuilder.put(requestBody != null ? requestBody : RequestBody.create("", JSON));
                break;
            case "PATCH":
                requestBuilder.patch(requestBody != null ? requestBody : RequestBody.create("", JSON));
                break;
            case "DELETE":
                requestBuilder.delete(requestBody);
                break;
            default:
                throw new IllegalArgumentException("Unsupported HTTP method: " + descriptor.getMethod());
        }

        return requestBuilder.build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
