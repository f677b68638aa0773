package com.teamleader.sdk.http;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpTransport} backed by OkHttp.
 */
public class OkHttpTransport implements HttpTransport, AutoCloseable {

    private final OkHttpClient httpClient;

    public OkHttpTransport(Duration connectTimeout, Duration readTimeout, Duration callTimeout) {
        this(new OkHttpClient.Builder()
                .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .callTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .build());
    }

    public OkHttpTransport(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public TransportResponse execute(TransportRequest request) throws IOException {
        Request.Builder requestBuilder = new Request.Builder().url(request.getUrl());
        request.getHeaders().forEach(requestBuilder::header);

        RequestBody requestBody = null;
        if (request.getBody() != null) {
            requestBody = RequestBody.create(request.getBody(), MediaType.parse(request.getContentType()));
        }

        switch (request.getMethod()) {
            case "GET":
                requestBuilder.get();
                break;
            case "POST":
                requestBuilder.post(requestBody != null ? requestBody : emptyBody(request));
                break;
            case "PUT":
                requestBuilder.put(requestBody != null ? requestBody : emptyBody(request));
                break;
            case "PATCH":
                requestBuilder.patch(requestBody != null ? requestBody : emptyBody(request));
                break;
            case "DELETE":
                requestBuilder.delete(requestBody);
                break;
            default:
                throw new IllegalArgumentException("Unsupported HTTP method: " + request.getMethod());
        }

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            String bodyString = responseBody != null ? responseBody.string() : "";
            return new TransportResponse(response.code(), bodyString, response.headers().toMultimap());
        }
    }

    private static RequestBody emptyBody(TransportRequest request) {
        return RequestBody.create("", MediaType.parse(request.getContentType()));
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
