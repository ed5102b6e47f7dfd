package com.agentbridge.support;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * OkHttp interceptor that answers from a queue of canned responses and records
 * every request. No network I/O happens.
 */
public final class OkHttpStubEngine implements Interceptor {

    private final ConcurrentLinkedQueue<Object> planned = new ConcurrentLinkedQueue<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public void enqueueBytes(int code, byte[] body, String contentType) {
        planned.add(new Planned(code, body, contentType));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(failure);
    }

    public List<Request> requests() {
        return requests;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requests.add(request);

        Object next = planned.poll();
        if (next == null) {
            throw new IOException("No planned response for " + request.url());
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        Planned response = (Planned) next;
        return new Response.Builder()
            .request(request)
            .protocol(Protocol.HTTP_1_1)
            .code(response.code)
            .message("stub")
            .body(ResponseBody.create(response.body, MediaType.parse(response.contentType)))
            .build();
    }

    private static final class Planned {
        private final int code;
        private final byte[] body;
        private final String contentType;

        private Planned(int code, byte[] body, String contentType) {
            this.code = code;
            this.body = body;
            this.contentType = contentType;
        }
    }
}
