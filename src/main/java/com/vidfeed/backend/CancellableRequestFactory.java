package com.vidfeed.backend;

import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.core5.concurrent.Cancellable;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;

import java.net.URI;
import java.util.function.Supplier;

/**
 * Request factory that ties each outgoing request to the warm-up running on the current thread.
 * Cancelling the warm-up aborts the request, which closes its connection and releases the
 * worker blocked on it.
 */
public class CancellableRequestFactory extends HttpComponentsClientHttpRequestFactory {

    private final ThreadLocal<WarmupRequest> currentWarmup = new ThreadLocal<>();

    public CancellableRequestFactory() {
        super();
    }

    public CancellableRequestFactory(HttpClient httpClient) {
        super(httpClient);
    }

    /**
     * Runs {@code call} with every request it creates bound to {@code request}.
     */
    public <T> T execute(WarmupRequest request, Supplier<T> call) {
        WarmupRequest previous = currentWarmup.get();
        currentWarmup.set(request);
        try {
            return call.get();
        } finally {
            if (previous == null) {
                currentWarmup.remove();
            } else {
                currentWarmup.set(previous);
            }
        }
    }

    @Override
    protected ClassicHttpRequest createHttpUriRequest(HttpMethod httpMethod, URI uri) {
        ClassicHttpRequest httpRequest = super.createHttpUriRequest(httpMethod, uri);
        WarmupRequest warmup = currentWarmup.get();
        if (warmup != null && httpRequest instanceof Cancellable) {
            Cancellable cancellable = (Cancellable) httpRequest;
            warmup.onCancel(cancellable::cancel);
        }
        return httpRequest;
    }
}
