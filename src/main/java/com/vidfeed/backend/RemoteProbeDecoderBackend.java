package com.vidfeed.backend;

import com.vidfeed.exception.WarmupFailureException;
import com.vidfeed.model.VideoIdentifier;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpRange;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Warms a video up by fetching the head of its source and verifying the container.
 * <p>
 * Runs on the warm-up executor. Remote sources are read with an HTTP range request, local
 * {@code file:} sources straight from disk. Network and HTTP errors surface as source failures;
 * an unrecognised container surfaces as a decode failure. Cancelling the request aborts a range
 * request that is still in flight.
 */
@Slf4j
public class RemoteProbeDecoderBackend implements DecoderBackend {

    private final RestTemplate restTemplate;
    private final CancellableRequestFactory requestFactory;
    private final Executor warmupExecutor;
    private final int probeBytes;

    public RemoteProbeDecoderBackend(RestTemplate sourceRestTemplate, CancellableRequestFactory requestFactory,
                                     Executor warmupExecutor, int probeBytes) {
        this.restTemplate = sourceRestTemplate;
        this.requestFactory = requestFactory;
        this.warmupExecutor = warmupExecutor;
        this.probeBytes = probeBytes;
    }

    @Override
    public CompletableFuture<DecoderHandle> prepare(WarmupRequest request) {
        return CompletableFuture.supplyAsync(() -> warmUp(request), warmupExecutor);
    }

    private DecoderHandle warmUp(WarmupRequest request) {
        VideoIdentifier identifier = request.getIdentifier();
        URI uri = request.getDescriptor().getSourceUri();
        checkCancelled(request);

        log.debug("Probing source of video {}: {}", identifier.shortId(), uri);
        byte[] header = "file".equalsIgnoreCase(uri.getScheme())
                ? readLocalHeader(uri)
                : requestFactory.execute(request, () -> fetchRemoteHeader(request, uri));
        checkCancelled(request);

        if (header.length == 0) {
            throw WarmupFailureException.decodeFailure("FORMAT_ERROR", "Source returned no data: " + uri, null);
        }
        ContainerFormat format = ContainerFormat.detect(header)
                .orElseThrow(() -> WarmupFailureException.decodeFailure("FORMAT_ERROR",
                        "Unrecognised container format for " + uri, null));

        ProbedStreamHandle handle = new ProbedStreamHandle(identifier, uri, format, header.length);
        if (request.isCancelled()) {
            handle.close();
            throw new CancellationException("Warm-up of video " + identifier + " cancelled");
        }
        log.info("Probed video {}: {} ({} bytes)", identifier.shortId(), format, header.length);
        return handle;
    }

    private byte[] fetchRemoteHeader(WarmupRequest request, URI uri) {
        HttpHeaders headers = new HttpHeaders();
        headers.setRange(List.of(HttpRange.createByteRange(0, probeBytes - 1L)));
        headers.setCacheControl("no-cache");
        headers.set(HttpHeaders.USER_AGENT, "vidfeed/0.0.1");

        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
        } catch (RuntimeException e) {
            if (request.isCancelled()) {
                log.debug("Aborted range request of video {}: {}", request.getIdentifier().shortId(), e.getMessage());
                throw new CancellationException("Warm-up of video " + request.getIdentifier() + " cancelled");
            }
            throw e;
        }
        byte[] body = response.getBody();
        if (body == null) {
            return new byte[0];
        }
        // Servers that ignore Range send the whole file
        return body.length > probeBytes ? Arrays.copyOf(body, probeBytes) : body;
    }

    private byte[] readLocalHeader(URI uri) {
        byte[] buffer = new byte[probeBytes];
        try (InputStream in = Files.newInputStream(Path.of(uri))) {
            int read = IOUtils.read(in, buffer);
            return Arrays.copyOf(buffer, read);
        } catch (IOException e) {
            throw WarmupFailureException.sourceUnavailable("NOT_FOUND", "Cannot read local video " + uri, e);
        }
    }

    private void checkCancelled(WarmupRequest request) {
        if (request.isCancelled()) {
            throw new CancellationException("Warm-up of video " + request.getIdentifier() + " cancelled");
        }
    }
}
