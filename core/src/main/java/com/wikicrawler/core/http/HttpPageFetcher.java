package com.wikicrawler.core.http;

import com.wikicrawler.core.api.IPageFetcher;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * java.net.http 기반 페이지 수신기.
 * - 2xx 외 응답은 HTTP_STATUS, 네트워크/타임아웃은 TRANSPORT
 * - 본문은 엄격한 UTF-8 디코딩(대체 문자 없음), 실패 시 DECODE
 */
public final class HttpPageFetcher implements IPageFetcher {
    private final HttpClient client;
    private final String userAgent;

    public HttpPageFetcher(String userAgent) {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(), userAgent);
    }

    public HttpPageFetcher(HttpClient client, String userAgent) {
        this.client = Objects.requireNonNull(client, "client");
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? "WikiCrawler" : userAgent;
    }

    @Override
    public String fetch(String url, Duration timeout) throws FetchException {
        HttpResponse<byte[]> res;
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                    .build();
            res = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FetchException.transport(url, e);
        } catch (IOException | IllegalArgumentException e) {
            // HttpTimeoutException 도 여기로 (IOException 하위)
            throw FetchException.transport(url, e);
        }

        int code = res.statusCode();
        if (code < 200 || code > 299) throw FetchException.httpStatus(url, code);

        byte[] body = res.body() == null ? new byte[0] : res.body();
        return decodeUtf8(url, body);
    }

    static String decodeUtf8(String url, byte[] body) throws FetchException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(body)).toString();
        } catch (CharacterCodingException e) {
            throw FetchException.decode(url, e);
        }
    }
}
