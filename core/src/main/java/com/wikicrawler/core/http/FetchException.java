package com.wikicrawler.core.http;

/** 페이지 수신 실패. kind로 HTTP 상태/전송/디코딩 오류를 구분한다. */
public class FetchException extends Exception {

    public enum Kind { HTTP_STATUS, TRANSPORT, DECODE }

    private final Kind kind;
    private final String url;
    private final int statusCode; // HTTP_STATUS 가 아니면 -1

    public FetchException(Kind kind, String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
        this.statusCode = statusCode;
    }

    public static FetchException httpStatus(String url, int statusCode) {
        return new FetchException(Kind.HTTP_STATUS, url, statusCode, "HTTP " + statusCode + " for " + url, null);
    }

    public static FetchException transport(String url, Throwable cause) {
        return new FetchException(Kind.TRANSPORT, url, -1, "transport error for " + url + ": " + cause, cause);
    }

    public static FetchException decode(String url, Throwable cause) {
        return new FetchException(Kind.DECODE, url, -1, "response of " + url + " is not valid UTF-8", cause);
    }

    public Kind getKind() { return kind; }
    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
}
