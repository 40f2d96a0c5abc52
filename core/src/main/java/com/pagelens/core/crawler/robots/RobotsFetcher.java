package com.pagelens.core.crawler.robots;

import java.net.URI;

/** robots.txt 수집 seam. 리다이렉트는 따라가지 않고 RobotsRepository가 직접 처리한다. */
@FunctionalInterface
public interface RobotsFetcher {

    /**
     * @param status   HTTP 상태. 0이면 응답 자체를 못 받음(네트워크 오류)
     * @param finalUri 3xx일 때 Location, 그 외엔 요청 URI
     * @param error    status 0일 때 사유
     */
    record Response(int status, String body, URI finalUri, String error) {
        public Response {
            body = (body == null) ? "" : body;
        }

        public static Response ok(int status, String body, URI uri) {
            return new Response(status, body, uri, null);
        }

        public static Response redirect(int status, URI location) {
            return new Response(status, "", location, null);
        }

        public static Response fail(String msg, URI uri) {
            return new Response(0, "", uri, msg);
        }

        public boolean isNetworkFailure() { return status == 0; }
    }

    /** 예외를 던지지 않는다. 실패는 Response.fail로 돌려준다. */
    Response fetch(URI robotsTxtUri);
}
