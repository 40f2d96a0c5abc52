package com.pagelens.core.cache;

import com.pagelens.core.model.AnalysisRequest;
import com.pagelens.core.util.HashUtils;
import com.pagelens.core.util.UrlUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 캐시 키 = SHA-256(정규화 URL + 정렬된 분석기 이름과 각 설정 + 처리기 설정).
 * 수집기 설정(속도/재시도/헤더)은 분석 결과에 영향을 주지 않는 것으로 보고 제외한다.
 */
public final class Fingerprint {
    private Fingerprint() {}

    public static String of(AnalysisRequest req) {
        Objects.requireNonNull(req, "req");
        StringBuilder sb = new StringBuilder(256);
        sb.append("url=").append(UrlUtils.normalize(req.getUrl())).append('\n');
        List<String> names = new ArrayList<>(req.getAnalyzers());
        names.sort(null);
        for (String n : names) {
            sb.append("analyzer=").append(n).append('{').append(req.configFor(n).canonical()).append("}\n");
        }
        sb.append("processor=").append(req.getProcessor().canonical());
        return HashUtils.sha256Hex(sb.toString());
    }
}
