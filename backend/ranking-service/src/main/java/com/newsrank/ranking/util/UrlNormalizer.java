package com.newsrank.ranking.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * URL 정규화 유틸리티
 *
 * 프래그먼트와 쿼리 파라미터(트래킹 파라미터 포함)를 제거하고, scheme과 host만 소문자로 바꾸고,
 * 끝의 슬래시를 제거합니다. 경로의 대소문자는 유지합니다.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * @param url 원본 URL
     * @return 정규화된 URL, 비어 있으면 null
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return normalizeLoosely(trimmed);
            }
            StringBuilder normalized = new StringBuilder();
            normalized.append(uri.getScheme().toLowerCase(Locale.ROOT))
                    .append("://")
                    .append(uri.getRawAuthority().toLowerCase(Locale.ROOT));
            if (uri.getRawPath() != null) {
                normalized.append(uri.getRawPath());
            }
            return stripTrailingSlashes(normalized.toString());
        } catch (URISyntaxException e) {
            return normalizeLoosely(trimmed);
        }
    }

    /**
     * URI로 파싱되지 않는 문자열용 문자열 기반 정규화
     */
    static String normalizeLoosely(String url) {
        String normalized = url.replaceAll("#.*$", "").replaceAll("\\?.*$", "");

        int schemeEnd = normalized.indexOf("://");
        int hostStart = schemeEnd >= 0 ? schemeEnd + 3 : 0;
        int pathStart = normalized.indexOf('/', hostStart);
        if (pathStart < 0) {
            normalized = normalized.toLowerCase(Locale.ROOT);
        } else {
            normalized = normalized.substring(0, pathStart).toLowerCase(Locale.ROOT)
                    + normalized.substring(pathStart);
        }
        return stripTrailingSlashes(normalized);
    }

    private static String stripTrailingSlashes(String url) {
        String result = url;
        while (result.endsWith("/") && !result.endsWith("://")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
