package com.sandkev.poolfees.shared.http;

import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Map;

public final class QueryParams {

    private QueryParams() {}

    /** Insertion-ordered query parameters; null values are left out. */
    public static MultiValueMap<String, String> of(Map<String, Object> params) {
        var qpm = new LinkedMultiValueMap<String, String>();
        params.forEach((k, v) -> { if (v != null) qpm.add(k, String.valueOf(v)); });
        return qpm;
    }
}
