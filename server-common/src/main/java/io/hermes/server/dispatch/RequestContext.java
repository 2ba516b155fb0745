package io.hermes.server.dispatch;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import io.hermes.server.security.SecurityContext;
import org.jspecify.annotations.Nullable;

/**
 * Per-request state passed along the interceptor chain.
 */
public final class RequestContext {

    private final String method;
    private final Map<String, Object> params;
    private final Map<String, String> headers;
    private @Nullable SecurityContext securityContext;

    public RequestContext(String method, Map<String, Object> params, Map<String, String> headers) {
        this.method = method;
        this.params = new LinkedHashMap<>(params);
        TreeMap<String, String> caseInsensitive = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        caseInsensitive.putAll(headers);
        this.headers = caseInsensitive;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Returns the mutable parameter map; interceptors may strip reserved members.
     */
    public Map<String, Object> getParams() {
        return params;
    }

    public @Nullable String getHeader(String name) {
        return headers.get(name);
    }

    public @Nullable SecurityContext getSecurityContext() {
        return securityContext;
    }

    public void setSecurityContext(@Nullable SecurityContext securityContext) {
        this.securityContext = securityContext;
    }
}
