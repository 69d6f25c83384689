package com.phonebook.directory.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = resolveRequestId(request);
    response.setHeader(REQUEST_ID_HEADER, requestId);

    final Map<String, String> values = new LinkedHashMap<>();
    values.put("request_id", requestId);
    values.put("http_method", request.getMethod());
    values.put("http_path", request.getRequestURI());
    values.put("client_ip", resolveClientIp(request));
    values.entrySet().removeIf(entry -> entry.getValue() == null || entry.getValue().isBlank());
    values.forEach(MDC::put);
    request.setAttribute(ATTRIBUTE_KEYS, values.keySet());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof Iterable<?> keys) {
      keys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
  }

  // First hop of X-Forwarded-For when behind a proxy, otherwise the socket peer.
  private String resolveClientIp(HttpServletRequest request) {
    final String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
    if (forwardedFor == null || forwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = forwardedFor.indexOf(',');
    return (commaIndex < 0 ? forwardedFor : forwardedFor.substring(0, commaIndex)).trim();
  }
}
