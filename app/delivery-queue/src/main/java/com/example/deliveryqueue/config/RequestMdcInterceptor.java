/*
 * どこで: Delivery Queue の Web 層
 * 何を: 管理/ワーカー API のリクエスト属性 (ワーカー ID と対象通知 ID を含む) を MDC に載せる
 * なぜ: どのワーカーがどの通知を claim/報告したかをログから追えるようにするため
 */
package com.example.deliveryqueue.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String WORKER_ID_HEADER = "X-Worker-Id";
  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String MDC_KEYS_ATTRIBUTE = RequestMdcInterceptor.class.getName() + ".keys";
  private static final String NOTIFICATION_ID_VARIABLE = "id";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> added = new ArrayList<>();
    putIfPresent(added, "request_id", requestIdOf(request));
    putIfPresent(added, "http_method", request.getMethod());
    putIfPresent(added, "http_path", request.getRequestURI());
    putIfPresent(added, "client_ip", clientIpOf(request));
    putIfPresent(added, "worker_id", request.getHeader(WORKER_ID_HEADER));
    putIfPresent(added, "notification_id", notificationIdOf(request));
    request.setAttribute(MDC_KEYS_ATTRIBUTE, added);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(MDC_KEYS_ATTRIBUTE) instanceof List<?> added) {
      added.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
    }
  }

  private static String requestIdOf(HttpServletRequest request) {
    final String header = request.getHeader(REQUEST_ID_HEADER);
    return header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
  }

  // プロキシ経由では X-Forwarded-For の先頭が元クライアント
  private static String clientIpOf(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  @Nullable
  private static String notificationIdOf(HttpServletRequest request) {
    if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
        instanceof Map<?, ?> variables) {
      final Object id = variables.get(NOTIFICATION_ID_VARIABLE);
      return id == null ? null : id.toString();
    }
    return null;
  }

  private static void putIfPresent(List<String> added, String key, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
      added.add(key);
    }
  }
}
