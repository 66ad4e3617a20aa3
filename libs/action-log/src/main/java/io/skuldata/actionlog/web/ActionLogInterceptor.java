/*
 * どこで: Action log の Web 層
 * 何を: 認証済みで成功したリクエストごとに 1 件の監査ログを書き込む
 * なぜ: 画面操作 (閲覧を含む) の足跡を、各コントローラに手を入れずに残すため
 */
package io.skuldata.actionlog.web;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.skuldata.actionlog.capability.AuditActor;
import io.skuldata.actionlog.config.ActionLogProperties;
import io.skuldata.actionlog.model.ActionCategory;
import io.skuldata.actionlog.model.ActionTarget;
import io.skuldata.actionlog.model.RequestDetails;
import io.skuldata.actionlog.service.ActionLogMode;
import io.skuldata.actionlog.service.ActionLogRecorder;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Spring 管理の共有コンポーネントを保持するだけで防御的コピーが不可能なため")
public class ActionLogInterceptor implements HandlerInterceptor {

  private static final Logger logger = LoggerFactory.getLogger(ActionLogInterceptor.class);

  private final ActionLogRecorder recorder;
  private final ActionLogMode mode;
  private final ActorContextResolver actorContextResolver;
  private final ActionLogProperties.Interceptor settings;
  private final List<RequestMetadataExtractor> extractors;

  public ActionLogInterceptor(
      ActionLogRecorder recorder,
      ActionLogMode mode,
      ActorContextResolver actorContextResolver,
      ActionLogProperties properties,
      ObjectProvider<RequestMetadataExtractor> extractors) {
    this.recorder = recorder;
    this.mode = mode;
    this.actorContextResolver = actorContextResolver;
    this.settings = properties.interceptor();
    this.extractors = extractors.orderedStream().toList();
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    try {
      logRequest(request, response, ex);
    } catch (RuntimeException failure) {
      logger.warn(
          "request action log failed method={} path={}",
          request.getMethod(),
          request.getRequestURI(),
          failure);
    }
  }

  private void logRequest(
      HttpServletRequest request, HttpServletResponse response, @Nullable Exception ex) {
    if (!settings.enabled() || mode.isTestMode()) {
      return;
    }
    // 401/403 を含む失敗応答と未解決の例外は記録しない
    if (ex != null || response.getStatus() >= 400) {
      return;
    }
    final String path = resolvePath(request);
    if (isSkipped(path)) {
      return;
    }
    final Optional<AuditActor> actor = actorContextResolver.currentActor();
    if (actor.isEmpty()) {
      return;
    }
    final String method = request.getMethod().toUpperCase(Locale.ROOT);
    final RequestDetails details = actorContextResolver.requestDetails(request);
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("method", method);
    metadata.put("path", path);
    metadata.put("status_code", response.getStatus());
    metadata.put("query_params", queryParams(request));
    metadata.put("ip_address", details.ipAddress());
    metadata.put("user_agent", details.userAgent());
    ActionTarget target = null;
    for (RequestMetadataExtractor extractor : extractors) {
      final Optional<PathContext> context = extractor.extract(path, request);
      if (context.isEmpty()) {
        continue;
      }
      metadata.putAll(context.get().metadata());
      if (target == null) {
        target = context.get().target();
      }
    }
    recorder.recordAsync(
        actor.get(), method + " " + path, categoryFor(method), target, metadata, details);
  }

  static ActionCategory categoryFor(String method) {
    return switch (method) {
      case "GET" -> ActionCategory.VIEW;
      case "POST" -> ActionCategory.CREATE;
      case "PUT", "PATCH" -> ActionCategory.UPDATE;
      case "DELETE" -> ActionCategory.DELETE;
      default -> ActionCategory.OTHER;
    };
  }

  private boolean isSkipped(String path) {
    for (String prefix : settings.skipPathPrefixes()) {
      if (path.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  private String resolvePath(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    final String contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      return uri.substring(contextPath.length());
    }
    return uri;
  }

  private Map<String, Object> queryParams(HttpServletRequest request) {
    final Map<String, Object> params = new LinkedHashMap<>();
    for (Map.Entry<String, String[]> entry : request.getParameterMap().entrySet()) {
      params.put(entry.getKey(), Arrays.asList(entry.getValue()));
    }
    return params;
  }
}
