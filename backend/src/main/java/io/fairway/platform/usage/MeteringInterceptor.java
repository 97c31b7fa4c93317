package io.fairway.platform.usage;

import io.fairway.platform.exception.RateLimitExceededException;
import io.fairway.platform.multitenancy.TenantContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Rate-limits and meters every tenant-bound API request. Requests without a tenant (platform
 * tokens) pass through unmetered.
 */
@Component
public class MeteringInterceptor implements HandlerInterceptor {

  private static final String START_ATTRIBUTE = MeteringInterceptor.class.getName() + ".start";

  private final UsageMeter usageMeter;

  public MeteringInterceptor(UsageMeter usageMeter) {
    this.usageMeter = usageMeter;
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    String tenantId = TenantContext.getTenantIdOrNull();
    if (tenantId == null) {
      return true;
    }
    String endpoint = endpointKey(request);
    var decision = usageMeter.checkRateLimit(tenantId, endpoint);
    if (!decision.allowed()) {
      usageMeter.recordCall(tenantId, endpoint, 429, 0, 0);
      throw new RateLimitExceededException(tenantId, endpoint, decision.retryAfter());
    }
    request.setAttribute(START_ATTRIBUTE, System.nanoTime());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
    String tenantId = TenantContext.getTenantIdOrNull();
    Object start = request.getAttribute(START_ATTRIBUTE);
    if (tenantId == null || !(start instanceof Long startNanos)) {
      return;
    }
    long latencyMillis = (System.nanoTime() - startNanos) / 1_000_000;
    long bytes = Math.max(0, request.getContentLengthLong()) + responseLength(response);
    int status = ex != null && response.getStatus() < 400 ? 500 : response.getStatus();
    usageMeter.recordCall(tenantId, endpointKey(request), status, latencyMillis, bytes);
  }

  /** Method plus matched route template, so path variables do not explode the key space. */
  static String endpointKey(HttpServletRequest request) {
    Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    String path = pattern != null ? pattern.toString() : request.getRequestURI();
    return request.getMethod() + " " + path;
  }

  private static long responseLength(HttpServletResponse response) {
    String header = response.getHeader("Content-Length");
    if (header == null) {
      return 0;
    }
    try {
      return Long.parseLong(header);
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
