package io.fairway.platform.audit;

import io.fairway.platform.multitenancy.TenantContext;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates tenant, actor, source, IP
 * address, and user agent from the current request context when available.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}. Tenant and actor
 * can be set explicitly to override auto-population.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("subscription.canceled")
 *     .entityType("subscription")
 *     .entityId(subscription.getId().toString())
 *     .details(Map.of("reason", reason.name()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private String entityId;
  private String tenantId;
  private String actorId;
  private Map<String, Object> details;

  private boolean tenantIdExplicitlySet;
  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(Object entityId) {
    this.entityId = entityId != null ? entityId.toString() : null;
    return this;
  }

  public AuditEventBuilder tenantId(String tenantId) {
    this.tenantId = tenantId;
    this.tenantIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the {@link AuditEventRecord}, auto-populating fields from the current context:
   *
   * <ul>
   *   <li>{@code tenantId} and {@code actorId} from {@link TenantContext} if bound and not set
   *   <li>{@code actorType} = "USER" if an identity is bound, "SYSTEM" otherwise
   *   <li>{@code source} = "API" if in HTTP request context, "INTERNAL" otherwise
   *   <li>{@code ipAddress} and {@code userAgent} from the servlet request
   * </ul>
   */
  public AuditEventRecord build() {
    var identity = TenantContext.getIdentityOrNull();

    String resolvedTenantId = this.tenantId;
    if (!tenantIdExplicitlySet && identity != null) {
      resolvedTenantId = identity.tenantId();
    }

    String resolvedActorId = this.actorId;
    if (!actorIdExplicitlySet) {
      resolvedActorId = identity != null ? identity.userId() : "system";
    }

    String resolvedActorType =
        identity != null && !"system".equals(identity.userId()) ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();
    String resolvedSource = request != null ? "API" : "INTERNAL";

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    if (request != null) {
      resolvedIpAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedTenantId,
        resolvedActorId,
        resolvedActorType,
        resolvedSource,
        resolvedIpAddress,
        resolvedUserAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
