package io.fairway.platform.config;

import io.fairway.platform.usage.MeteringInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final MeteringInterceptor meteringInterceptor;

  public WebConfig(MeteringInterceptor meteringInterceptor) {
    this.meteringInterceptor = meteringInterceptor;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // Ingestion endpoint records on behalf of other callers; metering it would double count.
    registry
        .addInterceptor(meteringInterceptor)
        .addPathPatterns("/api/**")
        .excludePathPatterns("/api/metering/**");
  }
}
