package com.ospicorp.rentindex.config;

import com.ospicorp.rentindex.web.CsvHttpMessageConverter;
import java.util.List;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.ShallowEtagHeaderFilter;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(0, new CsvHttpMessageConverter());
  }

  // region reads only; batch reports differ on every run
  @Bean
  FilterRegistrationBean<ShallowEtagHeaderFilter> regionEtagFilter() {
    FilterRegistrationBean<ShallowEtagHeaderFilter> registration =
        new FilterRegistrationBean<>(new ShallowEtagHeaderFilter());
    registration.setName("regionEtagFilter");
    registration.addUrlPatterns("/v1/regions", "/v1/regions/*");
    return registration;
  }
}
