package com.sds.phucth.sessioncontext.config;

import com.sds.phucth.sessioncontext.auth.ApiTokenFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WebConfig {

    @Bean
    public FilterRegistrationBean<ApiTokenFilter> apiTokenFilterRegistration(ApiTokenFilter apiTokenFilter) {
        FilterRegistrationBean<ApiTokenFilter> registration = new FilterRegistrationBean<>(apiTokenFilter);
        registration.addUrlPatterns("/api/*");
        registration.setOrder(1);
        return registration;
    }
}
