package com.dicehub.web.common.feign;

import feign.RequestInterceptor;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Feign 客户端鉴权自动配置。
 *
 * 把调用方的 JWT 透传给下游服务（如阵容服务），按顺序尝试：
 * 1. 当前 HTTP 请求的 Authorization Header；
 * 2. SecurityContext 中的 JwtAuthenticationToken。
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(name = "org.springframework.cloud.openfeign.FeignClient")
public class FeignAuthAutoConfiguration {

    @Bean
    public RequestInterceptor feignRequestInterceptor() {
        return template -> {
            String authorization = resolveAuthorization();
            if (authorization != null) {
                template.header("Authorization", authorization);
            } else {
                log.warn("无法获取 JWT Token，Feign 调用将不携带 Token, url={}", template.url());
            }
        };
    }

    static String resolveAuthorization() {
        ServletRequestAttributes attributes =
                (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes != null) {
            HttpServletRequest request = attributes.getRequest();
            String header = request.getHeader("Authorization");
            if (header != null && !header.isBlank()) {
                return header;
            }
        }

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof JwtAuthenticationToken jwtAuth && jwtAuth.getToken() != null) {
            String tokenValue = jwtAuth.getToken().getTokenValue();
            if (tokenValue != null && !tokenValue.isBlank()) {
                return "Bearer " + tokenValue;
            }
        }
        return null;
    }
}
