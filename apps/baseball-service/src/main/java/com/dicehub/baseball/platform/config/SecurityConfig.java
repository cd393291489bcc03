package com.dicehub.baseball.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 资源服务器安全配置
 * -------------------------------------------------------
 *  - 只开启 JWT 资源服务器能力，issuer-uri/jwk-set-uri 由 application.yml 提供；
 *  - /actuator/** 放行；/ws 握手放行，身份在 STOMP CONNECT 阶段由 {@code WebSocketAuthChannelInterceptor} 校验；
 *  - 其余路径（/api/baseball/**）要求已认证。
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/**").permitAll()
                        .requestMatchers("/ws/**", "/ws").permitAll()
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth -> oauth.jwt(jwt -> { }));
        return http.build();
    }
}
