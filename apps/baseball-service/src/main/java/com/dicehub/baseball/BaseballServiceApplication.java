package com.dicehub.baseball;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * baseball-service 启动入口。
 * 通过 @EnableFeignClients 启用阵容服务的 Feign Client。
 */
@SpringBootApplication
@EnableFeignClients
public class BaseballServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BaseballServiceApplication.class, args);
    }
}
