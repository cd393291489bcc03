package com.dicehub.baseball.games.baseball.infrastructure.client;

import com.dicehub.web.common.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/**
 * 调用阵容服务（roster-service）的 Feign Client。
 * 本地开发通过 baseball.roster.url 指定地址；调用方的 JWT 由 web-common 的拦截器透传。
 */
@FeignClient(
        name = "roster-service",
        url = "${baseball.roster.url:http://localhost:8083}",
        path = "/api/rosters"
)
public interface TeamRosterClient {

    /**
     * 阵容详情：名称、所有者、各守位球员、棒次与数据
     */
    @GetMapping("/{rosterId}")
    ApiResponse<RosterView> getRoster(@PathVariable("rosterId") String rosterId);
}
