package com.dicehub.baseball.engine;

import com.dicehub.baseball.games.baseball.domain.rule.AtBatResolver;
import com.dicehub.baseball.games.baseball.domain.rule.OutcomeEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 引擎装配：骰子偏移幅度来自配置（baseball.engine.dice-bias-shift）。
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public OutcomeEngine outcomeEngine(@Value("${baseball.engine.dice-bias-shift:0.05}") double diceBiasShift) {
        log.info("打席引擎初始化，骰子偏移幅度={}", diceBiasShift);
        return new OutcomeEngine(diceBiasShift);
    }

    @Bean
    public AtBatResolver atBatResolver(OutcomeEngine outcomeEngine) {
        return new AtBatResolver(outcomeEngine);
    }
}
