package com.dicehub.baseball.infrastructure.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 会话写回线程：单线程保证同一会话的快照按提交顺序落库，
 * 与计时器线程池分开，避免 Redis 抖动拖慢断线判负。
 */
@Configuration
public class PersistExecutorConfig {

    @Bean(name = "sessionPersistExecutor", destroyMethod = "shutdown")
    public ExecutorService sessionPersistExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "session-persist-" + idx.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), tf);
    }
}
