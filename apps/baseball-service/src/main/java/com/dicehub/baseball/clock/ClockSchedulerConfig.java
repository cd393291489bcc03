package com.dicehub.baseball.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 断线宽限计时器使用的定时线程池。
 *
 * 1. 核心线程数读取 scheduler.clock.corePoolSize；
 * 2. 线程命名为 grace-clock-N，守护线程；
 * 3. 队列满时 DiscardPolicy 直接丢弃；
 * 4. setRemoveOnCancelPolicy(true)：重连取消的计时器立即从队列移除。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.clock.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "graceClockScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor graceClockScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "grace-clock-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
