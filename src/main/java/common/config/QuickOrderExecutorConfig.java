package common.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 批量建单线程池与解析时钟
 */
@Slf4j
@Configuration
public class QuickOrderExecutorConfig {

    @Bean("quickOrderExecutor")
    public ThreadPoolTaskExecutor quickOrderExecutor(QuickOrderProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutorPoolSize());
        executor.setMaxPoolSize(properties.getExecutorPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("QuickOrder-");

        // 关闭时等待正在处理的行完成 避免订单已建而指派请求被中断
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        // 队列满时由调用线程自己执行
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();

        log.info("批量建单线程池初始化完成: poolSize={}", properties.getExecutorPoolSize());
        return executor;
    }

    @Bean
    public Clock quickOrderClock(QuickOrderProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
