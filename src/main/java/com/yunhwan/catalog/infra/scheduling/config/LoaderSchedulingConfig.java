package com.yunhwan.catalog.infra.scheduling.config;

import com.yunhwan.catalog.usecase.loader.config.BatchLoaderProperties;
import com.yunhwan.catalog.usecase.product.ProductBatchLoaderFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class LoaderSchedulingConfig {

    /**
     * BatchLoader tick. 작업 1개 = dispatch 1회.
     */
    @Bean(name = ProductBatchLoaderFactory.TICK_EXECUTOR)
    public ThreadPoolTaskExecutor loaderTickExecutor(BatchLoaderProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getTickPoolSize());
        executor.setMaxPoolSize(props.getTickPoolSize());
        executor.setThreadNamePrefix("loader-tick-");
        executor.initialize();
        return executor;
    }

    @Bean
    public TaskScheduler catalogTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1); // dead-letter report
        scheduler.setThreadNamePrefix("catalog-sched-");
        scheduler.initialize();
        return scheduler;
    }
}
