package com.automate.CodeAudit.Config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ANALYSIS_EXECUTOR = "analysisExecutor";

    // one task per triggered analysis
    @Bean(name = ANALYSIS_EXECUTOR)
    public Executor analysisExecutor(CodeAuditProperties properties) {
        CodeAuditProperties.AnalysisPool pool = properties.getAnalysisPool();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(pool.getCorePoolSize());
        ex.setMaxPoolSize(pool.getMaxPoolSize());
        ex.setQueueCapacity(pool.getQueueCapacity());
        ex.setThreadNamePrefix("analysis-");
        ex.initialize();
        return ex;
    }
}
