package com.purchasingpower.orchestrator.configuration;

import com.purchasingpower.orchestrator.config.OrchestrationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for agent invocations and relevance validation.
 *
 * Agent calls and LLM validations run on separate pools so a slow model cannot starve routing.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "agentExecutor")
    public Executor agentExecutor(OrchestrationProperties properties) {
        OrchestrationProperties.ExecutorSettings settings = properties.getExecutor();
        return buildExecutor("agent-async-",
                settings.getCorePoolSize(),
                settings.getMaxPoolSize(),
                settings.getQueueCapacity());
    }

    @Bean(name = "validationExecutor")
    public Executor validationExecutor() {
        return buildExecutor("validation-async-", 5, 10, 100);
    }

    private Executor buildExecutor(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);

        // Let in-flight agent calls finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Async executor {} configured: core={}, max={}, queue={}",
                prefix, executor.getCorePoolSize(), executor.getMaxPoolSize(), queue);

        return executor;
    }
}
