package br.com.fantasydraft.backend.config;

import br.com.fantasydraft.backend.config.properties.DraftProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Scheduler próprio da varredura de timers, dimensionado por draft.sweep.*.
 * As threads saem com prefixo fixo para aparecerem nos logs.
 */
@Slf4j
@Configuration
@EnableScheduling
@RequiredArgsConstructor
public class SchedulingConfig implements SchedulingConfigurer {

    private final DraftProperties draftProperties;

    @Override
    public void configureTasks(@NonNull ScheduledTaskRegistrar taskRegistrar) {
        DraftProperties.Sweep sweep = draftProperties.getSweep();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, sweep.getPoolSize()));
        scheduler.setThreadNamePrefix(sweep.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        scheduler.initialize();

        log.info("⏰ [Scheduling] Varredura com {} thread(s), prefixo '{}'", scheduler.getScheduledThreadPoolExecutor()
                .getCorePoolSize(), sweep.getThreadNamePrefix());
        taskRegistrar.setTaskScheduler(scheduler);
    }
}
