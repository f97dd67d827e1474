package com.dnobretech.jarvisepubconverter.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pools separados para EPUBs e para entradas: uma tarefa de EPUB espera as tarefas das suas
 * entradas, então elas não podem disputar o mesmo pool.
 */
@Configuration
public class ConversionExecutorConfig {

    @Bean(name = "archiveExecutor")
    public ThreadPoolTaskExecutor archiveExecutor(@Value("${jarvis.convert.archive-threads:4}") int threads) {
        return pool("epub-", threads);
    }

    @Bean(name = "entryExecutor")
    public ThreadPoolTaskExecutor entryExecutor(@Value("${jarvis.convert.entry-threads:0}") int threads) {
        // 0 = um por núcleo
        int size = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        return pool("entry-", size);
    }

    private static ThreadPoolTaskExecutor pool(String prefix, int size) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(Math.max(1, size));
        ex.setMaxPoolSize(Math.max(1, size));
        ex.setThreadNamePrefix(prefix);
        ex.setWaitForTasksToCompleteOnShutdown(false);
        return ex;
    }
}
