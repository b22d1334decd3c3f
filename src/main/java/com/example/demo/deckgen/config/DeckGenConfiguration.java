package com.example.demo.deckgen.config;

import com.example.demo.deckgen.dispatch.Sleeper;
import com.example.demo.deckgen.dispatch.ThreadSleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Infrastructure beans of the rendering pipeline.
 */
@Configuration
public class DeckGenConfiguration {

    @Bean
    public Sleeper sleeper() {
        return new ThreadSleeper();
    }

    /**
     * Runs image uploads. Pool size bounds how many are in flight at once.
     */
    @Bean
    public ThreadPoolTaskExecutor uploadExecutor(UploadProperties uploadProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(uploadProperties.getConcurrency());
        executor.setMaxPoolSize(uploadProperties.getConcurrency());
        executor.setThreadNamePrefix("image-upload-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
