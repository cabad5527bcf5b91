package com.cashcow.config;

import com.cashcow.store.EntityStore;
import com.cashcow.store.InMemoryEntityStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class StoreConfig {

    /** Default entity source. Replaced when the host application defines its own store. */
    @Bean
    @ConditionalOnMissingBean(EntityStore.class)
    public InMemoryEntityStore entityStore(@Qualifier("forecastExecutor") ThreadPoolTaskExecutor forecastExecutor) {
        return new InMemoryEntityStore(forecastExecutor);
    }
}
