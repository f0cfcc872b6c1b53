package com.github.yoep.paging.core.config;

import com.github.yoep.paging.core.PagingControllerFactory;
import com.github.yoep.paging.core.config.properties.PagingProperties;
import com.github.yoep.paging.core.environment.PlatformProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PagingProperties.class)
public class PagingConfig {
    @Bean
    public PagingControllerFactory pagingControllerFactory(PagingProperties pagingProperties, PlatformProvider platformProvider) {
        return new PagingControllerFactory(pagingProperties, platformProvider);
    }
}
