package com.github.yoep.paging.ui.config;

import com.github.yoep.paging.core.config.PagingConfig;
import com.github.yoep.paging.core.environment.PlatformProvider;
import com.github.yoep.paging.ui.PlatformFX;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import(PagingConfig.class)
public class PagingUiConfig {
    @Bean
    public PlatformProvider platformProvider() {
        return new PlatformFX();
    }
}
