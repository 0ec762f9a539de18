package com.crave.search.ondemand;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(OnDemandProperties.class)
public class OnDemandConfig {
}
