package com.slipway.deploy;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DeployConfig {

    @Bean
    @ConditionalOnProperty(name = "slipway.deploy.provider", havingValue = "cloudfoundry", matchIfMissing = true)
    public DeploymentClient cloudFoundryDeploymentClient(DeployProperties properties) {
        return new CloudFoundryDeploymentClient(properties);
    }
}
