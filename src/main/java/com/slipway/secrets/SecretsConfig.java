package com.slipway.secrets;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SecretsConfig {

    @Bean
    @ConditionalOnProperty(name = "slipway.secrets.store", havingValue = "environment", matchIfMissing = true)
    public SecretStore environmentSecretStore() {
        return new EnvironmentSecretStore(System::getenv);
    }

    @Bean
    @ConditionalOnProperty(name = "slipway.secrets.store", havingValue = "credhub")
    public SecretStore credHubSecretStore(SecretsProperties properties) {
        return new CredHubSecretStore(properties.getCredhub());
    }
}
