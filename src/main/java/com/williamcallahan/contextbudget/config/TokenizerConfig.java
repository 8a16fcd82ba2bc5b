package com.williamcallahan.contextbudget.config;

import com.williamcallahan.contextbudget.application.tokens.JtokkitTokenizerRegistry;
import com.williamcallahan.contextbudget.application.tokens.TokenizerRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the tokenizer registry used by every token counter in the application.
 */
@Configuration
public class TokenizerConfig {

    @Bean
    @ConditionalOnMissingBean(TokenizerRegistry.class)
    public TokenizerRegistry tokenizerRegistry() {
        return new JtokkitTokenizerRegistry();
    }
}
