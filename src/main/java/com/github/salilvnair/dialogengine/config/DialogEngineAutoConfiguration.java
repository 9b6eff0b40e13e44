package com.github.salilvnair.dialogengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.dialogengine.audit.AuditService;
import com.github.salilvnair.dialogengine.audit.LoggingAuditService;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import com.github.salilvnair.dialogengine.expression.SpelExpressionEvaluator;
import com.github.salilvnair.dialogengine.service.DialogStateStore;
import com.github.salilvnair.dialogengine.service.InMemoryDialogStateStore;
import com.github.salilvnair.dialogengine.template.LanguageGenerator;
import com.github.salilvnair.dialogengine.template.ThymeleafLanguageGenerator;
import com.github.salilvnair.dialogengine.transport.ActivitySender;
import com.github.salilvnair.dialogengine.transport.LoggingActivitySender;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;

/**
 * Registers the engine components. Expression evaluation, templating, state storage,
 * outbound transport and audit each have a default that an application replaces by
 * declaring its own bean.
 */
@AutoConfiguration
@EnableConfigurationProperties
@ComponentScan(basePackages = "com.github.salilvnair.dialogengine",
        excludeFilters = @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = DialogEngineAutoConfiguration.class))
public class DialogEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ExpressionEvaluator expressionEvaluator() {
        return new SpelExpressionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public LanguageGenerator languageGenerator() {
        return new ThymeleafLanguageGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public DialogStateStore dialogStateStore(ObjectProvider<ObjectMapper> objectMapper) {
        return new InMemoryDialogStateStore(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ActivitySender activitySender() {
        return new LoggingActivitySender();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditService auditService() {
        return new LoggingAuditService();
    }
}
