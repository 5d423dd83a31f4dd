package io.interval4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.interval4j.CalendarIntervalScheduleBuilder;
import io.interval4j.CalendarIntervalScheduleFactory;
import io.interval4j.ScheduleDocumentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for interval4j components.
 */
@AutoConfiguration
@ConditionalOnClass(CalendarIntervalScheduleBuilder.class)
@EnableConfigurationProperties(Interval4jProperties.class)
@ConditionalOnProperty(prefix = "interval4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Interval4jAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(Interval4jAutoConfiguration.class);

    @Bean
    @ConfigurationPropertiesBinding
    public static MisfireInstructionConverter misfireInstructionConverter() {
        return new MisfireInstructionConverter();
    }

    @Bean
    @ConditionalOnMissingBean
    public CalendarIntervalScheduleFactory calendarIntervalScheduleFactory(Interval4jProperties props) {
        CalendarIntervalScheduleFactory factory = new CalendarIntervalScheduleFactory(
                props.getDefaultInterval(),
                props.getDefaultUnit(),
                props.getDefaultMisfireInstruction());

        log.info("interval4j schedule defaults: interval={}, unit={}, misfireInstruction={}",
                factory.getDefaultInterval(),
                factory.getDefaultUnit(),
                factory.getDefaultMisfireInstruction());
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleDocumentCodec scheduleDocumentCodec(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return new ScheduleDocumentCodec(objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }
}
