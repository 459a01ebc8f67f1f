package com.reflector.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;

/**
 * Spring Boot auto-configuration exposing the reflector services, most notably the
 * {@link com.reflector.service.api.OperationReflectorFactory}, to the host application.
 */
@AutoConfiguration
@ComponentScan("com.reflector.service")
@EnableConfigurationProperties(ReflectorProperties.class)
public class ReflectorConfiguration {
}
