package com.flamingo.ai.stap.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Enables the periodic cache maintenance tasks. */
@Configuration
@EnableScheduling
public class SchedulingConfig {}
