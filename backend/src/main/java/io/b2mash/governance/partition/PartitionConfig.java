package io.b2mash.governance.partition;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PartitionProperties.class)
public class PartitionConfig {}
