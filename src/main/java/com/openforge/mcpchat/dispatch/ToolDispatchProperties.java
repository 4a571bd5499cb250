package com.openforge.mcpchat.dispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/** Upper bound on a single tool invocation, under "agent.dispatch". */
@ConfigurationProperties(prefix = "agent.dispatch")
public record ToolDispatchProperties(
        @DefaultValue("60s") Duration timeout
) {}
