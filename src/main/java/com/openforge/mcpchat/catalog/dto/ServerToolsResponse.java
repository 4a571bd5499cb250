package com.openforge.mcpchat.catalog.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.mcpchat.catalog.ToolSchema;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ServerToolsResponse(String serverId, List<ToolSchema> tools) {}
