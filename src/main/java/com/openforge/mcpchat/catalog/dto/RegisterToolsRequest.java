package com.openforge.mcpchat.catalog.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.mcpchat.catalog.ToolSchema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of PUT /api/catalog/servers/{serverId}/tools: the server's tools/list
 * result as reported by connection management.
 */
public record RegisterToolsRequest(

        @NotNull
        List<@Valid ToolDefinition> tools
) {

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record ToolDefinition(
            @NotBlank String name,
            String description,
            JsonNode inputSchema
    ) {
        public ToolSchema toSchema() {
            return new ToolSchema(name, description, inputSchema);
        }
    }
}
