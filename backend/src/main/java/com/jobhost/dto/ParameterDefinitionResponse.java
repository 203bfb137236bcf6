package com.jobhost.dto;

import com.jobhost.model.ParameterDefinition;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParameterDefinitionResponse {
    private String name;
    private String type;
    private boolean required;
    private String defaultValue;
    private String description;

    public static ParameterDefinitionResponse from(ParameterDefinition definition) {
        return ParameterDefinitionResponse.builder()
                .name(definition.getName())
                .type(definition.getType())
                .required(definition.isRequired())
                .defaultValue(definition.getDefaultValue())
                .description(definition.getDescription())
                .build();
    }
}
