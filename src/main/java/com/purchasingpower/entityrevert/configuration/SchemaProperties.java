package com.purchasingpower.entityrevert.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SchemaProperties {

    /** Spring resource location of the entity schema. */
    @NotBlank
    private String location = "classpath:schema.yml";
}
