package com.purchasingpower.entityrevert.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StorageProperties {

    /** Entity store directory, relative to the repository directory. */
    @NotBlank
    private String root = "vpdb";
}
