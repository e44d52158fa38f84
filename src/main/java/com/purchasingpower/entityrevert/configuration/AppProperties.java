package com.purchasingpower.entityrevert.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @NotBlank(message = "Repository directory (Git work tree of the entity store) is required")
    private String repositoryDir;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private StorageProperties storage = new StorageProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SchemaProperties schema = new SchemaProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GitProperties git = new GitProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private MirrorProperties mirror = new MirrorProperties();
}
