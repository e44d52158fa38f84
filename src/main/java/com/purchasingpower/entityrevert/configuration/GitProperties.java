package com.purchasingpower.entityrevert.configuration;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GitProperties {

    @NotBlank
    private String authorName = "VersionPress";

    @NotBlank
    @Email
    private String authorEmail = "versionpress@localhost";
}
