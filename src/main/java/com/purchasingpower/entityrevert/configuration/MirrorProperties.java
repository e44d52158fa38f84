package com.purchasingpower.entityrevert.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class MirrorProperties {

    /** Prefix of every mirror table, e.g. {@code wp_posts}. */
    @NotNull
    @Pattern(regexp = "[A-Za-z0-9_]*")
    private String tablePrefix = "wp_";

    /** Zone of the "local" timestamps written to the mirror. */
    @NotBlank
    private String timeZone = "UTC";
}
