package com.example.demo.deckgen.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "deckgen.validation")
public class ValidationProperties {

    /**
     * Reject slides carrying more than one table.
     */
    private boolean singleTablePerSlide = false;
}
