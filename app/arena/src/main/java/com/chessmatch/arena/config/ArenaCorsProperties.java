package com.chessmatch.arena.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "arena.cors")
public record ArenaCorsProperties(List<String> allowedOrigins) {

  public ArenaCorsProperties {
    allowedOrigins =
        allowedOrigins == null || allowedOrigins.isEmpty()
            ? List.of("http://localhost:3000")
            : List.copyOf(allowedOrigins);
  }
}
