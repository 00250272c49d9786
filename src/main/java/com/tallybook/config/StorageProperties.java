package com.tallybook.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "tallybook.storage")
public record StorageProperties(String uploadDir, DataSize maxFileSize, List<String> allowedContentTypes) {
  public StorageProperties {
    if (uploadDir == null || uploadDir.isBlank()) {
      uploadDir = "uploads";
    }
    if (maxFileSize == null) {
      maxFileSize = DataSize.ofMegabytes(5);
    }
    if (allowedContentTypes == null || allowedContentTypes.isEmpty()) {
      allowedContentTypes = List.of("image/jpeg", "image/png", "application/pdf");
    }
  }
}
