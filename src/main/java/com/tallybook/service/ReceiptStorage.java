package com.tallybook.service;

import com.tallybook.config.StorageProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

@Component
public class ReceiptStorage {
  private static final Logger log = LoggerFactory.getLogger(ReceiptStorage.class);
  static final String REFERENCE_PREFIX = "/uploads/";

  private final Path root;

  public ReceiptStorage(StorageProperties properties) {
    this.root = Paths.get(properties.uploadDir()).toAbsolutePath().normalize();
  }

  public String store(MultipartFile file) {
    String storedName = UUID.randomUUID() + extensionOf(file.getOriginalFilename());
    Path target = root.resolve(storedName);
    try (InputStream in = file.getInputStream()) {
      Files.createDirectories(root);
      Files.copy(in, target);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to store receipt file " + storedName, ex);
    }
    return REFERENCE_PREFIX + storedName;
  }

  public boolean delete(String reference) {
    Optional<Path> path = locate(fileNameOf(reference));
    if (path.isEmpty()) {
      log.warn("Receipt file reference {} does not point inside the upload area", reference);
      return false;
    }
    try {
      boolean deleted = Files.deleteIfExists(path.get());
      if (!deleted) {
        log.warn("Receipt file {} was already gone", reference);
      }
      return deleted;
    } catch (IOException ex) {
      log.warn("Could not delete receipt file {}: {}", reference, ex.getMessage());
      return false;
    }
  }

  public Optional<Path> resolveExisting(String fileName) {
    return locate(fileName).filter(Files::isRegularFile);
  }

  public static String referenceFor(String fileName) {
    return REFERENCE_PREFIX + fileName;
  }

  public static MediaType contentTypeFor(String fileName) {
    String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
      return MediaType.IMAGE_JPEG;
    }
    if (lower.endsWith(".png")) {
      return MediaType.IMAGE_PNG;
    }
    if (lower.endsWith(".pdf")) {
      return MediaType.APPLICATION_PDF;
    }
    return MediaType.APPLICATION_OCTET_STREAM;
  }

  private Optional<Path> locate(String fileName) {
    if (fileName == null || fileName.isBlank()
        || fileName.contains("/") || fileName.contains("\\") || fileName.contains("..")) {
      return Optional.empty();
    }
    Path candidate = root.resolve(fileName).normalize();
    if (!candidate.startsWith(root)) {
      return Optional.empty();
    }
    return Optional.of(candidate);
  }

  private static String fileNameOf(String reference) {
    if (reference == null) {
      return null;
    }
    return reference.startsWith(REFERENCE_PREFIX) ? reference.substring(REFERENCE_PREFIX.length()) : reference;
  }

  private static String extensionOf(String originalName) {
    if (originalName == null) {
      return "";
    }
    String name = Paths.get(originalName).getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return "";
    }
    return name.substring(dot);
  }
}
