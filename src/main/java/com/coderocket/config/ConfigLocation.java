package com.coderocket.config;

import java.nio.file.Path;

/**
 * Directory and settings file for one {@link ConfigScope}.
 */
public record ConfigLocation(Path dir, Path file) {
}
