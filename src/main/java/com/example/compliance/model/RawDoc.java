package com.example.compliance.model;

/**
 * Decoded procedure document as read from disk (or from the extraction service).
 *
 * @param path         source path
 * @param contentHash  SHA-256 of the file bytes
 * @param lastModified modification time in epoch milliseconds
 * @param text         decoded text
 */
public record RawDoc(String path, String contentHash, long lastModified, String text) {
}
