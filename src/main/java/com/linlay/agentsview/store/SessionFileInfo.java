package com.linlay.agentsview.store;

/**
 * Last persisted size and content hash of a session's source file.
 */
public record SessionFileInfo(long size, String hash) {
}
