package org.dissync.client;

import java.util.Map;

/**
 * The files of one user's directory as committed at one version.
 *
 * @param version The commit id the files were read from.
 * @param files   File contents keyed by path relative to the user's directory.
 */
public record StoredSnapshot(String version, Map<String, byte[]> files) {
}
