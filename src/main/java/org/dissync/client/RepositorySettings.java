package org.dissync.client;

import com.typesafe.config.Config;

/**
 * Naming conventions of a sync repository.
 *
 * @param branchPrefix Prefix of every sync branch; a user's branch is the prefix plus the user name.
 * @param remoteName   Name of the shared remote.
 * @param hashFile     Root-level file holding the content hash of the analysed binary.
 */
public record RepositorySettings(String branchPrefix, String remoteName, String hashFile) {

    public static final String ROOT_BRANCH_SUFFIX = "__root__";

    public static RepositorySettings defaults() {
        return new RepositorySettings("dissync/", "origin", "binary_hash");
    }

    /**
     * Reads the settings from a {@code dissync.repository} block.
     */
    public static RepositorySettings fromConfig(Config config) {
        return new RepositorySettings(
                config.getString("branch-prefix"),
                config.getString("remote-name"),
                config.getString("hash-file"));
    }

    /**
     * The branch that holds the repository-wide records every user branch starts from.
     */
    public String rootBranch() {
        return branchPrefix + ROOT_BRANCH_SUFFIX;
    }

    public String userBranch(String user) {
        return branchPrefix + user;
    }
}
