package org.dissync.client;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.transport.URIish;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.PathFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * A {@link SyncRepository} on top of a git working copy, driven through JGit.
 * <p>
 * Every user commits to their own branch ({@code <prefix><user>}), forked from a root branch that
 * carries the binary hash. Within a branch the user's files live in a directory named after the
 * user. Because nobody else ever writes a user's branch, fetching never needs a merge.
 * <p>
 * All operations are serialized on this instance.
 */
public final class GitSyncRepository implements SyncRepository {

    private static final Logger LOG = LoggerFactory.getLogger(GitSyncRepository.class);
    private static final String STAGING_DIR = "dissync-staging";
    private static final String PREVIOUS_DIR = "dissync-previous";

    private final Git git;
    private final Path workTree;
    private final String user;
    private final RepositorySettings settings;

    private GitSyncRepository(Git git, String user, RepositorySettings settings) {
        this.git = git;
        this.workTree = git.getRepository().getWorkTree().toPath();
        this.user = user;
        this.settings = settings;
    }

    /**
     * Opens a sync repository and checks out the user's branch, creating it when needed.
     *
     * @param path       The working copy location.
     * @param user       The local user.
     * @param initRepo   Create a new sync repository at {@code path} (and publish it when a remote is given).
     * @param remoteUrl  The shared remote; used to clone when {@code path} is not a repository yet.
     * @param binaryHash Recorded in a newly created repository.
     * @param settings   Naming conventions.
     * @return The opened repository.
     * @throws IOException if the repository cannot be created, cloned or opened.
     */
    public static GitSyncRepository open(Path path, String user, boolean initRepo, String remoteUrl,
                                         String binaryHash, RepositorySettings settings) throws IOException {
        Git git;
        boolean existing = Files.isDirectory(path.resolve(Constants.DOT_GIT));
        try {
            if (initRepo) {
                if (existing) {
                    throw new IOException("Cannot initialize a sync repository at " + path + ": it is already a git repository");
                }
                git = initialize(path, user, remoteUrl, binaryHash, settings);
            } else if (!existing) {
                if (remoteUrl == null || remoteUrl.isBlank()) {
                    throw new IOException("No sync repository at " + path + " and no remote to clone from");
                }
                LOG.info("Cloning sync repository from {} into {}", remoteUrl, path);
                git = Git.cloneRepository()
                        .setURI(remoteUrl)
                        .setDirectory(path.toFile())
                        .setRemote(settings.remoteName())
                        .setBranch(Constants.R_HEADS + settings.rootBranch())
                        .call();
            } else {
                git = Git.open(path.toFile());
            }
        } catch (GitAPIException e) {
            throw new IOException("Failed to open sync repository at " + path + ": " + e.getMessage(), e);
        }

        GitSyncRepository repository = new GitSyncRepository(git, user, settings);
        try {
            repository.checkoutUserBranch();
        } catch (IOException e) {
            git.close();
            throw e;
        }
        return repository;
    }

    private static Git initialize(Path path, String user, String remoteUrl, String binaryHash,
                                  RepositorySettings settings) throws GitAPIException, IOException {
        LOG.info("Initializing sync repository at {}", path);
        Files.createDirectories(path);
        Git git = Git.init()
                .setDirectory(path.toFile())
                .setInitialBranch(settings.rootBranch())
                .call();
        try {
            Files.writeString(path.resolve(settings.hashFile()), binaryHash == null ? "" : binaryHash,
                    StandardCharsets.UTF_8);
            git.add().addFilepattern(settings.hashFile()).call();
            PersonIdent ident = identity(user);
            git.commit().setMessage("Initialize sync repository").setAuthor(ident).setCommitter(ident).call();

            if (remoteUrl != null && !remoteUrl.isBlank()) {
                git.remoteAdd().setName(settings.remoteName()).setUri(new URIish(remoteUrl)).call();
                pushBranch(git, settings.remoteName(), settings.rootBranch());
            }
            return git;
        } catch (URISyntaxException e) {
            git.close();
            throw new IOException("Invalid remote URL '" + remoteUrl + "'", e);
        } catch (GitAPIException | IOException e) {
            git.close();
            throw e;
        }
    }

    private void checkoutUserBranch() throws IOException {
        Repository repo = git.getRepository();
        String branch = settings.userBranch(user);
        try {
            if (repo.exactRef(Constants.R_HEADS + branch) != null) {
                if (!branch.equals(repo.getBranch())) {
                    git.checkout().setName(branch).call();
                }
                return;
            }
            String startPoint = firstExisting(remoteRef(branch), Constants.R_HEADS + settings.rootBranch(),
                    remoteRef(settings.rootBranch()));
            if (startPoint == null) {
                throw new IOException("Repository at " + workTree + " is not a sync repository: no branch "
                        + settings.rootBranch());
            }
            LOG.debug("Creating branch {} from {}", branch, startPoint);
            git.checkout().setCreateBranch(true).setName(branch).setStartPoint(startPoint).call();
        } catch (GitAPIException e) {
            throw new IOException("Failed to check out branch " + branch + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getUser() {
        return user;
    }

    @Override
    public synchronized boolean hasRemote() {
        return git.getRepository().getRemoteNames().contains(settings.remoteName());
    }

    @Override
    public synchronized void fetch() throws IOException {
        try {
            git.fetch().setRemote(settings.remoteName()).setRemoveDeletedRefs(true).call();
        } catch (GitAPIException e) {
            throw new IOException("Fetch from " + settings.remoteName() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void push() throws IOException {
        try {
            pushBranch(git, settings.remoteName(), settings.userBranch(user));
        } catch (GitAPIException e) {
            throw new IOException("Push to " + settings.remoteName() + " failed: " + e.getMessage(), e);
        }
    }

    private static void pushBranch(Git git, String remote, String branch) throws GitAPIException, IOException {
        String ref = Constants.R_HEADS + branch;
        Iterable<PushResult> results = git.push()
                .setRemote(remote)
                .setRefSpecs(new RefSpec(ref + ":" + ref))
                .call();
        for (PushResult result : results) {
            for (RemoteRefUpdate update : result.getRemoteUpdates()) {
                RemoteRefUpdate.Status status = update.getStatus();
                if (status != RemoteRefUpdate.Status.OK && status != RemoteRefUpdate.Status.UP_TO_DATE) {
                    throw new IOException("Remote rejected " + update.getRemoteName() + ": " + status);
                }
            }
        }
    }

    @Override
    public synchronized boolean commit(Map<String, byte[]> files, String message) throws IOException {
        Path gitDir = git.getRepository().getDirectory().toPath();
        Path staging = gitDir.resolve(STAGING_DIR);
        Path previous = gitDir.resolve(PREVIOUS_DIR);
        Path userDir = workTree.resolve(user);

        deleteRecursively(staging);
        deleteRecursively(previous);
        Files.createDirectories(staging);
        for (Map.Entry<String, byte[]> file : files.entrySet()) {
            Path target = staging.resolve(file.getKey()).normalize();
            if (!target.startsWith(staging)) {
                throw new IOException("File path escapes the user directory: " + file.getKey());
            }
            Files.createDirectories(target.getParent());
            Files.write(target, file.getValue());
        }

        boolean hadPrevious = Files.exists(userDir);
        try {
            if (hadPrevious) {
                Files.move(userDir, previous, StandardCopyOption.ATOMIC_MOVE);
            }
            Files.move(staging, userDir, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (hadPrevious && Files.exists(previous) && !Files.exists(userDir)) {
                Files.move(previous, userDir, StandardCopyOption.ATOMIC_MOVE);
            }
            throw e;
        }
        deleteRecursively(previous);

        try {
            git.add().addFilepattern(user).call();
            git.add().addFilepattern(user).setUpdate(true).call();
            Status status = git.status().addPath(user).call();
            if (status.getAdded().isEmpty() && status.getChanged().isEmpty() && status.getRemoved().isEmpty()) {
                LOG.debug("Nothing to commit for user '{}'", user);
                return false;
            }
            PersonIdent ident = identity(user);
            RevCommit commit = git.commit().setMessage(message).setAuthor(ident).setCommitter(ident).call();
            LOG.debug("Committed {} for user '{}'", commit.getId().abbreviate(8).name(), user);
            return true;
        } catch (GitAPIException e) {
            restoreWorkTree();
            throw new IOException("Commit for user '" + user + "' failed: " + e.getMessage(), e);
        }
    }

    private void restoreWorkTree() {
        try {
            git.reset().setMode(ResetCommand.ResetType.HARD).call();
            git.clean().setCleanDirectories(true).setPaths(Set.of(user)).call();
        } catch (GitAPIException e) {
            LOG.error("Failed to restore the working copy of user '{}' after a failed commit: {}", user, e.getMessage());
        }
    }

    @Override
    public synchronized Optional<StoredSnapshot> read(String targetUser, String version) throws IOException {
        ObjectId commitId = resolveUserCommit(targetUser, version);
        if (commitId == null) {
            return Optional.empty();
        }
        Repository repo = git.getRepository();
        Map<String, byte[]> files = new TreeMap<>();
        try (RevWalk walk = new RevWalk(repo)) {
            RevCommit commit = walk.parseCommit(commitId);
            try (TreeWalk treeWalk = new TreeWalk(repo)) {
                treeWalk.addTree(commit.getTree());
                treeWalk.setRecursive(true);
                treeWalk.setFilter(PathFilter.create(targetUser));
                String prefix = targetUser + "/";
                while (treeWalk.next()) {
                    String path = treeWalk.getPathString();
                    if (path.startsWith(prefix)) {
                        files.put(path.substring(prefix.length()), repo.open(treeWalk.getObjectId(0)).getBytes());
                    }
                }
            }
            return Optional.of(new StoredSnapshot(commit.getName(), files));
        }
    }

    private ObjectId resolveUserCommit(String targetUser, String version) throws IOException {
        Repository repo = git.getRepository();
        if (version != null) {
            ObjectId id = repo.resolve(version);
            if (id == null) {
                throw new IOException("Unknown version '" + version + "'");
            }
            return id;
        }
        String branch = settings.userBranch(targetUser);
        String ref = targetUser.equals(user)
                ? firstExisting(Constants.R_HEADS + branch)
                : firstExisting(remoteRef(branch), Constants.R_HEADS + branch);
        return ref == null ? null : repo.resolve(ref);
    }

    @Override
    public synchronized Optional<String> readRootFile(String name) throws IOException {
        String ref = firstExisting(Constants.R_HEADS + settings.rootBranch(), remoteRef(settings.rootBranch()));
        if (ref == null) {
            return Optional.empty();
        }
        Repository repo = git.getRepository();
        try (RevWalk walk = new RevWalk(repo)) {
            RevCommit commit = walk.parseCommit(repo.resolve(ref));
            try (TreeWalk treeWalk = TreeWalk.forPath(repo, name, commit.getTree())) {
                if (treeWalk == null) {
                    return Optional.empty();
                }
                return Optional.of(new String(repo.open(treeWalk.getObjectId(0)).getBytes(), StandardCharsets.UTF_8));
            }
        }
    }

    @Override
    public synchronized List<String> users() throws IOException {
        TreeSet<String> names = new TreeSet<>();
        String localPrefix = Constants.R_HEADS + settings.branchPrefix();
        String remotePrefix = Constants.R_REMOTES + settings.remoteName() + "/" + settings.branchPrefix();
        for (String prefix : List.of(localPrefix, remotePrefix)) {
            for (Ref ref : git.getRepository().getRefDatabase().getRefsByPrefix(prefix)) {
                String name = ref.getName().substring(prefix.length());
                if (!name.equals(RepositorySettings.ROOT_BRANCH_SUFFIX)) {
                    names.add(name);
                }
            }
        }
        return new ArrayList<>(names);
    }

    @Override
    public synchronized void close() {
        git.close();
    }

    private String remoteRef(String branch) {
        return Constants.R_REMOTES + settings.remoteName() + "/" + branch;
    }

    private String firstExisting(String... refs) throws IOException {
        for (String ref : refs) {
            if (git.getRepository().exactRef(ref) != null) {
                return ref;
            }
        }
        return null;
    }

    private static PersonIdent identity(String user) {
        return new PersonIdent(user, user + "@dissync");
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }
}
