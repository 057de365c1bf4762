package org.broadinstitute.varspace.workspace;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.utils.tsv.TableFormat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Maps workspace-relative file ids onto paths under a workspace root, validates extensions and allocates
 * collision-free names.
 * <p>
 * File ids always use {@code /} as separator and never escape the root.
 * </p>
 */
public final class PathNamer {

    private final Path root;
    private final String requiredExtension;

    /**
     * @param root              the workspace root directory.
     * @param requiredExtension the extension required of merge and apply targets, e.g. {@code .csv}.
     */
    public PathNamer(final Path root, final String requiredExtension) {
        this.root = Utils.nonNull(root, "the workspace root cannot be null").toAbsolutePath().normalize();
        this.requiredExtension = normalizeExtension(Utils.nonEmpty(requiredExtension, "the required extension cannot be empty"));
    }

    public Path getRoot() {
        return root;
    }

    public String getRequiredExtension() {
        return requiredExtension;
    }

    /**
     * Resolves a file id to an absolute path under the workspace root.
     *
     * @throws UserException.ValidationError if the id is blank, absolute or points outside the workspace.
     */
    public Path resolve(final String fileId) {
        Utils.nonNull(fileId, "the file id cannot be null");
        if (StringUtils.isBlank(fileId)) {
            throw new UserException.ValidationError("the file id cannot be blank");
        }
        final Path relative = root.getFileSystem().getPath(fileId);
        if (relative.isAbsolute()) {
            throw new UserException.ValidationError("file id must be relative to the workspace: " + fileId);
        }
        final Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new UserException.ValidationError("file id points outside the workspace: " + fileId);
        }
        return resolved;
    }

    /**
     * Returns the file id of a path under the workspace root.
     */
    public String toFileId(final Path path) {
        final Path normalized = Utils.nonNull(path).toAbsolutePath().normalize();
        Utils.validateArg(normalized.startsWith(root), () -> path + " is not inside the workspace " + root);
        return Utils.stream(root.relativize(normalized)).map(Path::toString).collect(Collectors.joining("/"));
    }

    public boolean exists(final String fileId) {
        return Files.isRegularFile(resolve(fileId));
    }

    /**
     * @throws UserException.InvalidExtension if {@code fileId} does not end in the required extension.
     */
    public void requireExtension(final String fileId) {
        Utils.nonNull(fileId, "the file id cannot be null");
        if (!fileId.endsWith(requiredExtension) || fileId.length() == requiredExtension.length()) {
            throw new UserException.InvalidExtension(fileId, requiredExtension);
        }
    }

    /**
     * Validates a file id as the target of a mutating operation.
     *
     * @throws UserException.InvalidExtension if the extension is wrong.
     * @throws UserException.PathConflict     if the target exists and {@code override} is false.
     */
    public void checkTarget(final String fileId, final boolean override) {
        requireExtension(fileId);
        final Path target = resolve(fileId);
        if (Files.isDirectory(target) || (!override && Files.exists(target))) {
            throw new UserException.PathConflict(fileId);
        }
    }

    /**
     * Returns the table layout implied by the file's extension.
     *
     * @throws UserException.InvalidExtension if the extension is neither {@code .csv} nor {@code .tsv}.
     */
    public TableFormat formatOf(final String fileId) {
        return TableFormat.fromFileName(fileId).orElseThrow(() -> new UserException.InvalidExtension(fileId,
                Arrays.stream(TableFormat.values()).map(TableFormat::getExtension).collect(Collectors.joining(" or "))));
    }

    /**
     * Allocates a file id that does not yet exist: {@code directory/baseName.ext}, or {@code baseName_1.ext},
     * {@code baseName_2.ext} and so forth. Nothing is created on disk.
     *
     * @param directory workspace-relative directory; empty for the root.
     */
    public String createUnique(final String directory, final String baseName, final String extension) {
        Utils.nonNull(directory, "the directory cannot be null");
        Utils.nonEmpty(baseName, "the base name cannot be empty");
        Utils.validateArg(!StringUtils.containsAny(baseName, '/', '\\'), () -> "the base name cannot contain a path separator: " + baseName);
        final String ext = normalizeExtension(Utils.nonEmpty(extension, "the extension cannot be empty"));
        final String prefix = StringUtils.isBlank(directory) ? "" : StringUtils.removeEnd(directory, "/") + "/";

        String candidate = prefix + baseName + ext;
        for (int suffix = 1; Files.exists(resolve(candidate)); suffix++) {
            candidate = prefix + baseName + "_" + suffix + ext;
        }
        return candidate;
    }

    private static String normalizeExtension(final String extension) {
        return extension.startsWith(".") ? extension : "." + extension;
    }
}
