package org.kindred.compiler.build;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Removes a build output directory and everything in it.
 */
public class BuildDirectoryCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(BuildDirectoryCleaner.class);

    /**
     * Deletes the directory tree. An absent directory is not an error, so cleaning twice is safe.
     * Symbolic links inside the tree are removed, not followed.
     *
     * @param directory The output directory.
     * @return {@code true} if something was removed, {@code false} if the directory did not exist.
     * @throws IOException if the path is not a directory, is a file system root or the user's
     *                     home directory, or cannot be deleted.
     */
    public boolean clean(Path directory) throws IOException {
        Path absolute = directory.toAbsolutePath().normalize();
        if (Files.notExists(absolute)) {
            LOG.debug("Nothing to clean at {}", absolute);
            return false;
        }
        if (!Files.isDirectory(absolute)) {
            throw new IOException("Not a directory: " + absolute);
        }
        if (absolute.getParent() == null || absolute.equals(Path.of(System.getProperty("user.home")).toAbsolutePath().normalize())) {
            throw new IOException("Refusing to delete " + absolute);
        }

        Files.walkFileTree(absolute, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
        LOG.info("Removed {}", absolute);
        return true;
    }
}
