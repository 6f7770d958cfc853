package com.schemacraft.generator.codegen.util;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.codegen.SynthesisOutput;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;

/**
 * Materializes a {@link SynthesisOutput} into a directory.
 *
 * Files are first written to a scratch directory private to this call, next to the target,
 * and moved into place only once every file is written. A failed write leaves the target
 * untouched.
 */
public class ProjectWriter {
    private static final Logger log = LoggerFactory.getLogger(ProjectWriter.class);

    private static final String SCRATCH_PREFIX = ".schemacraft-";

    /**
     * @param overwrite replace an existing non-empty target directory
     * @return the target directory
     * @throws FileAlreadyExistsException if the target is non-empty and overwrite is off
     */
    public Path write(SynthesisOutput output, Path targetDir, boolean overwrite) throws IOException {
        Path target = targetDir.toAbsolutePath().normalize();
        if (FileWriteUtil.isNonEmptyDirectory(target) && !overwrite) {
            throw new FileAlreadyExistsException(target.toString(), null,
                    "Output directory is not empty (use --force to overwrite)");
        }
        if (Files.exists(target) && !Files.isDirectory(target)) {
            throw new FileAlreadyExistsException(target.toString(), null, "Output path is a file");
        }

        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path scratch = Files.createTempDirectory(parent, SCRATCH_PREFIX);
        try {
            for (GeneratedFile file : output.getFiles().values()) {
                FileWriteUtil.safeWriteString(scratch.resolve(file.getPath()), file.getContents());
            }
            FileWriteUtil.deleteDirectory(target);
            Files.move(scratch, target);
        } finally {
            FileWriteUtil.deleteDirectory(scratch);
        }

        log.info("Wrote {} files to {}", output.size(), target);
        return target;
    }
}
