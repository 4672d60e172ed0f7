package au.org.ala.raster.util;

import com.google.common.io.ByteSink;
import com.google.common.io.ByteSource;
import com.google.common.io.MoreFiles;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FileByteSinkFactory implements ByteSinkFactory {

    public static final Logger log = LoggerFactory.getLogger(FileByteSinkFactory.class);

    final File parentDir;
    final boolean cleanParentDir;

    public FileByteSinkFactory(File parentDir) {
        this(parentDir, true);
    }

    /**
     * @param cleanParentDir false when resuming a run, so tiles written by the previous process are kept
     */
    public FileByteSinkFactory(File parentDir, boolean cleanParentDir) {
        this.parentDir = parentDir;
        this.cleanParentDir = cleanParentDir;
    }

    public File getParentDir() {
        return parentDir;
    }

    @Override
    public void prepare() throws IOException {
        if (parentDir.exists() && cleanParentDir) {
            log.info("Removing existing tile directory: {}", parentDir);
            FileUtils.deleteDirectory(parentDir);
        }
        FileUtils.forceMkdir(parentDir);
    }

    @Override
    public ByteSink getByteSinkForNames(String... names) {
        Path path = Paths.get(parentDir.getAbsolutePath(), names);
        File parent = path.getParent().toFile();
        if (!parent.exists() && !parent.mkdirs() && !parent.isDirectory()) {
            log.error("Unable to create directories for {}", path);
        }
        return MoreFiles.asByteSink(path);
    }

    @Override
    public ByteSource getByteSourceForNames(String... names) {
        Path path = Paths.get(parentDir.getAbsolutePath(), names);
        if (!Files.isRegularFile(path)) {
            return null;
        }
        return MoreFiles.asByteSource(path);
    }
}
