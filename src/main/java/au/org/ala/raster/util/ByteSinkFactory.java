package au.org.ala.raster.util;

import com.google.common.io.ByteSink;
import com.google.common.io.ByteSource;

import java.io.IOException;

public interface ByteSinkFactory {
    void prepare() throws IOException;
    ByteSink getByteSinkForNames(String... names);

    /**
     * @return a source for a previously written entry, or null if nothing exists under those names
     */
    ByteSource getByteSourceForNames(String... names);
}
