package au.org.ala.raster.tiling;

import au.org.ala.raster.util.ByteSinkFactory;
import com.google.common.io.ByteSink;
import com.google.common.io.ByteSource;

import java.io.IOException;

/**
 * Where tiles live, addressed by level, column and row. The path based sink lays them out the Deep Zoom way:
 * {@code <level>/<col>_<row>.<ext>}.
 */
public interface TilerSink {

    LevelSink getLevelSink(int level);

    interface LevelSink {
        ColumnSink getColumnSink(int col);
    }

    interface ColumnSink {
        ByteSink getTileSink(int row);

        /**
         * @return the stored tile, or null if it has not been written
         */
        ByteSource getTileSource(int row);
    }

    class PathBasedTilerSink implements TilerSink {

        private final ByteSinkFactory byteSinkFactory;
        private final TileFormat tileFormat;

        public PathBasedTilerSink(ByteSinkFactory byteSinkFactory, TileFormat tileFormat) throws IOException {
            this.byteSinkFactory = byteSinkFactory;
            this.tileFormat = tileFormat;
            this.byteSinkFactory.prepare();
        }

        public class LevelSink implements TilerSink.LevelSink {

            private final int level;

            LevelSink(int level) {
                this.level = level;
            }

            @Override
            public ColumnSink getColumnSink(int col) {
                return new ColumnSink(col);
            }

            public class ColumnSink implements TilerSink.ColumnSink {

                private final int col;

                ColumnSink(int col) {
                    this.col = col;
                }

                @Override
                public ByteSink getTileSink(int row) {
                    return byteSinkFactory.getByteSinkForNames(Integer.toString(level), tileName(row));
                }

                @Override
                public ByteSource getTileSource(int row) {
                    return byteSinkFactory.getByteSourceForNames(Integer.toString(level), tileName(row));
                }

                private String tileName(int row) {
                    return col + "_" + row + "." + tileFormat.getExtension();
                }
            }
        }

        @Override
        public LevelSink getLevelSink(int level) {
            return new LevelSink(level);
        }
    }
}
