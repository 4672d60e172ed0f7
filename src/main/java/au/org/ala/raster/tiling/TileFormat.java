package au.org.ala.raster.tiling;

public enum TileFormat {
    PNG("png", "png"),
    JPEG("jpeg", "jpg");

    private final String imageIoName;
    private final String extension;

    TileFormat(String imageIoName, String extension) {
        this.imageIoName = imageIoName;
        this.extension = extension;
    }

    /** Format name understood by {@link javax.imageio.ImageIO#write}. */
    public String getImageIoName() {
        return imageIoName;
    }

    /** File extension, also the {@code Format} attribute of the Deep Zoom manifest. */
    public String getExtension() {
        return extension;
    }
}
