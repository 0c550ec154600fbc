package github.sarthakdev143.executive_summary.model;

/**
 * Square grid of fixed-size tiles. The side is the integer square root of the frame count, so when the
 * count is not a perfect square only {@code side * side} frames are laid out and the rest are dropped.
 */
public record MosaicGeometry(int frameCount, int side, int tileSize) {

    public static MosaicGeometry forFrames(int frameCount, int tileSize) {
        if (frameCount < 0) {
            throw new IllegalArgumentException("frameCount must not be negative.");
        }
        if (tileSize <= 0) {
            throw new IllegalArgumentException("tileSize must be positive.");
        }
        return new MosaicGeometry(frameCount, (int) Math.floor(Math.sqrt(frameCount)), tileSize);
    }

    public int canvasSize() {
        return side * tileSize;
    }

    public int placedFrames() {
        return side * side;
    }

    public int column(int index) {
        return index % side;
    }

    public int row(int index) {
        return index / side;
    }

    public int x(int index) {
        return column(index) * tileSize;
    }

    public int y(int index) {
        return row(index) * tileSize;
    }
}
