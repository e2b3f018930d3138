package io;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the embedded JPEG preview of a Sony .ARW through ImageIO. Sensor data is not decoded.
 */
final class ArwPreviewReader {

    private ArwPreviewReader() {
    }

    static BufferedImage loadPreview(Path arwPath) throws DecodeException {
        try (InputStream in = Files.newInputStream(arwPath)) {
            BufferedImage img = ImageIO.read(in);
            if (img == null)
                throw new DecodeException(arwPath, "No readable embedded preview in " + arwPath.getFileName());
            return img;
        } catch (IIOException iioe) {
            // lossless JPEG variants (SOF 0xC3/0xC6) are not supported by the stock ImageIO readers
            throw new DecodeException(arwPath, "RAW preview decode failed for " + arwPath.getFileName()
                    + ": " + iioe.getMessage(), iioe);
        } catch (DecodeException e) {
            throw e;
        } catch (IOException ioe) {
            throw new DecodeException(arwPath, "Failed to read RAW file " + arwPath + ": " + ioe.getMessage(), ioe);
        } catch (RuntimeException e) {
            throw new DecodeException(arwPath, "Corrupt embedded preview in " + arwPath.getFileName() + ": " + e, e);
        }
    }
}
