package flowbuf.infomodel;

import java.io.IOException;

/**
 * Bulk registration of information elements from an external description.
 */
@FunctionalInterface
public interface ElementLoader {
    void load(InfoModel model) throws IOException;
}
