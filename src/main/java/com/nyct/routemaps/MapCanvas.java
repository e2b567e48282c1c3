package com.nyct.routemaps;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Something route lines can be drawn on and saved as a map file.
 */
public interface MapCanvas {

    void setCenter(double lat, double lon, int zoom);

    /**
     * Draws a connected line through the points, in order.
     */
    void addPolyline(List<LatLon> points);

    void save(Path path) throws IOException;

    /**
     * @return the extension, without dot, of the files {@link #save(Path)} writes.
     */
    String getFileExtension();
}
