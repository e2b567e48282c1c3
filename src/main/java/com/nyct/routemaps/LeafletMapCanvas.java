package com.nyct.routemaps;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import freemarker.template.Configuration;
import freemarker.template.DefaultObjectWrapperBuilder;
import freemarker.template.SimpleHash;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.Version;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the map as a standalone HTML page drawn by Leaflet over OpenStreetMap tiles.
 */
public class LeafletMapCanvas implements MapCanvas {
    private static final Version FREEMARKER_VERSION = Configuration.VERSION_2_3_30;

    private static final String TEMPLATE_NAME = "routesMap.ftlh";

    private static final Configuration FREEMARKER_CONFIGURATION = createConfiguration();

    private final String title;

    private LatLon center;

    private int zoom;

    private final List<ImmutableList<LatLon>> polylines = new ArrayList<>();

    public LeafletMapCanvas(String title) {
        this.title = title;
    }

    @Override
    public void setCenter(double lat, double lon, int zoom) {
        this.center = new LatLon(lat, lon);
        this.zoom = zoom;
    }

    @Override
    public void addPolyline(List<LatLon> points) {
        polylines.add(ImmutableList.copyOf(points));
    }

    @Override
    public void save(Path path) throws IOException {
        Preconditions.checkState(center != null, "Map center has not been set");

        final SimpleHash root = new SimpleHash(new DefaultObjectWrapperBuilder(FREEMARKER_VERSION).build());
        root.put("title", title);
        root.put("center", center);
        root.put("zoom", zoom);
        root.put("polylines", polylines);

        final Template template = FREEMARKER_CONFIGURATION.getTemplate(TEMPLATE_NAME);

        try (final OutputStream os = Files.newOutputStream(path);
             final Writer out = new OutputStreamWriter(os, StandardCharsets.UTF_8)) {
            template.process(root, out);
        } catch (TemplateException e) {
            throw new IOException("Unable to render map " + path, e);
        }
    }

    @Override
    public String getFileExtension() {
        return "html";
    }

    private static Configuration createConfiguration() {
        final Configuration configuration = new Configuration(FREEMARKER_VERSION);
        configuration.setClassForTemplateLoading(LeafletMapCanvas.class, "");
        configuration.setDefaultEncoding("UTF-8");
        configuration.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        configuration.setLogTemplateExceptions(false);
        configuration.setWrapUncheckedExceptions(true);
        configuration.setFallbackOnNullLoopVariable(false);
        return configuration;
    }
}
