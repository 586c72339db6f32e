package com.acme.hotdog.router.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Build metadata stamped into the jar at package time.
 */
public final class BuildInfo {
    private static final Logger LOG = Logger.getLogger(BuildInfo.class.getName());
    private static final String RESOURCE = "/hotdog-build.properties";
    private static final String UNKNOWN = "unknown";
    private static final String VERSION = loadVersion();

    private BuildInfo() {
    }

    public static String version() {
        return VERSION;
    }

    private static String loadVersion() {
        try (InputStream in = BuildInfo.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return UNKNOWN;
            }
            Properties props = new Properties();
            props.load(in);
            String version = props.getProperty("version", UNKNOWN).trim();
            // unfiltered resource when running from an IDE
            if (version.isEmpty() || version.startsWith("${")) {
                return UNKNOWN;
            }
            return version;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to read " + RESOURCE, e);
            return UNKNOWN;
        }
    }
}
