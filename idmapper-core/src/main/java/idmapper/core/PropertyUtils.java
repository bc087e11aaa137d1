/* 
 * Copyright (C) 2025 IDMAPPER developers
 *
 * This File is part of IDMAPPER
 *
 * IDMAPPER is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * IDMAPPER is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with IDMAPPER.  If not, see <http://www.gnu.org/licenses/>.
 */
package idmapper.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.FileReader;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Persistent user settings, stored in {@code ~/.idmapper.cfg} or in the file given by the {@value #CONFIG_FILE_PROPERTY} system property
 */
public class PropertyUtils {
    public final static Logger logger = LoggerFactory.getLogger(PropertyUtils.class);
    public final static String CONFIG_FILE_PROPERTY = "idmapper.config";
    private static Properties props;
    public final static String CAST = "cast";

    public static synchronized Properties getProps() {
        if (props == null) {
            props = new Properties();
            File f = getFile();
            if (f.exists()) {
                try (Reader r = new FileReader(f)) {
                    props.load(r);
                } catch (IOException e) {
                    logger.error("Error while trying to load property file", e);
                }
            }
        }
        return props;
    }

    /**
     * Forces the property file to be read again at next access
     */
    public static synchronized void reload() {
        props = null;
    }

    public static String get(String key) {
        return getProps().getProperty(key);
    }
    public static String get(String key, String defaultValue) {
        return getProps().getProperty(key, defaultValue);
    }
    public static void set(String key, String value) {
        if (value!=null) {
            getProps().setProperty(key, value);
            saveParamChanges();
        }
        else remove(key);
    }
    public static void set(String key, int value) {
        getProps().setProperty(key, Integer.toString(value));
        saveParamChanges();
    }
    public static void set(String key, double value) {
        getProps().setProperty(key, Double.toString(value));
        saveParamChanges();
    }
    public static void set(String key, boolean value) {
        getProps().setProperty(key, Boolean.toString(value));
        saveParamChanges();
    }
    public static void remove(String key) {
        getProps().remove(key);
        saveParamChanges();
    }
    public static boolean get(String key, boolean defaultValue) {
        return Boolean.parseBoolean(getProps().getProperty(key, Boolean.toString(defaultValue)));
    }
    public static int get(String key, int defaultValue) {
        String v = getProps().getProperty(key);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            logger.warn("invalid integer for property {}: {}", key, v);
            return defaultValue;
        }
    }
    public static double get(String key, double defaultValue) {
        String v = getProps().getProperty(key);
        if (v == null) return defaultValue;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            logger.warn("invalid number for property {}: {}", key, v);
            return defaultValue;
        }
    }
    public static void setStrings(String key, List<String> values) {
        if (values==null) values=Collections.emptyList();
        for (int i = 0; i<values.size(); ++i) {
            getProps().setProperty(key+"_"+i, values.get(i));
        }
        int idx = values.size();
        while(getProps().containsKey(key+"_"+idx)) {
            getProps().remove(key+"_"+idx);
            ++idx;
        }
        saveParamChanges();
    }
    public static List<String> getStrings(String key) {
        List<String> res = new ArrayList<>();
        int idx = 0;
        String next = get(key+"_"+idx);
        while(next!=null) {
            res.add(next);
            ++idx;
            next = get(key+"_"+idx);
        }
        return res;
    }
    public static synchronized void saveParamChanges() {
        File f = getFile();
        try (OutputStream out = new FileOutputStream(f)) {
            getProps().store(out, "IDMAPPER settings");
        } catch (IOException e) {
            logger.error("Error while trying to save to property file: "+f, e);
        }
    }

    public static File getFile() {
        String path = System.getProperty(CONFIG_FILE_PROPERTY, System.getProperty("user.home") + "/.idmapper.cfg");
        return new File(path);
    }
}
