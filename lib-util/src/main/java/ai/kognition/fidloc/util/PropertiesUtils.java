/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.fidloc.util;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.Properties;

/**
 * Helpers for reading sectioned {@link Properties}. A section is the set of keys sharing
 * a dotted prefix, for example every {@code localizer.*} entry.
 */
public class PropertiesUtils {
    public static final String separator = ".";

    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();

        for(final Enumeration<?> e = props.propertyNames(); e.hasMoreElements();) {
            final String key = (String)(e.nextElement());
            if(key.startsWith(sectionName + separator)) {
                final String newkey = removeSectionName ? key.substring(sectionName.length() + 1) : key;

                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName) {
                ret.setProperty(key, props.getProperty(key));
            }
        }

        return ret;
    }

    public static Properties loadProps(final String fname) throws IOException {
        try(InputStream fis = new FileInputStream(fname);) {
            final Properties p = new Properties();
            p.load(fis);
            return p;
        }
    }

    public static double getDouble(final Properties p, final String key, final double defaultValue) {
        final String val = trimmed(p, key);
        if(val == null)
            return defaultValue;
        try {
            return Double.parseDouble(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" should be a number but was \"" + val + "\"", nfe);
        }
    }

    public static int getInt(final Properties p, final String key, final int defaultValue) {
        final String val = trimmed(p, key);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" should be an integer but was \"" + val + "\"", nfe);
        }
    }

    public static boolean getBoolean(final Properties p, final String key, final boolean defaultValue) {
        final String val = trimmed(p, key);
        if(val == null)
            return defaultValue;
        if("true".equalsIgnoreCase(val))
            return true;
        if("false".equalsIgnoreCase(val))
            return false;
        throw new IllegalArgumentException("The property \"" + key + "\" should be \"true\" or \"false\" but was \"" + val + "\"");
    }

    private static String trimmed(final Properties p, final String key) {
        final String val = p.getProperty(key);
        if(val == null)
            return null;
        final String ret = val.trim();
        return ret.length() == 0 ? null : ret;
    }
}
