/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.stompy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Provides version information for the Stompy Java SDK.
 *
 * <p>Version information is read from a properties file filtered at build time.
 */
public final class StompyVersion {

    private static final Logger log = LoggerFactory.getLogger(StompyVersion.class);
    private static final String PROPERTIES_FILE = "/stompy-version.properties";
    private static final String UNKNOWN = "unknown";

    private static final StompyVersion INSTANCE = load(PROPERTIES_FILE);

    private final String version;
    private final String buildTime;
    private final String gitCommit;

    StompyVersion(String version, String buildTime, String gitCommit) {
        this.version = version;
        this.buildTime = buildTime;
        this.gitCommit = gitCommit;
    }

    static StompyVersion load(String resource) {
        String version = UNKNOWN;
        String buildTime = UNKNOWN;
        String gitCommit = UNKNOWN;

        try (InputStream is = StompyVersion.class.getResourceAsStream(resource)) {
            if (is != null) {
                Properties props = new Properties();
                props.load(is);
                version = known(props.getProperty("version"));
                buildTime = known(props.getProperty("buildTime"));
                gitCommit = known(props.getProperty("gitCommit"));
            }
        } catch (IOException e) {
            log.warn("Failed to read version information from {}", resource, e);
        }
        return new StompyVersion(version, buildTime, gitCommit);
    }

    // unfiltered ${...} placeholders count as unknown
    private static String known(String value) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return UNKNOWN;
        }
        return value;
    }

    public static StompyVersion getInstance() {
        return INSTANCE;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Gets the build timestamp.
     *
     * @return the build time as ISO-8601 string, or "unknown" if not available
     */
    public String getBuildTime() {
        return buildTime;
    }

    public String getGitCommit() {
        return gitCommit;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Stompy Java SDK ").append(version);
        if (!UNKNOWN.equals(buildTime)) {
            sb.append(" (built: ").append(buildTime);
            if (!UNKNOWN.equals(gitCommit)) {
                sb.append(", commit: ").append(gitCommit);
            }
            sb.append(")");
        }
        return sb.toString();
    }
}
