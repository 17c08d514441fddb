package com.threatsentinel.core.config;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML shape of the static threat-intelligence block lists: for each
 * indicator type, a map of source name to indicators.
 *
 * <pre>
 * ip:
 *   local: [1.2.3.4]
 *   cloud: [9.10.11.12]
 * domain:
 *   local: [malicious-domain.com]
 * </pre>
 *
 * @since 1.0.0
 */
public class ThreatIntelFeeds implements Serializable {

    private static final long serialVersionUID = 1L;

    private Map<String, List<String>> ip = new LinkedHashMap<>();
    private Map<String, List<String>> domain = new LinkedHashMap<>();
    private Map<String, List<String>> hash = new LinkedHashMap<>();
    private Map<String, List<String>> url = new LinkedHashMap<>();

    public Map<String, List<String>> getIp() {
        return ip;
    }

    public void setIp(Map<String, List<String>> ip) {
        this.ip = ip != null ? ip : new LinkedHashMap<>();
    }

    public Map<String, List<String>> getDomain() {
        return domain;
    }

    public void setDomain(Map<String, List<String>> domain) {
        this.domain = domain != null ? domain : new LinkedHashMap<>();
    }

    public Map<String, List<String>> getHash() {
        return hash;
    }

    public void setHash(Map<String, List<String>> hash) {
        this.hash = hash != null ? hash : new LinkedHashMap<>();
    }

    public Map<String, List<String>> getUrl() {
        return url;
    }

    public void setUrl(Map<String, List<String>> url) {
        this.url = url != null ? url : new LinkedHashMap<>();
    }

    /**
     * Load feeds from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static ThreatIntelFeeds fromClasspath(String resource) {
        return YamlSupport.readClasspath(resource, is -> {
            ThreatIntelFeeds feeds = YamlSupport.parse(is, ThreatIntelFeeds.class);
            return feeds != null ? feeds : new ThreatIntelFeeds();
        });
    }
}
