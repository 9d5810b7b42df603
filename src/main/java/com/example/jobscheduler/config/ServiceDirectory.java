package com.example.jobscheduler.config;

import com.example.jobscheduler.service.UnknownServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.*;

/**
 * 服务名 -> base URL 的显式映射（来自 scheduler.services）。
 * 启动时校验每个 URL，引用未配置的服务立即失败，不做默认回退。
 */
@Slf4j
@Component
public class ServiceDirectory {

    private final Map<String, String> mapping;

    public ServiceDirectory(SchedulerProperties props) {
        Map<String, String> m = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : props.getServices().entrySet()) {
            String name = e.getKey() == null ? "" : e.getKey().trim();
            String url = e.getValue() == null ? "" : e.getValue().trim();
            if (name.isEmpty() || url.isEmpty()) {
                throw new IllegalStateException("scheduler.services entry must have a name and a URL: " + e);
            }
            m.put(name, normalizeBaseUrl(name, url));
        }
        this.mapping = Collections.unmodifiableMap(m);
        log.info("Service directory loaded: {}", mapping);
    }

    public boolean contains(String service) {
        return service != null && mapping.containsKey(service);
    }

    public String baseUrl(String service) {
        String url = service == null ? null : mapping.get(service);
        if (url == null) throw new UnknownServiceException(service);
        return url;
    }

    /**
     * baseUrl + endpoint，endpoint 必须以 / 开头。
     */
    public String resolve(String service, String endpoint) {
        String base = baseUrl(service);
        String path = endpoint == null ? "" : endpoint.trim();
        if (!path.isEmpty() && !path.startsWith("/")) path = "/" + path;
        return base + path;
    }

    public Set<String> serviceNames() {
        return mapping.keySet();
    }

    private static String normalizeBaseUrl(String name, String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid base URL for service " + name + ": " + url, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalStateException("Base URL for service " + name + " must be absolute: " + url);
        }
        String s = url;
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }
}
