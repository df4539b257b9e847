package com.titiplex.mist.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.mist.core.crypto.NodeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class ConfigService {
    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path cfgPath;

    public ConfigService(@Value("${app.data.dir}") String dataDir) {
        this.cfgPath = Paths.get(dataDir).resolve("config.json");
    }

    public void saveProfile(NodeState ns) {
        try {
            Map<String, Object> profile = new HashMap<>();
            profile.put("displayName", ns.displayName);
            profile.put("signalingPort", ns.signalingPort);
            profile.put("transportPort", ns.transportPort);
            profile.put("seeds", ns.seeds);

            Map<String, Object> root = new HashMap<>();
            root.put("profile", profile);

            Files.createDirectories(cfgPath.getParent());
            Files.writeString(cfgPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + cfgPath, e);
        }
    }

    @SuppressWarnings("unchecked")
    public boolean tryRestore(NodeState ns) {
        if (!Files.exists(cfgPath)) return false;
        try {
            Map<String, Object> root = mapper.readValue(Files.readAllBytes(cfgPath), Map.class);
            Object p = root.get("profile");
            if (!(p instanceof Map)) return false;
            Map<String, Object> profile = (Map<String, Object>) p;

            if (ns.displayName == null || ns.displayName.isBlank())
                ns.displayName = (String) profile.get("displayName");
            if (ns.signalingPort == 0 && profile.get("signalingPort") instanceof Number n)
                ns.signalingPort = n.intValue();
            if (ns.transportPort == 0 && profile.get("transportPort") instanceof Number n)
                ns.transportPort = n.intValue();
            if (ns.seeds == null || ns.seeds.isEmpty()) {
                List<String> seeds = (List<String>) profile.get("seeds");
                ns.seeds = (seeds != null) ? new ArrayList<>(seeds) : new ArrayList<>();
            }
            log.debug("Profile restored: name={}, seeds={}", ns.displayName, ns.seeds.size());
            return true;
        } catch (IOException | ClassCastException e) {
            log.warn("Profile in {} unreadable: {}", cfgPath, e.getMessage());
            return false;
        }
    }

    public void clear() {
        try {
            Files.deleteIfExists(cfgPath);
        } catch (IOException e) {
            log.warn("Cannot delete {}: {}", cfgPath, e.getMessage());
        }
    }
}
