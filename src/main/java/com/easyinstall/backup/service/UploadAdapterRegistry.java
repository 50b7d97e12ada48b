package com.easyinstall.backup.service;

import com.easyinstall.backup.client.UploadAdapter;
import com.easyinstall.backup.model.ProviderTag;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class UploadAdapterRegistry {

    private final List<UploadAdapter> adapters;
    private Map<ProviderTag, UploadAdapter> adapterMap;

    public UploadAdapterRegistry(List<UploadAdapter> adapters) {
        this.adapters = adapters;
    }

    @PostConstruct
    public void init() {
        adapterMap = new EnumMap<>(ProviderTag.class);
        adapters.forEach(adapter -> {
            UploadAdapter previous = adapterMap.put(adapter.provider(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two upload adapters registered for " + adapter.provider());
            }
        });
        log.info("Upload adapters registered: {}", adapterMap.keySet());
    }

    public Optional<UploadAdapter> resolve(String provider) {
        return ProviderTag.fromTag(provider).map(adapterMap::get);
    }
}
